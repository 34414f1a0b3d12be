/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

/**
 * 对端生命周期监听器。
 *
 * <p>回调可能在任意线程上触发，与探测循环并发。
 */
public interface PeerLifecycleListener {

  /**
   * 对端加入
   *
   * @param peerId 对端 ID
   */
  void onPeerJoined(String peerId);

  /**
   * 对端离开
   *
   * @param peerId 对端 ID
   */
  void onPeerLeft(String peerId);
}
