/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.observation;

import io.opentelemetry.sdk.extension.latencymonitor.probe.ProbeResult;

/**
 * 观测记录接收端。
 *
 * <p>回调在探测循环线程上执行，实现应尽快返回；抛出的异常会被记录并忽略。
 */
@FunctionalInterface
public interface ObservationSink {

  /**
   * 一次探测成功完成
   *
   * @param observation 观测记录
   */
  void onObservation(ProbeObservation observation);

  /**
   * 一次探测失败，统计未更新
   *
   * @param peerId 对端 ID
   * @param result 失败结果
   */
  default void onProbeFailed(String peerId, ProbeResult result) {}

  /**
   * 对端已离开，不会再有它的观测记录
   *
   * @param peerId 对端 ID
   */
  default void onPeerRemoved(String peerId) {}
}
