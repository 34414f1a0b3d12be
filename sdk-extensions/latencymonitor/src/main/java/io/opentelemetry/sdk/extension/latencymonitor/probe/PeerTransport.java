/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

/**
 * 探测传输。
 *
 * <p>向对端发起一次往返调用并取回对端的时钟读数。监控同一时刻最多只会有一个探测在进行中。
 * 失败应通过 {@link ProbeResult#failure(String)} 返回，而不是抛出异常。
 */
@FunctionalInterface
public interface PeerTransport {

  /**
   * 探测对端
   *
   * @param peer 在线对端
   * @return 成功时携带对端时钟读数（epoch 秒），失败时携带错误信息
   */
  ProbeResult probe(PeerHandle peer);
}
