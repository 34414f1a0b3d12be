/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe.inprocess;

import io.opentelemetry.sdk.extension.latencymonitor.core.MonitorClock;

/**
 * 对端侧的探测应答：返回对端自己的时钟读数。
 */
@FunctionalInterface
public interface ClockResponder {

  /**
   * 应答一次探测
   *
   * @return 对端时钟读数（epoch 秒）
   * @throws Exception 应答失败
   */
  double respond() throws Exception;

  /**
   * 使用给定时钟应答
   *
   * @param clock 对端时钟
   * @return 应答器
   */
  static ClockResponder fromClock(MonitorClock clock) {
    return clock::nowSeconds;
  }

  /**
   * 使用带固定偏差的时钟应答
   *
   * @param clock 基准时钟
   * @param skewSeconds 对端时钟相对基准的偏差（秒）
   * @return 应答器
   */
  static ClockResponder skewed(MonitorClock clock, double skewSeconds) {
    return () -> clock.nowSeconds() + skewSeconds;
  }
}
