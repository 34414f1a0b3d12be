/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 探测间隔控制器。
 *
 * <p>整轮探测的总时长固定为 {@code totalCycle}，单个对端之间的探测间隔为 {@code totalCycle / 对端数}。
 * 对端数量翻倍时，每个对端的探测频率减半，总探测流量保持不变。没有对端时间隔回落到 1 秒。
 */
public final class IntervalController {

  private static final Logger logger = Logger.getLogger(IntervalController.class.getName());

  /** 无对端时的探测间隔（秒） */
  public static final double IDLE_INTERVAL_SECONDS = 1.0;

  private final Duration totalCycle;
  private volatile double currentIntervalSeconds = IDLE_INTERVAL_SECONDS;

  /**
   * 创建间隔控制器
   *
   * @param totalCycle 一整轮探测的总时长
   */
  public IntervalController(Duration totalCycle) {
    Objects.requireNonNull(totalCycle, "totalCycle");
    if (totalCycle.isZero() || totalCycle.isNegative()) {
      throw new IllegalArgumentException("totalCycle must be positive");
    }
    this.totalCycle = totalCycle;
  }

  /**
   * 根据当前活跃对端数重新计算探测间隔
   *
   * @param activeCount 活跃对端数
   * @return 新的探测间隔（秒）
   */
  public double recompute(int activeCount) {
    if (activeCount < 0) {
      throw new IllegalArgumentException("activeCount must not be negative: " + activeCount);
    }
    double interval;
    if (activeCount > 0) {
      interval = ((double) totalCycle.toMillis() / activeCount) / 1000;
    } else {
      interval = IDLE_INTERVAL_SECONDS;
    }
    double previous = currentIntervalSeconds;
    currentIntervalSeconds = interval;
    if (previous != interval) {
      logger.log(
          Level.FINE,
          "Probe interval changed: {0}s -> {1}s (active peers: {2})",
          new Object[] {previous, interval, activeCount});
    }
    return interval;
  }

  public double getCurrentIntervalSeconds() {
    return currentIntervalSeconds;
  }

  /** 当前探测间隔（纳秒精度） */
  public Duration getCurrentInterval() {
    return Duration.ofNanos(Math.round(currentIntervalSeconds * 1_000_000_000L));
  }

  public Duration getTotalCycle() {
    return totalCycle;
  }
}
