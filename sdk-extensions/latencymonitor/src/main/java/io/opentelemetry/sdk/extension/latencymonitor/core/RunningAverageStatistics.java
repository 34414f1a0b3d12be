/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerEntry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerStatistics;

/**
 * 滑动平均统计。
 *
 * <p>每次更新 {@code n = min(sampleCount + 1, 5)}，然后 {@code avg = avg - avg / n + sample / n}。
 * 样本数不超过 5 时即为算术平均；达到 5 之后每个新样本权重固定为 1/5。
 * 延迟与时钟偏移使用同一公式，互不影响。
 */
public final class RunningAverageStatistics {

  public static final int MAX_SAMPLES = PeerEntry.MAX_SAMPLE_COUNT;

  private RunningAverageStatistics() {}

  /**
   * 用一次探测结果更新条目统计
   *
   * @param entry 对端条目
   * @param latencySample 往返延迟（秒）
   * @param offsetSample 时钟偏移（秒）
   * @return 更新后的快照
   */
  public static PeerStatistics update(PeerEntry entry, double latencySample, double offsetSample) {
    synchronized (entry) {
      int n = Math.min(entry.getSampleCount() + 1, MAX_SAMPLES);
      double avgLatency = nextAverage(entry.getAvgLatency(), latencySample, n);
      double avgClockOffset = nextAverage(entry.getAvgClockOffset(), offsetSample, n);
      entry.setStatistics(n, avgLatency, avgClockOffset);
      return entry.snapshot();
    }
  }

  /**
   * 计算下一次平均值
   *
   * @param avg 当前平均值
   * @param sample 新样本
   * @param n 更新后的样本数（大于 0）
   * @return 新平均值
   */
  public static double nextAverage(double avg, double sample, int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("n must be positive: " + n);
    }
    return avg - (avg / n) + (sample / n);
  }
}
