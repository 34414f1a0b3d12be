/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.registry;

import java.util.Locale;
import javax.annotation.Nullable;

/**
 * 单个对端的监控条目。
 *
 * <p>条目由 {@link PeerRegistry} 创建并持有；{@code prev}/{@code next} 只是注册表内部的位置链接，
 * 只在注册表锁内读写。统计字段只由探测循环写入，读写均在条目自身上同步。
 */
public final class PeerEntry {

  /** 参与滑动平均的最大样本数 */
  public static final int MAX_SAMPLE_COUNT = 5;

  private final String id;

  // 统计字段，guarded by this
  private int sampleCount;
  private double avgLatency;
  private double avgClockOffset;

  // 位置链接，guarded by PeerRegistry.lock
  @Nullable PeerEntry prev;
  @Nullable PeerEntry next;
  boolean detached;
  @Nullable PeerEntry successorAtRemoval;

  PeerEntry(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public synchronized int getSampleCount() {
    return sampleCount;
  }

  /** 平均往返延迟（秒） */
  public synchronized double getAvgLatency() {
    return avgLatency;
  }

  /** 平均时钟偏移（秒） */
  public synchronized double getAvgClockOffset() {
    return avgClockOffset;
  }

  /**
   * 覆盖统计值
   *
   * @param sampleCount 样本数，范围 [0, {@link #MAX_SAMPLE_COUNT}]
   * @param avgLatency 平均延迟（秒）
   * @param avgClockOffset 平均时钟偏移（秒）
   */
  public synchronized void setStatistics(int sampleCount, double avgLatency, double avgClockOffset) {
    if (sampleCount < 0 || sampleCount > MAX_SAMPLE_COUNT) {
      throw new IllegalArgumentException(
          "sampleCount must be within [0, " + MAX_SAMPLE_COUNT + "]: " + sampleCount);
    }
    this.sampleCount = sampleCount;
    this.avgLatency = avgLatency;
    this.avgClockOffset = avgClockOffset;
  }

  /**
   * 获取统计快照
   *
   * @return 不可变快照
   */
  public synchronized PeerStatistics snapshot() {
    return new PeerStatistics(id, sampleCount, avgLatency, avgClockOffset);
  }

  @Override
  public String toString() {
    PeerStatistics stats = snapshot();
    return String.format(
        Locale.ROOT,
        "PeerEntry{id=%s, samples=%d, avgLatency=%.6f, avgClockOffset=%.6f}",
        id,
        stats.getSampleCount(),
        stats.getAvgLatency(),
        stats.getAvgClockOffset());
  }
}
