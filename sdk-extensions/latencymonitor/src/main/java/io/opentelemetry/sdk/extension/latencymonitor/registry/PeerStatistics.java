/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.registry;

import java.util.Locale;
import java.util.Objects;

/** 对端统计快照（不可变） */
public final class PeerStatistics {

  private final String peerId;
  private final int sampleCount;
  private final double avgLatency;
  private final double avgClockOffset;

  public PeerStatistics(String peerId, int sampleCount, double avgLatency, double avgClockOffset) {
    this.peerId = Objects.requireNonNull(peerId, "peerId");
    this.sampleCount = sampleCount;
    this.avgLatency = avgLatency;
    this.avgClockOffset = avgClockOffset;
  }

  public String getPeerId() {
    return peerId;
  }

  public int getSampleCount() {
    return sampleCount;
  }

  public double getAvgLatency() {
    return avgLatency;
  }

  public double getAvgClockOffset() {
    return avgClockOffset;
  }

  /** 是否已有至少一个样本 */
  public boolean hasSamples() {
    return sampleCount > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PeerStatistics)) {
      return false;
    }
    PeerStatistics that = (PeerStatistics) o;
    return sampleCount == that.sampleCount
        && Double.compare(avgLatency, that.avgLatency) == 0
        && Double.compare(avgClockOffset, that.avgClockOffset) == 0
        && peerId.equals(that.peerId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(peerId, sampleCount, avgLatency, avgClockOffset);
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "PeerStatistics{peerId=%s, samples=%d, avgLatency=%.6f, avgClockOffset=%.6f}",
        peerId,
        sampleCount,
        avgLatency,
        avgClockOffset);
  }
}
