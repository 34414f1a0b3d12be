/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.observation;

import java.util.Locale;
import java.util.Objects;

/**
 * 一次成功探测的观测记录。
 *
 * <p>所有时间值均为秒：
 *
 * <ul>
 *   <li>{@code sendTimestamp} - 本地发出探测的时间
 *   <li>{@code remoteTimestamp} - 对端返回的时钟读数
 *   <li>{@code receiveTimestamp} - 本地收到响应的时间
 *   <li>{@code latency = receiveTimestamp - sendTimestamp}
 *   <li>{@code clockOffset = receiveTimestamp - remoteTimestamp}
 * </ul>
 */
public final class ProbeObservation {

  private final String peerId;
  private final double sendTimestamp;
  private final double remoteTimestamp;
  private final double receiveTimestamp;
  private final double latency;
  private final double avgLatency;
  private final double clockOffset;
  private final double avgClockOffset;
  private final int sampleCount;

  private ProbeObservation(Builder builder) {
    this.peerId = Objects.requireNonNull(builder.peerId, "peerId");
    this.sendTimestamp = builder.sendTimestamp;
    this.remoteTimestamp = builder.remoteTimestamp;
    this.receiveTimestamp = builder.receiveTimestamp;
    this.latency = builder.latency;
    this.avgLatency = builder.avgLatency;
    this.clockOffset = builder.clockOffset;
    this.avgClockOffset = builder.avgClockOffset;
    this.sampleCount = builder.sampleCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getPeerId() {
    return peerId;
  }

  public double getSendTimestamp() {
    return sendTimestamp;
  }

  public double getRemoteTimestamp() {
    return remoteTimestamp;
  }

  public double getReceiveTimestamp() {
    return receiveTimestamp;
  }

  public double getLatency() {
    return latency;
  }

  public double getAvgLatency() {
    return avgLatency;
  }

  public double getClockOffset() {
    return clockOffset;
  }

  public double getAvgClockOffset() {
    return avgClockOffset;
  }

  public int getSampleCount() {
    return sampleCount;
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "Peer %s - PingTx: %.6f; PeerClock: %.6f; PongRx: %.6f; Latency: %.6f; AvgLatency: %.6f;"
            + " ClockOffset: %.6f; AvgClockOffset: %.6f; Samples: %d",
        peerId,
        sendTimestamp,
        remoteTimestamp,
        receiveTimestamp,
        latency,
        avgLatency,
        clockOffset,
        avgClockOffset,
        sampleCount);
  }

  /** 构建器 */
  public static final class Builder {
    private String peerId;
    private double sendTimestamp;
    private double remoteTimestamp;
    private double receiveTimestamp;
    private double latency;
    private double avgLatency;
    private double clockOffset;
    private double avgClockOffset;
    private int sampleCount;

    private Builder() {}

    public Builder peerId(String peerId) {
      this.peerId = peerId;
      return this;
    }

    public Builder sendTimestamp(double sendTimestamp) {
      this.sendTimestamp = sendTimestamp;
      return this;
    }

    public Builder remoteTimestamp(double remoteTimestamp) {
      this.remoteTimestamp = remoteTimestamp;
      return this;
    }

    public Builder receiveTimestamp(double receiveTimestamp) {
      this.receiveTimestamp = receiveTimestamp;
      return this;
    }

    public Builder latency(double latency) {
      this.latency = latency;
      return this;
    }

    public Builder avgLatency(double avgLatency) {
      this.avgLatency = avgLatency;
      return this;
    }

    public Builder clockOffset(double clockOffset) {
      this.clockOffset = clockOffset;
      return this;
    }

    public Builder avgClockOffset(double avgClockOffset) {
      this.avgClockOffset = avgClockOffset;
      return this;
    }

    public Builder sampleCount(int sampleCount) {
      this.sampleCount = sampleCount;
      return this;
    }

    public ProbeObservation build() {
      return new ProbeObservation(this);
    }
  }
}
