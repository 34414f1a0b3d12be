/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.observation;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.extension.latencymonitor.probe.ProbeResult;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 把观测记录写入 OpenTelemetry 指标。
 *
 * <ul>
 *   <li>{@code latency.monitor.probe.latency} - 往返延迟直方图（秒）
 *   <li>{@code latency.monitor.clock.offset} - 各对端最近的平均时钟偏移（秒）
 *   <li>{@code latency.monitor.probe.failures} - 探测失败次数
 * </ul>
 *
 * <p>所有指标都带 {@code peer.id} 属性。对端离开后时钟偏移 gauge 不再报告该对端。
 */
public final class MetricsObservationSink implements ObservationSink {

  public static final String INSTRUMENTATION_SCOPE =
      "io.opentelemetry.sdk.extension.latencymonitor";

  static final AttributeKey<String> PEER_ID = AttributeKey.stringKey("peer.id");

  private final DoubleHistogram latencyHistogram;
  private final Map<String, Double> latestAvgClockOffsets = new ConcurrentHashMap<>();
  private final LongCounter failureCounter;

  /**
   * 创建指标接收端
   *
   * @param meter 指标 Meter
   */
  public MetricsObservationSink(Meter meter) {
    this.latencyHistogram =
        meter
            .histogramBuilder("latency.monitor.probe.latency")
            .setDescription("Round-trip latency of a peer probe")
            .setUnit("s")
            .build();
    meter
        .gaugeBuilder("latency.monitor.clock.offset")
        .setDescription("Average difference between local receive time and the peer clock reading")
        .setUnit("s")
        .buildWithCallback(
            measurement ->
                latestAvgClockOffsets.forEach(
                    (peerId, offset) ->
                        measurement.record(offset, Attributes.of(PEER_ID, peerId))));
    this.failureCounter =
        meter
            .counterBuilder("latency.monitor.probe.failures")
            .setDescription("Number of failed peer probes")
            .setUnit("{failure}")
            .build();
  }

  /**
   * 从 OpenTelemetry 实例创建
   *
   * @param openTelemetry OpenTelemetry 实例
   * @return 指标接收端
   */
  public static MetricsObservationSink create(OpenTelemetry openTelemetry) {
    return new MetricsObservationSink(openTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  @Override
  public void onObservation(ProbeObservation observation) {
    Attributes attributes = Attributes.of(PEER_ID, observation.getPeerId());
    latencyHistogram.record(observation.getLatency(), attributes);
    latestAvgClockOffsets.put(observation.getPeerId(), observation.getAvgClockOffset());
  }

  @Override
  public void onProbeFailed(String peerId, ProbeResult result) {
    failureCounter.add(1, Attributes.of(PEER_ID, peerId));
  }

  @Override
  public void onPeerRemoved(String peerId) {
    latestAvgClockOffsets.remove(peerId);
  }
}
