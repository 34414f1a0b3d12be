/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MonitorStatisticsTest {

  @Test
  void countersStartAtZero() {
    MonitorStatistics statistics = new MonitorStatistics();

    assertThat(statistics.getCyclesStarted()).isZero();
    assertThat(statistics.getProbesSucceeded()).isZero();
    assertThat(statistics.getProbesFailed()).isZero();
    assertThat(statistics.getStalePeersSkipped()).isZero();
  }

  @Test
  void recordIncrementsCounters() {
    MonitorStatistics statistics = new MonitorStatistics();

    assertThat(statistics.recordCycleStarted()).isEqualTo(1);
    assertThat(statistics.recordCycleStarted()).isEqualTo(2);
    statistics.recordProbeSucceeded();
    statistics.recordProbeSucceeded();
    statistics.recordProbeSucceeded();
    statistics.recordProbeFailed();
    statistics.recordStalePeerSkipped();

    assertThat(statistics.getCyclesStarted()).isEqualTo(2);
    assertThat(statistics.getProbesSucceeded()).isEqualTo(3);
    assertThat(statistics.getProbesFailed()).isEqualTo(1);
    assertThat(statistics.getStalePeersSkipped()).isEqualTo(1);
  }

  @Test
  void buildSummary() {
    MonitorStatistics statistics = new MonitorStatistics();
    statistics.recordCycleStarted();
    statistics.recordProbeSucceeded();
    statistics.recordProbeFailed();

    assertThat(statistics.buildSummary(2, 0.5))
        .isEqualTo("peers=2, interval=0.500s, cycles=1, probes(ok/failed)=1/1, staleSkipped=0");
  }

  @Test
  void periodicStatusIsRateLimited() {
    MonitorStatistics statistics = new MonitorStatistics(60_000);

    assertThat(statistics.logPeriodicStatus(1, 1.0)).isTrue();
    assertThat(statistics.logPeriodicStatus(1, 1.0)).isFalse();
  }

  @Test
  void zeroIntervalLogsEveryTime() {
    MonitorStatistics statistics = new MonitorStatistics(0);

    assertThat(statistics.logPeriodicStatus(1, 1.0)).isTrue();
    assertThat(statistics.logPeriodicStatus(1, 1.0)).isTrue();
  }
}
