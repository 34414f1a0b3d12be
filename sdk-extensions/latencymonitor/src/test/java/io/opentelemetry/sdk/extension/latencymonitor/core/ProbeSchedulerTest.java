/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.opentelemetry.sdk.extension.latencymonitor.core.ProbeScheduler.SchedulerState;
import io.opentelemetry.sdk.extension.latencymonitor.core.ProbeScheduler.TickOutcome;
import io.opentelemetry.sdk.extension.latencymonitor.observation.ObservationSink;
import io.opentelemetry.sdk.extension.latencymonitor.observation.ProbeObservation;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerHandle;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerResolver;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerTransport;
import io.opentelemetry.sdk.extension.latencymonitor.probe.ProbeResult;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerEntry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerRegistry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerStatistics;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProbeSchedulerTest {

  private final Deque<Double> timestamps = new ArrayDeque<>();
  private final List<ProbeObservation> observations = new ArrayList<>();
  private final List<String> failedPeers = new ArrayList<>();

  private PeerRegistry registry;
  private IntervalController intervalController;
  private PeerResolver resolver;
  private PeerTransport transport;
  private MonitorStatistics statistics;
  private ProbeScheduler scheduler;

  @BeforeEach
  void setUp() {
    registry = new PeerRegistry();
    intervalController = new IntervalController(Duration.ofMillis(1000));
    resolver = mock(PeerResolver.class);
    transport = mock(PeerTransport.class);
    statistics = new MonitorStatistics();
    MonitorClock clock = () -> timestamps.isEmpty() ? 0.0 : timestamps.poll();

    when(resolver.resolveLivePeer(anyString()))
        .thenAnswer(invocation -> handle(invocation.getArgument(0)));

    scheduler =
        new ProbeScheduler(registry, intervalController, resolver, transport, clock, statistics);
    scheduler.addSink(
        new ObservationSink() {
          @Override
          public void onObservation(ProbeObservation observation) {
            observations.add(observation);
          }

          @Override
          public void onProbeFailed(String peerId, ProbeResult result) {
            failedPeers.add(peerId);
          }
        });
  }

  private static PeerHandle handle(String peerId) {
    return () -> peerId;
  }

  @Test
  void idleWhenRegistryEmpty() {
    assertThat(scheduler.tick()).isEqualTo(TickOutcome.IDLE);
    assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
    assertThat(scheduler.getCursorPeerId()).isNull();
    assertThat(statistics.getCyclesStarted()).isZero();
    verifyNoInteractions(resolver, transport);
  }

  @Test
  void successfulProbeUpdatesStatistics() {
    registry.register("A");
    when(transport.probe(any())).thenReturn(ProbeResult.success(99.5));
    timestamps.add(100.0);
    timestamps.add(100.2);

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);

    PeerStatistics stats = registry.lookup("A").snapshot();
    assertThat(stats.getSampleCount()).isEqualTo(1);
    assertThat(stats.getAvgLatency()).isCloseTo(0.2, within(1e-9));
    assertThat(stats.getAvgClockOffset()).isCloseTo(0.7, within(1e-9));

    assertThat(observations).hasSize(1);
    ProbeObservation observation = observations.get(0);
    assertThat(observation.getPeerId()).isEqualTo("A");
    assertThat(observation.getSendTimestamp()).isEqualTo(100.0);
    assertThat(observation.getRemoteTimestamp()).isEqualTo(99.5);
    assertThat(observation.getReceiveTimestamp()).isEqualTo(100.2);
    assertThat(observation.getLatency()).isCloseTo(0.2, within(1e-9));
    assertThat(observation.getClockOffset()).isCloseTo(0.7, within(1e-9));
    assertThat(observation.getSampleCount()).isEqualTo(1);
    assertThat(statistics.getProbesSucceeded()).isEqualTo(1);
  }

  @Test
  void probesPeersRoundRobinInInsertionOrder() {
    registry.register("A");
    registry.register("B");
    registry.register("C");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));

    for (int i = 0; i < 7; i++) {
      scheduler.tick();
    }

    List<String> probed = new ArrayList<>();
    for (ProbeObservation observation : observations) {
      probed.add(observation.getPeerId());
    }
    assertThat(probed).containsExactly("A", "B", "C", "A", "B", "C", "A");
    assertThat(statistics.getCyclesStarted()).isEqualTo(3);
  }

  @Test
  void cursorEmptiesAtEndOfCycle() {
    registry.register("A");
    registry.register("B");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));

    scheduler.tick();
    assertThat(scheduler.getState()).isEqualTo(SchedulerState.PROBING);
    assertThat(scheduler.getCursorPeerId()).isEqualTo("B");

    scheduler.tick();
    assertThat(scheduler.getState()).isEqualTo(SchedulerState.IDLE);
    assertThat(scheduler.getCursorPeerId()).isNull();
  }

  @Test
  void newCycleRecomputesInterval() {
    registry.register("A");
    registry.register("B");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    assertThat(intervalController.getCurrentIntervalSeconds()).isEqualTo(1.0);

    scheduler.tick();
    assertThat(intervalController.getCurrentIntervalSeconds()).isEqualTo(0.5);

    registry.register("C");
    registry.register("D");
    scheduler.tick();
    scheduler.tick();
    scheduler.tick();
    assertThat(statistics.getCyclesStarted()).isEqualTo(1);

    scheduler.tick();
    assertThat(statistics.getCyclesStarted()).isEqualTo(2);
    assertThat(intervalController.getCurrentIntervalSeconds()).isEqualTo(0.25);
  }

  @Test
  void stalePeerSkippedWithoutProbe() {
    registry.register("A");
    registry.register("B");
    when(resolver.resolveLivePeer("A")).thenReturn(null);

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.SKIPPED_STALE);

    verify(transport, never()).probe(any());
    assertThat(registry.lookup("A").getSampleCount()).isZero();
    assertThat(scheduler.getCursorPeerId()).isEqualTo("B");
    assertThat(statistics.getStalePeersSkipped()).isEqualTo(1);
    assertThat(observations).isEmpty();
    assertThat(failedPeers).isEmpty();
  }

  @Test
  void failedProbeLeavesStatisticsAndAdvances() {
    registry.register("A");
    registry.register("B");
    registry.register("C");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    scheduler.tick();
    PeerStatistics before = registry.lookup("B").snapshot();

    when(transport.probe(any())).thenReturn(ProbeResult.failure("timed out"));
    assertThat(scheduler.tick()).isEqualTo(TickOutcome.FAILED);

    assertThat(registry.lookup("B").snapshot()).isEqualTo(before);
    assertThat(scheduler.getCursorPeerId()).isEqualTo("C");
    assertThat(failedPeers).containsExactly("B");
    assertThat(statistics.getProbesFailed()).isEqualTo(1);
  }

  @Test
  void transportExceptionTreatedAsFailure() {
    registry.register("A");
    when(transport.probe(any())).thenThrow(new IllegalStateException("connection reset"));
    List<ProbeResult> results = new ArrayList<>();
    scheduler.addSink(
        new ObservationSink() {
          @Override
          public void onObservation(ProbeObservation observation) {}

          @Override
          public void onProbeFailed(String peerId, ProbeResult result) {
            results.add(result);
          }
        });

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.FAILED);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).isSuccess()).isFalse();
    assertThat(results.get(0).getErrorMessage()).isEqualTo("connection reset");
    assertThat(results.get(0).getCause()).isInstanceOf(IllegalStateException.class);
    assertThat(registry.lookup("A").getSampleCount()).isZero();
  }

  @Test
  void nullTransportResultTreatedAsFailure() {
    registry.register("A");
    when(transport.probe(any())).thenReturn(null);

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.FAILED);
    assertThat(failedPeers).containsExactly("A");
  }

  @Test
  void resolverExceptionPropagates() {
    registry.register("A");
    when(resolver.resolveLivePeer("A")).thenThrow(new IllegalStateException("resolver down"));

    assertThatThrownBy(() -> scheduler.tick())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("resolver down");
  }

  @Test
  void failingSinkDoesNotAffectOtherSinks() {
    registry.register("A");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    scheduler.addSink(
        observation -> {
          throw new IllegalStateException("sink failure");
        });
    List<ProbeObservation> later = new ArrayList<>();
    scheduler.addSink(later::add);

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);

    assertThat(observations).hasSize(1);
    assertThat(later).hasSize(1);
    assertThat(registry.lookup("A").getSampleCount()).isEqualTo(1);
  }

  @Test
  void removedSinkNotNotified() {
    registry.register("A");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    List<ProbeObservation> received = new ArrayList<>();
    ObservationSink sink = received::add;
    scheduler.addSink(sink);
    scheduler.removeSink(sink);

    scheduler.tick();

    assertThat(received).isEmpty();
  }

  @Test
  void cursorOnRemovedPeerContinuesWithNextLivePeer() {
    registry.register("A");
    registry.register("B");
    registry.register("C");
    registry.register("D");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    scheduler.tick();
    assertThat(scheduler.getCursorPeerId()).isEqualTo("B");

    registry.unregister("B");
    registry.unregister("C");

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);
    assertThat(observations).extracting(ProbeObservation::getPeerId).containsExactly("A", "D");
    assertThat(statistics.getStalePeersSkipped()).isZero();
    verify(resolver, never()).resolveLivePeer("B");
  }

  @Test
  void cursorOnRemovedTailStartsNewCycle() {
    registry.register("A");
    registry.register("B");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    scheduler.tick();

    registry.unregister("B");

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);
    assertThat(observations).extracting(ProbeObservation::getPeerId).containsExactly("A", "A");
    assertThat(statistics.getCyclesStarted()).isEqualTo(2);
  }

  @Test
  void rejoinedPeerProbedThroughNewEntry() {
    PeerEntry a = registry.register("A");
    PeerEntry oldB = registry.register("B");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));
    scheduler.tick();
    scheduler.tick();
    scheduler.tick();
    assertThat(scheduler.getCursorPeerId()).isEqualTo("B");
    PeerStatistics oldStats = oldB.snapshot();

    registry.unregister("B");
    PeerEntry newB = registry.register("B");

    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);
    assertThat(scheduler.tick()).isEqualTo(TickOutcome.PROBED);

    assertThat(observations)
        .extracting(ProbeObservation::getPeerId)
        .containsExactly("A", "B", "A", "A", "B");
    assertThat(oldB.snapshot()).isEqualTo(oldStats);
    assertThat(a.getSampleCount()).isEqualTo(3);
    assertThat(newB.getSampleCount()).isEqualTo(1);
    assertThat(observations.get(4).getSampleCount()).isEqualTo(1);
  }

  @Test
  void peerRemovalReachesEverySink() {
    List<String> removed = new ArrayList<>();
    scheduler.addSink(
        new ObservationSink() {
          @Override
          public void onObservation(ProbeObservation observation) {}

          @Override
          public void onPeerRemoved(String peerId) {
            throw new IllegalStateException("sink failure");
          }
        });
    scheduler.addSink(
        new ObservationSink() {
          @Override
          public void onObservation(ProbeObservation observation) {}

          @Override
          public void onPeerRemoved(String peerId) {
            removed.add(peerId);
          }
        });

    scheduler.notifyPeerRemoved("A");

    assertThat(removed).containsExactly("A");
  }

  @Test
  void statisticsSaturateAcrossManyCycles() {
    registry.register("A");
    when(transport.probe(any())).thenReturn(ProbeResult.success(0));

    for (int i = 0; i < 12; i++) {
      scheduler.tick();
    }

    assertThat(registry.lookup("A").getSampleCount()).isEqualTo(5);
    assertThat(observations).hasSize(12);
    assertThat(observations.get(11).getSampleCount()).isEqualTo(5);
  }
}
