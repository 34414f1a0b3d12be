/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor;

import io.opentelemetry.sdk.extension.latencymonitor.config.LatencyMonitorConfig;
import io.opentelemetry.sdk.extension.latencymonitor.core.IntervalController;
import io.opentelemetry.sdk.extension.latencymonitor.core.MonitorClock;
import io.opentelemetry.sdk.extension.latencymonitor.core.MonitorStatistics;
import io.opentelemetry.sdk.extension.latencymonitor.core.ProbeScheduler;
import io.opentelemetry.sdk.extension.latencymonitor.observation.LoggingObservationSink;
import io.opentelemetry.sdk.extension.latencymonitor.observation.ObservationSink;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerLifecycleListener;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerResolver;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerTransport;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerEntry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerRegistry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerStatistics;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Peer latency monitor.
 *
 * <p>Owns the peer registry, the interval controller and the probe scheduler, and runs the probe
 * loop on a single daemon thread:
 *
 * <ul>
 *   <li>Peer join and leave events update the registry and recompute the probe interval
 *   <li>Each tick waits for the current probe interval, then probes one peer
 *   <li>At most one probe is in flight at any time
 * </ul>
 *
 * <p>If the probe loop hits an unexpected error it terminates and the state becomes {@link
 * MonitorState#FAILED}. A monitor runs at most once: after {@link #stop()} or a failure, build a
 * new one.
 */
public final class LatencyMonitor implements PeerLifecycleListener, Closeable {

  private static final Logger logger = Logger.getLogger(LatencyMonitor.class.getName());

  /** Monitor lifecycle state. */
  public enum MonitorState {
    /** Created, not started yet. */
    NEW,
    /** Probe loop running. */
    RUNNING,
    /** Stopped by {@link #stop()} or {@link #close()}. */
    STOPPED,
    /** Probe loop terminated by an unexpected error. */
    FAILED
  }

  private final LatencyMonitorConfig config;
  private final IntervalController intervalController;
  private final PeerRegistry registry;
  private final MonitorStatistics monitorStatistics;
  private final ProbeScheduler probeScheduler;
  private final ScheduledExecutorService executor;
  private final AtomicReference<MonitorState> state;

  @Nullable private volatile ScheduledFuture<?> nextTick;

  private LatencyMonitor(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    this.intervalController = new IntervalController(config.getCycleDuration());
    this.registry = new PeerRegistry(intervalController::recompute);
    this.monitorStatistics = new MonitorStatistics(config.getStatusLogInterval().toMillis());
    this.probeScheduler =
        new ProbeScheduler(
            registry,
            intervalController,
            Objects.requireNonNull(builder.peerResolver, "peerResolver is required"),
            Objects.requireNonNull(builder.transport, "transport is required"),
            builder.clock,
            monitorStatistics);

    if (config.isLogObservations()) {
      probeScheduler.addSink(new LoggingObservationSink());
    }
    for (ObservationSink sink : builder.sinks) {
      probeScheduler.addSink(sink);
    }

    String threadName = config.getThreadName();
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, threadName);
              t.setDaemon(true);
              return t;
            });
    this.state = new AtomicReference<>(MonitorState.NEW);
  }

  /**
   * Creates a new builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Starts the probe loop. The first probe runs after one probe interval. */
  public void start() {
    if (!config.isEnabled()) {
      logger.log(Level.INFO, "Latency monitor is disabled");
      return;
    }

    if (!state.compareAndSet(MonitorState.NEW, MonitorState.RUNNING)) {
      logger.log(Level.WARNING, "Latency monitor cannot start, state: {0}", state.get());
      return;
    }

    logger.log(
        Level.INFO,
        "Starting latency monitor, cycleDuration: {0}ms, peers: {1}",
        new Object[] {config.getCycleDuration().toMillis(), registry.size()});
    scheduleNextTick();
  }

  /**
   * Stops the probe loop and shuts down its thread. A probe in flight is allowed to complete. Use
   * {@link #close()} to also wait for it.
   */
  public void stop() {
    MonitorState previous = state.get();
    boolean stopped =
        (previous == MonitorState.NEW || previous == MonitorState.RUNNING)
            && state.compareAndSet(previous, MonitorState.STOPPED);

    ScheduledFuture<?> pending = nextTick;
    if (pending != null) {
      pending.cancel(false);
    }
    executor.shutdown();

    if (!stopped) {
      return;
    }
    logger.log(
        Level.INFO,
        "Latency monitor stopped - {0}",
        monitorStatistics.buildSummary(
            registry.size(), intervalController.getCurrentIntervalSeconds()));
  }

  /** Stops the probe loop and waits up to the configured shutdown timeout for it to finish. */
  @Override
  public void close() {
    stop();

    try {
      if (!executor.awaitTermination(
          config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  @Override
  public void onPeerJoined(String peerId) {
    registry.register(peerId);
  }

  @Override
  public void onPeerLeft(String peerId) {
    registry.unregister(peerId);
    probeScheduler.notifyPeerRemoved(peerId);
  }

  public MonitorState getState() {
    MonitorState current = state.get();
    return current != null ? current : MonitorState.NEW;
  }

  public boolean isRunning() {
    return getState() == MonitorState.RUNNING;
  }

  boolean isExecutorShutdown() {
    return executor.isShutdown();
  }

  /**
   * Returns the statistics of a peer.
   *
   * @param peerId the peer id
   * @return a snapshot, or null if the peer is not registered
   */
  @Nullable
  public PeerStatistics getStatistics(String peerId) {
    PeerEntry entry = registry.lookup(peerId);
    return entry != null ? entry.snapshot() : null;
  }

  /**
   * Returns the statistics of all peers in registration order.
   *
   * @return the snapshots
   */
  public List<PeerStatistics> getAllStatistics() {
    List<PeerEntry> entries = registry.entries();
    List<PeerStatistics> result = new ArrayList<>(entries.size());
    for (PeerEntry entry : entries) {
      result.add(entry.snapshot());
    }
    return Collections.unmodifiableList(result);
  }

  public double getCurrentIntervalSeconds() {
    return intervalController.getCurrentIntervalSeconds();
  }

  public LatencyMonitorConfig getConfig() {
    return config;
  }

  public PeerRegistry getRegistry() {
    return registry;
  }

  public ProbeScheduler getProbeScheduler() {
    return probeScheduler;
  }

  public MonitorStatistics getMonitorStatistics() {
    return monitorStatistics;
  }

  private void scheduleNextTick() {
    if (state.get() != MonitorState.RUNNING) {
      return;
    }
    long delayNanos = intervalController.getCurrentInterval().toNanos();
    try {
      nextTick = executor.schedule(this::runTick, delayNanos, TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Probe tick rejected, executor is shut down");
    }
  }

  private void runTick() {
    if (state.get() != MonitorState.RUNNING) {
      return;
    }

    try {
      probeScheduler.tick();
    } catch (RuntimeException e) {
      if (state.compareAndSet(MonitorState.RUNNING, MonitorState.FAILED)) {
        logger.log(Level.SEVERE, "Latency monitor probe loop failed, probing stopped", e);
      }
      return;
    }

    monitorStatistics.logPeriodicStatus(
        registry.size(), intervalController.getCurrentIntervalSeconds());
    scheduleNextTick();
  }

  /** Builder for {@link LatencyMonitor}. */
  public static final class Builder {
    private LatencyMonitorConfig config = LatencyMonitorConfig.builder().build();
    @Nullable private PeerTransport transport;
    @Nullable private PeerResolver peerResolver;
    private MonitorClock clock = MonitorClock.system();
    private final List<ObservationSink> sinks = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the configuration.
     *
     * @param config the latency monitor configuration
     * @return this builder
     */
    public Builder setConfig(LatencyMonitorConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    /**
     * Sets the probe transport.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder setTransport(PeerTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Sets the live peer resolver.
     *
     * @param peerResolver the resolver
     * @return this builder
     */
    public Builder setPeerResolver(PeerResolver peerResolver) {
      this.peerResolver = Objects.requireNonNull(peerResolver, "peerResolver");
      return this;
    }

    public Builder setClock(MonitorClock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Adds an observation sink.
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder addObservationSink(ObservationSink sink) {
      sinks.add(Objects.requireNonNull(sink, "sink"));
      return this;
    }

    /**
     * Builds the latency monitor.
     *
     * @return the latency monitor
     */
    public LatencyMonitor build() {
      if (transport == null) {
        throw new IllegalStateException("transport is required");
      }
      if (peerResolver == null) {
        throw new IllegalStateException("peerResolver is required");
      }
      return new LatencyMonitor(this);
    }
  }
}
