/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import io.opentelemetry.sdk.extension.latencymonitor.observation.ObservationSink;
import io.opentelemetry.sdk.extension.latencymonitor.observation.ProbeObservation;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerHandle;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerResolver;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerTransport;
import io.opentelemetry.sdk.extension.latencymonitor.probe.ProbeResult;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerEntry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerRegistry;
import io.opentelemetry.sdk.extension.latencymonitor.registry.PeerStatistics;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 轮询探测调度器。
 *
 * <p>每次 {@link #tick()} 只探测游标指向的一个对端，然后把游标移到下一个条目：
 *
 * <ol>
 *   <li>游标为空且注册表非空：游标指向链表头，开始新一轮并重新计算探测间隔
 *   <li>游标仍为空：本次跳过
 *   <li>对端已不在线：游标前进，不更新统计
 *   <li>探测失败：通知接收端，游标前进，不更新统计
 *   <li>探测成功：计算延迟与时钟偏移，更新滑动平均，输出观测记录，游标前进
 * </ol>
 *
 * <p>游标只由探测循环线程修改。游标所指条目被并发注销时，按 {@link PeerRegistry#successorOf(PeerEntry)}
 * 的规则前进。本类不做任何等待，等待由 {@code LatencyMonitor} 负责。
 */
public final class ProbeScheduler {

  private static final Logger logger = Logger.getLogger(ProbeScheduler.class.getName());

  /** 调度器状态 */
  public enum SchedulerState {
    /** 游标为空：注册表为空，或等待开始新一轮 */
    IDLE,
    /** 游标指向待探测的条目 */
    PROBING
  }

  /** 单次 tick 的结果 */
  public enum TickOutcome {
    /** 没有可探测的对端 */
    IDLE,
    /** 对端已断开，跳过 */
    SKIPPED_STALE,
    /** 探测失败 */
    FAILED,
    /** 探测成功并已更新统计 */
    PROBED
  }

  private final PeerRegistry registry;
  private final IntervalController intervalController;
  private final PeerResolver peerResolver;
  private final PeerTransport transport;
  private final MonitorClock clock;
  private final MonitorStatistics statistics;
  private final List<ObservationSink> sinks = new CopyOnWriteArrayList<>();

  @Nullable private volatile PeerEntry cursor;

  /**
   * 创建调度器
   *
   * @param registry 对端注册表
   * @param intervalController 间隔控制器
   * @param peerResolver 在线对端查找
   * @param transport 探测传输
   * @param clock 时钟
   * @param statistics 运行计数
   */
  public ProbeScheduler(
      PeerRegistry registry,
      IntervalController intervalController,
      PeerResolver peerResolver,
      PeerTransport transport,
      MonitorClock clock,
      MonitorStatistics statistics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.intervalController = Objects.requireNonNull(intervalController, "intervalController");
    this.peerResolver = Objects.requireNonNull(peerResolver, "peerResolver");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
  }

  /**
   * 执行一次探测
   *
   * @return 本次结果
   */
  public TickOutcome tick() {
    PeerEntry entry = cursor;
    if (entry != null && !registry.isRegistered(entry)) {
      // 游标所在条目已注销（可能已用新条目重新注册），移到仍在注册表中的后继
      logger.log(Level.FINE, "Peer {0} left while queued for probing", entry.getId());
      entry = registry.successorOf(entry);
      cursor = entry;
    }
    if (entry == null) {
      entry = registry.first();
      if (entry != null) {
        cursor = entry;
        double interval = intervalController.recompute(registry.size());
        long cycle = statistics.recordCycleStarted();
        logger.log(
            Level.FINE,
            "Starting probe cycle {0}, interval: {1}s",
            new Object[] {cycle, interval});
      }
    }

    if (entry == null) {
      return TickOutcome.IDLE;
    }

    // 对端可能已断开而注销通知还没到
    PeerHandle peer = peerResolver.resolveLivePeer(entry.getId());
    if (peer == null) {
      statistics.recordStalePeerSkipped();
      logger.log(Level.FINE, "Peer {0} is no longer live, skipping", entry.getId());
      advance(entry);
      return TickOutcome.SKIPPED_STALE;
    }

    double sendTimestamp = clock.nowSeconds();
    ProbeResult result = invokeTransport(peer);

    if (!result.isSuccess()) {
      statistics.recordProbeFailed();
      logger.log(
          Level.WARNING,
          "Failed to probe peer {0}. ERROR: {1}",
          new Object[] {entry.getId(), result.getErrorMessage()});
      notifyFailure(entry.getId(), result);
      advance(entry);
      return TickOutcome.FAILED;
    }

    double receiveTimestamp = clock.nowSeconds();
    double remoteTimestamp = result.getRemoteTimestamp();
    double latency = receiveTimestamp - sendTimestamp;
    double clockOffset = receiveTimestamp - remoteTimestamp;

    PeerStatistics updated = RunningAverageStatistics.update(entry, latency, clockOffset);
    statistics.recordProbeSucceeded();

    ProbeObservation observation =
        ProbeObservation.builder()
            .peerId(entry.getId())
            .sendTimestamp(sendTimestamp)
            .remoteTimestamp(remoteTimestamp)
            .receiveTimestamp(receiveTimestamp)
            .latency(latency)
            .avgLatency(updated.getAvgLatency())
            .clockOffset(clockOffset)
            .avgClockOffset(updated.getAvgClockOffset())
            .sampleCount(updated.getSampleCount())
            .build();
    notifyObservation(observation);

    advance(entry);
    return TickOutcome.PROBED;
  }

  public SchedulerState getState() {
    return cursor == null ? SchedulerState.IDLE : SchedulerState.PROBING;
  }

  /**
   * 游标当前指向的对端
   *
   * @return 对端 ID，游标为空时返回 null
   */
  @Nullable
  public String getCursorPeerId() {
    PeerEntry current = cursor;
    return current != null ? current.getId() : null;
  }

  /**
   * 添加观测接收端
   *
   * @param sink 接收端
   */
  public void addSink(ObservationSink sink) {
    if (sink != null) {
      sinks.add(sink);
    }
  }

  /**
   * 移除观测接收端
   *
   * @param sink 接收端
   */
  public void removeSink(ObservationSink sink) {
    sinks.remove(sink);
  }

  /**
   * 通知所有接收端对端已离开
   *
   * @param peerId 对端 ID
   */
  public void notifyPeerRemoved(String peerId) {
    for (ObservationSink sink : sinks) {
      try {
        sink.onPeerRemoved(peerId);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Error notifying observation sink: {0}", e.getMessage());
      }
    }
  }

  private void advance(PeerEntry from) {
    // 到达链表末尾后游标为空，下一次 tick 开始新一轮
    cursor = registry.successorOf(from);
  }

  private ProbeResult invokeTransport(PeerHandle peer) {
    try {
      ProbeResult result = transport.probe(peer);
      if (result == null) {
        return ProbeResult.failure("transport returned no result");
      }
      return result;
    } catch (RuntimeException e) {
      return ProbeResult.failure(e);
    }
  }

  private void notifyObservation(ProbeObservation observation) {
    for (ObservationSink sink : sinks) {
      try {
        sink.onObservation(observation);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Error notifying observation sink: {0}", e.getMessage());
      }
    }
  }

  private void notifyFailure(String peerId, ProbeResult result) {
    for (ObservationSink sink : sinks) {
      try {
        sink.onProbeFailed(peerId, result);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Error notifying observation sink: {0}", e.getMessage());
      }
    }
  }
}
