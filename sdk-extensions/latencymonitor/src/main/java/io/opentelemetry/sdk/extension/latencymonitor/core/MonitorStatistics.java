/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 延迟监控运行计数。
 *
 * <p>负责统计探测循环的运行情况，并周期性输出状态日志：
 *
 * <ul>
 *   <li>已开始的轮次
 *   <li>探测成功 / 失败次数
 *   <li>因对端已断开而跳过的次数
 * </ul>
 */
public final class MonitorStatistics {

  private static final Logger logger = Logger.getLogger(MonitorStatistics.class.getName());

  /** 默认状态日志输出间隔（毫秒） */
  private static final long DEFAULT_STATUS_LOG_INTERVAL_MS = 60_000;

  private final AtomicLong cyclesStarted = new AtomicLong(0);
  private final AtomicLong probesSucceeded = new AtomicLong(0);
  private final AtomicLong probesFailed = new AtomicLong(0);
  private final AtomicLong stalePeersSkipped = new AtomicLong(0);
  private final AtomicLong lastStatusLogTime = new AtomicLong(0);
  private final long statusLogIntervalMs;

  public MonitorStatistics() {
    this(DEFAULT_STATUS_LOG_INTERVAL_MS);
  }

  /**
   * 创建运行计数（自定义日志间隔）
   *
   * @param statusLogIntervalMs 状态日志间隔（毫秒）
   */
  public MonitorStatistics(long statusLogIntervalMs) {
    this.statusLogIntervalMs = statusLogIntervalMs;
  }

  public long recordCycleStarted() {
    return cyclesStarted.incrementAndGet();
  }

  public long recordProbeSucceeded() {
    return probesSucceeded.incrementAndGet();
  }

  public long recordProbeFailed() {
    return probesFailed.incrementAndGet();
  }

  public long recordStalePeerSkipped() {
    return stalePeersSkipped.incrementAndGet();
  }

  public long getCyclesStarted() {
    return cyclesStarted.get();
  }

  public long getProbesSucceeded() {
    return probesSucceeded.get();
  }

  public long getProbesFailed() {
    return probesFailed.get();
  }

  public long getStalePeersSkipped() {
    return stalePeersSkipped.get();
  }

  /**
   * 构建状态摘要
   *
   * @param activePeers 当前对端数
   * @param intervalSeconds 当前探测间隔（秒）
   * @return 摘要字符串
   */
  public String buildSummary(int activePeers, double intervalSeconds) {
    return String.format(
        Locale.ROOT,
        "peers=%d, interval=%.3fs, cycles=%d, probes(ok/failed)=%d/%d, staleSkipped=%d",
        activePeers,
        intervalSeconds,
        cyclesStarted.get(),
        probesSucceeded.get(),
        probesFailed.get(),
        stalePeersSkipped.get());
  }

  /**
   * 周期性输出状态日志
   *
   * @param activePeers 当前对端数
   * @param intervalSeconds 当前探测间隔（秒）
   * @return 本次是否输出了日志
   */
  public boolean logPeriodicStatus(int activePeers, double intervalSeconds) {
    long now = System.currentTimeMillis();
    long lastLog = lastStatusLogTime.get();
    if (now - lastLog >= statusLogIntervalMs && lastStatusLogTime.compareAndSet(lastLog, now)) {
      logger.log(
          Level.INFO,
          "Latency monitor status - {0}",
          buildSummary(activePeers, intervalSeconds));
      return true;
    }
    return false;
  }
}
