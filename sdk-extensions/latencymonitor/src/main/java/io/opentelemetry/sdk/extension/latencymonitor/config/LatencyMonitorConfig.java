/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import java.time.Duration;
import java.util.Objects;

/**
 * 延迟监控配置
 *
 * <p>核心只有一个可调参数：整轮探测的总时长（默认 1000ms）。其余为运行时参数。
 */
public final class LatencyMonitorConfig {

  // ===== 配置键常量 =====
  private static final String ENABLED = "otel.latency.monitor.enabled";
  private static final String CYCLE_DURATION = "otel.latency.monitor.cycle.duration";
  private static final String SHUTDOWN_TIMEOUT = "otel.latency.monitor.shutdown.timeout";
  private static final String STATUS_LOG_INTERVAL = "otel.latency.monitor.status.log.interval";
  private static final String LOG_OBSERVATIONS = "otel.latency.monitor.log.observations";
  private static final String THREAD_NAME = "otel.latency.monitor.thread.name";

  // ===== 默认值常量 =====
  private static final Duration DEFAULT_CYCLE_DURATION = Duration.ofMillis(1000);
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_STATUS_LOG_INTERVAL = Duration.ofSeconds(60);
  private static final String DEFAULT_THREAD_NAME = "otel-latency-monitor";

  private final boolean enabled;
  private final Duration cycleDuration;
  private final Duration shutdownTimeout;
  private final Duration statusLogInterval;
  private final boolean logObservations;
  private final String threadName;

  private LatencyMonitorConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.cycleDuration = builder.cycleDuration;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.statusLogInterval = builder.statusLogInterval;
    this.logObservations = builder.logObservations;
    this.threadName = builder.threadName;
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 延迟监控配置
   */
  public static LatencyMonitorConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ===== Getters =====

  public boolean isEnabled() {
    return enabled;
  }

  /** 整轮探测的总时长 */
  public Duration getCycleDuration() {
    return cycleDuration;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public Duration getStatusLogInterval() {
    return statusLogInterval;
  }

  /** 是否输出每条观测记录的日志 */
  public boolean isLogObservations() {
    return logObservations;
  }

  public String getThreadName() {
    return threadName;
  }

  @Override
  public String toString() {
    return "LatencyMonitorConfig{enabled="
        + enabled
        + ", cycleDuration="
        + cycleDuration.toMillis()
        + "ms, shutdownTimeout="
        + shutdownTimeout.toMillis()
        + "ms, statusLogInterval="
        + statusLogInterval.toMillis()
        + "ms, logObservations="
        + logObservations
        + ", threadName="
        + threadName
        + "}";
  }

  /** 构建器 */
  public static final class Builder {
    private boolean enabled = true;
    private Duration cycleDuration = DEFAULT_CYCLE_DURATION;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private Duration statusLogInterval = DEFAULT_STATUS_LOG_INTERVAL;
    private boolean logObservations = true;
    private String threadName = DEFAULT_THREAD_NAME;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置，未配置的项保持默认值
     *
     * @param properties 配置属性
     * @return 构建器
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      Boolean enabledConfig = properties.getBoolean(ENABLED);
      if (enabledConfig != null) {
        this.enabled = enabledConfig;
      }

      Duration cycle = properties.getDuration(CYCLE_DURATION);
      if (cycle != null) {
        this.cycleDuration = cycle;
      }

      Duration shutdown = properties.getDuration(SHUTDOWN_TIMEOUT);
      if (shutdown != null) {
        this.shutdownTimeout = shutdown;
      }

      Duration statusLog = properties.getDuration(STATUS_LOG_INTERVAL);
      if (statusLog != null) {
        this.statusLogInterval = statusLog;
      }

      Boolean logObservationsConfig = properties.getBoolean(LOG_OBSERVATIONS);
      if (logObservationsConfig != null) {
        this.logObservations = logObservationsConfig;
      }

      String thread = properties.getString(THREAD_NAME);
      if (thread != null && !thread.trim().isEmpty()) {
        this.threadName = thread.trim();
      }

      return this;
    }

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setCycleDuration(Duration cycleDuration) {
      this.cycleDuration = Objects.requireNonNull(cycleDuration, "cycleDuration");
      return this;
    }

    public Builder setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    public Builder setStatusLogInterval(Duration statusLogInterval) {
      this.statusLogInterval = Objects.requireNonNull(statusLogInterval, "statusLogInterval");
      return this;
    }

    public Builder setLogObservations(boolean logObservations) {
      this.logObservations = logObservations;
      return this;
    }

    public Builder setThreadName(String threadName) {
      this.threadName = Objects.requireNonNull(threadName, "threadName");
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     */
    public LatencyMonitorConfig build() {
      validate();
      return new LatencyMonitorConfig(this);
    }

    private void validate() {
      if (cycleDuration.toMillis() <= 0) {
        throw new IllegalArgumentException("cycleDuration must be at least 1ms");
      }
      if (shutdownTimeout.isNegative()) {
        throw new IllegalArgumentException("shutdownTimeout must not be negative");
      }
      if (statusLogInterval.isNegative()) {
        throw new IllegalArgumentException("statusLogInterval must not be negative");
      }
      if (threadName.trim().isEmpty()) {
        throw new IllegalArgumentException("threadName must not be blank");
      }
    }
  }
}
