/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.observation;

import java.util.logging.Level;
import java.util.logging.Logger;

/** 把每条观测记录输出为一行日志，默认 INFO 级别。探测失败由调度器自身记录 WARNING。 */
public final class LoggingObservationSink implements ObservationSink {

  private static final Logger logger = Logger.getLogger(LoggingObservationSink.class.getName());

  private final Level observationLevel;

  public LoggingObservationSink() {
    this(Level.INFO);
  }

  /**
   * 创建日志接收端
   *
   * @param observationLevel 成功观测的日志级别
   */
  public LoggingObservationSink(Level observationLevel) {
    this.observationLevel = observationLevel;
  }

  @Override
  public void onObservation(ProbeObservation observation) {
    if (logger.isLoggable(observationLevel)) {
      logger.log(observationLevel, observation.toString());
    }
  }
}
