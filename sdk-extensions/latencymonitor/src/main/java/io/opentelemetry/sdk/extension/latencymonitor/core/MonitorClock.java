/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.core;

import java.time.Instant;

/**
 * 监控时钟，返回以秒为单位的 epoch 时间。
 *
 * <p>时钟偏移按 {@code 本地接收时间 - 对端时钟读数} 计算，对端返回的也是 epoch 秒，所以这里使用墙上时钟。
 */
@FunctionalInterface
public interface MonitorClock {

  /** 当前时间（epoch 秒，含小数部分） */
  double nowSeconds();

  /** 系统时钟 */
  static MonitorClock system() {
    return () -> {
      Instant now = Instant.now();
      return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    };
  }
}
