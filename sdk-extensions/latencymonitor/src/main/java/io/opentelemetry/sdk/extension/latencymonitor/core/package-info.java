/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 延迟监控核心组件。
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.core.ProbeScheduler} - 轮询探测
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.core.IntervalController} - 探测间隔计算
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.core.RunningAverageStatistics} - 滑动平均统计
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.core.MonitorStatistics} - 运行计数
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.core;

import javax.annotation.ParametersAreNonnullByDefault;
