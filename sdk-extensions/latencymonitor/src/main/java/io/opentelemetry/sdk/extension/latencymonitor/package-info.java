/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 对端延迟监控扩展。
 *
 * <p>{@link io.opentelemetry.sdk.extension.latencymonitor.LatencyMonitor} 是入口：按轮询顺序每次只探测一个对端，
 * 统计往返延迟与时钟偏移。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor;

import javax.annotation.ParametersAreNonnullByDefault;
