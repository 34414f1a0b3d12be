/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 对端注册表。
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.registry.PeerRegistry} - 按插入顺序保存对端条目
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.registry.PeerEntry} - 单个对端的统计状态
 *   <li>{@link io.opentelemetry.sdk.extension.latencymonitor.registry.PeerStatistics} - 统计快照
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.registry;

import javax.annotation.ParametersAreNonnullByDefault;
