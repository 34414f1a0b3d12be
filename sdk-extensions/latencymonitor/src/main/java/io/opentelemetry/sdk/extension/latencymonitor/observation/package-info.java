/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 探测结果的输出：观测记录及日志、指标两种接收端。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.observation;

import javax.annotation.ParametersAreNonnullByDefault;
