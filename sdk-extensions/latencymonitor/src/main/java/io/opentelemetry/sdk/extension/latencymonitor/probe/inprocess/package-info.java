/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 进程内对端网络，用于本地联调和测试。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.probe.inprocess;

import javax.annotation.ParametersAreNonnullByDefault;
