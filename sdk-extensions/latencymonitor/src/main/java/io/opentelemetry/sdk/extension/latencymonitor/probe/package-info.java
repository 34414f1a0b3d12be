/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 探测传输、对端查找与生命周期通知的外部协作接口。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.probe;

import javax.annotation.ParametersAreNonnullByDefault;
