/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.latencymonitor.config;

import javax.annotation.ParametersAreNonnullByDefault;
