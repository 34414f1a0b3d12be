/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

/** 在线对端的句柄，由 {@link PeerResolver} 提供，交给 {@link PeerTransport} 使用。 */
public interface PeerHandle {

  /** 对端 ID */
  String getPeerId();
}
