/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

import javax.annotation.Nullable;

/**
 * 在线对端查找。
 *
 * <p>对端可能已断开而注销通知尚未到达，探测前用它再确认一次。
 */
@FunctionalInterface
public interface PeerResolver {

  /**
   * 查找在线对端
   *
   * @param peerId 对端 ID
   * @return 对端句柄，对端已不在线时返回 null
   */
  @Nullable
  PeerHandle resolveLivePeer(String peerId);
}
