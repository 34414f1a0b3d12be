/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 探测结果
 *
 * <p>使用工厂方法创建实例：
 *
 * <pre>{@code
 * // 成功，携带对端时钟读数
 * ProbeResult.success(1718000000.125);
 *
 * // 失败
 * ProbeResult.failure("peer did not answer");
 * }</pre>
 */
public final class ProbeResult {

  private final boolean success;
  private final double remoteTimestamp;
  @Nullable private final String errorMessage;
  @Nullable private final Throwable cause;

  private ProbeResult(
      boolean success,
      double remoteTimestamp,
      @Nullable String errorMessage,
      @Nullable Throwable cause) {
    this.success = success;
    this.remoteTimestamp = remoteTimestamp;
    this.errorMessage = errorMessage;
    this.cause = cause;
  }

  /**
   * 创建成功结果
   *
   * @param remoteTimestamp 对端时钟读数（epoch 秒）
   * @return 成功结果
   */
  public static ProbeResult success(double remoteTimestamp) {
    return new ProbeResult(/* success= */ true, remoteTimestamp, null, null);
  }

  /**
   * 创建失败结果
   *
   * @param errorMessage 错误信息
   * @return 失败结果
   */
  public static ProbeResult failure(String errorMessage) {
    return new ProbeResult(
        /* success= */ false,
        Double.NaN,
        Objects.requireNonNull(errorMessage, "errorMessage"),
        null);
  }

  /**
   * 从异常创建失败结果
   *
   * @param throwable 异常
   * @return 失败结果
   */
  public static ProbeResult failure(Throwable throwable) {
    String message = throwable.getMessage();
    return new ProbeResult(
        /* success= */ false,
        Double.NaN,
        message != null ? message : throwable.getClass().getName(),
        throwable);
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * 对端时钟读数
   *
   * @return epoch 秒
   * @throws IllegalStateException 失败结果没有时钟读数
   */
  public double getRemoteTimestamp() {
    if (!success) {
      throw new IllegalStateException("Failed probe has no remote timestamp");
    }
    return remoteTimestamp;
  }

  @Nullable
  public String getErrorMessage() {
    return errorMessage;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    if (success) {
      return String.format(
          Locale.ROOT, "ProbeResult{success, remoteTimestamp=%.6f}", remoteTimestamp);
    }
    return "ProbeResult{failure, error=" + errorMessage + "}";
  }
}
