/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ProbeResultTest {

  @Test
  void success() {
    ProbeResult result = ProbeResult.success(1700000000.25);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getRemoteTimestamp()).isEqualTo(1700000000.25);
    assertThat(result.getErrorMessage()).isNull();
    assertThat(result.getCause()).isNull();
  }

  @Test
  void failureWithMessage() {
    ProbeResult result = ProbeResult.failure("timed out");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getErrorMessage()).isEqualTo("timed out");
    assertThat(result.toString()).contains("timed out");
    assertThatThrownBy(result::getRemoteTimestamp).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void failureFromException() {
    IOException cause = new IOException("connection refused");
    ProbeResult result = ProbeResult.failure(cause);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getErrorMessage()).isEqualTo("connection refused");
    assertThat(result.getCause()).isSameAs(cause);
  }

  @Test
  void failureFromExceptionWithoutMessageUsesClassName() {
    ProbeResult result = ProbeResult.failure(new IllegalStateException());

    assertThat(result.getErrorMessage()).isEqualTo(IllegalStateException.class.getName());
  }
}
