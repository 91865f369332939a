/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskCategoryTest {

  @Test
  void defaultLimits() {
    assertThat(TaskCategory.DESKTOP.getDefaultLimit()).isEqualTo(1);
    assertThat(TaskCategory.FILE.getDefaultLimit()).isEqualTo(3);
    assertThat(TaskCategory.QUERY.getDefaultLimit()).isEqualTo(5);
    assertThat(TaskCategory.SHELL.getDefaultLimit()).isEqualTo(2);
    assertThat(TaskCategory.NETWORK.getDefaultLimit()).isEqualTo(3);
  }

  @Test
  void fromNameIsCaseInsensitiveAndTrimmed() {
    assertThat(TaskCategory.fromName("desktop")).isEqualTo(TaskCategory.DESKTOP);
    assertThat(TaskCategory.fromName(" Shell ")).isEqualTo(TaskCategory.SHELL);
    assertThat(TaskCategory.fromName("NETWORK")).isEqualTo(TaskCategory.NETWORK);
  }

  @Test
  void fromNameReturnsNullForUnknown() {
    assertThat(TaskCategory.fromName("gpu")).isNull();
    assertThat(TaskCategory.fromName("")).isNull();
    assertThat(TaskCategory.fromName(null)).isNull();
  }

  @Test
  void toStringIsWireName() {
    assertThat(TaskCategory.QUERY.toString()).isEqualTo("query");
  }
}
