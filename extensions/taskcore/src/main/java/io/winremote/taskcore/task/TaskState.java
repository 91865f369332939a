/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import java.util.Locale;

/**
 * 任务状态
 *
 * <p>状态机（单向，终态不可离开）：
 * <pre>
 * PENDING --[准入并执行]--> RUNNING --[成功]--> SUCCEEDED
 * RUNNING --[抛出异常]--> FAILED
 * PENDING --[取消]--> CANCELLED
 * PENDING --[准入超时]--> FAILED
 * RUNNING --[操作配合取消]--> CANCELLED
 * </pre>
 */
public enum TaskState {
  /** 已创建，等待准入 */
  PENDING,
  /** 已获得准入，正在执行 */
  RUNNING,
  /** 执行成功 */
  SUCCEEDED,
  /** 执行失败 */
  FAILED,
  /** 已取消 */
  CANCELLED;

  /**
   * 是否为终态
   *
   * @return 是否终态
   */
  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELLED;
  }

  /**
   * 是否为活跃状态（PENDING 或 RUNNING）
   *
   * @return 是否活跃
   */
  public boolean isActive() {
    return !isTerminal();
  }

  /**
   * 检查是否允许迁移到目标状态
   *
   * @param target 目标状态
   * @return 是否允许
   */
  public boolean canTransitionTo(TaskState target) {
    switch (this) {
      case PENDING:
        return target == RUNNING || target == CANCELLED || target == FAILED;
      case RUNNING:
        return target == SUCCEEDED || target == FAILED || target == CANCELLED;
      case SUCCEEDED:
      case FAILED:
      case CANCELLED:
        return false;
    }
    throw new AssertionError("Unexpected state: " + this);
  }

  /**
   * 获取对外展示的状态名（小写）
   *
   * @return 状态名
   */
  public String getWireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
