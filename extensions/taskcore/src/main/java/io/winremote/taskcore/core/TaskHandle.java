/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import io.winremote.taskcore.task.CancellationToken;
import io.winremote.taskcore.task.TaskCategory;

/**
 * 任务句柄
 *
 * <p>由 {@link TaskRegistry#create(TaskCategory, String)} 返回，持有任务 ID 和该任务的取消令牌。
 */
public final class TaskHandle {

  private final String taskId;
  private final String operationName;
  private final TaskCategory category;
  private final CancellationToken cancellationToken;

  TaskHandle(
      String taskId,
      String operationName,
      TaskCategory category,
      CancellationToken cancellationToken) {
    this.taskId = taskId;
    this.operationName = operationName;
    this.category = category;
    this.cancellationToken = cancellationToken;
  }

  public String getTaskId() {
    return taskId;
  }

  public String getOperationName() {
    return operationName;
  }

  public TaskCategory getCategory() {
    return category;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  @Override
  public String toString() {
    return "TaskHandle{taskId=" + taskId + ", operation=" + operationName
        + ", category=" + category + '}';
  }
}
