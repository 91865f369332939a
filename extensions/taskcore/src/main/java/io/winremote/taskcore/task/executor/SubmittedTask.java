/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import java.util.concurrent.CompletableFuture;

/**
 * 异步提交的句柄：立即可用的任务 ID 和最终结果
 *
 * <p>取消 {@link #getOutcome()} 返回的 future 不会取消任务本身，取消任务请使用任务 ID。
 *
 * @param <T> 结果类型
 */
public final class SubmittedTask<T> {

  private final String taskId;
  private final CompletableFuture<TaskOutcome<T>> outcome;

  SubmittedTask(String taskId, CompletableFuture<TaskOutcome<T>> outcome) {
    this.taskId = taskId;
    this.outcome = outcome;
  }

  public String getTaskId() {
    return taskId;
  }

  public CompletableFuture<TaskOutcome<T>> getOutcome() {
    return outcome;
  }

  @Override
  public String toString() {
    return "SubmittedTask{taskId=" + taskId + ", done=" + outcome.isDone() + '}';
  }
}
