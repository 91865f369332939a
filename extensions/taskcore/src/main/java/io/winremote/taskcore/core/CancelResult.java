/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import io.winremote.taskcore.task.TaskRecord;
import java.util.Locale;
import javax.annotation.Nullable;

/** 取消请求结果 */
public final class CancelResult {

  /** 取消结果状态 */
  public enum Status {
    /** 任务尚未执行，已直接进入 CANCELLED，操作不会被调用 */
    CANCELLED,
    /** 任务正在执行，已设置建议性取消标志（操作可能仍会正常完成） */
    CANCEL_REQUESTED,
    /** 任务不存在（或已从历史中淘汰） */
    NOT_FOUND,
    /** 任务已处于终态 */
    ALREADY_TERMINAL
  }

  private final Status status;
  private final String taskId;
  @Nullable private final TaskRecord record;

  private CancelResult(Status status, String taskId, @Nullable TaskRecord record) {
    this.status = status;
    this.taskId = taskId;
    this.record = record;
  }

  static CancelResult cancelled(TaskRecord record) {
    return new CancelResult(Status.CANCELLED, record.getTaskId(), record);
  }

  static CancelResult cancelRequested(TaskRecord record) {
    return new CancelResult(Status.CANCEL_REQUESTED, record.getTaskId(), record);
  }

  static CancelResult notFound(String taskId) {
    return new CancelResult(Status.NOT_FOUND, taskId, null);
  }

  static CancelResult alreadyTerminal(TaskRecord record) {
    return new CancelResult(Status.ALREADY_TERMINAL, record.getTaskId(), record);
  }

  public Status getStatus() {
    return status;
  }

  public String getTaskId() {
    return taskId;
  }

  /**
   * 取消请求处理后的记录快照，NOT_FOUND 时为 null
   *
   * @return 记录快照
   */
  @Nullable
  public TaskRecord getRecord() {
    return record;
  }

  public boolean isOk() {
    return status == Status.CANCELLED || status == Status.CANCEL_REQUESTED;
  }

  /**
   * 面向调用方的描述信息
   *
   * @return 描述
   */
  public String getMessage() {
    switch (status) {
      case CANCELLED:
        return "Cancelled task " + taskId + " (" + operationName() + ")";
      case CANCEL_REQUESTED:
        return "Cancellation requested for running task " + taskId + " (" + operationName()
            + "); it may still complete if the operation does not observe the request";
      case NOT_FOUND:
        return "Task " + taskId + " not found";
      case ALREADY_TERMINAL:
        return "Task " + taskId + " is already " + stateName();
    }
    throw new AssertionError("Unexpected status: " + status);
  }

  private String operationName() {
    return record != null ? record.getOperationName() : "unknown";
  }

  private String stateName() {
    return record != null ? record.getState().getWireName() : "finished";
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "CancelResult{status=%s, taskId=%s}", status, taskId);
  }
}
