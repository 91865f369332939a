/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskRecord;
import javax.annotation.Nullable;

/**
 * 任务记录的对外 JSON 视图
 *
 * <p>{@code duration} 以秒为单位保留两位小数，尚未开始执行时为 null。
 */
@JsonPropertyOrder({
  "task_id", "tool_name", "category", "status", "duration", "error", "cancel_requested"
})
public final class TaskView {

  @JsonProperty("task_id")
  private final String taskId;

  @JsonProperty("tool_name")
  private final String toolName;

  @JsonProperty("category")
  private final String category;

  @JsonProperty("status")
  private final String status;

  @Nullable
  @JsonProperty("duration")
  private final Double duration;

  @Nullable
  @JsonProperty("error")
  private final String error;

  @JsonProperty("cancel_requested")
  private final boolean cancelRequested;

  private TaskView(
      String taskId,
      String toolName,
      String category,
      String status,
      @Nullable Double duration,
      @Nullable String error,
      boolean cancelRequested) {
    this.taskId = taskId;
    this.toolName = toolName;
    this.category = category;
    this.status = status;
    this.duration = duration;
    this.error = error;
    this.cancelRequested = cancelRequested;
  }

  /**
   * 从任务记录创建视图
   *
   * @param record 任务记录
   * @return 视图
   */
  public static TaskView from(TaskRecord record) {
    Long durationMillis = record.getDurationMillis();
    TaskError error = record.getError();
    return new TaskView(
        record.getTaskId(),
        record.getOperationName(),
        record.getCategory().getWireName(),
        record.getState().getWireName(),
        durationMillis != null ? Math.round(durationMillis / 10.0) / 100.0 : null,
        error != null ? error.getMessage() : null,
        record.isCancelRequested());
  }

  public String getTaskId() {
    return taskId;
  }

  public String getToolName() {
    return toolName;
  }

  public String getCategory() {
    return category;
  }

  public String getStatus() {
    return status;
  }

  @Nullable
  public Double getDuration() {
    return duration;
  }

  @Nullable
  public String getError() {
    return error;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }
}
