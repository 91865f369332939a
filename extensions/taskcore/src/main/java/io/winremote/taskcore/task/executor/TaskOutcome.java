/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskState;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 一次提交的执行结果
 *
 * <p>任务 ID 总是存在；成功时携带结果，否则携带结构化错误。JSON 形式：
 * <pre>{@code
 * {"success":false,"task_id":"3f2a9c1b7d4e","state":"failed",
 *  "error":"boom","error_code":"OPERATION_FAILED"}
 * }</pre>
 *
 * @param <T> 结果类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "task_id", "state", "result", "error", "error_code"})
@JsonAutoDetect(
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    fieldVisibility = JsonAutoDetect.Visibility.NONE)
public final class TaskOutcome<T> {

  private final String taskId;
  private final TaskState state;
  @Nullable private final T result;
  @Nullable private final TaskError error;

  private TaskOutcome(String taskId, TaskState state, @Nullable T result, @Nullable TaskError error) {
    this.taskId = Objects.requireNonNull(taskId, "taskId");
    this.state = state;
    this.result = result;
    this.error = error;
  }

  public static <T> TaskOutcome<T> success(String taskId, @Nullable T result) {
    return new TaskOutcome<>(taskId, TaskState.SUCCEEDED, result, null);
  }

  public static <T> TaskOutcome<T> failed(String taskId, TaskError error) {
    return new TaskOutcome<>(taskId, TaskState.FAILED, null, error);
  }

  public static <T> TaskOutcome<T> cancelled(String taskId, TaskError error) {
    return new TaskOutcome<>(taskId, TaskState.CANCELLED, null, error);
  }

  @JsonProperty("success")
  public boolean isSuccess() {
    return state == TaskState.SUCCEEDED;
  }

  @JsonProperty("task_id")
  public String getTaskId() {
    return taskId;
  }

  public TaskState getState() {
    return state;
  }

  @JsonProperty("state")
  public String getStateName() {
    return state.getWireName();
  }

  public boolean isCancelled() {
    return state == TaskState.CANCELLED;
  }

  @Nullable
  @JsonProperty("result")
  public T getResult() {
    return result;
  }

  @Nullable
  public TaskError getError() {
    return error;
  }

  @Nullable
  @JsonProperty("error")
  public String getErrorMessage() {
    return error != null ? error.getMessage() : null;
  }

  @Nullable
  @JsonProperty("error_code")
  public String getErrorCode() {
    return error != null ? error.getCode() : null;
  }

  @Override
  public String toString() {
    return "TaskOutcome{taskId=" + taskId + ", state=" + state
        + (error != null ? ", error=" + error : "") + '}';
  }
}
