/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 任务记录（不可变快照）
 *
 * <p>任务注册表内部每次状态迁移都会替换为新的快照，读取方拿到的实例永远不会被修改。
 * 时间字段使用毫秒时间戳，0 表示尚未发生。
 */
public final class TaskRecord {

  private final String taskId;
  private final String operationName;
  private final TaskCategory category;
  private final TaskState state;
  private final long sequence;
  private final long createdAtMillis;
  private final long startedAtMillis;
  private final long completedAtMillis;
  @Nullable private final Object result;
  @Nullable private final TaskError error;
  private final boolean cancelRequested;

  private TaskRecord(Builder builder) {
    this.taskId = Objects.requireNonNull(builder.taskId, "taskId");
    this.operationName = Objects.requireNonNull(builder.operationName, "operationName");
    this.category = Objects.requireNonNull(builder.category, "category");
    this.state = builder.state;
    this.sequence = builder.sequence;
    this.createdAtMillis = builder.createdAtMillis;
    this.startedAtMillis = builder.startedAtMillis;
    this.completedAtMillis = builder.completedAtMillis;
    this.result = builder.result;
    this.error = builder.error;
    this.cancelRequested = builder.cancelRequested;
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

  public TaskState getState() {
    return state;
  }

  /**
   * 提交序号，同一注册表内严格递增，用于创建顺序排序（毫秒时间戳可能相同）
   *
   * @return 提交序号
   */
  public long getSequence() {
    return sequence;
  }

  public long getCreatedAtMillis() {
    return createdAtMillis;
  }

  public long getStartedAtMillis() {
    return startedAtMillis;
  }

  public long getCompletedAtMillis() {
    return completedAtMillis;
  }

  @Nullable
  public Object getResult() {
    return result;
  }

  @Nullable
  public TaskError getError() {
    return error;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  public boolean hasStarted() {
    return startedAtMillis > 0;
  }

  /**
   * 执行耗时
   *
   * <p>从开始执行到完成；仍在执行时计算到当前时间；尚未开始返回 null。
   *
   * @return 耗时（毫秒）
   */
  @Nullable
  public Long getDurationMillis() {
    if (!hasStarted()) {
      return null;
    }
    long end = completedAtMillis > 0 ? completedAtMillis : System.currentTimeMillis();
    return Math.max(0, end - startedAtMillis);
  }

  public Builder toBuilder() {
    return new Builder()
        .taskId(taskId)
        .operationName(operationName)
        .category(category)
        .state(state)
        .sequence(sequence)
        .createdAtMillis(createdAtMillis)
        .startedAtMillis(startedAtMillis)
        .completedAtMillis(completedAtMillis)
        .result(result)
        .error(error)
        .cancelRequested(cancelRequested);
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "TaskRecord{taskId=%s, operation=%s, category=%s, state=%s, cancelRequested=%s}",
        taskId, operationName, category, state, cancelRequested);
  }

  // ===== Builder =====

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    @Nullable private String taskId;
    @Nullable private String operationName;
    @Nullable private TaskCategory category;
    private TaskState state = TaskState.PENDING;
    private long sequence;
    private long createdAtMillis = System.currentTimeMillis();
    private long startedAtMillis;
    private long completedAtMillis;
    @Nullable private Object result;
    @Nullable private TaskError error;
    private boolean cancelRequested;

    private Builder() {}

    public Builder taskId(String taskId) {
      this.taskId = taskId;
      return this;
    }

    public Builder operationName(String operationName) {
      this.operationName = operationName;
      return this;
    }

    public Builder category(TaskCategory category) {
      this.category = category;
      return this;
    }

    public Builder state(TaskState state) {
      this.state = state;
      return this;
    }

    public Builder sequence(long sequence) {
      this.sequence = sequence;
      return this;
    }

    public Builder createdAtMillis(long createdAtMillis) {
      this.createdAtMillis = createdAtMillis;
      return this;
    }

    public Builder startedAtMillis(long startedAtMillis) {
      this.startedAtMillis = startedAtMillis;
      return this;
    }

    public Builder completedAtMillis(long completedAtMillis) {
      this.completedAtMillis = completedAtMillis;
      return this;
    }

    public Builder result(@Nullable Object result) {
      this.result = result;
      return this;
    }

    public Builder error(@Nullable TaskError error) {
      this.error = error;
      return this;
    }

    public Builder cancelRequested(boolean cancelRequested) {
      this.cancelRequested = cancelRequested;
      return this;
    }

    public TaskRecord build() {
      return new TaskRecord(this);
    }
  }
}
