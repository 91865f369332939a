/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * 任务状态查询
 *
 * <p>只读视图，所有结果都是注册表的快照。
 */
public final class TaskStatusReporter {

  /** 文本摘要中历史任务的最大行数 */
  public static final int SUMMARY_HISTORY_LINES = 20;

  private static final ObjectMapper objectMapper =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final TaskRegistry registry;

  public TaskStatusReporter(TaskRegistry registry) {
    this.registry = registry;
  }

  public Optional<TaskRecord> getTaskStatus(String taskId) {
    return registry.get(taskId);
  }

  /** 最近完成的任务，最新在前，最多为历史容量 */
  public List<TaskRecord> getTaskStatus() {
    return registry.listRecentHistory(registry.getHistoryCapacity());
  }

  /** PENDING / RUNNING 任务，按创建时间升序 */
  public List<TaskRecord> getRunningTasks() {
    return registry.listActive();
  }

  public List<TaskRecord> listTasks(@Nullable TaskState state, int limit) {
    return registry.list(state, limit);
  }

  /**
   * 序列化单条任务记录
   *
   * @param record 任务记录
   * @return JSON 文本
   */
  public static String toJson(TaskRecord record) {
    try {
      return objectMapper.writeValueAsString(TaskView.from(record));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize task " + record.getTaskId(), e);
    }
  }

  /**
   * 最近任务的文本摘要
   *
   * <pre>
   * Recent tasks:
   *   [3f2a9c1b7d4e] Shell -&gt; failed (1.25s) - exit code 1
   * </pre>
   */
  public String describeHistory() {
    List<TaskRecord> recent = registry.listRecentHistory(SUMMARY_HISTORY_LINES);
    if (recent.isEmpty()) {
      return "No tasks in history.";
    }
    StringBuilder sb = new StringBuilder("Recent tasks:");
    for (TaskRecord record : recent) {
      TaskView view = TaskView.from(record);
      sb.append("\n  [").append(view.getTaskId()).append("] ")
          .append(view.getToolName()).append(" -> ").append(view.getStatus())
          .append(formatDuration(view));
      if (view.getError() != null) {
        sb.append(" - ").append(view.getError());
      }
    }
    return sb.toString();
  }

  /**
   * 活跃任务的文本摘要
   *
   * <pre>
   * Active tasks (2):
   *   [3f2a9c1b7d4e] Snapshot [desktop] running (0.42s)
   *   [91c0d2e8aa31] Click [desktop] pending
   * </pre>
   */
  public String describeRunning() {
    List<TaskRecord> active = registry.listActive();
    if (active.isEmpty()) {
      return "No active tasks.";
    }
    StringBuilder sb = new StringBuilder("Active tasks (").append(active.size()).append("):");
    for (TaskRecord record : active) {
      TaskView view = TaskView.from(record);
      sb.append("\n  [").append(view.getTaskId()).append("] ")
          .append(view.getToolName()).append(" [").append(view.getCategory()).append("] ")
          .append(view.getStatus())
          .append(formatDuration(view));
    }
    return sb.toString();
  }

  private static String formatDuration(TaskView view) {
    return view.getDuration() != null ? " (" + view.getDuration() + "s)" : "";
  }
}
