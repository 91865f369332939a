/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.status;

import io.winremote.taskcore.core.CancelResult;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.task.TaskRecord;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 任务控制操作：CancelTask / GetTaskStatus / GetRunningTasks
 *
 * <p>控制操作直接访问注册表，不经过操作包装器，也不占用任何类别槽位。
 * 每个操作同时提供结构化结果和文本形式。
 */
public final class TaskControlService {

  private static final Logger logger = Logger.getLogger(TaskControlService.class.getName());

  public static final String CANCEL_TASK = "CancelTask";
  public static final String GET_TASK_STATUS = "GetTaskStatus";
  public static final String GET_RUNNING_TASKS = "GetRunningTasks";

  private final TaskRegistry registry;
  private final TaskStatusReporter reporter;

  public TaskControlService(TaskRegistry registry, TaskStatusReporter reporter) {
    this.registry = registry;
    this.reporter = reporter;
  }

  /**
   * 控制操作名称判断
   *
   * @param toolName 工具名称
   * @return 是否为控制操作
   */
  public static boolean isControlTool(String toolName) {
    return CANCEL_TASK.equals(toolName)
        || GET_TASK_STATUS.equals(toolName)
        || GET_RUNNING_TASKS.equals(toolName);
  }

  // ===== CancelTask =====

  public CancelResult cancelTask(String taskId) {
    CancelResult result = registry.requestCancel(taskId);
    if (!result.isOk()) {
      logger.log(
          Level.FINE,
          "Cancel rejected: taskId={0}, status={1}",
          new Object[] {taskId, result.getStatus()});
    }
    return result;
  }

  /** 文本形式：成功时为描述，失败时以 {@code Cancel failed:} 开头 */
  public String cancelTaskText(String taskId) {
    CancelResult result = cancelTask(taskId);
    return result.isOk() ? result.getMessage() : "Cancel failed: " + result.getMessage();
  }

  // ===== GetTaskStatus =====

  public Optional<TaskRecord> getTaskStatus(String taskId) {
    return reporter.getTaskStatus(taskId);
  }

  public List<TaskRecord> getTaskStatus() {
    return reporter.getTaskStatus();
  }

  /**
   * 文本形式：指定任务时返回 JSON，未指定时返回最近任务摘要
   *
   * @param taskId 任务 ID，null 或空白表示列出最近任务
   * @return 文本
   */
  public String getTaskStatusText(@Nullable String taskId) {
    if (taskId == null || taskId.trim().isEmpty()) {
      return reporter.describeHistory();
    }
    String id = taskId.trim();
    return reporter.getTaskStatus(id)
        .map(TaskStatusReporter::toJson)
        .orElse("Task " + id + " not found");
  }

  // ===== GetRunningTasks =====

  public List<TaskRecord> getRunningTasks() {
    return reporter.getRunningTasks();
  }

  public String getRunningTasksText() {
    return reporter.describeRunning();
  }
}
