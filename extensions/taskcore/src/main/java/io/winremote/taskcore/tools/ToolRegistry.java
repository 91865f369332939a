/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.tools;

import io.winremote.taskcore.status.TaskControlService;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.executor.OperationWrapper;
import io.winremote.taskcore.task.executor.SubmissionRejectedException;
import io.winremote.taskcore.task.executor.SubmittedTask;
import io.winremote.taskcore.task.executor.TaskOutcome;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 工具注册表
 *
 * <p>把工具名称绑定到类别和实现，类别在注册时校验。普通工具的每次调用都经过
 * {@link OperationWrapper}；CancelTask / GetTaskStatus / GetRunningTasks 直接交给
 * {@link TaskControlService}，不会被包装。
 */
public final class ToolRegistry {

  private static final Logger logger = Logger.getLogger(ToolRegistry.class.getName());

  static final String TASK_ID_ARGUMENT = "task_id";

  private final OperationWrapper wrapper;
  private final TaskControlService controlService;
  private final Map<String, Registration> tools = new ConcurrentHashMap<>();

  public ToolRegistry(OperationWrapper wrapper, TaskControlService controlService) {
    this.wrapper = wrapper;
    this.controlService = controlService;
  }

  // ===== 注册 =====

  /**
   * 按内置类别表注册工具
   *
   * @param toolName 工具名称
   * @param handler 工具实现
   * @return this（支持链式调用）
   * @throws SubmissionRejectedException 工具不在内置类别表中
   */
  public ToolRegistry register(String toolName, ToolHandler handler) {
    TaskCategory category = ToolCategories.categoryOf(toolName);
    if (category == null) {
      throw new SubmissionRejectedException(
          SubmissionRejectedException.Reason.UNKNOWN_CATEGORY,
          "No default category for tool " + toolName + "; register it with an explicit category");
    }
    return register(toolName, category, handler);
  }

  /**
   * 按类别名称注册工具
   *
   * @throws SubmissionRejectedException 类别名称未知
   */
  public ToolRegistry register(String toolName, String categoryName, ToolHandler handler) {
    TaskCategory category = TaskCategory.fromName(categoryName);
    if (category == null) {
      throw SubmissionRejectedException.unknownCategory(categoryName);
    }
    return register(toolName, category, handler);
  }

  public ToolRegistry register(String toolName, TaskCategory category, ToolHandler handler) {
    if (TaskControlService.isControlTool(toolName)) {
      throw new IllegalArgumentException("Tool name is reserved for task control: " + toolName);
    }
    Registration previous = tools.put(toolName, new Registration(category, handler));
    if (previous != null) {
      logger.log(Level.WARNING, "Replaced existing tool registration: {0}", toolName);
    }
    logger.log(
        Level.FINE, "Registered tool: name={0}, category={1}", new Object[] {toolName, category});
    return this;
  }

  public boolean unregister(String toolName) {
    return tools.remove(toolName) != null;
  }

  // ===== 调用 =====

  /**
   * 同步调用工具
   *
   * @param toolName 工具名称
   * @param arguments 调用参数
   * @return 执行结果
   * @throws SubmissionRejectedException 工具未注册或包装器已关闭
   */
  public TaskOutcome<Object> invoke(String toolName, Map<String, Object> arguments) {
    Registration registration = lookup(toolName);
    return wrapper.executeCancellable(
        registration.category,
        toolName,
        token -> registration.handler.call(arguments, token));
  }

  /**
   * 异步调用工具
   *
   * @throws SubmissionRejectedException 工具未注册或异步执行器已关闭
   */
  public SubmittedTask<Object> invokeAsync(String toolName, Map<String, Object> arguments) {
    Registration registration = lookup(toolName);
    return wrapper.submit(
        registration.category,
        toolName,
        token -> registration.handler.call(arguments, token));
  }

  /**
   * 以文本形式调用工具（含控制操作）
   *
   * <p>普通工具的文本结果带有 {@code [task:<id>]} 前缀，便于调用方随后查询或取消。
   *
   * @param toolName 工具名称
   * @param arguments 调用参数
   * @return 文本结果
   */
  public String invokeText(String toolName, Map<String, Object> arguments) {
    switch (toolName) {
      case TaskControlService.CANCEL_TASK:
        String taskId = stringArgument(arguments, TASK_ID_ARGUMENT);
        if (taskId == null || taskId.trim().isEmpty()) {
          return "Cancel failed: " + TASK_ID_ARGUMENT + " is required";
        }
        return controlService.cancelTaskText(taskId.trim());
      case TaskControlService.GET_TASK_STATUS:
        return controlService.getTaskStatusText(stringArgument(arguments, TASK_ID_ARGUMENT));
      case TaskControlService.GET_RUNNING_TASKS:
        return controlService.getRunningTasksText();
      default:
        return formatText(toolName, invoke(toolName, arguments));
    }
  }

  @Nullable
  public TaskCategory getCategory(String toolName) {
    Registration registration = tools.get(toolName);
    return registration != null ? registration.category : null;
  }

  public Set<String> getToolNames() {
    return Collections.unmodifiableSet(new TreeSet<>(tools.keySet()));
  }

  // ===== 内部方法 =====

  private Registration lookup(String toolName) {
    Registration registration = tools.get(toolName);
    if (registration == null) {
      throw SubmissionRejectedException.unknownTool(toolName);
    }
    return registration;
  }

  static String formatText(String toolName, TaskOutcome<?> outcome) {
    String prefix = "[task:" + outcome.getTaskId() + "]";
    if (outcome.isSuccess()) {
      Object result = outcome.getResult();
      return result == null ? prefix : prefix + " " + result;
    }
    if (outcome.getState() == TaskState.CANCELLED) {
      return prefix + " " + outcome.getErrorMessage();
    }
    return prefix + " Error in " + toolName + ": " + outcome.getErrorMessage();
  }

  @Nullable
  private static String stringArgument(Map<String, Object> arguments, String name) {
    Object value = arguments.get(name);
    return value != null ? String.valueOf(value) : null;
  }

  private static final class Registration {
    private final TaskCategory category;
    private final ToolHandler handler;

    Registration(TaskCategory category, ToolHandler handler) {
      this.category = category;
      this.handler = handler;
    }
  }
}
