/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import io.winremote.taskcore.task.status.TaskStatusEvent;
import io.winremote.taskcore.task.status.TaskStatusEventManager.TaskStatusEventListener;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务生命周期日志记录器
 *
 * <p>作为状态事件监听器挂在任务注册表上，把每次迁移输出为一行带前缀的日志：
 *
 * <pre>
 * [{prefix}] taskId={taskId}, tool={tool}, category={category}, {key1}={value1}, ...
 * </pre>
 *
 * <p>日志级别使用规范：
 *
 * <ul>
 *   <li>SEVERE: 操作执行失败
 *   <li>WARNING: 准入超时、取消请求
 *   <li>INFO: 关键生命周期事件（接收、开始、完成、取消）
 *   <li>FINE: 结果详情、异常堆栈
 * </ul>
 */
public final class TaskLifecycleLogger implements TaskStatusEventListener {

  private static final Logger logger = Logger.getLogger(TaskLifecycleLogger.class.getName());

  // ==================== 日志前缀常量 ====================
  public static final String LOG_PREFIX_RECEIVED = "[TASK-RECEIVED]";
  public static final String LOG_PREFIX_STARTED = "[TASK-STARTED]";
  public static final String LOG_PREFIX_COMPLETED = "[TASK-COMPLETED]";
  public static final String LOG_PREFIX_FAILED = "[TASK-FAILED]";
  public static final String LOG_PREFIX_CANCELLED = "[TASK-CANCELLED]";
  public static final String LOG_PREFIX_CANCEL_REQUESTED = "[TASK-CANCEL-REQUESTED]";
  public static final String LOG_PREFIX_ADMISSION_TIMEOUT = "[TASK-ADMISSION-TIMEOUT]";

  /** 默认结果日志最大长度 */
  public static final int DEFAULT_MAX_RESULT_LOG_LENGTH = 500;

  private volatile boolean enabled = true;

  /** 结果日志最大长度 */
  private volatile int maxResultLogLength = DEFAULT_MAX_RESULT_LOG_LENGTH;

  public TaskLifecycleLogger() {}

  public TaskLifecycleLogger(int maxResultLogLength) {
    setMaxResultLogLength(maxResultLogLength);
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * 设置结果日志最大长度
   *
   * @param maxLength 最大长度，必须为正数
   */
  public void setMaxResultLogLength(int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxResultLogLength must be positive: " + maxLength);
    }
    this.maxResultLogLength = maxLength;
  }

  public int getMaxResultLogLength() {
    return maxResultLogLength;
  }

  @Override
  public void onEvent(TaskStatusEvent event) {
    if (!enabled) {
      return;
    }
    TaskRecord record = event.getRecord();
    switch (event.getKind()) {
      case CREATED:
        logger.log(
            Level.INFO,
            "{0} taskId={1}, tool={2}, category={3}",
            new Object[] {
              LOG_PREFIX_RECEIVED, record.getTaskId(), record.getOperationName(), record.getCategory()
            });
        break;
      case CANCEL_REQUESTED:
        logger.log(
            Level.WARNING,
            "{0} taskId={1}, tool={2}, state={3}, note=advisory",
            new Object[] {
              LOG_PREFIX_CANCEL_REQUESTED,
              record.getTaskId(),
              record.getOperationName(),
              record.getState().getWireName()
            });
        break;
      case TRANSITION:
        logTransition(record);
        break;
      default:
        break;
    }
  }

  private void logTransition(TaskRecord record) {
    switch (record.getState()) {
      case RUNNING:
        logger.log(
            Level.INFO,
            "{0} taskId={1}, tool={2}, category={3}, queueTimeMs={4}",
            new Object[] {
              LOG_PREFIX_STARTED,
              record.getTaskId(),
              record.getOperationName(),
              record.getCategory(),
              record.getStartedAtMillis() - record.getCreatedAtMillis()
            });
        break;
      case SUCCEEDED:
        logger.log(
            Level.INFO,
            "{0} taskId={1}, tool={2}, executionTimeMs={3}",
            new Object[] {
              LOG_PREFIX_COMPLETED,
              record.getTaskId(),
              record.getOperationName(),
              durationOrZero(record)
            });
        if (record.getResult() != null && logger.isLoggable(Level.FINE)) {
          logger.log(
              Level.FINE,
              "{0} taskId={1}, result={2}",
              new Object[] {
                LOG_PREFIX_COMPLETED,
                record.getTaskId(),
                truncate(String.valueOf(record.getResult()), maxResultLogLength)
              });
        }
        break;
      case FAILED:
        logFailed(record);
        break;
      case CANCELLED:
        logger.log(
            Level.INFO,
            "{0} taskId={1}, tool={2}, started={3}, reason={4}",
            new Object[] {
              LOG_PREFIX_CANCELLED,
              record.getTaskId(),
              record.getOperationName(),
              record.hasStarted(),
              record.getError() != null ? record.getError().getMessage() : "none"
            });
        break;
      default:
        break;
    }
  }

  private void logFailed(TaskRecord record) {
    TaskError error = record.getError();
    String code = error != null ? error.getCode() : TaskError.OPERATION_FAILED;
    String message = error != null ? error.getMessage() : "Unknown error";
    if (TaskError.ADMISSION_TIMEOUT.equals(code)) {
      logger.log(
          Level.WARNING,
          "{0} taskId={1}, tool={2}, category={3}, waitedMs={4}",
          new Object[] {
            LOG_PREFIX_ADMISSION_TIMEOUT,
            record.getTaskId(),
            record.getOperationName(),
            record.getCategory(),
            record.getCompletedAtMillis() - record.getCreatedAtMillis()
          });
      return;
    }
    logger.log(
        Level.SEVERE,
        "{0} taskId={1}, tool={2}, errorCode={3}, errorMessage={4}, executionTimeMs={5}",
        new Object[] {
          LOG_PREFIX_FAILED,
          record.getTaskId(),
          record.getOperationName(),
          code,
          truncate(message, maxResultLogLength),
          durationOrZero(record)
        });
  }

  /**
   * 记录操作抛出的异常堆栈（FINE 级别）
   *
   * @param taskId 任务 ID
   * @param throwable 异常
   */
  public void logOperationException(String taskId, Throwable throwable) {
    if (enabled && logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Task exception stacktrace for " + taskId, throwable);
    }
  }

  private static long durationOrZero(TaskRecord record) {
    Long duration = record.getDurationMillis();
    return duration != null ? duration : 0L;
  }

  static String truncate(String value, int maxLength) {
    if (value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength) + "...(truncated)";
  }
}
