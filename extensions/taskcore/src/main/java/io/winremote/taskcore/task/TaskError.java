/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 结构化错误描述
 *
 * <p>附加在 FAILED / CANCELLED 任务记录和调用结果上，包含错误码、错误信息和（可选的）异常类型。
 */
public final class TaskError {

  /** 操作执行时抛出异常 */
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  /** 在准入队列中等待超时 */
  public static final String ADMISSION_TIMEOUT = "ADMISSION_TIMEOUT";

  /** 任务被取消 */
  public static final String TASK_CANCELLED = "TASK_CANCELLED";

  private final String code;
  private final String message;
  @Nullable private final String exceptionType;

  private TaskError(String code, String message, @Nullable String exceptionType) {
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
    this.exceptionType = exceptionType;
  }

  public static TaskError of(String code, String message) {
    return new TaskError(code, message, null);
  }

  /**
   * 从异常创建错误描述
   *
   * <p>异常消息为空时使用异常类名作为错误信息。
   *
   * @param code 错误码
   * @param throwable 异常
   * @return 错误描述
   */
  public static TaskError fromException(String code, Throwable throwable) {
    String message = throwable.getMessage();
    return new TaskError(
        code, message != null ? message : throwable.getClass().getName(),
        throwable.getClass().getName());
  }

  public static TaskError cancelled(String reason) {
    return new TaskError(TASK_CANCELLED, reason, null);
  }

  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  @Nullable
  public String getExceptionType() {
    return exceptionType;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaskError)) {
      return false;
    }
    TaskError other = (TaskError) o;
    return code.equals(other.code)
        && message.equals(other.message)
        && Objects.equals(exceptionType, other.exceptionType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, exceptionType);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "TaskError{code=%s, message='%s'}", code, message);
  }
}
