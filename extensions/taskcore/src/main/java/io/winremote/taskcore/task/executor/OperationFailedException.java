/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import io.winremote.taskcore.task.TaskError;
import javax.annotation.Nullable;

/**
 * 带错误码的操作失败
 *
 * <p>操作抛出此异常时，任务以 FAILED 结束，错误码取自异常；其他异常统一使用
 * {@link TaskError#OPERATION_FAILED}。
 */
public class OperationFailedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String errorCode;

  public OperationFailedException(String errorCode, String message) {
    this(errorCode, message, null);
  }

  public OperationFailedException(String errorCode, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
