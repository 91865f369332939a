/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

/**
 * 操作配合取消时抛出
 *
 * <p>操作在执行期间观察到取消请求并主动放弃，抛出此异常后任务进入 CANCELLED 而非 FAILED。
 */
public class TaskCancelledException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TaskCancelledException(String message) {
    super(message);
  }
}
