/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import io.winremote.taskcore.task.TaskCategory;

/**
 * 准入失败
 *
 * <p>由 {@link CategoryGate#acquire} 抛出，表示调用方未获得执行槽位，操作不得执行。
 */
public class AdmissionException extends Exception {

  private static final long serialVersionUID = 1L;

  /** 失败原因 */
  public enum Reason {
    /** 等待期间收到取消请求 */
    CANCELLED,
    /** 超过最大等待时间 */
    TIMEOUT
  }

  private final Reason reason;
  private final TaskCategory category;

  public AdmissionException(Reason reason, TaskCategory category, String message) {
    super(message);
    this.reason = reason;
    this.category = category;
  }

  public static AdmissionException cancelled(TaskCategory category, String taskId) {
    return new AdmissionException(
        Reason.CANCELLED,
        category,
        "Task " + taskId + " cancelled while waiting for a " + category + " slot");
  }

  public static AdmissionException timeout(TaskCategory category, String taskId, long waitedMillis) {
    return new AdmissionException(
        Reason.TIMEOUT,
        category,
        "Task " + taskId + " timed out after " + waitedMillis + "ms waiting for a "
            + category + " slot");
  }

  public Reason getReason() {
    return reason;
  }

  public TaskCategory getCategory() {
    return category;
  }

  public boolean isTimeout() {
    return reason == Reason.TIMEOUT;
  }
}
