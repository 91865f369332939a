/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

/**
 * 提交被拒绝
 *
 * <p>在创建任务记录之前抛出，被拒绝的提交不会产生任务 ID。
 */
public class SubmissionRejectedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 拒绝原因 */
  public enum Reason {
    /** 未知类别 */
    UNKNOWN_CATEGORY,
    /** 未注册的工具 */
    UNKNOWN_TOOL,
    /** 执行器已关闭 */
    CLOSED
  }

  private final Reason reason;

  public SubmissionRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public static SubmissionRejectedException unknownCategory(String categoryName) {
    return new SubmissionRejectedException(
        Reason.UNKNOWN_CATEGORY, "Unknown task category: " + categoryName);
  }

  public static SubmissionRejectedException unknownTool(String toolName) {
    return new SubmissionRejectedException(Reason.UNKNOWN_TOOL, "Unknown tool: " + toolName);
  }

  public static SubmissionRejectedException closed() {
    return new SubmissionRejectedException(Reason.CLOSED, "Task executor is closed");
  }

  public Reason getReason() {
    return reason;
  }
}
