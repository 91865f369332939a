/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import io.winremote.taskcore.core.AdmissionException;
import io.winremote.taskcore.core.CategoryGate;
import io.winremote.taskcore.core.TaskHandle;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.metrics.TaskMetrics;
import io.winremote.taskcore.task.CancellationToken;
import io.winremote.taskcore.task.TaskCancelledException;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskLifecycleLogger;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 操作包装器
 *
 * <p>一次提交的完整编排：
 * <ol>
 *   <li>在任务注册表中创建 PENDING 记录，此后即可被状态查询看到
 *   <li>若取消已先到达，直接结束，不执行操作
 *   <li>申请类别槽位（唯一的阻塞点），等待期间可被取消或超时
 *   <li>迁移到 RUNNING（与取消标志原子复查）
 *   <li>执行操作并把结果或异常转换为 {@link TaskOutcome}
 *   <li>无论如何释放槽位
 * </ol>
 *
 * <p>任何操作异常都不会越过此边界传播。
 */
public final class OperationWrapper {

  private static final Logger logger = Logger.getLogger(OperationWrapper.class.getName());

  /** 默认不限制准入等待 */
  public static final Duration DEFAULT_ADMISSION_TIMEOUT = Duration.ZERO;

  private final TaskRegistry registry;
  private final CategoryGate gate;
  private final Duration admissionTimeout;
  @Nullable private final TaskLifecycleLogger lifecycleLogger;
  @Nullable private final TaskMetrics metrics;
  @Nullable private final ExecutorService asyncExecutor;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  private OperationWrapper(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.gate = Objects.requireNonNull(builder.gate, "gate");
    this.admissionTimeout = builder.admissionTimeout;
    this.lifecycleLogger = builder.lifecycleLogger;
    this.metrics = builder.metrics;
    this.asyncExecutor = builder.asyncExecutor;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ===== 同步提交 =====

  /**
   * 同步执行操作
   *
   * @param category 类别
   * @param operationName 操作名称
   * @param operation 操作
   * @param <T> 结果类型
   * @return 执行结果
   */
  public <T> TaskOutcome<T> execute(
      TaskCategory category, String operationName, Callable<T> operation) {
    Objects.requireNonNull(operation, "operation");
    return executeCancellable(category, operationName, token -> operation.call());
  }

  /**
   * 同步执行操作（按类别名称）
   *
   * @param categoryName 类别名称
   * @param operationName 操作名称
   * @param operation 操作
   * @param <T> 结果类型
   * @return 执行结果
   * @throws SubmissionRejectedException 未知类别
   */
  public <T> TaskOutcome<T> execute(
      String categoryName, String operationName, Callable<T> operation) {
    return execute(resolveCategory(categoryName), operationName, operation);
  }

  /**
   * 同步执行配合取消的操作
   *
   * @param category 类别
   * @param operationName 操作名称
   * @param operation 操作，接收本任务的取消令牌
   * @param <T> 结果类型
   * @return 执行结果
   * @throws SubmissionRejectedException 包装器已关闭
   */
  public <T> TaskOutcome<T> executeCancellable(
      TaskCategory category, String operationName, CancellableOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    if (shutdown.get()) {
      throw SubmissionRejectedException.closed();
    }
    TaskHandle handle = registry.create(category, operationName);
    return run(handle, operation);
  }

  // ===== 异步提交 =====

  /**
   * 异步提交操作
   *
   * <p>任务记录在返回前创建，返回的任务 ID 可立即用于状态查询和取消。
   *
   * @param category 类别
   * @param operationName 操作名称
   * @param operation 操作
   * @param <T> 结果类型
   * @return 提交句柄
   * @throws SubmissionRejectedException 未配置异步执行器、执行器或包装器已关闭
   */
  public <T> SubmittedTask<T> submit(
      TaskCategory category, String operationName, CancellableOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    ExecutorService executor = asyncExecutor;
    if (shutdown.get() || executor == null || executor.isShutdown()) {
      throw SubmissionRejectedException.closed();
    }
    TaskHandle handle = registry.create(category, operationName);
    CompletableFuture<TaskOutcome<T>> future;
    try {
      future = CompletableFuture.supplyAsync(() -> run(handle, operation), executor);
    } catch (RejectedExecutionException e) {
      TaskError error = TaskError.fromException(TaskError.OPERATION_FAILED, e);
      registry.markFailed(handle.getTaskId(), error);
      future = CompletableFuture.completedFuture(TaskOutcome.failed(handle.getTaskId(), error));
    }
    return new SubmittedTask<>(handle.getTaskId(), future);
  }

  public <T> SubmittedTask<T> submit(
      String categoryName, String operationName, CancellableOperation<T> operation) {
    return submit(resolveCategory(categoryName), operationName, operation);
  }

  public Duration getAdmissionTimeout() {
    return admissionTimeout;
  }

  /**
   * 关闭包装器
   *
   * <p>此后同步与异步提交都会被拒绝；已创建的任务继续按原流程结束。
   */
  public void shutdown() {
    if (shutdown.compareAndSet(false, true)) {
      logger.log(Level.FINE, "Operation wrapper shut down");
    }
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  // ===== 内部方法 =====

  private <T> TaskOutcome<T> run(TaskHandle handle, CancellableOperation<T> operation) {
    String taskId = handle.getTaskId();
    CancellationToken token = handle.getCancellationToken();

    if (token.isCancellationRequested()) {
      return cancelledOutcome(taskId, "Cancelled before admission");
    }

    long waitStart = System.nanoTime();
    try (CategoryGate.Permit permit = gate.acquire(handle.getCategory(), token, admissionTimeout)) {
      recordAdmissionWait(handle.getCategory(), waitStart, TaskState.RUNNING);
      if (!registry.markRunning(taskId)) {
        return cancelledOutcome(taskId, "Cancelled before execution");
      }
      return invoke(handle, operation);
    } catch (AdmissionException e) {
      if (e.isTimeout()) {
        recordAdmissionWait(handle.getCategory(), waitStart, TaskState.FAILED);
        TaskError error = TaskError.of(TaskError.ADMISSION_TIMEOUT, e.getMessage());
        registry.markFailed(taskId, error);
        return TaskOutcome.failed(taskId, error);
      }
      return cancelledOutcome(taskId, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(
          Level.WARNING, "Interrupted while waiting for admission: taskId={0}", taskId);
      return cancelledOutcome(taskId, "Interrupted while waiting for admission");
    }
  }

  private <T> TaskOutcome<T> invoke(TaskHandle handle, CancellableOperation<T> operation) {
    String taskId = handle.getTaskId();
    T result;
    try {
      result = operation.run(handle.getCancellationToken());
    } catch (TaskCancelledException e) {
      return cancelledOutcome(taskId, messageOf(e));
    } catch (OperationFailedException e) {
      return failedOutcome(taskId, TaskError.fromException(e.getErrorCode(), e), e);
    } catch (Throwable t) {
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return failedOutcome(taskId, TaskError.fromException(TaskError.OPERATION_FAILED, t), t);
    }
    registry.markCompleted(taskId, result);
    return TaskOutcome.success(taskId, result);
  }

  private <T> TaskOutcome<T> failedOutcome(String taskId, TaskError error, Throwable cause) {
    if (lifecycleLogger != null) {
      lifecycleLogger.logOperationException(taskId, cause);
    }
    registry.markFailed(taskId, error);
    return TaskOutcome.failed(taskId, error);
  }

  /** 记录可能已被取消请求迁移到 CANCELLED，此时沿用记录上的错误描述 */
  private <T> TaskOutcome<T> cancelledOutcome(String taskId, String reason) {
    if (registry.markCancelled(taskId, reason)) {
      return TaskOutcome.cancelled(taskId, TaskError.cancelled(reason));
    }
    TaskError error = registry.get(taskId)
        .map(TaskRecord::getError)
        .orElse(TaskError.cancelled(reason));
    return TaskOutcome.cancelled(taskId, error);
  }

  private void recordAdmissionWait(TaskCategory category, long waitStartNanos, TaskState outcome) {
    if (metrics != null) {
      long waitedNanos = System.nanoTime() - waitStartNanos;
      metrics.recordAdmissionWait(
          category, waitedNanos / (double) TimeUnit.MILLISECONDS.toNanos(1), outcome);
    }
  }

  private static String messageOf(Throwable t) {
    String message = t.getMessage();
    return message != null ? message : t.getClass().getName();
  }

  private static TaskCategory resolveCategory(String categoryName) {
    TaskCategory category = TaskCategory.fromName(categoryName);
    if (category == null) {
      throw SubmissionRejectedException.unknownCategory(categoryName);
    }
    return category;
  }

  /** 构建器 */
  public static final class Builder {
    @Nullable private TaskRegistry registry;
    @Nullable private CategoryGate gate;
    private Duration admissionTimeout = DEFAULT_ADMISSION_TIMEOUT;
    @Nullable private TaskLifecycleLogger lifecycleLogger;
    @Nullable private TaskMetrics metrics;
    @Nullable private ExecutorService asyncExecutor;

    private Builder() {}

    public Builder registry(TaskRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder gate(CategoryGate gate) {
      this.gate = gate;
      return this;
    }

    /**
     * 设置准入等待上限
     *
     * @param admissionTimeout 等待上限，零表示无限等待
     * @return this
     */
    public Builder admissionTimeout(Duration admissionTimeout) {
      if (admissionTimeout.isNegative()) {
        throw new IllegalArgumentException("admissionTimeout must not be negative");
      }
      this.admissionTimeout = admissionTimeout;
      return this;
    }

    public Builder lifecycleLogger(@Nullable TaskLifecycleLogger lifecycleLogger) {
      this.lifecycleLogger = lifecycleLogger;
      return this;
    }

    public Builder metrics(@Nullable TaskMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder asyncExecutor(@Nullable ExecutorService asyncExecutor) {
      this.asyncExecutor = asyncExecutor;
      return this;
    }

    public OperationWrapper build() {
      return new OperationWrapper(this);
    }
  }
}
