/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务取消令牌
 *
 * <p>每个任务一个，只表达"请求取消"这一建议性信号，不会强制中断正在执行的调用。
 * 检查点：
 * <ul>
 *   <li>准入前（提交后立即检查）
 *   <li>在准入队列中等待时（通过 {@link #onCancel(Runnable)} 唤醒等待者）
 *   <li>迁移到 RUNNING 时（由任务注册表原子复查）
 *   <li>执行中由配合取消的操作自行轮询 {@link #throwIfCancellationRequested()}
 * </ul>
 */
public final class CancellationToken {

  private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

  private final String taskId;
  private final AtomicBoolean requested = new AtomicBoolean(false);
  private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public CancellationToken(String taskId) {
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }

  /**
   * 请求取消（幂等）
   *
   * @return 是否为首次请求
   */
  public boolean cancel() {
    if (!requested.compareAndSet(false, true)) {
      return false;
    }
    for (Runnable callback : callbacks) {
      runQuietly(callback);
    }
    return true;
  }

  public boolean isCancellationRequested() {
    return requested.get();
  }

  /**
   * 若已请求取消则抛出 {@link TaskCancelledException}
   *
   * <p>供长时间运行的操作在循环中调用，以配合取消。
   */
  public void throwIfCancellationRequested() {
    if (requested.get()) {
      throw new TaskCancelledException("Task " + taskId + " cancelled during execution");
    }
  }

  /**
   * 注册取消回调
   *
   * <p>若已取消，回调在当前线程立即执行。返回的 {@link Registration} 关闭后回调被移除。
   *
   * @param callback 回调，应快速返回
   * @return 注册句柄
   */
  public Registration onCancel(Runnable callback) {
    callbacks.add(callback);
    // 注册与 cancel() 并发时，回调可能执行两次；回调必须是幂等的
    if (requested.get()) {
      runQuietly(callback);
    }
    return () -> callbacks.remove(callback);
  }

  private void runQuietly(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(
          Level.WARNING,
          "Cancellation callback failed: taskId={0}, error={1}",
          new Object[] {taskId, e.getMessage()});
    }
  }

  /** 回调注册句柄 */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  @Override
  public String toString() {
    return "CancellationToken{taskId=" + taskId + ", requested=" + requested.get() + '}';
  }
}
