/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import io.winremote.taskcore.task.CancellationToken;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.status.TaskStatusEvent;
import io.winremote.taskcore.task.status.TaskStatusEventManager;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 任务注册表
 *
 * <p>任务状态的唯一事实来源，也是任务状态的唯一写入者：
 * <ul>
 *   <li>所有写操作在同一个临界区内串行执行
 *   <li>读操作返回不可变快照列表，迭代过程不受并发写入影响
 *   <li>进入终态的记录从活跃视图移入有界历史，超出容量时按 FIFO 淘汰最旧记录
 *   <li>每次迁移在临界区之外通过 {@link TaskStatusEventManager} 广播
 * </ul>
 *
 * <p>取消请求与准入的竞争在 {@link #markRunning(String)} 中解决：取消标志的复查与
 * PENDING → RUNNING 迁移处于同一个临界区。
 */
public final class TaskRegistry {

  private static final Logger logger = Logger.getLogger(TaskRegistry.class.getName());

  /** 默认历史容量 */
  public static final int DEFAULT_HISTORY_CAPACITY = 100;

  private static final int TASK_ID_LENGTH = 12;

  private final ReentrantLock lock = new ReentrantLock();

  /** 活跃记录（PENDING / RUNNING），按创建顺序 */
  private final LinkedHashMap<String, TaskRecord> active = new LinkedHashMap<>();

  /** 活跃任务的取消令牌 */
  private final Map<String, CancellationToken> tokens = new HashMap<>();

  /** 终态记录，队首为最近完成 */
  private final ArrayDeque<TaskRecord> history = new ArrayDeque<>();

  private final Map<String, TaskRecord> historyIndex = new HashMap<>();

  private final int historyCapacity;
  private final TaskStatusEventManager eventManager;
  private long nextSequence = 1;

  public TaskRegistry() {
    this(DEFAULT_HISTORY_CAPACITY, new TaskStatusEventManager());
  }

  /**
   * 创建任务注册表
   *
   * @param historyCapacity 终态历史容量
   * @param eventManager 状态事件管理器
   */
  public TaskRegistry(int historyCapacity, TaskStatusEventManager eventManager) {
    if (historyCapacity <= 0) {
      throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
    }
    this.historyCapacity = historyCapacity;
    this.eventManager = eventManager;
  }

  // ===== 写操作 =====

  /**
   * 创建任务记录（PENDING）
   *
   * <p>返回后记录立即对状态查询可见。
   *
   * @param category 操作类别
   * @param operationName 操作名称
   * @return 任务句柄
   */
  public TaskHandle create(TaskCategory category, String operationName) {
    TaskRecord record;
    CancellationToken token;
    lock.lock();
    try {
      String taskId = newTaskId();
      token = new CancellationToken(taskId);
      record = TaskRecord.builder()
          .taskId(taskId)
          .operationName(operationName)
          .category(category)
          .state(TaskState.PENDING)
          .sequence(nextSequence++)
          .createdAtMillis(System.currentTimeMillis())
          .build();
      active.put(taskId, record);
      tokens.put(taskId, token);
    } finally {
      lock.unlock();
    }
    eventManager.emit(TaskStatusEvent.created(record));
    return new TaskHandle(record.getTaskId(), operationName, category, token);
  }

  /**
   * PENDING → RUNNING
   *
   * <p>与取消标志的复查原子执行：PENDING 任务收到取消请求时会在同一临界区内直接进入 CANCELLED，
   * 因此这里只要记录仍是活跃的 PENDING 就可以安全迁移；否则返回 false，调用方不得执行操作。
   *
   * @param taskId 任务 ID
   * @return 是否已进入 RUNNING
   */
  public boolean markRunning(String taskId) {
    TaskRecord started;
    lock.lock();
    try {
      TaskRecord current = active.get(taskId);
      if (current == null) {
        // 取消请求先到达：记录已进入 CANCELLED（可能已被历史淘汰）
        return false;
      }
      if (current.getState() != TaskState.PENDING) {
        throw illegalTransition(current, TaskState.RUNNING);
      }
      started = current.toBuilder()
          .state(TaskState.RUNNING)
          .startedAtMillis(System.currentTimeMillis())
          .build();
      active.put(taskId, started);
    } finally {
      lock.unlock();
    }
    eventManager.emit(TaskStatusEvent.transition(TaskState.PENDING, started));
    return true;
  }

  /**
   * RUNNING → SUCCEEDED
   *
   * @param taskId 任务 ID
   * @param result 结果
   * @return 是否迁移成功（记录已是终态时返回 false）
   */
  public boolean markCompleted(String taskId, @Nullable Object result) {
    return transitionToTerminal(taskId, TaskState.SUCCEEDED, result, null);
  }

  /**
   * RUNNING → FAILED，或 PENDING → FAILED（准入超时）
   *
   * @param taskId 任务 ID
   * @param error 错误描述
   * @return 是否迁移成功（记录已是终态时返回 false）
   */
  public boolean markFailed(String taskId, TaskError error) {
    return transitionToTerminal(taskId, TaskState.FAILED, null, error);
  }

  /**
   * PENDING / RUNNING → CANCELLED
   *
   * @param taskId 任务 ID
   * @param reason 取消原因
   * @return 是否迁移成功（记录已是终态时返回 false）
   */
  public boolean markCancelled(String taskId, String reason) {
    return transitionToTerminal(taskId, TaskState.CANCELLED, null, TaskError.cancelled(reason));
  }

  /**
   * 请求取消任务
   *
   * <p>PENDING 任务立即进入 CANCELLED；RUNNING 任务只设置建议性标志。
   * 两种情况都会触发任务的取消令牌（在临界区之外），唤醒在准入队列中等待的调用方。
   *
   * @param taskId 任务 ID
   * @return 取消结果
   */
  public CancelResult requestCancel(String taskId) {
    List<TaskStatusEvent> events = new ArrayList<>(1);
    CancellationToken token = null;
    CancelResult result;
    lock.lock();
    try {
      TaskRecord current = active.get(taskId);
      if (current == null) {
        TaskRecord finished = historyIndex.get(taskId);
        return finished != null
            ? CancelResult.alreadyTerminal(finished)
            : CancelResult.notFound(taskId);
      }
      token = tokens.get(taskId);
      if (current.getState() == TaskState.PENDING) {
        TaskRecord cancelled = current.toBuilder()
            .state(TaskState.CANCELLED)
            .cancelRequested(true)
            .completedAtMillis(System.currentTimeMillis())
            .error(TaskError.cancelled("Cancelled before execution"))
            .build();
        moveToHistory(cancelled);
        events.add(TaskStatusEvent.transition(TaskState.PENDING, cancelled));
        result = CancelResult.cancelled(cancelled);
      } else {
        TaskRecord flagged = current.toBuilder().cancelRequested(true).build();
        active.put(taskId, flagged);
        events.add(TaskStatusEvent.cancelRequested(flagged));
        result = CancelResult.cancelRequested(flagged);
      }
    } finally {
      lock.unlock();
    }
    eventManager.emitAll(events);
    if (token != null) {
      token.cancel();
    }
    return result;
  }

  // ===== 读操作 =====

  /**
   * 查询任务记录
   *
   * @param taskId 任务 ID
   * @return 记录快照
   */
  public Optional<TaskRecord> get(String taskId) {
    lock.lock();
    try {
      TaskRecord record = active.get(taskId);
      if (record == null) {
        record = historyIndex.get(taskId);
      }
      return Optional.ofNullable(record);
    } finally {
      lock.unlock();
    }
  }

  /**
   * 列出活跃任务（PENDING / RUNNING），按创建时间升序
   *
   * @return 快照列表
   */
  public List<TaskRecord> listActive() {
    lock.lock();
    try {
      return new ArrayList<>(active.values());
    } finally {
      lock.unlock();
    }
  }

  /**
   * 列出最近完成的任务，最新在前
   *
   * @param limit 最大条数
   * @return 快照列表
   */
  public List<TaskRecord> listRecentHistory(int limit) {
    List<TaskRecord> result = new ArrayList<>(Math.max(0, Math.min(limit, historyCapacity)));
    lock.lock();
    try {
      Iterator<TaskRecord> it = history.iterator();
      while (it.hasNext() && result.size() < limit) {
        result.add(it.next());
      }
    } finally {
      lock.unlock();
    }
    return result;
  }

  /**
   * 按状态筛选全部已知任务（活跃 + 历史），最新创建在前
   *
   * @param state 状态过滤条件，null 表示不过滤
   * @param limit 最大条数
   * @return 快照列表
   */
  public List<TaskRecord> list(@Nullable TaskState state, int limit) {
    List<TaskRecord> all;
    lock.lock();
    try {
      all = new ArrayList<>(active.size() + history.size());
      all.addAll(active.values());
      all.addAll(history);
    } finally {
      lock.unlock();
    }
    List<TaskRecord> result = new ArrayList<>();
    all.sort((a, b) -> Long.compare(b.getSequence(), a.getSequence()));
    for (TaskRecord record : all) {
      if (result.size() >= limit) {
        break;
      }
      if (state == null || record.getState() == state) {
        result.add(record);
      }
    }
    return result;
  }

  public int getActiveCount() {
    lock.lock();
    try {
      return active.size();
    } finally {
      lock.unlock();
    }
  }

  public int getHistorySize() {
    lock.lock();
    try {
      return history.size();
    } finally {
      lock.unlock();
    }
  }

  public int getHistoryCapacity() {
    return historyCapacity;
  }

  public TaskStatusEventManager getEventManager() {
    return eventManager;
  }

  // ===== 内部方法 =====

  private boolean transitionToTerminal(
      String taskId, TaskState target, @Nullable Object result, @Nullable TaskError error) {
    TaskStatusEvent event;
    lock.lock();
    try {
      TaskRecord current = active.get(taskId);
      if (current == null) {
        // 已是终态（可能已被历史淘汰）
        return false;
      }
      if (!current.getState().canTransitionTo(target)
          || (target == TaskState.SUCCEEDED && current.getState() != TaskState.RUNNING)) {
        throw illegalTransition(current, target);
      }
      TaskRecord finished = current.toBuilder()
          .state(target)
          .completedAtMillis(System.currentTimeMillis())
          .result(result)
          .error(error)
          .build();
      moveToHistory(finished);
      event = TaskStatusEvent.transition(current.getState(), finished);
    } finally {
      lock.unlock();
    }
    eventManager.emit(event);
    return true;
  }

  /** 调用方必须持有锁 */
  private void moveToHistory(TaskRecord finished) {
    String taskId = finished.getTaskId();
    active.remove(taskId);
    tokens.remove(taskId);
    history.addFirst(finished);
    historyIndex.put(taskId, finished);
    while (history.size() > historyCapacity) {
      TaskRecord evicted = history.removeLast();
      historyIndex.remove(evicted.getTaskId());
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "Evicted task from history: {0}", evicted.getTaskId());
      }
    }
  }

  /** 调用方必须持有锁 */
  private String newTaskId() {
    String taskId;
    do {
      taskId = UUID.randomUUID().toString().replace("-", "").substring(0, TASK_ID_LENGTH);
    } while (active.containsKey(taskId) || historyIndex.containsKey(taskId));
    return taskId;
  }

  private static IllegalStateException illegalTransition(TaskRecord current, TaskState target) {
    return new IllegalStateException(
        String.format(
            Locale.ROOT,
            "Illegal task transition: taskId=%s, %s -> %s",
            current.getTaskId(), current.getState(), target));
  }
}
