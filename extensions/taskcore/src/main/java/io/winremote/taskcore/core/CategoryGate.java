/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import io.winremote.taskcore.task.CancellationToken;
import io.winremote.taskcore.task.TaskCategory;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 按类别限流的准入闸门
 *
 * <p>每个类别一条有界通道，同一类别内严格按到达顺序（FIFO）准入。等待者在以下情况之一返回：
 * <ul>
 *   <li>获得槽位且位于队首：返回 {@link Permit}
 *   <li>取消令牌触发：抛出 {@link AdmissionException}（CANCELLED）
 *   <li>超过最大等待时间：抛出 {@link AdmissionException}（TIMEOUT）
 *   <li>线程被中断：抛出 {@link InterruptedException}
 * </ul>
 *
 * <p>不同类别之间互不影响。
 */
public final class CategoryGate {

  private static final Logger logger = Logger.getLogger(CategoryGate.class.getName());

  private final Map<TaskCategory, Lane> lanes;

  /**
   * 创建准入闸门
   *
   * @param capacities 每个类别的并发上限，必须覆盖全部类别且为正数
   * @throws IllegalArgumentException 上限缺失或非正数
   */
  public CategoryGate(Map<TaskCategory, Integer> capacities) {
    Map<TaskCategory, Lane> built = new EnumMap<>(TaskCategory.class);
    for (TaskCategory category : TaskCategory.values()) {
      Integer capacity = capacities.get(category);
      if (capacity == null) {
        throw new IllegalArgumentException("Missing concurrency limit for category: " + category);
      }
      if (capacity <= 0) {
        throw new IllegalArgumentException(
            "Concurrency limit for category " + category + " must be positive: " + capacity);
      }
      built.put(category, new Lane(category, capacity));
    }
    this.lanes = Collections.unmodifiableMap(built);
  }

  /** 使用各类别默认上限 */
  public static CategoryGate withDefaults() {
    Map<TaskCategory, Integer> capacities = new EnumMap<>(TaskCategory.class);
    for (TaskCategory category : TaskCategory.values()) {
      capacities.put(category, category.getDefaultLimit());
    }
    return new CategoryGate(capacities);
  }

  /**
   * 申请执行槽位
   *
   * @param category 类别
   * @param token 任务取消令牌
   * @param maxWait 最大等待时间，零表示无限等待
   * @return 槽位许可，关闭时释放
   * @throws AdmissionException 等待期间被取消或超时
   * @throws InterruptedException 等待线程被中断
   */
  public Permit acquire(TaskCategory category, CancellationToken token, Duration maxWait)
      throws AdmissionException, InterruptedException {
    return lanes.get(category).acquire(token, maxWait);
  }

  public int getCapacity(TaskCategory category) {
    return lanes.get(category).capacity;
  }

  public int getInUse(TaskCategory category) {
    return lanes.get(category).inUse();
  }

  public int getWaiting(TaskCategory category) {
    return lanes.get(category).waiting();
  }

  /** 执行槽位许可，只释放一次 */
  public static final class Permit implements AutoCloseable {

    private final Lane lane;
    private final String taskId;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Permit(Lane lane, String taskId) {
      this.lane = lane;
      this.taskId = taskId;
    }

    public TaskCategory getCategory() {
      return lane.category;
    }

    public String getTaskId() {
      return taskId;
    }

    public boolean isReleased() {
      return released.get();
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        lane.release(taskId);
      }
    }
  }

  private static final class Lane {

    private final TaskCategory category;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();

    /** 等待中的任务 ID，队首优先准入 */
    private final ArrayDeque<Object> queue = new ArrayDeque<>();

    private int inUse;

    Lane(TaskCategory category, int capacity) {
      this.category = category;
      this.capacity = capacity;
    }

    Permit acquire(CancellationToken token, Duration maxWait)
        throws AdmissionException, InterruptedException {
      String taskId = token.getTaskId();
      boolean bounded = !maxWait.isZero() && !maxWait.isNegative();
      long startNanos = System.nanoTime();
      long remaining = bounded ? maxWait.toNanos() : Long.MAX_VALUE;
      Object ticket = new Object();

      CancellationToken.Registration registration = token.onCancel(this::wakeAll);
      lock.lock();
      try {
        queue.addLast(ticket);
        while (true) {
          if (token.isCancellationRequested()) {
            throw AdmissionException.cancelled(category, taskId);
          }
          if (queue.peekFirst() == ticket && inUse < capacity) {
            queue.pollFirst();
            inUse++;
            // 后继者可能也有空位
            changed.signalAll();
            if (logger.isLoggable(Level.FINE)) {
              logger.log(
                  Level.FINE,
                  "Admitted: taskId={0}, category={1}, inUse={2}/{3}",
                  new Object[] {taskId, category, inUse, capacity});
            }
            return new Permit(this, taskId);
          }
          if (!bounded) {
            changed.await();
          } else {
            if (remaining <= 0L) {
              throw AdmissionException.timeout(
                  category, taskId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            }
            remaining = changed.awaitNanos(remaining);
          }
        }
      } finally {
        if (queue.remove(ticket)) {
          // 离队可能让下一个等待者成为队首
          changed.signalAll();
        }
        lock.unlock();
        registration.close();
      }
    }

    void release(String taskId) {
      lock.lock();
      try {
        inUse--;
        changed.signalAll();
        if (logger.isLoggable(Level.FINE)) {
          logger.log(
              Level.FINE,
              "Released: taskId={0}, category={1}, inUse={2}/{3}",
              new Object[] {taskId, category, inUse, capacity});
        }
      } finally {
        lock.unlock();
      }
    }

    void wakeAll() {
      lock.lock();
      try {
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    int inUse() {
      lock.lock();
      try {
        return inUse;
      } finally {
        lock.unlock();
      }
    }

    int waiting() {
      lock.lock();
      try {
        return queue.size();
      } finally {
        lock.unlock();
      }
    }
  }
}
