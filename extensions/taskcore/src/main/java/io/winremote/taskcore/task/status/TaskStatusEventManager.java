package io.winremote.taskcore.task.status;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 统一任务状态事件管理器。
 *
 * <p>目标：
 * - **事件驱动**：注册表只负责发出迁移事件，日志、指标等关注点各自订阅。
 * - **故障隔离**：单个监听器抛出异常不会影响其他监听器，更不会回流到任务执行路径。
 */
public final class TaskStatusEventManager {

  private static final Logger logger = Logger.getLogger(TaskStatusEventManager.class.getName());

  private final CopyOnWriteArrayList<TaskStatusEventListener> listeners = new CopyOnWriteArrayList<>();

  public interface TaskStatusEventListener {
    void onEvent(TaskStatusEvent event);
  }

  public void addListener(TaskStatusEventListener listener) {
    listeners.add(listener);
  }

  public void removeListener(TaskStatusEventListener listener) {
    listeners.remove(listener);
  }

  public int getListenerCount() {
    return listeners.size();
  }

  public void emit(TaskStatusEvent event) {
    for (TaskStatusEventListener l : listeners) {
      try {
        l.onEvent(event);
      } catch (RuntimeException e) {
        logger.log(
            Level.WARNING,
            "TaskStatusEvent listener failed: taskId={0}, error={1}",
            new Object[] {event.getTaskId(), e.getMessage()});
      }
    }
  }

  public void emitAll(List<TaskStatusEvent> events) {
    for (TaskStatusEvent event : events) {
      emit(event);
    }
  }
}
