package io.winremote.taskcore.task.status;

import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 任务状态迁移事件。
 *
 * <p>任务注册表每完成一次状态迁移（包括创建和取消请求）就发出一个事件，携带迁移后的记录快照。
 * 事件在注册表临界区之外分发，监听器看到的是已经生效的状态。
 */
public final class TaskStatusEvent {

  /** 事件类型 */
  public enum Kind {
    /** 任务已创建（PENDING） */
    CREATED,
    /** 状态迁移 */
    TRANSITION,
    /** 运行中任务收到取消请求（状态不变） */
    CANCEL_REQUESTED
  }

  private final Kind kind;
  @Nullable private final TaskState previousState;
  private final TaskRecord record;
  private final long timestampMillis;

  private TaskStatusEvent(
      Kind kind, @Nullable TaskState previousState, TaskRecord record, long timestampMillis) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.previousState = previousState;
    this.record = Objects.requireNonNull(record, "record");
    this.timestampMillis = timestampMillis;
  }

  public static TaskStatusEvent created(TaskRecord record) {
    return new TaskStatusEvent(Kind.CREATED, null, record, record.getCreatedAtMillis());
  }

  public static TaskStatusEvent transition(TaskState previousState, TaskRecord record) {
    return new TaskStatusEvent(
        Kind.TRANSITION, previousState, record, System.currentTimeMillis());
  }

  public static TaskStatusEvent cancelRequested(TaskRecord record) {
    return new TaskStatusEvent(
        Kind.CANCEL_REQUESTED, record.getState(), record, System.currentTimeMillis());
  }

  public Kind getKind() {
    return kind;
  }

  @Nullable
  public TaskState getPreviousState() {
    return previousState;
  }

  public TaskRecord getRecord() {
    return record;
  }

  public String getTaskId() {
    return record.getTaskId();
  }

  public TaskCategory getCategory() {
    return record.getCategory();
  }

  public TaskState getState() {
    return record.getState();
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  /**
   * 是否为进入终态的迁移
   *
   * @return 是否终态迁移
   */
  public boolean isTerminalTransition() {
    return kind == Kind.TRANSITION && record.getState().isTerminal();
  }

  @Override
  public String toString() {
    return "TaskStatusEvent{kind=" + kind
        + ", taskId=" + record.getTaskId()
        + ", " + previousState + " -> " + record.getState() + '}';
  }
}
