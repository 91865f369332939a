/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.status.TaskStatusEvent;
import io.winremote.taskcore.task.status.TaskStatusEventManager;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskRegistryTest {

  private TaskStatusEventManager eventManager;
  private List<TaskStatusEvent> events;
  private TaskRegistry registry;

  @BeforeEach
  void setUp() {
    eventManager = new TaskStatusEventManager();
    events = new ArrayList<>();
    eventManager.addListener(events::add);
    registry = new TaskRegistry(3, eventManager);
  }

  @Test
  void createRegistersPendingRecord() {
    TaskHandle handle = registry.create(TaskCategory.SHELL, "Shell");

    assertThat(handle.getTaskId()).matches("[0-9a-f]{12}");
    TaskRecord record = registry.get(handle.getTaskId()).orElseThrow(AssertionError::new);
    assertThat(record.getState()).isEqualTo(TaskState.PENDING);
    assertThat(record.getOperationName()).isEqualTo("Shell");
    assertThat(record.getCategory()).isEqualTo(TaskCategory.SHELL);
    assertThat(record.hasStarted()).isFalse();
    assertThat(record.getDurationMillis()).isNull();
    assertThat(events).extracting(TaskStatusEvent::getKind)
        .containsExactly(TaskStatusEvent.Kind.CREATED);
  }

  @Test
  void idsAreUnique() {
    TaskRegistry large = new TaskRegistry(2000, new TaskStatusEventManager());
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      ids.add(large.create(TaskCategory.QUERY, "q").getTaskId());
    }
    assertThat(ids).hasSize(1000);
  }

  @Test
  void successfulLifecycleMovesRecordToHistory() {
    String id = registry.create(TaskCategory.QUERY, "GetSystemInfo").getTaskId();

    assertThat(registry.markRunning(id)).isTrue();
    assertThat(registry.get(id).get().getState()).isEqualTo(TaskState.RUNNING);
    assertThat(registry.get(id).get().hasStarted()).isTrue();

    assertThat(registry.markCompleted(id, "ok")).isTrue();

    TaskRecord record = registry.get(id).get();
    assertThat(record.getState()).isEqualTo(TaskState.SUCCEEDED);
    assertThat(record.getResult()).isEqualTo("ok");
    assertThat(record.getDurationMillis()).isNotNull();
    assertThat(registry.listActive()).isEmpty();
    assertThat(registry.listRecentHistory(10)).extracting(TaskRecord::getTaskId).containsExactly(id);
    assertThat(events).extracting(TaskStatusEvent::getState)
        .containsExactly(TaskState.PENDING, TaskState.RUNNING, TaskState.SUCCEEDED);
  }

  @Test
  void completingPendingTaskIsIllegal() {
    String id = registry.create(TaskCategory.FILE, "FileRead").getTaskId();

    assertThatThrownBy(() -> registry.markCompleted(id, null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void terminalRecordIgnoresFurtherTransitions() {
    String id = registry.create(TaskCategory.FILE, "FileRead").getTaskId();
    registry.markRunning(id);
    registry.markFailed(id, TaskError.of(TaskError.OPERATION_FAILED, "disk"));

    assertThat(registry.markCompleted(id, "late")).isFalse();
    assertThat(registry.markCancelled(id, "late")).isFalse();
    assertThat(registry.get(id).get().getState()).isEqualTo(TaskState.FAILED);
  }

  @Test
  void cancelPendingTaskIsImmediate() {
    TaskHandle handle = registry.create(TaskCategory.DESKTOP, "Click");

    CancelResult result = registry.requestCancel(handle.getTaskId());

    assertThat(result.getStatus()).isEqualTo(CancelResult.Status.CANCELLED);
    assertThat(result.isOk()).isTrue();
    assertThat(result.getMessage()).isEqualTo("Cancelled task " + handle.getTaskId() + " (Click)");
    assertThat(handle.getCancellationToken().isCancellationRequested()).isTrue();
    TaskRecord record = registry.get(handle.getTaskId()).get();
    assertThat(record.getState()).isEqualTo(TaskState.CANCELLED);
    assertThat(record.isCancelRequested()).isTrue();
    // 取消先于准入到达
    assertThat(registry.markRunning(handle.getTaskId())).isFalse();
  }

  @Test
  void cancelRunningTaskOnlySetsFlag() {
    TaskHandle handle = registry.create(TaskCategory.SHELL, "Shell");
    registry.markRunning(handle.getTaskId());

    CancelResult result = registry.requestCancel(handle.getTaskId());

    assertThat(result.getStatus()).isEqualTo(CancelResult.Status.CANCEL_REQUESTED);
    assertThat(handle.getCancellationToken().isCancellationRequested()).isTrue();
    TaskRecord record = registry.get(handle.getTaskId()).get();
    assertThat(record.getState()).isEqualTo(TaskState.RUNNING);
    assertThat(record.isCancelRequested()).isTrue();

    // 未配合取消的操作仍可正常完成
    assertThat(registry.markCompleted(handle.getTaskId(), "done")).isTrue();
    assertThat(registry.get(handle.getTaskId()).get().getState()).isEqualTo(TaskState.SUCCEEDED);
  }

  @Test
  void cancelUnknownOrTerminalTask() {
    assertThat(registry.requestCancel("nope").getStatus())
        .isEqualTo(CancelResult.Status.NOT_FOUND);

    String id = registry.create(TaskCategory.QUERY, "q").getTaskId();
    registry.markRunning(id);
    registry.markCompleted(id, null);

    CancelResult result = registry.requestCancel(id);
    assertThat(result.getStatus()).isEqualTo(CancelResult.Status.ALREADY_TERMINAL);
    assertThat(result.getMessage()).isEqualTo("Task " + id + " is already succeeded");
  }

  @Test
  void historyIsBoundedAndNewestFirst() {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      String id = registry.create(TaskCategory.QUERY, "q" + i).getTaskId();
      registry.markRunning(id);
      registry.markCompleted(id, i);
      ids.add(id);
    }

    List<TaskRecord> history = registry.listRecentHistory(10);
    assertThat(history).extracting(TaskRecord::getTaskId)
        .containsExactly(ids.get(4), ids.get(3), ids.get(2));
    assertThat(registry.getHistorySize()).isEqualTo(3);
    assertThat(registry.get(ids.get(0))).isEmpty();
    assertThat(registry.requestCancel(ids.get(0)).getStatus())
        .isEqualTo(CancelResult.Status.NOT_FOUND);
  }

  @Test
  void evictedRecordIgnoresLateTransitions() {
    String id = registry.create(TaskCategory.QUERY, "q").getTaskId();
    registry.requestCancel(id);
    for (int i = 0; i < 3; i++) {
      String other = registry.create(TaskCategory.QUERY, "other").getTaskId();
      registry.requestCancel(other);
    }

    assertThat(registry.get(id)).isEmpty();
    assertThat(registry.markRunning(id)).isFalse();
    assertThat(registry.markCancelled(id, "late")).isFalse();
  }

  @Test
  void listActiveIsInCreationOrder() {
    String a = registry.create(TaskCategory.DESKTOP, "a").getTaskId();
    String b = registry.create(TaskCategory.FILE, "b").getTaskId();
    String c = registry.create(TaskCategory.SHELL, "c").getTaskId();
    registry.markRunning(b);

    assertThat(registry.listActive()).extracting(TaskRecord::getTaskId).containsExactly(a, b, c);
    assertThat(registry.getActiveCount()).isEqualTo(3);
  }

  @Test
  void listFiltersByStateNewestCreatedFirst() {
    String a = registry.create(TaskCategory.QUERY, "a").getTaskId();
    String b = registry.create(TaskCategory.QUERY, "b").getTaskId();
    String c = registry.create(TaskCategory.QUERY, "c").getTaskId();
    registry.requestCancel(b);

    assertThat(registry.list(null, 10)).extracting(TaskRecord::getTaskId).containsExactly(c, b, a);
    assertThat(registry.list(TaskState.PENDING, 10))
        .extracting(TaskRecord::getTaskId)
        .containsExactly(c, a);
    assertThat(registry.list(null, 1)).hasSize(1);
  }

  @Test
  void snapshotsAreNotAffectedByLaterWrites() {
    String id = registry.create(TaskCategory.QUERY, "q").getTaskId();
    List<TaskRecord> before = registry.listActive();

    registry.markRunning(id);

    assertThat(before.get(0).getState()).isEqualTo(TaskState.PENDING);
    assertThat(before.stream().map(TaskRecord::getTaskId).collect(Collectors.toList()))
        .containsExactly(id);
  }

  @Test
  void rejectsNonPositiveHistoryCapacity() {
    assertThatThrownBy(() -> new TaskRegistry(0, eventManager))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
