/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.opentelemetry.sdk.autoconfigure.spi.internal.DefaultConfigProperties;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.executor.SubmissionRejectedException;
import io.winremote.taskcore.task.executor.SubmittedTask;
import io.winremote.taskcore.task.executor.TaskOutcome;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskCoreManagerTest {

  private TaskCoreManager manager;

  @BeforeEach
  void setUp() {
    Map<String, String> props = new HashMap<>();
    props.put("winremote.task.category.limits", "query=2");
    props.put("winremote.task.history.capacity", "10");
    manager = TaskCoreManager.create(DefaultConfigProperties.createFromMap(props));
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  @Test
  void wiresConfigIntoComponents() {
    assertThat(manager.getGate().getCapacity(TaskCategory.QUERY)).isEqualTo(2);
    assertThat(manager.getGate().getCapacity(TaskCategory.DESKTOP)).isEqualTo(1);
    assertThat(manager.getRegistry().getHistoryCapacity()).isEqualTo(10);
    // 生命周期日志与指标
    assertThat(manager.getEventManager().getListenerCount()).isEqualTo(2);
  }

  @Test
  void toolInvocationEndToEnd() {
    manager.getToolRegistry().register("GetClipboard", (args, token) -> "copied");

    TaskOutcome<Object> outcome =
        manager.getToolRegistry().invoke("GetClipboard", Collections.emptyMap());

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(manager.getControlService().getTaskStatus(outcome.getTaskId()))
        .map(TaskRecord::getState)
        .contains(TaskState.SUCCEEDED);
  }

  @Test
  void closeCancelsQueuedTasks() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    manager.getToolRegistry().register("Snapshot", (args, token) -> {
      release.await(5, TimeUnit.SECONDS);
      return "shot";
    });
    manager.getToolRegistry().register("Click", (args, token) -> "clicked");

    SubmittedTask<Object> running =
        manager.getToolRegistry().invokeAsync("Snapshot", Collections.emptyMap());
    await().atMost(Duration.ofSeconds(2)).until(
        () -> manager.getGate().getInUse(TaskCategory.DESKTOP) == 1);
    SubmittedTask<Object> queued =
        manager.getToolRegistry().invokeAsync("Click", Collections.emptyMap());
    await().atMost(Duration.ofSeconds(2)).until(
        () -> manager.getGate().getWaiting(TaskCategory.DESKTOP) == 1);

    Thread closer = new Thread(manager::close);
    closer.start();

    assertThat(queued.getOutcome().get(5, TimeUnit.SECONDS).getState())
        .isEqualTo(TaskState.CANCELLED);
    release.countDown();
    closer.join(TimeUnit.SECONDS.toMillis(10));

    assertThat(manager.isClosed()).isTrue();
    // 未配合取消的运行中任务正常完成
    assertThat(running.getOutcome().get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
  }

  @Test
  void syncInvocationIsRejectedAfterClose() {
    manager.getToolRegistry().register("GetClipboard", (args, token) -> "copied");
    manager.close();

    assertThatThrownBy(
            () -> manager.getToolRegistry().invoke("GetClipboard", Collections.emptyMap()))
        .isInstanceOfSatisfying(
            SubmissionRejectedException.class,
            e -> assertThat(e.getReason()).isEqualTo(SubmissionRejectedException.Reason.CLOSED));
    assertThat(manager.getRegistry().list(null, 10)).isEmpty();
  }

  @Test
  void poolThreadsHaveDistinctNames() throws Exception {
    Set<String> threadNames = ConcurrentHashMap.newKeySet();
    CountDownLatch bothStarted = new CountDownLatch(2);
    manager.getToolRegistry().register("ListProcesses", (args, token) -> {
      threadNames.add(Thread.currentThread().getName());
      bothStarted.countDown();
      return bothStarted.await(5, TimeUnit.SECONDS);
    });

    SubmittedTask<Object> first =
        manager.getToolRegistry().invokeAsync("ListProcesses", Collections.emptyMap());
    SubmittedTask<Object> second =
        manager.getToolRegistry().invokeAsync("ListProcesses", Collections.emptyMap());

    assertThat(first.getOutcome().get(5, TimeUnit.SECONDS).getResult()).isEqualTo(true);
    assertThat(second.getOutcome().get(5, TimeUnit.SECONDS).getResult()).isEqualTo(true);
    assertThat(threadNames).hasSize(2)
        .allMatch(name -> name.startsWith("winremote-task-executor-"));
  }
}
