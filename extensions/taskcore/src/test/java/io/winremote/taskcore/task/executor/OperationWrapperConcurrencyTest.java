/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import static org.assertj.core.api.Assertions.assertThat;

import io.winremote.taskcore.core.CategoryGate;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.status.TaskStatusEventManager;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** 多类别混合提交下的并发上限与终态唯一性 */
class OperationWrapperConcurrencyTest {

  private static final int SUBMISSIONS = 400;

  private TaskRegistry registry;
  private CategoryGate gate;
  private ExecutorService executor;
  private OperationWrapper wrapper;
  private final Map<String, AtomicInteger> terminalEvents = new ConcurrentHashMap<>();

  @BeforeEach
  void setUp() {
    TaskStatusEventManager eventManager = new TaskStatusEventManager();
    eventManager.addListener(event -> {
      if (event.isTerminalTransition()) {
        terminalEvents.computeIfAbsent(event.getTaskId(), id -> new AtomicInteger())
            .incrementAndGet();
      }
    });
    registry = new TaskRegistry(SUBMISSIONS, eventManager);
    gate = CategoryGate.withDefaults();
    executor = Executors.newCachedThreadPool();
    wrapper = OperationWrapper.builder()
        .registry(registry)
        .gate(gate)
        .asyncExecutor(executor)
        .build();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void mixedSubmissionsRespectCeilingsAndTerminateExactlyOnce() throws Exception {
    Random random = new Random(42);
    TaskCategory[] categories = TaskCategory.values();
    ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
    List<SubmittedTask<Integer>> submitted = new ArrayList<>();

    for (int i = 0; i < SUBMISSIONS; i++) {
      TaskCategory category = categories[random.nextInt(categories.length)];
      boolean fails = random.nextInt(10) == 0;
      int sleepMillis = random.nextInt(5);
      int index = i;
      submitted.add(wrapper.submit(category, "Op-" + i, token -> {
        long running = countRunning(category);
        if (running > gate.getCapacity(category)) {
          violations.add(category + " running=" + running);
        }
        if (gate.getInUse(category) > gate.getCapacity(category)) {
          violations.add(category + " inUse=" + gate.getInUse(category));
        }
        Thread.sleep(sleepMillis);
        token.throwIfCancellationRequested();
        if (fails) {
          throw new OperationFailedException("BROKEN", "op " + index + " failed");
        }
        return index;
      }));

      if (random.nextInt(5) == 0) {
        String victim = submitted.get(random.nextInt(submitted.size())).getTaskId();
        registry.requestCancel(victim);
      }
    }

    for (SubmittedTask<Integer> task : submitted) {
      TaskOutcome<Integer> outcome = task.getOutcome().get(60, TimeUnit.SECONDS);
      assertThat(outcome.getState().isTerminal()).isTrue();
      assertThat(outcome.getTaskId()).isEqualTo(task.getTaskId());
    }

    assertThat(violations).isEmpty();
    for (SubmittedTask<Integer> task : submitted) {
      AtomicInteger count = terminalEvents.get(task.getTaskId());
      assertThat(count).as("terminal events for %s", task.getTaskId()).isNotNull();
      assertThat(count.get()).as("terminal events for %s", task.getTaskId()).isEqualTo(1);
    }
    assertThat(terminalEvents).hasSize(SUBMISSIONS);
    assertThat(registry.getActiveCount()).isZero();
    for (TaskCategory category : categories) {
      assertThat(gate.getInUse(category)).isZero();
      assertThat(gate.getWaiting(category)).isZero();
    }
  }

  private long countRunning(TaskCategory category) {
    long running = 0;
    for (TaskRecord record : registry.listActive()) {
      if (record.getCategory() == category && record.getState() == TaskState.RUNNING) {
        running++;
      }
    }
    return running;
  }
}
