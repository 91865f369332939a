/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.status;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskError;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.status.TaskStatusEventManager;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskStatusReporterTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private TaskRegistry registry;
  private TaskStatusReporter reporter;

  @BeforeEach
  void setUp() {
    registry = new TaskRegistry(5, new TaskStatusEventManager());
    reporter = new TaskStatusReporter(registry);
  }

  @Test
  void historyIsCappedAtCapacityNewestFirst() {
    for (int i = 0; i < 8; i++) {
      String id = registry.create(TaskCategory.QUERY, "q" + i).getTaskId();
      registry.markRunning(id);
      registry.markCompleted(id, null);
    }

    List<TaskRecord> history = reporter.getTaskStatus();

    assertThat(history).hasSize(5);
    assertThat(history).extracting(TaskRecord::getOperationName)
        .containsExactly("q7", "q6", "q5", "q4", "q3");
  }

  @Test
  void runningTasksNeverContainTerminalRecords() {
    String done = registry.create(TaskCategory.FILE, "FileRead").getTaskId();
    registry.markRunning(done);
    registry.markCompleted(done, "x");
    String running = registry.create(TaskCategory.FILE, "FileWrite").getTaskId();
    registry.markRunning(running);
    String pending = registry.create(TaskCategory.FILE, "FileList").getTaskId();

    assertThat(reporter.getRunningTasks())
        .extracting(TaskRecord::getTaskId)
        .containsExactly(running, pending);
    assertThat(reporter.getRunningTasks()).noneMatch(TaskRecord::isTerminal);
  }

  @Test
  void jsonViewUsesSnakeCaseFields() throws Exception {
    String id = registry.create(TaskCategory.SHELL, "Shell").getTaskId();
    registry.markRunning(id);
    registry.markFailed(id, TaskError.of(TaskError.OPERATION_FAILED, "exit code 1"));

    JsonNode json = MAPPER.readTree(TaskStatusReporter.toJson(registry.get(id).get()));

    assertThat(json.get("task_id").asText()).isEqualTo(id);
    assertThat(json.get("tool_name").asText()).isEqualTo("Shell");
    assertThat(json.get("category").asText()).isEqualTo("shell");
    assertThat(json.get("status").asText()).isEqualTo("failed");
    assertThat(json.get("duration").isNumber()).isTrue();
    assertThat(json.get("error").asText()).isEqualTo("exit code 1");
  }

  @Test
  void pendingTaskHasNullDuration() throws Exception {
    String id = registry.create(TaskCategory.DESKTOP, "Click").getTaskId();

    JsonNode json = MAPPER.readTree(TaskStatusReporter.toJson(registry.get(id).get()));

    assertThat(json.get("duration").isNull()).isTrue();
    assertThat(json.get("error").isNull()).isTrue();
    assertThat(json.get("status").asText()).isEqualTo("pending");
  }

  @Test
  void durationIsRoundedToHundredths() {
    TaskRecord record = TaskRecord.builder()
        .taskId("abc")
        .operationName("Wait")
        .category(TaskCategory.DESKTOP)
        .state(TaskState.SUCCEEDED)
        .startedAtMillis(1_000L)
        .completedAtMillis(2_257L)
        .build();

    assertThat(TaskView.from(record).getDuration()).isEqualTo(1.26);
  }

  @Test
  void emptySummaries() {
    assertThat(reporter.describeHistory()).isEqualTo("No tasks in history.");
    assertThat(reporter.describeRunning()).isEqualTo("No active tasks.");
  }

  @Test
  void summariesListTasks() {
    String failed = registry.create(TaskCategory.SHELL, "Shell").getTaskId();
    registry.markRunning(failed);
    registry.markFailed(failed, TaskError.of(TaskError.OPERATION_FAILED, "denied"));
    String pending = registry.create(TaskCategory.DESKTOP, "Click").getTaskId();

    assertThat(reporter.describeHistory())
        .startsWith("Recent tasks:")
        .contains("[" + failed + "] Shell -> failed")
        .contains(" - denied");
    assertThat(reporter.describeRunning())
        .startsWith("Active tasks (1):")
        .contains("[" + pending + "] Click [desktop] pending");
  }
}
