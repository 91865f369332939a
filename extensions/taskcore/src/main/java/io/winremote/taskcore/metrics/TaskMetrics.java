/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.winremote.taskcore.task.TaskCategory;
import io.winremote.taskcore.task.TaskState;
import io.winremote.taskcore.task.status.TaskStatusEvent;
import io.winremote.taskcore.task.status.TaskStatusEventManager.TaskStatusEventListener;

/**
 * 任务指标
 *
 * <p>由状态事件驱动：
 * <ul>
 *   <li>{@code winremote.task.submitted}：按类别统计提交数
 *   <li>{@code winremote.task.completed}：按类别和终态统计完成数
 *   <li>{@code winremote.task.active}：当前活跃（PENDING / RUNNING）任务数
 *   <li>{@code winremote.task.admission.wait}：准入等待时间（毫秒）
 * </ul>
 */
public final class TaskMetrics implements TaskStatusEventListener {

  public static final String INSTRUMENTATION_SCOPE = "io.winremote.taskcore";

  static final AttributeKey<String> CATEGORY = AttributeKey.stringKey("category");
  static final AttributeKey<String> STATE = AttributeKey.stringKey("state");

  private final LongCounter submitted;
  private final LongCounter completed;
  private final LongUpDownCounter active;
  private final DoubleHistogram admissionWait;

  public TaskMetrics(MeterProvider meterProvider) {
    Meter meter = meterProvider.get(INSTRUMENTATION_SCOPE);
    this.submitted = meter.counterBuilder("winremote.task.submitted")
        .setDescription("Number of tasks submitted")
        .setUnit("{task}")
        .build();
    this.completed = meter.counterBuilder("winremote.task.completed")
        .setDescription("Number of tasks that reached a terminal state")
        .setUnit("{task}")
        .build();
    this.active = meter.upDownCounterBuilder("winremote.task.active")
        .setDescription("Number of pending or running tasks")
        .setUnit("{task}")
        .build();
    this.admissionWait = meter.histogramBuilder("winremote.task.admission.wait")
        .setDescription("Time spent waiting for a category slot")
        .setUnit("ms")
        .build();
  }

  /** 不输出任何数据 */
  public static TaskMetrics noop() {
    return new TaskMetrics(MeterProvider.noop());
  }

  @Override
  public void onEvent(TaskStatusEvent event) {
    Attributes categoryOnly = Attributes.of(CATEGORY, event.getCategory().getWireName());
    switch (event.getKind()) {
      case CREATED:
        submitted.add(1, categoryOnly);
        active.add(1, categoryOnly);
        break;
      case TRANSITION:
        if (event.isTerminalTransition()) {
          active.add(-1, categoryOnly);
          completed.add(1, Attributes.of(
              CATEGORY, event.getCategory().getWireName(),
              STATE, event.getState().getWireName()));
        }
        break;
      default:
        break;
    }
  }

  /**
   * 记录准入等待时间
   *
   * @param category 类别
   * @param waitedMillis 等待毫秒数
   * @param outcome 准入结果，成功时为 RUNNING
   */
  public void recordAdmissionWait(TaskCategory category, double waitedMillis, TaskState outcome) {
    admissionWait.record(waitedMillis, Attributes.of(
        CATEGORY, category.getWireName(),
        STATE, outcome.getWireName()));
  }
}
