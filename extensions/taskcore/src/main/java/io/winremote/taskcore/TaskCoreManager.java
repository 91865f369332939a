/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore;

import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.winremote.taskcore.config.TaskCoreConfig;
import io.winremote.taskcore.core.CategoryGate;
import io.winremote.taskcore.core.TaskRegistry;
import io.winremote.taskcore.metrics.TaskMetrics;
import io.winremote.taskcore.status.TaskControlService;
import io.winremote.taskcore.status.TaskStatusReporter;
import io.winremote.taskcore.task.TaskLifecycleLogger;
import io.winremote.taskcore.task.TaskRecord;
import io.winremote.taskcore.task.executor.OperationWrapper;
import io.winremote.taskcore.task.status.TaskStatusEventManager;
import io.winremote.taskcore.tools.ToolRegistry;
import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Owns every component of the task execution core.
 *
 * <p>Each instance has its own registry, gate and history; nothing is shared between instances.
 */
public final class TaskCoreManager implements Closeable {

  private static final Logger logger = Logger.getLogger(TaskCoreManager.class.getName());

  private final TaskCoreConfig config;
  private final TaskStatusEventManager eventManager;
  private final TaskRegistry registry;
  private final CategoryGate gate;
  private final TaskLifecycleLogger lifecycleLogger;
  private final TaskMetrics metrics;
  private final OperationWrapper wrapper;
  private final TaskStatusReporter reporter;
  private final TaskControlService controlService;
  private final ToolRegistry toolRegistry;
  private final ExecutorService asyncExecutor;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicInteger threadCounter = new AtomicInteger();

  private TaskCoreManager(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config is required");
    this.eventManager = new TaskStatusEventManager();
    this.registry = new TaskRegistry(config.getHistoryCapacity(), eventManager);
    this.gate = new CategoryGate(config.getCategoryLimits());

    this.lifecycleLogger = new TaskLifecycleLogger(config.getLogResultMaxLength());
    this.metrics = new TaskMetrics(builder.meterProvider);
    eventManager.addListener(lifecycleLogger);
    eventManager.addListener(metrics);

    this.asyncExecutor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "winremote-task-executor-" + threadCounter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });

    this.wrapper = OperationWrapper.builder()
        .registry(registry)
        .gate(gate)
        .admissionTimeout(config.getAdmissionTimeout())
        .lifecycleLogger(lifecycleLogger)
        .metrics(metrics)
        .asyncExecutor(asyncExecutor)
        .build();
    this.reporter = new TaskStatusReporter(registry);
    this.controlService = new TaskControlService(registry, reporter);
    this.toolRegistry = new ToolRegistry(wrapper, controlService);

    logger.log(Level.INFO, "Task core initialized: {0}", config);
  }

  /**
   * Creates a manager from autoconfigure properties, with no-op metrics.
   *
   * @param properties the config properties
   * @return the manager
   */
  public static TaskCoreManager create(ConfigProperties properties) {
    return builder().setConfig(TaskCoreConfig.create(properties)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public TaskCoreConfig getConfig() {
    return config;
  }

  public TaskRegistry getRegistry() {
    return registry;
  }

  public CategoryGate getGate() {
    return gate;
  }

  public OperationWrapper getWrapper() {
    return wrapper;
  }

  public TaskStatusReporter getReporter() {
    return reporter;
  }

  public TaskControlService getControlService() {
    return controlService;
  }

  public ToolRegistry getToolRegistry() {
    return toolRegistry;
  }

  public TaskLifecycleLogger getLifecycleLogger() {
    return lifecycleLogger;
  }

  public TaskStatusEventManager getEventManager() {
    return eventManager;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Rejects further submissions, sync and async, requests cancellation of every active task and waits
   * briefly for the async pool to drain.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.log(Level.INFO, "Closing task core...");

    wrapper.shutdown();
    asyncExecutor.shutdown();
    for (TaskRecord record : registry.listActive()) {
      registry.requestCancel(record.getTaskId());
    }
    try {
      if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        asyncExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      asyncExecutor.shutdownNow();
    }

    logger.log(Level.INFO, "Task core closed");
  }

  /** Builder for {@link TaskCoreManager}. */
  public static final class Builder {
    @Nullable private TaskCoreConfig config;
    private MeterProvider meterProvider = MeterProvider.noop();

    private Builder() {}

    public Builder setConfig(TaskCoreConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the meter provider used for task metrics.
     *
     * @param meterProvider the meter provider
     * @return this builder
     */
    public Builder setMeterProvider(MeterProvider meterProvider) {
      this.meterProvider = meterProvider;
      return this;
    }

    public TaskCoreManager build() {
      if (config == null) {
        config = TaskCoreConfig.defaults();
      }
      return new TaskCoreManager(this);
    }
  }
}
