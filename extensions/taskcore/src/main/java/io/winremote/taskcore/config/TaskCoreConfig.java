/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.winremote.taskcore.task.TaskCategory;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务执行核心配置
 *
 * <p>支持的配置项（系统属性或环境变量）：
 * <ul>
 *   <li>{@code winremote.task.category.limits}：类别并发上限，如 {@code desktop=1,shell=2}，
 *       未列出的类别使用默认值
 *   <li>{@code winremote.task.history.capacity}：终态历史容量，默认 100
 *   <li>{@code winremote.task.admission.timeout}：准入等待上限，默认 0（无限等待），设为正值（如 30s）后启用超时
 *   <li>{@code winremote.task.log.result.max.length}：结果日志最大长度，默认 500
 * </ul>
 */
public final class TaskCoreConfig {

  private static final Logger logger = Logger.getLogger(TaskCoreConfig.class.getName());

  // ===== 配置键常量 =====
  static final String CATEGORY_LIMITS = "winremote.task.category.limits";
  static final String HISTORY_CAPACITY = "winremote.task.history.capacity";
  static final String ADMISSION_TIMEOUT = "winremote.task.admission.timeout";
  static final String LOG_RESULT_MAX_LENGTH = "winremote.task.log.result.max.length";

  // ===== 默认值常量 =====
  private static final int DEFAULT_HISTORY_CAPACITY = 100;
  private static final Duration DEFAULT_ADMISSION_TIMEOUT = Duration.ZERO;
  private static final int DEFAULT_LOG_RESULT_MAX_LENGTH = 500;

  private final Map<TaskCategory, Integer> categoryLimits;
  private final int historyCapacity;
  private final Duration admissionTimeout;
  private final int logResultMaxLength;

  private TaskCoreConfig(Builder builder) {
    this.categoryLimits = Collections.unmodifiableMap(new EnumMap<>(builder.categoryLimits));
    this.historyCapacity = builder.historyCapacity;
    this.admissionTimeout = builder.admissionTimeout;
    this.logResultMaxLength = builder.logResultMaxLength;
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 配置实例
   * @throws IllegalArgumentException 配置值非法
   */
  public static TaskCoreConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /** 全部使用默认值 */
  public static TaskCoreConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ===== Getters =====

  /** 每个类别都有值 */
  public Map<TaskCategory, Integer> getCategoryLimits() {
    return categoryLimits;
  }

  public int getCategoryLimit(TaskCategory category) {
    return categoryLimits.get(category);
  }

  public int getHistoryCapacity() {
    return historyCapacity;
  }

  public Duration getAdmissionTimeout() {
    return admissionTimeout;
  }

  public boolean isAdmissionTimeoutBounded() {
    return !admissionTimeout.isZero();
  }

  public int getLogResultMaxLength() {
    return logResultMaxLength;
  }

  @Override
  public String toString() {
    return "TaskCoreConfig{"
        + "categoryLimits=" + categoryLimits
        + ", historyCapacity=" + historyCapacity
        + ", admissionTimeout=" + admissionTimeout
        + ", logResultMaxLength=" + logResultMaxLength
        + '}';
  }

  /** 构建器 */
  public static final class Builder {
    private final Map<TaskCategory, Integer> categoryLimits = new EnumMap<>(TaskCategory.class);
    private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
    private Duration admissionTimeout = DEFAULT_ADMISSION_TIMEOUT;
    private int logResultMaxLength = DEFAULT_LOG_RESULT_MAX_LENGTH;

    private Builder() {
      for (TaskCategory category : TaskCategory.values()) {
        categoryLimits.put(category, category.getDefaultLimit());
      }
    }

    /**
     * 从 ConfigProperties 读取配置
     *
     * @param properties 配置属性
     * @return this
     * @throws IllegalArgumentException 类别名称未知或上限不是整数
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      Map<String, String> limits = properties.getMap(CATEGORY_LIMITS);
      for (Map.Entry<String, String> entry : limits.entrySet()) {
        TaskCategory category = TaskCategory.fromName(entry.getKey());
        if (category == null) {
          throw new IllegalArgumentException(
              "Unknown task category in " + CATEGORY_LIMITS + ": " + entry.getKey());
        }
        setCategoryLimit(category, parseLimit(entry.getKey(), entry.getValue()));
      }
      this.historyCapacity = properties.getInt(HISTORY_CAPACITY, historyCapacity);
      this.admissionTimeout = properties.getDuration(ADMISSION_TIMEOUT, admissionTimeout);
      this.logResultMaxLength = properties.getInt(LOG_RESULT_MAX_LENGTH, logResultMaxLength);

      if (!limits.isEmpty()) {
        logger.log(Level.INFO, "Task category limits overridden: {0}", categoryLimits);
      }
      return this;
    }

    public Builder setCategoryLimit(TaskCategory category, int limit) {
      categoryLimits.put(category, limit);
      return this;
    }

    public Builder setHistoryCapacity(int historyCapacity) {
      this.historyCapacity = historyCapacity;
      return this;
    }

    public Builder setAdmissionTimeout(Duration admissionTimeout) {
      this.admissionTimeout = admissionTimeout;
      return this;
    }

    public Builder setLogResultMaxLength(int logResultMaxLength) {
      this.logResultMaxLength = logResultMaxLength;
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     * @throws IllegalArgumentException 配置值非法
     */
    public TaskCoreConfig build() {
      validate();
      return new TaskCoreConfig(this);
    }

    private void validate() {
      for (Map.Entry<TaskCategory, Integer> entry : categoryLimits.entrySet()) {
        if (entry.getValue() <= 0) {
          throw new IllegalArgumentException(
              "Concurrency limit for category " + entry.getKey() + " must be positive: "
                  + entry.getValue());
        }
      }
      if (historyCapacity <= 0) {
        throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
      }
      if (admissionTimeout.isNegative()) {
        throw new IllegalArgumentException("admissionTimeout must not be negative");
      }
      if (logResultMaxLength <= 0) {
        throw new IllegalArgumentException(
            "logResultMaxLength must be positive: " + logResultMaxLength);
      }
    }

    private static int parseLimit(String category, String value) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Invalid concurrency limit for category " + category + ": " + value, e);
      }
    }
  }
}
