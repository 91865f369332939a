/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task;

import java.util.Locale;
import javax.annotation.Nullable;

/**
 * 操作类别
 *
 * <p>每个被提交的操作都属于一个封闭枚举中的类别，类别决定了适用的并发上限：
 * <ul>
 *   <li>{@link #DESKTOP} - 鼠标/键盘/截屏，独占（同一物理输入流不能并发）
 *   <li>{@link #FILE} - 文件系统读写
 *   <li>{@link #QUERY} - 系统查询（进程、注册表、服务等）
 *   <li>{@link #SHELL} - Shell 命令执行
 *   <li>{@link #NETWORK} - 网络探测
 * </ul>
 *
 * <p>未知类别名在提交时直接拒绝，不会回退到任何默认类别。
 */
public enum TaskCategory {
  DESKTOP("desktop", 1),
  FILE("file", 3),
  QUERY("query", 5),
  SHELL("shell", 2),
  NETWORK("network", 3);

  private final String wireName;
  private final int defaultLimit;

  TaskCategory(String wireName, int defaultLimit) {
    this.wireName = wireName;
    this.defaultLimit = defaultLimit;
  }

  /**
   * 获取对外展示的类别名（小写）
   *
   * @return 类别名
   */
  public String getWireName() {
    return wireName;
  }

  /**
   * 获取默认并发上限
   *
   * @return 默认上限
   */
  public int getDefaultLimit() {
    return defaultLimit;
  }

  /**
   * 按名称解析类别（忽略大小写和首尾空白）
   *
   * @param name 类别名
   * @return 类别，未知名称返回 null
   */
  @Nullable
  public static TaskCategory fromName(@Nullable String name) {
    if (name == null) {
      return null;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (TaskCategory category : values()) {
      if (category.wireName.equals(normalized)) {
        return category;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
