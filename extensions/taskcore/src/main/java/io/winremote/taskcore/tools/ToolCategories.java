/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.tools;

import io.winremote.taskcore.task.TaskCategory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** 内置工具的默认类别 */
public final class ToolCategories {

  private static final Map<String, TaskCategory> DEFAULTS;

  static {
    Map<String, TaskCategory> map = new LinkedHashMap<>();
    // 桌面交互：鼠标、键盘、截屏，独占
    put(map, TaskCategory.DESKTOP,
        "Snapshot", "AnnotatedSnapshot", "Click", "Type", "Scroll", "Move", "Shortcut",
        "FocusWindow", "MinimizeAll", "App", "OCR", "ScreenRecord", "LockScreen", "Wait");
    put(map, TaskCategory.FILE,
        "FileRead", "FileWrite", "FileList", "FileSearch", "FileDownload", "FileUpload");
    put(map, TaskCategory.QUERY,
        "GetSystemInfo", "GetClipboard", "SetClipboard", "ListProcesses", "KillProcess",
        "Notification", "RegRead", "RegWrite", "ServiceList", "ServiceStart", "ServiceStop",
        "TaskList", "TaskCreate", "TaskDelete", "EventLog");
    put(map, TaskCategory.SHELL, "Shell", "Scrape");
    put(map, TaskCategory.NETWORK, "Ping", "PortCheck", "NetConnections");
    DEFAULTS = Collections.unmodifiableMap(map);
  }

  private ToolCategories() {}

  /**
   * 查询工具的默认类别
   *
   * @param toolName 工具名称
   * @return 类别，未内置的工具返回 null
   */
  @Nullable
  public static TaskCategory categoryOf(String toolName) {
    return DEFAULTS.get(toolName);
  }

  public static Map<String, TaskCategory> defaults() {
    return DEFAULTS;
  }

  private static void put(Map<String, TaskCategory> map, TaskCategory category, String... tools) {
    for (String tool : tools) {
      map.put(tool, category);
    }
  }
}
