/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.tools;

import io.winremote.taskcore.task.CancellationToken;
import java.util.Map;

/**
 * 工具实现
 *
 * <p>返回字符串时会在文本结果前加上 {@code [task:<id>]} 前缀。
 */
@FunctionalInterface
public interface ToolHandler {

  /**
   * 执行工具
   *
   * @param arguments 调用参数
   * @param token 当前任务的取消令牌
   * @return 结果
   * @throws Exception 工具执行失败
   */
  Object call(Map<String, Object> arguments, CancellationToken token) throws Exception;
}
