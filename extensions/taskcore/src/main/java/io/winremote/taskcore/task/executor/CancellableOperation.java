/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.winremote.taskcore.task.executor;

import io.winremote.taskcore.task.CancellationToken;

/**
 * 配合取消的操作
 *
 * <p>执行期间可以轮询 {@link CancellationToken#throwIfCancellationRequested()}，
 * 以便运行中的任务在收到取消请求后以 CANCELLED 结束。
 *
 * @param <T> 结果类型
 */
@FunctionalInterface
public interface CancellableOperation<T> {

  /**
   * 执行操作
   *
   * @param token 当前任务的取消令牌
   * @return 结果
   * @throws Exception 操作失败
   */
  T run(CancellationToken token) throws Exception;
}
