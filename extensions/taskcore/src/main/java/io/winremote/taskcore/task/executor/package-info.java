/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 任务执行框架
 *
 * <ul>
 *   <li>{@link io.winremote.taskcore.task.executor.OperationWrapper} - 操作包装器
 *   <li>{@link io.winremote.taskcore.task.executor.TaskOutcome} - 执行结果
 *   <li>{@link io.winremote.taskcore.task.executor.SubmittedTask} - 异步提交句柄
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.task.executor;

import javax.annotation.ParametersAreNonnullByDefault;
