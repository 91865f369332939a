/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 任务执行核心组件。
 *
 * <ul>
 *   <li>{@link io.winremote.taskcore.core.TaskRegistry} - 任务记录与状态迁移
 *   <li>{@link io.winremote.taskcore.core.CategoryGate} - 按类别的准入闸门
 *   <li>{@link io.winremote.taskcore.core.CancelResult} - 取消请求结果
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.core;

import javax.annotation.ParametersAreNonnullByDefault;
