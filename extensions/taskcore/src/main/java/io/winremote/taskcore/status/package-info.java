/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 任务状态查询与控制操作
 *
 * <p>{@link io.winremote.taskcore.status.TaskControlService} 提供 CancelTask / GetTaskStatus /
 * GetRunningTasks 三个控制操作。
 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.status;

import javax.annotation.ParametersAreNonnullByDefault;
