/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 任务模型：类别、状态、记录、错误与取消令牌。 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.task;

import javax.annotation.ParametersAreNonnullByDefault;
