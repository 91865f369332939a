/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 任务执行核心配置。 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.config;

import javax.annotation.ParametersAreNonnullByDefault;
