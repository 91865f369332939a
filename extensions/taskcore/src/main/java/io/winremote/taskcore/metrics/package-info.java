/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 基于 OpenTelemetry API 的任务指标。 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.metrics;

import javax.annotation.ParametersAreNonnullByDefault;
