/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 工具注册与分发。 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore.tools;

import javax.annotation.ParametersAreNonnullByDefault;
