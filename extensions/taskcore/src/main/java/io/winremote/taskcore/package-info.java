/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * winremote 任务执行核心
 *
 * <p>在按类别限流的前提下执行异构的阻塞操作，提供统一的提交、追踪与取消能力：
 *
 * <ul>
 *   <li>任务身份分配与生命周期追踪
 *   <li>按类别的并发上限与 FIFO 准入
 *   <li>协作式取消
 *   <li>操作失败隔离
 * </ul>
 *
 * @see io.winremote.taskcore.TaskCoreManager
 */
@ParametersAreNonnullByDefault
package io.winremote.taskcore;

import javax.annotation.ParametersAreNonnullByDefault;
