/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 加载核心
 *
 * <ul>
 *   <li>{@link io.assetloader.core.Task} - 任务能力契约
 *   <li>{@link io.assetloader.core.Loader} - 任务聚合与进度计算
 *   <li>{@link io.assetloader.core.retry.Retry} - 退避重试
 *   <li>{@link io.assetloader.core.throttle.Throttler} - 并发上限控制
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.assetloader.core;

import javax.annotation.ParametersAreNonnullByDefault;
