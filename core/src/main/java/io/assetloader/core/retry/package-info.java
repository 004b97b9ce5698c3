/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 重试模块
 *
 * <ul>
 *   <li>{@link io.assetloader.core.retry.Retry} - 异步重试包装器
 *   <li>{@link io.assetloader.core.retry.RetryPolicy} - 尝试次数、退避与可重试条件
 *   <li>{@link io.assetloader.core.retry.JitteredExponentialBackoff} - 带抖动的指数退避
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.assetloader.core.retry;

import javax.annotation.ParametersAreNonnullByDefault;
