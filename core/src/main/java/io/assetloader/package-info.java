/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * Asset Loader
 *
 * <p>异步资源加载核心，包括：
 *
 * <ul>
 *   <li>网络/图片/任意异步操作的统一任务抽象
 *   <li>带抖动的指数退避重试
 *   <li>全局并发上限控制
 *   <li>多任务进度聚合与取消
 * </ul>
 *
 * <p>入口为 {@link io.assetloader.LoaderRuntime}，它在启动时创建一次，并把共享的
 * {@link io.assetloader.core.throttle.Throttler} 传给所有网络与图片任务。
 *
 * @see io.assetloader.core.Loader
 */
@ParametersAreNonnullByDefault
package io.assetloader;

import javax.annotation.ParametersAreNonnullByDefault;
