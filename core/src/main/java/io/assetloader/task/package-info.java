/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 具体任务类型
 *
 * <ul>
 *   <li>{@link io.assetloader.task.RequestTask} - 可报告进度的网络请求
 *   <li>{@link io.assetloader.task.ImageTask} - 图片获取与解码
 *   <li>{@link io.assetloader.task.ManualTask} - 外部标记完成
 *   <li>{@link io.assetloader.task.PassThroughTask} - 包装已有的异步操作
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.assetloader.task;

import javax.annotation.ParametersAreNonnullByDefault;
