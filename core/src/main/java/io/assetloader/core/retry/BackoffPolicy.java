/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.retry;

/** 退避策略：根据失败次数计算下一次重试前的等待时间 */
@FunctionalInterface
public interface BackoffPolicy {

  /**
   * 计算退避时间
   *
   * @param attempt 已失败的尝试序号（从 0 开始）
   * @return 等待时间（毫秒）
   */
  long delayMillis(int attempt);
}
