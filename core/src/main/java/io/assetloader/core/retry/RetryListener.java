/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.retry;

/** 重试监听器 */
public interface RetryListener {

  /** 不做任何处理的监听器 */
  RetryListener NOOP = (attempt, error, willRetry) -> {};

  /**
   * 某次尝试失败时调用
   *
   * @param attempt 当前尝试序号（从 0 开始）
   * @param error 失败原因
   * @param willRetry 是否会继续重试
   */
  void onRetryAttempt(int attempt, Throwable error, boolean willRetry);

  /**
   * 进入退避等待前调用
   *
   * @param attempt 刚失败的尝试序号（从 0 开始）
   * @param delayMillis 等待时间（毫秒）
   */
  default void onBackoff(int attempt, long delayMillis) {}

  /**
   * 重试后成功时调用
   *
   * @param totalAttempts 总尝试次数
   */
  default void onRetrySuccess(int totalAttempts) {}
}
