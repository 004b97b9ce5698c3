/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 带乘性抖动的指数退避
 *
 * <p>第 i 次失败（从 0 开始）后的等待时间为 {@code 2^i * baseDelay * random(0, 1) + minDelay}，
 * 默认 baseDelay 为 500ms、minDelay 为 50ms。
 */
public final class JitteredExponentialBackoff implements BackoffPolicy {

  /** 默认基础间隔（毫秒） */
  public static final long DEFAULT_BASE_DELAY_MS = 500;

  /** 默认最小间隔（毫秒） */
  public static final long DEFAULT_MIN_DELAY_MS = 50;

  // 防止 2^i 溢出
  private static final int MAX_EXPONENT = 30;

  private final long baseDelayMs;
  private final long minDelayMs;
  private final DoubleSupplier random;

  /** 使用默认参数创建 */
  public JitteredExponentialBackoff() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MIN_DELAY_MS);
  }

  /**
   * 创建退避计算器
   *
   * @param baseDelayMs 基础间隔（毫秒）
   * @param minDelayMs 最小间隔（毫秒）
   */
  public JitteredExponentialBackoff(long baseDelayMs, long minDelayMs) {
    this(baseDelayMs, minDelayMs, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * 创建退避计算器
   *
   * @param baseDelayMs 基础间隔（毫秒）
   * @param minDelayMs 最小间隔（毫秒）
   * @param random [0, 1) 区间的随机数来源
   */
  public JitteredExponentialBackoff(long baseDelayMs, long minDelayMs, DoubleSupplier random) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0");
    }
    if (minDelayMs < 0) {
      throw new IllegalArgumentException("minDelayMs must be >= 0");
    }
    this.baseDelayMs = baseDelayMs;
    this.minDelayMs = minDelayMs;
    this.random = random;
  }

  @Override
  public long delayMillis(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0");
    }
    double factor = Math.min(Math.max(random.getAsDouble(), 0.0), 1.0);
    double exponential = (double) (1L << Math.min(attempt, MAX_EXPONENT)) * baseDelayMs;
    return (long) (exponential * factor) + minDelayMs;
  }

  public long getBaseDelayMs() {
    return baseDelayMs;
  }

  public long getMinDelayMs() {
    return minDelayMs;
  }

  @Override
  public String toString() {
    return "JitteredExponentialBackoff{"
        + "baseDelayMs="
        + baseDelayMs
        + ", minDelayMs="
        + minDelayMs
        + '}';
  }
}
