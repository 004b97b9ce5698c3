/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.retry;

import io.assetloader.LoaderException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 重试策略
 *
 * <p>默认最多尝试 4 次，使用 {@link JitteredExponentialBackoff}，不重试编程错误和不可恢复的 {@link
 * LoaderException}。
 */
public final class RetryPolicy {

  /** 默认最大尝试次数（包含首次） */
  public static final int DEFAULT_MAX_ATTEMPTS = 4;

  final int maxAttempts;
  final BackoffPolicy backoff;
  final Predicate<Throwable> retryPredicate;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.backoff = builder.backoff;
    this.retryPredicate = builder.retryPredicate;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** 默认策略：4 次尝试，500ms 基础间隔，50ms 最小间隔 */
  public static RetryPolicy defaultPolicy() {
    return builder().build();
  }

  /** 只尝试一次 */
  public static RetryPolicy noRetry() {
    return builder().setMaxAttempts(1).build();
  }

  /**
   * 默认的可重试判断
   *
   * @param error 失败原因
   * @return 是否可以重试
   */
  public static boolean isRetryableByDefault(Throwable error) {
    if (error instanceof LoaderException) {
      return ((LoaderException) error).isRecoverable();
    }
    if (error instanceof Error) {
      return false;
    }
    return !(error instanceof IllegalStateException
        || error instanceof IllegalArgumentException
        || error instanceof NullPointerException);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public BackoffPolicy getBackoff() {
    return backoff;
  }

  public boolean isRetryable(Throwable error) {
    return retryPredicate.test(error);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", backoff=" + backoff + '}';
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private BackoffPolicy backoff = new JitteredExponentialBackoff();
    private Predicate<Throwable> retryPredicate = RetryPolicy::isRetryableByDefault;

    private Builder() {}

    /** 设置最大尝试次数（包含首次） */
    public Builder setMaxAttempts(int maxAttempts) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be >= 1");
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder setBackoff(BackoffPolicy backoff) {
      this.backoff = Objects.requireNonNull(backoff, "backoff");
      return this;
    }

    /** 设置可重试条件 */
    public Builder setRetryPredicate(Predicate<Throwable> retryPredicate) {
      this.retryPredicate = Objects.requireNonNull(retryPredicate, "retryPredicate");
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
