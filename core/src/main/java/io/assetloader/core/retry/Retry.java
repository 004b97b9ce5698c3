/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.retry;

import io.assetloader.core.Futures;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 异步重试包装器
 *
 * <p>为任意可能失败的异步操作提供有限次数的重试：
 *
 * <ul>
 *   <li>失败后若已取消，立即抛出原始错误，不再重试
 *   <li>退避等待中被取消时立即执行最后一次尝试，操作应返回取消错误
 *   <li>否则按 {@link BackoffPolicy} 等待后重试，等待由调度器完成，不阻塞线程
 *   <li>尝试次数耗尽后抛出最后一次的错误
 * </ul>
 *
 * <p>每个实例只包装一个操作，不在多个操作间复用。
 */
public final class Retry {

  private static final Logger logger = Logger.getLogger(Retry.class.getName());

  private final RetryPolicy policy;
  private final ScheduledExecutorService scheduler;
  private final String description;
  private final RetryListener listener;
  private final AtomicBoolean aborted = new AtomicBoolean(false);
  private final AtomicInteger attempt = new AtomicInteger(0);
  private final AtomicReference<Runnable> pendingRetry = new AtomicReference<>();
  @Nullable private volatile ScheduledFuture<?> backoff;

  /**
   * 创建重试包装器
   *
   * @param policy 重试策略
   * @param scheduler 用于退避等待的调度器
   * @param description 操作描述，用于日志，例如 "download https://..."
   */
  public Retry(RetryPolicy policy, ScheduledExecutorService scheduler, String description) {
    this(policy, scheduler, description, RetryListener.NOOP);
  }

  /**
   * 创建重试包装器
   *
   * @param policy 重试策略
   * @param scheduler 用于退避等待的调度器
   * @param description 操作描述，用于日志
   * @param listener 重试监听器
   */
  public Retry(
      RetryPolicy policy,
      ScheduledExecutorService scheduler,
      String description,
      RetryListener listener) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.description = Objects.requireNonNull(description, "description");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * 执行带重试的操作
   *
   * @param operation 每次尝试时调用，返回本次尝试的结果
   * @param <T> 结果类型
   * @return 最终结果
   */
  public <T> CompletableFuture<T> attempt(Supplier<? extends CompletionStage<T>> operation) {
    CompletableFuture<T> result = new CompletableFuture<>();
    runAttempt(operation, 0, result);
    return result;
  }

  private <T> void runAttempt(
      Supplier<? extends CompletionStage<T>> operation, int index, CompletableFuture<T> result) {
    attempt.set(index + 1);
    Futures.invoke(operation)
        .whenComplete(
            (value, error) -> {
              if (error == null) {
                if (index > 0) {
                  listener.onRetrySuccess(index + 1);
                }
                result.complete(value);
                return;
              }
              onAttemptFailed(operation, index, Futures.unwrap(error), result);
            });
  }

  private <T> void onAttemptFailed(
      Supplier<? extends CompletionStage<T>> operation,
      int index,
      Throwable error,
      CompletableFuture<T> result) {
    if (aborted.get()) {
      result.completeExceptionally(error);
      return;
    }

    boolean willRetry = index + 1 < policy.getMaxAttempts() && policy.isRetryable(error);
    listener.onRetryAttempt(index, error, willRetry);
    if (!willRetry) {
      result.completeExceptionally(error);
      return;
    }

    long delayMs = policy.getBackoff().delayMillis(index);
    logger.log(
        Level.WARNING,
        "Attempt #{0} to {1} failed, trying again in {2}ms: {3}",
        new Object[] {index + 1, description, delayMs, error.getMessage()});
    listener.onBackoff(index, delayMs);

    Runnable retry = () -> runAttempt(operation, index + 1, result);
    pendingRetry.set(retry);
    try {
      backoff =
          scheduler.schedule(
              () -> {
                if (pendingRetry.compareAndSet(retry, null)) {
                  retry.run();
                }
              },
              delayMs,
              TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      if (pendingRetry.compareAndSet(retry, null)) {
        error.addSuppressed(e);
        result.completeExceptionally(error);
      }
      return;
    }
    // abort() 可能发生在登记之前
    if (aborted.get()) {
      retryNow();
    }
  }

  // 结束等待并立即执行下一次尝试
  private void retryNow() {
    Runnable retry = pendingRetry.getAndSet(null);
    if (retry == null) {
      return;
    }
    ScheduledFuture<?> sleeping = backoff;
    if (sleeping != null) {
      sleeping.cancel(false);
    }
    retry.run();
  }

  /**
   * 取消后续重试
   *
   * <p>不会中断正在进行的尝试，其失败将直接返回。若正处于退避等待中，则结束等待并立即执行最后一次尝试，由操作自身给出取消错误。幂等。
   */
  public void abort() {
    aborted.set(true);
    retryNow();
  }

  public boolean isAborted() {
    return aborted.get();
  }

  /**
   * 当前尝试次数
   *
   * @return 已开始的尝试次数，尚未开始时为 0
   */
  public int getAttempt() {
    return attempt.get();
  }

  public String getDescription() {
    return description;
  }

  public RetryPolicy getPolicy() {
    return policy;
  }
}
