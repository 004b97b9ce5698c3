/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/** CompletableFuture 辅助方法 */
public final class Futures {

  private Futures() {}

  /**
   * 剥离 {@link CompletionException} / {@link ExecutionException} 包装
   *
   * @param error 异常
   * @return 原始异常
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * 调用操作，同步抛出的异常转换为失败的 future
   *
   * @param operation 异步操作
   * @param <T> 结果类型
   * @return 操作返回的 stage
   */
  public static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
    try {
      CompletionStage<T> stage = operation.get();
      if (stage == null) {
        return CompletableFuture.failedFuture(
            new NullPointerException("operation returned a null stage"));
      }
      return stage;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
