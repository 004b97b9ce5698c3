/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core.throttle;

import io.assetloader.core.Futures;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 并发上限控制器
 *
 * <p>同时运行的操作不超过 {@code maxConcurrent} 个，其余按提交顺序排队；任一操作结束（无论成功或失败）后启动队首操作。
 *
 * <p>在应用启动时创建一次，并传给所有发起网络或图片解码的组件。操作的完成回调可能来自任意线程，计数器与队列由锁保护，操作本身总是在锁外启动。
 */
public final class Throttler {

  private static final Logger logger = Logger.getLogger(Throttler.class.getName());

  /** 默认并发上限 */
  public static final int DEFAULT_MAX_CONCURRENT = 20;

  private final Object lock = new Object();

  // guarded by lock
  private int maxConcurrent;
  private int active = 0;
  private final Queue<Runnable> pending = new ArrayDeque<>();
  private boolean draining = false;

  public Throttler() {
    this(DEFAULT_MAX_CONCURRENT);
  }

  /**
   * 创建并发控制器
   *
   * @param maxConcurrent 最大并发数
   */
  public Throttler(int maxConcurrent) {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be >= 1");
    }
    this.maxConcurrent = maxConcurrent;
  }

  /**
   * 提交操作
   *
   * @param operation 异步操作，获得运行名额时才会被调用
   * @param <T> 结果类型
   * @return 操作结果
   */
  public <T> CompletableFuture<T> run(Supplier<? extends CompletionStage<T>> operation) {
    CompletableFuture<T> result = new CompletableFuture<>();
    boolean queued;
    synchronized (lock) {
      queued = active >= maxConcurrent;
      pending.add(() -> start(operation, result));
    }
    if (queued) {
      logger.log(Level.FINE, "Operation queued, pending: {0}", getPendingCount());
    }
    drain();
    return result;
  }

  private <T> void start(
      Supplier<? extends CompletionStage<T>> operation, CompletableFuture<T> result) {
    Futures.invoke(operation)
        .whenComplete(
            (value, error) -> {
              // 先释放名额并启动下一个，再通知调用方
              onOperationFinished();
              if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
              } else {
                result.complete(value);
              }
            });
  }

  private void onOperationFinished() {
    synchronized (lock) {
      active--;
    }
    drain();
  }

  /**
   * 在有空闲名额时依次启动排队的操作
   *
   * <p>同一时刻只有一个线程在启动操作。同步完成的操作在回调中再次进入时直接返回，由外层循环继续启动，调用栈深度与队列长度无关。
   */
  private void drain() {
    synchronized (lock) {
      if (draining) {
        return;
      }
      draining = true;
    }
    boolean idle = false;
    try {
      while (true) {
        Runnable next;
        synchronized (lock) {
          next = pollNextLocked();
          if (next == null) {
            draining = false;
            idle = true;
            return;
          }
        }
        next.run();
      }
    } finally {
      if (!idle) {
        synchronized (lock) {
          draining = false;
        }
      }
    }
  }

  // 有空闲名额时取出队首并占用名额
  @Nullable
  private Runnable pollNextLocked() {
    if (active >= maxConcurrent) {
      return null;
    }
    Runnable next = pending.poll();
    if (next != null) {
      active++;
    }
    return next;
  }

  /**
   * 调整并发上限，提高上限时立即启动排队中的操作
   *
   * @param maxConcurrent 新的并发上限
   */
  public void setMaxConcurrent(int maxConcurrent) {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be >= 1");
    }
    synchronized (lock) {
      this.maxConcurrent = maxConcurrent;
    }
    drain();
  }

  public int getMaxConcurrent() {
    synchronized (lock) {
      return maxConcurrent;
    }
  }

  /** 正在运行的操作数 */
  public int getActiveCount() {
    synchronized (lock) {
      return active;
    }
  }

  /** 排队等待的操作数 */
  public int getPendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  @Override
  public String toString() {
    synchronized (lock) {
      return "Throttler{"
          + "maxConcurrent="
          + maxConcurrent
          + ", active="
          + active
          + ", pending="
          + pending.size()
          + '}';
    }
  }
}
