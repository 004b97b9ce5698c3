/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务聚合器。
 *
 * <p>负责：
 *
 * <ul>
 *   <li>登记任务并把自身绑定到任务上
 *   <li>按"已完成任务数 / 总任务数"计算整体进度（不按字节加权）
 *   <li>级联取消与清理
 * </ul>
 *
 * <p>具体的聚合策略及结果类型由子类通过 {@link #load()} 定义。
 *
 * <p>状态约束：
 *
 * <ul>
 *   <li>取消后进度固定为 1.0
 *   <li>出错后不再派发进度通知，但不会自动取消其余任务
 * </ul>
 *
 * @param <T> 加载结果类型
 */
public abstract class Loader<T> {

  private static final Logger logger = Logger.getLogger(Loader.class.getName());

  private final List<Task> tasks = new CopyOnWriteArrayList<>();
  private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean aborted = new AtomicBoolean(false);
  private final AtomicBoolean errored = new AtomicBoolean(false);

  /**
   * 登记任务
   *
   * <p>Loader 已取消时任务仍会登记，但会被立即取消。
   *
   * @param task 任务
   * @param <K> 任务类型
   * @return 同一个任务，便于链式调用
   */
  public <K extends Task> K addTask(K task) {
    tasks.add(task);
    task.bindLoader(this);
    if (aborted.get()) {
      logger.log(Level.FINE, "Task added to an aborted loader, aborting it: {0}", task);
      task.abort();
    }
    return task;
  }

  /** 清空已登记任务并重新计算进度 */
  public void resetTasks() {
    tasks.clear();
    updateProgress();
  }

  /** 取消 Loader 及其所有已登记任务，幂等 */
  public void abort() {
    if (!aborted.compareAndSet(false, true)) {
      return;
    }
    for (Task task : tasks) {
      task.abort();
    }
  }

  /**
   * 解绑所有任务并清空任务集合
   *
   * <p>幂等，在成功、失败或取消后都可调用。
   */
  public void cleanup() {
    for (Task task : tasks) {
      task.bindLoader(null);
    }
    tasks.clear();
  }

  /**
   * 重新计算进度并通知监听器
   *
   * <p>由任务调用，使用方通常不需要直接调用。
   */
  public void updateProgress() {
    if (errored.get()) {
      return;
    }
    double progress = getProgress();
    onProgress(progress);
    for (ProgressListener listener : listeners) {
      try {
        listener.onProgress(progress);
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Progress listener failed: {0}", e.getMessage());
      }
    }
  }

  /**
   * 当前进度
   *
   * @return 已完成任务数 / 总任务数；无任务时为 0；已取消时为 1
   */
  public double getProgress() {
    if (aborted.get()) {
      return 1.0;
    }
    int total = tasks.size();
    if (total == 0) {
      return 0.0;
    }
    int finished = 0;
    for (Task task : tasks) {
      if (task.isComplete()) {
        finished++;
      }
    }
    return (double) finished / total;
  }

  /**
   * 进度钩子，子类可覆盖
   *
   * @param progress 当前进度
   */
  protected void onProgress(double progress) {}

  public void addProgressListener(ProgressListener listener) {
    listeners.add(listener);
  }

  public void removeProgressListener(ProgressListener listener) {
    listeners.remove(listener);
  }

  /** 标记出错，之后不再派发进度通知 */
  public void markErrored() {
    errored.set(true);
  }

  public boolean isAborted() {
    return aborted.get();
  }

  public boolean isErrored() {
    return errored.get();
  }

  /** 已登记任务的只读视图 */
  public List<Task> getTasks() {
    return Collections.unmodifiableList(tasks);
  }

  /**
   * 执行加载
   *
   * @return 加载结果
   */
  public abstract CompletableFuture<T> load();
}
