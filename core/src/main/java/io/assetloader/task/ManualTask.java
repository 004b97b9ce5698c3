/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import io.assetloader.core.Loader;
import io.assetloader.core.LoaderBinding;
import io.assetloader.core.Task;
import javax.annotation.Nullable;

/**
 * 由外部调用 {@link #markComplete()} 标记完成的任务
 *
 * <p>用于无法映射到网络请求或图片的工作，例如同步预计算。工作量不可计算，取消不影响完成状态。
 */
public final class ManualTask implements Task {

  private final LoaderBinding binding = new LoaderBinding();
  private volatile boolean complete = false;
  private volatile boolean aborted = false;

  /** 标记完成并通知所属 Loader，重复调用无效果 */
  public void markComplete() {
    if (complete) {
      return;
    }
    complete = true;
    binding.notifyProgress();
  }

  @Override
  public boolean isComplete() {
    return complete;
  }

  @Override
  public boolean isWorkComputable() {
    return false;
  }

  @Override
  public long getTotalWork() {
    return 0;
  }

  @Override
  public long getCompletedWork() {
    return 0;
  }

  @Override
  public void abort() {
    aborted = true;
  }

  public boolean isAborted() {
    return aborted;
  }

  @Override
  public void bindLoader(@Nullable Loader<?> loader) {
    binding.bind(loader);
  }

  @Override
  public String toString() {
    return "ManualTask{complete=" + complete + ", aborted=" + aborted + '}';
  }
}
