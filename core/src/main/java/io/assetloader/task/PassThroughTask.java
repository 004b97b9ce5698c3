/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import io.assetloader.core.Loader;
import io.assetloader.core.Task;
import java.util.concurrent.CompletionStage;
import javax.annotation.Nullable;

/**
 * 把已经在进行中的异步操作包装为任务
 *
 * <p>操作成功时自动完成；操作失败时保持未完成。不发起重试。
 */
public final class PassThroughTask implements Task {

  private final ManualTask delegate = new ManualTask();

  /**
   * 创建任务
   *
   * @param stage 被包装的异步操作
   */
  public PassThroughTask(CompletionStage<?> stage) {
    stage.whenComplete(
        (value, error) -> {
          if (error == null) {
            delegate.markComplete();
          }
        });
  }

  @Override
  public boolean isComplete() {
    return delegate.isComplete();
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
    delegate.abort();
  }

  public boolean isAborted() {
    return delegate.isAborted();
  }

  @Override
  public void bindLoader(@Nullable Loader<?> loader) {
    delegate.bindLoader(loader);
  }
}
