/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core;

import javax.annotation.Nullable;

/**
 * 任务到 Loader 的非拥有引用。
 *
 * <p>各任务实现组合一个该对象，而不是继承公共基类。
 */
public final class LoaderBinding {

  @Nullable private volatile Loader<?> loader;

  public void bind(@Nullable Loader<?> loader) {
    this.loader = loader;
  }

  @Nullable
  public Loader<?> getLoader() {
    return loader;
  }

  /** 通知已绑定的 Loader 重新计算进度，未绑定时忽略 */
  public void notifyProgress() {
    Loader<?> current = loader;
    if (current != null) {
      current.updateProgress();
    }
  }
}
