/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core;

/** Loader 进度监听器 */
@FunctionalInterface
public interface ProgressListener {

  /**
   * 进度变化时调用
   *
   * @param progress 进度，取值范围 [0, 1]
   */
  void onProgress(double progress);
}
