/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.core;

import javax.annotation.Nullable;

/**
 * 可观察完成状态的异步工作单元。
 *
 * <p>实现需满足：
 *
 * <ul>
 *   <li>{@link #isWorkComputable()} 为 false 时，{@link #getTotalWork()} 与 {@link #getCompletedWork()}
 *       均返回 0
 *   <li>任务完成且工作量可计算时，已完成工作量等于总工作量
 *   <li>完成状态或工作量变化时，通过 {@link LoaderBinding#notifyProgress()} 通知所属 Loader
 * </ul>
 */
public interface Task {

  /** 任务是否已知完成 */
  boolean isComplete();

  /** 工作量是否可计算（通常指下载长度已知） */
  boolean isWorkComputable();

  /**
   * 完成任务所需的总工作量
   *
   * @return 总工作量，工作量不可计算时为 0
   */
  long getTotalWork();

  /**
   * 已完成的工作量
   *
   * @return 已完成工作量，工作量不可计算时为 0
   */
  long getCompletedWork();

  /**
   * 取消任务
   *
   * <p>幂等，完成后调用不产生任何效果。
   */
  void abort();

  /**
   * 绑定所属 Loader，仅用于推送进度通知，不参与生命周期控制
   *
   * @param loader Loader，传入 null 表示解绑
   */
  void bindLoader(@Nullable Loader<?> loader);
}
