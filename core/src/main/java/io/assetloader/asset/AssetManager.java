/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.asset;

import io.assetloader.task.Blob;
import java.util.concurrent.CompletableFuture;

/** 按名称获取全局资源 */
public interface AssetManager {

  /**
   * 加载字体文件
   *
   * @param src 资源路径
   * @return 字体内容
   */
  CompletableFuture<Blob> loadFont(String src);

  /**
   * 加载二进制资源
   *
   * @param src 资源路径
   * @return 资源内容
   */
  CompletableFuture<byte[]> loadBinaryResource(String src);
}
