/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.asset;

import io.assetloader.LoaderRuntime;
import io.assetloader.task.Blob;
import io.assetloader.task.ResponseType;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 {@link io.assetloader.task.RequestTask} 的资源管理器
 *
 * <p>资源地址为 {@code basePath + src}。宿主环境无法按相对路径获取本地文件时，可把 basePath 指向另一个源。
 */
public final class FetchingAssetManager implements AssetManager {

  private final LoaderRuntime runtime;
  private final String basePath;

  /**
   * 创建资源管理器
   *
   * @param runtime 运行时
   * @param basePath 基础路径，不含结尾斜杠；为空时直接使用 src
   */
  public FetchingAssetManager(LoaderRuntime runtime, String basePath) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.basePath = Objects.requireNonNull(basePath, "basePath");
  }

  @Override
  public CompletableFuture<Blob> loadFont(String src) {
    return runtime.newRequest(resolve(src)).load(ResponseType.BLOB);
  }

  @Override
  public CompletableFuture<byte[]> loadBinaryResource(String src) {
    return runtime.newRequest(resolve(src)).load(ResponseType.BINARY);
  }

  /**
   * 解析资源完整地址
   *
   * @param src 资源路径
   * @return 完整地址
   */
  public String resolve(String src) {
    return basePath + src;
  }

  public String getBasePath() {
    return basePath;
  }
}
