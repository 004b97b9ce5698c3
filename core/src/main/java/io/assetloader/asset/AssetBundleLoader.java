/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.asset;

import io.assetloader.LoaderRuntime;
import io.assetloader.core.Futures;
import io.assetloader.core.Loader;
import io.assetloader.task.ResponseType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 一组具名二进制资源的 Loader
 *
 * <p>每个资源对应一个 {@link io.assetloader.task.RequestTask}，全部完成后按登记顺序返回名称到内容的映射。
 * 任一资源最终失败时标记出错并返回该错误；其余请求不会被取消。
 */
public final class AssetBundleLoader extends Loader<Map<String, byte[]>> {

  private static final Logger logger = Logger.getLogger(AssetBundleLoader.class.getName());

  private final LoaderRuntime runtime;
  private final Map<String, String> sources;
  private final AtomicBoolean started = new AtomicBoolean(false);

  /**
   * 创建资源包 Loader
   *
   * @param runtime 运行时
   * @param sources 资源名称到地址的映射
   */
  public AssetBundleLoader(LoaderRuntime runtime, Map<String, String> sources) {
    this.runtime = runtime;
    this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
  }

  @Override
  public CompletableFuture<Map<String, byte[]>> load() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Asset bundle has already been loaded");
    }

    Map<String, CompletableFuture<byte[]>> pending = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : sources.entrySet()) {
      pending.put(
          entry.getKey(),
          addTask(runtime.newRequest(entry.getValue())).load(ResponseType.BINARY));
    }

    CompletableFuture<Map<String, byte[]>> result = new CompletableFuture<>();
    for (Map.Entry<String, CompletableFuture<byte[]>> entry : pending.entrySet()) {
      entry
          .getValue()
          .whenComplete(
              (value, error) -> {
                if (error != null && !result.isDone()) {
                  logger.log(
                      Level.FINE,
                      "Asset {0} failed: {1}",
                      new Object[] {entry.getKey(), error.getMessage()});
                  markErrored();
                  result.completeExceptionally(Futures.unwrap(error));
                }
              });
    }

    CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
        .thenRun(
            () -> {
              Map<String, byte[]> loaded = new LinkedHashMap<>();
              for (Map.Entry<String, CompletableFuture<byte[]>> entry : pending.entrySet()) {
                loaded.put(entry.getKey(), entry.getValue().join());
              }
              result.complete(loaded);
            });
    return result;
  }

  public Map<String, String> getSources() {
    return sources;
  }
}
