/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import io.assetloader.LoaderException;
import io.assetloader.LoaderRuntime;
import io.assetloader.core.Loader;
import io.assetloader.core.LoaderBinding;
import io.assetloader.core.Task;
import io.assetloader.core.retry.Retry;
import io.assetloader.core.throttle.Throttler;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import javax.imageio.ImageIO;
import okhttp3.Call;

/**
 * 图片任务
 *
 * <p>获取图片内容并用 {@link ImageIO} 解码，解码失败时像网络错误一样重试。工作量不可计算。
 *
 * <p>{@link #abort()} 只停止重试循环，已经发出的获取与解码不会被中断。
 */
public final class ImageTask implements Task {

  private static final int STATUS_OK = 200;

  private final String src;
  private final ResourceFetcher fetcher;
  private final Throttler throttler;
  private final Retry retry;
  private final LoaderBinding binding = new LoaderBinding();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean aborted = new AtomicBoolean(false);

  private volatile boolean complete = false;

  /**
   * 创建图片任务
   *
   * @param src 图片地址（http、https 或 file）
   * @param runtime 运行时
   */
  public ImageTask(String src, LoaderRuntime runtime) {
    this.src = src;
    this.fetcher = new ResourceFetcher(runtime.getHttpClient(), runtime.getScheduler());
    this.throttler = runtime.getThrottler();
    this.retry = runtime.newRetry("download image " + src);
  }

  /**
   * 开始加载
   *
   * @return 解码后的图片
   * @throws IllegalStateException 已经调用过 load
   */
  public CompletableFuture<BufferedImage> load() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Image " + src + " has already been started");
    }
    return throttler.run(() -> retry.attempt(this::loadOnce));
  }

  private CompletableFuture<BufferedImage> loadOnce() {
    if (aborted.get()) {
      return CompletableFuture.failedFuture(
          LoaderException.aborted("Cannot load image " + src + " -- aborted."));
    }
    // 图片获取不登记调用，无法取消
    AtomicReference<Call> untracked = new AtomicReference<>();
    return fetcher
        .fetch(src, untracked, ResourceFetcher.ProgressCallback.NONE)
        .thenApply(this::decode);
  }

  private BufferedImage decode(ResourceFetcher.FetchResult result) {
    if (result.status != ResourceFetcher.LOCAL_STATUS && result.status != STATUS_OK) {
      throw LoaderException.httpStatus(
          "HTTP Error " + result.status + " while loading image " + src);
    }
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(result.body));
    } catch (IOException e) {
      throw LoaderException.decodeFailed("Failed to load image: " + src, e);
    }
    if (image == null) {
      throw LoaderException.decodeFailed("Failed to load image: " + src, null);
    }
    complete = true;
    binding.notifyProgress();
    return image;
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
    if (complete || !aborted.compareAndSet(false, true)) {
      return;
    }
    retry.abort();
  }

  @Override
  public void bindLoader(@Nullable Loader<?> loader) {
    binding.bind(loader);
  }

  public boolean isAborted() {
    return aborted.get();
  }

  public String getSrc() {
    return src;
  }

  @Override
  public String toString() {
    return "ImageTask{src=" + src + ", complete=" + complete + ", aborted=" + aborted + '}';
  }
}
