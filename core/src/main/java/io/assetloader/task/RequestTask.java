/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.assetloader.LoaderException;
import io.assetloader.LoaderRuntime;
import io.assetloader.core.Loader;
import io.assetloader.core.LoaderBinding;
import io.assetloader.core.Task;
import io.assetloader.core.retry.Retry;
import io.assetloader.core.throttle.Throttler;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import okhttp3.Call;

/**
 * 网络请求任务
 *
 * <p>经共享的 {@link Throttler} 限流、由 {@link Retry} 重试的 GET 请求，按接收字节数报告进度。
 *
 * <p>可接受的状态码为 0（本地/不透明访问）和 200；调用 {@link #ignoreErrors()} 后接受任意状态码。{@link
 * #abort()} 会取消进行中的传输，结果以 {@link LoaderException.Type#ABORTED} 失败且不再重试。
 *
 * <p>每个任务只能 {@link #load(ResponseType)} 一次。
 */
public final class RequestTask implements Task {

  private static final int STATUS_OK = 200;

  private final String url;
  private final ResourceFetcher fetcher;
  private final Throttler throttler;
  private final Retry retry;
  private final ObjectMapper objectMapper;
  private final LoaderBinding binding = new LoaderBinding();
  private final AtomicReference<Call> currentCall = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean aborted = new AtomicBoolean(false);

  private volatile boolean shouldIgnoreErrors = false;
  private volatile boolean complete = false;
  private volatile boolean workComputable = false;
  private volatile long totalWork = 0;
  private volatile long completedWork = 0;
  private volatile int status = 0;

  /**
   * 创建请求任务
   *
   * @param url 资源地址（http、https 或 file）
   * @param runtime 提供共享 HTTP 客户端、限流器与重试策略的运行时
   */
  public RequestTask(String url, LoaderRuntime runtime) {
    this.url = url;
    this.fetcher = new ResourceFetcher(runtime.getHttpClient(), runtime.getScheduler());
    this.throttler = runtime.getThrottler();
    this.retry = runtime.newRetry("download " + url);
    this.objectMapper = runtime.getObjectMapper();
  }

  /**
   * 接受任意状态码
   *
   * @return 当前任务
   */
  public RequestTask ignoreErrors() {
    this.shouldIgnoreErrors = true;
    return this;
  }

  /**
   * 开始下载
   *
   * @param type 响应表示形式
   * @param <T> 结果类型
   * @return 解码后的响应
   * @throws IllegalStateException 已经调用过 load
   */
  public <T> CompletableFuture<T> load(ResponseType<T> type) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Request for " + url + " has already been started");
    }
    return throttler.run(() -> retry.attempt(() -> loadOnce(type)));
  }

  private <T> CompletableFuture<T> loadOnce(ResponseType<T> type) {
    if (aborted.get()) {
      return CompletableFuture.failedFuture(
          LoaderException.aborted("Cannot download " + url + " -- aborted."));
    }
    CompletableFuture<ResourceFetcher.FetchResult> fetch =
        fetcher.fetch(url, currentCall, this::updateProgress);
    // abort() 可能发生在检查之后、调用登记之前
    if (aborted.get()) {
      cancelCurrentCall();
    }
    return fetch.thenApply(result -> accept(result, type));
  }

  private void cancelCurrentCall() {
    Call call = currentCall.get();
    if (call != null) {
      call.cancel();
    }
  }

  private <T> T accept(ResourceFetcher.FetchResult result, ResponseType<T> type) {
    status = result.status;
    if (!isAcceptable(result.status)) {
      throw LoaderException.httpStatus(
          "HTTP Error " + result.status + " while downloading " + url);
    }
    T value;
    try {
      value = type.decode(result.body, result.contentType, objectMapper);
    } catch (IOException e) {
      throw LoaderException.decodeFailed("Cannot decode response of " + url, e);
    }
    if (workComputable) {
      completedWork = totalWork;
    }
    complete = true;
    binding.notifyProgress();
    return value;
  }

  private boolean isAcceptable(int code) {
    return code == ResourceFetcher.LOCAL_STATUS || code == STATUS_OK || shouldIgnoreErrors;
  }

  private void updateProgress(boolean computable, long loaded, long total) {
    this.workComputable = computable;
    this.totalWork = computable ? total : 0;
    this.completedWork = computable ? loaded : 0;
    binding.notifyProgress();
  }

  @Override
  public boolean isComplete() {
    return complete;
  }

  @Override
  public boolean isWorkComputable() {
    return workComputable;
  }

  @Override
  public long getTotalWork() {
    return totalWork;
  }

  @Override
  public long getCompletedWork() {
    return completedWork;
  }

  @Override
  public void abort() {
    if (complete || !aborted.compareAndSet(false, true)) {
      return;
    }
    retry.abort();
    cancelCurrentCall();
  }

  @Override
  public void bindLoader(@Nullable Loader<?> loader) {
    binding.bind(loader);
  }

  public boolean isAborted() {
    return aborted.get();
  }

  /** 最近一次响应的状态码，尚无响应时为 0 */
  public int getStatus() {
    return status;
  }

  public String getUrl() {
    return url;
  }

  @Override
  public String toString() {
    return "RequestTask{url=" + url + ", complete=" + complete + ", aborted=" + aborted + '}';
  }
}
