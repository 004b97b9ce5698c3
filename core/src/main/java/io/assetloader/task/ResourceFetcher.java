/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import io.assetloader.LoaderException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * 资源获取
 *
 * <p>{@code http(s):} 地址通过 OkHttp 异步 GET 获取；{@code file:} 地址在本地读取，状态码固定为 {@link
 * #LOCAL_STATUS}。读取过程中按收到的字节数回调进度。
 */
final class ResourceFetcher {

  private static final Logger logger = Logger.getLogger(ResourceFetcher.class.getName());

  /** 本地/不透明访问时的状态码 */
  static final int LOCAL_STATUS = 0;

  private static final String FILE_SCHEME = "file:";
  private static final int BUFFER_SIZE = 8192;
  // Content-Length 不可信，初始容量有上限
  private static final int MAX_INITIAL_CAPACITY = 64 * 1024;

  /** 进度回调 */
  interface ProgressCallback {
    ProgressCallback NONE = (computable, loaded, total) -> {};

    /**
     * @param computable 总长度是否已知
     * @param loaded 已接收字节数
     * @param total 总字节数，未知时为 0
     */
    void onProgress(boolean computable, long loaded, long total);
  }

  /** 获取结果 */
  static final class FetchResult {
    final int status;
    final byte[] body;
    @Nullable final String contentType;

    FetchResult(int status, byte[] body, @Nullable String contentType) {
      this.status = status;
      this.body = body;
      this.contentType = contentType;
    }
  }

  private final OkHttpClient httpClient;
  private final Executor localExecutor;

  ResourceFetcher(OkHttpClient httpClient, Executor localExecutor) {
    this.httpClient = httpClient;
    this.localExecutor = localExecutor;
  }

  /**
   * 获取资源
   *
   * @param url 资源地址
   * @param callHolder 保存进行中的 HTTP 调用，便于外部取消
   * @param progress 进度回调
   * @return 获取结果；网络失败时为 NETWORK_ERROR，调用被取消时为 ABORTED
   */
  CompletableFuture<FetchResult> fetch(
      String url, AtomicReference<Call> callHolder, ProgressCallback progress) {
    if (url.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length())) {
      return readLocal(url, progress);
    }

    Request request;
    try {
      request = new Request.Builder().url(url).get().build();
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(e);
    }

    CompletableFuture<FetchResult> future = new CompletableFuture<>();
    Call call = httpClient.newCall(request);
    callHolder.set(call);
    progress.onProgress(false, 0, 0);

    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call call, IOException e) {
            callHolder.compareAndSet(call, null);
            future.completeExceptionally(toFailure(call, url, e));
          }

          @Override
          public void onResponse(Call call, Response response) {
            try (ResponseBody body = response.body()) {
              byte[] data = body != null ? readBody(body, progress) : new byte[0];
              MediaType mediaType = body != null ? body.contentType() : null;
              logger.log(
                  Level.FINE,
                  "Fetched {0}: code={1}, bytes={2}",
                  new Object[] {url, response.code(), data.length});
              future.complete(
                  new FetchResult(
                      response.code(), data, mediaType != null ? mediaType.toString() : null));
            } catch (IOException e) {
              future.completeExceptionally(toFailure(call, url, e));
            } catch (RuntimeException | Error e) {
              logger.log(Level.WARNING, "Failed to read response of " + url, e);
              future.completeExceptionally(e);
            } finally {
              callHolder.compareAndSet(call, null);
            }
          }
        });
    return future;
  }

  private CompletableFuture<FetchResult> readLocal(String url, ProgressCallback progress) {
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            Path path = Paths.get(URI.create(url));
            long size = Files.size(path);
            progress.onProgress(true, 0, size);
            byte[] data = Files.readAllBytes(path);
            progress.onProgress(true, data.length, data.length);
            return new FetchResult(LOCAL_STATUS, data, Files.probeContentType(path));
          } catch (IOException e) {
            throw LoaderException.networkError("Error while reading " + url, e);
          }
        },
        localExecutor);
  }

  private static byte[] readBody(ResponseBody body, ProgressCallback progress)
      throws IOException {
    long length = body.contentLength();
    boolean computable = length >= 0;
    progress.onProgress(computable, 0, computable ? length : 0);

    ByteArrayOutputStream out =
        new ByteArrayOutputStream(
            computable ? (int) Math.min(length, MAX_INITIAL_CAPACITY) : BUFFER_SIZE);
    byte[] buffer = new byte[BUFFER_SIZE];
    long loaded = 0;
    try (InputStream in = body.byteStream()) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
        loaded += read;
        if (computable) {
          progress.onProgress(true, loaded, length);
        }
      }
    }
    return out.toByteArray();
  }

  private static LoaderException toFailure(Call call, String url, IOException e) {
    if (call.isCanceled()) {
      return LoaderException.aborted("Download of " + url + " was aborted");
    }
    String message =
        String.format(
            Locale.ROOT,
            "Error while downloading %s: %s",
            url,
            e.getMessage() != null ? e.getMessage() : "Unknown error");
    logger.log(Level.FINE, message);
    return LoaderException.networkError(message, e);
  }
}
