/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assetloader.asset.AssetManager;
import io.assetloader.asset.FetchingAssetManager;
import io.assetloader.config.LoaderConfig;
import io.assetloader.core.retry.JitteredExponentialBackoff;
import io.assetloader.core.retry.Retry;
import io.assetloader.core.retry.RetryPolicy;
import io.assetloader.core.throttle.Throttler;
import io.assetloader.task.ImageTask;
import io.assetloader.task.RequestTask;
import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;

/**
 * 加载运行时
 *
 * <p>在应用启动时创建一次，持有所有任务共享的资源：
 *
 * <ul>
 *   <li>{@link Throttler} - 全局并发上限
 *   <li>{@link OkHttpClient} - HTTP 客户端
 *   <li>{@link ScheduledExecutorService} - 退避等待与本地文件读取
 *   <li>{@link ObjectMapper} - JSON 解析
 * </ul>
 */
public final class LoaderRuntime implements Closeable {

  private static final Logger logger = Logger.getLogger(LoaderRuntime.class.getName());

  private static final String THREAD_NAME_PREFIX = "assetloader-scheduler-";

  private final LoaderConfig config;
  private final RetryPolicy retryPolicy;
  private final Throttler throttler;
  private final OkHttpClient httpClient;
  private final ScheduledExecutorService scheduler;
  private final ObjectMapper objectMapper;
  private volatile AssetManager assetManager;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * 按配置创建运行时，重试策略由配置推导
   *
   * @param config 加载配置
   * @return 运行时
   */
  public static LoaderRuntime create(LoaderConfig config) {
    return new LoaderRuntime(config, retryPolicyOf(config));
  }

  /**
   * 创建运行时
   *
   * @param config 加载配置
   * @param retryPolicy 所有任务使用的重试策略
   */
  public LoaderRuntime(LoaderConfig config, RetryPolicy retryPolicy) {
    this.config = Objects.requireNonNull(config, "config");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.throttler = new Throttler(config.getMaxConcurrent());
    this.httpClient =
        new OkHttpClient.Builder()
            .connectTimeout(config.getConnectTimeout())
            .readTimeout(config.getReadTimeout())
            .retryOnConnectionFailure(true)
            .build();
    this.scheduler = createScheduler(config.getSchedulerThreads());
    this.objectMapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.assetManager = new FetchingAssetManager(this, config.getAssetBasePath());

    logger.log(
        Level.INFO,
        "Loader runtime initialized, maxConcurrent: {0}, retry: {1}, assetBasePath: {2}",
        new Object[] {config.getMaxConcurrent(), retryPolicy, config.getAssetBasePath()});
  }

  static RetryPolicy retryPolicyOf(LoaderConfig config) {
    return RetryPolicy.builder()
        .setMaxAttempts(config.getRetryMaxAttempts())
        .setBackoff(
            new JitteredExponentialBackoff(
                config.getRetryBaseDelay().toMillis(), config.getRetryMinDelay().toMillis()))
        .build();
  }

  private static ScheduledExecutorService createScheduler(int threads) {
    AtomicInteger counter = new AtomicInteger(0);
    return Executors.newScheduledThreadPool(
        threads,
        r -> {
          Thread t = new Thread(r, THREAD_NAME_PREFIX + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  /**
   * 创建网络请求任务
   *
   * @param url 资源地址
   * @return 请求任务
   */
  public RequestTask newRequest(String url) {
    checkNotClosed();
    return new RequestTask(url, this);
  }

  /**
   * 创建图片任务
   *
   * @param src 图片地址
   * @return 图片任务
   */
  public ImageTask newImage(String src) {
    checkNotClosed();
    return new ImageTask(src, this);
  }

  /**
   * 为单个操作创建重试包装器
   *
   * @param description 操作描述，用于日志
   * @return 重试包装器
   */
  public Retry newRetry(String description) {
    return new Retry(retryPolicy, scheduler, description);
  }

  public LoaderConfig getConfig() {
    return config;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public Throttler getThrottler() {
    return throttler;
  }

  public OkHttpClient getHttpClient() {
    return httpClient;
  }

  public ScheduledExecutorService getScheduler() {
    return scheduler;
  }

  public ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /** 当前资源管理器，默认为使用配置中资源基础路径的 {@link FetchingAssetManager} */
  public AssetManager getAssetManager() {
    return assetManager;
  }

  /**
   * 替换资源管理器
   *
   * @param assetManager 新的资源管理器
   */
  public void setAssetManager(AssetManager assetManager) {
    this.assetManager = Objects.requireNonNull(assetManager, "assetManager");
    logger.log(Level.FINE, "Asset manager replaced: {0}", assetManager);
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void checkNotClosed() {
    if (closed.get()) {
      throw new IllegalStateException("Loader runtime is closed");
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    scheduler.shutdownNow();
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
    logger.log(Level.INFO, "Loader runtime closed");
  }
}
