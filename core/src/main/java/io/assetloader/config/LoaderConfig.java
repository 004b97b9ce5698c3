/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.config;

import io.assetloader.LoaderException;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigurationException;
import java.time.Duration;
import java.util.Objects;

/**
 * 资源加载配置
 *
 * <p>可通过 {@link ConfigProperties}（系统属性 / 环境变量）加载，也可直接使用 {@link Builder} 构建。
 */
public final class LoaderConfig {

  // ===== 配置键常量 =====

  // 并发控制
  private static final String THROTTLE_MAX_CONCURRENT = "assetloader.throttle.max.concurrent";

  // 重试配置
  private static final String RETRY_MAX_ATTEMPTS = "assetloader.retry.max.attempts";
  private static final String RETRY_BASE_DELAY = "assetloader.retry.base.delay";
  private static final String RETRY_MIN_DELAY = "assetloader.retry.min.delay";

  // 资源路径
  private static final String ASSET_BASE_PATH = "assetloader.asset.base.path";

  // HTTP 配置
  private static final String HTTP_CONNECT_TIMEOUT = "assetloader.http.connect.timeout";
  private static final String HTTP_READ_TIMEOUT = "assetloader.http.read.timeout";

  // 调度器
  private static final String SCHEDULER_THREADS = "assetloader.scheduler.threads";

  // ===== 默认值常量 =====
  private static final int DEFAULT_MAX_CONCURRENT = 20;
  private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 4;
  private static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofMillis(500);
  private static final Duration DEFAULT_RETRY_MIN_DELAY = Duration.ofMillis(50);
  private static final String DEFAULT_ASSET_BASE_PATH = "";
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
  private static final int DEFAULT_SCHEDULER_THREADS = 1;

  // ===== 配置字段 =====
  private final int maxConcurrent;
  private final int retryMaxAttempts;
  private final Duration retryBaseDelay;
  private final Duration retryMinDelay;
  private final String assetBasePath;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final int schedulerThreads;

  private LoaderConfig(Builder builder) {
    this.maxConcurrent = builder.maxConcurrent;
    this.retryMaxAttempts = builder.retryMaxAttempts;
    this.retryBaseDelay = builder.retryBaseDelay;
    this.retryMinDelay = builder.retryMinDelay;
    this.assetBasePath = builder.assetBasePath;
    this.connectTimeout = builder.connectTimeout;
    this.readTimeout = builder.readTimeout;
    this.schedulerThreads = builder.schedulerThreads;
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 加载配置
   * @throws LoaderException 配置值格式错误或不合法（{@link LoaderException.Type#CONFIG_ERROR}）
   */
  public static LoaderConfig create(ConfigProperties properties) {
    try {
      return builder().fromConfigProperties(properties).build();
    } catch (ConfigurationException | IllegalArgumentException e) {
      throw LoaderException.configError(
          "Invalid asset loader configuration: " + e.getMessage(), e);
    }
  }

  /** 使用全部默认值的配置 */
  public static LoaderConfig defaultConfig() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ===== Getters =====

  public int getMaxConcurrent() {
    return maxConcurrent;
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public Duration getRetryBaseDelay() {
    return retryBaseDelay;
  }

  public Duration getRetryMinDelay() {
    return retryMinDelay;
  }

  public String getAssetBasePath() {
    return assetBasePath;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public int getSchedulerThreads() {
    return schedulerThreads;
  }

  @Override
  public String toString() {
    return "LoaderConfig{"
        + "maxConcurrent="
        + maxConcurrent
        + ", retryMaxAttempts="
        + retryMaxAttempts
        + ", retryBaseDelay="
        + retryBaseDelay
        + ", retryMinDelay="
        + retryMinDelay
        + ", assetBasePath='"
        + assetBasePath
        + '\''
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + ", schedulerThreads="
        + schedulerThreads
        + '}';
  }

  /** Builder for {@link LoaderConfig}. */
  public static final class Builder {
    private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
    private int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;
    private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
    private Duration retryMinDelay = DEFAULT_RETRY_MIN_DELAY;
    private String assetBasePath = DEFAULT_ASSET_BASE_PATH;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;
    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置
     *
     * <p>未设置的键保持当前值。
     *
     * @param properties 配置属性
     * @return 构建器
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      Integer concurrent = properties.getInt(THROTTLE_MAX_CONCURRENT);
      if (concurrent != null) {
        setMaxConcurrent(concurrent);
      }

      Integer attempts = properties.getInt(RETRY_MAX_ATTEMPTS);
      if (attempts != null) {
        setRetryMaxAttempts(attempts);
      }

      Duration baseDelay = properties.getDuration(RETRY_BASE_DELAY);
      if (baseDelay != null) {
        setRetryBaseDelay(baseDelay);
      }

      Duration minDelay = properties.getDuration(RETRY_MIN_DELAY);
      if (minDelay != null) {
        setRetryMinDelay(minDelay);
      }

      String basePath = properties.getString(ASSET_BASE_PATH);
      if (basePath != null) {
        setAssetBasePath(basePath);
      }

      Duration connect = properties.getDuration(HTTP_CONNECT_TIMEOUT);
      if (connect != null) {
        setConnectTimeout(connect);
      }

      Duration read = properties.getDuration(HTTP_READ_TIMEOUT);
      if (read != null) {
        setReadTimeout(read);
      }

      Integer threads = properties.getInt(SCHEDULER_THREADS);
      if (threads != null) {
        setSchedulerThreads(threads);
      }

      return this;
    }

    public Builder setMaxConcurrent(int maxConcurrent) {
      if (maxConcurrent < 1) {
        throw new IllegalArgumentException("maxConcurrent must be >= 1");
      }
      this.maxConcurrent = maxConcurrent;
      return this;
    }

    public Builder setRetryMaxAttempts(int retryMaxAttempts) {
      if (retryMaxAttempts < 1) {
        throw new IllegalArgumentException("retryMaxAttempts must be >= 1");
      }
      this.retryMaxAttempts = retryMaxAttempts;
      return this;
    }

    public Builder setRetryBaseDelay(Duration retryBaseDelay) {
      Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
      if (retryBaseDelay.isNegative()) {
        throw new IllegalArgumentException("retryBaseDelay must not be negative");
      }
      this.retryBaseDelay = retryBaseDelay;
      return this;
    }

    public Builder setRetryMinDelay(Duration retryMinDelay) {
      Objects.requireNonNull(retryMinDelay, "retryMinDelay");
      if (retryMinDelay.isNegative()) {
        throw new IllegalArgumentException("retryMinDelay must not be negative");
      }
      this.retryMinDelay = retryMinDelay;
      return this;
    }

    /**
     * 设置资源基础路径
     *
     * <p>当宿主环境无法按相对路径获取本地资源时，可指向另一个源，例如 {@code https://cdn.example.com}。
     * 不应包含结尾的斜杠。
     */
    public Builder setAssetBasePath(String assetBasePath) {
      this.assetBasePath = Objects.requireNonNull(assetBasePath, "assetBasePath");
      return this;
    }

    public Builder setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    public Builder setReadTimeout(Duration readTimeout) {
      this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
      return this;
    }

    public Builder setSchedulerThreads(int schedulerThreads) {
      if (schedulerThreads < 1) {
        throw new IllegalArgumentException("schedulerThreads must be >= 1");
      }
      this.schedulerThreads = schedulerThreads;
      return this;
    }

    public LoaderConfig build() {
      return new LoaderConfig(this);
    }
  }
}
