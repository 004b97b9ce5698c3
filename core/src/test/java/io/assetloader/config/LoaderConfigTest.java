/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.assetloader.LoaderException;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoaderConfigTest {

  @Test
  void defaultValues() {
    LoaderConfig config = LoaderConfig.defaultConfig();

    assertThat(config.getMaxConcurrent()).isEqualTo(20);
    assertThat(config.getRetryMaxAttempts()).isEqualTo(4);
    assertThat(config.getRetryBaseDelay()).isEqualTo(Duration.ofMillis(500));
    assertThat(config.getRetryMinDelay()).isEqualTo(Duration.ofMillis(50));
    assertThat(config.getAssetBasePath()).isEmpty(); // 默认直接使用资源路径
    assertThat(config.getConnectTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getReadTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.getSchedulerThreads()).isEqualTo(1);
  }

  @Test
  void builderSetsValues() {
    LoaderConfig config =
        LoaderConfig.builder()
            .setMaxConcurrent(8)
            .setRetryMaxAttempts(2)
            .setRetryBaseDelay(Duration.ofMillis(100))
            .setRetryMinDelay(Duration.ZERO)
            .setAssetBasePath("https://cdn.example.com")
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(10))
            .setSchedulerThreads(2)
            .build();

    assertThat(config.getMaxConcurrent()).isEqualTo(8);
    assertThat(config.getRetryMaxAttempts()).isEqualTo(2);
    assertThat(config.getRetryBaseDelay()).isEqualTo(Duration.ofMillis(100));
    assertThat(config.getRetryMinDelay()).isEqualTo(Duration.ZERO);
    assertThat(config.getAssetBasePath()).isEqualTo("https://cdn.example.com");
    assertThat(config.getConnectTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.getReadTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.getSchedulerThreads()).isEqualTo(2);
  }

  @Test
  void createFromConfigProperties() {
    ConfigProperties properties = mock(ConfigProperties.class);
    when(properties.getInt("assetloader.throttle.max.concurrent")).thenReturn(6);
    when(properties.getInt("assetloader.retry.max.attempts")).thenReturn(3);
    when(properties.getDuration("assetloader.retry.base.delay"))
        .thenReturn(Duration.ofMillis(250));
    when(properties.getString("assetloader.asset.base.path")).thenReturn("file:///opt/game");
    when(properties.getDuration("assetloader.http.read.timeout"))
        .thenReturn(Duration.ofSeconds(15));

    LoaderConfig config = LoaderConfig.create(properties);

    assertThat(config.getMaxConcurrent()).isEqualTo(6);
    assertThat(config.getRetryMaxAttempts()).isEqualTo(3);
    assertThat(config.getRetryBaseDelay()).isEqualTo(Duration.ofMillis(250));
    assertThat(config.getAssetBasePath()).isEqualTo("file:///opt/game");
    assertThat(config.getReadTimeout()).isEqualTo(Duration.ofSeconds(15));
    // 未设置的键保持默认值
    assertThat(config.getRetryMinDelay()).isEqualTo(Duration.ofMillis(50));
    assertThat(config.getConnectTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getSchedulerThreads()).isEqualTo(1);
  }

  @Test
  void invalidPropertyIsRejected() {
    ConfigProperties properties = mock(ConfigProperties.class);
    when(properties.getInt("assetloader.throttle.max.concurrent")).thenReturn(0);

    assertThatThrownBy(() -> LoaderConfig.create(properties))
        .isInstanceOf(LoaderException.class)
        .hasMessageContaining("[CONFIG_ERROR]")
        .hasMessageContaining("maxConcurrent must be >= 1")
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void malformedPropertyIsRejected() {
    ConfigProperties properties = mock(ConfigProperties.class);
    when(properties.getDuration("assetloader.retry.base.delay"))
        .thenThrow(new ConfigurationException("Invalid duration property"));

    Throwable thrown = catchThrowable(() -> LoaderConfig.create(properties));

    assertThat(thrown).isInstanceOf(LoaderException.class);
    assertThat(((LoaderException) thrown).getType()).isEqualTo(LoaderException.Type.CONFIG_ERROR);
    assertThat(thrown).hasCauseInstanceOf(ConfigurationException.class);
  }

  @Test
  void builderValidatesValues() {
    assertThatThrownBy(() -> LoaderConfig.builder().setRetryMaxAttempts(0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("retryMaxAttempts must be >= 1");
    assertThatThrownBy(() -> LoaderConfig.builder().setRetryBaseDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("retryBaseDelay must not be negative");
    assertThatThrownBy(() -> LoaderConfig.builder().setRetryMinDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LoaderConfig.builder().setSchedulerThreads(0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("schedulerThreads must be >= 1");
  }

  @Test
  void toStringContainsValues() {
    String str = LoaderConfig.builder().setAssetBasePath("/static").build().toString();

    assertThat(str).contains("LoaderConfig{");
    assertThat(str).contains("maxConcurrent=20");
    assertThat(str).contains("assetBasePath='/static'");
  }
}
