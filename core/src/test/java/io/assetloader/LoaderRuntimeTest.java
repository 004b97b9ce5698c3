/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.assetloader.asset.AssetManager;
import io.assetloader.asset.FetchingAssetManager;
import io.assetloader.config.LoaderConfig;
import io.assetloader.core.retry.RetryPolicy;
import io.assetloader.task.ImageTask;
import io.assetloader.task.RequestTask;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class LoaderRuntimeTest {

  @Test
  void retryPolicyFollowsConfig() {
    LoaderConfig config =
        LoaderConfig.builder()
            .setRetryMaxAttempts(2)
            .setRetryBaseDelay(Duration.ofMillis(100))
            .setRetryMinDelay(Duration.ofMillis(5))
            .build();

    RetryPolicy policy = LoaderRuntime.retryPolicyOf(config);

    assertThat(policy.getMaxAttempts()).isEqualTo(2);
    assertThat(policy.getBackoff().toString())
        .isEqualTo("JitteredExponentialBackoff{baseDelayMs=100, minDelayMs=5}");
  }

  @Test
  void sharesOneThrottlerAcrossTasks() {
    try (LoaderRuntime runtime =
        LoaderRuntime.create(LoaderConfig.builder().setMaxConcurrent(3).build())) {
      assertThat(runtime.getThrottler().getMaxConcurrent()).isEqualTo(3);
      assertThat(runtime.getThrottler()).isSameAs(runtime.getThrottler());
      assertThat(runtime.getRetryPolicy().getMaxAttempts()).isEqualTo(4);
    }
  }

  @Test
  void assetManagerUsesConfiguredBasePath() {
    try (LoaderRuntime runtime =
        LoaderRuntime.create(
            LoaderConfig.builder().setAssetBasePath("https://cdn.example.com").build())) {
      assertThat(runtime.getAssetManager()).isInstanceOf(FetchingAssetManager.class);
      assertThat(((FetchingAssetManager) runtime.getAssetManager()).resolve("/a.png"))
          .isEqualTo("https://cdn.example.com/a.png");
    }
  }

  @Test
  void assetManagerCanBeReplaced() throws Exception {
    try (LoaderRuntime runtime = LoaderRuntime.create(LoaderConfig.defaultConfig())) {
      AssetManager custom = mock(AssetManager.class);
      when(custom.loadBinaryResource("/a.bin"))
          .thenReturn(CompletableFuture.completedFuture(new byte[] {7}));

      runtime.setAssetManager(custom);

      assertThat(runtime.getAssetManager()).isSameAs(custom);
      assertThat(runtime.getAssetManager().loadBinaryResource("/a.bin").get())
          .containsExactly(7);
      assertThatThrownBy(() -> runtime.setAssetManager(null))
          .isInstanceOf(NullPointerException.class);
    }
  }

  @Test
  void createsTasks() {
    try (LoaderRuntime runtime = LoaderRuntime.create(LoaderConfig.defaultConfig())) {
      RequestTask request = runtime.newRequest("https://example.com/a.bin");
      ImageTask image = runtime.newImage("https://example.com/a.png");

      assertThat(request.getUrl()).isEqualTo("https://example.com/a.bin");
      assertThat(request.isComplete()).isFalse();
      assertThat(image.getSrc()).isEqualTo("https://example.com/a.png");
      assertThat(runtime.newRetry("op").getDescription()).isEqualTo("op");
    }
  }

  @Test
  void closeIsIdempotentAndRejectsNewTasks() {
    LoaderRuntime runtime = LoaderRuntime.create(LoaderConfig.defaultConfig());

    runtime.close();
    runtime.close();

    assertThat(runtime.isClosed()).isTrue();
    assertThat(runtime.getScheduler().isShutdown()).isTrue();
    assertThatThrownBy(() -> runtime.newRequest("https://example.com/a.bin"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("closed");
    assertThatThrownBy(() -> runtime.newImage("https://example.com/a.png"))
        .isInstanceOf(IllegalStateException.class);
  }
}
