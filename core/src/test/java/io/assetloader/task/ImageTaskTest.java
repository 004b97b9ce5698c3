/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.assetloader.LoaderException;
import io.assetloader.LoaderRuntime;
import io.assetloader.config.LoaderConfig;
import io.assetloader.core.retry.JitteredExponentialBackoff;
import io.assetloader.core.retry.RetryPolicy;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import javax.imageio.ImageIO;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageTaskTest {

  private MockWebServer server;
  private LoaderRuntime runtime;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    runtime =
        new LoaderRuntime(
            LoaderConfig.defaultConfig(),
            RetryPolicy.builder()
                .setBackoff(new JitteredExponentialBackoff(0, 10, () -> 0.0))
                .build());
  }

  @AfterEach
  void tearDown() throws IOException {
    runtime.close();
    server.shutdown();
  }

  private static byte[] png(int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(0, 0, 0xFFFF0000);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }

  private static MockResponse imageResponse(byte[] data) {
    return new MockResponse()
        .setHeader("Content-Type", "image/png")
        .setBody(new Buffer().write(data));
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    Throwable thrown = catchThrowable(() -> future.get(10, TimeUnit.SECONDS));
    assertThat(thrown).isInstanceOf(ExecutionException.class);
    return thrown.getCause();
  }

  @Test
  void decodesPng() throws Exception {
    server.enqueue(imageResponse(png(4, 3)));
    ImageTask task = runtime.newImage(server.url("/sprite.png").toString());

    BufferedImage image = task.load().get(10, TimeUnit.SECONDS);

    assertThat(image.getWidth()).isEqualTo(4);
    assertThat(image.getHeight()).isEqualTo(3);
    assertThat(image.getRGB(0, 0)).isEqualTo(0xFFFF0000);
    assertThat(task.isComplete()).isTrue();
    assertThat(task.isWorkComputable()).isFalse();
    assertThat(task.getTotalWork()).isZero();
  }

  @Test
  void retriesUndecodableImage() throws Exception {
    server.enqueue(new MockResponse().setBody("not an image"));
    server.enqueue(new MockResponse().setBody("still not an image"));
    server.enqueue(imageResponse(png(2, 2)));

    BufferedImage image =
        runtime.newImage(server.url("/flaky.png").toString()).load().get(10, TimeUnit.SECONDS);

    assertThat(image.getWidth()).isEqualTo(2);
    assertThat(server.getRequestCount()).isEqualTo(3);
  }

  @Test
  void undecodableImageFailsAfterFourAttempts() {
    for (int i = 0; i < 4; i++) {
      server.enqueue(new MockResponse().setBody("garbage"));
    }
    String src = server.url("/broken.png").toString();

    Throwable error = failureOf(runtime.newImage(src).load());

    assertThat(error).isInstanceOf(LoaderException.class);
    assertThat(((LoaderException) error).getType())
        .isEqualTo(LoaderException.Type.DECODE_FAILED);
    assertThat(error).hasMessageContaining("Failed to load image: " + src);
    assertThat(server.getRequestCount()).isEqualTo(4);
  }

  @Test
  void errorStatusFailsWithHttpStatus() {
    for (int i = 0; i < 4; i++) {
      server.enqueue(new MockResponse().setResponseCode(403));
    }

    Throwable error = failureOf(runtime.newImage(server.url("/secret.png").toString()).load());

    assertThat(((LoaderException) error).getType()).isEqualTo(LoaderException.Type.HTTP_STATUS);
    assertThat(error).hasMessageContaining("HTTP Error 403 while loading image");
  }

  @Test
  void loadsLocalImage(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("icon.png");
    Files.write(file, png(8, 8));

    BufferedImage image =
        runtime.newImage(file.toUri().toString()).load().get(10, TimeUnit.SECONDS);

    assertThat(image.getWidth()).isEqualTo(8);
  }

  @Test
  void abortBeforeLoadFailsWithoutRequest() {
    ImageTask task = runtime.newImage(server.url("/never.png").toString());
    task.abort();

    Throwable error = failureOf(task.load());

    assertThat(((LoaderException) error).isAborted()).isTrue();
    assertThat(task.isAborted()).isTrue();
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void abortAfterCompletionIsNoOp() throws Exception {
    server.enqueue(imageResponse(png(1, 1)));
    ImageTask task = runtime.newImage(server.url("/done.png").toString());
    task.load().get(10, TimeUnit.SECONDS);

    task.abort();

    assertThat(task.isAborted()).isFalse();
  }
}
