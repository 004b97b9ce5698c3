/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResourceFetcherTest {

  private MockWebServer server;
  private OkHttpClient client;
  private ResourceFetcher fetcher;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = new OkHttpClient();
    fetcher = new ResourceFetcher(client, Runnable::run);
  }

  @AfterEach
  void tearDown() throws IOException {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
    server.shutdown();
  }

  @Test
  void reportsStatusBodyAndContentType() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(404)
            .setHeader("Content-Type", "text/plain")
            .setBody("gone"));

    ResourceFetcher.FetchResult result =
        fetcher
            .fetch(
                server.url("/x").toString(),
                new AtomicReference<>(),
                ResourceFetcher.ProgressCallback.NONE)
            .get(10, TimeUnit.SECONDS);

    assertThat(result.status).isEqualTo(404);
    assertThat(result.body).hasSize(4);
    assertThat(result.contentType).isEqualTo("text/plain");
  }

  @Test
  void failureWhileReadingBodyCompletesFuture() {
    server.enqueue(new MockResponse().setBody("payload"));
    CompletableFuture<ResourceFetcher.FetchResult> future =
        fetcher.fetch(
            server.url("/x").toString(),
            new AtomicReference<Call>(),
            (computable, loaded, total) -> {
              if (computable) {
                throw new IllegalStateException("progress consumer failed");
              }
            });

    Throwable thrown = catchThrowable(() -> future.get(10, TimeUnit.SECONDS));
    assertThat(thrown)
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void malformedUrlFailsFuture() {
    CompletableFuture<ResourceFetcher.FetchResult> future =
        fetcher.fetch("not a url", new AtomicReference<>(), ResourceFetcher.ProgressCallback.NONE);

    assertThat(future).isCompletedExceptionally();
  }
}
