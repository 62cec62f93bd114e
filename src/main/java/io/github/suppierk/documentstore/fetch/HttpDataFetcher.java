/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.documentstore.fetch;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link DataFetcher} over {@link HttpClient}, honouring a deadline on every round trip. */
public final class HttpDataFetcher implements DataFetcher {
  private static final Logger log = LoggerFactory.getLogger(HttpDataFetcher.class);

  private final HttpClient client;
  private final Duration timeout;

  public HttpDataFetcher(final HttpClient client, final Duration timeout) {
    if (client == null) {
      throw new IllegalArgumentException("HTTP client cannot be null");
    }

    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive");
    }

    this.client = client;
    this.timeout = timeout;
  }

  /**
   * @param timeout applied to connecting and to every request
   * @return fetcher following redirects with a fresh client
   */
  public static HttpDataFetcher withTimeout(final Duration timeout) {
    return new HttpDataFetcher(
        HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        timeout);
  }

  /** {@inheritDoc} */
  @Override
  public byte[] fetch(final String url) throws IOException {
    final HttpRequest request =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();

    try {
      final HttpResponse<byte[]> response =
          client.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() / 100 != 2) {
        throw new IOException("GET %s returned HTTP %d".formatted(url, response.statusCode()));
      }

      log.debug("Fetched {} bytes from {}", response.body().length, url);
      return response.body();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while fetching " + url);
    }
  }
}
