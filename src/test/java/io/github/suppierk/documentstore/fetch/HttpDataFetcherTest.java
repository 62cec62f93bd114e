package io.github.suppierk.documentstore.fetch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HttpDataFetcherTest {
  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_invalid_illegal_argument_must_be_thrown() {
      final var client = HttpClient.newHttpClient();

      assertThrows(
          IllegalArgumentException.class, () -> new HttpDataFetcher(null, Duration.ofSeconds(1)));
      assertThrows(IllegalArgumentException.class, () -> new HttpDataFetcher(client, null));
      assertThrows(
          IllegalArgumentException.class, () -> new HttpDataFetcher(client, Duration.ZERO));
      assertThrows(
          IllegalArgumentException.class,
          () -> new HttpDataFetcher(client, Duration.ofSeconds(-1)));
      assertDoesNotThrow(() -> HttpDataFetcher.withTimeout(Duration.ofSeconds(2)));
    }
  }

  @Nested
  class Fetching {
    HttpServer server;
    String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
      server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
      server.createContext(
          "/article.xml",
          exchange -> {
            final byte[] body = "<article/>".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
              out.write(body);
            }
          });
      server.createContext(
          "/missing.xml",
          exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
          });
      server.start();
      baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
      server.stop(0);
    }

    @Test
    void when_server_answers_with_success_the_body_is_returned() throws IOException {
      final var fetcher = HttpDataFetcher.withTimeout(Duration.ofSeconds(2));

      assertArrayEquals(
          "<article/>".getBytes(StandardCharsets.UTF_8), fetcher.fetch(baseUrl + "/article.xml"));
    }

    @Test
    void when_server_answers_with_an_error_io_exception_must_be_thrown() {
      final var fetcher = HttpDataFetcher.withTimeout(Duration.ofSeconds(2));

      assertThrows(IOException.class, () -> fetcher.fetch(baseUrl + "/missing.xml"));
    }
  }
}
