package io.github.suppierk.test;

import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.fetch.DataFetcher;
import io.github.suppierk.documentstore.persistence.InMemoryStorageDriver;
import io.github.suppierk.documentstore.persistence.StorageDriver;
import io.github.suppierk.documentstore.session.SessionFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Shared building blocks which make tests deterministic. */
public final class Fixtures {
  public static final Instant NOW = Instant.parse("2019-02-21T13:52:26.526904Z");

  private Fixtures() {
    // Static utility
  }

  /**
   * @return clock standing still at {@link #NOW}, every timestamp one microsecond after the last
   */
  public static VersionClock fixedClock() {
    return new VersionClock(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  public static SessionFactory inMemorySessionFactory(DataFetcher fetcher) {
    return inMemorySessionFactory(new InMemoryStorageDriver(), fetcher);
  }

  public static SessionFactory inMemorySessionFactory(StorageDriver driver, DataFetcher fetcher) {
    return new SessionFactory(driver, fixedClock(), fetcher);
  }
}
