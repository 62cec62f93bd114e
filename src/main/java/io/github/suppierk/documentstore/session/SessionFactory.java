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

package io.github.suppierk.documentstore.session;

import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.async.Subscriber;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.fetch.DataFetcher;
import io.github.suppierk.documentstore.persistence.StorageDriver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hands out a fresh {@link Session} per command, each one observed by the same subscribers.
 *
 * <p>The storage driver, the clock and the fetcher are shared by every session created here.
 */
public final class SessionFactory {
  private final StorageDriver driver;
  private final VersionClock clock;
  private final DataFetcher fetcher;
  private final List<Map.Entry<Event, Subscriber>> subscribers;

  public SessionFactory(
      final StorageDriver driver,
      final VersionClock clock,
      final DataFetcher fetcher,
      final List<Map.Entry<Event, Subscriber>> subscribers) {
    if (driver == null) {
      throw new IllegalArgumentException("Storage driver cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Version clock cannot be null");
    }

    if (fetcher == null) {
      throw new IllegalArgumentException("Data fetcher cannot be null");
    }

    this.driver = driver;
    this.clock = clock;
    this.fetcher = fetcher;
    this.subscribers = new ArrayList<>(subscribers == null ? List.of() : subscribers);
  }

  public SessionFactory(
      final StorageDriver driver, final VersionClock clock, final DataFetcher fetcher) {
    this(driver, clock, fetcher, List.of());
  }

  /**
   * Adds a subscriber to every session created from now on.
   *
   * @param event to listen to
   * @param subscriber to invoke
   */
  public synchronized void subscribe(final Event event, final Subscriber subscriber) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (subscriber == null) {
      throw new IllegalArgumentException("Subscriber cannot be null");
    }

    subscribers.add(Map.entry(event, subscriber));
  }

  /**
   * @return new session observed by every registered subscriber
   */
  public synchronized Session create() {
    final var session = new Session(driver, clock, fetcher);
    subscribers.forEach(entry -> session.observe(entry.getKey(), entry.getValue()));
    return session;
  }
}
