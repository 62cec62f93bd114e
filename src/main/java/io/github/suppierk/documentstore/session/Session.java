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

import io.github.suppierk.documentstore.async.DomainNotification;
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.async.Subscriber;
import io.github.suppierk.documentstore.changes.ChangeLog;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.fetch.DataFetcher;
import io.github.suppierk.documentstore.persistence.DocumentRepository;
import io.github.suppierk.documentstore.persistence.DocumentsBundleRepository;
import io.github.suppierk.documentstore.persistence.JournalRepository;
import io.github.suppierk.documentstore.persistence.StorageDriver;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work of a single command: one repository per aggregate kind, the change log and the
 * subscribers to notify once the command succeeded.
 *
 * <p>A session lives for exactly one command invocation and is not shared between threads. The
 * repositories it hands out share the storage driver and the change log of every other session.
 * It does not span transactions over several aggregates: each repository call stands on its own.
 */
public final class Session {
  private static final Logger log = LoggerFactory.getLogger(Session.class);

  private final DocumentRepository documents;
  private final DocumentsBundleRepository documentsBundles;
  private final JournalRepository journals;
  private final ChangeLog changes;
  private final DataFetcher fetcher;
  private final VersionClock clock;
  private final Map<Event, List<Subscriber>> subscribers;

  public Session(final StorageDriver driver, final VersionClock clock, final DataFetcher fetcher) {
    if (driver == null) {
      throw new IllegalArgumentException("Storage driver cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Version clock cannot be null");
    }

    if (fetcher == null) {
      throw new IllegalArgumentException("Data fetcher cannot be null");
    }

    this.changes = new ChangeLog(driver, clock);
    this.documents = new DocumentRepository(driver, changes, clock);
    this.documentsBundles = new DocumentsBundleRepository(driver, changes, clock);
    this.journals = new JournalRepository(driver, changes, clock);
    this.fetcher = fetcher;
    this.clock = clock;
    this.subscribers = new EnumMap<>(Event.class);
  }

  public DocumentRepository documents() {
    return documents;
  }

  public DocumentsBundleRepository documentsBundles() {
    return documentsBundles;
  }

  public JournalRepository journals() {
    return journals;
  }

  public ChangeLog changes() {
    return changes;
  }

  public DataFetcher fetcher() {
    return fetcher;
  }

  public VersionClock clock() {
    return clock;
  }

  /**
   * Registers a subscriber for the rest of this session.
   *
   * @param event to listen to
   * @param subscriber to invoke, after the ones already registered for the same event
   */
  public void observe(final Event event, final Subscriber subscriber) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (subscriber == null) {
      throw new IllegalArgumentException("Subscriber cannot be null");
    }

    subscribers.computeIfAbsent(event, ignored -> new ArrayList<>()).add(subscriber);
  }

  /**
   * Invokes every subscriber of the notification's event in registration order.
   *
   * <p>A subscriber failure is logged and the remaining subscribers are still invoked.
   *
   * @param notification to deliver
   */
  public void notify(final DomainNotification notification) {
    final Event event = notification.event();
    for (Subscriber subscriber : subscribers.getOrDefault(event, List.of())) {
      try {
        subscriber.onEvent(event, notification.payload());
      } catch (RuntimeException e) {
        log.warn("Subscriber {} failed to handle {}", subscriber, event, e);
      }
    }
  }
}
