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

package io.github.suppierk.documentstore.changes;

import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.exceptions.ValidationException;
import io.github.suppierk.documentstore.persistence.StorageDriver;
import java.util.List;

/**
 * Append-only, time-ordered feed of the changes made to every aggregate, consumed by external
 * indexers.
 *
 * <p>Entries are ordered by {@code (timestamp, insertion order)}. Subscribers page through the
 * feed by passing the timestamp of the last entry they processed as {@code since}.
 */
public final class ChangeLog {
  public static final int DEFAULT_LIMIT = 500;

  private final StorageDriver driver;
  private final VersionClock clock;

  public ChangeLog(final StorageDriver driver, final VersionClock clock) {
    if (driver == null) {
      throw new IllegalArgumentException("Storage driver cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Version clock cannot be null");
    }

    this.driver = driver;
    this.clock = clock;
  }

  /**
   * Stamps a change without storing it. Drivers call this under their write lock and persist the
   * result together with the record.
   *
   * @param kind of the changed aggregate
   * @param id of the changed aggregate
   * @param deleted {@code true} if the change tombstones the aggregate
   * @return change stamped with the current time
   */
  public Change entry(final EntityKind kind, final String id, final boolean deleted) {
    return new Change(kind.path(id), clock.nextTimestamp(), deleted);
  }

  /**
   * Reads a page of the feed.
   *
   * @param since empty to read from the beginning, otherwise the timestamp of a known entry to read
   *     strictly after it; unknown timestamps yield an empty page
   * @param limit maximum number of entries to return
   * @return entries in feed order
   * @throws ValidationException if the limit is not positive
   */
  public List<Change> filter(final String since, final int limit) {
    if (limit <= 0) {
      throw new ValidationException("Limit must be a positive number, got %d".formatted(limit));
    }

    return driver.changes(since == null ? "" : since, limit);
  }

  /**
   * @see #filter(String, int)
   */
  public List<Change> filter() {
    return filter("", DEFAULT_LIMIT);
  }
}
