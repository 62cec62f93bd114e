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

package io.github.suppierk.documentstore.persistence;

import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.changes.EntityKind;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence backend: one collection of {@link StoredRecord}s per {@link EntityKind} plus the
 * change feed.
 *
 * <p>Implementations are shared by every session and must be thread-safe. Every write stores the
 * record and its {@link Change} together: either both become visible or neither does.
 *
 * <p>Writes receive the change as a stamp which the driver calls only once it holds its write
 * lock, so the feed order by timestamp is also the commit order. A subscriber that has read an
 * entry never misses an entry committed after it.
 */
public interface StorageDriver {
  /**
   * Stores a new record at revision {@link StoredRecord#FIRST_REVISION}.
   *
   * @param stamp called at most once, under the write lock, to produce the change entry
   * @throws AlreadyExistsException if the id is already taken
   */
  void insert(
      final EntityKind kind, final String id, final byte[] payload, final Supplier<Change> stamp);

  Optional<StoredRecord> find(final EntityKind kind, final String id);

  /**
   * Replaces a record if it is still at {@code expectedRevision}.
   *
   * @param stamp called at most once, under the write lock, to produce the change entry
   * @return {@code true} if the record was replaced, {@code false} if another writer replaced it
   *     first
   * @throws DoesNotExistException if the id is absent
   */
  boolean replace(
      final EntityKind kind,
      final String id,
      final long expectedRevision,
      final byte[] payload,
      final Supplier<Change> stamp);

  /**
   * Reads the change feed ordered by {@code (timestamp, insertion order)}.
   *
   * @param since empty to read from the beginning; otherwise entries strictly after the last entry
   *     stamped {@code since} are returned, or nothing if no entry carries that stamp
   * @param limit maximum number of entries to return
   * @return entries in feed order
   */
  List<Change> changes(final String since, final int limit);
}
