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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/** {@link StorageDriver} keeping everything on the heap, for tests and local experiments. */
public final class InMemoryStorageDriver implements StorageDriver {
  private final Map<EntityKind, Map<String, StoredRecord>> collections;
  private final List<Change> changes;

  public InMemoryStorageDriver() {
    this.collections = new EnumMap<>(EntityKind.class);
    for (EntityKind kind : EntityKind.values()) {
      collections.put(kind, new HashMap<>());
    }

    this.changes = new ArrayList<>();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void insert(
      final EntityKind kind, final String id, final byte[] payload, final Supplier<Change> stamp) {
    final var collection = collections.get(kind);
    if (collection.containsKey(id)) {
      throw new AlreadyExistsException(
          "Cannot add '%s' to %s: already exists".formatted(id, kind.collection()));
    }

    final var change = stamp.get();
    collection.put(id, new StoredRecord(id, StoredRecord.FIRST_REVISION, payload.clone()));
    changes.add(change);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<StoredRecord> find(final EntityKind kind, final String id) {
    return Optional.ofNullable(collections.get(kind).get(id))
        .map(stored -> new StoredRecord(stored.id(), stored.revision(), stored.payload().clone()));
  }

  /** {@inheritDoc} */
  @Override
  public synchronized boolean replace(
      final EntityKind kind,
      final String id,
      final long expectedRevision,
      final byte[] payload,
      final Supplier<Change> stamp) {
    final var collection = collections.get(kind);
    final var stored = collection.get(id);
    if (stored == null) {
      throw new DoesNotExistException(
          "Cannot update '%s' in %s: does not exist".formatted(id, kind.collection()));
    }

    if (stored.revision() != expectedRevision) {
      return false;
    }

    final var change = stamp.get();
    collection.put(id, new StoredRecord(id, expectedRevision + 1, payload.clone()));
    changes.add(change);
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<Change> changes(final String since, final int limit) {
    final var ordered = new ArrayList<>(changes);
    ordered.sort(Comparator.comparing(Change::timestamp)); // stable: ties keep insertion order

    int start = 0;
    if (!since.isEmpty()) {
      start = -1;
      for (int i = 0; i < ordered.size(); i++) {
        if (ordered.get(i).timestamp().equals(since)) {
          start = i + 1;
        }
      }

      if (start < 0) {
        return List.of();
      }
    }

    return List.copyOf(ordered.subList(start, Math.min(ordered.size(), start + limit)));
  }
}
