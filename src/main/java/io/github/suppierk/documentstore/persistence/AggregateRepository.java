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

import io.github.suppierk.documentstore.changes.ChangeLog;
import io.github.suppierk.documentstore.changes.EntityKind;
import io.github.suppierk.documentstore.domain.Aggregate;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import io.github.suppierk.documentstore.exceptions.RetryableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one kind of aggregate through a {@link StorageDriver}.
 *
 * <p>Repositories are the only writers of the change feed: every successful {@link #add} or
 * {@link #update} stores exactly one {@link
 * io.github.suppierk.documentstore.changes.Change} for the aggregate, in the same driver call as
 * the record itself, stamped by the driver once it holds its write lock. They do not notify
 * subscribers.
 *
 * <p><b>Design note</b>: {@link #update} is optimistic. The aggregate remembers the revision it was
 * fetched at, and the write is refused if the stored revision moved in the meantime. Retrying is
 * up to the caller, which has to fetch again and replay its mutation.
 *
 * @param <A> type of the aggregate
 * @param <M> type of its manifest, which is what gets stored
 */
public abstract class AggregateRepository<A extends Aggregate<?>, M> {
  private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

  private final EntityKind kind;
  private final Class<M> manifestClass;
  private final StorageDriver driver;
  private final ChangeLog changeLog;
  protected final VersionClock clock;

  protected AggregateRepository(
      final EntityKind kind,
      final Class<M> manifestClass,
      final StorageDriver driver,
      final ChangeLog changeLog,
      final VersionClock clock) {
    if (driver == null) {
      throw new IllegalArgumentException("Storage driver cannot be null");
    }

    if (changeLog == null) {
      throw new IllegalArgumentException("Change log cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Version clock cannot be null");
    }

    this.kind = kind;
    this.manifestClass = manifestClass;
    this.driver = driver;
    this.changeLog = changeLog;
    this.clock = clock;
  }

  /**
   * Rebuilds an aggregate from its stored manifest.
   *
   * @param manifest as stored
   * @return aggregate bound to this repository's clock
   */
  protected abstract A reconstitute(final M manifest);

  /**
   * @param aggregate about to be written
   * @return {@code true} if the change feed entry must be flagged as a deletion
   */
  protected boolean isDeleted(final A aggregate) {
    return false;
  }

  /**
   * @return kind of aggregates this repository stores
   */
  public final EntityKind kind() {
    return kind;
  }

  /**
   * Stores a new aggregate.
   *
   * @param aggregate to store
   * @throws AlreadyExistsException if the id is already taken
   */
  public final void add(final A aggregate) {
    final String id = aggregate.id();
    final boolean deleted = isDeleted(aggregate);
    driver.insert(
        kind, id, JsonCodec.encode(aggregate.manifest()), () -> changeLog.entry(kind, id, deleted));
    aggregate.markStoredAt(StoredRecord.FIRST_REVISION);
  }

  /**
   * @param id of the aggregate
   * @return aggregate as currently stored
   * @throws DoesNotExistException if nothing is stored under the id
   */
  public final A fetch(final String id) {
    final StoredRecord stored =
        driver
            .find(kind, id)
            .orElseThrow(
                () ->
                    new DoesNotExistException(
                        "Cannot fetch '%s' from %s: does not exist"
                            .formatted(id, kind.collection())));

    final A aggregate = reconstitute(JsonCodec.decode(stored.payload(), manifestClass));
    aggregate.markStoredAt(stored.revision());
    return aggregate;
  }

  /**
   * Replaces a stored aggregate with its mutated copy.
   *
   * @param aggregate previously returned by {@link #fetch(String)} and mutated since
   * @throws DoesNotExistException if nothing is stored under the id
   * @throws RetryableException if another writer updated the aggregate after it was fetched
   */
  public final void update(final A aggregate) {
    final String id = aggregate.id();
    final long expectedRevision = aggregate.revision();
    final boolean deleted = isDeleted(aggregate);

    final boolean replaced =
        driver.replace(
            kind,
            id,
            expectedRevision,
            JsonCodec.encode(aggregate.manifest()),
            () -> changeLog.entry(kind, id, deleted));

    if (!replaced) {
      log.debug("Concurrent update of {} detected at revision {}", kind.path(id), expectedRevision);
      throw new RetryableException(
          "'%s' in %s was changed by another writer".formatted(id, kind.collection()));
    }

    aggregate.markStoredAt(expectedRevision + 1);
  }
}
