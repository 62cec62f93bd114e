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

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.max;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.noCondition;
import static org.jooq.impl.DSL.table;

import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.changes.EntityKind;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StorageDriver} over a relational database through jOOQ.
 *
 * <p>Each {@link EntityKind} lives in its own table of {@code (id, revision, payload)} rows and the
 * change feed lives in a {@code changes} table. Every write runs in one transaction together with
 * its change entry, and {@link #replace} is a compare-and-set on the revision column.
 *
 * <p>Writers through one driver instance are serialised, and the change entry is stamped inside
 * the write transaction, so feed timestamps follow commit order. Deployments with several writer
 * processes must route all writes through one of them.
 *
 * <p><b>Design note</b>: reads and writes can be routed to different databases by supplying two
 * different {@link DslContextProvider}s, the feed is read through the read-only one.
 */
public final class JooqStorageDriver implements StorageDriver {
  private static final Logger log = LoggerFactory.getLogger(JooqStorageDriver.class);

  static final Field<String> ID = field(name("id"), SQLDataType.VARCHAR(255).nullable(false));
  static final Field<Long> REVISION = field(name("revision"), SQLDataType.BIGINT.nullable(false));
  static final Field<byte[]> PAYLOAD =
      field(name("payload"), SQLDataType.VARBINARY.nullable(false));

  static final Table<Record> CHANGES = table(name("changes"));
  static final Field<Long> SEQ = field(name("seq"), SQLDataType.BIGINT.identity(true));
  static final Field<String> PATH = field(name("path"), SQLDataType.VARCHAR(512).nullable(false));
  static final Field<String> TS = field(name("ts"), SQLDataType.VARCHAR(32).nullable(false));
  static final Field<Boolean> DELETED =
      field(name("deleted"), SQLDataType.BOOLEAN.nullable(false));

  private final DslContextProvider readWriteDslProvider;
  private final DslContextProvider readOnlyDslProvider;
  private final ReentrantLock writeLock;

  public JooqStorageDriver(
      final DslContextProvider readWriteDslProvider,
      final DslContextProvider readOnlyDslProvider) {
    if (readWriteDslProvider == null) {
      throw new IllegalArgumentException("Read-write DSL provider cannot be null");
    }

    if (readOnlyDslProvider == null) {
      throw new IllegalArgumentException("Read-only DSL provider cannot be null");
    }

    this.readWriteDslProvider = readWriteDslProvider;
    this.readOnlyDslProvider = readOnlyDslProvider;
    this.writeLock = new ReentrantLock(true);
  }

  /**
   * @param dslContext used for both reads and writes
   * @return driver with a single database
   */
  public static JooqStorageDriver using(final DSLContext dslContext) {
    final var provider = DslContextProvider.dslContextIdentity(dslContext);
    return new JooqStorageDriver(provider, provider);
  }

  static Table<Record> tableOf(final EntityKind kind) {
    return table(name(kind.collection()));
  }

  /** Creates the collection tables and the change feed table if they do not exist yet. */
  public void createSchema() {
    final DSLContext dsl = readWriteDslProvider.get();

    for (EntityKind kind : EntityKind.values()) {
      dsl.createTableIfNotExists(tableOf(kind))
          .column(ID)
          .column(REVISION)
          .column(PAYLOAD)
          .primaryKey(ID)
          .execute();
    }

    dsl.createTableIfNotExists(CHANGES)
        .column(SEQ)
        .column(PATH)
        .column(TS)
        .column(DELETED)
        .primaryKey(SEQ)
        .execute();

    log.debug("Storage schema is in place");
  }

  /** {@inheritDoc} */
  @Override
  public void insert(
      final EntityKind kind, final String id, final byte[] payload, final Supplier<Change> stamp) {
    final boolean inserted;
    writeLock.lock();
    try {
      inserted =
          readWriteDslProvider
              .get()
              .transactionResult(
                  (final Configuration trx) -> {
                    final DSLContext dsl = trx.dsl();
                    if (dsl.fetchExists(tableOf(kind), ID.eq(id))) {
                      return false;
                    }

                    dsl.insertInto(tableOf(kind))
                        .columns(ID, REVISION, PAYLOAD)
                        .values(id, StoredRecord.FIRST_REVISION, payload)
                        .execute();
                    insertChange(dsl, stamp.get());
                    return true;
                  });
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new AlreadyExistsException(
            "Cannot add '%s' to %s: already exists".formatted(id, kind.collection()), e);
      }

      throw e;
    } finally {
      writeLock.unlock();
    }

    if (!inserted) {
      throw new AlreadyExistsException(
          "Cannot add '%s' to %s: already exists".formatted(id, kind.collection()));
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<StoredRecord> find(final EntityKind kind, final String id) {
    return readOnlyDslProvider
        .get()
        .select(ID, REVISION, PAYLOAD)
        .from(tableOf(kind))
        .where(ID.eq(id))
        .fetchOptional(row -> new StoredRecord(row.get(ID), row.get(REVISION), row.get(PAYLOAD)));
  }

  /** {@inheritDoc} */
  @Override
  public boolean replace(
      final EntityKind kind,
      final String id,
      final long expectedRevision,
      final byte[] payload,
      final Supplier<Change> stamp) {
    final ReplaceOutcome outcome;
    writeLock.lock();
    try {
      outcome =
          readWriteDslProvider
              .get()
              .transactionResult(
                  (final Configuration trx) -> {
                    final DSLContext dsl = trx.dsl();
                    final int updated =
                        dsl.update(tableOf(kind))
                            .set(REVISION, expectedRevision + 1)
                            .set(PAYLOAD, payload)
                            .where(ID.eq(id).and(REVISION.eq(expectedRevision)))
                            .execute();

                    if (updated == 0) {
                      return dsl.fetchExists(tableOf(kind), ID.eq(id))
                          ? ReplaceOutcome.STALE
                          : ReplaceOutcome.MISSING;
                    }

                    insertChange(dsl, stamp.get());
                    return ReplaceOutcome.REPLACED;
                  });
    } finally {
      writeLock.unlock();
    }

    if (outcome == ReplaceOutcome.MISSING) {
      throw new DoesNotExistException(
          "Cannot update '%s' in %s: does not exist".formatted(id, kind.collection()));
    }

    return outcome == ReplaceOutcome.REPLACED;
  }

  /** {@inheritDoc} */
  @Override
  public List<Change> changes(final String since, final int limit) {
    final DSLContext dsl = readOnlyDslProvider.get();

    Condition after = noCondition();
    if (!since.isEmpty()) {
      final Long anchor =
          dsl.select(max(SEQ)).from(CHANGES).where(TS.eq(since)).fetchOne(0, Long.class);
      if (anchor == null) {
        return List.of();
      }

      after = TS.gt(since).or(TS.eq(since).and(SEQ.gt(anchor)));
    }

    return dsl.select(PATH, TS, DELETED)
        .from(CHANGES)
        .where(after)
        .orderBy(TS, SEQ)
        .limit(limit)
        .fetch(row -> new Change(row.get(PATH), row.get(TS), row.get(DELETED)));
  }

  private static void insertChange(final DSLContext dsl, final Change change) {
    dsl.insertInto(CHANGES)
        .columns(PATH, TS, DELETED)
        .values(change.id(), change.timestamp(), change.deleted())
        .execute();
  }

  private enum ReplaceOutcome {
    REPLACED,
    STALE,
    MISSING
  }
}
