package io.github.suppierk.documentstore.cqrs;

import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.changes.EntityKind;
import io.github.suppierk.documentstore.persistence.InMemoryStorageDriver;
import io.github.suppierk.documentstore.persistence.StorageDriver;
import io.github.suppierk.documentstore.persistence.StoredRecord;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Reports the first {@code conflicts} replacements as lost races against another writer. */
class ConflictingStorageDriver implements StorageDriver {
  final InMemoryStorageDriver delegate = new InMemoryStorageDriver();
  final AtomicInteger replaceCalls = new AtomicInteger();
  final int conflicts;

  ConflictingStorageDriver(int conflicts) {
    this.conflicts = conflicts;
  }

  @Override
  public void insert(EntityKind kind, String id, byte[] payload, Supplier<Change> stamp) {
    delegate.insert(kind, id, payload, stamp);
  }

  @Override
  public Optional<StoredRecord> find(EntityKind kind, String id) {
    return delegate.find(kind, id);
  }

  @Override
  public boolean replace(
      EntityKind kind, String id, long expectedRevision, byte[] payload, Supplier<Change> stamp) {
    if (replaceCalls.incrementAndGet() <= conflicts) {
      return false;
    }

    return delegate.replace(kind, id, expectedRevision, payload, stamp);
  }

  @Override
  public List<Change> changes(String since, int limit) {
    return delegate.changes(since, limit);
  }
}
