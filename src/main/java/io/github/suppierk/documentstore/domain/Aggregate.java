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

package io.github.suppierk.documentstore.domain;

/**
 * Root entity with its full local history, the unit of consistency of the store.
 *
 * <p>Besides its own state every aggregate remembers the storage revision it was read at. The
 * repository compares that revision with the stored one before writing, which is how concurrent
 * writers of the same id are detected.
 *
 * @param <M> the manifest type describing this aggregate
 */
public abstract class Aggregate<M> {
  /** Revision of an aggregate which has never been stored. */
  public static final long UNSAVED = 0L;

  private final String id;
  protected final VersionClock clock;
  private long revision;

  protected Aggregate(final String id, final VersionClock clock) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Aggregate id cannot be empty");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Version clock cannot be null");
    }

    this.id = id;
    this.clock = clock;
    this.revision = UNSAVED;
  }

  public final String id() {
    return id;
  }

  /**
   * @return storage revision this instance was loaded at, or {@link #UNSAVED}
   */
  public final long revision() {
    return revision;
  }

  /**
   * Used by repositories only, after reading or writing the aggregate.
   *
   * @param revision currently stored
   */
  public final void markStoredAt(final long revision) {
    this.revision = revision;
  }

  /**
   * @return serializable snapshot of the current state
   */
  public abstract M manifest();
}
