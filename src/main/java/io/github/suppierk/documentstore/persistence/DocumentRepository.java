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
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.domain.DocumentManifest;
import io.github.suppierk.documentstore.domain.VersionClock;

/** Stores {@link Document}s; tombstoning writes are flagged as deletions in the change feed. */
public final class DocumentRepository extends AggregateRepository<Document, DocumentManifest> {
  public DocumentRepository(
      final StorageDriver driver, final ChangeLog changeLog, final VersionClock clock) {
    super(EntityKind.DOCUMENT, DocumentManifest.class, driver, changeLog, clock);
  }

  /** {@inheritDoc} */
  @Override
  protected Document reconstitute(final DocumentManifest manifest) {
    return Document.fromManifest(manifest, clock);
  }

  /** {@inheritDoc} */
  @Override
  protected boolean isDeleted(final Document document) {
    return document.isDeleted();
  }
}
