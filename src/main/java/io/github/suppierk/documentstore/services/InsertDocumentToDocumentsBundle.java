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

package io.github.suppierk.documentstore.services;

import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.cqrs.DomainCommand;
import io.github.suppierk.documentstore.cqrs.DomainCommandHandler;
import io.github.suppierk.documentstore.domain.DocumentsBundle;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Inserts a document into a bundle before the given position. Out of range positions insert at the
 * nearest end.
 */
public record InsertDocumentToDocumentsBundle(
    UUID messageId, Instant createdAt, String id, int index, String doc)
    implements DomainCommand.Update<DocumentsBundle> {
  public InsertDocumentToDocumentsBundle(final String id, final int index, final String doc) {
    this(UUID.randomUUID(), Instant.now(), id, index, doc);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<InsertDocumentToDocumentsBundle, DocumentsBundle> {
    public Handler() {
      super(InsertDocumentToDocumentsBundle.class);
    }

    @Override
    protected void mutate(
        final InsertDocumentToDocumentsBundle command, final DocumentsBundle bundle) {
      bundle.insertDocument(command.index(), command.doc());
    }

    @Override
    protected AggregateRepository<DocumentsBundle, ?> repository(final Session session) {
      return session.documentsBundles();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_INSERTED_TO_DOCUMENTSBUNDLE;
    }

    @Override
    protected String aggregateName() {
      return "bundle";
    }

    @Override
    protected Map<String, Object> arguments(final InsertDocumentToDocumentsBundle command) {
      return Map.of("id", command.id(), "index", command.index(), "doc", command.doc());
    }
  }
}
