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
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Replaces the documents of a bundle wholesale.
 *
 * <p>A list with duplicates is refused with {@link AlreadyExistsException} and the bundle is left
 * as it was.
 */
public record UpdateDocumentsInDocumentsBundle(
    UUID messageId, Instant createdAt, String id, List<String> docs)
    implements DomainCommand.Update<DocumentsBundle> {
  public UpdateDocumentsInDocumentsBundle {
    docs = docs == null ? List.of() : List.copyOf(docs);
  }

  public UpdateDocumentsInDocumentsBundle(final String id, final List<String> docs) {
    this(UUID.randomUUID(), Instant.now(), id, docs);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<UpdateDocumentsInDocumentsBundle, DocumentsBundle> {
    public Handler() {
      super(UpdateDocumentsInDocumentsBundle.class);
    }

    @Override
    protected void mutate(
        final UpdateDocumentsInDocumentsBundle command, final DocumentsBundle bundle) {
      bundle.updateDocuments(command.docs());
    }

    @Override
    protected AggregateRepository<DocumentsBundle, ?> repository(final Session session) {
      return session.documentsBundles();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENTS_UPDATED_IN_DOCUMENTSBUNDLE;
    }

    @Override
    protected String aggregateName() {
      return "bundle";
    }

    @Override
    protected Map<String, Object> arguments(final UpdateDocumentsInDocumentsBundle command) {
      return Map.of("id", command.id(), "docs", command.docs());
    }
  }
}
