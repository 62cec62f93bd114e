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

public record RemoveDocumentFromDocumentsBundle(
    UUID messageId, Instant createdAt, String id, String doc)
    implements DomainCommand.Update<DocumentsBundle> {
  public RemoveDocumentFromDocumentsBundle(final String id, final String doc) {
    this(UUID.randomUUID(), Instant.now(), id, doc);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<RemoveDocumentFromDocumentsBundle, DocumentsBundle> {
    public Handler() {
      super(RemoveDocumentFromDocumentsBundle.class);
    }

    @Override
    protected void mutate(
        final RemoveDocumentFromDocumentsBundle command, final DocumentsBundle bundle) {
      bundle.removeDocument(command.doc());
    }

    @Override
    protected AggregateRepository<DocumentsBundle, ?> repository(final Session session) {
      return session.documentsBundles();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_REMOVED_FROM_DOCUMENTSBUNDLE;
    }

    @Override
    protected String aggregateName() {
      return "bundle";
    }

    @Override
    protected Map<String, Object> arguments(final RemoveDocumentFromDocumentsBundle command) {
      return Map.of("id", command.id(), "doc", command.doc());
    }
  }
}
