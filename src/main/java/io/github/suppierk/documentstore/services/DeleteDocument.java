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
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.exceptions.VersionAlreadySetException;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.UUID;

/**
 * Tombstones a document. Its history stays readable by timestamp, its current data does not.
 *
 * <p>Deleting a document twice fails with {@link VersionAlreadySetException}, which callers may
 * treat as success.
 */
public record DeleteDocument(UUID messageId, Instant createdAt, String id)
    implements DomainCommand.Delete<Document> {
  public DeleteDocument(final String id) {
    this(UUID.randomUUID(), Instant.now(), id);
  }

  public static final class Handler extends DomainCommandHandler.Delete<DeleteDocument, Document> {
    public Handler() {
      super(DeleteDocument.class);
    }

    @Override
    protected void mutate(final DeleteDocument command, final Document document) {
      document.delete();
    }

    @Override
    protected AggregateRepository<Document, ?> repository(final Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_DELETED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }
  }
}
