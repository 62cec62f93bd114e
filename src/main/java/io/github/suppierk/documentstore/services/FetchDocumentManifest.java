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

import io.github.suppierk.documentstore.cqrs.DomainQuery;
import io.github.suppierk.documentstore.cqrs.DomainQueryHandler;
import io.github.suppierk.documentstore.domain.DocumentManifest;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.UUID;

/** Fetches the full history of a document, tombstone included. */
public record FetchDocumentManifest(UUID messageId, Instant createdAt, String id)
    implements DomainQuery.One<DocumentManifest> {
  public FetchDocumentManifest(final String id) {
    this(UUID.randomUUID(), Instant.now(), id);
  }

  public static final class Handler
      extends DomainQueryHandler.One<FetchDocumentManifest, DocumentManifest> {
    public Handler() {
      super(FetchDocumentManifest.class);
    }

    @Override
    protected DocumentManifest run(final FetchDocumentManifest query, final Session session) {
      return session.documents().fetch(query.id()).manifest();
    }
  }
}
