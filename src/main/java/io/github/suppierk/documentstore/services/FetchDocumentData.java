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
import io.github.suppierk.documentstore.session.Session;
import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * Fetches the XML of a document version.
 *
 * @param messageId identifier of this query
 * @param createdAt when this query was created
 * @param id of the document
 * @param versionIndex position in history, {@code -1} being the latest
 * @param versionAt optional UTC timestamp; when given the version current at that moment is read
 *     and {@code versionIndex} is ignored
 */
public record FetchDocumentData(
    UUID messageId, Instant createdAt, String id, int versionIndex, String versionAt)
    implements DomainQuery.One<byte[]> {
  public FetchDocumentData(final String id, final int versionIndex, final String versionAt) {
    this(UUID.randomUUID(), Instant.now(), id, versionIndex, versionAt);
  }

  public FetchDocumentData(final String id) {
    this(id, -1, null);
  }

  public static final class Handler extends DomainQueryHandler.One<FetchDocumentData, byte[]> {
    public Handler() {
      super(FetchDocumentData.class);
    }

    @Override
    protected byte[] run(final FetchDocumentData query, final Session session) throws IOException {
      return session
          .documents()
          .fetch(query.id())
          .data(session.fetcher(), query.versionIndex(), query.versionAt());
    }
  }
}
