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
import io.github.suppierk.documentstore.domain.Rendition;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fetches the most recent rendition of each {@code (filename, mimetype, lang)} slot of a document
 * version.
 *
 * @see FetchDocumentData for the meaning of {@code versionIndex} and {@code versionAt}
 */
public record FetchDocumentRenditions(
    UUID messageId, Instant createdAt, String id, int versionIndex, String versionAt)
    implements DomainQuery.Many<Rendition> {
  public FetchDocumentRenditions(final String id, final int versionIndex, final String versionAt) {
    this(UUID.randomUUID(), Instant.now(), id, versionIndex, versionAt);
  }

  public static final class Handler
      extends DomainQueryHandler.Many<FetchDocumentRenditions, Rendition> {
    public Handler() {
      super(FetchDocumentRenditions.class);
    }

    @Override
    protected List<Rendition> run(final FetchDocumentRenditions query, final Session session) {
      return session
          .documents()
          .fetch(query.id())
          .renditions(query.versionIndex(), query.versionAt());
    }
  }
}
