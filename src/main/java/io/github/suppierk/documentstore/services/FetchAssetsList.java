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
import io.github.suppierk.documentstore.domain.DocumentVersion;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.UUID;

/**
 * Fetches one document version along with the history of each of its asset slots.
 *
 * @param messageId identifier of this query
 * @param createdAt when this query was created
 * @param id of the document
 * @param versionIndex position in history, {@code -1} being the latest
 */
public record FetchAssetsList(UUID messageId, Instant createdAt, String id, int versionIndex)
    implements DomainQuery.One<DocumentVersion> {
  public FetchAssetsList(final String id, final int versionIndex) {
    this(UUID.randomUUID(), Instant.now(), id, versionIndex);
  }

  public FetchAssetsList(final String id) {
    this(id, -1);
  }

  public static final class Handler
      extends DomainQueryHandler.One<FetchAssetsList, DocumentVersion> {
    public Handler() {
      super(FetchAssetsList.class);
    }

    @Override
    protected DocumentVersion run(final FetchAssetsList query, final Session session) {
      return session.documents().fetch(query.id()).version(query.versionIndex(), null);
    }
  }
}
