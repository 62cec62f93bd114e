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
import io.github.suppierk.documentstore.domain.DocumentsBundleManifest;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.UUID;

public record FetchDocumentsBundle(UUID messageId, Instant createdAt, String id)
    implements DomainQuery.One<DocumentsBundleManifest> {
  public FetchDocumentsBundle(final String id) {
    this(UUID.randomUUID(), Instant.now(), id);
  }

  public static final class Handler
      extends DomainQueryHandler.One<FetchDocumentsBundle, DocumentsBundleManifest> {
    public Handler() {
      super(FetchDocumentsBundle.class);
    }

    @Override
    protected DocumentsBundleManifest run(
        final FetchDocumentsBundle query, final Session session) {
      return session.documentsBundles().fetch(query.id()).manifest();
    }
  }
}
