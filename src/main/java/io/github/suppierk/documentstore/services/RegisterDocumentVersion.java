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
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Registers a new XML version of an existing document. The version inherits the asset slots of the
 * previous one.
 *
 * @see RegisterDocument
 */
public record RegisterDocumentVersion(
    UUID messageId, Instant createdAt, String id, String dataUrl, Map<String, String> assets)
    implements DomainCommand.Update<Document> {
  public RegisterDocumentVersion {
    assets = RegisterDocument.copyOfAssets(assets);
  }

  public RegisterDocumentVersion(
      final String id, final String dataUrl, final Map<String, String> assets) {
    this(UUID.randomUUID(), Instant.now(), id, dataUrl, assets);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<RegisterDocumentVersion, Document> {
    public Handler() {
      super(RegisterDocumentVersion.class);
    }

    @Override
    protected void mutate(final RegisterDocumentVersion command, final Document document) {
      RegisterDocument.registerVersion(document, command.dataUrl(), command.assets());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(final Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_VERSION_REGISTERED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }

    @Override
    protected Map<String, Object> arguments(final RegisterDocumentVersion command) {
      return RegisterDocument.arguments(command.id(), command.dataUrl(), command.assets());
    }
  }
}
