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
import java.util.Map;
import java.util.UUID;

/**
 * Registers a new upload of one asset of the latest document version.
 *
 * <p>Fails with {@link VersionAlreadySetException} if the slot already points at the same URL.
 *
 * @param messageId identifier of this command
 * @param createdAt when this command was created
 * @param id of the document
 * @param assetId slot declared by the latest version
 * @param assetUrl publicly reachable URL of the upload
 */
public record RegisterAssetVersion(
    UUID messageId, Instant createdAt, String id, String assetId, String assetUrl)
    implements DomainCommand.Update<Document> {
  public RegisterAssetVersion(final String id, final String assetId, final String assetUrl) {
    this(UUID.randomUUID(), Instant.now(), id, assetId, assetUrl);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<RegisterAssetVersion, Document> {
    public Handler() {
      super(RegisterAssetVersion.class);
    }

    @Override
    protected void mutate(final RegisterAssetVersion command, final Document document) {
      document.newAssetVersion(command.assetId(), command.assetUrl());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(final Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.ASSET_VERSION_REGISTERED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }

    @Override
    protected Map<String, Object> arguments(final RegisterAssetVersion command) {
      return Map.of(
          "id", command.id(), "asset_id", command.assetId(), "asset_url", command.assetUrl());
    }
  }
}
