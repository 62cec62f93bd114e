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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.cqrs.DomainCommand;
import io.github.suppierk.documentstore.cqrs.DomainCommandHandler;
import io.github.suppierk.documentstore.domain.DocumentsBundle;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Sets the given metadata fields of a bundle, leaving the others untouched. A JSON {@code null}
 * value removes the field.
 */
public record UpdateDocumentsBundleMetadata(
    UUID messageId, Instant createdAt, String id, Map<String, JsonNode> metadata)
    implements DomainCommand.Update<DocumentsBundle> {
  public UpdateDocumentsBundleMetadata {
    metadata = CreateDocumentsBundle.copyOfMetadata(metadata);
  }

  public UpdateDocumentsBundleMetadata(final String id, final Map<String, JsonNode> metadata) {
    this(UUID.randomUUID(), Instant.now(), id, metadata);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<UpdateDocumentsBundleMetadata, DocumentsBundle> {
    public Handler() {
      super(UpdateDocumentsBundleMetadata.class);
    }

    @Override
    protected void mutate(
        final UpdateDocumentsBundleMetadata command, final DocumentsBundle bundle) {
      bundle.updateMetadata(command.metadata());
    }

    @Override
    protected AggregateRepository<DocumentsBundle, ?> repository(final Session session) {
      return session.documentsBundles();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENTSBUNDLE_METADATA_UPDATED;
    }

    @Override
    protected String aggregateName() {
      return "bundle";
    }

    @Override
    protected Map<String, Object> arguments(final UpdateDocumentsBundleMetadata command) {
      return Map.of("id", command.id(), "metadata", command.metadata());
    }
  }
}
