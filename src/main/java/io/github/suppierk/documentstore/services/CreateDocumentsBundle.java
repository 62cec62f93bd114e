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
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates a documents bundle, optionally with its first documents and descriptive metadata.
 *
 * @param messageId identifier of this command
 * @param createdAt when this command was created
 * @param id of the bundle, must be unique
 * @param docs document ids, in bundle order
 * @param metadata descriptive fields such as {@code publication_year} or {@code titles}
 */
public record CreateDocumentsBundle(
    UUID messageId,
    Instant createdAt,
    String id,
    List<String> docs,
    Map<String, JsonNode> metadata)
    implements DomainCommand.Create<DocumentsBundle> {
  public CreateDocumentsBundle {
    docs = docs == null ? List.of() : List.copyOf(docs);
    metadata = copyOfMetadata(metadata);
  }

  public CreateDocumentsBundle(
      final String id, final List<String> docs, final Map<String, JsonNode> metadata) {
    this(UUID.randomUUID(), Instant.now(), id, docs, metadata);
  }

  static Map<String, JsonNode> copyOfMetadata(final Map<String, JsonNode> metadata) {
    return metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static final class Handler
      extends DomainCommandHandler.Create<CreateDocumentsBundle, DocumentsBundle> {
    public Handler() {
      super(CreateDocumentsBundle.class);
    }

    @Override
    protected DocumentsBundle newAggregate(
        final CreateDocumentsBundle command, final VersionClock clock) {
      return new DocumentsBundle(command.id(), clock);
    }

    @Override
    protected void mutate(final CreateDocumentsBundle command, final DocumentsBundle bundle) {
      command.docs().forEach(bundle::addDocument);
      bundle.updateMetadata(command.metadata());
    }

    @Override
    protected AggregateRepository<DocumentsBundle, ?> repository(final Session session) {
      return session.documentsBundles();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENTSBUNDLE_CREATED;
    }

    @Override
    protected String aggregateName() {
      return "bundle";
    }

    @Override
    protected Map<String, Object> arguments(final CreateDocumentsBundle command) {
      return Map.of("id", command.id(), "docs", command.docs(), "metadata", command.metadata());
    }
  }
}
