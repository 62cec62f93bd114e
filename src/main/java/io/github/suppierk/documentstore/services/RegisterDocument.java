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
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Registers a new document with its first XML version.
 *
 * @param messageId identifier of this command
 * @param createdAt when this command was created
 * @param id of the document, must be unique
 * @param dataUrl publicly reachable URL of the XML
 * @param assets asset slots referenced by the XML mapped to their URL; an empty or {@code null} URL
 *     declares the slot without uploading it
 */
public record RegisterDocument(
    UUID messageId, Instant createdAt, String id, String dataUrl, Map<String, String> assets)
    implements DomainCommand.Create<Document> {
  public RegisterDocument {
    assets = copyOfAssets(assets);
  }

  public RegisterDocument(final String id, final String dataUrl, final Map<String, String> assets) {
    this(UUID.randomUUID(), Instant.now(), id, dataUrl, assets);
  }

  static Map<String, String> copyOfAssets(final Map<String, String> assets) {
    return assets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
  }

  /**
   * Appends an XML version to the document and registers the given asset uploads against it.
   * Uploads which the inherited slot already points at are skipped.
   *
   * @param document to change
   * @param dataUrl of the new XML
   * @param assets declared slots mapped to their URL
   */
  static void registerVersion(
      final Document document, final String dataUrl, final Map<String, String> assets) {
    document.newVersion(dataUrl, assets.keySet());
    assets.forEach(
        (assetId, assetUrl) -> {
          if (assetUrl != null
              && !assetUrl.isBlank()
              && !document.hasAssetVersion(assetId, assetUrl)) {
            document.newAssetVersion(assetId, assetUrl);
          }
        });
  }

  static Map<String, Object> arguments(
      final String id, final String dataUrl, final Map<String, String> assets) {
    final var arguments = new LinkedHashMap<String, Object>();
    arguments.put("id", id);
    arguments.put("data_url", dataUrl);
    arguments.put("assets", assets);
    return arguments;
  }

  public static final class Handler
      extends DomainCommandHandler.Create<RegisterDocument, Document> {
    public Handler() {
      super(RegisterDocument.class);
    }

    @Override
    protected Document newAggregate(final RegisterDocument command, final VersionClock clock) {
      return new Document(command.id(), clock);
    }

    @Override
    protected void mutate(final RegisterDocument command, final Document document) {
      registerVersion(document, command.dataUrl(), command.assets());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(final Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_REGISTERED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }

    @Override
    protected Map<String, Object> arguments(final RegisterDocument command) {
      return RegisterDocument.arguments(command.id(), command.dataUrl(), command.assets());
    }
  }
}
