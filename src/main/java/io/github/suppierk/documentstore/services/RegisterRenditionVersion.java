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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Registers a rendition, such as a PDF, of the latest document version. Re-submitting the rendition
 * currently registered for the same {@code (filename, mimetype, lang)} slot is refused.
 */
public record RegisterRenditionVersion(
    UUID messageId,
    Instant createdAt,
    String id,
    String filename,
    String dataUrl,
    String mimetype,
    String lang,
    long sizeBytes)
    implements DomainCommand.Update<Document> {
  public RegisterRenditionVersion(
      final String id,
      final String filename,
      final String dataUrl,
      final String mimetype,
      final String lang,
      final long sizeBytes) {
    this(UUID.randomUUID(), Instant.now(), id, filename, dataUrl, mimetype, lang, sizeBytes);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<RegisterRenditionVersion, Document> {
    public Handler() {
      super(RegisterRenditionVersion.class);
    }

    @Override
    protected void mutate(final RegisterRenditionVersion command, final Document document) {
      document.newRenditionVersion(
          command.filename(),
          command.dataUrl(),
          command.mimetype(),
          command.lang(),
          command.sizeBytes());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(final Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_RENDITION_REGISTERED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }

    @Override
    protected Map<String, Object> arguments(final RegisterRenditionVersion command) {
      final var arguments = new LinkedHashMap<String, Object>();
      arguments.put("id", command.id());
      arguments.put("filename", command.filename());
      arguments.put("data_url", command.dataUrl());
      arguments.put("mimetype", command.mimetype());
      arguments.put("lang", command.lang());
      arguments.put("size_bytes", command.sizeBytes());
      return arguments;
    }
  }
}
