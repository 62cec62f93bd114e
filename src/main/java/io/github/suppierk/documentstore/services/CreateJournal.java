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
import io.github.suppierk.documentstore.domain.Journal;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Creates a journal with its descriptive metadata, e.g. {@code title} or {@code issn_print}.
 *
 * @param messageId identifier of this command
 * @param createdAt when this command was created
 * @param id of the journal, must be unique
 * @param metadata initial fields
 */
public record CreateJournal(
    UUID messageId, Instant createdAt, String id, Map<String, JsonNode> metadata)
    implements DomainCommand.Create<Journal> {
  public CreateJournal {
    metadata = CreateDocumentsBundle.copyOfMetadata(metadata);
  }

  public CreateJournal(final String id, final Map<String, JsonNode> metadata) {
    this(UUID.randomUUID(), Instant.now(), id, metadata);
  }

  public static final class Handler extends DomainCommandHandler.Create<CreateJournal, Journal> {
    public Handler() {
      super(CreateJournal.class);
    }

    @Override
    protected Journal newAggregate(final CreateJournal command, final VersionClock clock) {
      return new Journal(command.id(), clock);
    }

    @Override
    protected void mutate(final CreateJournal command, final Journal journal) {
      journal.updateMetadata(command.metadata());
    }

    @Override
    protected AggregateRepository<Journal, ?> repository(final Session session) {
      return session.journals();
    }

    @Override
    protected Event event() {
      return Event.JOURNAL_CREATED;
    }

    @Override
    protected String aggregateName() {
      return "journal";
    }

    @Override
    protected Map<String, Object> arguments(final CreateJournal command) {
      return Map.of("id", command.id(), "metadata", command.metadata());
    }
  }
}
