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
import io.github.suppierk.documentstore.domain.Journal;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Inserts an issue into a journal before the given position. Out of range positions insert at the
 * nearest end.
 */
public record InsertIssueToJournal(
    UUID messageId, Instant createdAt, String id, int index, String issue)
    implements DomainCommand.Update<Journal> {
  public InsertIssueToJournal(final String id, final int index, final String issue) {
    this(UUID.randomUUID(), Instant.now(), id, index, issue);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<InsertIssueToJournal, Journal> {
    public Handler() {
      super(InsertIssueToJournal.class);
    }

    @Override
    protected void mutate(final InsertIssueToJournal command, final Journal journal) {
      journal.insertIssue(command.index(), command.issue());
    }

    @Override
    protected AggregateRepository<Journal, ?> repository(final Session session) {
      return session.journals();
    }

    @Override
    protected Event event() {
      return Event.ISSUE_INSERTED_TO_JOURNAL;
    }

    @Override
    protected String aggregateName() {
      return "journal";
    }

    @Override
    protected Map<String, Object> arguments(final InsertIssueToJournal command) {
      return Map.of("id", command.id(), "index", command.index(), "issue", command.issue());
    }
  }
}
