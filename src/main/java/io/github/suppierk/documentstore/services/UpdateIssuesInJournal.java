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
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Replaces the issues of a journal wholesale, refusing lists with duplicates. */
public record UpdateIssuesInJournal(
    UUID messageId, Instant createdAt, String id, List<String> issues)
    implements DomainCommand.Update<Journal> {
  public UpdateIssuesInJournal {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public UpdateIssuesInJournal(final String id, final List<String> issues) {
    this(UUID.randomUUID(), Instant.now(), id, issues);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<UpdateIssuesInJournal, Journal> {
    public Handler() {
      super(UpdateIssuesInJournal.class);
    }

    @Override
    protected void mutate(final UpdateIssuesInJournal command, final Journal journal) {
      journal.updateIssues(command.issues());
    }

    @Override
    protected AggregateRepository<Journal, ?> repository(final Session session) {
      return session.journals();
    }

    @Override
    protected Event event() {
      return Event.ISSUES_UPDATED_IN_JOURNAL;
    }

    @Override
    protected String aggregateName() {
      return "journal";
    }

    @Override
    protected Map<String, Object> arguments(final UpdateIssuesInJournal command) {
      return Map.of("id", command.id(), "issues", command.issues());
    }
  }
}
