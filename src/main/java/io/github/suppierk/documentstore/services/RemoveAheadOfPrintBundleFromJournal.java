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

public record RemoveAheadOfPrintBundleFromJournal(UUID messageId, Instant createdAt, String id)
    implements DomainCommand.Update<Journal> {
  public RemoveAheadOfPrintBundleFromJournal(final String id) {
    this(UUID.randomUUID(), Instant.now(), id);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<RemoveAheadOfPrintBundleFromJournal, Journal> {
    public Handler() {
      super(RemoveAheadOfPrintBundleFromJournal.class);
    }

    @Override
    protected void mutate(
        final RemoveAheadOfPrintBundleFromJournal command, final Journal journal) {
      journal.removeAheadOfPrint();
    }

    @Override
    protected AggregateRepository<Journal, ?> repository(final Session session) {
      return session.journals();
    }

    @Override
    protected Event event() {
      return Event.AHEAD_OF_PRINT_BUNDLE_REMOVED;
    }

    @Override
    protected String aggregateName() {
      return "journal";
    }

    @Override
    protected Map<String, Object> arguments(final RemoveAheadOfPrintBundleFromJournal command) {
      return Map.of("id", command.id());
    }
  }
}
