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

/** Points the journal at the bundle gathering its ahead of print documents. */
public record SetAheadOfPrintBundleToJournal(
    UUID messageId, Instant createdAt, String id, String aop)
    implements DomainCommand.Update<Journal> {
  public SetAheadOfPrintBundleToJournal(final String id, final String aop) {
    this(UUID.randomUUID(), Instant.now(), id, aop);
  }

  public static final class Handler
      extends DomainCommandHandler.Update<SetAheadOfPrintBundleToJournal, Journal> {
    public Handler() {
      super(SetAheadOfPrintBundleToJournal.class);
    }

    @Override
    protected void mutate(final SetAheadOfPrintBundleToJournal command, final Journal journal) {
      journal.setAheadOfPrint(command.aop());
    }

    @Override
    protected AggregateRepository<Journal, ?> repository(final Session session) {
      return session.journals();
    }

    @Override
    protected Event event() {
      return Event.AHEAD_OF_PRINT_BUNDLE_SET;
    }

    @Override
    protected String aggregateName() {
      return "journal";
    }

    @Override
    protected Map<String, Object> arguments(final SetAheadOfPrintBundleToJournal command) {
      return Map.of("id", command.id(), "aop", command.aop());
    }
  }
}
