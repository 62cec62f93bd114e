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

import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.changes.ChangeLog;
import io.github.suppierk.documentstore.cqrs.DomainQuery;
import io.github.suppierk.documentstore.cqrs.DomainQueryHandler;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Reads a page of the change feed.
 *
 * @param messageId identifier of this query
 * @param createdAt when this query was created
 * @param since empty to read from the beginning, otherwise the timestamp of the last entry already
 *     processed
 * @param limit maximum number of entries to return
 * @see ChangeLog#filter(String, int)
 */
public record FetchChanges(UUID messageId, Instant createdAt, String since, int limit)
    implements DomainQuery.Many<Change> {
  public FetchChanges {
    since = since == null ? "" : since;
  }

  public FetchChanges(final String since, final int limit) {
    this(UUID.randomUUID(), Instant.now(), since, limit);
  }

  public static final class Handler extends DomainQueryHandler.Many<FetchChanges, Change> {
    public Handler() {
      super(FetchChanges.class);
    }

    @Override
    protected List<Change> run(final FetchChanges query, final Session session) {
      return session.changes().filter(query.since(), query.limit());
    }
  }
}
