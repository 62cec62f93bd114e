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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import io.github.suppierk.documentstore.cqrs.DomainQuery;
import io.github.suppierk.documentstore.cqrs.DomainQueryHandler;
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.session.Session;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Compares the XML of two versions of a document line by line, in unified diff format.
 *
 * <p>The file labels are the two timestamps, or {@code latest} when {@code toVersionAt} is absent.
 * Identical versions give an empty diff.
 *
 * @param messageId identifier of this query
 * @param createdAt when this query was created
 * @param id of the document
 * @param fromVersionAt UTC timestamp of the base version
 * @param toVersionAt optional UTC timestamp of the compared version, the latest when {@code null}
 */
public record DiffDocumentVersions(
    UUID messageId, Instant createdAt, String id, String fromVersionAt, String toVersionAt)
    implements DomainQuery.One<byte[]> {
  static final String LATEST = "latest";
  static final int CONTEXT_LINES = 3;

  public DiffDocumentVersions {
    if (fromVersionAt == null || fromVersionAt.isBlank()) {
      throw new IllegalArgumentException("Base version timestamp cannot be empty");
    }

    if (toVersionAt != null && toVersionAt.isBlank()) {
      toVersionAt = null;
    }
  }

  public DiffDocumentVersions(
      final String id, final String fromVersionAt, final String toVersionAt) {
    this(UUID.randomUUID(), Instant.now(), id, fromVersionAt, toVersionAt);
  }

  public DiffDocumentVersions(final String id, final String fromVersionAt) {
    this(id, fromVersionAt, null);
  }

  public static final class Handler extends DomainQueryHandler.One<DiffDocumentVersions, byte[]> {
    public Handler() {
      super(DiffDocumentVersions.class);
    }

    @Override
    protected byte[] run(final DiffDocumentVersions query, final Session session)
        throws IOException {
      final Document document = session.documents().fetch(query.id());
      final List<String> from = lines(document.data(session.fetcher(), -1, query.fromVersionAt()));
      final List<String> to = lines(document.data(session.fetcher(), -1, query.toVersionAt()));

      final List<String> diff =
          UnifiedDiffUtils.generateUnifiedDiff(
              query.fromVersionAt(),
              query.toVersionAt() == null ? LATEST : query.toVersionAt(),
              from,
              DiffUtils.diff(from, to),
              CONTEXT_LINES);
      return String.join("\n", diff).getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> lines(final byte[] data) {
      return new String(data, StandardCharsets.UTF_8).lines().toList();
    }
  }
}
