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

package io.github.suppierk.documentstore.domain;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.ConflictException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A journal: its issues in order, an optional ahead-of-print bundle and descriptive metadata.
 *
 * <p>No issue id appears twice and the ahead-of-print bundle, when set, is never one of the
 * issues. Every mutation moves {@code updated} forward.
 */
public final class Journal extends Aggregate<JournalManifest> {
  private final String created;
  private String updated;
  private final OrderedIds issues;
  private String aheadOfPrintBundle;
  private final Metadata metadata;

  public Journal(final String id, final VersionClock clock) {
    super(id, clock);
    this.created = clock.nextTimestamp();
    this.updated = created;
    this.issues = new OrderedIds(id, "Issue", List.of());
    this.metadata = new Metadata();
  }

  private Journal(final JournalManifest manifest, final VersionClock clock) {
    super(manifest.id(), clock);
    this.created = manifest.created();
    this.updated = manifest.updated();
    this.issues = new OrderedIds(manifest.id(), "Issue", manifest.items());
    this.aheadOfPrintBundle = manifest.aop();
    this.metadata = new Metadata(manifest.metadata());
  }

  /**
   * @param manifest as previously returned by {@link #manifest()}
   * @param clock to stamp further mutations with
   * @return reconstituted journal
   */
  public static Journal fromManifest(final JournalManifest manifest, final VersionClock clock) {
    return new Journal(manifest, clock);
  }

  /**
   * @throws AlreadyExistsException if the issue is already listed
   * @throws ConflictException if the issue is the ahead-of-print bundle
   */
  public void addIssue(final String issueId) {
    assertNotAheadOfPrint(issueId);
    issues.add(issueId);
    touch();
  }

  /**
   * @param index to insert before, negative values counting from the end
   * @throws AlreadyExistsException if the issue is already listed
   * @throws ConflictException if the issue is the ahead-of-print bundle
   */
  public void insertIssue(final int index, final String issueId) {
    assertNotAheadOfPrint(issueId);
    issues.insert(index, issueId);
    touch();
  }

  /**
   * @throws DoesNotExistException if the issue is not listed
   */
  public void removeIssue(final String issueId) {
    issues.remove(issueId);
    touch();
  }

  /**
   * Replaces all issues at once. Nothing changes if the replacement is rejected.
   *
   * @throws AlreadyExistsException if {@code issueIds} contains duplicates
   * @throws ConflictException if {@code issueIds} contains the ahead-of-print bundle
   */
  public void updateIssues(final List<String> issueIds) {
    if (aheadOfPrintBundle != null && issueIds.contains(aheadOfPrintBundle)) {
      throw new ConflictException(
          "Bundle '%s' is the ahead-of-print bundle of journal '%s'"
              .formatted(aheadOfPrintBundle, id()));
    }

    issues.replaceAll(issueIds);
    touch();
  }

  public List<String> issues() {
    return issues.asList();
  }

  /**
   * @throws AlreadyExistsException if the slot already holds {@code bundleId}
   * @throws ConflictException if the bundle is one of the issues
   */
  public void setAheadOfPrint(final String bundleId) {
    if (bundleId == null || bundleId.isBlank()) {
      throw new IllegalArgumentException("Ahead-of-print bundle id cannot be empty");
    }

    if (bundleId.equals(aheadOfPrintBundle)) {
      throw new AlreadyExistsException(
          "Bundle '%s' is already the ahead-of-print bundle of journal '%s'"
              .formatted(bundleId, id()));
    }

    if (issues.contains(bundleId)) {
      throw new ConflictException(
          "Bundle '%s' is an issue of journal '%s'".formatted(bundleId, id()));
    }

    aheadOfPrintBundle = bundleId;
    touch();
  }

  /**
   * @throws DoesNotExistException if no ahead-of-print bundle is set
   */
  public void removeAheadOfPrint() {
    if (aheadOfPrintBundle == null) {
      throw new DoesNotExistException(
          "Journal '%s' has no ahead-of-print bundle".formatted(id()));
    }

    aheadOfPrintBundle = null;
    touch();
  }

  public Optional<String> aheadOfPrint() {
    return Optional.ofNullable(aheadOfPrintBundle);
  }

  /**
   * @param key of the field, e.g. {@code title}
   * @param value new value, {@code null} to remove the field
   */
  public void setMetadata(final String key, final JsonNode value) {
    metadata.set(key, value);
    touch();
  }

  /**
   * Applies every entry of {@code values} as one mutation.
   *
   * @param values fields to set or, when mapped to {@code null}, to remove
   */
  public void updateMetadata(final Map<String, JsonNode> values) {
    values.forEach(metadata::set);
    touch();
  }

  public Metadata metadata() {
    return metadata;
  }

  public String created() {
    return created;
  }

  public String updated() {
    return updated;
  }

  /** {@inheritDoc} */
  @Override
  public JournalManifest manifest() {
    return new JournalManifest(
        id(),
        created,
        updated,
        issues.asList(),
        aheadOfPrintBundle,
        new LinkedHashMap<>(metadata.asMap()));
  }

  private void assertNotAheadOfPrint(final String issueId) {
    if (issueId != null && issueId.equals(aheadOfPrintBundle)) {
      throw new ConflictException(
          "Bundle '%s' is the ahead-of-print bundle of journal '%s'".formatted(issueId, id()));
    }
  }

  private void touch() {
    updated = clock.nextTimestamp();
  }
}
