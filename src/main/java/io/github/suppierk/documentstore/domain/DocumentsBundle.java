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
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of document ids, used for journal issues and ahead-of-print groups.
 *
 * <p>No document id appears twice and every mutation moves {@code updated} forward.
 */
public final class DocumentsBundle extends Aggregate<DocumentsBundleManifest> {
  private final String created;
  private String updated;
  private final OrderedIds items;
  private final Metadata metadata;

  public DocumentsBundle(final String id, final VersionClock clock) {
    super(id, clock);
    this.created = clock.nextTimestamp();
    this.updated = created;
    this.items = new OrderedIds(id, "Document", List.of());
    this.metadata = new Metadata();
  }

  private DocumentsBundle(final DocumentsBundleManifest manifest, final VersionClock clock) {
    super(manifest.id(), clock);
    this.created = manifest.created();
    this.updated = manifest.updated();
    this.items = new OrderedIds(manifest.id(), "Document", manifest.items());
    this.metadata = new Metadata(manifest.metadata());
  }

  /**
   * @param manifest as previously returned by {@link #manifest()}
   * @param clock to stamp further mutations with
   * @return reconstituted bundle
   */
  public static DocumentsBundle fromManifest(
      final DocumentsBundleManifest manifest, final VersionClock clock) {
    return new DocumentsBundle(manifest, clock);
  }

  /**
   * @throws AlreadyExistsException if the document is already part of the bundle
   */
  public void addDocument(final String documentId) {
    items.add(documentId);
    touch();
  }

  /**
   * @param index to insert before, negative values counting from the end
   * @throws AlreadyExistsException if the document is already part of the bundle
   */
  public void insertDocument(final int index, final String documentId) {
    items.insert(index, documentId);
    touch();
  }

  /**
   * @throws DoesNotExistException if the document is not part of the bundle
   */
  public void removeDocument(final String documentId) {
    items.remove(documentId);
    touch();
  }

  /**
   * Replaces all documents at once. Nothing changes if the replacement is rejected.
   *
   * @throws AlreadyExistsException if {@code documentIds} contains duplicates
   */
  public void updateDocuments(final List<String> documentIds) {
    items.replaceAll(documentIds);
    touch();
  }

  public List<String> documents() {
    return items.asList();
  }

  /**
   * @param key of the field, e.g. {@code publication_year}
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
  public DocumentsBundleManifest manifest() {
    return new DocumentsBundleManifest(
        id(), created, updated, items.asList(), new LinkedHashMap<>(metadata.asMap()));
  }

  private void touch() {
    updated = clock.nextTimestamp();
  }
}
