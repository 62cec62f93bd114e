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

import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import io.github.suppierk.documentstore.exceptions.VersionAlreadySetException;
import io.github.suppierk.documentstore.fetch.DataFetcher;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An article: its XML versions, the assets each version refers to and the renditions derived from
 * it.
 *
 * <p>History is append-only. A new XML version inherits the asset slots of the version before it,
 * keeping only the most recent upload of each slot. Assets and renditions are registered against
 * the latest version. Deletion appends a tombstone entry; afterwards the document accepts no more
 * mutations and its current data cannot be read, although earlier versions stay reachable by
 * timestamp.
 */
public final class Document extends Aggregate<DocumentManifest> {
  private final List<DocumentVersion> versions;

  public Document(final String id, final VersionClock clock) {
    super(id, clock);
    this.versions = new ArrayList<>();
  }

  /**
   * Rebuilds a document from its stored snapshot.
   *
   * @param manifest as previously returned by {@link #manifest()}
   * @param clock to stamp further mutations with
   * @return reconstituted document
   */
  public static Document fromManifest(final DocumentManifest manifest, final VersionClock clock) {
    final var document = new Document(manifest.id(), clock);
    document.versions.addAll(manifest.versions());
    return document;
  }

  /**
   * @return {@code true} if the latest entry is a tombstone
   */
  public boolean isDeleted() {
    return !versions.isEmpty() && latest().deleted();
  }

  /**
   * Registers a new XML version.
   *
   * @param dataUrl of the new XML
   * @param declaredAssetIds asset slots referenced by the new XML, besides the inherited ones
   * @throws DoesNotExistException if the document was deleted
   */
  public void newVersion(final String dataUrl, final Collection<String> declaredAssetIds) {
    if (dataUrl == null || dataUrl.isBlank()) {
      throw new IllegalArgumentException("Data URL cannot be empty");
    }

    assertNotDeleted();

    final var assets = new LinkedHashMap<String, List<AssetVersion>>();
    if (!versions.isEmpty()) {
      latest()
          .assets()
          .keySet()
          .forEach(
              assetId ->
                  assets.put(
                      assetId, latest().latestAsset(assetId).map(List::of).orElseGet(List::of)));
    }

    if (declaredAssetIds != null) {
      declaredAssetIds.forEach(assetId -> assets.putIfAbsent(assetId, List.of()));
    }

    versions.add(new DocumentVersion(dataUrl, assets, List.of(), clock.nextTimestamp(), false));
  }

  /**
   * Registers a new upload of an asset of the latest version.
   *
   * @param assetId slot declared by the latest version
   * @param dataUrl of the uploaded asset
   * @throws DoesNotExistException if the document was deleted or the slot is not declared
   * @throws VersionAlreadySetException if the slot already points at the same URL
   */
  public void newAssetVersion(final String assetId, final String dataUrl) {
    if (dataUrl == null || dataUrl.isBlank()) {
      throw new IllegalArgumentException("Asset URL cannot be empty");
    }

    final var current = latestLive();
    if (!current.assets().containsKey(assetId)) {
      throw new DoesNotExistException(
          "Asset '%s' is not declared by the latest version of document '%s'"
              .formatted(assetId, id()));
    }

    if (hasAssetVersion(assetId, dataUrl)) {
      throw new VersionAlreadySetException(
          "Asset '%s' of document '%s' already points at '%s'".formatted(assetId, id(), dataUrl));
    }

    replaceLatest(current.withAsset(assetId, new AssetVersion(dataUrl, clock.nextTimestamp())));
  }

  /**
   * @param assetId slot of the latest version
   * @param dataUrl candidate upload
   * @return {@code true} if registering the upload would not change the slot
   */
  public boolean hasAssetVersion(final String assetId, final String dataUrl) {
    return !versions.isEmpty()
        && latest()
            .latestAsset(assetId)
            .map(AssetVersion::assetUrl)
            .filter(dataUrl::equals)
            .isPresent();
  }

  /**
   * Registers a rendition of the latest version.
   *
   * @throws IllegalArgumentException if any of the strings is empty
   * @throws DoesNotExistException if the document was deleted
   * @throws VersionAlreadySetException if the most recent rendition of the same {@code (filename,
   *     mimetype, lang)} slot already has the same URL and size
   */
  public void newRenditionVersion(
      final String filename,
      final String dataUrl,
      final String mimetype,
      final String lang,
      final long sizeBytes) {
    requireText(filename, "Rendition filename");
    requireText(dataUrl, "Rendition URL");
    requireText(mimetype, "Rendition mimetype");
    requireText(lang, "Rendition language");

    final var current = latestLive();
    final var rendition =
        new Rendition(filename, dataUrl, mimetype, lang, sizeBytes, clock.nextTimestamp());

    final boolean repeated =
        current.latestRenditions().stream().anyMatch(existing -> existing.sameContentAs(rendition));
    if (repeated) {
      throw new VersionAlreadySetException(
          "Rendition '%s' (%s, %s) of document '%s' is already registered"
              .formatted(filename, mimetype, lang, id()));
    }

    replaceLatest(current.withRendition(rendition));
  }

  /**
   * Tombstones the document.
   *
   * @throws VersionAlreadySetException if the document is already deleted
   */
  public void delete() {
    if (versions.isEmpty()) {
      throw new DoesNotExistException("Document '%s' has no versions".formatted(id()));
    }

    if (isDeleted()) {
      throw new VersionAlreadySetException("Document '%s' is already deleted".formatted(id()));
    }

    versions.add(DocumentVersion.tombstone(clock.nextTimestamp()));
  }

  /**
   * Resolves a version of the document.
   *
   * <p>When {@code versionAt} is given, the latest version registered at or before it is chosen and
   * {@code versionIndex} is ignored. Otherwise {@code versionIndex} is used, negative values
   * counting from the end ({@code -1} being the latest).
   *
   * @param versionIndex position in history
   * @param versionAt optional point in time, see {@link VersionClock#parse(String)}
   * @return chosen version
   * @throws DoesNotExistException if no version matches or the chosen entry is a tombstone
   */
  public DocumentVersion version(final int versionIndex, final String versionAt) {
    final DocumentVersion chosen =
        versionAt == null ? versionByIndex(versionIndex) : versionAt(VersionClock.parse(versionAt));

    if (chosen.deleted()) {
      throw new DoesNotExistException("Document '%s' is deleted".formatted(id()));
    }

    return chosen;
  }

  /**
   * @return the latest version
   * @see #version(int, String)
   */
  public DocumentVersion version() {
    return version(-1, null);
  }

  /**
   * Fetches the XML of a version.
   *
   * @param fetcher to download the bytes with
   * @param versionIndex position in history
   * @param versionAt optional point in time
   * @return XML bytes
   * @throws DoesNotExistException if no version matches or the chosen entry is a tombstone
   * @throws IOException if the bytes could not be fetched
   * @see #version(int, String)
   */
  public byte[] data(final DataFetcher fetcher, final int versionIndex, final String versionAt)
      throws IOException {
    return fetcher.fetch(version(versionIndex, versionAt).dataUrl());
  }

  /**
   * @param versionIndex position in history
   * @param versionAt optional point in time
   * @return the most recent rendition of each slot of the chosen version
   */
  public List<Rendition> renditions(final int versionIndex, final String versionAt) {
    return version(versionIndex, versionAt).latestRenditions();
  }

  /** {@inheritDoc} */
  @Override
  public DocumentManifest manifest() {
    return new DocumentManifest(id(), versions);
  }

  /**
   * @return asset slots of the latest version mapped to their most recent URL
   */
  public Map<String, String> latestAssetUrls() {
    final var urls = new LinkedHashMap<String, String>();
    final var current = version();
    current
        .assets()
        .keySet()
        .forEach(
            assetId ->
                urls.put(
                    assetId, current.latestAsset(assetId).map(AssetVersion::assetUrl).orElse("")));
    return urls;
  }

  private DocumentVersion versionByIndex(final int versionIndex) {
    final int position = versionIndex < 0 ? versions.size() + versionIndex : versionIndex;
    if (position < 0 || position >= versions.size()) {
      throw new DoesNotExistException(
          "Document '%s' has no version at index %d".formatted(id(), versionIndex));
    }

    return versions.get(position);
  }

  private DocumentVersion versionAt(final Instant versionAt) {
    DocumentVersion chosen = null;
    for (DocumentVersion candidate : versions) {
      if (Instant.parse(candidate.timestamp()).isAfter(versionAt)) {
        break;
      }

      chosen = candidate;
    }

    if (chosen == null) {
      throw new DoesNotExistException(
          "Document '%s' has no version at %s".formatted(id(), VersionClock.format(versionAt)));
    }

    return chosen;
  }

  private DocumentVersion latest() {
    return versions.get(versions.size() - 1);
  }

  private DocumentVersion latestLive() {
    assertNotDeleted();
    if (versions.isEmpty()) {
      throw new DoesNotExistException("Document '%s' has no versions".formatted(id()));
    }

    return latest();
  }

  private void assertNotDeleted() {
    if (isDeleted()) {
      throw new DoesNotExistException("Document '%s' is deleted".formatted(id()));
    }
  }

  private void replaceLatest(final DocumentVersion version) {
    versions.set(versions.size() - 1, version);
  }

  private static void requireText(final String value, final String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(what + " cannot be empty");
    }
  }
}
