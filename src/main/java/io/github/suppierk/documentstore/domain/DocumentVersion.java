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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of a document history.
 *
 * <p>Instances are immutable: registering an asset or a rendition against the latest version
 * produces a copy of it with the new entry appended.
 *
 * @param dataUrl where the XML of this version can be fetched from, {@code null} for a tombstone
 * @param assets history of each asset slot declared by this version
 * @param renditions registered renditions, oldest first
 * @param timestamp when this version was registered
 * @param deleted marks the tombstone entry
 */
public record DocumentVersion(
    String dataUrl,
    Map<String, List<AssetVersion>> assets,
    List<Rendition> renditions,
    String timestamp,
    boolean deleted) {

  public DocumentVersion {
    final var assetsCopy = new LinkedHashMap<String, List<AssetVersion>>();
    if (assets != null) {
      assets.forEach((assetId, history) -> assetsCopy.put(assetId, List.copyOf(history)));
    }

    assets = Collections.unmodifiableMap(assetsCopy);
    renditions = renditions == null ? List.of() : List.copyOf(renditions);
  }

  static DocumentVersion tombstone(final String timestamp) {
    return new DocumentVersion(null, Map.of(), List.of(), timestamp, true);
  }

  /**
   * @param assetId slot to look at
   * @return the most recent upload registered for the slot
   */
  public Optional<AssetVersion> latestAsset(final String assetId) {
    final var history = assets.get(assetId);
    if (history == null || history.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(history.get(history.size() - 1));
  }

  /**
   * @return the most recent rendition of each {@code (filename, mimetype, lang)} slot, in the
   *     order the slots were first registered
   */
  public List<Rendition> latestRenditions() {
    final var latest = new ArrayList<Rendition>();
    for (Rendition rendition : renditions) {
      latest.removeIf(rendition::sameSlotAs);
      latest.add(rendition);
    }

    return List.copyOf(latest);
  }

  DocumentVersion withAsset(final String assetId, final AssetVersion assetVersion) {
    final var assetsCopy = new LinkedHashMap<>(assets);
    final var history = new ArrayList<>(assetsCopy.getOrDefault(assetId, List.of()));
    history.add(assetVersion);
    assetsCopy.put(assetId, history);
    return new DocumentVersion(dataUrl, assetsCopy, renditions, timestamp, deleted);
  }

  DocumentVersion withRendition(final Rendition rendition) {
    final var renditionsCopy = new ArrayList<>(renditions);
    renditionsCopy.add(rendition);
    return new DocumentVersion(dataUrl, assets, renditionsCopy, timestamp, deleted);
  }
}
