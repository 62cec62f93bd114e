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
import java.util.List;
import java.util.Map;

/**
 * Serializable snapshot of a {@link DocumentsBundle}.
 *
 * @param id of the bundle
 * @param created when the bundle was created
 * @param updated when the bundle was last changed
 * @param items document ids, in bundle order
 * @param metadata descriptive fields
 */
public record DocumentsBundleManifest(
    String id, String created, String updated, List<String> items, Map<String, JsonNode> metadata) {
  public DocumentsBundleManifest {
    items = items == null ? List.of() : List.copyOf(items);
    metadata = metadata == null ? Map.of() : metadata;
  }
}
