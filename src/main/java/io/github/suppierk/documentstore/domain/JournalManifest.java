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
 * Serializable snapshot of a {@link Journal}.
 *
 * @param id of the journal
 * @param created when the journal was created
 * @param updated when the journal was last changed
 * @param items issue bundle ids, in journal order
 * @param aop ahead-of-print bundle id, {@code null} when not set
 * @param metadata descriptive fields
 */
public record JournalManifest(
    String id,
    String created,
    String updated,
    List<String> items,
    String aop,
    Map<String, JsonNode> metadata) {
  public JournalManifest {
    items = items == null ? List.of() : List.copyOf(items);
    metadata = metadata == null ? Map.of() : metadata;
  }
}
