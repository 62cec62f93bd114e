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
import com.fasterxml.jackson.databind.node.JsonNodeType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptive fields of a bundle or a journal, such as {@code publication_year}, {@code volume} or
 * {@code titles}.
 *
 * <p>Each value is a JSON node, which acts as a tagged value: text, number, boolean, a list or a
 * structured sub-record. {@code null} is not a value, setting a key to {@code null} removes it.
 */
public final class Metadata {
  private final Map<String, JsonNode> values;

  public Metadata() {
    this.values = new LinkedHashMap<>();
  }

  public Metadata(final Map<String, JsonNode> values) {
    this();
    if (values != null) {
      values.forEach(this::set);
    }
  }

  /**
   * @param key of the field
   * @param value new value, {@code null} or JSON {@code null} to remove the field
   * @throws IllegalArgumentException if the key is empty
   */
  public void set(final String key, final JsonNode value) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Metadata key cannot be empty");
    }

    if (value == null
        || value.getNodeType() == JsonNodeType.NULL
        || value.getNodeType() == JsonNodeType.MISSING) {
      values.remove(key);
    } else {
      values.put(key, value.deepCopy());
    }
  }

  public Optional<JsonNode> get(final String key) {
    return Optional.ofNullable(values.get(key)).map(JsonNode::deepCopy);
  }

  /**
   * @return read-only view of the fields, in insertion order
   */
  public Map<String, JsonNode> asMap() {
    return Collections.unmodifiableMap(values);
  }
}
