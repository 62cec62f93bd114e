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

package io.github.suppierk.documentstore.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON form of manifests and request bodies.
 *
 * <p>Field names are written in {@code snake_case}, so a stored document version carries {@code
 * data_url} and a rendition carries {@code size_bytes}. Unknown fields are ignored when reading.
 */
public final class JsonCodec {
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JsonCodec() {
    // Static utility
  }

  /**
   * @return shared, fully configured mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static byte[] encode(final Object value) {
    try {
      return MAPPER.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static <T> T decode(final byte[] payload, final Class<T> type) {
    try {
      return MAPPER.readValue(payload, type);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * @param value to convert, typically a manifest
   * @return JSON tree of the value
   */
  public static JsonNode toTree(final Object value) {
    return MAPPER.valueToTree(value);
  }

  /**
   * @param json text to read
   * @return parsed tree
   * @throws IOException if the text is not valid JSON
   */
  public static JsonNode readTree(final String json) throws IOException {
    return MAPPER.readTree(json);
  }
}
