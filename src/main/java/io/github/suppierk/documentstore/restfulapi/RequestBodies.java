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

package io.github.suppierk.documentstore.restfulapi;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.documentstore.exceptions.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Checks the shape of request bodies before they reach a command.
 *
 * <p>Every check throws {@link ValidationException} naming the offending field.
 */
final class RequestBodies {
  private RequestBodies() {
    // Static utility
  }

  /** {@code {"data": "<url>", "assets": [{"asset_id": "...", "asset_url": "..."}]}} */
  static DocumentRegistration documentRegistration(final JsonNode body) {
    requireObject(body, "Document");
    final String data = requireText(body, "data");

    final var assets = new LinkedHashMap<String, String>();
    final JsonNode assetsNode = body.path("assets");
    if (!assetsNode.isMissingNode() && !assetsNode.isNull()) {
      if (!assetsNode.isArray()) {
        throw new ValidationException("'assets' must be a list");
      }

      for (JsonNode asset : assetsNode) {
        requireObject(asset, "Asset");
        final String assetId = requireText(asset, "asset_id");
        final JsonNode url = asset.path("asset_url");
        if (!url.isMissingNode() && !url.isNull() && !url.isTextual()) {
          throw new ValidationException("'asset_url' must be a string");
        }

        assets.put(assetId, url.isTextual() ? url.asText() : "");
      }
    }

    return new DocumentRegistration(data, Collections.unmodifiableMap(assets));
  }

  /** {@code {"filename", "data_url", "mimetype", "lang", "size_bytes"}}, all required. */
  static RenditionRegistration renditionRegistration(final JsonNode body) {
    requireObject(body, "Rendition");
    final JsonNode size = body.path("size_bytes");
    if (!size.isIntegralNumber() || size.asLong() < 0) {
      throw new ValidationException("'size_bytes' must be a non negative integer");
    }

    return new RenditionRegistration(
        requireText(body, "filename"),
        requireText(body, "data_url"),
        requireText(body, "mimetype"),
        requireText(body, "lang"),
        size.asLong());
  }

  /**
   * Metadata of a bundle. No field is required, but {@code titles} entries need both {@code
   * language} and {@code title}, and {@code publication_months} holds either {@code month} or
   * {@code range}.
   */
  static Map<String, JsonNode> bundleMetadata(final JsonNode body) {
    final Map<String, JsonNode> metadata = metadata(body);

    final JsonNode titles = metadata.get("titles");
    if (titles != null && !titles.isNull()) {
      if (!titles.isArray()) {
        throw new ValidationException("'titles' must be a list");
      }

      for (JsonNode title : titles) {
        requireObject(title, "Title");
        requireText(title, "language");
        requireText(title, "title");
      }
    }

    final JsonNode months = metadata.get("publication_months");
    if (months != null && !months.isNull()) {
      requireObject(months, "Publication months");
      if (months.has("month") == months.has("range")) {
        throw new ValidationException(
            "'publication_months' must have either 'month' or 'range', and not both");
      }
    }

    return metadata;
  }

  /** Metadata of a journal: any JSON object. */
  static Map<String, JsonNode> metadata(final JsonNode body) {
    requireObject(body, "Metadata");
    final var metadata = new LinkedHashMap<String, JsonNode>();
    body.fields().forEachRemaining(field -> metadata.put(field.getKey(), field.getValue()));
    return metadata;
  }

  /** {@code [{"id": "..."}, ...]}, as sent for bundle documents and journal issues. */
  static List<String> idList(final JsonNode body) {
    if (body == null || !body.isArray()) {
      throw new ValidationException("Body must be a list");
    }

    final var ids = new ArrayList<String>();
    for (JsonNode item : body) {
      requireObject(item, "Item");
      ids.add(requireText(item, "id"));
    }

    return ids;
  }

  /**
   * {@code {"issue": "...", "index": 0}} where {@code index} is optional and {@code issue} is an id
   * or an {@code {"id", "year"}} object.
   */
  static IssuePlacement issuePlacement(final JsonNode body) {
    requireObject(body, "Issue");
    final String issue = issueId(body);

    final JsonNode index = body.path("index");
    if (index.isMissingNode() || index.isNull()) {
      return new IssuePlacement(issue, OptionalInt.empty());
    }

    if (!index.isIntegralNumber()) {
      throw new ValidationException("'index' must be an integer");
    }

    return new IssuePlacement(issue, OptionalInt.of(index.asInt()));
  }

  /** {@code {"issue": "..."}} */
  static String issueRemoval(final JsonNode body) {
    requireObject(body, "Issue");
    return requireText(body, "issue");
  }

  /** {@code {"aop": "..."}} */
  static String aheadOfPrint(final JsonNode body) {
    requireObject(body, "Ahead of print");
    return requireText(body, "aop");
  }

  private static String issueId(final JsonNode body) {
    final JsonNode issue = body.path("issue");
    if (issue.isObject()) {
      requireText(issue, "year");
      return requireText(issue, "id");
    }

    return requireText(body, "issue");
  }

  private static void requireObject(final JsonNode node, final String what) {
    if (node == null || !node.isObject()) {
      throw new ValidationException("%s must be a JSON object".formatted(what));
    }
  }

  private static String requireText(final JsonNode node, final String field) {
    return Optional.ofNullable(node.get(field))
        .filter(JsonNode::isTextual)
        .map(JsonNode::asText)
        .filter(text -> !text.isBlank())
        .orElseThrow(
            () ->
                new ValidationException(
                    "'%s' is required and must be a string".formatted(field)));
  }

  record DocumentRegistration(String data, Map<String, String> assets) {}

  record RenditionRegistration(
      String filename, String dataUrl, String mimetype, String lang, long sizeBytes) {}

  record IssuePlacement(String issue, OptionalInt index) {}
}
