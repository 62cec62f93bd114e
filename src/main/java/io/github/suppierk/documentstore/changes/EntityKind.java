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

package io.github.suppierk.documentstore.changes;

/** The three aggregate families the store keeps, with their storage and change-feed names. */
public enum EntityKind {
  DOCUMENT("documents", "/documents/"),
  DOCUMENTS_BUNDLE("documents_bundles", "/bundles/"),
  JOURNAL("journals", "/journals/");

  private final String collection;
  private final String pathPrefix;

  EntityKind(final String collection, final String pathPrefix) {
    this.collection = collection;
    this.pathPrefix = pathPrefix;
  }

  /**
   * @return name of the storage collection holding this kind
   */
  public String collection() {
    return collection;
  }

  /**
   * @param id of an aggregate of this kind
   * @return path identifying the aggregate in the change feed, e.g. {@code /documents/<id>}
   */
  public String path(final String id) {
    return pathPrefix + id;
  }
}
