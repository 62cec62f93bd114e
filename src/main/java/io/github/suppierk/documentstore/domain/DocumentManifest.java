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

import java.util.List;

/**
 * Serializable snapshot of a {@link Document} and its full history.
 *
 * @param id of the document
 * @param versions oldest first
 */
public record DocumentManifest(String id, List<DocumentVersion> versions) {
  public DocumentManifest {
    versions = versions == null ? List.of() : List.copyOf(versions);
  }
}
