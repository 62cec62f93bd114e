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

/**
 * A derived artefact of a document version, such as its PDF.
 *
 * @param filename of the artefact
 * @param dataUrl where the artefact can be fetched from
 * @param mimetype of the artefact
 * @param lang language of the artefact
 * @param sizeBytes size of the artefact
 * @param timestamp when this rendition was registered
 */
public record Rendition(
    String filename,
    String dataUrl,
    String mimetype,
    String lang,
    long sizeBytes,
    String timestamp) {

  /**
   * @param other rendition
   * @return {@code true} if both renditions describe the same artefact slot
   */
  boolean sameSlotAs(final Rendition other) {
    return filename.equals(other.filename)
        && mimetype.equals(other.mimetype)
        && lang.equals(other.lang);
  }

  /**
   * @param other rendition in the same slot
   * @return {@code true} if submitting {@code other} would not change anything
   */
  boolean sameContentAs(final Rendition other) {
    return sameSlotAs(other) && dataUrl.equals(other.dataUrl) && sizeBytes == other.sizeBytes;
  }
}
