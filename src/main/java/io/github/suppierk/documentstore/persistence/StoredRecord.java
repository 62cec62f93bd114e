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

/**
 * Opaque stored form of an aggregate.
 *
 * @param id of the aggregate
 * @param revision starts at 1 and grows by one on every replace
 * @param payload serialized manifest
 */
public record StoredRecord(String id, long revision, byte[] payload) {
  public static final long FIRST_REVISION = 1L;
}
