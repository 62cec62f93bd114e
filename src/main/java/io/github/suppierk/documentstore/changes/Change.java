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

/**
 * One entry of the change feed: the aggregate at {@code id} was created, updated or deleted at
 * {@code timestamp}.
 *
 * @param id path of the aggregate, e.g. {@code /documents/0034-8910-rsp-48-2-0347}
 * @param timestamp when the change was stored
 * @param deleted {@code true} if the change tombstoned the aggregate
 */
public record Change(String id, String timestamp, boolean deleted) {}
