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

import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Ordered list of ids in which no id appears twice: the documents of a bundle or the issues of a
 * journal.
 */
final class OrderedIds {
  private final String owner;
  private final String itemName;
  private final List<String> ids;

  OrderedIds(final String owner, final String itemName, final List<String> ids) {
    this.owner = owner;
    this.itemName = itemName;
    this.ids = new ArrayList<>();
    if (ids != null) {
      replaceAll(ids);
    }
  }

  boolean contains(final String id) {
    return ids.contains(id);
  }

  List<String> asList() {
    return List.copyOf(ids);
  }

  void add(final String id) {
    assertAbsent(requireId(id));
    ids.add(id);
  }

  /**
   * Inserts before {@code index}. Negative indexes count from the end, indexes out of range are
   * clamped to the nearest end.
   */
  void insert(final int index, final String id) {
    assertAbsent(requireId(id));

    int position = index < 0 ? ids.size() + index : index;
    position = Math.max(0, Math.min(position, ids.size()));
    ids.add(position, id);
  }

  void remove(final String id) {
    if (!ids.remove(requireId(id))) {
      throw new DoesNotExistException(
          "%s '%s' is not part of '%s'".formatted(itemName, id, owner));
    }
  }

  void replaceAll(final List<String> replacement) {
    final var seen = new HashSet<String>();
    for (String id : replacement) {
      if (!seen.add(requireId(id))) {
        throw new AlreadyExistsException(
            "%s '%s' is listed more than once for '%s'".formatted(itemName, id, owner));
      }
    }

    ids.clear();
    ids.addAll(replacement);
  }

  private void assertAbsent(final String id) {
    if (ids.contains(id)) {
      throw new AlreadyExistsException(
          "%s '%s' is already part of '%s'".formatted(itemName, id, owner));
    }
  }

  private static String requireId(final String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Id cannot be empty");
    }

    return id;
  }
}
