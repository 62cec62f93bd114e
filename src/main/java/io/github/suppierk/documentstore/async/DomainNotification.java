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

package io.github.suppierk.documentstore.async;

import io.github.suppierk.documentstore.cqrs.DomainMessage;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Represents a notification about a change which took place within the store.
 *
 * <p>Notifications let other systems, such as search indexers or audit trails, be aware of the
 * changes and react to them. The payload carries the mutated aggregate and the arguments of the
 * command which mutated it.
 *
 * @param messageId identifier of this notification
 * @param createdAt when this notification was created
 * @param event kind of the change
 * @param payload aggregate and command arguments, keyed by name
 */
public record DomainNotification(
    UUID messageId, Instant createdAt, Event event, Map<String, Object> payload)
    implements DomainMessage {
  public DomainNotification {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /**
   * @param event kind of the change
   * @param payload aggregate and command arguments
   * @return notification stamped now
   */
  public static DomainNotification of(final Event event, final Map<String, Object> payload) {
    return new DomainNotification(UUID.randomUUID(), Instant.now(), event, payload);
  }
}
