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

import java.util.Map;

/**
 * Callback registered for one {@link Event} kind.
 *
 * <p>Subscribers are invoked after the change was stored, in registration order. Whatever they
 * throw is logged and ignored: a failing subscriber cannot undo nor fail the write that triggered
 * it.
 */
@FunctionalInterface
public interface Subscriber {
  /**
   * @param event which took place
   * @param payload aggregate and command arguments, see {@link DomainNotification#payload()}
   */
  void onEvent(final Event event, final Map<String, Object> payload);
}
