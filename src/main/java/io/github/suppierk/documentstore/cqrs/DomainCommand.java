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

package io.github.suppierk.documentstore.cqrs;

import io.github.suppierk.documentstore.domain.Aggregate;
import java.io.Serializable;

/**
 * Represents an immutable command which must update one aggregate as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>In terms of 'read-write' {@link DomainCommand} is a 'write' representation, whereas {@link
 * DomainQuery} is its 'read' counterpart.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Add Issue To Journal' instead of
 * 'Set Journal issues'. It should be possible to place commands in a queue rather than process them
 * synchronously - this is the reason this class implements {@link DomainMessage} interface which
 * extends {@link Serializable} interface.
 *
 * <p>Every command targets exactly one aggregate. To bridge the gap in understanding between CRUD
 * and CQRS, we leverage Java {@code sealed} feature, enforcing users to pick one of the specific
 * intents rather than defining a command completely on their own.
 *
 * @param <A> is the type of the aggregate the command produces or mutates
 */
// @formatter:off
public sealed interface DomainCommand<
  A extends Aggregate<?>
> extends DomainMessage
permits
  DomainCommand.Create,
  DomainCommand.Update,
  DomainCommand.Delete
{
// @formatter:on

  /**
   * @return identifier of the aggregate this command targets
   */
  String id();

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   */
  non-sealed interface Create<A extends Aggregate<?>> extends DomainCommand<A> {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   */
  non-sealed interface Update<A extends Aggregate<?>> extends DomainCommand<A> {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to tombstone an
   * existing aggregate in the system. History stays readable, the aggregate stops accepting
   * changes.
   */
  non-sealed interface Delete<A extends Aggregate<?>> extends DomainCommand<A> {}
}
