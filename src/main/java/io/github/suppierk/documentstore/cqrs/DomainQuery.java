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

import java.util.List;

/**
 * Represents a query which must retrieve the underlying model as per CQRS paradigm.
 *
 * <p>In terms of 'read-write' {@link DomainQuery} is a 'read' representation, whereas {@link
 * DomainCommand} is its 'write' counterpart.
 *
 * <p>Queries must answer specific question using given data, while not necessarily retrieving the
 * whole model - e.g. 'Which renditions does document X have' instead of 'Given document X, fetch
 * me its manifest'.
 *
 * @param <OUTPUT> is the type of the answer
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public sealed interface DomainQuery<
  OUTPUT
> extends DomainMessage
permits
  DomainQuery.One, DomainQuery.Many
{
// @formatter:on

  /**
   * Marker interface, denoting that the query is supposed to represent an intent to read a single
   * object of the system.
   *
   * @param <OUTPUT> is the type of the object
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface One<OUTPUT> extends DomainQuery<OUTPUT> {}

  /**
   * Marker interface, denoting that the query is supposed to represent an intent to read multiple
   * objects of the system.
   *
   * @param <ITEM> is the type of each object
   */
  @SuppressWarnings("squid:S119")
  non-sealed interface Many<ITEM> extends DomainQuery<List<ITEM>> {}
}
