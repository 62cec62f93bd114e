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

import io.github.suppierk.documentstore.async.DomainNotification;
import io.github.suppierk.documentstore.session.Session;
import io.github.suppierk.documentstore.session.SessionFactory;
import io.github.suppierk.java.Try;
import java.util.List;

/**
 * Class to accept and process the work associated to a specific {@link DomainQuery}:
 *
 * <ul>
 *   <li>Read the stored state through a fresh {@link Session}.
 *   <li><b>Optional</b>: emit a {@link DomainNotification} if {@link DomainQuery} succeeded.
 *   <li><b>Optional</b>: emit a {@link DomainNotification} if {@link DomainQuery} failed.
 * </ul>
 *
 * <p>Because {@link DomainQuery} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature.
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <OUTPUT> the expected output type of the given query
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainQueryHandler<
  QUERY extends DomainQuery<OUTPUT>,
  OUTPUT
>
extends
        DomainHandler<QUERY, OUTPUT>
permits
  DomainQueryHandler.One,
  DomainQueryHandler.Many
{
// @formatter:on
  private final Class<QUERY> queryClass;

  /**
   * Default constructor.
   *
   * @param queryClass this handler is intended for
   */
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    this.queryClass = throwIllegalArgumentIfNull(queryClass, "Query class");
  }

  /**
   * @return specific {@link DomainQuery} class
   */
  public final Class<QUERY> getQueryClass() {
    return queryClass;
  }

  /**
   * Defines business logic of this particular {@link DomainQueryHandler}.
   *
   * @param query being invoked
   * @param session created by {@link BoundedContext} to read the store with
   * @return answer to the query
   * @throws Exception if any happened during invocation
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract OUTPUT run(final QUERY query, final Session session) throws Exception;

  /**
   * General business logic invocation to be used and exposed via {@link BoundedContext}.
   *
   * <p>The usage of {@link Try} will "hide" the exception that can be thrown by {@link
   * #run(DomainQuery, Session)} - but not get rid of it. The actual exception is thrown again once
   * the failure notification, if any, was delivered.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link BoundedContext}
   * only.
   *
   * @param query being invoked
   * @param sessionFactory to create the session with
   * @return a result of query invocation
   */
  final OUTPUT runInContext(final QUERY query, final SessionFactory sessionFactory) {
    final QUERY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final SessionFactory nonNullSessionFactory =
        throwIllegalStateIfNull(sessionFactory, "Session factory");
    final Session session = throwIllegalStateIfNull(nonNullSessionFactory.create(), "Session");

    final Try<OUTPUT> output =
        Try.of(() -> throwIllegalStateIfNull(run(nonNullQuery, session), "Query handler result"));

    output.ifSuccess(
        result -> {
          final var optionalNotification =
              throwIllegalStateIfNull(
                  onSuccess(nonNullQuery, result),
                  "Query handler Optional successful notification");
          optionalNotification.ifPresent(session::notify);
        });

    output.ifFailure(
        reason -> {
          final var optionalNotification =
              throwIllegalStateIfNull(
                  onFailure(nonNullQuery, reason), "Query handler Optional failure notification");
          optionalNotification.ifPresent(session::notify);
          throw rethrow(reason);
        });

    return output.get();
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.One}.
   *
   * @param <ONE> the type of the particular {@link DomainQuery.One}
   * @param <OUTPUT> the type of the object read
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends DomainQuery.One<OUTPUT>,
    OUTPUT
  > extends DomainQueryHandler<ONE, OUTPUT> {
  // @formatter:on
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.Many}.
   *
   * @param <MANY> the type of the particular {@link DomainQuery.Many}
   * @param <ITEM> the type of each object read
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends DomainQuery.Many<ITEM>,
    ITEM
  > extends DomainQueryHandler<MANY, List<ITEM>> {
  // @formatter:on
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
