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
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.domain.Aggregate;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.exceptions.RetryableException;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import io.github.suppierk.documentstore.session.SessionFactory;
import io.github.suppierk.java.Try;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Resolve the target aggregate: construct a new one or fetch the stored one.
 *   <li>Mutate it.
 *   <li>Persist it, which also appends the change feed entry.
 *   <li>Notify the session subscribers with a {@link DomainNotification} if the command succeeded.
 *   <li><b>Optional</b>: notify them if the command failed.
 * </ul>
 *
 * <p>The three variants only differ in how the aggregate is resolved and persisted. Each of them
 * describes this with a {@link Strategy} and the single run function below does the rest, so no
 * variant overrides the flow itself.
 *
 * <p>Persisting is optimistic: when another writer updated the same aggregate in the meantime the
 * whole fetch, mutate and persist sequence is replayed, up to the number of attempts configured in
 * {@link BoundedContext}.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <AGGREGATE> the type of the aggregate the command works on
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<AGGREGATE>,
  AGGREGATE extends Aggregate<?>
>
extends
        DomainHandler<COMMAND, AGGREGATE>
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update,
  DomainCommandHandler.Delete
{
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(DomainCommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * @param session of the current invocation
   * @return repository storing the aggregates this handler works on
   */
  protected abstract AggregateRepository<AGGREGATE, ?> repository(final Session session);

  /**
   * @return kind of the event delivered to subscribers once the command succeeded
   */
  protected abstract Event event();

  /**
   * Business logic applying the command to the resolved aggregate.
   *
   * @param command containing the data required to change the aggregate
   * @param aggregate to be changed, either brand new or freshly fetched
   * @throws Exception if any error occurs during the execution of the command
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract void mutate(final COMMAND command, final AGGREGATE aggregate)
      throws Exception;

  /**
   * Arguments delivered to subscribers along with the aggregate, keyed by name. By default this is
   * the aggregate identifier only.
   *
   * @param command which succeeded
   * @return command arguments
   */
  protected Map<String, Object> arguments(final COMMAND command) {
    return Map.of("id", command.id());
  }

  /**
   * @return key under which the aggregate is delivered to subscribers, e.g. {@code document}
   */
  protected String aggregateName() {
    return "instance";
  }

  /**
   * @return how the variant resolves and persists the aggregate
   */
  abstract Strategy<COMMAND, AGGREGATE> strategy();

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification> onSuccess(
      final COMMAND command, final AGGREGATE aggregate) {
    final var payload = new LinkedHashMap<String, Object>();
    payload.put(aggregateName(), aggregate);
    payload.putAll(arguments(command));
    return Optional.of(DomainNotification.of(strategy().event(), payload));
  }

  /**
   * Executes the given command in a fresh {@link Session}.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link BoundedContext}
   * only.
   *
   * @param command to be executed
   * @param sessionFactory to create the session with
   * @param maxAttempts how many times the command may be replayed on concurrent updates
   * @return the aggregate as persisted
   * @throws IllegalArgumentException if any command parameter is null
   * @throws IllegalStateException if any internal state is invalid (typically null)
   * @throws RetryableException if every attempt lost against a concurrent writer
   */
  final AGGREGATE runInContext(
      final COMMAND command, final SessionFactory sessionFactory, final int maxAttempts) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    throwValidationIfBlank(nonNullCommand.id(), "Command's aggregate id");

    final SessionFactory nonNullSessionFactory =
        throwIllegalStateIfNull(sessionFactory, "Session factory");
    final Session session = throwIllegalStateIfNull(nonNullSessionFactory.create(), "Session");
    final Strategy<COMMAND, AGGREGATE> strategy = throwIllegalStateIfNull(strategy(), "Strategy");

    final Try<AGGREGATE> output =
        Try.of(() -> persistWithRetries(nonNullCommand, session, strategy, maxAttempts));

    output.ifSuccess(
        aggregate -> {
          final var optionalNotification =
              throwIllegalStateIfNull(
                  onSuccess(nonNullCommand, aggregate),
                  "Command handler Optional successful notification");
          optionalNotification.ifPresent(
              notification -> {
                session.notify(notification);
                log.debug("{} delivered for '{}'", notification.event(), nonNullCommand.id());
              });
        });

    output.ifFailure(
        reason -> {
          final var optionalNotification =
              throwIllegalStateIfNull(
                  onFailure(nonNullCommand, reason),
                  "Command handler Optional failure notification");
          optionalNotification.ifPresent(session::notify);
          throw rethrow(reason);
        });

    return output.get();
  }

  private AGGREGATE persistWithRetries(
      final COMMAND command,
      final Session session,
      final Strategy<COMMAND, AGGREGATE> strategy,
      final int maxAttempts)
      throws Exception {
    for (int attempt = 1; ; attempt++) {
      final AGGREGATE aggregate =
          throwIllegalStateIfNull(strategy.getOrCreate().apply(session, command), "Aggregate");
      mutate(command, aggregate);

      try {
        strategy.persist().accept(session, aggregate);
        return aggregate;
      } catch (RetryableException e) {
        if (attempt >= maxAttempts) {
          log.warn(
              "Giving up on {} for '{}' after {} attempts",
              getCommandClass().getSimpleName(),
              command.id(),
              attempt);
          throw e;
        }

        log.debug("Replaying {} for '{}'", getCommandClass().getSimpleName(), command.id());
      }
    }
  }

  /**
   * How a variant obtains the aggregate to mutate and how it stores the result.
   *
   * @param getOrCreate resolves the aggregate for the command
   * @param persist stores the mutated aggregate
   * @param event delivered to subscribers once the aggregate is stored
   * @param <COMMAND> the type of the particular {@link DomainCommand}
   * @param <AGGREGATE> the type of the aggregate
   */
  @SuppressWarnings("squid:S119")
  record Strategy<COMMAND, AGGREGATE>(
      BiFunction<Session, COMMAND, AGGREGATE> getOrCreate,
      BiConsumer<Session, AGGREGATE> persist,
      Event event) {}

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}: the aggregate
   * is constructed from scratch and added to its repository.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <AGGREGATE> the type of the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<AGGREGATE>,
    AGGREGATE extends Aggregate<?>
  > extends DomainCommandHandler<CREATE, AGGREGATE> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * @param command being executed
     * @param clock to stamp the new aggregate with
     * @return blank aggregate carrying the command's id
     */
    protected abstract AGGREGATE newAggregate(final CREATE command, final VersionClock clock);

    /** {@inheritDoc} */
    @Override
    final Strategy<CREATE, AGGREGATE> strategy() {
      return new Strategy<CREATE, AGGREGATE>(
          (session, command) -> newAggregate(command, session.clock()),
          (session, aggregate) -> repository(session).add(aggregate),
          event());
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}: the aggregate
   * is fetched and written back.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <AGGREGATE> the type of the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<AGGREGATE>,
    AGGREGATE extends Aggregate<?>
  > extends DomainCommandHandler<UPDATE, AGGREGATE> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /** {@inheritDoc} */
    @Override
    final Strategy<UPDATE, AGGREGATE> strategy() {
      return new Strategy<UPDATE, AGGREGATE>(
          (session, command) -> repository(session).fetch(command.id()),
          (session, aggregate) -> repository(session).update(aggregate),
          event());
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Delete}: the aggregate
   * is fetched, tombstoned by {@link #mutate} and written back, its history stays in storage.
   *
   * @param <DELETE> the type of the particular {@link DomainCommand.Delete}
   * @param <AGGREGATE> the type of the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Delete<
    DELETE extends DomainCommand.Delete<AGGREGATE>,
    AGGREGATE extends Aggregate<?>
  > extends DomainCommandHandler<DELETE, AGGREGATE> {
  // @formatter:on
    protected Delete(final Class<DELETE> commandClass) {
      super(commandClass);
    }

    /** {@inheritDoc} */
    @Override
    final Strategy<DELETE, AGGREGATE> strategy() {
      return new Strategy<DELETE, AGGREGATE>(
          (session, command) -> repository(session).fetch(command.id()),
          (session, aggregate) -> repository(session).update(aggregate),
          event());
    }
  }
}
