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
import io.github.suppierk.documentstore.session.SessionFactory;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of the handlers forming one consistent model, and the single entry point to invoke
 * them.
 *
 * <p>Subclasses register their handlers upon construction. Each command class and each query class
 * may have exactly one handler. Registration and lookups are guarded by a read-write lock, so a
 * context can keep serving requests while handlers are being added. Handlers themselves run
 * outside the lock.
 *
 * <p><b>Design note</b>: a command is executed in its own {@link
 * io.github.suppierk.documentstore.session.Session} obtained from the {@link SessionFactory}, and
 * may be replayed up to {@code maxAttempts} times when it loses a race against a concurrent writer
 * of the same aggregate.
 */
public abstract non-sealed class BoundedContext extends Suspicious {
  /** How many times a command is attempted before a concurrent update is reported. */
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private final SessionFactory sessionFactory;
  private final int maxAttempts;
  private final ReentrantReadWriteLock lock;
  private final Map<Class<?>, DomainCommandHandler<?, ?>> commandHandlers;
  private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers;

  /**
   * @param sessionFactory to create a session per invocation with
   * @param maxAttempts how many times a command may be attempted, at least 1
   * @throws IllegalArgumentException if the factory is null or attempts are not positive
   */
  protected BoundedContext(final SessionFactory sessionFactory, final int maxAttempts) {
    this.sessionFactory = throwIllegalArgumentIfNull(sessionFactory, "Session factory");

    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "Max attempts must be at least 1, got %d".formatted(maxAttempts));
    }

    this.maxAttempts = maxAttempts;
    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
    this.queryHandlers = new HashMap<>();
  }

  protected BoundedContext(final SessionFactory sessionFactory) {
    this(sessionFactory, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * @return factory every invocation obtains its session from
   */
  public final SessionFactory getSessionFactory() {
    return sessionFactory;
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if its command class already has a handler
   */
  public final void addDomainCommandHandler(final DomainCommandHandler<?, ?> handler) {
    final DomainCommandHandler<?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");
    register(commandHandlers, nonNullHandler.getCommandClass(), nonNullHandler);
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if its query class already has a handler
   */
  public final void addDomainQueryHandler(final DomainQueryHandler<?, ?> handler) {
    final DomainQueryHandler<?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Query handler");
    register(queryHandlers, nonNullHandler.getQueryClass(), nonNullHandler);
  }

  /**
   * @return command classes this context can execute
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(commandHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @return query classes this context can answer
   */
  public final Set<Class<?>> getSupportedDomainQueryClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(queryHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @param command to execute
   * @param <A> type of the created aggregate
   * @return created aggregate
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <A extends Aggregate<?>> A createModel(final DomainCommand.Create<A> command) {
    return execute(command);
  }

  /**
   * @param command to execute
   * @param <A> type of the changed aggregate
   * @return changed aggregate
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <A extends Aggregate<?>> A updateModel(final DomainCommand.Update<A> command) {
    return execute(command);
  }

  /**
   * @param command to execute
   * @param <A> type of the tombstoned aggregate
   * @return tombstoned aggregate
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <A extends Aggregate<?>> A deleteModel(final DomainCommand.Delete<A> command) {
    return execute(command);
  }

  /**
   * @param query to answer
   * @param <O> type of the answer
   * @return answer
   * @throws IllegalArgumentException if the query is null
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  public final <O> O queryOneModel(final DomainQuery.One<O> query) {
    return query(query);
  }

  /**
   * @param query to answer
   * @param <I> type of each item of the answer
   * @return answer
   * @throws IllegalArgumentException if the query is null
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  public final <I> List<I> queryManyModels(final DomainQuery.Many<I> query) {
    return query(query);
  }

  boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }

  boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  @SuppressWarnings("unchecked")
  private <A extends Aggregate<?>> A execute(final DomainCommand<A> command) {
    final DomainCommand<A> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler<DomainCommand<A>, A> handler =
        (DomainCommandHandler<DomainCommand<A>, A>) lookup(commandHandlers, nonNullCommand);
    return handler.runInContext(nonNullCommand, sessionFactory, maxAttempts);
  }

  @SuppressWarnings("unchecked")
  private <O> O query(final DomainQuery<O> query) {
    final DomainQuery<O> nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler<DomainQuery<O>, O> handler =
        (DomainQueryHandler<DomainQuery<O>, O>) lookup(queryHandlers, nonNullQuery);
    return handler.runInContext(nonNullQuery, sessionFactory);
  }

  private <H> void register(final Map<Class<?>, H> handlers, final Class<?> key, final H handler) {
    lock.writeLock().lock();
    try {
      if (handlers.containsKey(key)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(key.getSimpleName()));
      }

      handlers.put(key, handler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private <H> H lookup(final Map<Class<?>, H> handlers, final DomainMessage message) {
    lock.readLock().lock();
    try {
      return throwUnsupportedOperationIfNull(
          handlers.get(message.getClass()),
          "Handler for '%s'".formatted(message.getClass().getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }
  }
}
