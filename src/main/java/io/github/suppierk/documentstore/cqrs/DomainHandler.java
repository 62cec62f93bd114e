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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Defines some of the common functionalities defined for handlers.
 *
 * @param <OPERATION> supported by the current handler
 * @param <OUTPUT> of the handler operation
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION, OUTPUT> extends Suspicious
    permits DomainCommandHandler, DomainQueryHandler {
  /**
   * Defines a {@link DomainNotification} to deliver in case when this operation will succeed.
   *
   * @param operation being invoked
   * @param output created after operation invocation
   * @return an {@link Optional} {@link DomainNotification} to deliver via {@link
   *     Session#notify(DomainNotification)}
   */
  protected Optional<DomainNotification> onSuccess(final OPERATION operation, final OUTPUT output) {
    return Optional.empty();
  }

  /**
   * Defines a {@link DomainNotification} to deliver in case when this operation will fail.
   *
   * @param operation being invoked
   * @param cause is an exception that happened during processing
   * @return an {@link Optional} {@link DomainNotification} to deliver via {@link
   *     Session#notify(DomainNotification)}
   */
  protected Optional<DomainNotification> onFailure(
      final OPERATION operation, final Throwable cause) {
    return Optional.empty();
  }

  /**
   * Lets the failure of an operation escape as is, so that callers observe the typed exception
   * rather than a wrapper. Checked exceptions are wrapped once.
   *
   * @param cause of the failure
   * @return never returns, declared for {@code throw rethrow(cause)} call sites
   */
  static RuntimeException rethrow(final Throwable cause) {
    if (cause instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }

    if (cause instanceof Error error) {
      throw error;
    }

    if (cause instanceof IOException ioException) {
      throw new UncheckedIOException(ioException);
    }

    throw new IllegalStateException(cause);
  }
}
