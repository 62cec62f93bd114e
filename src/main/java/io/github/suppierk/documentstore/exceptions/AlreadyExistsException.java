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

package io.github.suppierk.documentstore.exceptions;

import java.io.Serial;

/**
 * Raised on a duplicate {@code add}, a duplicate issue in a journal, a duplicate document in a
 * bundle or an ahead-of-print bundle the journal already holds.
 */
public class AlreadyExistsException extends DocumentStoreException {
  @Serial private static final long serialVersionUID = -6004994862716263102L;

  public AlreadyExistsException(String message) {
    super(message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Transport routes decide how a duplicate is reported: a repeated {@code PUT} is a success, a
   * list with repeated ids is unprocessable. This is the status used when a route has no opinion.
   *
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public final int getStatusCode() {
    return 409;
  }
}
