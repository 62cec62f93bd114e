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
 * Raised when a stored record changed between {@code fetch} and {@code update}.
 *
 * <p>Command handlers retry on it a bounded number of times; once the retries are exhausted it
 * escapes to the caller, who may submit the command again.
 */
public class RetryableException extends DocumentStoreException {
  @Serial private static final long serialVersionUID = -1590425066925811418L;

  public RetryableException(String message) {
    super(message);
  }

  public RetryableException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/503">503 Service
   *     Unavailable</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public final int getStatusCode() {
    return 503;
  }
}
