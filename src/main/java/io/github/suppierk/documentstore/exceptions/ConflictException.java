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
 * Raised when a journal would hold the same bundle both as an issue and as its ahead-of-print
 * bundle. Unlike {@link AlreadyExistsException} the request does not repeat the current state, so
 * it is never reported as a success.
 */
public class ConflictException extends DocumentStoreException {
  @Serial private static final long serialVersionUID = 2934567104455327618L;

  public ConflictException(String message) {
    super(message);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public final int getStatusCode() {
    return 409;
  }
}
