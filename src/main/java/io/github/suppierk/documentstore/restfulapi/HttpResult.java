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

package io.github.suppierk.documentstore.restfulapi;

import java.util.Map;

/**
 * Outcome of a request: the status code and, where the route returns one, the body.
 *
 * <p>Bodies are either raw bytes (the XML of a document) or values the transport serializes with
 * {@link io.github.suppierk.documentstore.persistence.JsonCodec}.
 *
 * @param status HTTP status code
 * @param body response body, {@code null} when there is none
 */
public record HttpResult(int status, Object body) {
  public static final int OK = 200;
  public static final int CREATED = 201;
  public static final int NO_CONTENT = 204;
  public static final int BAD_REQUEST = 400;
  public static final int NOT_FOUND = 404;
  public static final int METHOD_NOT_ALLOWED = 405;
  public static final int CONFLICT = 409;
  public static final int UNPROCESSABLE_ENTITY = 422;
  public static final int BAD_GATEWAY = 502;

  public static HttpResult ok(final Object body) {
    return new HttpResult(OK, body);
  }

  public static HttpResult created() {
    return new HttpResult(CREATED, null);
  }

  public static HttpResult noContent() {
    return new HttpResult(NO_CONTENT, null);
  }

  public static HttpResult error(final int status, final String message) {
    return new HttpResult(status, Map.of("error", message == null ? "" : message));
  }

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }
}
