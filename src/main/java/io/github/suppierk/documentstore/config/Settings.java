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

package io.github.suppierk.documentstore.config;

import io.github.suppierk.documentstore.exceptions.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolved configuration of the store.
 *
 * <p>Each {@link Setting} is resolved with the precedence <b>environment variable &gt; supplied
 * value &gt; default</b>, and the winning raw text is coerced by the setting's parser. Defaults are
 * taken as they are.
 */
public final class Settings {
  public static final Setting<Integer> CHANGES_DEFAULT_LIMIT =
      Setting.integer("documentstore.changes.default_limit", "DOCUMENTSTORE_CHANGES_LIMIT", 500);
  public static final Setting<Integer> RETRIES =
      Setting.integer("documentstore.retries", "DOCUMENTSTORE_RETRIES", 3);
  public static final Setting<Integer> FETCH_TIMEOUT_SECONDS =
      Setting.integer("documentstore.fetch.timeout_seconds", "DOCUMENTSTORE_FETCH_TIMEOUT", 2);
  public static final Setting<String> JDBC_URL =
      Setting.text("documentstore.jdbc.url", "DOCUMENTSTORE_JDBC_URL", null);
  public static final Setting<Boolean> DEBUG =
      Setting.bool("documentstore.debug", "DOCUMENTSTORE_DEBUG", false);

  /** Every setting known to the store. */
  public static final List<Setting<?>> DEFAULTS =
      List.of(CHANGES_DEFAULT_LIMIT, RETRIES, FETCH_TIMEOUT_SECONDS, JDBC_URL, DEBUG);

  private static final Set<String> TRUTHY = Set.of("true", "yes", "on", "1");
  private static final Set<String> FALSY = Set.of("false", "no", "off", "0");

  private final Map<String, Object> values;

  private Settings(final Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * @see #parse(Map, List, Function)
   */
  public static Settings parse(
      final Map<String, String> supplied, final List<Setting<?>> settings) {
    return parse(supplied, settings, System::getenv);
  }

  /**
   * @param supplied raw values keyed by {@link Setting#key()}, typically read from a file
   * @param settings to resolve
   * @param environment lookup of environment variables, returning {@code null} when unset
   * @return resolved settings
   * @throws ValidationException if a raw value cannot be coerced
   */
  public static Settings parse(
      final Map<String, String> supplied,
      final List<Setting<?>> settings,
      final Function<String, String> environment) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null");
    }

    if (environment == null) {
      throw new IllegalArgumentException("Environment cannot be null");
    }

    final Map<String, String> nonNullSupplied = supplied == null ? Map.of() : supplied;
    final var resolved = new LinkedHashMap<String, Object>();

    for (Setting<?> setting : settings) {
      final String raw =
          Optional.ofNullable(environment.apply(setting.envVar()))
              .orElseGet(() -> nonNullSupplied.get(setting.key()));

      resolved.put(setting.key(), raw == null ? setting.defaultValue() : coerce(setting, raw));
    }

    return new Settings(resolved);
  }

  /**
   * @param setting to read
   * @param <T> semantic type of the value
   * @return resolved value, empty when the setting has no value at all
   * @throws IllegalArgumentException if the setting was not part of the parsed list
   */
  public <T> Optional<T> get(final Setting<T> setting) {
    if (!values.containsKey(setting.key())) {
      throw new IllegalArgumentException("Unknown setting '%s'".formatted(setting.key()));
    }

    @SuppressWarnings("unchecked")
    final T value = (T) values.get(setting.key());
    return Optional.ofNullable(value);
  }

  /**
   * @param setting to read
   * @param <T> semantic type of the value
   * @return resolved value
   * @throws IllegalStateException if the setting has no value at all
   */
  public <T> T require(final Setting<T> setting) {
    return get(setting)
        .orElseThrow(
            () -> new IllegalStateException("Setting '%s' is required".formatted(setting.key())));
  }

  /**
   * @return resolved values keyed by {@link Setting#key()}
   */
  public Map<String, Object> asMap() {
    return values;
  }

  static Boolean parseBoolean(final String raw) {
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (TRUTHY.contains(normalized)) {
      return Boolean.TRUE;
    }

    if (FALSY.contains(normalized)) {
      return Boolean.FALSE;
    }

    throw new IllegalArgumentException("'%s' is not a boolean".formatted(raw));
  }

  private static Object coerce(final Setting<?> setting, final String raw) {
    try {
      return setting.parser().apply(raw);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Invalid value '%s' for setting '%s'".formatted(raw, setting.key()), e);
    }
  }
}
