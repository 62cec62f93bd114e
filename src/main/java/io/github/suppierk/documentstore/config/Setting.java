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

import java.util.function.Function;

/**
 * One configurable value of the store.
 *
 * @param key under which the value may be supplied, e.g. {@code documentstore.retries}
 * @param envVar environment variable overriding any supplied value
 * @param parser coercing the raw text to the semantic type
 * @param defaultValue used when neither the environment nor the caller supply a value, may be
 *     {@code null}
 * @param <T> semantic type of the value
 */
public record Setting<T>(
    String key, String envVar, Function<String, T> parser, T defaultValue) {
  public Setting {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Setting key cannot be empty");
    }

    if (envVar == null || envVar.isBlank()) {
      throw new IllegalArgumentException("Setting environment variable cannot be empty");
    }

    if (parser == null) {
      throw new IllegalArgumentException("Setting parser cannot be null");
    }
  }

  public static Setting<String> text(
      final String key, final String envVar, final String defaultValue) {
    return new Setting<>(key, envVar, Function.identity(), defaultValue);
  }

  public static Setting<Integer> integer(
      final String key, final String envVar, final Integer defaultValue) {
    return new Setting<>(key, envVar, raw -> Integer.valueOf(raw.trim()), defaultValue);
  }

  public static Setting<Boolean> bool(
      final String key, final String envVar, final Boolean defaultValue) {
    return new Setting<>(key, envVar, Settings::parseBoolean, defaultValue);
  }
}
