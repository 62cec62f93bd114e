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

package io.github.suppierk.documentstore.domain;

import io.github.suppierk.documentstore.exceptions.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Source of version timestamps.
 *
 * <p>Wraps a {@link Clock} and guarantees that, within one instance, every call to {@link #next()}
 * returns an instant strictly later than the previous one at microsecond precision. A coarse or
 * fixed clock therefore still yields distinct, ordered timestamps.
 *
 * <p>Timestamps are serialized as ISO-8601 UTC with six fractional digits and a trailing {@code
 * Z}, e.g. {@code 2019-02-21T13:52:26.526904Z}. The fixed width keeps their lexicographic and
 * chronological orders identical.
 */
public final class VersionClock {
  private static final DateTimeFormatter FORMATTER =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  private final Clock clock;
  private Instant last;

  public VersionClock(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.clock = clock;
    this.last = Instant.MIN;
  }

  /**
   * @return a clock backed by the system UTC clock
   */
  public static VersionClock systemUTC() {
    return new VersionClock(Clock.systemUTC());
  }

  /**
   * @return next instant, strictly after any instant previously returned by this clock
   */
  public synchronized Instant next() {
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    if (!now.isAfter(last)) {
      now = last.plus(1, ChronoUnit.MICROS);
    }

    last = now;
    return now;
  }

  /**
   * @return {@link #next()} serialized with {@link #format(Instant)}
   */
  public String nextTimestamp() {
    return format(next());
  }

  /**
   * @param instant to serialize
   * @return fixed-width ISO-8601 UTC representation
   */
  public static String format(final Instant instant) {
    return FORMATTER.format(instant);
  }

  /**
   * Reads a user supplied point in time.
   *
   * <p>Accepts full ISO-8601 instants ({@code 2019-02-21T13:52:26.526904Z}) and plain dates ({@code
   * 1900-01-01}), the latter meaning the start of that day in UTC.
   *
   * @param value to parse
   * @return parsed instant
   * @throws ValidationException if the value is neither an instant nor a date
   */
  public static Instant parse(final String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Timestamp cannot be empty");
    }

    try {
      if (value.length() == 10) {
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
      }

      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new ValidationException("'%s' is not a valid timestamp".formatted(value), e);
    }
  }
}
