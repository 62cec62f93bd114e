package io.github.suppierk.documentstore.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.documentstore.exceptions.ValidationException;
import io.github.suppierk.test.Fixtures;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class VersionClockTest {
  @Test
  void when_constructed_with_null_clock_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new VersionClock(null));
  }

  @Test
  void when_the_underlying_clock_stands_still_timestamps_still_increase() {
    final var clock = Fixtures.fixedClock();

    final String first = clock.nextTimestamp();
    final String second = clock.nextTimestamp();

    assertEquals("2019-02-21T13:52:26.526904Z", first);
    assertEquals("2019-02-21T13:52:26.526905Z", second);
    assertTrue(first.compareTo(second) < 0);
  }

  @Test
  void when_formatting_the_width_is_fixed() {
    assertEquals(
        "2019-01-01T00:00:00.000000Z", VersionClock.format(Instant.parse("2019-01-01T00:00:00Z")));
  }

  @Test
  void when_parsing_dates_and_instants_both_are_accepted() {
    assertEquals(Instant.parse("1900-01-01T00:00:00Z"), VersionClock.parse("1900-01-01"));
    assertEquals(Fixtures.NOW, VersionClock.parse("2019-02-21T13:52:26.526904Z"));
  }

  @Test
  void when_parsing_garbage_validation_must_fail() {
    assertThrows(ValidationException.class, () -> VersionClock.parse("xxx"));
    assertThrows(ValidationException.class, () -> VersionClock.parse(""));
  }
}
