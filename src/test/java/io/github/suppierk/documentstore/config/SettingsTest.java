package io.github.suppierk.documentstore.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.documentstore.exceptions.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SettingsTest {
  static final Map<String, String> NO_ENVIRONMENT = Map.of();

  static Settings parse(Map<String, String> supplied, Map<String, String> environment) {
    return Settings.parse(supplied, Settings.DEFAULTS, environment::get);
  }

  @Nested
  class Precedence {
    @Test
    void when_nothing_is_supplied_defaults_are_used() {
      final var settings = parse(Map.of(), NO_ENVIRONMENT);

      assertEquals(500, settings.require(Settings.CHANGES_DEFAULT_LIMIT));
      assertEquals(3, settings.require(Settings.RETRIES));
      assertEquals(2, settings.require(Settings.FETCH_TIMEOUT_SECONDS));
      assertFalse(settings.require(Settings.DEBUG));
      assertEquals(Optional.empty(), settings.get(Settings.JDBC_URL));
    }

    @Test
    void when_value_is_supplied_it_overrides_the_default() {
      final var settings = parse(Map.of("documentstore.retries", "5"), NO_ENVIRONMENT);

      assertEquals(5, settings.require(Settings.RETRIES));
    }

    @Test
    void when_environment_variable_is_set_it_overrides_the_supplied_value() {
      final var settings =
          parse(
              Map.of("documentstore.retries", "5"),
              Map.of("DOCUMENTSTORE_RETRIES", "7", "DOCUMENTSTORE_JDBC_URL", "jdbc:h2:mem:kernel"));

      assertEquals(7, settings.require(Settings.RETRIES));
      assertEquals("jdbc:h2:mem:kernel", settings.require(Settings.JDBC_URL));
    }

    @Test
    void when_supplied_values_are_null_defaults_are_used() {
      final var settings = Settings.parse(null, Settings.DEFAULTS, name -> null);

      assertEquals(500, settings.require(Settings.CHANGES_DEFAULT_LIMIT));
    }
  }

  @Nested
  class Coercion {
    boolean debug(String raw) {
      return parse(Map.of("documentstore.debug", raw), NO_ENVIRONMENT).require(Settings.DEBUG);
    }

    @Test
    void when_boolean_is_spelled_loosely_it_is_still_understood() {
      assertTrue(debug("YES"));
      assertTrue(debug(" on "));
      assertFalse(debug("0"));
    }

    @Test
    void when_integer_has_surrounding_spaces_it_is_trimmed() {
      assertEquals(
          42,
          parse(Map.of("documentstore.changes.default_limit", " 42 "), NO_ENVIRONMENT)
              .require(Settings.CHANGES_DEFAULT_LIMIT));
    }

    @Test
    void when_value_cannot_be_coerced_validation_must_fail() {
      assertThrows(
          ValidationException.class,
          () -> parse(Map.of("documentstore.retries", "many"), NO_ENVIRONMENT));
      assertThrows(
          ValidationException.class,
          () -> parse(Map.of(), Map.of("DOCUMENTSTORE_DEBUG", "perhaps")));
    }
  }

  @Nested
  class Lookup {
    @Test
    void when_setting_was_not_parsed_illegal_argument_must_be_thrown() {
      final var settings = Settings.parse(Map.of(), List.of(Settings.RETRIES), name -> null);

      assertThrows(IllegalArgumentException.class, () -> settings.get(Settings.DEBUG));
    }

    @Test
    void when_required_setting_has_no_value_illegal_state_must_be_thrown() {
      final var settings = parse(Map.of(), NO_ENVIRONMENT);

      assertThrows(IllegalStateException.class, () -> settings.require(Settings.JDBC_URL));
    }

    @Test
    void when_parse_arguments_are_null_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> Settings.parse(Map.of(), null));
      assertThrows(
          IllegalArgumentException.class,
          () -> Settings.parse(Map.of(), Settings.DEFAULTS, null));
    }

    @Test
    void when_custom_setting_is_declared_it_is_resolved_like_the_built_in_ones() {
      final var acronym = Setting.text("documentstore.acronym", "DOCUMENTSTORE_ACRONYM", "rsp");
      final var settings = Settings.parse(Map.of(), List.of(acronym), name -> null);

      assertEquals("rsp", settings.require(acronym));
      assertEquals(Map.of("documentstore.acronym", "rsp"), settings.asMap());
      assertThrows(IllegalArgumentException.class, () -> Setting.text(" ", "X", null));
    }
  }
}
