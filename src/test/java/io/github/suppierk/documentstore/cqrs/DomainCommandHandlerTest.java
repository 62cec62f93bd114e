package io.github.suppierk.documentstore.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.documentstore.async.DomainNotification;
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.exceptions.RetryableException;
import io.github.suppierk.documentstore.exceptions.ValidationException;
import io.github.suppierk.documentstore.session.SessionFactory;
import io.github.suppierk.test.Fixtures;
import io.github.suppierk.test.StubDataFetcher;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  static SessionFactory sessionFactory(ConflictingStorageDriver driver) {
    return Fixtures.inMemorySessionFactory(driver, new StubDataFetcher());
  }

  @Nested
  class Notifications {
    @Test
    void when_a_command_succeeds_subscribers_receive_the_aggregate_and_the_arguments() {
      final var factory = sessionFactory(new ConflictingStorageDriver(0));
      final List<Map<String, Object>> payloads = new ArrayList<>();
      factory.subscribe(Event.DOCUMENT_REGISTERED, (event, payload) -> payloads.add(payload));

      final var document =
          new TestCommands.RegisterHandler()
              .runInContext(new TestCommands.Register("d1", "https://x.org/d1.xml"), factory, 3);

      assertEquals(1, payloads.size());
      assertSame(document, payloads.get(0).get("document"));
      assertEquals("d1", payloads.get(0).get("id"));
      assertEquals("https://x.org/d1.xml", payloads.get(0).get("data_url"));
    }

    @Test
    void when_a_command_fails_no_success_notification_is_delivered() {
      final var factory = sessionFactory(new ConflictingStorageDriver(0));
      final List<Event> events = new ArrayList<>();
      factory.subscribe(Event.DOCUMENT_VERSION_REGISTERED, (event, payload) -> events.add(event));

      assertThrows(
          RuntimeException.class,
          () ->
              new TestCommands.ReviseHandler()
                  .runInContext(new TestCommands.Revise("d1", "https://x.org/x.xml"), factory, 3));
      assertTrue(events.isEmpty());
    }

    @Test
    void when_a_failure_notification_is_defined_it_is_delivered_before_the_exception_escapes() {
      final var factory = sessionFactory(new ConflictingStorageDriver(0));
      final List<Object> reasons = new ArrayList<>();
      factory.subscribe(
          Event.DOCUMENT_DELETED, (event, payload) -> reasons.add(payload.get("reason")));

      final var handler =
          new TestCommands.RemoveHandler() {
            @Override
            protected Optional<DomainNotification> onFailure(
                TestCommands.Remove command, Throwable cause) {
              return Optional.of(
                  DomainNotification.of(
                      Event.DOCUMENT_DELETED, Map.of("reason", cause.getClass().getSimpleName())));
            }
          };

      assertThrows(
          RuntimeException.class,
          () -> handler.runInContext(new TestCommands.Remove("missing"), factory, 3));
      assertEquals(List.of("DoesNotExistException"), reasons);
    }
  }

  @Nested
  class Retries {
    @Test
    void when_conflicts_stay_below_the_attempts_the_command_eventually_succeeds() {
      final var driver = new ConflictingStorageDriver(2);
      final var factory = sessionFactory(driver);
      new TestCommands.RegisterHandler()
          .runInContext(new TestCommands.Register("d1", "https://x.org/d1.xml"), factory, 3);

      final Document revised =
          new TestCommands.ReviseHandler()
              .runInContext(new TestCommands.Revise("d1", "https://x.org/d1-v2.xml"), factory, 3);

      assertEquals(3, driver.replaceCalls.get());
      assertEquals(2, revised.revision());
      assertEquals(2, revised.manifest().versions().size());
      assertEquals(2, factory.create().changes().filter().size());
    }

    @Test
    void when_every_attempt_conflicts_retryable_must_be_thrown_and_nothing_is_notified() {
      final var driver = new ConflictingStorageDriver(Integer.MAX_VALUE);
      final var factory = sessionFactory(driver);
      final List<Event> events = new ArrayList<>();
      factory.subscribe(Event.DOCUMENT_VERSION_REGISTERED, (event, payload) -> events.add(event));
      new TestCommands.RegisterHandler()
          .runInContext(new TestCommands.Register("d1", "https://x.org/d1.xml"), factory, 3);

      assertThrows(
          RetryableException.class,
          () ->
              new TestCommands.ReviseHandler()
                  .runInContext(
                      new TestCommands.Revise("d1", "https://x.org/d1-v2.xml"), factory, 3));
      assertEquals(3, driver.replaceCalls.get());
      assertTrue(events.isEmpty());
      assertEquals(1, factory.create().changes().filter().size());
    }
  }

  @Nested
  class Failures {
    @Test
    void when_the_aggregate_id_is_blank_validation_must_fail() {
      final var factory = sessionFactory(new ConflictingStorageDriver(0));

      assertThrows(
          ValidationException.class,
          () ->
              new TestCommands.RegisterHandler()
                  .runInContext(
                      new TestCommands.Register(" ", "https://x.org/d1.xml"), factory, 3));
      assertThrows(
          IllegalArgumentException.class,
          () -> new TestCommands.RegisterHandler().runInContext(null, factory, 3));
    }

    @Test
    void when_mutation_throws_a_checked_exception_it_is_wrapped_once() {
      final var factory = sessionFactory(new ConflictingStorageDriver(0));
      final var ioFailure =
          new TestCommands.RegisterHandler() {
            @Override
            protected void mutate(TestCommands.Register command, Document document)
                throws IOException {
              throw new IOException("unreachable");
            }
          };
      final var otherFailure =
          new TestCommands.RegisterHandler() {
            @Override
            protected void mutate(TestCommands.Register command, Document document)
                throws Exception {
              throw new Exception("odd");
            }
          };
      final var command = new TestCommands.Register("d1", "https://x.org/d1.xml");

      final var io =
          assertThrows(
              UncheckedIOException.class, () -> ioFailure.runInContext(command, factory, 3));
      assertEquals("unreachable", io.getCause().getMessage());

      final var other =
          assertThrows(
              IllegalStateException.class, () -> otherFailure.runInContext(command, factory, 3));
      assertEquals("odd", other.getCause().getMessage());
    }
  }
}
