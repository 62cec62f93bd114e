package io.github.suppierk.documentstore.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.documentstore.async.DomainNotification;
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.domain.Journal;
import io.github.suppierk.documentstore.persistence.InMemoryStorageDriver;
import io.github.suppierk.test.Fixtures;
import io.github.suppierk.test.StubDataFetcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionTest {
  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_null_illegal_argument_must_be_thrown() {
      final var driver = new InMemoryStorageDriver();
      final var clock = Fixtures.fixedClock();
      final var fetcher = new StubDataFetcher();

      assertThrows(IllegalArgumentException.class, () -> new Session(null, clock, fetcher));
      assertThrows(IllegalArgumentException.class, () -> new Session(driver, null, fetcher));
      assertThrows(IllegalArgumentException.class, () -> new Session(driver, clock, null));
      assertThrows(IllegalArgumentException.class, () -> new SessionFactory(null, clock, fetcher));
    }

    @Test
    void when_created_by_a_factory_sessions_are_fresh_but_share_the_same_storage() {
      final var factory = Fixtures.inMemorySessionFactory(new StubDataFetcher());

      final var first = factory.create();
      final var second = factory.create();

      assertNotSame(first, second);
      assertSame(first.clock(), second.clock());

      first.journals().add(new Journal("j1", first.clock()));
      assertEquals(1, second.changes().filter().size());
    }
  }

  @Nested
  class Notification {
    @Test
    void when_notified_subscribers_of_that_event_are_invoked_in_registration_order() {
      final var session = Fixtures.inMemorySessionFactory(new StubDataFetcher()).create();
      final List<String> calls = new ArrayList<>();
      session.observe(Event.DOCUMENT_REGISTERED, (event, payload) -> calls.add("first"));
      session.observe(Event.DOCUMENT_REGISTERED, (event, payload) -> calls.add("second"));
      session.observe(Event.DOCUMENT_DELETED, (event, payload) -> calls.add("other"));

      session.notify(DomainNotification.of(Event.DOCUMENT_REGISTERED, Map.of("id", "d1")));

      assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void when_a_subscriber_fails_the_next_ones_are_still_invoked() {
      final var session = Fixtures.inMemorySessionFactory(new StubDataFetcher()).create();
      final List<Object> received = new ArrayList<>();
      session.observe(
          Event.DOCUMENT_DELETED,
          (event, payload) -> {
            throw new IllegalStateException("boom");
          });
      session.observe(Event.DOCUMENT_DELETED, (event, payload) -> received.add(payload.get("id")));

      session.notify(DomainNotification.of(Event.DOCUMENT_DELETED, Map.of("id", "d1")));

      assertEquals(List.of("d1"), received);
    }

    @Test
    void when_subscribed_on_the_factory_every_later_session_observes_the_event() {
      final var factory = Fixtures.inMemorySessionFactory(new StubDataFetcher());
      final List<Event> received = new ArrayList<>();
      factory.subscribe(Event.JOURNAL_CREATED, (event, payload) -> received.add(event));

      factory.create().notify(DomainNotification.of(Event.JOURNAL_CREATED, Map.of()));
      factory.create().notify(DomainNotification.of(Event.JOURNAL_CREATED, Map.of()));

      assertEquals(List.of(Event.JOURNAL_CREATED, Event.JOURNAL_CREATED), received);
    }

    @Test
    void when_observing_with_null_arguments_illegal_argument_must_be_thrown() {
      final var session = Fixtures.inMemorySessionFactory(new StubDataFetcher()).create();

      assertThrows(
          IllegalArgumentException.class, () -> session.observe(null, (event, payload) -> {}));
      assertThrows(
          IllegalArgumentException.class, () -> session.observe(Event.DOCUMENT_DELETED, null));
    }
  }
}
