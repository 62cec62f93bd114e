package io.github.suppierk.documentstore.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.ConflictException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import io.github.suppierk.documentstore.session.SessionFactory;
import io.github.suppierk.test.Fixtures;
import io.github.suppierk.test.StubDataFetcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JournalServicesTest {
  static final String JOURNAL = "0034-8910";

  SessionFactory sessionFactory;
  DocumentStoreServices services;

  @BeforeEach
  void setUp() {
    sessionFactory = Fixtures.inMemorySessionFactory(new StubDataFetcher());
    services = new DocumentStoreServices(sessionFactory);
    services.createModel(
        new CreateJournal(
            JOURNAL, Map.of("title", TextNode.valueOf("Revista de Saúde Pública"))));
  }

  @Nested
  class Issues {
    @Test
    void when_issues_are_added_inserted_and_removed_the_order_follows() {
      services.updateModel(new AddIssueToJournal(JOURNAL, "issue-2"));
      services.updateModel(new InsertIssueToJournal(JOURNAL, 0, "issue-1"));
      services.updateModel(new AddIssueToJournal(JOURNAL, "issue-3"));
      services.updateModel(new RemoveIssueFromJournal(JOURNAL, "issue-2"));

      assertEquals(
          List.of("issue-1", "issue-3"),
          services.queryOneModel(new FetchJournal(JOURNAL)).items());
    }

    @Test
    void when_issue_is_added_twice_already_exists_must_be_thrown() {
      services.updateModel(new AddIssueToJournal(JOURNAL, "issue-1"));

      assertThrows(
          AlreadyExistsException.class,
          () -> services.updateModel(new AddIssueToJournal(JOURNAL, "issue-1")));
      assertThrows(
          DoesNotExistException.class,
          () -> services.updateModel(new RemoveIssueFromJournal(JOURNAL, "issue-9")));
    }

    @Test
    void when_issues_are_replaced_the_new_order_is_kept() {
      services.updateModel(new AddIssueToJournal(JOURNAL, "issue-1"));
      services.updateModel(new UpdateIssuesInJournal(JOURNAL, List.of("issue-3", "issue-2")));

      assertEquals(
          List.of("issue-3", "issue-2"),
          services.queryOneModel(new FetchJournal(JOURNAL)).items());
    }
  }

  @Nested
  class AheadOfPrint {
    @Test
    void when_bundle_is_set_and_removed_the_slot_follows() {
      services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "aop-bundle"));
      assertEquals("aop-bundle", services.queryOneModel(new FetchJournal(JOURNAL)).aop());

      services.updateModel(new RemoveAheadOfPrintBundleFromJournal(JOURNAL));
      assertNull(services.queryOneModel(new FetchJournal(JOURNAL)).aop());

      assertThrows(
          DoesNotExistException.class,
          () -> services.updateModel(new RemoveAheadOfPrintBundleFromJournal(JOURNAL)));
    }

    @Test
    void when_the_same_bundle_is_set_again_already_exists_must_be_thrown() {
      services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "aop-bundle"));

      assertThrows(
          AlreadyExistsException.class,
          () -> services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "aop-bundle")));
    }

    @Test
    void when_a_bundle_would_be_both_issue_and_ahead_of_print_conflict_must_be_thrown() {
      services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "aop-bundle"));
      services.updateModel(new AddIssueToJournal(JOURNAL, "issue-bundle"));

      assertThrows(
          ConflictException.class,
          () -> services.updateModel(new AddIssueToJournal(JOURNAL, "aop-bundle")));
      assertThrows(
          ConflictException.class,
          () -> services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "issue-bundle")));
      assertEquals("aop-bundle", services.queryOneModel(new FetchJournal(JOURNAL)).aop());
    }
  }

  @Test
  void when_metadata_is_updated_the_other_fields_are_kept() {
    services.updateModel(
        new UpdateJournalMetadata(JOURNAL, Map.of("acronym", TextNode.valueOf("rsp"))));

    final var metadata = services.queryOneModel(new FetchJournal(JOURNAL)).metadata();
    assertEquals("Revista de Saúde Pública", metadata.get("title").asText());
    assertEquals("rsp", metadata.get("acronym").asText());
  }

  @Test
  void when_journal_changes_subscribers_are_told_what_happened() {
    final List<Event> events = new ArrayList<>();
    sessionFactory.subscribe(Event.ISSUE_ADDED_TO_JOURNAL, (event, payload) -> events.add(event));
    sessionFactory.subscribe(
        Event.AHEAD_OF_PRINT_BUNDLE_SET, (event, payload) -> events.add(event));

    services.updateModel(new AddIssueToJournal(JOURNAL, "issue-1"));
    services.updateModel(new SetAheadOfPrintBundleToJournal(JOURNAL, "aop-bundle"));

    assertEquals(List.of(Event.ISSUE_ADDED_TO_JOURNAL, Event.AHEAD_OF_PRINT_BUNDLE_SET), events);
  }
}
