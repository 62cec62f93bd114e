package io.github.suppierk.documentstore.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.changes.ChangeLog;
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.domain.DocumentsBundle;
import io.github.suppierk.documentstore.domain.Journal;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import io.github.suppierk.documentstore.exceptions.RetryableException;
import io.github.suppierk.test.Fixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AggregateRepositoryTest {
  VersionClock clock;
  StorageDriver driver;
  ChangeLog changeLog;

  @BeforeEach
  void setUp() {
    clock = Fixtures.fixedClock();
    driver = new InMemoryStorageDriver();
    changeLog = new ChangeLog(driver, clock);
  }

  @Test
  void when_any_of_the_constructor_arguments_is_null_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class, () -> new DocumentRepository(null, changeLog, clock));
    assertThrows(IllegalArgumentException.class, () -> new DocumentRepository(driver, null, clock));
    assertThrows(
        IllegalArgumentException.class, () -> new DocumentRepository(driver, changeLog, null));
  }

  @Nested
  class Documents {
    DocumentRepository repository;

    @BeforeEach
    void setUp() {
      repository = new DocumentRepository(driver, changeLog, clock);
    }

    Document registered(String id) {
      final var document = new Document(id, clock);
      document.newVersion("https://x.org/%s.xml".formatted(id), List.of());
      repository.add(document);
      return document;
    }

    @Test
    void when_added_and_fetched_the_document_round_trips() {
      final var document = registered("d1");

      final var fetched = repository.fetch("d1");

      assertEquals(document.manifest(), fetched.manifest());
      assertEquals(StoredRecord.FIRST_REVISION, fetched.revision());
    }

    @Test
    void when_added_exactly_one_change_is_recorded() {
      registered("d1");

      assertEquals(List.of("/documents/d1"), changeLog.filter().stream().map(Change::id).toList());
    }

    @Test
    void when_added_twice_already_exists_must_be_thrown() {
      registered("d1");

      assertThrows(AlreadyExistsException.class, () -> registered("d1"));
      assertEquals(1, changeLog.filter().size());
    }

    @Test
    void when_fetching_a_missing_document_does_not_exist_must_be_thrown() {
      assertThrows(DoesNotExistException.class, () -> repository.fetch("d1"));
    }

    @Test
    void when_updated_the_revision_moves_and_a_change_is_recorded() {
      registered("d1");
      final var document = repository.fetch("d1");
      document.newVersion("https://x.org/d1-v2.xml", List.of());

      repository.update(document);

      assertEquals(2, document.revision());
      assertEquals(2, repository.fetch("d1").manifest().versions().size());
      assertEquals(2, changeLog.filter().size());
    }

    @Test
    void when_two_copies_are_updated_the_second_write_is_retryable() {
      registered("d1");
      final var first = repository.fetch("d1");
      final var second = repository.fetch("d1");

      first.newVersion("https://x.org/d1-a.xml", List.of());
      repository.update(first);

      second.newVersion("https://x.org/d1-b.xml", List.of());
      assertThrows(RetryableException.class, () -> repository.update(second));
      assertEquals("https://x.org/d1-a.xml", repository.fetch("d1").version().dataUrl());
      assertEquals(2, changeLog.filter().size());
    }

    @Test
    void when_deleted_the_change_is_flagged_and_the_tombstone_is_still_fetchable() {
      registered("d1");
      final var document = repository.fetch("d1");
      document.delete();

      repository.update(document);

      final var changes = changeLog.filter();
      assertFalse(changes.get(0).deleted());
      assertTrue(changes.get(1).deleted());
      assertTrue(repository.fetch("d1").isDeleted());
    }
  }

  @Nested
  class Bundles {
    @Test
    void when_a_bundle_round_trips_its_items_and_metadata_are_kept() {
      final var repository = new DocumentsBundleRepository(driver, changeLog, clock);
      final var bundle = new DocumentsBundle("b1", clock);
      bundle.addDocument("d1");
      bundle.setMetadata("volume", new TextNode("48"));

      repository.add(bundle);

      final var fetched = repository.fetch("b1");
      assertEquals(List.of("d1"), fetched.documents());
      assertEquals(Map.of("volume", new TextNode("48")), fetched.metadata().asMap());
      assertEquals("/bundles/b1", changeLog.filter().get(0).id());
    }
  }

  @Nested
  class Journals {
    @Test
    void when_a_journal_round_trips_its_issues_and_ahead_of_print_are_kept() {
      final var repository = new JournalRepository(driver, changeLog, clock);
      final var journal = new Journal("j1", clock);
      journal.addIssue("i1");
      journal.setAheadOfPrint("aop");

      repository.add(journal);

      assertEquals(journal.manifest(), repository.fetch("j1").manifest());
      assertEquals("/journals/j1", changeLog.filter().get(0).id());
    }
  }
}
