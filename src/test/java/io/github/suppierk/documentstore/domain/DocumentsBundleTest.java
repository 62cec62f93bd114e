package io.github.suppierk.documentstore.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DoesNotExistException;
import io.github.suppierk.test.Fixtures;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DocumentsBundleTest {
  DocumentsBundle bundle;

  @BeforeEach
  void setUp() {
    bundle = new DocumentsBundle("0034-8910-rsp-48-2", Fixtures.fixedClock());
  }

  @Nested
  class Documents {
    @Test
    void when_a_document_is_added_it_is_appended() {
      bundle.addDocument("d1");
      bundle.addDocument("d2");

      assertEquals(List.of("d1", "d2"), bundle.documents());
    }

    @Test
    void when_a_document_is_added_twice_already_exists_must_be_thrown() {
      bundle.addDocument("d1");

      assertThrows(AlreadyExistsException.class, () -> bundle.addDocument("d1"));
      assertThrows(AlreadyExistsException.class, () -> bundle.insertDocument(0, "d1"));
      assertEquals(List.of("d1"), bundle.documents());
    }

    @Test
    void when_a_document_is_inserted_out_of_range_it_lands_at_the_nearest_end() {
      bundle.addDocument("d1");
      bundle.insertDocument(10, "d2");
      bundle.insertDocument(-10, "d0");
      bundle.insertDocument(1, "d0.5");

      assertEquals(List.of("d0", "d0.5", "d1", "d2"), bundle.documents());
    }

    @Test
    void when_a_missing_document_is_removed_does_not_exist_must_be_thrown() {
      assertThrows(DoesNotExistException.class, () -> bundle.removeDocument("d1"));
    }

    @Test
    void when_documents_are_replaced_with_duplicates_nothing_changes() {
      bundle.addDocument("d0");

      assertThrows(
          AlreadyExistsException.class, () -> bundle.updateDocuments(List.of("d1", "d1")));
      assertEquals(List.of("d0"), bundle.documents());
    }

    @Test
    void when_documents_are_replaced_the_new_order_is_kept() {
      bundle.addDocument("d0");
      bundle.updateDocuments(List.of("d2", "d1"));

      assertEquals(List.of("d2", "d1"), bundle.documents());
    }
  }

  @Nested
  class MetadataFields {
    @Test
    void when_metadata_is_updated_fields_are_set_and_null_values_remove_them() {
      bundle.setMetadata("volume", new TextNode("48"));
      bundle.setMetadata("number", new TextNode("2"));

      final var update = new LinkedHashMap<String, JsonNode>();
      update.put("publication_year", new IntNode(2014));
      update.put("number", NullNode.getInstance());
      bundle.updateMetadata(update);

      assertEquals(
          Map.of("volume", new TextNode("48"), "publication_year", new IntNode(2014)),
          bundle.metadata().asMap());
      assertFalse(bundle.metadata().get("number").isPresent());
    }

    @Test
    void when_an_empty_key_is_used_illegal_argument_must_be_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> bundle.setMetadata(" ", IntNode.valueOf(1)));
    }
  }

  @Test
  void when_mutated_updated_moves_forward_and_created_stays() {
    final String created = bundle.created();
    assertEquals(created, bundle.updated());

    bundle.addDocument("d1");

    assertEquals(created, bundle.created());
    assertNotEquals(created, bundle.updated());
    assertTrue(bundle.updated().compareTo(created) > 0);
  }

  @Test
  void when_rebuilt_from_its_manifest_the_bundle_is_the_same() {
    bundle.addDocument("d1");
    bundle.setMetadata("volume", new TextNode("48"));

    final var rebuilt = DocumentsBundle.fromManifest(bundle.manifest(), Fixtures.fixedClock());

    assertEquals(bundle.manifest(), rebuilt.manifest());
  }
}
