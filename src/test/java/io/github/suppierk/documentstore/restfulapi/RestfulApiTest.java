package io.github.suppierk.documentstore.restfulapi;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.documentstore.changes.Change;
import io.github.suppierk.documentstore.config.Settings;
import io.github.suppierk.documentstore.domain.DocumentManifest;
import io.github.suppierk.documentstore.domain.DocumentsBundleManifest;
import io.github.suppierk.documentstore.domain.JournalManifest;
import io.github.suppierk.documentstore.domain.Rendition;
import io.github.suppierk.documentstore.services.DocumentStoreServices;
import io.github.suppierk.test.Fixtures;
import io.github.suppierk.test.StubDataFetcher;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RestfulApiTest {
  static final String XML = "https://kernel.example.org/rsp/0347.xml";
  static final String DOCUMENT = "{\"data\": \"" + XML + "\", \"assets\": []}";

  StubDataFetcher fetcher;
  RestfulApi api;

  @BeforeEach
  void setUp() {
    fetcher = new StubDataFetcher().serve(XML, "<article/>");
    api = new RestfulApi(new DocumentStoreServices(Fixtures.inMemorySessionFactory(fetcher)));
  }

  HttpResult call(String method, String path, String body) {
    return api.handle(method, path, Map.of(), body);
  }

  @SuppressWarnings("unchecked")
  List<Change> changes(Map<String, String> query) {
    final HttpResult result = api.handle("GET", "/changes", query, null);
    assertEquals(HttpResult.OK, result.status());
    return (List<Change>) ((Map<String, Object>) result.body()).get("results");
  }

  @Nested
  class Documents {
    @Test
    void when_the_same_document_is_put_twice_it_is_created_then_versioned() {
      assertEquals(HttpResult.CREATED, call("PUT", "/documents/0347", DOCUMENT).status());
      assertEquals(HttpResult.NO_CONTENT, call("PUT", "/documents/0347", DOCUMENT).status());

      assertEquals(2, changes(Map.of()).size());
      final var manifest = (DocumentManifest) call("GET", "/documents/0347/manifest", null).body();
      assertEquals(2, manifest.versions().size());
    }

    @Test
    void when_document_is_read_the_xml_bytes_are_returned() {
      call("PUT", "/documents/0347", DOCUMENT);

      final HttpResult result = call("GET", "/documents/0347", null);
      assertEquals(HttpResult.OK, result.status());
      assertArrayEquals("<article/>".getBytes(StandardCharsets.UTF_8), (byte[]) result.body());
    }

    @Test
    void when_document_is_read_before_its_first_version_not_found_is_returned() {
      call("PUT", "/documents/0347", DOCUMENT);

      final var result =
          api.handle("GET", "/documents/0347", Map.of("when", "1900-01-01"), null);
      assertEquals(HttpResult.NOT_FOUND, result.status());
    }

    @Test
    void when_xml_cannot_be_downloaded_bad_gateway_is_returned() {
      call("PUT", "/documents/0347", "{\"data\": \"https://kernel.example.org/gone.xml\"}");

      assertEquals(HttpResult.BAD_GATEWAY, call("GET", "/documents/0347", null).status());
    }

    @Test
    void when_document_is_deleted_it_reads_as_missing_and_the_feed_flags_it() {
      call("PUT", "/documents/0347", DOCUMENT);

      assertEquals(HttpResult.NO_CONTENT, call("DELETE", "/documents/0347", null).status());
      assertEquals(HttpResult.NOT_FOUND, call("GET", "/documents/0347", null).status());
      assertEquals(HttpResult.NO_CONTENT, call("DELETE", "/documents/0347", null).status());

      final List<Change> changes = changes(Map.of());
      assertEquals(2, changes.size());
      assertTrue(changes.get(1).deleted());
    }

    @Test
    void when_renditions_are_put_they_are_listed_and_duplicates_are_accepted() {
      call("PUT", "/documents/0347", DOCUMENT);
      final String rendition =
          "{\"filename\": \"0347.pdf\", \"data_url\": \"https://x.org/0347.pdf\","
              + " \"mimetype\": \"application/pdf\", \"lang\": \"pt\", \"size_bytes\": 23456}";

      assertEquals(
          HttpResult.NO_CONTENT, call("PUT", "/documents/0347/renditions", rendition).status());
      assertEquals(
          HttpResult.NO_CONTENT, call("PUT", "/documents/0347/renditions", rendition).status());

      @SuppressWarnings("unchecked")
      final var renditions =
          (List<Rendition>) call("GET", "/documents/0347/renditions", null).body();
      assertEquals(1, renditions.size());
      assertEquals("0347.pdf", renditions.get(0).filename());
    }

    @Test
    void when_document_body_is_malformed_bad_request_is_returned() {
      assertEquals(HttpResult.BAD_REQUEST, call("PUT", "/documents/0347", "{").status());
      assertEquals(HttpResult.BAD_REQUEST, call("PUT", "/documents/0347", "{}").status());
      assertEquals(
          HttpResult.BAD_REQUEST,
          call("PUT", "/documents/0347", "{\"data\": \"" + XML + "\", \"assets\": {}}").status());
      assertEquals(
          HttpResult.BAD_REQUEST,
          call("PUT", "/documents/0347/renditions", "{\"filename\": \"0347.pdf\"}").status());
    }
  }

  @Nested
  class Changes {
    @BeforeEach
    void setUp() {
      for (int i = 0; i < 10; i++) {
        call("PUT", "/documents/doc-" + i, DOCUMENT);
      }
    }

    @Test
    void when_reading_from_the_beginning_every_entry_is_returned() {
      assertEquals(10, changes(Map.of()).size());
    }

    @Test
    void when_reading_since_an_entry_only_the_later_ones_are_returned() {
      final String fifth = changes(Map.of()).get(4).timestamp();

      final List<Change> later = changes(Map.of("since", fifth));
      assertEquals(5, later.size());
      assertEquals("/documents/doc-5", later.get(0).id());
    }

    @Test
    void when_reading_since_an_unknown_timestamp_nothing_is_returned() {
      assertTrue(changes(Map.of("since", "xxx")).isEmpty());
    }

    @Test
    void when_limit_is_given_the_page_is_bounded() {
      assertEquals(3, changes(Map.of("limit", "3")).size());
    }

    @Test
    void when_limit_is_not_a_positive_integer_bad_request_is_returned() {
      assertEquals(
          HttpResult.BAD_REQUEST,
          api.handle("GET", "/changes", Map.of("limit", "ten"), null).status());
      assertEquals(
          HttpResult.BAD_REQUEST,
          api.handle("GET", "/changes", Map.of("limit", "0"), null).status());
    }

    @Test
    void when_limit_is_missing_the_configured_default_applies() {
      final var settings =
          Settings.parse(
              Map.of("documentstore.changes.default_limit", "4"), Settings.DEFAULTS, name -> null);
      final var limited =
          new RestfulApi(
              new DocumentStoreServices(Fixtures.inMemorySessionFactory(fetcher)), settings);
      for (int i = 0; i < 6; i++) {
        limited.handle("PUT", "/documents/doc-" + i, Map.of(), DOCUMENT);
      }

      @SuppressWarnings("unchecked")
      final var body = (Map<String, Object>) limited.handle("GET", "/changes", null, null).body();
      assertEquals(4, body.get("limit"));
      assertEquals(4, ((List<?>) body.get("results")).size());
    }
  }

  @Nested
  class Bundles {
    DocumentsBundleManifest bundle(String id) {
      return (DocumentsBundleManifest) call("GET", "/bundles/" + id, null).body();
    }

    @Test
    void when_bundle_is_put_twice_it_is_created_once() {
      final String metadata = "{\"publication_year\": \"2014\", \"volume\": \"48\"}";

      assertEquals(HttpResult.CREATED, call("PUT", "/bundles/rsp-v48-n2", metadata).status());
      assertEquals(HttpResult.NO_CONTENT, call("PUT", "/bundles/rsp-v48-n2", "{}").status());

      final var manifest = bundle("rsp-v48-n2");
      assertEquals("48", manifest.metadata().get("volume").asText());
    }

    @Test
    void when_documents_have_duplicates_unprocessable_entity_is_returned() {
      call("PUT", "/bundles/rsp-v48-n2", "{}");

      final var result =
          call(
              "PUT", "/bundles/rsp-v48-n2/documents", "[{\"id\": \"doc-1\"}, {\"id\": \"doc-1\"}]");
      assertEquals(HttpResult.UNPROCESSABLE_ENTITY, result.status());

      final var manifest = bundle("rsp-v48-n2");
      assertTrue(manifest.items().isEmpty());
    }

    @Test
    void when_documents_are_put_they_replace_the_previous_list() {
      call("PUT", "/bundles/rsp-v48-n2", "{}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("PUT", "/bundles/rsp-v48-n2/documents", "[{\"id\": \"doc-2\"}, {\"id\": \"doc-1\"}]")
              .status());

      final var manifest = bundle("rsp-v48-n2");
      assertEquals(List.of("doc-2", "doc-1"), manifest.items());
    }

    @Test
    void when_bundle_metadata_is_malformed_bad_request_is_returned() {
      assertEquals(
          HttpResult.BAD_REQUEST,
          call("PUT", "/bundles/rsp-v48-n2", "{\"titles\": [{\"language\": \"pt\"}]}").status());
      assertEquals(
          HttpResult.BAD_REQUEST,
          call(
                  "PUT",
                  "/bundles/rsp-v48-n2",
                  "{\"publication_months\": {\"month\": \"03\", \"range\": [3, 4]}}")
              .status());
      assertEquals(HttpResult.NOT_FOUND, call("GET", "/bundles/rsp-v48-n2", null).status());
    }

    @Test
    void when_bundle_is_patched_the_metadata_is_merged() {
      call("PUT", "/bundles/rsp-v48-n2", "{\"volume\": \"48\"}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("PATCH", "/bundles/rsp-v48-n2", "{\"number\": \"2\", \"volume\": null}").status());

      final var manifest = bundle("rsp-v48-n2");
      assertEquals("2", manifest.metadata().get("number").asText());
      assertFalse(manifest.metadata().containsKey("volume"));
    }
  }

  @Nested
  class Journals {
    @BeforeEach
    void setUp() {
      assertEquals(
          HttpResult.CREATED,
          call("PUT", "/journals/rsp", "{\"title\": \"Rev Saude Publica\"}").status());
    }

    JournalManifest journal() {
      return (JournalManifest) call("GET", "/journals/rsp", null).body();
    }

    @Test
    void when_issue_is_patched_with_an_index_it_is_inserted_there() {
      call("PATCH", "/journals/rsp/issues", "{\"issue\": \"issue-1\"}");
      call("PATCH", "/journals/rsp/issues", "{\"issue\": \"issue-2\"}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("PATCH", "/journals/rsp/issues", "{\"issue\": \"issue-0\", \"index\": 0}").status());
      assertEquals(List.of("issue-0", "issue-1", "issue-2"), journal().items());
    }

    @Test
    void when_issue_is_already_listed_the_patch_is_accepted_without_change() {
      call(
          "PATCH",
          "/journals/rsp/issues",
          "{\"issue\": {\"id\": \"issue-1\", \"year\": \"2014\"}}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("PATCH", "/journals/rsp/issues", "{\"issue\": \"issue-1\"}").status());
      assertEquals(List.of("issue-1"), journal().items());
    }

    @Test
    void when_issues_are_put_with_duplicates_unprocessable_entity_is_returned() {
      assertEquals(
          HttpResult.UNPROCESSABLE_ENTITY,
          call("PUT", "/journals/rsp/issues", "[{\"id\": \"issue-1\"}, {\"id\": \"issue-1\"}]")
              .status());
      assertTrue(journal().items().isEmpty());
    }

    @Test
    void when_issue_is_deleted_twice_the_second_time_is_not_found() {
      call("PATCH", "/journals/rsp/issues", "{\"issue\": \"issue-1\"}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("DELETE", "/journals/rsp/issues", "{\"issue\": \"issue-1\"}").status());
      assertEquals(
          HttpResult.NOT_FOUND,
          call("DELETE", "/journals/rsp/issues", "{\"issue\": \"issue-1\"}").status());
    }

    @Test
    void when_ahead_of_print_is_set_then_removed_a_second_removal_is_not_found() {
      assertEquals(
          HttpResult.NO_CONTENT,
          call("PATCH", "/journals/rsp/aop", "{\"aop\": \"rsp-aop\"}").status());
      assertEquals("rsp-aop", journal().aop());

      assertEquals(HttpResult.NO_CONTENT, call("DELETE", "/journals/rsp/aop", null).status());
      assertEquals(HttpResult.NOT_FOUND, call("DELETE", "/journals/rsp/aop", null).status());
    }

    @Test
    void when_ahead_of_print_is_set_again_to_the_same_bundle_no_content_is_returned() {
      call("PATCH", "/journals/rsp/aop", "{\"aop\": \"rsp-aop\"}");

      assertEquals(
          HttpResult.NO_CONTENT,
          call("PATCH", "/journals/rsp/aop", "{\"aop\": \"rsp-aop\"}").status());
      assertEquals("rsp-aop", journal().aop());
    }

    @Test
    void when_an_issue_is_set_as_ahead_of_print_conflict_is_returned() {
      call("PATCH", "/journals/rsp/issues", "{\"issue\": \"b\"}");

      assertEquals(
          HttpResult.CONFLICT, call("PATCH", "/journals/rsp/aop", "{\"aop\": \"b\"}").status());
      assertNull(journal().aop());
      assertEquals(List.of("b"), journal().items());
    }

    @Test
    void when_the_ahead_of_print_bundle_is_added_as_an_issue_conflict_is_returned() {
      call("PATCH", "/journals/rsp/aop", "{\"aop\": \"b\"}");

      assertEquals(
          HttpResult.CONFLICT,
          call("PATCH", "/journals/rsp/issues", "{\"issue\": \"b\"}").status());
      assertEquals(
          HttpResult.CONFLICT,
          call("PATCH", "/journals/rsp/issues", "{\"issue\": \"b\", \"index\": 0}").status());
      assertEquals(
          HttpResult.CONFLICT, call("PUT", "/journals/rsp/issues", "[{\"id\": \"b\"}]").status());
      assertTrue(journal().items().isEmpty());
      assertEquals("b", journal().aop());
    }

    @Test
    void when_journal_is_put_twice_it_is_created_once() {
      assertEquals(HttpResult.NO_CONTENT, call("PUT", "/journals/rsp", "{}").status());
      assertEquals("Rev Saude Publica", journal().metadata().get("title").asText());
    }
  }

  @Nested
  class Routing {
    @Test
    void when_route_is_unknown_not_found_is_returned() {
      assertEquals(HttpResult.NOT_FOUND, call("GET", "/articles/0347", null).status());
      assertEquals(HttpResult.NOT_FOUND, call("GET", "/", null).status());
      assertEquals(HttpResult.NOT_FOUND, call("GET", "/documents/0347/pages/1", null).status());
    }

    @Test
    void when_method_is_not_supported_method_not_allowed_is_returned() {
      assertEquals(HttpResult.METHOD_NOT_ALLOWED, call("POST", "/documents/0347", null).status());
      assertEquals(HttpResult.METHOD_NOT_ALLOWED, call("DELETE", "/changes", null).status());
      assertEquals(HttpResult.METHOD_NOT_ALLOWED, call("PUT", "/journals/rsp/aop", "{}").status());
    }

    @Test
    void when_services_are_missing_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new RestfulApi(null));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new RestfulApi(
                  new DocumentStoreServices(Fixtures.inMemorySessionFactory(fetcher)), 0));
    }
  }
}
