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

package io.github.suppierk.documentstore.restfulapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.suppierk.documentstore.changes.ChangeLog;
import io.github.suppierk.documentstore.config.Settings;
import io.github.suppierk.documentstore.exceptions.AlreadyExistsException;
import io.github.suppierk.documentstore.exceptions.DocumentStoreException;
import io.github.suppierk.documentstore.exceptions.ValidationException;
import io.github.suppierk.documentstore.persistence.JsonCodec;
import io.github.suppierk.documentstore.services.AddIssueToJournal;
import io.github.suppierk.documentstore.services.CreateDocumentsBundle;
import io.github.suppierk.documentstore.services.CreateJournal;
import io.github.suppierk.documentstore.services.DeleteDocument;
import io.github.suppierk.documentstore.services.DocumentStoreServices;
import io.github.suppierk.documentstore.services.FetchAssetsList;
import io.github.suppierk.documentstore.services.FetchChanges;
import io.github.suppierk.documentstore.services.FetchDocumentData;
import io.github.suppierk.documentstore.services.FetchDocumentManifest;
import io.github.suppierk.documentstore.services.FetchDocumentRenditions;
import io.github.suppierk.documentstore.services.FetchDocumentsBundle;
import io.github.suppierk.documentstore.services.FetchJournal;
import io.github.suppierk.documentstore.services.InsertIssueToJournal;
import io.github.suppierk.documentstore.services.RegisterDocument;
import io.github.suppierk.documentstore.services.RegisterDocumentVersion;
import io.github.suppierk.documentstore.services.RegisterRenditionVersion;
import io.github.suppierk.documentstore.services.RemoveAheadOfPrintBundleFromJournal;
import io.github.suppierk.documentstore.services.RemoveIssueFromJournal;
import io.github.suppierk.documentstore.services.SetAheadOfPrintBundleToJournal;
import io.github.suppierk.documentstore.services.UpdateDocumentsBundleMetadata;
import io.github.suppierk.documentstore.services.UpdateDocumentsInDocumentsBundle;
import io.github.suppierk.documentstore.services.UpdateIssuesInJournal;
import io.github.suppierk.documentstore.services.UpdateJournalMetadata;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP surface of the store, independent of any server.
 *
 * <p>Each route method turns its path parameters and body into one command or query, runs it
 * through {@link DocumentStoreServices} and maps the outcome onto a status code. This is the only
 * place where failures become status codes: {@link DocumentStoreException}s carry their own, a few
 * routes reinterpret {@link AlreadyExistsException}, malformed input is 400 and a payload which
 * could not be downloaded is 502.
 *
 * <p>{@link #handle(String, String, Map, String)} dispatches a raw request onto the route methods
 * for transports which do not do the routing themselves.
 */
public final class RestfulApi {
  private static final Logger log = LoggerFactory.getLogger(RestfulApi.class);

  private final DocumentStoreServices services;
  private final int changesDefaultLimit;

  /**
   * @param services to run commands and queries with
   * @param changesDefaultLimit page size of {@code GET /changes} when the request has none
   */
  public RestfulApi(final DocumentStoreServices services, final int changesDefaultLimit) {
    if (services == null) {
      throw new IllegalArgumentException("Services cannot be null");
    }

    if (changesDefaultLimit < 1) {
      throw new IllegalArgumentException(
          "Default changes limit must be positive, got %d".formatted(changesDefaultLimit));
    }

    this.services = services;
    this.changesDefaultLimit = changesDefaultLimit;
  }

  public RestfulApi(final DocumentStoreServices services) {
    this(services, ChangeLog.DEFAULT_LIMIT);
  }

  /**
   * @param services to run commands and queries with
   * @param settings providing {@link Settings#CHANGES_DEFAULT_LIMIT}
   */
  public RestfulApi(final DocumentStoreServices services, final Settings settings) {
    this(services, settings.get(Settings.CHANGES_DEFAULT_LIMIT).orElse(ChangeLog.DEFAULT_LIMIT));
  }

  /**
   * Routes a raw request.
   *
   * @param method HTTP method, case insensitive
   * @param path request path, e.g. {@code /documents/0034-8910-rsp-48-2-0347/renditions}
   * @param query query string parameters, may be null
   * @param body request body as JSON text, may be null or empty
   * @return outcome of the matching route, 404 if none matches
   */
  public HttpResult handle(
      final String method, final String path, final Map<String, String> query, final String body) {
    final Map<String, String> params = query == null ? Map.of() : query;
    final String verb = method == null ? "" : method.toUpperCase();
    final String[] segments =
        path == null ? new String[0] : path.replaceAll("^/+|/+$", "").split("/");

    final JsonNode json;
    try {
      json = body == null || body.isBlank() ? MissingNode.getInstance() : JsonCodec.readTree(body);
    } catch (IOException e) {
      log.debug("Unreadable body for {} {}", verb, path, e);
      return HttpResult.error(HttpResult.BAD_REQUEST, "Body is not valid JSON");
    }

    if (segments.length == 1 && "changes".equals(segments[0])) {
      return "GET".equals(verb)
          ? fetchChanges(params.get("since"), params.get("limit"))
          : methodNotAllowed(verb, path);
    }

    if (segments.length < 2 || segments.length > 3) {
      return HttpResult.error(HttpResult.NOT_FOUND, "No route for '%s'".formatted(path));
    }

    final String collection = segments[0];
    final String id = segments[1];
    final String resource = segments.length == 3 ? segments[2] : "";

    final String route = collection + "/" + resource;
    switch (route) {
      case "documents/":
        switch (verb) {
          case "PUT":
            return putDocument(id, json);
          case "GET":
            return getDocument(id, params.get("when"));
          case "DELETE":
            return deleteDocument(id);
          default:
            return methodNotAllowed(verb, path);
        }
      case "documents/manifest":
        return "GET".equals(verb) ? getDocumentManifest(id) : methodNotAllowed(verb, path);
      case "documents/assets":
        return "GET".equals(verb) ? getAssetsList(id) : methodNotAllowed(verb, path);
      case "documents/renditions":
        switch (verb) {
          case "GET":
            return getDocumentRenditions(id, params.get("when"));
          case "PUT":
            return putRendition(id, json);
          default:
            return methodNotAllowed(verb, path);
        }
      case "bundles/":
        switch (verb) {
          case "PUT":
            return putDocumentsBundle(id, json);
          case "GET":
            return getDocumentsBundle(id);
          case "PATCH":
            return patchDocumentsBundle(id, json);
          default:
            return methodNotAllowed(verb, path);
        }
      case "bundles/documents":
        return "PUT".equals(verb)
            ? putDocumentsBundleDocuments(id, json)
            : methodNotAllowed(verb, path);
      case "journals/":
        switch (verb) {
          case "PUT":
            return putJournal(id, json);
          case "GET":
            return getJournal(id);
          case "PATCH":
            return patchJournal(id, json);
          default:
            return methodNotAllowed(verb, path);
        }
      case "journals/issues":
        switch (verb) {
          case "PATCH":
            return patchJournalIssues(id, json);
          case "PUT":
            return putJournalIssues(id, json);
          case "DELETE":
            return deleteJournalIssues(id, json);
          default:
            return methodNotAllowed(verb, path);
        }
      case "journals/aop":
        switch (verb) {
          case "PATCH":
            return patchJournalAheadOfPrint(id, json);
          case "DELETE":
            return deleteJournalAheadOfPrint(id);
          default:
            return methodNotAllowed(verb, path);
        }
      default:
        return HttpResult.error(HttpResult.NOT_FOUND, "No route for '%s'".formatted(path));
    }
  }

  /** {@code PUT /documents/{id}}: 201 when registered, 204 when a new version was added. */
  public HttpResult putDocument(final String id, final JsonNode body) {
    return respond(
        () -> {
          final var registration = RequestBodies.documentRegistration(body);
          try {
            services.createModel(
                new RegisterDocument(id, registration.data(), registration.assets()));
            return HttpResult.created();
          } catch (AlreadyExistsException e) {
            services.updateModel(
                new RegisterDocumentVersion(id, registration.data(), registration.assets()));
            return HttpResult.noContent();
          }
        });
  }

  /** {@code GET /documents/{id}?when=}: XML of the latest version, or of the one current then. */
  public HttpResult getDocument(final String id, final String when) {
    return respond(
        () ->
            HttpResult.ok(
                services.queryOneModel(new FetchDocumentData(id, -1, blankToNull(when)))));
  }

  public HttpResult getDocumentManifest(final String id) {
    return respond(() -> HttpResult.ok(services.queryOneModel(new FetchDocumentManifest(id))));
  }

  public HttpResult getAssetsList(final String id) {
    return respond(() -> HttpResult.ok(services.queryOneModel(new FetchAssetsList(id))));
  }

  public HttpResult getDocumentRenditions(final String id, final String when) {
    return respond(
        () ->
            HttpResult.ok(
                services.queryManyModels(
                    new FetchDocumentRenditions(id, -1, blankToNull(when)))));
  }

  /** {@code PUT /documents/{id}/renditions}: 204, including when the rendition is already known. */
  public HttpResult putRendition(final String id, final JsonNode body) {
    return respond(
        () -> {
          final var rendition = RequestBodies.renditionRegistration(body);
          services.updateModel(
              new RegisterRenditionVersion(
                  id,
                  rendition.filename(),
                  rendition.dataUrl(),
                  rendition.mimetype(),
                  rendition.lang(),
                  rendition.sizeBytes()));
          return HttpResult.noContent();
        });
  }

  /** {@code DELETE /documents/{id}}: 204, including when the document is already deleted. */
  public HttpResult deleteDocument(final String id) {
    return respond(
        () -> {
          services.deleteModel(new DeleteDocument(id));
          return HttpResult.noContent();
        });
  }

  /** {@code PUT /bundles/{id}}: 201 when created, 204 when the bundle already exists. */
  public HttpResult putDocumentsBundle(final String id, final JsonNode body) {
    return respond(
        () -> {
          final Map<String, JsonNode> metadata = RequestBodies.bundleMetadata(body);
          try {
            services.createModel(new CreateDocumentsBundle(id, List.of(), metadata));
            return HttpResult.created();
          } catch (AlreadyExistsException e) {
            log.debug("Bundle '{}' already exists, nothing to create", id);
            return HttpResult.noContent();
          }
        });
  }

  public HttpResult getDocumentsBundle(final String id) {
    return respond(() -> HttpResult.ok(services.queryOneModel(new FetchDocumentsBundle(id))));
  }

  public HttpResult patchDocumentsBundle(final String id, final JsonNode body) {
    return respond(
        () -> {
          services.updateModel(
              new UpdateDocumentsBundleMetadata(id, RequestBodies.bundleMetadata(body)));
          return HttpResult.noContent();
        });
  }

  /** {@code PUT /bundles/{id}/documents}: 422 when the list has duplicates. */
  public HttpResult putDocumentsBundleDocuments(final String id, final JsonNode body) {
    return respond(
        () -> {
          final List<String> docs = RequestBodies.idList(body);
          try {
            services.updateModel(new UpdateDocumentsInDocumentsBundle(id, docs));
            return HttpResult.noContent();
          } catch (AlreadyExistsException e) {
            return HttpResult.error(HttpResult.UNPROCESSABLE_ENTITY, e.getMessage());
          }
        });
  }

  /** {@code PUT /journals/{id}}: 201 when created, 204 when the journal already exists. */
  public HttpResult putJournal(final String id, final JsonNode body) {
    return respond(
        () -> {
          final Map<String, JsonNode> metadata = RequestBodies.metadata(body);
          try {
            services.createModel(new CreateJournal(id, metadata));
            return HttpResult.created();
          } catch (AlreadyExistsException e) {
            log.debug("Journal '{}' already exists, nothing to create", id);
            return HttpResult.noContent();
          }
        });
  }

  public HttpResult getJournal(final String id) {
    return respond(() -> HttpResult.ok(services.queryOneModel(new FetchJournal(id))));
  }

  public HttpResult patchJournal(final String id, final JsonNode body) {
    return respond(
        () -> {
          services.updateModel(new UpdateJournalMetadata(id, RequestBodies.metadata(body)));
          return HttpResult.noContent();
        });
  }

  /**
   * {@code PATCH /journals/{id}/issues}: appends the issue, or inserts it when the body has an
   * {@code index}. An issue already listed is 204, the ahead-of-print bundle is 409.
   */
  public HttpResult patchJournalIssues(final String id, final JsonNode body) {
    return respond(
        () -> {
          final var placement = RequestBodies.issuePlacement(body);
          try {
            if (placement.index().isPresent()) {
              services.updateModel(
                  new InsertIssueToJournal(id, placement.index().getAsInt(), placement.issue()));
            } else {
              services.updateModel(new AddIssueToJournal(id, placement.issue()));
            }
          } catch (AlreadyExistsException e) {
            log.debug("Issue '{}' is already in journal '{}'", placement.issue(), id);
          }

          return HttpResult.noContent();
        });
  }

  /**
   * {@code PUT /journals/{id}/issues}: 422 when the list has duplicates, 409 when it holds the
   * ahead-of-print bundle.
   */
  public HttpResult putJournalIssues(final String id, final JsonNode body) {
    return respond(
        () -> {
          final List<String> issues = RequestBodies.idList(body);
          try {
            services.updateModel(new UpdateIssuesInJournal(id, issues));
            return HttpResult.noContent();
          } catch (AlreadyExistsException e) {
            return HttpResult.error(HttpResult.UNPROCESSABLE_ENTITY, e.getMessage());
          }
        });
  }

  public HttpResult deleteJournalIssues(final String id, final JsonNode body) {
    return respond(
        () -> {
          services.updateModel(new RemoveIssueFromJournal(id, RequestBodies.issueRemoval(body)));
          return HttpResult.noContent();
        });
  }

  /**
   * {@code PATCH /journals/{id}/aop}: 204, including when the bundle is already set, and 409 when
   * the bundle is one of the issues.
   */
  public HttpResult patchJournalAheadOfPrint(final String id, final JsonNode body) {
    return respond(
        () -> {
          final String aop = RequestBodies.aheadOfPrint(body);
          try {
            services.updateModel(new SetAheadOfPrintBundleToJournal(id, aop));
          } catch (AlreadyExistsException e) {
            log.debug("Bundle '{}' is already the ahead-of-print of '{}'", aop, id);
          }

          return HttpResult.noContent();
        });
  }

  /** {@code DELETE /journals/{id}/aop}: 404 when the journal has no ahead-of-print bundle. */
  public HttpResult deleteJournalAheadOfPrint(final String id) {
    return respond(
        () -> {
          services.updateModel(new RemoveAheadOfPrintBundleFromJournal(id));
          return HttpResult.noContent();
        });
  }

  /**
   * {@code GET /changes?since=&limit=}
   *
   * @return {@code {since, limit, results}} where {@code results} are the entries strictly after
   *     {@code since}
   */
  public HttpResult fetchChanges(final String since, final String limit) {
    return respond(
        () -> {
          final String nonNullSince = since == null ? "" : since;
          final int nonNullLimit = parseLimit(limit);

          final var body = new LinkedHashMap<String, Object>();
          body.put("since", nonNullSince);
          body.put("limit", nonNullLimit);
          body.put(
              "results",
              services.queryManyModels(new FetchChanges(nonNullSince, nonNullLimit)));
          return HttpResult.ok(body);
        });
  }

  private int parseLimit(final String limit) {
    if (limit == null || limit.isBlank()) {
      return changesDefaultLimit;
    }

    try {
      return Integer.parseInt(limit.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("Limit must be an integer, got '%s'".formatted(limit), e);
    }
  }

  private static HttpResult respond(final Supplier<HttpResult> route) {
    try {
      return route.get();
    } catch (DocumentStoreException e) {
      log.debug("Request failed with {}: {}", e.getStatusCode(), e.getMessage());
      return e.getStatusCode() == HttpResult.NO_CONTENT
          ? HttpResult.noContent()
          : HttpResult.error(e.getStatusCode(), e.getMessage());
    } catch (IllegalArgumentException e) {
      log.debug("Request rejected: {}", e.getMessage());
      return HttpResult.error(HttpResult.BAD_REQUEST, e.getMessage());
    } catch (UncheckedIOException e) {
      log.warn("Could not fetch a payload", e);
      return HttpResult.error(HttpResult.BAD_GATEWAY, e.getMessage());
    }
  }

  private static HttpResult methodNotAllowed(final String verb, final String path) {
    return HttpResult.error(
        HttpResult.METHOD_NOT_ALLOWED, "%s is not allowed on '%s'".formatted(verb, path));
  }

  private static String blankToNull(final String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
