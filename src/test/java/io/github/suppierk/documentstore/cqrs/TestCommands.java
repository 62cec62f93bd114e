package io.github.suppierk.documentstore.cqrs;

import io.github.suppierk.documentstore.async.Event;
import io.github.suppierk.documentstore.domain.Document;
import io.github.suppierk.documentstore.domain.DocumentManifest;
import io.github.suppierk.documentstore.domain.VersionClock;
import io.github.suppierk.documentstore.persistence.AggregateRepository;
import io.github.suppierk.documentstore.session.Session;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Minimal commands and queries over {@link Document}s to drive the handler machinery with. */
final class TestCommands {
  private TestCommands() {
    // Static utility
  }

  record Register(UUID messageId, Instant createdAt, String id, String dataUrl)
      implements DomainCommand.Create<Document> {
    Register(String id, String dataUrl) {
      this(UUID.randomUUID(), Instant.now(), id, dataUrl);
    }
  }

  record Revise(UUID messageId, Instant createdAt, String id, String dataUrl)
      implements DomainCommand.Update<Document> {
    Revise(String id, String dataUrl) {
      this(UUID.randomUUID(), Instant.now(), id, dataUrl);
    }
  }

  record Remove(UUID messageId, Instant createdAt, String id)
      implements DomainCommand.Delete<Document> {
    Remove(String id) {
      this(UUID.randomUUID(), Instant.now(), id);
    }
  }

  record Manifest(UUID messageId, Instant createdAt, String id)
      implements DomainQuery.One<DocumentManifest> {
    Manifest(String id) {
      this(UUID.randomUUID(), Instant.now(), id);
    }
  }

  record Paths(UUID messageId, Instant createdAt) implements DomainQuery.Many<String> {
    Paths() {
      this(UUID.randomUUID(), Instant.now());
    }
  }

  static class RegisterHandler extends DomainCommandHandler.Create<Register, Document> {
    RegisterHandler() {
      super(Register.class);
    }

    @Override
    protected Document newAggregate(Register command, VersionClock clock) {
      return new Document(command.id(), clock);
    }

    @Override
    protected void mutate(Register command, Document document) throws Exception {
      document.newVersion(command.dataUrl(), List.of());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_REGISTERED;
    }

    @Override
    protected String aggregateName() {
      return "document";
    }

    @Override
    protected Map<String, Object> arguments(Register command) {
      return Map.of("id", command.id(), "data_url", command.dataUrl());
    }
  }

  static class ReviseHandler extends DomainCommandHandler.Update<Revise, Document> {
    ReviseHandler() {
      super(Revise.class);
    }

    @Override
    protected void mutate(Revise command, Document document) {
      document.newVersion(command.dataUrl(), List.of());
    }

    @Override
    protected AggregateRepository<Document, ?> repository(Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_VERSION_REGISTERED;
    }
  }

  static class RemoveHandler extends DomainCommandHandler.Delete<Remove, Document> {
    RemoveHandler() {
      super(Remove.class);
    }

    @Override
    protected void mutate(Remove command, Document document) {
      document.delete();
    }

    @Override
    protected AggregateRepository<Document, ?> repository(Session session) {
      return session.documents();
    }

    @Override
    protected Event event() {
      return Event.DOCUMENT_DELETED;
    }
  }

  static class ManifestHandler extends DomainQueryHandler.One<Manifest, DocumentManifest> {
    ManifestHandler() {
      super(Manifest.class);
    }

    @Override
    protected DocumentManifest run(Manifest query, Session session) {
      return session.documents().fetch(query.id()).manifest();
    }
  }

  static class PathsHandler extends DomainQueryHandler.Many<Paths, String> {
    PathsHandler() {
      super(Paths.class);
    }

    @Override
    protected List<String> run(Paths query, Session session) {
      return session.changes().filter().stream().map(change -> change.id()).toList();
    }
  }
}
