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

package io.github.suppierk.documentstore.services;

import io.github.suppierk.documentstore.config.Settings;
import io.github.suppierk.documentstore.cqrs.BoundedContext;
import io.github.suppierk.documentstore.session.SessionFactory;

/**
 * The document store as one {@link BoundedContext}: documents, their bundles, the journals those
 * bundles are issues of, and the change feed.
 */
public final class DocumentStoreServices extends BoundedContext {
  public DocumentStoreServices(final SessionFactory sessionFactory, final int maxAttempts) {
    super(sessionFactory, maxAttempts);

    addDomainCommandHandler(new RegisterDocument.Handler());
    addDomainCommandHandler(new RegisterDocumentVersion.Handler());
    addDomainCommandHandler(new RegisterAssetVersion.Handler());
    addDomainCommandHandler(new RegisterRenditionVersion.Handler());
    addDomainCommandHandler(new DeleteDocument.Handler());
    addDomainQueryHandler(new FetchDocumentData.Handler());
    addDomainQueryHandler(new FetchDocumentManifest.Handler());
    addDomainQueryHandler(new FetchAssetsList.Handler());
    addDomainQueryHandler(new FetchDocumentRenditions.Handler());
    addDomainQueryHandler(new DiffDocumentVersions.Handler());

    addDomainCommandHandler(new CreateDocumentsBundle.Handler());
    addDomainCommandHandler(new UpdateDocumentsBundleMetadata.Handler());
    addDomainCommandHandler(new AddDocumentToDocumentsBundle.Handler());
    addDomainCommandHandler(new InsertDocumentToDocumentsBundle.Handler());
    addDomainCommandHandler(new RemoveDocumentFromDocumentsBundle.Handler());
    addDomainCommandHandler(new UpdateDocumentsInDocumentsBundle.Handler());
    addDomainQueryHandler(new FetchDocumentsBundle.Handler());

    addDomainCommandHandler(new CreateJournal.Handler());
    addDomainCommandHandler(new UpdateJournalMetadata.Handler());
    addDomainCommandHandler(new AddIssueToJournal.Handler());
    addDomainCommandHandler(new InsertIssueToJournal.Handler());
    addDomainCommandHandler(new RemoveIssueFromJournal.Handler());
    addDomainCommandHandler(new UpdateIssuesInJournal.Handler());
    addDomainCommandHandler(new SetAheadOfPrintBundleToJournal.Handler());
    addDomainCommandHandler(new RemoveAheadOfPrintBundleFromJournal.Handler());
    addDomainQueryHandler(new FetchJournal.Handler());

    addDomainQueryHandler(new FetchChanges.Handler());
  }

  public DocumentStoreServices(final SessionFactory sessionFactory) {
    this(sessionFactory, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * @param sessionFactory to create a session per invocation with
   * @param settings providing {@link Settings#RETRIES}
   */
  public DocumentStoreServices(final SessionFactory sessionFactory, final Settings settings) {
    this(sessionFactory, settings.get(Settings.RETRIES).orElse(DEFAULT_MAX_ATTEMPTS));
  }
}
