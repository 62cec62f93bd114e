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

package io.github.suppierk.documentstore.async;

/** Kinds of events dispatched to subscribers after a command succeeded. */
public enum Event {
  DOCUMENT_REGISTERED,
  DOCUMENT_VERSION_REGISTERED,
  ASSET_VERSION_REGISTERED,
  DOCUMENT_RENDITION_REGISTERED,
  DOCUMENT_DELETED,
  DOCUMENTSBUNDLE_CREATED,
  DOCUMENTSBUNDLE_METADATA_UPDATED,
  DOCUMENT_ADDED_TO_DOCUMENTSBUNDLE,
  DOCUMENT_INSERTED_TO_DOCUMENTSBUNDLE,
  DOCUMENT_REMOVED_FROM_DOCUMENTSBUNDLE,
  DOCUMENTS_UPDATED_IN_DOCUMENTSBUNDLE,
  JOURNAL_CREATED,
  JOURNAL_METADATA_UPDATED,
  ISSUE_ADDED_TO_JOURNAL,
  ISSUE_INSERTED_TO_JOURNAL,
  ISSUE_REMOVED_FROM_JOURNAL,
  ISSUES_UPDATED_IN_JOURNAL,
  AHEAD_OF_PRINT_BUNDLE_SET,
  AHEAD_OF_PRINT_BUNDLE_REMOVED
}
