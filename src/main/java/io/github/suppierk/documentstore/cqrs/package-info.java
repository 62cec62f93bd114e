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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are the editorial office of a scientific journal:
 *
 * <ul>
 *   <li>Each article we publish is a {@link io.github.suppierk.documentstore.domain.Document}, an
 *       {@link io.github.suppierk.documentstore.domain.Aggregate} whose history is never rewritten:
 *       <ul>
 *         <li>We can submit a corrected XML of the article via a {@link
 *             io.github.suppierk.documentstore.cqrs.DomainCommand}:
 *             <ul>
 *               <li>The {@link io.github.suppierk.documentstore.cqrs.DomainCommand} {@code
 *                   Register Document Version} appends a version to the article, the previous
 *                   versions stay readable.
 *             </ul>
 *         <li>We can look at the article as it was on any given day via a {@link
 *             io.github.suppierk.documentstore.cqrs.DomainQuery}:
 *             <ul>
 *               <li>The {@link io.github.suppierk.documentstore.cqrs.DomainQuery} {@code Fetch
 *                   Document Data} with a point in time picks the version current at that moment.
 *             </ul>
 *         <li>Articles are grouped into issues, which are {@link
 *             io.github.suppierk.documentstore.domain.DocumentsBundle}s, and issues are listed by
 *             a {@link io.github.suppierk.documentstore.domain.Journal}.
 *         <li>The indexing service downstream learns about changes via {@link
 *             io.github.suppierk.documentstore.async.DomainNotification}s delivered right after
 *             the write, or later by paging through the {@link
 *             io.github.suppierk.documentstore.changes.ChangeLog}.
 *       </ul>
 *   <li>Articles, issues and journals, combined with actions we can do, form a {@link
 *       io.github.suppierk.documentstore.cqrs.BoundedContext} describing possible interactions.
 * </ul>
 */
package io.github.suppierk.documentstore.cqrs;
