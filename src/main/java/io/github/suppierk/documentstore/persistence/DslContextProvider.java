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

package io.github.suppierk.documentstore.persistence;

import java.util.function.Supplier;
import org.jooq.DSLContext;

/**
 * Allows for flexibility to define {@link DSLContext}s to be used.
 *
 * <p>Extends {@link Supplier} to give the ability to decide which {@link DSLContext} to use on
 * every storage round trip, where some of the usage examples might be to hand out a context bound
 * to a pooled connection or to route reads to a replica.
 */
@FunctionalInterface
public interface DslContextProvider extends Supplier<DSLContext> {

  /**
   * Always hands out the same context.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which simply returns provided {@link
   *     DSLContext}
   */
  static DslContextProvider dslContextIdentity(DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return new DslContextProvider() {
      private final DSLContext context = dslContext;

      @Override
      public DSLContext get() {
        return context;
      }
    };
  }
}
