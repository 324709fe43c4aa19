/*
 * Copyright 2025 The WgslMorph Authors
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

package org.wgslmorph.ast;

/** Synthetic statements created by transformations. */
public sealed interface AugmentedStatement extends Statement {

  /**
   * A statement that can never have an observable effect because it is guarded by an opaque
   * predicate. Fragments are created in one of a few shapes (see {@code DeadCodeFragments}), but
   * the shape is not enforced here: later transformations may rewrite the guarded code, or the
   * guard itself, while keeping it dead.
   */
  record DeadCodeFragment(Statement statement) implements AugmentedStatement {}

  /**
   * A construct that executes {@code statement}'s original run of statements exactly once. The
   * compound holding the run is tagged with {@link Metadata.ControlFlowWrapperBody} carrying the
   * same {@code id}.
   */
  record ControlFlowWrapper(Statement statement, int id) implements AugmentedStatement {}

  /**
   * A return appended after the {@link ControlFlowWrapper} with the same {@code id}, when the
   * wrapped run always returned. It is never executed.
   */
  record ControlFlowWrapReturn(Statement.Return returnStatement, int id)
      implements AugmentedStatement {}
}
