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

package org.wgslmorph.resolve;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AstNode;

/** The names visible at a program point. */
public interface Scope {

  /** Returns the innermost declaration of {@code name}, or null if none is visible. */
  @Nullable ScopeEntry getEntry(String name);

  /**
   * Returns every visible declaration, innermost first. Shadowed declarations are not included.
   */
  ImmutableList<ScopeEntry> getAllEntries();

  /**
   * Returns a view of this scope without the entries declared by {@code hidden}, which is
   * compared by identity. A hidden entry that shadows another declaration hides that one too.
   */
  default Scope without(Set<AstNode> hidden) {
    if (hidden.isEmpty()) {
      return this;
    }
    Scope base = this;
    return new Scope() {
      @Override
      public @Nullable ScopeEntry getEntry(String name) {
        ScopeEntry entry = base.getEntry(name);
        return entry == null || hidden.contains(entry.astNode()) ? null : entry;
      }

      @Override
      public ImmutableList<ScopeEntry> getAllEntries() {
        return base.getAllEntries().stream()
            .filter(entry -> !hidden.contains(entry.astNode()))
            .collect(ImmutableList.toImmutableList());
      }
    };
  }
}
