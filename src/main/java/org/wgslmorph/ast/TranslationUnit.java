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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A complete shader module: its directives followed by its module-scope declarations. */
public record TranslationUnit(
    ImmutableList<Directive> directives, ImmutableList<GlobalDecl> globalDecls)
    implements AstNode {

  public TranslationUnit(List<? extends GlobalDecl> globalDecls) {
    this(ImmutableList.of(), ImmutableList.copyOf(globalDecls));
  }

  /** Returns the function declarations of this module, in declaration order. */
  public ImmutableList<GlobalDecl.Function> functions() {
    return globalDecls.stream()
        .filter(GlobalDecl.Function.class::isInstance)
        .map(GlobalDecl.Function.class::cast)
        .collect(ImmutableList.toImmutableList());
  }
}
