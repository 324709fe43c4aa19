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

import static com.google.common.base.Preconditions.checkArgument;

import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.LhsExpression;
import org.wgslmorph.ast.Statement;

/**
 * The resolver's answers about one translation unit. Queries are keyed by node identity, so they
 * are only meaningful for nodes of the translation unit that was resolved; nodes created by a
 * transformation are unknown until the result is resolved again.
 *
 * <p>Queries about unknown nodes throw {@link IllegalStateException}.
 */
public interface ResolvedEnvironment {

  Scope globalScope();

  Type typeOf(Expression expression);

  Type typeOf(LhsExpression lhsExpression);

  /** Returns the scope in which {@code statement} is resolved. */
  Scope scopeAvailableBefore(Statement statement);

  /** Returns the scope after the last statement of {@code compound}. */
  Scope scopeAvailableAtEnd(Statement.Compound compound);

  /**
   * Returns the scope before the statement at {@code index} of {@code compound}, or the scope at
   * the end of the compound when {@code index} is its size.
   */
  default Scope scopeAtIndex(Statement.Compound compound, int index) {
    checkArgument(
        index >= 0 && index <= compound.size(),
        "Index %s out of range 0..%s",
        index,
        compound.size());
    return index == compound.size()
        ? scopeAvailableAtEnd(compound)
        : scopeAvailableBefore(compound.statements().get(index));
  }
}
