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

/**
 * Synthetic expressions created by transformations. Each one prints as its underlying expression
 * in parentheses, so that generated operands never need to be parenthesized by their creator; the
 * wrapper records what the transformation guarantees about the expression, so that later passes
 * (and a reducer) can rely on or undo it.
 */
public sealed interface AugmentedExpression extends Expression {

  /**
   * An expression that evaluates to {@code knownValue} on every execution, without observable side
   * effects. {@code knownValue} is a literal ({@link Expression.BoolLiteral}, {@link
   * Expression.IntLiteral} or {@link Expression.FloatLiteral}) of the same type as {@code
   * expression}.
   *
   * <p>A boolean known value is a "true by construction" or "false by construction" expression
   * (an opaque predicate).
   */
  record KnownValue(Expression knownValue, Expression expression) implements AugmentedExpression {

    public boolean isTrueByConstruction() {
      return knownValue instanceof Expression.BoolLiteral b && b.value();
    }

    public boolean isFalseByConstruction() {
      return knownValue instanceof Expression.BoolLiteral b && !b.value();
    }
  }

  /** An expression whose value is deliberately unconstrained; it only needs to type-check. */
  record ArbitraryExpression(Expression expression) implements AugmentedExpression {}

  static boolean isTrueByConstruction(Expression expression) {
    return expression instanceof KnownValue kv && kv.isTrueByConstruction();
  }

  static boolean isFalseByConstruction(Expression expression) {
    return expression instanceof KnownValue kv && kv.isFalseByConstruction();
  }
}
