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
 * Tags attached to {@link Expression.Paren}, {@link Expression.Binary} and {@link
 * Statement.Compound} nodes by transformations. They do not affect semantics; they record enough
 * for a reducer to undo the transformation mechanically. Ids are minted by {@code
 * FuzzerSettings.getUniqueId()}, so all the tags created by one rewrite share an id.
 */
public sealed interface Metadata {

  /** The parenthesis was introduced by the rewrite with this id. */
  record AdditionalParen(int id) implements Metadata {}

  /** Replacing the binary expression by its left operand undoes rewrite {@code id}. */
  record ReverseToLhsBinaryOperator(String commentary, int id) implements Metadata {}

  /** Replacing the binary expression by its right operand undoes rewrite {@code id}. */
  record ReverseToRhsBinaryOperator(String commentary, int id) implements Metadata {}

  /**
   * Marks the compound holding the original statements of the {@link
   * AugmentedStatement.ControlFlowWrapper} with the same id.
   */
  record ControlFlowWrapperBody(int id) implements Metadata {}

  /** Marks generated or donor filler code that can be deleted wholesale. */
  record ArbitraryCompound() implements Metadata {}

  ArbitraryCompound ARBITRARY_COMPOUND = new ArbitraryCompound();
}
