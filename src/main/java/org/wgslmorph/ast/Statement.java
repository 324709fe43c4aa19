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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Statements. Three marker interfaces narrow the statements allowed in particular positions:
 * {@link ElseBranch} (an {@code else} is followed by a compound or another {@code if}), {@link
 * ForInit} and {@link ForUpdate}.
 *
 * <p>{@link AugmentedStatement} adds the synthetic statements created by transformations.
 */
public sealed interface Statement extends AstNode
    permits Statement.ElseBranch,
        Statement.ForInit,
        Statement.ForUpdate,
        Statement.Empty,
        Statement.Break,
        Statement.Continue,
        Statement.Discard,
        Statement.Return,
        Statement.ConstAssert,
        Statement.Switch,
        Statement.Loop,
        Statement.For,
        Statement.While,
        AugmentedStatement {

  sealed interface ElseBranch extends Statement permits If, Compound {}

  sealed interface ForInit extends Statement
      permits Variable, Value, Assignment, Increment, Decrement, FunctionCall {}

  sealed interface ForUpdate extends Statement
      permits Assignment, Increment, Decrement, FunctionCall {}

  record Empty() implements Statement {}

  record Break() implements Statement {}

  record Continue() implements Statement {}

  record Discard() implements Statement {}

  record Return(@Nullable Expression expression) implements Statement {}

  /** An assignment; a null left-hand side denotes the phony assignment {@code _ = rhs}. */
  record Assignment(
      @Nullable LhsExpression lhsExpression,
      AssignmentOperator assignmentOperator,
      Expression rhs)
      implements ForInit, ForUpdate {}

  record Increment(LhsExpression target) implements ForInit, ForUpdate {}

  record Decrement(LhsExpression target) implements ForInit, ForUpdate {}

  record ConstAssert(Expression expression) implements Statement {}

  record Compound(ImmutableList<Statement> statements, ImmutableSet<Metadata> metadata)
      implements ElseBranch {

    public Compound(List<? extends Statement> statements) {
      this(ImmutableList.copyOf(statements), ImmutableSet.of());
    }

    public static Compound of(Statement... statements) {
      return new Compound(ImmutableList.copyOf(statements), ImmutableSet.of());
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }

    public int size() {
      return statements.size();
    }
  }

  record If(
      ImmutableList<Attribute> attributes,
      Expression condition,
      Compound thenBranch,
      @Nullable ElseBranch elseBranch)
      implements ElseBranch {

    public If(Expression condition, Compound thenBranch, @Nullable ElseBranch elseBranch) {
      this(ImmutableList.of(), condition, thenBranch, elseBranch);
    }
  }

  record Switch(
      ImmutableList<Attribute> attributesAtStart,
      Expression expression,
      ImmutableList<Attribute> attributesBeforeBody,
      ImmutableList<SwitchClause> clauses)
      implements Statement {

    public Switch(Expression expression, List<SwitchClause> clauses) {
      this(ImmutableList.of(), expression, ImmutableList.of(), ImmutableList.copyOf(clauses));
    }
  }

  record Loop(
      ImmutableList<Attribute> attributesAtStart,
      ImmutableList<Attribute> attributesBeforeBody,
      Compound body,
      @Nullable ContinuingStatement continuingStatement)
      implements Statement {

    public Loop(Compound body, @Nullable ContinuingStatement continuingStatement) {
      this(ImmutableList.of(), ImmutableList.of(), body, continuingStatement);
    }
  }

  record For(
      ImmutableList<Attribute> attributes,
      @Nullable ForInit init,
      @Nullable Expression condition,
      @Nullable ForUpdate update,
      Compound body)
      implements Statement {

    public For(
        @Nullable ForInit init,
        @Nullable Expression condition,
        @Nullable ForUpdate update,
        Compound body) {
      this(ImmutableList.of(), init, condition, update, body);
    }
  }

  record While(ImmutableList<Attribute> attributes, Expression condition, Compound body)
      implements Statement {

    public While(Expression condition, Compound body) {
      this(ImmutableList.of(), condition, body);
    }
  }

  /** A call whose result, if any, is discarded. */
  record FunctionCall(String callee, ImmutableList<Expression> args)
      implements ForInit, ForUpdate {}

  /** {@code let} (or {@code const} when {@code isConst}) declaration. */
  record Value(boolean isConst, String name, @Nullable TypeDecl type, Expression initializer)
      implements ForInit {}

  /** {@code var<addressSpace, accessMode> name: type = initializer;} */
  record Variable(
      String name,
      @Nullable AddressSpace addressSpace,
      @Nullable AccessMode accessMode,
      @Nullable TypeDecl type,
      @Nullable Expression initializer)
      implements ForInit {

    public Variable(String name, @Nullable TypeDecl type, @Nullable Expression initializer) {
      this(name, null, null, type, initializer);
    }
  }
}
