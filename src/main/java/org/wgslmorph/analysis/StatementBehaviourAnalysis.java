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

package org.wgslmorph.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AugmentedStatement;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.SwitchClause;
import org.wgslmorph.ast.UnaryOperator;

/**
 * Computes statement behaviours as defined by the WGSL behaviour analysis: the set of ways in
 * which executing a statement may complete. A function call always behaves as {@link
 * Behaviour#NEXT}, since returns inside the callee do not leave the caller.
 *
 * <p>{@code discard} is treated as {@link Behaviour#NEXT}, following the WGSL rules.
 */
public final class StatementBehaviourAnalysis {

  /** Returns the behaviour of a sequence of statements executed in order. */
  public static Set<Behaviour> behaviourOf(List<Statement> statements) {
    Set<Behaviour> result = EnumSet.of(Behaviour.NEXT);
    for (Statement statement : statements) {
      Set<Behaviour> head = behaviourOf(statement);
      if (result.contains(Behaviour.NEXT)) {
        result.remove(Behaviour.NEXT);
        result.addAll(head);
      }
    }
    return result;
  }

  public static Set<Behaviour> behaviourOf(Statement statement) {
    if (statement instanceof Statement.Break) {
      return EnumSet.of(Behaviour.BREAK);
    } else if (statement instanceof Statement.Continue) {
      return EnumSet.of(Behaviour.CONTINUE);
    } else if (statement instanceof Statement.Return) {
      return EnumSet.of(Behaviour.RETURN);
    } else if (statement instanceof Statement.Compound compound) {
      return behaviourOf(compound.statements());
    } else if (statement instanceof Statement.If ifStatement) {
      Set<Behaviour> result = behaviourOf(ifStatement.thenBranch());
      result.addAll(
          ifStatement.elseBranch() == null
              ? EnumSet.of(Behaviour.NEXT)
              : behaviourOf(ifStatement.elseBranch()));
      return result;
    } else if (statement instanceof Statement.Loop loop) {
      Set<Behaviour> result = behaviourOf(loop.body());
      @Nullable ContinuingStatement continuing = loop.continuingStatement();
      if (continuing != null) {
        result.addAll(behaviourOf(continuing.statements()));
        if (continuing.breakIfExpr() != null) {
          result.add(Behaviour.BREAK);
        }
      }
      return loopBehaviour(result);
    } else if (statement instanceof Statement.For forStatement) {
      return behaviourOf(desugar(forStatement));
    } else if (statement instanceof Statement.While whileStatement) {
      return behaviourOf(desugar(whileStatement));
    } else if (statement instanceof Statement.Switch switchStatement) {
      Set<Behaviour> result = EnumSet.noneOf(Behaviour.class);
      for (SwitchClause clause : switchStatement.clauses()) {
        result.addAll(behaviourOf(clause.compoundStatement()));
      }
      if (result.remove(Behaviour.BREAK)) {
        result.add(Behaviour.NEXT);
      }
      return result;
    } else if (statement instanceof AugmentedStatement.DeadCodeFragment fragment) {
      return behaviourOf(fragment.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapper wrapper) {
      return behaviourOf(wrapper.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapReturn) {
      return EnumSet.of(Behaviour.RETURN);
    }
    // Declarations, assignments, calls, discard, const_assert and empty statements.
    return EnumSet.of(Behaviour.NEXT);
  }

  private static Set<Behaviour> loopBehaviour(Set<Behaviour> body) {
    if (body.contains(Behaviour.BREAK)) {
      Set<Behaviour> result = EnumSet.of(Behaviour.NEXT);
      result.addAll(Sets.difference(body, EnumSet.of(Behaviour.BREAK, Behaviour.CONTINUE)));
      return result;
    }
    Set<Behaviour> result = EnumSet.noneOf(Behaviour.class);
    result.addAll(Sets.difference(body, EnumSet.of(Behaviour.NEXT, Behaviour.CONTINUE)));
    return result;
  }

  private static Statement desugar(Statement.For forStatement) {
    ImmutableList.Builder<Statement> body = ImmutableList.builder();
    if (forStatement.condition() != null) {
      body.add(breakUnless(forStatement.condition()));
    }
    body.addAll(forStatement.body().statements());
    @Nullable ContinuingStatement continuing =
        forStatement.update() == null
            ? null
            : new ContinuingStatement(Statement.Compound.of(forStatement.update()), null);
    Statement.Loop loop = new Statement.Loop(new Statement.Compound(body.build()), continuing);
    return forStatement.init() == null ? loop : Statement.Compound.of(forStatement.init(), loop);
  }

  private static Statement desugar(Statement.While whileStatement) {
    ImmutableList<Statement> body =
        ImmutableList.<Statement>builder()
            .add(breakUnless(whileStatement.condition()))
            .addAll(whileStatement.body().statements())
            .build();
    return new Statement.Loop(new Statement.Compound(body), null);
  }

  private static Statement breakUnless(Expression condition) {
    return new Statement.If(
        new Expression.Unary(UnaryOperator.LOGICAL_NOT, condition),
        Statement.Compound.of(new Statement.Break()),
        null);
  }

  private StatementBehaviourAnalysis() {}
}
