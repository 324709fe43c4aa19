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

package org.wgslmorph.transform;

import static org.wgslmorph.transform.Choice.option;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.Attribute;
import org.wgslmorph.ast.AugmentedExpression.KnownValue;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.SwitchClause;
import org.wgslmorph.ast.TypeDecl;
import org.wgslmorph.ast.UnaryOperator;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Rewrites scalar numeric expressions {@code x} into {@code x + 0}, {@code 0 + x}, {@code x - 0},
 * {@code 1 * x}, {@code x * 1} or {@code x / 1}, where the 0 or 1 is a known value.
 *
 * <p>Expressions that must be constant (module-scope initializers, {@code const} declarations,
 * {@code const_assert}, case selectors, attribute arguments and array sizes) are left alone, as
 * are the operands of {@code &} and the literal half of a {@link KnownValue}.
 */
public final class IdentityOperations implements MetamorphicTransformation {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The six identity operations. */
  enum Kind {
    ADD_ZERO_LEFT(BinaryOperator.PLUS, 0, true, "add zero on left"),
    ADD_ZERO_RIGHT(BinaryOperator.PLUS, 0, false, "add zero on right"),
    SUB_ZERO(BinaryOperator.MINUS, 0, false, "sub zero"),
    MUL_ONE_LEFT(BinaryOperator.TIMES, 1, true, "mul by one on left"),
    MUL_ONE_RIGHT(BinaryOperator.TIMES, 1, false, "mul by one on right"),
    DIV_ONE(BinaryOperator.DIVIDE, 1, false, "div by one");

    final BinaryOperator operator;
    final int identity;

    /** True if the identity value is the left operand. */
    final boolean identityOnLeft;

    final String commentary;

    Kind(BinaryOperator operator, int identity, boolean identityOnLeft, String commentary) {
      this.operator = operator;
      this.identity = identity;
      this.identityOnLeft = identityOnLeft;
      this.commentary = commentary;
    }
  }

  /** A decision to apply {@code kind} to an expression, with its generated identity operand. */
  private record Pending(Kind kind, KnownValue identityValue, int id) {}

  @Override
  public ShaderJob apply(ShaderJob shaderJob, FuzzerSettings settings) {
    Selector selector = new Selector(shaderJob, settings);
    Map<Expression, Pending> pending = new IdentityHashMap<>();
    AstTraversal.traverse(selector::select, shaderJob.tu(), pending);
    logger.atFine().log("Applying %d identity operations", pending.size());
    return shaderJob.withTranslationUnit(
        AstCloner.clone(shaderJob.tu(), node -> rewrite(node, pending)));
  }

  private static @Nullable AstNode rewrite(AstNode node, Map<Expression, Pending> pending) {
    if (!(node instanceof Expression expression)) {
      return null;
    }
    Pending p = pending.get(expression);
    if (p == null) {
      return null;
    }
    // Clone the expression itself, applying any operations chosen for its subexpressions.
    Expression inner = AstCloner.clone(expression, n -> n == node ? null : rewrite(n, pending));
    ImmutableSet<Metadata> paren = ImmutableSet.of(new Metadata.AdditionalParen(p.id()));
    Expression operand = new Expression.Paren(inner, paren);
    Expression identity = new Expression.Paren(p.identityValue(), paren);
    Metadata reverse =
        p.kind().identityOnLeft
            ? new Metadata.ReverseToRhsBinaryOperator(p.kind().commentary, p.id())
            : new Metadata.ReverseToLhsBinaryOperator(p.kind().commentary, p.id());
    Expression binary =
        p.kind().identityOnLeft
            ? new Expression.Binary(p.kind().operator, identity, operand, ImmutableSet.of(reverse))
            : new Expression.Binary(p.kind().operator, operand, identity, ImmutableSet.of(reverse));
    return new Expression.Paren(binary, paren);
  }

  private static final class Selector {
    final ShaderJob shaderJob;
    final FuzzerSettings settings;
    Scope scope;

    Selector(ShaderJob shaderJob, FuzzerSettings settings) {
      this.shaderJob = shaderJob;
      this.settings = settings;
      this.scope = shaderJob.environment().globalScope();
    }

    void select(AstNode node, Map<Expression, Pending> pending) {
      if (node instanceof Attribute
          || node instanceof TypeDecl
          || node instanceof GlobalDecl.Constant
          || node instanceof GlobalDecl.OverrideConstant
          || node instanceof GlobalDecl.Variable
          || node instanceof GlobalDecl.ConstAssert
          || node instanceof Statement.ConstAssert
          || (node instanceof Statement.Value value && value.isConst())
          || (node instanceof Expression.Unary unary
              && unary.operator() == UnaryOperator.ADDRESS_OF)) {
        return;
      }
      if (node instanceof SwitchClause clause) {
        select(clause.compoundStatement(), pending);
        return;
      }
      if (node instanceof Expression.ArrayValueConstructor constructor) {
        // The element count is a constant; only the elements are candidates.
        for (Expression arg : constructor.args()) {
          select(arg, pending);
        }
        return;
      }
      if (node instanceof KnownValue knownValue) {
        AstTraversal.traverse(this::select, knownValue.expression(), pending);
        return;
      }
      if (node instanceof Statement.Compound compound) {
        for (int i = 0; i < compound.size(); i++) {
          selectIn(
              shaderJob.environment().scopeAtIndex(compound, i),
              compound.statements().get(i),
              pending);
        }
        return;
      }
      if (node instanceof Statement.For forStatement) {
        if (forStatement.init() != null) {
          select(forStatement.init(), pending);
        }
        // The condition and update see the loop counter, like the start of the body.
        Scope inner = shaderJob.environment().scopeAtIndex(forStatement.body(), 0);
        if (forStatement.condition() != null) {
          selectIn(inner, forStatement.condition(), pending);
        }
        if (forStatement.update() != null) {
          selectIn(inner, forStatement.update(), pending);
        }
        select(forStatement.body(), pending);
        return;
      }
      if (node instanceof ContinuingStatement continuing) {
        select(continuing.statements(), pending);
        if (continuing.breakIfExpr() != null) {
          selectIn(
              shaderJob.environment().scopeAvailableAtEnd(continuing.statements()),
              continuing.breakIfExpr(),
              pending);
        }
        return;
      }
      AstTraversal.traverse(this::select, node, pending);
      if (node instanceof Expression expression && settings.applyIdentityOperation()) {
        Type type = shaderJob.environment().typeOf(expression).asStoreTypeIfReference();
        if (type instanceof Type.Scalar scalar
            && (scalar.isInteger() || scalar.isFloat())
            && scalar != Type.Scalar.F16) {
          pending.put(expression, choose(scalar));
        }
      }
    }

    void selectIn(Scope inner, AstNode node, Map<Expression, Pending> pending) {
      Scope enclosing = scope;
      scope = inner;
      select(node, pending);
      scope = enclosing;
    }

    Pending choose(Type.Scalar type) {
      int id = settings.getUniqueId();
      FuzzerSettings.ScalarIdentityOperationWeights weights =
          settings.scalarIdentityOperationWeights();
      Kind kind =
          Choice.choose(
              settings,
              option(weights.addZeroLeft(), () -> Kind.ADD_ZERO_LEFT),
              option(weights.addZeroRight(), () -> Kind.ADD_ZERO_RIGHT),
              option(weights.subZero(), () -> Kind.SUB_ZERO),
              option(weights.mulOneLeft(), () -> Kind.MUL_ONE_LEFT),
              option(weights.mulOneRight(), () -> Kind.MUL_ONE_RIGHT),
              option(weights.divOne(), () -> Kind.DIV_ONE));
      KnownValue identityValue =
          KnownValues.generateKnownValueExpression(
              0,
              KnownValues.constantWithSameValueEverywhere(kind.identity, type),
              type,
              settings,
              shaderJob,
              scope);
      return new Pending(kind, identityValue, id);
    }
  }
}
