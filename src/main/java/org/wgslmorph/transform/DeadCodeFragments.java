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

import static com.google.common.base.Preconditions.checkArgument;
import static org.wgslmorph.transform.Choice.option;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AugmentedExpression.KnownValue;
import org.wgslmorph.ast.AugmentedStatement.DeadCodeFragment;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Factories for {@link DeadCodeFragment} statements. These are the only way fragments are
 * created, so each one starts out in a shape whose guarded code is evidently unreachable.
 */
public final class DeadCodeFragments {

  /** {@code if (false-by-construction) { dead } [else { }]} */
  public static DeadCodeFragment ifFalseThenDead(
      KnownValue falseCondition, Statement.Compound dead, boolean includeEmptyElseBranch) {
    checkArgument(falseCondition.isFalseByConstruction(), "Not false: %s", falseCondition);
    return new DeadCodeFragment(
        new Statement.If(
            falseCondition, dead, includeEmptyElseBranch ? Statement.Compound.of() : null));
  }

  /** {@code if (true-by-construction) { } else { dead }} */
  public static DeadCodeFragment ifTrueElseDead(KnownValue trueCondition, Statement.Compound dead) {
    checkArgument(trueCondition.isTrueByConstruction(), "Not true: %s", trueCondition);
    return new DeadCodeFragment(new Statement.If(trueCondition, Statement.Compound.of(), dead));
  }

  /** {@code while (false-by-construction) { dead }} */
  public static DeadCodeFragment whileFalseDead(
      KnownValue falseCondition, Statement.Compound dead) {
    checkArgument(falseCondition.isFalseByConstruction(), "Not false: %s", falseCondition);
    return new DeadCodeFragment(new Statement.While(falseCondition, dead));
  }

  /** {@code for (; false-by-construction; update) { dead }} */
  public static DeadCodeFragment forWithFalseConditionDead(
      KnownValue falseCondition,
      Statement.Compound dead,
      Statement.@Nullable ForUpdate unreachableUpdate) {
    checkArgument(falseCondition.isFalseByConstruction(), "Not false: %s", falseCondition);
    return new DeadCodeFragment(new Statement.For(null, falseCondition, unreachableUpdate, dead));
  }

  /**
   * {@code loop { if (true-by-construction) { break; } dead... [continuing { [break if e;] }] }}.
   * The statements of {@code dead} are placed directly in the loop body.
   */
  public static DeadCodeFragment loopWithUnconditionalBreakDead(
      KnownValue trueCondition,
      Statement.Compound dead,
      boolean includeContinuingStatement,
      @Nullable Expression breakIfExpr) {
    checkArgument(trueCondition.isTrueByConstruction(), "Not true: %s", trueCondition);
    checkArgument(
        includeContinuingStatement || breakIfExpr == null,
        "break-if requires a continuing statement");
    ImmutableList<Statement> body =
        ImmutableList.<Statement>builder()
            .add(
                new Statement.If(
                    trueCondition, Statement.Compound.of(new Statement.Break()), null))
            .addAll(dead.statements())
            .build();
    return new DeadCodeFragment(
        new Statement.Loop(
            new Statement.Compound(body),
            includeContinuingStatement
                ? new ContinuingStatement(Statement.Compound.of(), breakIfExpr)
                : null));
  }

  /**
   * Guards a {@code break} or {@code continue} with an {@code if}. Loop shapes would capture the
   * jump, so they are never used here.
   */
  public static DeadCodeFragment deadBreakOrContinue(
      Statement jump, FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    checkArgument(
        jump instanceof Statement.Break || jump instanceof Statement.Continue,
        "Not a break or continue: %s",
        jump);
    Statement.Compound dead = Statement.Compound.of(jump);
    FuzzerSettings.DeadBreaksAndContinuesWeights weights = settings.deadBreaksAndContinuesWeights();
    return Choice.choose(
        settings,
        option(
            weights.ifFalse(),
            () ->
                ifFalseThenDead(
                    KnownValues.generateFalseByConstructionExpression(settings, shaderJob, scope),
                    dead,
                    false)),
        option(
            weights.ifFalseWithEmptyElse(),
            () ->
                ifFalseThenDead(
                    KnownValues.generateFalseByConstructionExpression(settings, shaderJob, scope),
                    dead,
                    true)),
        option(
            weights.ifTrue(),
            () ->
                ifTrueElseDead(
                    KnownValues.generateTrueByConstructionExpression(settings, shaderJob, scope),
                    dead)));
  }

  /** Guards a {@code discard} or {@code return} with any of the dead code shapes. */
  public static DeadCodeFragment deadDiscardOrReturn(
      Statement jump, FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    checkArgument(
        jump instanceof Statement.Discard || jump instanceof Statement.Return,
        "Not a discard or return: %s",
        jump);
    Statement.Compound dead = Statement.Compound.of(jump);
    FuzzerSettings.DeadDiscardOrReturnWeights weights = settings.deadDiscardOrReturnWeights();
    return Choice.choose(
        settings,
        option(
            weights.ifFalse(),
            () ->
                ifFalseThenDead(
                    KnownValues.generateFalseByConstructionExpression(settings, shaderJob, scope),
                    dead,
                    settings.randomBool())),
        option(
            weights.ifTrue(),
            () ->
                ifTrueElseDead(
                    KnownValues.generateTrueByConstructionExpression(settings, shaderJob, scope),
                    dead)),
        option(
            weights.whileFalse(),
            () ->
                whileFalseDead(
                    KnownValues.generateFalseByConstructionExpression(settings, shaderJob, scope),
                    dead)),
        option(
            weights.forLoopWithFalseCondition(),
            () ->
                forWithFalseConditionDead(
                    KnownValues.generateFalseByConstructionExpression(settings, shaderJob, scope),
                    dead,
                    null)),
        option(
            weights.loopWithUnconditionalBreak(),
            () -> {
              KnownValue trueCondition =
                  KnownValues.generateTrueByConstructionExpression(settings, shaderJob, scope);
              boolean includeContinuing = settings.randomBool();
              // The loop always breaks before reaching the continuing block.
              Expression breakIf =
                  includeContinuing && settings.randomBool()
                      ? ArbitraryExpressions.generateArbitraryExpression(
                          0, Type.Scalar.BOOL, true, settings, shaderJob, scope)
                      : null;
              return loopWithUnconditionalBreakDead(
                  trueCondition, dead, includeContinuing, breakIf);
            }));
  }

  private DeadCodeFragments() {}
}
