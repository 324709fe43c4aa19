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

import static com.google.common.truth.Truth.assertThat;
import static org.wgslmorph.testing.Asts.F32;
import static org.wgslmorph.testing.Asts.I32;
import static org.wgslmorph.testing.Asts.assign;
import static org.wgslmorph.testing.Asts.binary;
import static org.wgslmorph.testing.Asts.block;
import static org.wgslmorph.testing.Asts.constDecl;
import static org.wgslmorph.testing.Asts.flit;
import static org.wgslmorph.testing.Asts.fn;
import static org.wgslmorph.testing.Asts.forLoop;
import static org.wgslmorph.testing.Asts.id;
import static org.wgslmorph.testing.Asts.job;
import static org.wgslmorph.testing.Asts.let;
import static org.wgslmorph.testing.Asts.lit;
import static org.wgslmorph.testing.Asts.param;
import static org.wgslmorph.testing.Asts.ret;
import static org.wgslmorph.testing.Asts.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.Metadata;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.UnaryOperator;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;
import org.wgslmorph.testing.Asts;
import org.wgslmorph.testing.ExpressionEvaluator;
import org.wgslmorph.testing.ScriptedFuzzerSettings;
import org.wgslmorph.testing.ScriptedFuzzerSettings.Hook;

@RunWith(TestParameterInjector.class)
public class IdentityOperationsTest {

  /**
   * <pre>
   * fn f(a: i32) -> i32 {
   *   var x: i32 = a;
   *   const c = 3i;
   *   x = x + c;
   *   let p = &x;
   *   var y: f32 = 1.5f;
   *   let b = x > 2i;
   *   return x * 2i;
   * }
   * </pre>
   */
  private static ShaderJob fixture() {
    return job(
        fn(
            "f",
            ImmutableList.of(param("a", I32)),
            I32,
            var("x", I32, id("a")),
            constDecl("c", lit("3i")),
            assign("x", binary(BinaryOperator.PLUS, id("x"), id("c"))),
            let("p", new Expression.Unary(UnaryOperator.ADDRESS_OF, id("x"))),
            var("y", F32, flit("1.5f")),
            let("b", binary(BinaryOperator.GREATER_THAN, id("x"), lit("2i"))),
            ret(binary(BinaryOperator.TIMES, id("x"), lit("2i")))));
  }

  /** The identity operations, each chosen on its own. */
  enum Kind {
    ADD_ZERO_LEFT(new FuzzerSettings.ScalarIdentityOperationWeights(1, 0, 0, 0, 0, 0)),
    ADD_ZERO_RIGHT(new FuzzerSettings.ScalarIdentityOperationWeights(0, 1, 0, 0, 0, 0)),
    SUB_ZERO(new FuzzerSettings.ScalarIdentityOperationWeights(0, 0, 1, 0, 0, 0)),
    MUL_ONE_LEFT(new FuzzerSettings.ScalarIdentityOperationWeights(0, 0, 0, 1, 0, 0)),
    MUL_ONE_RIGHT(new FuzzerSettings.ScalarIdentityOperationWeights(0, 0, 0, 0, 1, 0)),
    DIV_ONE(new FuzzerSettings.ScalarIdentityOperationWeights(0, 0, 0, 0, 0, 1));

    final FuzzerSettings.ScalarIdentityOperationWeights weights;

    Kind(FuzzerSettings.ScalarIdentityOperationWeights weights) {
      this.weights = weights;
    }
  }

  private static boolean hasMetadata(
      ImmutableSet<Metadata> metadata, Class<?> kind) {
    return metadata.stream().anyMatch(kind::isInstance);
  }

  /** Removes every identity operation, restoring the expression it was applied to. */
  private static @Nullable AstNode undo(AstNode node) {
    if (node instanceof Expression.Paren outer
        && hasMetadata(outer.metadata(), Metadata.AdditionalParen.class)
        && outer.target() instanceof Expression.Binary operation) {
      boolean identityOnLeft =
          hasMetadata(operation.metadata(), Metadata.ReverseToRhsBinaryOperator.class);
      Expression.Paren operand =
          (Expression.Paren) (identityOnLeft ? operation.rhs() : operation.lhs());
      return AstCloner.clone(operand.target(), IdentityOperationsTest::undo);
    }
    return null;
  }

  private static ImmutableList<Expression.Binary> identityOperations(ShaderJob job) {
    return identityOperations(job.tu());
  }

  private static ImmutableList<Expression.Binary> identityOperations(AstNode root) {
    return Asts.nodesOfType(root, Expression.Binary.class).stream()
        .filter(
            b ->
                hasMetadata(b.metadata(), Metadata.ReverseToLhsBinaryOperator.class)
                    || hasMetadata(b.metadata(), Metadata.ReverseToRhsBinaryOperator.class))
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void operationsCanBeUndone() {
    for (int seed = 0; seed < 20; seed++) {
      ShaderJob job = fixture();
      ShaderJob result = new IdentityOperations().apply(job, new DefaultFuzzerSettings(seed));
      assertThat(AstCloner.clone(result.tu(), IdentityOperationsTest::undo)).isEqualTo(job.tu());
    }
  }

  @Test
  public void identityValuesAreNeutral(@TestParameter Kind kind) {
    ShaderJob result =
        new IdentityOperations()
            .apply(
                fixture(),
                new ScriptedFuzzerSettings(kind.ordinal())
                    .always(Hook.IDENTITY_OPERATION)
                    .with(kind.weights));
    ExpressionEvaluator evaluator = new ExpressionEvaluator(result);
    ImmutableList<Expression.Binary> operations = identityOperations(result);
    assertThat(operations).isNotEmpty();
    for (Expression.Binary operation : operations) {
      boolean identityOnLeft =
          hasMetadata(operation.metadata(), Metadata.ReverseToRhsBinaryOperator.class);
      assertThat(identityOnLeft).isEqualTo(kind.name().endsWith("_LEFT"));
      Expression identity = identityOnLeft ? operation.lhs() : operation.rhs();
      double value = ((Number) evaluator.evaluate(identity)).doubleValue();
      switch (operation.operator()) {
        case PLUS, MINUS -> assertThat(value).isEqualTo(0.0);
        case TIMES, DIVIDE -> assertThat(value).isEqualTo(1.0);
        default -> throw new AssertionError(operation.operator());
      }
    }
  }

  @Test
  public void onlyNumericScalarsOutsideConstContextsAreWrapped() {
    ShaderJob result =
        new IdentityOperations()
            .apply(fixture(), new ScriptedFuzzerSettings(4).always(Hook.IDENTITY_OPERATION));
    for (Expression.Binary operation : identityOperations(result)) {
      Type type = result.environment().typeOf(operation).asStoreTypeIfReference();
      assertThat(type).isAnyOf(Type.Scalar.I32, Type.Scalar.F32);
    }
    ImmutableList<Statement> body = Asts.function(result, "f").body().statements();
    assertThat(body.get(1)).isEqualTo(constDecl("c", lit("3i")));
    assertThat(body.get(3))
        .isEqualTo(let("p", new Expression.Unary(UnaryOperator.ADDRESS_OF, id("x"))));
  }

  @Test
  public void nestedBodiesAndLoopHeadersAreRewritten() {
    // fn g() {
    //   var x: i32 = 0i;
    //   if (x > 0i) { let y = x; x = y; } else { x = 1i; }
    //   for (var i: i32 = 0i; i < 3i; i++) { x = i; }
    //   while (x < 5i) { x = x + 1i; }
    //   loop { var z: i32 = x; continuing { z = 2i; break if z > 1i; } }
    // }
    ShaderJob job =
        job(
            fn(
                "g",
                null,
                var("x", I32, lit("0i")),
                new Statement.If(
                    binary(BinaryOperator.GREATER_THAN, id("x"), lit("0i")),
                    block(let("y", id("x")), assign("x", id("y"))),
                    block(assign("x", lit("1i")))),
                forLoop("i", 3, assign("x", id("i"))),
                new Statement.While(
                    binary(BinaryOperator.LESS_THAN, id("x"), lit("5i")),
                    block(assign("x", binary(BinaryOperator.PLUS, id("x"), lit("1i"))))),
                new Statement.Loop(
                    block(var("z", I32, id("x"))),
                    new ContinuingStatement(
                        block(assign("z", lit("2i"))),
                        binary(BinaryOperator.GREATER_THAN, id("z"), lit("1i"))))));
    for (int seed = 0; seed < 10; seed++) {
      ShaderJob result =
          new IdentityOperations()
              .apply(job, new ScriptedFuzzerSettings(seed).always(Hook.IDENTITY_OPERATION));
      assertThat(AstCloner.clone(result.tu(), IdentityOperationsTest::undo)).isEqualTo(job.tu());
      Statement.For forStatement = Asts.nodesOfType(result.tu(), Statement.For.class).get(0);
      assertThat(identityOperations(forStatement.condition())).isNotEmpty();
      assertThat(identityOperations(forStatement.update())).isEmpty();
      Statement.Loop loop = Asts.nodesOfType(result.tu(), Statement.Loop.class).get(0);
      assertThat(identityOperations(loop.continuingStatement().breakIfExpr())).isNotEmpty();
    }
  }

  @Test
  public void nothingChosenLeavesTheShaderUnchanged() {
    ShaderJob job = fixture();
    ShaderJob result =
        new IdentityOperations()
            .apply(job, new ScriptedFuzzerSettings(0).never(Hook.IDENTITY_OPERATION));
    assertThat(result.tu()).isEqualTo(job.tu());
  }
}
