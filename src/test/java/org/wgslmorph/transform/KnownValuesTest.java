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
import static org.junit.Assert.assertThrows;
import static org.wgslmorph.testing.Asts.F32;
import static org.wgslmorph.testing.Asts.I32;
import static org.wgslmorph.testing.Asts.U32;
import static org.wgslmorph.testing.Asts.flit;
import static org.wgslmorph.testing.Asts.fn;
import static org.wgslmorph.testing.Asts.function;
import static org.wgslmorph.testing.Asts.job;
import static org.wgslmorph.testing.Asts.let;
import static org.wgslmorph.testing.Asts.lit;
import static org.wgslmorph.testing.Asts.member;
import static org.wgslmorph.testing.Asts.named;
import static org.wgslmorph.testing.Asts.struct;
import static org.wgslmorph.testing.Asts.uniform;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wgslmorph.ast.AugmentedExpression.KnownValue;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.ast.TypeDecl;
import org.wgslmorph.ast.UnaryOperator;
import org.wgslmorph.resolve.PipelineState;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;
import org.wgslmorph.testing.ExpressionEvaluator;
import org.wgslmorph.testing.ScriptedFuzzerSettings;

@RunWith(TestParameterInjector.class)
public class KnownValuesTest {

  private static final int SEEDS = 40;

  /** A job with no uniforms. */
  private static final ShaderJob PLAIN = job(fn("main", null));

  /**
   * A job with uniforms whose scalars need every kind of adjustment: negative, fractional, and
   * beyond the precise float range.
   */
  private static ShaderJob withUniforms() {
    PipelineState pipelineState =
        PipelineState.builder()
            .setUniformValue(
                0,
                0,
                Expression.StructValueConstructor.of(
                    "S",
                    lit("-20000000i"),
                    Expression.VectorValueConstructor.of(
                        2,
                        F32,
                        flit("3.75f"),
                        new Expression.Unary(UnaryOperator.MINUS, flit("2.5f"))),
                    lit("4000000000u")))
            .setUniformValue(0, 1, flit("33554436.0f"))
            .setUniformValue(1, 0, lit("12u"))
            .build();
    return job(
        pipelineState,
        struct("S", member("a", I32), member("b", new TypeDecl.Vector(2, F32)), member("c", U32)),
        uniform(0, 0, "s", named("S")),
        uniform(0, 1, "big", F32),
        uniform(1, 0, "small", U32),
        fn("main", null));
  }

  private static Scope globalScope(ShaderJob job) {
    return job.environment().globalScope();
  }

  /** Resolves {@code expression} inside a throwaway function and returns its store type. */
  private static Type resolvedType(ShaderJob job, Expression expression) {
    ImmutableList<GlobalDecl> decls =
        ImmutableList.<GlobalDecl>builder()
            .addAll(job.tu().globalDecls())
            .add(fn("typed", null, let("typedValue", expression)))
            .build();
    ShaderJob resolved = job.withTranslationUnit(new TranslationUnit(decls));
    return resolved.environment().typeOf(expression).asStoreTypeIfReference();
  }

  private static double numeric(Object value) {
    return ((Number) value).doubleValue();
  }

  @Test
  public void knownValueEvaluatesToItsValue(
      @TestParameter({"I32", "U32", "F32", "ABSTRACT_INT", "ABSTRACT_FLOAT"}) Type.Scalar type,
      @TestParameter({"0", "1", "7", "1000", "16777216"}) int value,
      @TestParameter boolean uniforms) {
    ShaderJob job = uniforms ? withUniforms() : PLAIN;
    ExpressionEvaluator evaluator = new ExpressionEvaluator(job);
    for (int seed = 0; seed < SEEDS; seed++) {
      FuzzerSettings settings = new DefaultFuzzerSettings(seed);
      KnownValue known =
          KnownValues.generateKnownValueExpression(
              0, KnownValues.literal(value, type), type, settings, job, globalScope(job));
      assertThat(numeric(evaluator.evaluate(known.knownValue()))).isEqualTo((double) value);
      Object actual = evaluator.evaluate(known.expression());
      assertThat(actual).isNotNull();
      assertThat(numeric(actual)).isEqualTo((double) value);
      if (type.isInteger()) {
        assertThat(actual).isInstanceOf(Long.class);
      } else {
        assertThat(actual).isInstanceOf(Double.class);
      }
    }
  }

  @Test
  public void concreteKnownValuesHaveTheRequestedType(
      @TestParameter({"I32", "U32", "F32"}) Type.Scalar type) {
    ShaderJob job = withUniforms();
    for (int seed = 0; seed < SEEDS; seed++) {
      FuzzerSettings settings = new DefaultFuzzerSettings(seed);
      KnownValue known =
          KnownValues.generateKnownValueExpression(
              0, KnownValues.literal(42, type), type, settings, job, globalScope(job));
      assertThat(resolvedType(job, known)).isEqualTo(type);
    }
  }

  @Test
  public void sumSplitsTheValue() {
    ScriptedFuzzerSettings settings =
        new ScriptedFuzzerSettings(5)
            .withMaxDepth(1)
            .with(
                new FuzzerSettings.KnownValueWeights(
                    FuzzerSettings.constant(0),
                    FuzzerSettings.constant(1),
                    FuzzerSettings.constant(0),
                    FuzzerSettings.constant(0),
                    FuzzerSettings.constant(0)))
            .scriptInt(1, 0)
            .scriptInt(8, 3);
    KnownValue known =
        KnownValues.generateKnownValueExpression(
            0, lit("7i"), Type.Scalar.I32, settings, PLAIN, globalScope(PLAIN));
    assertThat(known.knownValue()).isEqualTo(lit("7i"));
    Expression three = new KnownValue(lit("3i"), lit("3i"));
    Expression four = new KnownValue(lit("4i"), lit("4i"));
    assertThat(known.expression())
        .isAnyOf(
            new Expression.Binary(BinaryOperator.PLUS, three, four),
            new Expression.Binary(BinaryOperator.PLUS, four, three));
  }

  @Test
  public void noDeeperMeansPlainLiteral() {
    ScriptedFuzzerSettings settings = new ScriptedFuzzerSettings(0).withMaxDepth(0);
    KnownValue known =
        KnownValues.generateKnownValueExpression(
            0, lit("9u"), Type.Scalar.U32, settings, PLAIN, globalScope(PLAIN));
    assertThat(known).isEqualTo(new KnownValue(lit("9u"), lit("9u")));
    assertThat(known.knownValue()).isNotSameInstanceAs(known.expression());
  }

  @Test
  public void booleansDelegateToOpaquePredicates(@TestParameter boolean value) {
    for (int seed = 0; seed < SEEDS; seed++) {
      KnownValue known =
          KnownValues.generateKnownValueExpression(
              0,
              Expression.BoolLiteral.of(value),
              Type.Scalar.BOOL,
              new DefaultFuzzerSettings(seed),
              PLAIN,
              globalScope(PLAIN));
      assertThat(new ExpressionEvaluator(PLAIN).evaluate(known.expression())).isEqualTo(value);
    }
  }

  @Test
  public void opaquePredicates(@TestParameter boolean uniforms) {
    ShaderJob job = uniforms ? withUniforms() : PLAIN;
    ExpressionEvaluator evaluator = new ExpressionEvaluator(job);
    for (int seed = 0; seed < SEEDS; seed++) {
      FuzzerSettings settings = new DefaultFuzzerSettings(seed);
      KnownValue trueValue =
          KnownValues.generateTrueByConstructionExpression(settings, job, globalScope(job));
      KnownValue falseValue =
          KnownValues.generateFalseByConstructionExpression(settings, job, globalScope(job));
      assertThat(trueValue.isTrueByConstruction()).isTrue();
      assertThat(falseValue.isFalseByConstruction()).isTrue();
      assertThat(evaluator.evaluate(trueValue.expression())).isEqualTo(true);
      assertThat(evaluator.evaluate(falseValue.expression())).isEqualTo(false);
      assertThat(resolvedType(job, trueValue)).isEqualTo(Type.Scalar.BOOL);
    }
  }

  @Test
  public void valueOutsidePreciseRange(@TestParameter({"-1i", "16777217i", "2.5f"}) String text) {
    Expression literal = text.endsWith("f") ? flit(text) : lit(text);
    Type.Scalar type = text.endsWith("f") ? Type.Scalar.F32 : Type.Scalar.I32;
    assertThrows(
        IllegalArgumentException.class,
        () ->
            KnownValues.generateKnownValueExpression(
                0, literal, type, new DefaultFuzzerSettings(0), PLAIN, globalScope(PLAIN)));
  }

  @Test
  public void unsupportedTypes() {
    FuzzerSettings settings = new DefaultFuzzerSettings(0);
    assertThrows(
        UnsupportedOperationException.class,
        () ->
            KnownValues.generateKnownValueExpression(
                0,
                lit("1i"),
                new Type.Vector(2, Type.Scalar.I32),
                settings,
                PLAIN,
                globalScope(PLAIN)));
    assertThrows(
        UnsupportedOperationException.class,
        () ->
            KnownValues.generateKnownValueExpression(
                0, flit("1h"), Type.Scalar.F16, settings, PLAIN, globalScope(PLAIN)));
  }

  @Test
  public void shadowedUniformsAreNotUsed() {
    ShaderJob job = withUniforms();
    assertThat(KnownValues.hasUsableUniform(job, globalScope(job))).isTrue();
    ShaderJob shadowing =
        job.withTranslationUnit(
            new TranslationUnit(
                ImmutableList.<GlobalDecl>builder()
                    .addAll(job.tu().globalDecls())
                    .add(
                        fn(
                            "shadow",
                            null,
                            let("s", lit("1i")),
                            let("big", lit("2i")),
                            let("small", lit("3i"))))
                    .build()));
    Statement.Compound body = function(shadowing, "shadow").body();
    Scope inside = shadowing.environment().scopeAtIndex(body, 3);
    assertThat(KnownValues.hasUsableUniform(shadowing, inside)).isFalse();
    assertThat(KnownValues.hasUsableUniform(PLAIN, globalScope(PLAIN))).isFalse();
  }

  @Test
  public void uniformScalarReadsTheDeclaredValue() {
    ShaderJob job = withUniforms();
    ExpressionEvaluator evaluator = new ExpressionEvaluator(job);
    for (int seed = 0; seed < SEEDS; seed++) {
      KnownValues.UniformScalar uniform =
          KnownValues.randomKnownScalarValueFromUniform(
              job, new DefaultFuzzerSettings(seed), globalScope(job));
      assertThat(evaluator.evaluate(uniform.expression()))
          .isEqualTo(evaluator.evaluate(uniform.value()));
      assertThat(resolvedType(job, uniform.expression())).isEqualTo(uniform.type());
    }
  }

  @Test
  public void literals() {
    assertThat(KnownValues.literal(7, Type.Scalar.I32)).isEqualTo(lit("7i"));
    assertThat(KnownValues.literal(7, Type.Scalar.U32)).isEqualTo(lit("7u"));
    assertThat(KnownValues.literal(7, Type.Scalar.ABSTRACT_INT)).isEqualTo(lit("7"));
    assertThat(KnownValues.literal(7, Type.Scalar.F32)).isEqualTo(flit("7f"));
    assertThat(KnownValues.literal(7, Type.Scalar.ABSTRACT_FLOAT)).isEqualTo(flit("7.0"));
    assertThrows(
        UnsupportedOperationException.class, () -> KnownValues.literal(1, Type.Scalar.BOOL));
  }

  @Test
  public void constantWithSameValueEverywhere() {
    assertThat(KnownValues.constantWithSameValueEverywhere(1, Type.Scalar.F32))
        .isEqualTo(flit("1.0f"));
    assertThat(KnownValues.constantWithSameValueEverywhere(0, Type.Scalar.BOOL))
        .isEqualTo(Expression.BoolLiteral.of(false));
    assertThat(
            KnownValues.constantWithSameValueEverywhere(1, new Type.Vector(3, Type.Scalar.U32)))
        .isEqualTo(Expression.VectorValueConstructor.of(3, U32, lit("1u"), lit("1u"), lit("1u")));
    assertThrows(
        UnsupportedOperationException.class,
        () ->
            KnownValues.constantWithSameValueEverywhere(
                1, new Type.Array(Type.Scalar.I32, null)));
  }

  @Test
  public void constantWithSameValueEverywhereBroadcastsThroughComposites() {
    Expression column = Expression.VectorValueConstructor.of(2, F32, flit("1.0f"), flit("1.0f"));
    assertThat(
            KnownValues.constantWithSameValueEverywhere(1, new Type.Matrix(3, 2, Type.Scalar.F32)))
        .isEqualTo(
            new Expression.MatrixValueConstructor(
                3, 2, F32, ImmutableList.of(column, column, column)));
    assertThat(
            KnownValues.constantWithSameValueEverywhere(1, new Type.Array(Type.Scalar.I32, 2)))
        .isEqualTo(
            new Expression.ArrayValueConstructor(
                I32, lit("2u"), ImmutableList.of(lit("1i"), lit("1i"))));
    Type.Struct out =
        new Type.Struct(
            "Out",
            ImmutableList.of(
                new Type.Struct.Member("color", new Type.Vector(2, Type.Scalar.F32)),
                new Type.Struct.Member("flag", Type.Scalar.BOOL)));
    assertThat(KnownValues.constantWithSameValueEverywhere(1, out))
        .isEqualTo(
            Expression.StructValueConstructor.of("Out", column, Expression.BoolLiteral.of(true)));
  }

  @Test
  public void numericValueLooksThroughNegationAndParens() {
    assertThat(
            KnownValues.numericValue(
                new Expression.Paren(new Expression.Unary(UnaryOperator.MINUS, lit("5i")))))
        .isEqualTo(-5.0);
    assertThrows(
        IllegalArgumentException.class,
        () -> KnownValues.numericValue(new Expression.Identifier("x")));
  }
}
