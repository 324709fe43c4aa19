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
import java.util.ArrayList;
import java.util.List;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AugmentedExpression.KnownValue;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.UnaryOperator;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ScopeEntry;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;
import org.wgslmorph.util.StringUtil;

/**
 * Synthesizes expressions that are guaranteed to evaluate to a given value, but that are not
 * visibly constant: opaque predicates for booleans, and sums, differences, products and
 * uniform-derived expressions for numbers.
 *
 * <p>Numeric known values are integers in {@code [0, 2^24]}. Every such integer is exactly
 * representable as an f32, so values can move between integer and float types without loss.
 */
public final class KnownValues {

  /** The largest integer n such that every integer in {@code [0, n]} is exactly an f32. */
  public static final int LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE = 1 << 24;

  /**
   * Returns an expression of type {@code type} that evaluates to the value of the literal {@code
   * knownValue} on every execution.
   *
   * @throws UnsupportedOperationException if {@code type} is not a scalar, or is f16
   * @throws IllegalArgumentException if the value is not an integer in {@code [0, 2^24]}
   */
  public static KnownValue generateKnownValueExpression(
      int depth,
      Expression knownValue,
      Type type,
      FuzzerSettings settings,
      ShaderJob shaderJob,
      Scope scope) {
    if (!settings.goDeeper(depth)) {
      return new KnownValue(AstCloner.clone(knownValue), AstCloner.clone(knownValue));
    }
    if (!(type instanceof Type.Scalar scalar)) {
      throw new UnsupportedOperationException(
          "Known values of type " + type + " are not supported");
    }
    if (scalar == Type.Scalar.BOOL) {
      checkArgument(knownValue instanceof Expression.BoolLiteral, "Not a bool: %s", knownValue);
      return ((Expression.BoolLiteral) knownValue).value()
          ? generateTrueByConstructionExpression(depth, settings, shaderJob, scope)
          : generateFalseByConstructionExpression(depth, settings, shaderJob, scope);
    }
    if (scalar == Type.Scalar.F16) {
      throw new UnsupportedOperationException("Known values of type f16 are not supported");
    }
    long value = knownIntegerValue(knownValue);
    FuzzerSettings.KnownValueWeights weights = settings.knownValueWeights();
    NumericKnownValues generator =
        new NumericKnownValues(depth, scalar, settings, shaderJob, scope);

    List<Choice.Option<Expression>> options = new ArrayList<>();
    options.add(option(weights.plainKnownValue().applyAsInt(depth), () -> literal(value, scalar)));
    options.add(
        option(
            weights.sumOfKnownValues().applyAsInt(depth),
            () -> {
              long r = settings.randomInt((int) value + 1);
              return randomOperandOrder(
                  settings, BinaryOperator.PLUS, generator.known(r), generator.known(value - r));
            }));
    options.add(
        option(
            weights.differenceOfKnownValues().applyAsInt(depth),
            () -> {
              long r = settings.randomInt(LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE - (int) value + 1);
              return new Expression.Binary(
                  BinaryOperator.MINUS, generator.known(value + r), generator.known(r));
            }));
    options.add(
        option(
            weights.productOfKnownValues().applyAsInt(depth),
            () -> {
              long r = Math.max(1, settings.randomInt((int) Math.max(1, value / 2)));
              long quotient = value / r;
              long remainder = value % r;
              Expression product =
                  randomOperandOrder(
                      settings,
                      BinaryOperator.TIMES,
                      generator.known(r),
                      generator.known(quotient));
              // A zero remainder is sometimes added anyway, for variety.
              if (remainder != 0 || settings.randomBool()) {
                product =
                    randomOperandOrder(
                        settings, BinaryOperator.PLUS, product, generator.known(remainder));
              }
              return product;
            }));
    if (!scalar.isAbstract() && hasUsableUniform(shaderJob, scope)) {
      options.add(
          option(
              weights.knownValueDerivedFromUniform().applyAsInt(depth),
              () -> generator.derivedFromUniform(value)));
    }
    return new KnownValue(AstCloner.clone(knownValue), Choice.choose(settings, options));
  }

  public static KnownValue generateTrueByConstructionExpression(
      FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    return generateTrueByConstructionExpression(0, settings, shaderJob, scope);
  }

  public static KnownValue generateFalseByConstructionExpression(
      FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    return generateFalseByConstructionExpression(0, settings, shaderJob, scope);
  }

  /** Returns an opaque predicate that always evaluates to true. */
  public static KnownValue generateTrueByConstructionExpression(
      int depth, FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    if (!settings.goDeeper(depth)) {
      return new KnownValue(Expression.BoolLiteral.of(true), Expression.BoolLiteral.of(true));
    }
    FuzzerSettings.TrueByConstructionWeights weights = settings.trueByConstructionWeights();
    List<Choice.Option<Expression>> options = new ArrayList<>();
    options.add(
        option(weights.plainTrue().applyAsInt(depth), () -> Expression.BoolLiteral.of(true)));
    // The right operand of || is never evaluated here, so it may have side effects.
    options.add(
        option(
            weights.trueOrArbitrary().applyAsInt(depth),
            () ->
                new Expression.Binary(
                    BinaryOperator.SHORT_CIRCUIT_OR,
                    generateTrueByConstructionExpression(depth + 1, settings, shaderJob, scope),
                    arbitraryBool(depth + 1, true, settings, shaderJob, scope))));
    options.add(
        option(
            weights.arbitraryOrTrue().applyAsInt(depth),
            () ->
                new Expression.Binary(
                    BinaryOperator.SHORT_CIRCUIT_OR,
                    arbitraryBool(depth + 1, false, settings, shaderJob, scope),
                    generateTrueByConstructionExpression(depth + 1, settings, shaderJob, scope))));
    options.add(
        option(
            weights.notFalse().applyAsInt(depth),
            () ->
                new Expression.Unary(
                    UnaryOperator.LOGICAL_NOT,
                    generateFalseByConstructionExpression(depth + 1, settings, shaderJob, scope))));
    if (hasUsableUniform(shaderJob, scope)) {
      options.add(
          option(
              weights.opaqueTrueFromUniformValues().applyAsInt(depth),
              () ->
                  compareUniformWithKnownValue(
                      depth,
                      settings,
                      shaderJob,
                      scope,
                      ImmutableList.of(
                          BinaryOperator.EQUAL_EQUAL,
                          BinaryOperator.LESS_THAN_EQUAL,
                          BinaryOperator.GREATER_THAN_EQUAL))));
    }
    return new KnownValue(Expression.BoolLiteral.of(true), Choice.choose(settings, options));
  }

  /** Returns an opaque predicate that always evaluates to false. */
  public static KnownValue generateFalseByConstructionExpression(
      int depth, FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {
    if (!settings.goDeeper(depth)) {
      return new KnownValue(Expression.BoolLiteral.of(false), Expression.BoolLiteral.of(false));
    }
    FuzzerSettings.FalseByConstructionWeights weights = settings.falseByConstructionWeights();
    List<Choice.Option<Expression>> options = new ArrayList<>();
    options.add(
        option(weights.plainFalse().applyAsInt(depth), () -> Expression.BoolLiteral.of(false)));
    options.add(
        option(
            weights.falseAndArbitrary().applyAsInt(depth),
            () ->
                new Expression.Binary(
                    BinaryOperator.SHORT_CIRCUIT_AND,
                    generateFalseByConstructionExpression(depth + 1, settings, shaderJob, scope),
                    arbitraryBool(depth + 1, true, settings, shaderJob, scope))));
    options.add(
        option(
            weights.arbitraryAndFalse().applyAsInt(depth),
            () ->
                new Expression.Binary(
                    BinaryOperator.SHORT_CIRCUIT_AND,
                    arbitraryBool(depth + 1, false, settings, shaderJob, scope),
                    generateFalseByConstructionExpression(depth + 1, settings, shaderJob, scope))));
    options.add(
        option(
            weights.notTrue().applyAsInt(depth),
            () ->
                new Expression.Unary(
                    UnaryOperator.LOGICAL_NOT,
                    generateTrueByConstructionExpression(depth + 1, settings, shaderJob, scope))));
    if (hasUsableUniform(shaderJob, scope)) {
      options.add(
          option(
              weights.opaqueFalseFromUniformValues().applyAsInt(depth),
              () ->
                  compareUniformWithKnownValue(
                      depth,
                      settings,
                      shaderJob,
                      scope,
                      ImmutableList.of(
                          BinaryOperator.NOT_EQUAL,
                          BinaryOperator.LESS_THAN,
                          BinaryOperator.GREATER_THAN))));
    }
    return new KnownValue(Expression.BoolLiteral.of(false), Choice.choose(settings, options));
  }

  private static Expression arbitraryBool(
      int depth,
      boolean sideEffectsAllowed,
      FuzzerSettings settings,
      ShaderJob shaderJob,
      Scope scope) {
    return ArbitraryExpressions.generateArbitraryExpression(
        depth, Type.Scalar.BOOL, sideEffectsAllowed, settings, shaderJob, scope);
  }

  /**
   * Compares a uniform scalar with a known value equal to it, using one of {@code operators} (all
   * of which must be true for equal operands, or all false).
   */
  private static Expression compareUniformWithKnownValue(
      int depth,
      FuzzerSettings settings,
      ShaderJob shaderJob,
      Scope scope,
      ImmutableList<BinaryOperator> operators) {
    UniformScalar uniform = randomKnownScalarValueFromUniform(shaderJob, settings, scope);
    AdjustedScalar adjusted = adjust(uniform, uniform.type());
    KnownValue known =
        generateKnownValueExpression(
            depth + 1,
            literal(adjusted.value(), uniform.type()),
            uniform.type(),
            settings,
            shaderJob,
            scope);
    return randomOperandOrder(
        settings, settings.randomElement(operators), adjusted.expression(), known);
  }

  /**
   * A scalar inside a uniform buffer: an expression that reads it, and its value as a literal.
   */
  public record UniformScalar(Expression expression, Expression value, Type.Scalar type) {}

  /** An integer-valued expression derived from a uniform, and its value. */
  private record AdjustedScalar(long value, Expression expression) {}

  /** Returns true if some uniform with a usable scalar is visible in {@code scope}. */
  public static boolean hasUsableUniform(ShaderJob shaderJob, Scope scope) {
    for (int group : shaderJob.pipelineState().getUniformGroups()) {
      if (!usableBindings(shaderJob, scope, group).isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Picks a random i32, u32 or f32 scalar inside a uniform buffer, by choosing a group, a binding,
   * and then a path through the buffer's struct, array and vector types.
   */
  public static UniformScalar randomKnownScalarValueFromUniform(
      ShaderJob shaderJob, FuzzerSettings settings, Scope scope) {
    List<Integer> groups = new ArrayList<>();
    for (int group : shaderJob.pipelineState().getUniformGroups()) {
      if (!usableBindings(shaderJob, scope, group).isEmpty()) {
        groups.add(group);
      }
    }
    int group = settings.randomElement(groups);
    int binding = settings.randomElement(usableBindings(shaderJob, scope, group));
    GlobalDecl.Variable declaration = shaderJob.uniformDeclaration(group, binding);

    Type type = uniformType(shaderJob, declaration);
    Expression access = new Expression.Identifier(declaration.name());
    Expression value = shaderJob.pipelineState().getUniformValue(group, binding);
    while (true) {
      if (type instanceof Type.Scalar scalar && isUsableLeaf(scalar)) {
        return new UniformScalar(access, value, scalar);
      } else if (type instanceof Type.Vector vector) {
        int index = settings.randomInt(vector.width());
        access = new Expression.IndexLookup(access, indexLiteral(index));
        value = constructorArgs(value).get(index);
        type = vector.elementType();
      } else if (type instanceof Type.Struct struct) {
        List<Integer> memberIndices = new ArrayList<>();
        for (int i = 0; i < struct.members().size(); i++) {
          if (hasUsableLeaf(struct.members().get(i).type())) {
            memberIndices.add(i);
          }
        }
        int index = settings.randomElement(memberIndices);
        Type.Struct.Member member = struct.members().get(index);
        access = new Expression.MemberLookup(access, member.name());
        value = constructorArgs(value).get(index);
        type = member.type();
      } else if (type instanceof Type.Array array && array.elementCount() != null) {
        int index = settings.randomInt(array.elementCount());
        access = new Expression.IndexLookup(access, indexLiteral(index));
        value = constructorArgs(value).get(index);
        type = array.elementType();
      } else {
        throw new IllegalStateException("Unexpected type in uniform: " + type);
      }
    }
  }

  private static Expression indexLiteral(int index) {
    return new Expression.IntLiteral(String.valueOf(index));
  }

  private static List<Integer> usableBindings(ShaderJob shaderJob, Scope scope, int group) {
    List<Integer> result = new ArrayList<>();
    for (int binding : shaderJob.pipelineState().getUniformBindingsForGroup(group)) {
      GlobalDecl.Variable declaration = shaderJob.uniformDeclaration(group, binding);
      // The uniform may be shadowed by a local declaration.
      if (scope.getEntry(declaration.name()) instanceof ScopeEntry.GlobalVariable entry
          && entry.astNode() == declaration
          && hasUsableLeaf(uniformType(shaderJob, declaration))) {
        result.add(binding);
      }
    }
    return result;
  }

  private static Type uniformType(ShaderJob shaderJob, GlobalDecl.Variable declaration) {
    if (shaderJob.environment().globalScope().getEntry(declaration.name())
        instanceof ScopeEntry.GlobalVariable entry) {
      return entry.type().asStoreTypeIfReference();
    }
    throw new IllegalStateException("Uniform " + declaration.name() + " is not in global scope");
  }

  private static boolean isUsableLeaf(Type.Scalar scalar) {
    return scalar == Type.Scalar.I32 || scalar == Type.Scalar.U32 || scalar == Type.Scalar.F32;
  }

  private static boolean hasUsableLeaf(Type type) {
    if (type instanceof Type.Scalar scalar) {
      return isUsableLeaf(scalar);
    } else if (type instanceof Type.Vector vector) {
      return isUsableLeaf(vector.elementType());
    } else if (type instanceof Type.Struct struct) {
      return struct.members().stream().anyMatch(m -> hasUsableLeaf(m.type()));
    } else if (type instanceof Type.Array array) {
      Integer count = array.elementCount();
      return count != null && count > 0 && hasUsableLeaf(array.elementType());
    }
    return false;
  }

  private static ImmutableList<Expression> constructorArgs(Expression value) {
    if (value instanceof Expression.ValueConstructor constructor) {
      return constructor.args();
    }
    throw new IllegalStateException("Uniform value does not match its type: " + value);
  }

  /**
   * Converts a uniform scalar to an integer-valued expression of type {@code outputType} whose
   * value lies in {@code [0, 2^24]}. Out-of-range values are first folded with {@code abs(x) %
   * 2^24} in the uniform's own type; the result is then converted (which truncates floats) or, if
   * no conversion is needed, truncated with {@code trunc}.
   */
  private static AdjustedScalar adjust(UniformScalar uniform, Type.Scalar outputType) {
    double raw = numericValue(uniform.value());
    if (!Double.isFinite(raw)) {
      throw new UnsupportedOperationException("Non-finite uniform value " + uniform.value());
    }
    Type.Scalar sourceType = uniform.type();
    Expression expression = uniform.expression();
    double value;
    switch (sourceType) {
      case F32 -> {
        float f = (float) raw;
        if (!inRange(truncate(f))) {
          expression = fold(expression, sourceType);
          f = Math.abs(f) % LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE;
        }
        value = f;
      }
      case I32 -> {
        int i = (int) raw;
        if (!inRange(i)) {
          expression = fold(expression, sourceType);
          // Math.abs(Integer.MIN_VALUE) wraps exactly as WGSL's abs does.
          i = Math.abs(i) % LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE;
        }
        value = i;
      }
      case U32 -> {
        long u = (long) raw;
        if (!inRange(u)) {
          expression = fold(expression, sourceType);
          u = u % LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE;
        }
        value = u;
      }
      default -> throw new IllegalStateException("Unexpected uniform scalar type " + sourceType);
    }
    if (outputType == sourceType) {
      if (value != truncate(value)) {
        expression = Expression.FunctionCall.of("trunc", expression);
      }
    } else {
      // Conversions to integer types truncate; conversions of integers to f32 are exact here.
      expression =
          Expression.ScalarValueConstructor.of(Type.scalarTypeDecl(outputType), expression);
    }
    long result = (long) truncate(value);
    if (!inRange(result)) {
      throw new AssertionError("Adjusted uniform value out of range: " + result);
    }
    return new AdjustedScalar(result, expression);
  }

  private static Expression fold(Expression expression, Type.Scalar type) {
    return new Expression.Paren(
        new Expression.Binary(
            BinaryOperator.MODULO,
            Expression.FunctionCall.of("abs", expression),
            literal(LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE, type)));
  }

  private static boolean inRange(double value) {
    return value >= 0 && value <= LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE;
  }

  private static double truncate(double value) {
    return value < 0 ? Math.ceil(value) : Math.floor(value);
  }

  /**
   * Returns a literal of the given type with the given non-negative value, e.g. {@code 7i},
   * {@code 7u}, {@code 7f} or {@code 7.0}.
   */
  public static Expression literal(long value, Type.Scalar type) {
    return switch (type) {
      case ABSTRACT_INT -> new Expression.IntLiteral(String.valueOf(value));
      case I32 -> new Expression.IntLiteral(value + "i");
      case U32 -> new Expression.IntLiteral(value + "u");
      case ABSTRACT_FLOAT -> new Expression.FloatLiteral(value + ".0");
      case F32 -> new Expression.FloatLiteral(value + "f");
      case BOOL, F16 ->
          throw new UnsupportedOperationException("No numeric literal of type " + type);
    };
  }

  /**
   * Returns a constant of {@code type} in which every scalar has the given value: a literal for a
   * scalar type, or a constructor of such literals for a vector, matrix, fixed-size array or
   * struct.
   *
   * @throws UnsupportedOperationException for types that cannot be constructed, such as
   *     runtime-sized arrays, atomics, pointers, samplers and textures
   */
  public static Expression constantWithSameValueEverywhere(int value, Type type) {
    if (type instanceof Type.Scalar scalar) {
      return switch (scalar) {
        case BOOL -> Expression.BoolLiteral.of(value != 0);
        case ABSTRACT_FLOAT -> new Expression.FloatLiteral(value + ".0");
        case F16 -> new Expression.FloatLiteral(value + ".0h");
        case F32 -> new Expression.FloatLiteral(value + ".0f");
        case ABSTRACT_INT -> new Expression.IntLiteral(String.valueOf(value));
        case I32 -> new Expression.IntLiteral(value + "i");
        case U32 -> new Expression.IntLiteral(value + "u");
      };
    } else if (type instanceof Type.Vector vector) {
      ImmutableList.Builder<Expression> args = ImmutableList.builder();
      for (int i = 0; i < vector.width(); i++) {
        args.add(constantWithSameValueEverywhere(value, vector.elementType()));
      }
      return new Expression.VectorValueConstructor(
          vector.width(),
          vector.elementType().isAbstract() ? null : Type.scalarTypeDecl(vector.elementType()),
          args.build());
    } else if (type instanceof Type.Matrix matrix) {
      ImmutableList.Builder<Expression> columns = ImmutableList.builder();
      for (int i = 0; i < matrix.numCols(); i++) {
        columns.add(constantWithSameValueEverywhere(value, matrix.columnType()));
      }
      return new Expression.MatrixValueConstructor(
          matrix.numCols(),
          matrix.numRows(),
          matrix.elementType().isAbstract() ? null : Type.scalarTypeDecl(matrix.elementType()),
          columns.build());
    } else if (type instanceof Type.Array array && array.elementCount() != null) {
      int count = array.elementCount();
      ImmutableList.Builder<Expression> elements = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        elements.add(constantWithSameValueEverywhere(value, array.elementType()));
      }
      return new Expression.ArrayValueConstructor(
          array.elementType().toTypeDecl(),
          new Expression.IntLiteral(count + "u"),
          elements.build());
    } else if (type instanceof Type.Struct struct) {
      ImmutableList.Builder<Expression> members = ImmutableList.builder();
      for (Type.Struct.Member member : struct.members()) {
        members.add(constantWithSameValueEverywhere(value, member.type()));
      }
      return new Expression.StructValueConstructor(struct.name(), members.build());
    }
    throw new UnsupportedOperationException("Constant construction not supported for type " + type);
  }

  /** Returns the value of a numeric literal, possibly negated or parenthesized. */
  public static double numericValue(Expression expression) {
    if (expression instanceof Expression.IntLiteral literal) {
      return StringUtil.parseIntegerLiteral(literal.text());
    } else if (expression instanceof Expression.FloatLiteral literal) {
      return StringUtil.parseFloatLiteral(literal.text());
    } else if (expression instanceof Expression.Paren paren) {
      return numericValue(paren.target());
    } else if (expression instanceof Expression.Unary unary
        && unary.operator() == UnaryOperator.MINUS) {
      return -numericValue(unary.target());
    }
    throw new IllegalArgumentException("Not a numeric literal: " + expression);
  }

  private static long knownIntegerValue(Expression knownValue) {
    double value = numericValue(knownValue);
    checkArgument(
        value == Math.rint(value) && inRange(value),
        "Known value %s is not an integer in [0, %s]",
        knownValue,
        LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE);
    return (long) value;
  }

  /** Returns {@code a op b} or {@code b op a}, with equal probability. */
  static Expression randomOperandOrder(
      FuzzerSettings settings, BinaryOperator operator, Expression a, Expression b) {
    return settings.randomBool()
        ? new Expression.Binary(operator, a, b)
        : new Expression.Binary(operator, b, a);
  }

  /** Recursion helper for numeric known values of one type. */
  private record NumericKnownValues(
      int depth, Type.Scalar type, FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {

    KnownValue known(long value) {
      return generateKnownValueExpression(
          depth + 1, literal(value, type), type, settings, shaderJob, scope);
    }

    Expression derivedFromUniform(long value) {
      UniformScalar uniform = randomKnownScalarValueFromUniform(shaderJob, settings, scope);
      AdjustedScalar adjusted = adjust(uniform, type);
      if (adjusted.value() == value) {
        return adjusted.expression();
      } else if (adjusted.value() > value) {
        return new Expression.Binary(
            BinaryOperator.MINUS, adjusted.expression(), known(adjusted.value() - value));
      } else {
        return randomOperandOrder(
            settings, BinaryOperator.PLUS, adjusted.expression(), known(value - adjusted.value()));
      }
    }
  }

  private KnownValues() {}
}
