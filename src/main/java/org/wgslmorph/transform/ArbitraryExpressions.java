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
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AddressSpace;
import org.wgslmorph.ast.AstCloner;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.AstTraversal;
import org.wgslmorph.ast.AugmentedExpression.ArbitraryExpression;
import org.wgslmorph.ast.AugmentedExpression.KnownValue;
import org.wgslmorph.ast.BinaryOperator;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.UnaryOperator;
import org.wgslmorph.resolve.Scope;
import org.wgslmorph.resolve.ScopeEntry;
import org.wgslmorph.resolve.ShaderJob;
import org.wgslmorph.resolve.Type;

/**
 * Generates expressions of a required type whose value does not matter. They are used in places
 * that are never executed, or whose value is never observed.
 *
 * <p>Booleans, i32 and u32 get recursively built expressions over literals, variables in scope,
 * operators and built-in functions. An f32 is a known value of some random integer, with the
 * known-value tags stripped. Every other type gets the constant 1 broadcast through the type.
 */
public final class ArbitraryExpressions {

  private static final long I32_LOWEST_LITERAL = -(1L << 31) + 1;
  private static final long I32_HIGHEST_LITERAL = (1L << 31) - 1;
  private static final long U32_HIGHEST_LITERAL = (1L << 32) - 1;
  private static final int BIT_WIDTH = 32;

  private static final ImmutableSet<BinaryOperator> ARITHMETIC =
      Sets.immutableEnumSet(BinaryOperator.PLUS, BinaryOperator.MINUS, BinaryOperator.TIMES);

  /**
   * Returns an {@link ArbitraryExpression} of type {@code type} that is well-typed in {@code
   * scope}.
   *
   * @param sideEffectsAllowed whether the expression may have side effects; true only where the
   *     expression is never evaluated. The generated expressions never call user functions or
   *     assign, so they are side-effect free either way.
   */
  public static ArbitraryExpression generateArbitraryExpression(
      int depth,
      Type type,
      boolean sideEffectsAllowed,
      FuzzerSettings settings,
      ShaderJob shaderJob,
      Scope scope) {
    return new ArbitraryExpression(
        new Generator(settings, shaderJob, scope).generate(depth, type));
  }

  /**
   * Returns an expression that reads a value of type {@code type} out of some variable, parameter
   * or constant in {@code scope}, navigating into arrays, vectors, matrices and structs, or null if
   * there is none.
   *
   * <p>Entries that pointers in scope might alias are never read, nor are workgroup variables or
   * write-only storage.
   */
  public static @Nullable Expression randomVariableFromScope(
      Scope scope, Type type, FuzzerSettings settings) {
    Set<Type> pointeeTypes = new LinkedHashSet<>();
    for (ScopeEntry entry : scope.getAllEntries()) {
      if (entry instanceof ScopeEntry.TypedDecl typed && isValueEntry(typed)) {
        for (Type component : componentTypes(typed.type(), t -> true)) {
          if (component instanceof Type.Pointer pointer) {
            pointeeTypes.add(pointer.pointeeType());
          }
        }
      }
    }

    List<ScopeEntry.TypedDecl> candidates = new ArrayList<>();
    for (ScopeEntry entry : scope.getAllEntries()) {
      if (!(entry instanceof ScopeEntry.TypedDecl typed) || !isValueEntry(typed)) {
        continue;
      }
      if (typed.type() instanceof Type.Reference reference
          && (reference.addressSpace() == AddressSpace.WORKGROUP
              || !reference.accessMode().canRead())) {
        continue;
      }
      Set<Type> components = componentTypes(typed.type(), t -> true);
      if (components.stream().anyMatch(pointeeTypes::contains)) {
        continue;
      }
      if (componentTypes(typed.type().asStoreTypeIfReference(), ArbitraryExpressions::isReadable)
          .contains(type)) {
        candidates.add(typed);
      }
    }
    if (candidates.isEmpty()) {
      return null;
    }
    ScopeEntry.TypedDecl chosen = settings.randomElement(candidates);
    Expression result =
        navigateToType(
            new Expression.Identifier(chosen.declName()), chosen.type(), type, settings);
    if (result == null) {
      throw new AssertionError("No component of type " + type + " in " + chosen.type());
    }
    return result;
  }

  private static boolean isValueEntry(ScopeEntry.TypedDecl entry) {
    return !(entry instanceof ScopeEntry.TypeAlias) && !(entry instanceof ScopeEntry.Struct);
  }

  private static boolean isReadable(Type type) {
    if (type instanceof Type.Array array) {
      return array.elementCount() != null;
    } else if (type instanceof Type.Pointer pointer) {
      return pointer.accessMode().canRead();
    }
    return true;
  }

  private static @Nullable Expression navigateToType(
      Expression expression, Type expressionType, Type requiredType, FuzzerSettings settings) {
    if (expressionType.equals(requiredType)) {
      return expression;
    }
    if (expressionType instanceof Type.Array array) {
      Integer count = array.elementCount();
      if (count == null || count == 0) {
        return null;
      }
      return navigateToType(
          new Expression.IndexLookup(expression, indexLiteral(settings.randomInt(count))),
          array.elementType(),
          requiredType,
          settings);
    } else if (expressionType instanceof Type.Vector vector) {
      return navigateToType(
          new Expression.IndexLookup(expression, indexLiteral(settings.randomInt(vector.width()))),
          vector.elementType(),
          requiredType,
          settings);
    } else if (expressionType instanceof Type.Matrix matrix) {
      return navigateToType(
          new Expression.IndexLookup(
              expression, indexLiteral(settings.randomInt(matrix.numCols()))),
          matrix.columnType(),
          requiredType,
          settings);
    } else if (expressionType instanceof Type.Struct struct) {
      List<Type.Struct.Member> members = new ArrayList<>(struct.members());
      settings.shuffle(members);
      for (Type.Struct.Member member : members) {
        Expression result =
            navigateToType(
                new Expression.MemberLookup(expression, member.name()),
                member.type(),
                requiredType,
                settings);
        if (result != null) {
          return result;
        }
      }
      return null;
    } else if (expressionType instanceof Type.Reference reference) {
      return navigateToType(expression, reference.storeType(), requiredType, settings);
    } else if (expressionType instanceof Type.Pointer pointer) {
      return navigateToType(
          new Expression.Unary(UnaryOperator.DEREFERENCE, expression),
          pointer.pointeeType(),
          requiredType,
          settings);
    }
    return null;
  }

  private static Expression indexLiteral(int index) {
    return new Expression.IntLiteral(String.valueOf(index));
  }

  /**
   * Returns {@code type} and every type reachable from it through element, column, member,
   * pointee and store types, stopping at types that fail {@code predicate}.
   */
  static Set<Type> componentTypes(Type type, Predicate<Type> predicate) {
    Set<Type> result = new LinkedHashSet<>();
    addComponentTypes(type, predicate, result);
    return result;
  }

  private static void addComponentTypes(Type type, Predicate<Type> predicate, Set<Type> result) {
    if (!predicate.test(type)) {
      return;
    }
    result.add(type);
    if (type instanceof Type.Array array) {
      addComponentTypes(array.elementType(), predicate, result);
    } else if (type instanceof Type.Matrix matrix) {
      addComponentTypes(matrix.columnType(), predicate, result);
    } else if (type instanceof Type.Vector vector) {
      addComponentTypes(vector.elementType(), predicate, result);
    } else if (type instanceof Type.Struct struct) {
      for (Type.Struct.Member member : struct.members()) {
        addComponentTypes(member.type(), predicate, result);
      }
    } else if (type instanceof Type.Pointer pointer) {
      addComponentTypes(pointer.pointeeType(), predicate, result);
    } else if (type instanceof Type.Reference reference) {
      addComponentTypes(reference.storeType(), predicate, result);
    } else if (type instanceof Type.Atomic atomic) {
      addComponentTypes(atomic.targetType(), predicate, result);
    }
  }

  /** Recursive generation state that stays fixed for one top-level request. */
  private record Generator(FuzzerSettings settings, ShaderJob shaderJob, Scope scope) {

    Expression generate(int depth, Type type) {
      if (type == Type.Scalar.BOOL) {
        return bool(depth);
      } else if (type == Type.Scalar.I32 || type == Type.Scalar.U32) {
        return integer(depth, (Type.Scalar) type);
      } else if (type == Type.Scalar.F32) {
        return float32(depth);
      }
      return KnownValues.constantWithSameValueEverywhere(1, type);
    }

    private Expression bool(int depth) {
      FuzzerSettings.ArbitraryBooleanExpressionWeights weights =
          settings.arbitraryBooleanExpressionWeights();
      List<Choice.Option<Expression>> options = new ArrayList<>();
      options.add(
          option(
              weights.literal().applyAsInt(depth),
              () -> Expression.BoolLiteral.of(settings.randomBool())));
      Expression variable = randomVariableFromScope(scope, Type.Scalar.BOOL, settings);
      if (variable != null) {
        options.add(option(weights.variableFromScope().applyAsInt(depth), () -> variable));
      }
      if (settings.goDeeper(depth)) {
        options.add(
            option(
                weights.not().applyAsInt(depth),
                () ->
                    new Expression.Paren(
                        new Expression.Unary(UnaryOperator.LOGICAL_NOT, bool(depth + 1)))));
        options.add(
            option(
                weights.or().applyAsInt(depth),
                () -> boolBinary(depth, BinaryOperator.SHORT_CIRCUIT_OR)));
        options.add(
            option(
                weights.and().applyAsInt(depth),
                () -> boolBinary(depth, BinaryOperator.SHORT_CIRCUIT_AND)));
        options.add(
            option(
                weights.lessThan().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.LESS_THAN)));
        options.add(
            option(
                weights.greaterThan().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.GREATER_THAN)));
        options.add(
            option(
                weights.lessThanOrEqual().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.LESS_THAN_EQUAL)));
        options.add(
            option(
                weights.greaterThanOrEqual().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.GREATER_THAN_EQUAL)));
        options.add(
            option(
                weights.equal().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.EQUAL_EQUAL)));
        options.add(
            option(
                weights.notEqual().applyAsInt(depth),
                () -> intComparison(depth, BinaryOperator.NOT_EQUAL)));
      }
      return Choice.choose(settings, options);
    }

    private Expression boolBinary(int depth, BinaryOperator operator) {
      return new Expression.Paren(
          new Expression.Binary(operator, bool(depth + 1), bool(depth + 1)));
    }

    private Expression intComparison(int depth, BinaryOperator operator) {
      Type.Scalar type = settings.randomElement(Type.Scalar.I32, Type.Scalar.U32);
      return new Expression.Paren(
          new Expression.Binary(operator, integer(depth + 1, type), integer(depth + 1, type)));
    }

    private Expression integer(int depth, Type.Scalar type) {
      FuzzerSettings.ArbitraryIntExpressionWeights weights =
          settings.arbitraryIntExpressionWeights();
      List<Choice.Option<Expression>> options = new ArrayList<>();
      options.add(option(weights.literal().applyAsInt(depth), () -> intLiteral(type)));
      Expression variable = randomVariableFromScope(scope, type, settings);
      if (variable != null) {
        options.add(option(weights.variableFromScope().applyAsInt(depth), () -> variable));
      }
      if (settings.goDeeper(depth)) {
        addRecursiveIntOptions(depth, type, weights, options);
      }
      return Choice.choose(settings, options);
    }

    private void addRecursiveIntOptions(
        int depth,
        Type.Scalar type,
        FuzzerSettings.ArbitraryIntExpressionWeights weights,
        List<Choice.Option<Expression>> options) {
      boolean signed = type == Type.Scalar.I32;
      Type.Scalar otherType = signed ? Type.Scalar.U32 : Type.Scalar.I32;
      options.add(
          option(
              weights.swapIntType().applyAsInt(depth),
              () ->
                  Expression.ScalarValueConstructor.of(
                      Type.scalarTypeDecl(type), integer(depth + 1, otherType))));
      options.add(
          option(
              weights.binaryOr().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.BINARY_OR)));
      options.add(
          option(
              weights.binaryAnd().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.BINARY_AND)));
      options.add(
          option(
              weights.binaryXor().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.BINARY_XOR)));
      if (signed) {
        options.add(
            option(
                weights.negate().applyAsInt(depth),
                () ->
                    new Expression.Paren(
                        new Expression.Unary(UnaryOperator.MINUS, integer(depth + 1, type)))));
      }
      options.add(
          option(
              weights.addition().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.PLUS)));
      options.add(
          option(
              weights.subtraction().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.MINUS)));
      options.add(
          option(
              weights.multiplication().applyAsInt(depth),
              () -> intBinary(depth, type, BinaryOperator.TIMES)));
      // The divisor is a known positive value, so there is no division by zero.
      options.add(
          option(
              weights.division().applyAsInt(depth),
              () -> divisionLike(depth, type, BinaryOperator.DIVIDE)));
      options.add(
          option(
              weights.modulo().applyAsInt(depth),
              () -> divisionLike(depth, type, BinaryOperator.MODULO)));
      options.add(option(weights.abs().applyAsInt(depth), () -> call(depth, type, "abs", 1)));
      options.add(option(weights.clamp().applyAsInt(depth), () -> clamp(depth, type)));
      options.add(
          option(
              weights.countLeadingZeros().applyAsInt(depth),
              () -> call(depth, type, "countLeadingZeros", 1)));
      options.add(
          option(
              weights.countOneBits().applyAsInt(depth),
              () -> call(depth, type, "countOneBits", 1)));
      options.add(
          option(
              weights.countTrailingZeros().applyAsInt(depth),
              () -> call(depth, type, "countTrailingZeros", 1)));
      if (signed) {
        options.add(
            option(
                weights.dot4I8Packed().applyAsInt(depth),
                () -> call(depth, Type.Scalar.U32, "dot4I8Packed", 2)));
      } else {
        options.add(
            option(
                weights.dot4U8Packed().applyAsInt(depth),
                () -> call(depth, Type.Scalar.U32, "dot4U8Packed", 2)));
      }
      options.add(
          option(weights.extractBits().applyAsInt(depth), () -> bitField(depth, type, false)));
      options.add(
          option(
              weights.firstLeadingBit().applyAsInt(depth),
              () -> call(depth, type, "firstLeadingBit", 1)));
      options.add(
          option(
              weights.firstTrailingBit().applyAsInt(depth),
              () -> call(depth, type, "firstTrailingBit", 1)));
      options.add(
          option(weights.insertBits().applyAsInt(depth), () -> bitField(depth, type, true)));
      options.add(option(weights.max().applyAsInt(depth), () -> call(depth, type, "max", 2)));
      options.add(option(weights.min().applyAsInt(depth), () -> call(depth, type, "min", 2)));
      options.add(
          option(
              weights.reverseBits().applyAsInt(depth),
              () -> call(depth, type, "reverseBits", 1)));
      if (signed) {
        options.add(
            option(weights.sign().applyAsInt(depth), () -> call(depth, type, "sign", 1)));
      }
    }

    private Expression intLiteral(Type.Scalar type) {
      if (type == Type.Scalar.U32) {
        return new Expression.IntLiteral(
            settings.randomLongInRange(0, U32_HIGHEST_LITERAL) + "u");
      }
      long value = settings.randomLongInRange(I32_LOWEST_LITERAL, I32_HIGHEST_LITERAL);
      if (value < 0) {
        return new Expression.Paren(
            new Expression.Unary(UnaryOperator.MINUS, new Expression.IntLiteral(-value + "i")));
      }
      return new Expression.IntLiteral(value + "i");
    }

    /**
     * {@code lhs op rhs}. Constant evaluation rejects an overflowing {@code +}, {@code -} or
     * {@code *}, so when neither operand reads a runtime value a bitwise operator is used instead.
     */
    private Expression intBinary(int depth, Type.Scalar type, BinaryOperator operator) {
      Expression lhs = integer(depth + 1, type);
      Expression rhs = integer(depth + 1, type);
      if (ARITHMETIC.contains(operator) && !readsRuntimeValue(lhs) && !readsRuntimeValue(rhs)) {
        operator =
            settings.randomElement(
                BinaryOperator.BINARY_OR, BinaryOperator.BINARY_AND, BinaryOperator.BINARY_XOR);
      }
      return new Expression.Paren(new Expression.Binary(operator, lhs, rhs));
    }

    /**
     * Returns true if {@code expression} names a parameter, a variable or a {@code let}, which
     * keeps it out of constant and override evaluation.
     */
    private boolean readsRuntimeValue(Expression expression) {
      for (AstNode node : AstTraversal.nodesPreOrder(expression)) {
        if (node instanceof Expression.Identifier identifier) {
          ScopeEntry entry = scope.getEntry(identifier.name());
          if (entry instanceof ScopeEntry.Parameter
              || entry instanceof ScopeEntry.LocalVariable
              || entry instanceof ScopeEntry.GlobalVariable
              || (entry instanceof ScopeEntry.LocalValue value && !value.astNode().isConst())) {
            return true;
          }
        }
      }
      return false;
    }

    private Expression divisionLike(int depth, Type.Scalar type, BinaryOperator operator) {
      long divisor =
          settings.randomLongInRange(1, KnownValues.LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE);
      return new Expression.Paren(
          new Expression.Binary(operator, integer(depth + 1, type), known(depth, divisor, type)));
    }

    /** A call to {@code callee} with {@code arity} arbitrary arguments of {@code argType}. */
    private Expression call(int depth, Type.Scalar argType, String callee, int arity) {
      Expression[] args = new Expression[arity];
      for (int i = 0; i < arity; i++) {
        args[i] = integer(depth + 1, argType);
      }
      return Expression.FunctionCall.of(callee, args);
    }

    private Expression clamp(int depth, Type.Scalar type) {
      long maxValue =
          settings.randomLongInRange(0, KnownValues.LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE);
      Expression max = known(depth, maxValue, type);
      Expression min = known(depth, settings.randomLongInRange(0, maxValue), type);
      return Expression.FunctionCall.of("clamp", integer(depth + 1, type), min, max);
    }

    /** {@code extractBits(e, offset, count)} or {@code insertBits(e, newBits, offset, count)}. */
    private Expression bitField(int depth, Type.Scalar type, boolean insert) {
      long count = settings.randomLongInRange(1, BIT_WIDTH);
      Expression countExpression = known(depth, count, Type.Scalar.U32);
      Expression offset =
          known(depth, settings.randomLongInRange(0, BIT_WIDTH - count), Type.Scalar.U32);
      return insert
          ? Expression.FunctionCall.of(
              "insertBits",
              integer(depth + 1, type),
              integer(depth + 1, type),
              offset,
              countExpression)
          : Expression.FunctionCall.of(
              "extractBits", integer(depth + 1, type), offset, countExpression);
    }

    private Expression known(int depth, long value, Type.Scalar type) {
      return KnownValues.generateKnownValueExpression(
          depth + 1, KnownValues.literal(value, type), type, settings, shaderJob, scope);
    }

    /**
     * Builds a known value of a random integer and then forgets that its value is known, so that
     * later passes treat it as arbitrary.
     */
    private Expression float32(int depth) {
      KnownValue known =
          KnownValues.generateKnownValueExpression(
              depth,
              KnownValues.literal(
                  settings.randomInt(KnownValues.LARGEST_INTEGER_IN_PRECISE_FLOAT_RANGE + 1),
                  Type.Scalar.F32),
              Type.Scalar.F32,
              settings,
              shaderJob,
              scope);
      return AstCloner.clone(known.expression(), ArbitraryExpressions::forgetKnownValue);
    }
  }

  private static @Nullable AstNode forgetKnownValue(AstNode node) {
    if (node instanceof KnownValue known) {
      return new ArbitraryExpression(
          AstCloner.clone(known.expression(), ArbitraryExpressions::forgetKnownValue));
    }
    return null;
  }

  private ArbitraryExpressions() {}
}
