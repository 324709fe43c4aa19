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
import org.jspecify.annotations.Nullable;

/**
 * Expressions. Literals keep their source text (including any {@code i}, {@code u}, {@code f} or
 * {@code h} suffix), since the suffix determines the literal's type.
 *
 * <p>{@link AugmentedExpression} adds the synthetic expressions created by transformations.
 */
public sealed interface Expression extends AstNode
    permits Expression.BoolLiteral,
        Expression.IntLiteral,
        Expression.FloatLiteral,
        Expression.Identifier,
        Expression.Paren,
        Expression.Unary,
        Expression.Binary,
        Expression.FunctionCall,
        Expression.ValueConstructor,
        Expression.MemberLookup,
        Expression.IndexLookup,
        AugmentedExpression {

  record BoolLiteral(String text) implements Expression {
    public static BoolLiteral of(boolean value) {
      return new BoolLiteral(String.valueOf(value));
    }

    public boolean value() {
      return text.equals("true");
    }
  }

  record IntLiteral(String text) implements Expression {}

  record FloatLiteral(String text) implements Expression {}

  record Identifier(String name) implements Expression {}

  record Paren(Expression target, ImmutableSet<Metadata> metadata) implements Expression {
    public Paren(Expression target) {
      this(target, ImmutableSet.of());
    }
  }

  record Unary(UnaryOperator operator, Expression target) implements Expression {}

  record Binary(
      BinaryOperator operator, Expression lhs, Expression rhs, ImmutableSet<Metadata> metadata)
      implements Expression {
    public Binary(BinaryOperator operator, Expression lhs, Expression rhs) {
      this(operator, lhs, rhs, ImmutableSet.of());
    }
  }

  /**
   * A call to a user-defined or built-in function that yields a value, e.g. {@code abs(x)} or
   * {@code bitcast<u32>(x)}.
   */
  record FunctionCall(
      String callee, @Nullable TypeDecl templateParameter, ImmutableList<Expression> args)
      implements Expression {
    public static FunctionCall of(String callee, Expression... args) {
      return new FunctionCall(callee, null, ImmutableList.copyOf(args));
    }
  }

  /** Type constructors: {@code i32(x)}, {@code vec3<f32>(a, b, c)}, {@code S(1, 2)}, ... */
  sealed interface ValueConstructor extends Expression {
    ImmutableList<Expression> args();
  }

  /** {@code bool(e)}, {@code i32(e)}, {@code u32(e)}, {@code f16(e)} or {@code f32(e)}. */
  record ScalarValueConstructor(
      TypeDecl.ScalarTypeDecl scalarType, ImmutableList<Expression> args)
      implements ValueConstructor {
    public static ScalarValueConstructor of(TypeDecl.ScalarTypeDecl type, Expression... args) {
      return new ScalarValueConstructor(type, ImmutableList.copyOf(args));
    }
  }

  /** {@code vecN(...)} or {@code vecN<T>(...)}; the element type is null when inferred. */
  record VectorValueConstructor(
      int width, TypeDecl.@Nullable ScalarTypeDecl elementType, ImmutableList<Expression> args)
      implements ValueConstructor {
    public static VectorValueConstructor of(
        int width, TypeDecl.ScalarTypeDecl elementType, Expression... args) {
      return new VectorValueConstructor(width, elementType, ImmutableList.copyOf(args));
    }
  }

  record MatrixValueConstructor(
      int numCols,
      int numRows,
      TypeDecl.@Nullable ScalarTypeDecl elementType,
      ImmutableList<Expression> args)
      implements ValueConstructor {}

  record StructValueConstructor(String structName, ImmutableList<Expression> args)
      implements ValueConstructor {
    public static StructValueConstructor of(String structName, Expression... args) {
      return new StructValueConstructor(structName, ImmutableList.copyOf(args));
    }
  }

  record TypeAliasValueConstructor(String typeName, ImmutableList<Expression> args)
      implements ValueConstructor {}

  record ArrayValueConstructor(
      @Nullable TypeDecl elementType,
      @Nullable Expression elementCount,
      ImmutableList<Expression> args)
      implements ValueConstructor {}

  /** {@code receiver.memberName}; also used for vector swizzles such as {@code v.xy}. */
  record MemberLookup(Expression receiver, String memberName) implements Expression {}

  record IndexLookup(Expression target, Expression index) implements Expression {}
}
