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

package org.wgslmorph.resolve;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AccessMode;
import org.wgslmorph.ast.AddressSpace;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.TypeDecl;

/**
 * Types as computed by the resolver. Unlike {@link TypeDecl} these are semantic: aliases have been
 * expanded, abstract numeric types are explicit, and a declared variable has a {@link Reference}
 * type.
 *
 * <p>All implementations compare structurally.
 */
public sealed interface Type {

  enum Scalar implements Type {
    BOOL("bool"),
    ABSTRACT_INT("AbstractInt"),
    I32("i32"),
    U32("u32"),
    ABSTRACT_FLOAT("AbstractFloat"),
    F16("f16"),
    F32("f32");

    public final String wgslName;

    Scalar(String wgslName) {
      this.wgslName = wgslName;
    }

    public boolean isInteger() {
      return this == ABSTRACT_INT || this == I32 || this == U32;
    }

    public boolean isFloat() {
      return this == ABSTRACT_FLOAT || this == F16 || this == F32;
    }

    public boolean isAbstract() {
      return this == ABSTRACT_INT || this == ABSTRACT_FLOAT;
    }

    /** Returns the concrete type an abstract value of this type converts to by default. */
    public Scalar concretize() {
      return switch (this) {
        case ABSTRACT_INT -> I32;
        case ABSTRACT_FLOAT -> F32;
        default -> this;
      };
    }
  }

  /** The type of a reference to a memory location, e.g. of an identifier naming a variable. */
  record Reference(Type storeType, AddressSpace addressSpace, AccessMode accessMode)
      implements Type {}

  record Vector(int width, Scalar elementType) implements Type {}

  record Matrix(int numCols, int numRows, Scalar elementType) implements Type {
    public Vector columnType() {
      return new Vector(numRows, elementType);
    }
  }

  /** A fixed-size array, or a runtime-sized one if {@code elementCount} is null. */
  record Array(Type elementType, @Nullable Integer elementCount) implements Type {}

  record Pointer(Type pointeeType, AddressSpace addressSpace, AccessMode accessMode)
      implements Type {}

  record Struct(String name, ImmutableList<Member> members) implements Type {
    public record Member(String name, Type type) {}
  }

  record Atomic(Scalar targetType) implements Type {}

  record Sampler(boolean comparison) implements Type {}

  /** Any texture type; only the name matters to this package. */
  record Texture(String wgslName) implements Type {}

  /** Returns the store type if this is a reference, otherwise this type. */
  default Type asStoreTypeIfReference() {
    return this instanceof Reference reference ? reference.storeType() : this;
  }

  /**
   * Returns the type with abstract scalars replaced by their default concrete types, or null if
   * this type cannot be written as the type of a function-scope variable.
   */
  default @Nullable Type concretize() {
    if (this instanceof Scalar scalar) {
      return scalar.concretize();
    } else if (this instanceof Vector vector) {
      return new Vector(vector.width(), vector.elementType().concretize());
    } else if (this instanceof Matrix matrix) {
      return new Matrix(matrix.numCols(), matrix.numRows(), matrix.elementType().concretize());
    }
    return null;
  }

  /** Returns a type declaration that denotes this (concrete) type. */
  default TypeDecl toTypeDecl() {
    if (this instanceof Scalar scalar) {
      return scalarTypeDecl(scalar);
    } else if (this instanceof Vector vector) {
      return new TypeDecl.Vector(vector.width(), scalarTypeDecl(vector.elementType()));
    } else if (this instanceof Matrix matrix) {
      return new TypeDecl.Matrix(
          matrix.numCols(), matrix.numRows(), scalarTypeDecl(matrix.elementType()));
    } else if (this instanceof Array array) {
      Integer count = array.elementCount();
      return new TypeDecl.Array(
          array.elementType().toTypeDecl(),
          count == null ? null : new Expression.IntLiteral(count + "u"));
    } else if (this instanceof Struct struct) {
      return new TypeDecl.NamedType(struct.name());
    } else if (this instanceof Atomic atomic) {
      return new TypeDecl.Atomic(scalarTypeDecl(atomic.targetType()));
    } else if (this instanceof Pointer pointer) {
      return new TypeDecl.Pointer(
          pointer.addressSpace(), pointer.pointeeType().toTypeDecl(), pointer.accessMode());
    }
    throw new UnsupportedOperationException("No type declaration for " + this);
  }

  static TypeDecl.ScalarTypeDecl scalarTypeDecl(Scalar scalar) {
    return switch (scalar) {
      case BOOL -> new TypeDecl.Bool();
      case I32 -> new TypeDecl.I32();
      case U32 -> new TypeDecl.U32();
      case F16 -> new TypeDecl.F16();
      case F32 -> new TypeDecl.F32();
      case ABSTRACT_INT, ABSTRACT_FLOAT ->
          throw new UnsupportedOperationException("Abstract types cannot be written: " + scalar);
    };
  }
}
