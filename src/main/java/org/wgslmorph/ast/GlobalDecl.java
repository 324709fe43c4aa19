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
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** Module-scope declarations. */
public sealed interface GlobalDecl extends AstNode {

  /** {@code const name: type = initializer;} */
  record Constant(String name, @Nullable TypeDecl type, Expression initializer)
      implements GlobalDecl {}

  /** {@code @id(n) override name: type = initializer;} */
  record OverrideConstant(
      ImmutableList<Attribute> attributes,
      String name,
      @Nullable TypeDecl type,
      @Nullable Expression initializer)
      implements GlobalDecl {}

  /** {@code @group(g) @binding(b) var<addressSpace, accessMode> name: type = initializer;} */
  record Variable(
      ImmutableList<Attribute> attributes,
      String name,
      @Nullable AddressSpace addressSpace,
      @Nullable AccessMode accessMode,
      @Nullable TypeDecl type,
      @Nullable Expression initializer)
      implements GlobalDecl {

    /**
     * Returns the integer argument of the attribute of the given kind ({@link Attribute.Group} or
     * {@link Attribute.Binding}), if present and written as a literal.
     */
    public Optional<Integer> literalAttributeValue(Class<? extends Attribute> kind) {
      for (Attribute attribute : attributes) {
        @Nullable Expression argument = null;
        if (kind.isInstance(attribute)) {
          if (attribute instanceof Attribute.Group group) {
            argument = group.expression();
          } else if (attribute instanceof Attribute.Binding binding) {
            argument = binding.expression();
          }
        }
        if (argument instanceof Expression.IntLiteral literal) {
          return Optional.of(Integer.parseInt(literal.text().replaceAll("[iu]$", "")));
        }
      }
      return Optional.empty();
    }
  }

  record Function(
      ImmutableList<Attribute> attributes,
      String name,
      ImmutableList<ParameterDecl> parameters,
      ImmutableList<Attribute> returnAttributes,
      @Nullable TypeDecl returnType,
      Statement.Compound body)
      implements GlobalDecl {

    public boolean isEntryPoint() {
      return attributes.stream()
          .anyMatch(
              a ->
                  a instanceof Attribute.Vertex
                      || a instanceof Attribute.Fragment
                      || a instanceof Attribute.Compute);
    }
  }

  record Struct(String name, ImmutableList<StructMember> members) implements GlobalDecl {}

  record TypeAlias(String name, TypeDecl type) implements GlobalDecl {}

  record ConstAssert(Expression expression) implements GlobalDecl {}

  /** A stray {@code ;} at module scope. */
  record Empty() implements GlobalDecl {}
}
