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

import org.jspecify.annotations.Nullable;

/**
 * Attributes ({@code @location(0)}, {@code @fragment}, ...). Arguments that are expressions are
 * kept as expressions, but no pass ever rewrites them.
 */
public sealed interface Attribute extends AstNode {

  record Align(Expression expression) implements Attribute {}

  record Binding(Expression expression) implements Attribute {}

  record BlendSrc(Expression expression) implements Attribute {}

  record Builtin(String name) implements Attribute {}

  record Compute() implements Attribute {}

  record Const() implements Attribute {}

  record Diagnostic(String severity, String rule) implements Attribute {}

  record Fragment() implements Attribute {}

  record Group(Expression expression) implements Attribute {}

  record Id(Expression expression) implements Attribute {}

  record Interpolate(String type, @Nullable String sampling) implements Attribute {}

  record Invariant() implements Attribute {}

  record Location(Expression expression) implements Attribute {}

  record MustUse() implements Attribute {}

  record Size(Expression expression) implements Attribute {}

  record Vertex() implements Attribute {}

  record WorkgroupSize(
      Expression sizeX, @Nullable Expression sizeY, @Nullable Expression sizeZ)
      implements Attribute {}
}
