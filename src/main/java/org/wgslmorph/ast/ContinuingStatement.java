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
import org.jspecify.annotations.Nullable;

/**
 * The {@code continuing { ... break if e; }} block of a {@code loop}. It is not a {@link
 * Statement}: it may only appear as the last element of a loop, and no {@code return} (nor a
 * {@code break}/{@code continue} targeting the enclosing loop) may occur inside it.
 */
public record ContinuingStatement(
    ImmutableList<Attribute> attributes,
    Statement.Compound statements,
    @Nullable Expression breakIfExpr)
    implements AstNode {

  public ContinuingStatement(Statement.Compound statements, @Nullable Expression breakIfExpr) {
    this(ImmutableList.of(), statements, breakIfExpr);
  }
}
