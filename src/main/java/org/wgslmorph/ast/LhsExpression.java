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

/** Expressions in assignable positions: the left of {@code =}, {@code +=}, {@code ++}, ... */
public sealed interface LhsExpression extends AstNode {

  record Identifier(String name) implements LhsExpression {}

  record Paren(LhsExpression target) implements LhsExpression {}

  record MemberLookup(LhsExpression receiver, String memberName) implements LhsExpression {}

  record IndexLookup(LhsExpression target, Expression index) implements LhsExpression {}

  record Dereference(LhsExpression target) implements LhsExpression {}

  record AddressOf(LhsExpression target) implements LhsExpression {}
}
