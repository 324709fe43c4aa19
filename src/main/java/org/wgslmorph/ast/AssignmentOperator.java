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

public enum AssignmentOperator {
  EQUAL("="),
  PLUS_EQUAL("+="),
  MINUS_EQUAL("-="),
  TIMES_EQUAL("*="),
  DIVIDE_EQUAL("/="),
  MODULO_EQUAL("%="),
  BINARY_AND_EQUAL("&="),
  BINARY_OR_EQUAL("|="),
  BINARY_XOR_EQUAL("^="),
  SHIFT_LEFT_EQUAL("<<="),
  SHIFT_RIGHT_EQUAL(">>=");

  public final String token;

  AssignmentOperator(String token) {
    this.token = token;
  }
}
