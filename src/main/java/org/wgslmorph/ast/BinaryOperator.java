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

public enum BinaryOperator {
  SHORT_CIRCUIT_OR("||"),
  SHORT_CIRCUIT_AND("&&"),
  BINARY_OR("|"),
  BINARY_AND("&"),
  BINARY_XOR("^"),
  LESS_THAN("<"),
  GREATER_THAN(">"),
  LESS_THAN_EQUAL("<="),
  GREATER_THAN_EQUAL(">="),
  EQUAL_EQUAL("=="),
  NOT_EQUAL("!="),
  SHIFT_LEFT("<<"),
  SHIFT_RIGHT(">>"),
  PLUS("+"),
  MINUS("-"),
  TIMES("*"),
  DIVIDE("/"),
  MODULO("%");

  public final String token;

  BinaryOperator(String token) {
    this.token = token;
  }

  /** True for the six relational operators, whose result is always {@code bool}. */
  public boolean isComparison() {
    return switch (this) {
      case LESS_THAN, GREATER_THAN, LESS_THAN_EQUAL, GREATER_THAN_EQUAL, EQUAL_EQUAL, NOT_EQUAL ->
          true;
      default -> false;
    };
  }

  public boolean isShortCircuit() {
    return this == SHORT_CIRCUIT_OR || this == SHORT_CIRCUIT_AND;
  }
}
