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

package org.wgslmorph.util;

/** Static-only class with methods for reading WGSL numeric literals. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Returns the value of a WGSL integer literal such as {@code 12}, {@code 12i}, {@code 0xFFu} or
   * (as written in uniform values) {@code -3i}.
   *
   * @throws NumberFormatException if {@code text} is not an integer literal
   */
  public static long parseIntegerLiteral(String text) {
    String s = text;
    if (s.endsWith("i") || s.endsWith("u")) {
      s = s.substring(0, s.length() - 1);
    }
    boolean negative = s.startsWith("-");
    if (negative) {
      s = s.substring(1);
    }
    long magnitude =
        (s.startsWith("0x") || s.startsWith("0X"))
            ? Long.parseLong(s.substring(2), 16)
            : Long.parseLong(s);
    return negative ? -magnitude : magnitude;
  }

  /**
   * Returns the value of a WGSL floating point literal such as {@code 1.5}, {@code 2f}, {@code
   * 1e3h} or {@code 0x1.8p1f}.
   *
   * @throws NumberFormatException if {@code text} is not a floating point literal
   */
  public static double parseFloatLiteral(String text) {
    String s = text;
    boolean hex = s.startsWith("0x") || s.startsWith("0X") || s.startsWith("-0x");
    if (hex) {
      // A hex float can only carry a suffix after its exponent.
      int exponent = Math.max(s.indexOf('p'), s.indexOf('P'));
      if (exponent < 0) {
        return Double.parseDouble(s + "p0");
      }
      if (s.endsWith("f") || s.endsWith("h")) {
        s = s.substring(0, s.length() - 1);
      }
      return Double.parseDouble(s);
    }
    if (s.endsWith("f") || s.endsWith("h")) {
      s = s.substring(0, s.length() - 1);
    }
    return Double.parseDouble(s);
  }
}
