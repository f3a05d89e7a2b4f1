/*
 * Copyright 2025 The Guestlang Authors
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

package org.guestlang.util;

import java.math.BigDecimal;

/** A static-only class with a few helpers for building readable descriptions of guest values. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Returns {@code s} enclosed in double quotes, with backslashes, quotes, and control characters
   * escaped.
   */
  public static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        default -> {
          if (c < ' ') {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Formats a double the way the guest language prints numbers: the shortest digit string that
   * identifies {@code d}, written positionally when its decimal exponent is between -7 and 21 and
   * in exponential form ({@code 1e+21}, {@code 1.5e-7}) otherwise. The non-finite values are
   * spelled {@code NaN}, {@code Infinity}, {@code -Infinity}, and -0 prints as {@code 0}.
   */
  public static String numberToString(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    } else if (d == 0) {
      return "0";
    } else if (d < 0) {
      return "-" + numberToString(-d);
    }
    // d is digits * 10^(n - k), with k = digits.length() and no trailing zeros in digits.
    BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
    String digits = decimal.unscaledValue().toString();
    int k = digits.length();
    int n = k - decimal.scale();
    if (k <= n && n <= 21) {
      return digits + "0".repeat(n - k);
    } else if (0 < n && n <= 21) {
      return digits.substring(0, n) + "." + digits.substring(n);
    } else if (-6 < n && n <= 0) {
      return "0." + "0".repeat(-n) + digits;
    }
    String exponent = (n > 0 ? "e+" : "e-") + Math.abs(n - 1);
    return (k == 1)
        ? digits + exponent
        : digits.charAt(0) + "." + digits.substring(1) + exponent;
  }
}
