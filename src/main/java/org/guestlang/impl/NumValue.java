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

package org.guestlang.impl;

import java.util.Arrays;
import org.guestlang.util.StringUtil;

/** An implementation of Value for numbers, which are always IEEE doubles. */
public final class NumValue implements Value {

  private static final int MIN_CACHED_INT = -1;
  private static final int MAX_CACHED_INT = 255;

  /** We preallocate NumValues for integers between -1 and 255 inclusive. */
  private static final NumValue[] intCache;

  public static final NumValue ZERO;
  public static final NumValue ONE;

  public static final NumValue NAN = new NumValue(Double.NaN);

  static {
    intCache = new NumValue[MAX_CACHED_INT - MIN_CACHED_INT + 1];
    Arrays.setAll(intCache, i -> new NumValue(i + MIN_CACHED_INT));
    ZERO = intCache[-MIN_CACHED_INT];
    ONE = intCache[1 - MIN_CACHED_INT];
  }

  public final double value;

  private NumValue(double value) {
    this.value = value;
  }

  /** Returns a NumValue for the given int. */
  public static NumValue of(int i) {
    if (i >= MIN_CACHED_INT && i <= MAX_CACHED_INT) {
      return intCache[i - MIN_CACHED_INT];
    }
    return new NumValue(i);
  }

  /** Returns a NumValue for the given double. */
  public static NumValue of(double d) {
    // -0.0 == 0 would otherwise hit the cache and lose its sign.
    int i = (int) d;
    if (i == d && i >= MIN_CACHED_INT && i <= MAX_CACHED_INT && !isNegativeZero(d)) {
      return intCache[i - MIN_CACHED_INT];
    }
    return Double.isNaN(d) ? NAN : new NumValue(d);
  }

  /** True if {@code d} is {@code -0.0}. */
  static boolean isNegativeZero(double d) {
    return d == 0 && Double.doubleToRawLongBits(d) != 0;
  }

  @Override
  public BaseType baseType() {
    return BaseType.NUMBER;
  }

  @Override
  public boolean equals(Object other) {
    // Uses SameValue semantics: NaN equals NaN, but 0 and -0 are distinct.
    return other instanceof NumValue nv
        && Double.doubleToLongBits(value) == Double.doubleToLongBits(nv.value);
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return StringUtil.numberToString(value);
  }
}
