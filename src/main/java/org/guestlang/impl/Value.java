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

/**
 * A Value represents a guest-language value: one of the primitive kinds (undefined, null, booleans,
 * numbers, strings, symbols) or an object.
 *
 * <p>Primitive Values are immutable and compared by {@link ObjectOps#sameValue}; objects have
 * reference identity.
 */
public interface Value {

  /** Returns the kind of this value. */
  BaseType baseType();

  /** True if this value is an object (including functions). */
  default boolean isObject() {
    return baseType() == BaseType.OBJECT;
  }
}
