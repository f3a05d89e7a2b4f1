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
 * The values {@code undefined}, {@code null}, {@code true}, and {@code false} are each represented
 * by a single Singleton instance; see {@link Core}.
 */
public final class Singleton implements Value {
  private final BaseType baseType;
  private final String name;

  Singleton(BaseType baseType, String name) {
    assert baseType == BaseType.UNDEFINED
        || baseType == BaseType.NULL
        || baseType == BaseType.BOOLEAN;
    this.baseType = baseType;
    this.name = name;
  }

  @Override
  public BaseType baseType() {
    return baseType;
  }

  @Override
  public String toString() {
    return name;
  }
}
