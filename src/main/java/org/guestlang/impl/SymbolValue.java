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

import org.jspecify.annotations.Nullable;

/**
 * A symbol: a primitive value with identity. Two SymbolValues are the same value only if they are
 * the same Java object, regardless of their descriptions.
 */
public final class SymbolValue implements Value {

  private final @Nullable String description;

  public SymbolValue(@Nullable String description) {
    this.description = description;
  }

  @Override
  public BaseType baseType() {
    return BaseType.SYMBOL;
  }

  @Override
  public String toString() {
    return "Symbol(" + (description == null ? "" : description) + ")";
  }
}
