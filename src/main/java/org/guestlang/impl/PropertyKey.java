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

import com.google.common.base.Preconditions;

/**
 * A property key is either a string or a symbol. String keys compare by content, symbol keys by
 * identity.
 */
public final class PropertyKey {
  private final Object key;

  private PropertyKey(Object key) {
    this.key = key;
  }

  /** Returns the PropertyKey for a string-named property. */
  public static PropertyKey of(String name) {
    return new PropertyKey(Preconditions.checkNotNull(name));
  }

  /** Returns the PropertyKey for a symbol-keyed property. */
  public static PropertyKey of(SymbolValue symbol) {
    return new PropertyKey(Preconditions.checkNotNull(symbol));
  }

  @Override
  public boolean equals(Object other) {
    // SymbolValue doesn't override equals(), so symbols compare by identity.
    return other instanceof PropertyKey pk && key.equals(pk.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return (key instanceof SymbolValue sym) ? "[" + sym + "]" : (String) key;
  }
}
