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
 * The values and property keys that are shared by every realm. This statics-only class holds the
 * primitive singletons and the well-known symbols.
 */
public class Core {

  // statics only
  private Core() {}

  public static final Singleton UNDEFINED = new Singleton(BaseType.UNDEFINED, "undefined");
  public static final Singleton NULL = new Singleton(BaseType.NULL, "null");
  public static final Singleton FALSE = new Singleton(BaseType.BOOLEAN, "false");
  public static final Singleton TRUE = new Singleton(BaseType.BOOLEAN, "true");

  /** Returns TRUE or FALSE. */
  public static Singleton bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  /** {@code Symbol.iterator}, the key of the method that returns an object's default iterator. */
  public static final SymbolValue SYMBOL_ITERATOR = new SymbolValue("Symbol.iterator");

  /** The property key for {@link #SYMBOL_ITERATOR}. */
  public static final PropertyKey ITERATOR = PropertyKey.of(SYMBOL_ITERATOR);

  public static final PropertyKey NEXT = PropertyKey.of("next");
  public static final PropertyKey RETURN = PropertyKey.of("return");
  public static final PropertyKey VALUE = PropertyKey.of("value");
  public static final PropertyKey DONE = PropertyKey.of("done");
  public static final PropertyKey MESSAGE = PropertyKey.of("message");
  public static final PropertyKey NAME = PropertyKey.of("name");
}
