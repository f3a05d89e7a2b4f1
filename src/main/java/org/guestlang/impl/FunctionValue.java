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

import com.google.common.collect.ImmutableList;
import org.guestlang.impl.Err.BuiltinException;
import org.jspecify.annotations.Nullable;

/**
 * A callable object. Each FunctionValue is a distinct identity; two functions with the same
 * behaviour are still different values.
 */
public abstract class FunctionValue extends ObjectValue {
  private final String name;

  protected FunctionValue(@Nullable ObjectValue prototype, String name, int length) {
    super(prototype);
    this.name = name;
    defineMethod(Core.NAME, StringValue.of(name));
    defineMethod(PropertyKey.of("length"), NumValue.of(length));
  }

  public String name() {
    return name;
  }

  /**
   * Calls this function with the given receiver ({@code this} value) and arguments. A throw
   * completion from the function body is reported as a BuiltinException.
   */
  public abstract Value apply(Realm realm, Value receiver, ImmutableList<Value> args)
      throws BuiltinException;

  /** Calls this function with the given receiver and arguments. */
  public final Value call(Realm realm, Value receiver, Value... args) throws BuiltinException {
    return apply(realm, receiver, ImmutableList.copyOf(args));
  }

  @Override
  public String className() {
    return "Function";
  }

  @Override
  public String toString() {
    return "function " + name + "() { [native code] }";
  }
}
