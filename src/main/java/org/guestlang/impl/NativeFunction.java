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

/** A FunctionValue whose behaviour is implemented in Java. */
public final class NativeFunction extends FunctionValue {

  /**
   * The Java implementation of a NativeFunction. {@code self} is the NativeFunction being called
   * (the "active function object"), which lets a body recognize objects that were set up to be
   * used with this particular function instance.
   */
  @FunctionalInterface
  public interface Body {
    Value apply(Realm realm, NativeFunction self, Value receiver, ImmutableList<Value> args)
        throws BuiltinException;
  }

  private final Body body;

  private NativeFunction(ObjectValue prototype, String name, int length, Body body) {
    super(prototype, name, length);
    this.body = body;
  }

  /** Returns a new NativeFunction whose prototype is the realm's {@code %Function.prototype%}. */
  public static NativeFunction create(Realm realm, String name, int length, Body body) {
    return new NativeFunction(realm.functionPrototype, name, length, body);
  }

  /** Used while the realm is being constructed, before {@link Realm#functionPrototype} is set. */
  static NativeFunction withPrototype(ObjectValue prototype, String name, int length, Body body) {
    return new NativeFunction(prototype, name, length, body);
  }

  @Override
  public Value apply(Realm realm, Value receiver, ImmutableList<Value> args)
      throws BuiltinException {
    return body.apply(realm, this, receiver, args);
  }
}
