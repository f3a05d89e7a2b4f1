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
import org.guestlang.impl.Err.BuiltinException;
import org.jspecify.annotations.Nullable;

/**
 * The abstract operations on values that the rest of the runtime is built from: property access,
 * method lookup and invocation, truthiness, and value identity.
 *
 * <p>Each operation that may run guest code (a getter or a called function) reports a guest
 * failure by throwing a BuiltinException; none of them catch one.
 */
public class ObjectOps {

  // statics only
  private ObjectOps() {}

  /**
   * Returns the value of a property of any value ({@code GetV}). Reading a property of {@code
   * undefined} or {@code null} is a TypeError; other primitives have no properties.
   */
  public static Value get(Realm realm, Value value, PropertyKey key) throws BuiltinException {
    if (value instanceof ObjectValue obj) {
      return obj.get(realm, key, obj);
    } else if (value.baseType().isNullish()) {
      throw Err.NULLISH_PROPERTY_ACCESS.asException(realm, key, value);
    }
    return Core.UNDEFINED;
  }

  /**
   * Returns the function stored in the named property ({@code GetMethod}), or null if the property
   * is {@code undefined} or {@code null}. Any other non-callable value is a TypeError.
   */
  public static @Nullable FunctionValue getMethod(Realm realm, Value value, PropertyKey key)
      throws BuiltinException {
    Value func = get(realm, value, key);
    if (func.baseType().isNullish()) {
      return null;
    } else if (func instanceof FunctionValue fn) {
      return fn;
    }
    throw Err.NOT_CALLABLE.asException(realm, func);
  }

  /** Calls {@code callee}, which must be callable, with the given receiver and arguments. */
  public static Value call(Realm realm, Value callee, Value receiver, Value... args)
      throws BuiltinException {
    if (callee instanceof FunctionValue fn) {
      return fn.call(realm, receiver, args);
    }
    throw Err.NOT_CALLABLE.asException(realm, callee);
  }

  /** Looks up the named method on {@code receiver} and calls it ({@code Invoke}). */
  public static Value invoke(Realm realm, Value receiver, PropertyKey key, Value... args)
      throws BuiltinException {
    return call(realm, get(realm, receiver, key), receiver, args);
  }

  /** Returns the truthiness of a value ({@code ToBoolean}). */
  public static boolean toBoolean(Value value) {
    return switch (value.baseType()) {
      case UNDEFINED, NULL -> false;
      case BOOLEAN -> value == Core.TRUE;
      case NUMBER -> {
        double d = ((NumValue) value).value;
        yield d != 0 && !Double.isNaN(d);
      }
      case STRING -> !((StringValue) value).value.isEmpty();
      case SYMBOL, OBJECT -> true;
    };
  }

  /**
   * Returns true if {@code a} and {@code b} are the same value ({@code SameValue}): objects and
   * symbols by identity, strings by content, numbers with NaN equal to itself and 0 distinct from
   * -0.
   */
  public static boolean sameValue(Value a, Value b) {
    if (a == b) {
      return true;
    } else if (a.baseType() != b.baseType()) {
      return false;
    }
    return switch (a.baseType()) {
      // NumValue.equals() and StringValue.equals() already implement SameValue.
      case NUMBER, STRING -> a.equals(b);
      default -> false;
    };
  }

  /**
   * Returns a new object with the given prototype and internal slots ({@code ObjectCreate}); each
   * slot starts out {@code undefined}.
   */
  public static ObjectValue objectCreate(@Nullable ObjectValue prototype, String... slotNames) {
    ObjectValue result = new ObjectValue(prototype);
    for (String slotName : slotNames) {
      result.declareSlot(Preconditions.checkNotNull(slotName));
    }
    return result;
  }

  /** Returns a new {@code {value, done}} object ({@code CreateIterResultObject}). */
  public static ObjectValue createIterResultObject(Realm realm, Value value, boolean done) {
    return new ObjectValue(realm.objectPrototype)
        .set(Core.VALUE, value)
        .set(Core.DONE, Core.bool(done));
  }
}
