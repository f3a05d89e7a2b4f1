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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.guestlang.impl.Err.BuiltinException;
import org.jspecify.annotations.Nullable;

/**
 * A guest-language object: an optional prototype, an insertion-ordered table of own properties,
 * and a bag of internal slots.
 *
 * <p>Internal slots are string-keyed and are never visible to ordinary property lookup; they hold
 * host-private state such as the {@code MapData} of a map. A slot is either declared when the
 * object is created (see {@link ObjectOps#objectCreate}), in which case it starts out {@code
 * undefined}, or added later by {@link #setSlot}.
 *
 * <p>ObjectValues have reference identity: {@code equals()} is not overridden.
 */
public class ObjectValue implements Value {

  /**
   * An own property: either a data property (with a value) or an accessor property (with a getter
   * that is called on each read).
   */
  public record Property(
      @Nullable Value value, @Nullable FunctionValue getter, boolean enumerable) {
    public Property {
      Preconditions.checkArgument((value == null) != (getter == null));
    }

    public boolean isAccessor() {
      return getter != null;
    }
  }

  private @Nullable ObjectValue prototype;

  private final LinkedHashMap<PropertyKey, Property> properties = new LinkedHashMap<>();

  /** Created on first use; most objects have no internal slots. */
  private @Nullable Map<String, Object> slots;

  public ObjectValue(@Nullable ObjectValue prototype) {
    this.prototype = prototype;
  }

  @Override
  public final BaseType baseType() {
    return BaseType.OBJECT;
  }

  public @Nullable ObjectValue prototype() {
    return prototype;
  }

  public void setPrototype(@Nullable ObjectValue prototype) {
    for (ObjectValue p = prototype; p != null; p = p.prototype) {
      Preconditions.checkArgument(p != this, "Prototype chain would be circular");
    }
    this.prototype = prototype;
  }

  /** The name used by {@link #toString}; subclasses override this to describe themselves. */
  public String className() {
    return "Object";
  }

  /** Returns the own property with the given key, or null if there is none. */
  public @Nullable Property getOwnProperty(PropertyKey key) {
    return properties.get(key);
  }

  public boolean hasOwnProperty(PropertyKey key) {
    return properties.containsKey(key);
  }

  /** Returns the keys of this object's own properties, in insertion order. */
  public Iterable<PropertyKey> ownKeys() {
    return properties.keySet();
  }

  /**
   * Returns the value of the named property, searching the prototype chain. An accessor property
   * calls its getter with {@code receiver} as {@code this}, so reading a property can fail.
   */
  public Value get(Realm realm, PropertyKey key, Value receiver) throws BuiltinException {
    for (ObjectValue obj = this; obj != null; obj = obj.prototype) {
      Property p = obj.properties.get(key);
      if (p != null) {
        return p.isAccessor() ? p.getter().call(realm, receiver) : p.value();
      }
    }
    return Core.UNDEFINED;
  }

  /** Equivalent to {@code get(realm, key, this)}. */
  public Value get(Realm realm, PropertyKey key) throws BuiltinException {
    return get(realm, key, this);
  }

  /** Creates or replaces an enumerable own data property. */
  @CanIgnoreReturnValue
  public ObjectValue set(PropertyKey key, Value value) {
    properties.put(key, new Property(Preconditions.checkNotNull(value), null, true));
    return this;
  }

  /** Equivalent to {@code set(PropertyKey.of(name), value)}. */
  @CanIgnoreReturnValue
  public ObjectValue set(String name, Value value) {
    return set(PropertyKey.of(name), value);
  }

  /**
   * Creates or replaces a non-enumerable own data property; this is how built-in methods are
   * installed.
   */
  @CanIgnoreReturnValue
  public ObjectValue defineMethod(PropertyKey key, Value value) {
    properties.put(key, new Property(Preconditions.checkNotNull(value), null, false));
    return this;
  }

  /** Creates or replaces an enumerable own accessor property with the given getter. */
  @CanIgnoreReturnValue
  public ObjectValue defineAccessor(PropertyKey key, FunctionValue getter) {
    properties.put(key, new Property(null, Preconditions.checkNotNull(getter), true));
    return this;
  }

  /** Removes an own property; returns true if there was one. */
  @CanIgnoreReturnValue
  public boolean delete(PropertyKey key) {
    return properties.remove(key) != null;
  }

  /** Declares an internal slot, with initial value {@code undefined}, if it is not present. */
  void declareSlot(String name) {
    if (slots == null) {
      slots = new HashMap<>();
    }
    slots.putIfAbsent(name, Core.UNDEFINED);
  }

  /** True if this object has the named internal slot, whether or not it has been set. */
  public boolean hasSlot(String name) {
    return slots != null && slots.containsKey(name);
  }

  /** Returns the value of the named internal slot, or null if this object has no such slot. */
  public @Nullable Object getSlot(String name) {
    return (slots == null) ? null : slots.get(name);
  }

  /** Sets the named internal slot, adding it if necessary. */
  public void setSlot(String name, Object value) {
    declareSlot(name);
    slots.put(name, Preconditions.checkNotNull(value));
  }

  @Override
  public String toString() {
    return "[object " + className() + "]";
  }
}
