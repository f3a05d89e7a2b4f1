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

package org.guestlang.impl.iter;

import org.guestlang.impl.Err;
import org.guestlang.impl.Err.BuiltinException;
import org.guestlang.impl.ObjectValue;
import org.guestlang.impl.Realm;
import org.guestlang.impl.Value;
import org.guestlang.impl.iter.IteratorState.MapIteratorState;
import org.guestlang.impl.iter.IteratorState.SetIteratorState;

/**
 * Constructs the iterators returned by the {@code keys()}, {@code values()}, and {@code entries()}
 * methods of maps and sets.
 *
 * <p>Only construction lives here. The returned iterators have no {@code next} property of their
 * own; they inherit one from {@code %MapIteratorPrototype%} or {@code %SetIteratorPrototype%},
 * which is supplied by the collection library and reads the {@link MapIteratorState} or {@link
 * SetIteratorState} created here.
 */
public class CollectionIterators {

  /** The internal slot that marks a genuine map and holds its entries. */
  public static final String MAP_DATA = "MapData";

  /** The internal slot that marks a genuine set and holds its elements. */
  public static final String SET_DATA = "SetData";

  // statics only
  private CollectionIterators() {}

  /**
   * Returns a new iterator over {@code map}, which must be an object with a {@value #MAP_DATA}
   * internal slot.
   */
  public static IteratorObject createMapIterator(Realm realm, Value map, IterationKind kind)
      throws BuiltinException {
    ObjectValue source = checkSource(realm, map, MAP_DATA, Err.NOT_A_MAP);
    return new IteratorObject(realm.mapIteratorPrototype, new MapIteratorState(source, kind));
  }

  /**
   * Returns a new iterator over {@code set}, which must be an object with a {@value #SET_DATA}
   * internal slot.
   */
  public static IteratorObject createSetIterator(Realm realm, Value set, IterationKind kind)
      throws BuiltinException {
    ObjectValue source = checkSource(realm, set, SET_DATA, Err.NOT_A_SET);
    return new IteratorObject(realm.setIteratorPrototype, new SetIteratorState(source, kind));
  }

  /**
   * Returns {@code source} if it is an object with the given internal slot. Having the right shape
   * is not enough: only objects created as maps (or sets) have the slot.
   */
  private static ObjectValue checkSource(Realm realm, Value source, String slot, Err missingSlot)
      throws BuiltinException {
    if (!(source instanceof ObjectValue obj)) {
      throw Err.NOT_AN_OBJECT.asException(realm, source);
    }
    if (!obj.hasSlot(slot)) {
      throw missingSlot.asException(realm, obj);
    }
    return obj;
  }
}
