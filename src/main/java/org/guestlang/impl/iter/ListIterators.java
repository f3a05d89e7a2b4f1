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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.guestlang.impl.Core;
import org.guestlang.impl.Err;
import org.guestlang.impl.Err.BuiltinException;
import org.guestlang.impl.NativeFunction;
import org.guestlang.impl.ObjectOps;
import org.guestlang.impl.Realm;
import org.guestlang.impl.Value;
import org.guestlang.impl.iter.IteratorState.ListIteratorState;

/**
 * List iterators adapt a Java list of values to the iteration protocol. They are used wherever the
 * runtime already has the values in hand but must present them to guest code as an iterator.
 */
public class ListIterators {

  // statics only
  private ListIterators() {}

  /**
   * Returns a new iterator over a snapshot of {@code list}.
   *
   * <p>Each iterator gets its own {@code next} function, which is both recorded in the iterator's
   * state and installed as its {@code next} property. The function only accepts a receiver whose
   * state records that same function instance, so it cannot be used to advance any other iterator
   * (or an object dressed up to look like one).
   */
  public static IteratorObject createListIterator(Realm realm, List<? extends Value> list) {
    NativeFunction next = NativeFunction.create(realm, "next", 0, ListIterators::next);
    IteratorObject iterator =
        new IteratorObject(
            realm.iteratorPrototype, new ListIteratorState(ImmutableList.copyOf(list), next));
    iterator.defineMethod(Core.NEXT, next);
    return iterator;
  }

  /** The body of each list iterator's {@code next} function. */
  private static Value next(
      Realm realm, NativeFunction self, Value receiver, ImmutableList<Value> args)
      throws BuiltinException {
    if (!(receiver instanceof IteratorObject iterator)
        || !(iterator.state() instanceof ListIteratorState state)) {
      throw Err.MISSING_INTERNAL_STATE.asException(realm, receiver);
    }
    if (!ObjectOps.sameValue(self, state.nextFunction)) {
      throw Err.FOREIGN_RECEIVER.asException(realm, receiver);
    }
    if (state.isExhausted()) {
      return ObjectOps.createIterResultObject(realm, Core.UNDEFINED, true);
    }
    return ObjectOps.createIterResultObject(realm, state.advance(), false);
  }
}
