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

import java.util.ArrayList;
import java.util.List;
import org.guestlang.impl.Completion;
import org.guestlang.impl.Core;
import org.guestlang.impl.NativeFunction;
import org.guestlang.impl.ObjectValue;
import org.guestlang.impl.Realm;
import org.guestlang.impl.Value;

/** Hand-built iterators and iterables for tests. */
final class IteratorFixtures {

  private IteratorFixtures() {}

  /** Returns a function that throws {@code thrown} whenever it is called. */
  static NativeFunction throwing(Realm realm, String name, Value thrown) {
    return NativeFunction.create(
        realm,
        name,
        0,
        (r, self, receiver, args) -> {
          throw Completion.ofThrow(thrown).asException();
        });
  }

  /** Returns a function that returns {@code result} whenever it is called. */
  static NativeFunction returning(Realm realm, String name, Value result) {
    return NativeFunction.create(realm, name, 0, (r, self, receiver, args) -> result);
  }

  /** Returns an iterable whose {@code @@iterator} method returns {@code iterator}. */
  static ObjectValue iterableOf(Realm realm, Value iterator) {
    return new ObjectValue(realm.objectPrototype)
        .defineMethod(Core.ITERATOR, returning(realm, "[Symbol.iterator]", iterator));
  }

  /**
   * An iterator whose {@code next} method returns the given values in turn (repeating the last one
   * once they run out), and which records the arguments of each call.
   */
  static final class ScriptedIterator {
    final ObjectValue iterator;
    final List<List<Value>> nextCalls = new ArrayList<>();
    final List<Value> receivers = new ArrayList<>();

    ScriptedIterator(Realm realm, Value... results) {
      iterator = new ObjectValue(realm.iteratorPrototype);
      iterator.set(
          Core.NEXT,
          NativeFunction.create(
              realm,
              "next",
              0,
              (r, self, receiver, args) -> {
                receivers.add(receiver);
                nextCalls.add(args);
                return results[Math.min(nextCalls.size(), results.length) - 1];
              }));
    }
  }

  /**
   * An iterator over nothing whose {@code return} method records each call and then returns {@code
   * result}.
   */
  static final class ClosableIterator {
    final ObjectValue iterator;
    final List<List<Value>> returnCalls = new ArrayList<>();
    final List<Value> receivers = new ArrayList<>();

    ClosableIterator(Realm realm, Value result) {
      iterator = ListIterators.createListIterator(realm, List.of());
      iterator.set(
          Core.RETURN,
          NativeFunction.create(
              realm,
              "return",
              0,
              (r, self, receiver, args) -> {
                receivers.add(receiver);
                returnCalls.add(args);
                return result;
              }));
    }
  }
}
