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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.guestlang.impl.NativeFunction;
import org.guestlang.impl.ObjectValue;
import org.guestlang.impl.Value;

/**
 * The private state of an iterator created by the runtime. There are exactly three kinds, one for
 * each kind of iterator the runtime constructs; an {@link IteratorObject} holds one of them.
 */
public abstract class IteratorState {

  // Only the nested classes below.
  private IteratorState() {}

  /** The name used when describing an iterator with this state. */
  abstract String className();

  /**
   * The state of a list iterator: the list being iterated ({@code [[IteratedList]]}), the index of
   * the next element to return ({@code [[ListIteratorNextIndex]]}), and the specific {@code next}
   * function created along with this iterator ({@code [[IteratorNext]]}).
   */
  public static final class ListIteratorState extends IteratorState {
    final ImmutableList<Value> list;
    final NativeFunction nextFunction;

    /** Never decreases, and never exceeds {@code list.size()}. */
    private int nextIndex;

    ListIteratorState(ImmutableList<Value> list, NativeFunction nextFunction) {
      this.list = list;
      this.nextFunction = nextFunction;
    }

    public ImmutableList<Value> list() {
      return list;
    }

    public int nextIndex() {
      return nextIndex;
    }

    /** True if every element of the list has been returned. */
    boolean isExhausted() {
      return nextIndex >= list.size();
    }

    /** Returns the next element and advances the cursor; must not be called once exhausted. */
    Value advance() {
      assert !isExhausted();
      return list.get(nextIndex++);
    }

    @Override
    String className() {
      return "List Iterator";
    }
  }

  /**
   * The shared part of {@link MapIteratorState} and {@link SetIteratorState}: a borrowed reference
   * to the collection being iterated, a cursor, and the iteration kind. The cursor is maintained by
   * the collection's {@code next} method, not by the runtime.
   */
  abstract static class CollectionIteratorState extends IteratorState {
    final ObjectValue source;
    final IterationKind kind;
    private int nextIndex;

    CollectionIteratorState(ObjectValue source, IterationKind kind) {
      this.source = Preconditions.checkNotNull(source);
      this.kind = Preconditions.checkNotNull(kind);
    }

    public IterationKind kind() {
      return kind;
    }

    public int nextIndex() {
      return nextIndex;
    }

    public void setNextIndex(int nextIndex) {
      Preconditions.checkArgument(nextIndex >= 0, "Negative index %s", nextIndex);
      this.nextIndex = nextIndex;
    }
  }

  /** {@code [[Map]]}, {@code [[MapNextIndex]]}, {@code [[MapIterationKind]]} */
  public static final class MapIteratorState extends CollectionIteratorState {
    MapIteratorState(ObjectValue map, IterationKind kind) {
      super(map, kind);
    }

    /** The map being iterated. */
    public ObjectValue map() {
      return source;
    }

    @Override
    String className() {
      return "Map Iterator";
    }
  }

  /** {@code [[IteratedSet]]}, {@code [[SetNextIndex]]}, {@code [[SetIterationKind]]} */
  public static final class SetIteratorState extends CollectionIteratorState {
    SetIteratorState(ObjectValue set, IterationKind kind) {
      super(set, kind);
    }

    /** The set being iterated. */
    public ObjectValue iteratedSet() {
      return source;
    }

    @Override
    String className() {
      return "Set Iterator";
    }
  }
}
