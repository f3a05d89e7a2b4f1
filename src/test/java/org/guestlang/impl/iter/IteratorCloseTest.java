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

import static com.google.common.truth.Truth.assertThat;
import static org.guestlang.impl.iter.IteratorFixtures.returning;
import static org.guestlang.impl.iter.IteratorFixtures.throwing;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import org.guestlang.impl.Completion;
import org.guestlang.impl.Core;
import org.guestlang.impl.Err.BuiltinException;
import org.guestlang.impl.ErrorKind;
import org.guestlang.impl.NumValue;
import org.guestlang.impl.ObjectValue;
import org.guestlang.impl.Realm;
import org.guestlang.impl.StringValue;
import org.guestlang.impl.Value;
import org.guestlang.impl.iter.IteratorFixtures.ClosableIterator;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Exercises each row of the decision made by {@link IteratorOps#iteratorClose}. */
@RunWith(TestParameterInjector.class)
public class IteratorCloseTest {

  private final Realm realm = new Realm();

  private static final Value E1 = StringValue.of("E1");
  private static final Value E2 = StringValue.of("E2");

  /** The ways a loop can stop early without throwing, plus running to completion. */
  enum Exit {
    RETURN {
      @Override
      Completion completion() {
        return Completion.ofReturn(NumValue.of(42));
      }
    },
    BREAK {
      @Override
      Completion completion() {
        return Completion.ofBreak(null);
      }
    },
    LABELLED_CONTINUE {
      @Override
      Completion completion() {
        return Completion.ofContinue("outer");
      }
    },
    NORMAL {
      @Override
      Completion completion() {
        return Completion.normal(Core.UNDEFINED);
      }
    };

    abstract Completion completion();
  }

  /** Returns an iterator whose {@code return} method throws {@code E2}. */
  private ObjectValue iteratorWithThrowingReturn() {
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of(NumValue.ONE));
    iterator.set(Core.RETURN, throwing(realm, "return", E2));
    return iterator;
  }

  @Test
  public void originalThrowWins() throws BuiltinException {
    Completion original = Completion.ofThrow(E1);
    Completion result = IteratorOps.iteratorClose(realm, iteratorWithThrowingReturn(), original);
    assertThat(result).isSameInstanceAs(original);
  }

  @Test
  public void cleanupFailureReplacesNonThrowExit(@TestParameter Exit exit)
      throws BuiltinException {
    Completion result =
        IteratorOps.iteratorClose(realm, iteratorWithThrowingReturn(), exit.completion());
    assertThat(result.isThrow()).isTrue();
    assertThat(result.value()).isSameInstanceAs(E2);
  }

  @Test
  public void noReturnMethod(@TestParameter Exit exit) throws BuiltinException {
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of(NumValue.ONE));
    Completion original = exit.completion();
    assertThat(IteratorOps.iteratorClose(realm, iterator, original)).isSameInstanceAs(original);
    Completion thrown = Completion.ofThrow(E1);
    assertThat(IteratorOps.iteratorClose(realm, iterator, thrown)).isSameInstanceAs(thrown);
  }

  @Test
  public void nullishReturnIsNoReturnMethod() throws BuiltinException {
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of());
    Completion original = Completion.ofBreak(null);
    iterator.set(Core.RETURN, Core.NULL);
    assertThat(IteratorOps.iteratorClose(realm, iterator, original)).isSameInstanceAs(original);
    iterator.set(Core.RETURN, Core.UNDEFINED);
    assertThat(IteratorOps.iteratorClose(realm, iterator, original)).isSameInstanceAs(original);
  }

  @Test
  public void returnCalledOnceWithNoArguments(@TestParameter Exit exit) throws BuiltinException {
    ClosableIterator closable = new ClosableIterator(realm, new ObjectValue(null));
    Completion original = exit.completion();
    assertThat(IteratorOps.iteratorClose(realm, closable.iterator, original))
        .isSameInstanceAs(original);
    assertThat(closable.returnCalls).containsExactly(List.of());
    assertThat(closable.receivers).containsExactly(closable.iterator);
  }

  @Test
  public void returnCalledEvenWhenOriginalThrows() throws BuiltinException {
    ClosableIterator closable = new ClosableIterator(realm, NumValue.ONE);
    Completion original = Completion.ofThrow(E1);
    // A non-object result is not an error when the original completion is a throw
    assertThat(IteratorOps.iteratorClose(realm, closable.iterator, original))
        .isSameInstanceAs(original);
    assertThat(closable.returnCalls).hasSize(1);
  }

  @Test
  public void nonObjectReturnResultIsTypeError(@TestParameter Exit exit) {
    ClosableIterator closable = new ClosableIterator(realm, StringValue.of("done"));
    BuiltinException e =
        assertThrows(
            BuiltinException.class,
            () -> IteratorOps.iteratorClose(realm, closable.iterator, exit.completion()));
    assertThat(e.errorKind()).isEqualTo(ErrorKind.TYPE_ERROR);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("TypeError: Iterator return() result \"done\" is not an object");
  }

  @Test
  public void lookupFailurePropagates() {
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of());
    Value e3 = StringValue.of("E3");
    iterator.defineAccessor(Core.RETURN, throwing(realm, "get return", e3));
    // Even an original throw does not take precedence over a failed lookup.
    BuiltinException e =
        assertThrows(
            BuiltinException.class,
            () -> IteratorOps.iteratorClose(realm, iterator, Completion.ofThrow(E1)));
    assertThat(e.thrownValue()).isSameInstanceAs(e3);
  }

  @Test
  public void nonCallableReturnPropagates() {
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of());
    iterator.set(Core.RETURN, NumValue.ONE);
    BuiltinException e =
        assertThrows(
            BuiltinException.class,
            () -> IteratorOps.iteratorClose(realm, iterator, Completion.ofThrow(E1)));
    assertThat(e).hasMessageThat().isEqualTo("TypeError: 1 is not a function");
  }

  @Test
  public void inheritedReturnMethod() throws BuiltinException {
    ClosableIterator closable = new ClosableIterator(realm, new ObjectValue(null));
    ObjectValue child = new ObjectValue(closable.iterator);
    Completion original = Completion.ofReturn(Core.NULL);
    assertThat(IteratorOps.iteratorClose(realm, child, original)).isSameInstanceAs(original);
    assertThat(closable.receivers).containsExactly(child);
  }

  @Test
  public void closeOutcomeTable() throws BuiltinException {
    Completion thrown = Completion.ofThrow(E1);
    Completion cleanupThrow = Completion.ofThrow(E2);
    Completion brk = Completion.ofBreak("label");
    Completion objectResult = Completion.normal(new ObjectValue(null));

    assertThat(IteratorOps.closeOutcome(realm, thrown, cleanupThrow)).isSameInstanceAs(thrown);
    assertThat(IteratorOps.closeOutcome(realm, thrown, objectResult)).isSameInstanceAs(thrown);
    assertThat(IteratorOps.closeOutcome(realm, brk, cleanupThrow)).isSameInstanceAs(cleanupThrow);
    assertThat(IteratorOps.closeOutcome(realm, brk, objectResult)).isSameInstanceAs(brk);
    assertThrows(
        BuiltinException.class,
        () -> IteratorOps.closeOutcome(realm, brk, Completion.normal(Core.UNDEFINED)));
  }

  @Test
  public void returnResultMayBeAnyObject() throws BuiltinException {
    // The result of return() is only checked for being an object, not for its shape.
    ObjectValue iterator = ListIterators.createListIterator(realm, List.of());
    iterator.set(Core.RETURN, returning(realm, "return", realm.functionPrototype));
    Completion original = Completion.ofBreak(null);
    assertThat(IteratorOps.iteratorClose(realm, iterator, original)).isSameInstanceAs(original);
  }
}
