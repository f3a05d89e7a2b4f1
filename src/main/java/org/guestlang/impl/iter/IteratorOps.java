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
import com.google.common.collect.ImmutableList.Builder;
import org.guestlang.impl.Completion;
import org.guestlang.impl.Core;
import org.guestlang.impl.Err;
import org.guestlang.impl.Err.BuiltinException;
import org.guestlang.impl.FunctionValue;
import org.guestlang.impl.ObjectOps;
import org.guestlang.impl.ObjectValue;
import org.guestlang.impl.Realm;
import org.guestlang.impl.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The operations of the iteration protocol, which work with any object that behaves like an
 * iterator: one with a callable {@code next} property that returns {@code {value, done}} objects,
 * and optionally a {@code return} method that is called when iteration is abandoned early.
 *
 * <p>A caller obtains an iterator with {@link #getIterator}, advances it with {@link #iteratorStep}
 * and reads each value with {@link #iteratorValue}. If the caller stops before the iterator is
 * exhausted (because of a {@code break}, a {@code return}, or an exception) it must pass the
 * completion that caused the exit to {@link #iteratorClose}, and continue with the completion that
 * returns.
 */
public class IteratorOps {

  private static final Logger logger = LoggerFactory.getLogger(IteratorOps.class);

  // statics only
  private IteratorOps() {}

  /**
   * Returns the iterator for {@code source}, obtained by calling its {@code @@iterator} method.
   * Fails if reading {@code @@iterator} fails, if there is no such method, or if it does not return
   * an object.
   */
  public static ObjectValue getIterator(Realm realm, Value source) throws BuiltinException {
    FunctionValue method = ObjectOps.getMethod(realm, source, Core.ITERATOR);
    if (method == null) {
      throw Err.NOT_ITERABLE.asException(realm, source);
    }
    return getIterator(realm, source, method);
  }

  /**
   * Returns the iterator for {@code source}, obtained by calling {@code method} with {@code source}
   * as its receiver and no arguments.
   */
  public static ObjectValue getIterator(Realm realm, Value source, Value method)
      throws BuiltinException {
    Value iterator = ObjectOps.call(realm, method, source);
    if (iterator instanceof ObjectValue result) {
      return result;
    }
    throw Err.ITERATOR_RESULT_NOT_OBJECT.asException(realm, iterator);
  }

  /** Calls {@code iterator.next()} and returns its result, which must be an object. */
  public static ObjectValue iteratorNext(Realm realm, Value iterator) throws BuiltinException {
    return checkResult(realm, ObjectOps.invoke(realm, iterator, Core.NEXT));
  }

  /**
   * Calls {@code iterator.next(value)} and returns its result, which must be an object. The value
   * is passed back into iterators that can resume with one, such as delegated generators.
   */
  public static ObjectValue iteratorNext(Realm realm, Value iterator, Value value)
      throws BuiltinException {
    return checkResult(realm, ObjectOps.invoke(realm, iterator, Core.NEXT, value));
  }

  private static ObjectValue checkResult(Realm realm, Value result) throws BuiltinException {
    if (result instanceof ObjectValue obj) {
      return obj;
    }
    throw Err.ITERATOR_RESULT_NOT_OBJECT.asException(realm, result);
  }

  /** Returns the truthiness of the {@code done} property of an iterator result. */
  public static boolean iteratorComplete(Realm realm, ObjectValue result) throws BuiltinException {
    return ObjectOps.toBoolean(result.get(realm, Core.DONE));
  }

  /** Returns the {@code value} property of an iterator result. */
  public static Value iteratorValue(Realm realm, ObjectValue result) throws BuiltinException {
    return result.get(realm, Core.VALUE);
  }

  /**
   * Advances {@code iterator} once. Returns {@link Step#EXHAUSTED} if the result says it is done;
   * otherwise returns a Step holding the result object, whose value has not yet been read.
   */
  public static Step iteratorStep(Realm realm, Value iterator) throws BuiltinException {
    ObjectValue result = iteratorNext(realm, iterator);
    return iteratorComplete(realm, result) ? Step.EXHAUSTED : Step.of(result);
  }

  /**
   * Lets {@code iterator} clean up after the caller has stopped iterating for the reason given by
   * {@code completion}, and returns the completion that the caller should continue with.
   *
   * <ul>
   *   <li>If reading {@code iterator.return} fails, that failure is thrown.
   *   <li>If there is no {@code return} method, {@code completion} is returned.
   *   <li>Otherwise {@code return} is called with no arguments, and its outcome is decided by
   *       {@link #closeOutcome}.
   * </ul>
   */
  public static Completion iteratorClose(Realm realm, ObjectValue iterator, Completion completion)
      throws BuiltinException {
    FunctionValue returnMethod = ObjectOps.getMethod(realm, iterator, Core.RETURN);
    if (returnMethod == null) {
      return completion;
    }
    Completion innerResult;
    try {
      innerResult = Completion.normal(returnMethod.call(realm, iterator));
    } catch (BuiltinException e) {
      innerResult = e.completion();
    }
    return closeOutcome(realm, completion, innerResult);
  }

  /**
   * Given the completion that ended iteration and the completion of the iterator's {@code return}
   * method, returns the completion to continue with:
   *
   * <ol>
   *   <li>a throw {@code completion} is always returned unchanged, whatever {@code return} did;
   *   <li>otherwise, if {@code return} threw, its throw completion replaces {@code completion};
   *   <li>otherwise, if {@code return} returned a non-object, a TypeError is thrown;
   *   <li>otherwise {@code completion} is returned unchanged.
   * </ol>
   */
  static Completion closeOutcome(Realm realm, Completion completion, Completion innerResult)
      throws BuiltinException {
    if (completion.isThrow()) {
      if (innerResult.isThrow()) {
        logger
            .atDebug()
            .setMessage("Discarding {} from return(); keeping {}")
            .addArgument(innerResult)
            .addArgument(completion)
            .log();
      }
      return completion;
    } else if (innerResult.isThrow()) {
      logger
          .atDebug()
          .setMessage("{} from return() replaces {}")
          .addArgument(innerResult)
          .addArgument(completion)
          .log();
      return innerResult;
    } else if (!innerResult.value().isObject()) {
      throw Err.RETURN_RESULT_NOT_OBJECT.asException(realm, innerResult.value());
    }
    return completion;
  }

  /**
   * Returns all the values produced by the iterator that {@code method} returns for {@code
   * source}, in order. The iterator is run to exhaustion, so it is never closed; callers that may
   * stop early should use the step operations and {@link #iteratorClose} instead.
   */
  public static ImmutableList<Value> iterableToList(Realm realm, Value source, Value method)
      throws BuiltinException {
    return drain(realm, getIterator(realm, source, method));
  }

  /** Like {@link #iterableToList(Realm, Value, Value)}, using the {@code @@iterator} method. */
  public static ImmutableList<Value> iterableToList(Realm realm, Value source)
      throws BuiltinException {
    return drain(realm, getIterator(realm, source));
  }

  private static ImmutableList<Value> drain(Realm realm, ObjectValue iterator)
      throws BuiltinException {
    Builder<Value> values = ImmutableList.builder();
    for (Step step = iteratorStep(realm, iterator);
        !step.isExhausted();
        step = iteratorStep(realm, iterator)) {
      values.add(iteratorValue(realm, step.result()));
    }
    return values.build();
  }
}
