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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Realm holds the intrinsic objects that the runtime's operations refer to: the standard
 * prototypes, and the error prototypes used when the runtime raises an error.
 *
 * <p>A Realm is not modified after construction, so the operations that take one hold no mutable
 * state of their own; all of an iterator's mutable state lives in the iterator object.
 */
public final class Realm {

  private static final Logger logger = LoggerFactory.getLogger(Realm.class);

  /** {@code %Object.prototype%} */
  public final ObjectValue objectPrototype;

  /** {@code %Function.prototype%} */
  public final ObjectValue functionPrototype;

  /**
   * {@code %IteratorPrototype%}, the prototype of every iterator the runtime creates. Its
   * {@code @@iterator} method returns its receiver, so every such iterator is also iterable.
   */
  public final ObjectValue iteratorPrototype;

  /** {@code %MapIteratorPrototype%}; its {@code next} method is supplied by the Map library. */
  public final ObjectValue mapIteratorPrototype;

  /** {@code %SetIteratorPrototype%}; its {@code next} method is supplied by the Set library. */
  public final ObjectValue setIteratorPrototype;

  private final ImmutableMap<ErrorKind, ObjectValue> errorPrototypes;

  public Realm() {
    objectPrototype = new ObjectValue(null);
    functionPrototype = new ObjectValue(objectPrototype);
    iteratorPrototype = new ObjectValue(objectPrototype);
    iteratorPrototype.defineMethod(
        Core.ITERATOR,
        NativeFunction.withPrototype(
            functionPrototype, "[Symbol.iterator]", 0, (realm, self, receiver, args) -> receiver));
    mapIteratorPrototype = new ObjectValue(iteratorPrototype);
    setIteratorPrototype = new ObjectValue(iteratorPrototype);
    Map<ErrorKind, ObjectValue> prototypes = new EnumMap<>(ErrorKind.class);
    ObjectValue errorPrototype = new ObjectValue(objectPrototype);
    for (ErrorKind kind : ErrorKind.values()) {
      ObjectValue proto =
          (kind == ErrorKind.ERROR) ? errorPrototype : new ObjectValue(errorPrototype);
      proto.defineMethod(Core.NAME, StringValue.of(kind.errorName));
      proto.defineMethod(Core.MESSAGE, StringValue.EMPTY);
      prototypes.put(kind, proto);
    }
    errorPrototypes = ImmutableMap.copyOf(prototypes);
    logger
        .atDebug()
        .setMessage("Realm created with {} error prototypes")
        .addArgument(errorPrototypes::size)
        .log();
  }

  /** Returns the prototype of errors of the given kind, e.g. {@code %TypeError.prototype%}. */
  public ObjectValue errorPrototype(ErrorKind kind) {
    return errorPrototypes.get(kind);
  }

  /** Returns a new error object of the given kind. */
  @FormatMethod
  public ErrorObject createError(ErrorKind kind, @FormatString String fmt, Object... args) {
    Preconditions.checkNotNull(kind);
    return new ErrorObject(errorPrototype(kind), kind, String.format(fmt, args));
  }

  /** Returns a throw completion whose value is a new error object of the given kind. */
  public Completion.Throw createErrorThrowCompletion(ErrorKind kind, String message) {
    return Completion.ofThrow(createError(kind, "%s", message));
  }
}
