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
import org.guestlang.impl.ObjectValue;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of {@link IteratorOps#iteratorStep}: either {@link #EXHAUSTED}, or a step that holds
 * the iterator's (not yet unwrapped) result object.
 */
public final class Step {

  /** The iterator reported {@code done}. */
  public static final Step EXHAUSTED = new Step(null);

  private final @Nullable ObjectValue result;

  private Step(@Nullable ObjectValue result) {
    this.result = result;
  }

  /** Returns a step holding the given result object. */
  static Step of(ObjectValue result) {
    return new Step(Preconditions.checkNotNull(result));
  }

  public boolean isExhausted() {
    return result == null;
  }

  /**
   * Returns the iterator result object, to be passed to {@link IteratorOps#iteratorValue}. Should
   * not be called on {@link #EXHAUSTED}.
   */
  public ObjectValue result() {
    Preconditions.checkState(result != null, "Iterator is exhausted");
    return result;
  }

  @Override
  public String toString() {
    return isExhausted() ? "EXHAUSTED" : "Step(" + result + ")";
  }
}
