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
 * A Completion records how a piece of guest code finished: normally with a value, or abruptly by
 * throwing, returning, breaking, or continuing.
 *
 * <p>Completions are plain values. Code that must arbitrate between two outcomes (see {@code
 * IteratorOps.iteratorClose}) inspects them rather than nesting exception handlers. When a throw
 * completion has to cross ordinary Java calls it is carried by a {@link BuiltinException}.
 */
public abstract class Completion {

  private final Value value;

  private Completion(Value value) {
    this.value = Preconditions.checkNotNull(value);
  }

  /** The completion's value; {@code undefined} for break and continue. */
  public Value value() {
    return value;
  }

  /** True for every kind except {@link Normal}. */
  public abstract boolean isAbrupt();

  /** True only for {@link Throw}. */
  public boolean isThrow() {
    return false;
  }

  public static Normal normal(Value value) {
    return new Normal(value);
  }

  public static Throw ofThrow(Value value) {
    return new Throw(value);
  }

  public static Return ofReturn(Value value) {
    return new Return(value);
  }

  public static Break ofBreak(@Nullable String target) {
    return new Break(target);
  }

  public static Continue ofContinue(@Nullable String target) {
    return new Continue(target);
  }

  /** A normal completion. */
  public static final class Normal extends Completion {
    private Normal(Value value) {
      super(value);
    }

    @Override
    public boolean isAbrupt() {
      return false;
    }

    @Override
    public String toString() {
      return "Normal(" + value() + ")";
    }
  }

  /** The superclass of all abrupt completions. */
  public abstract static class Abrupt extends Completion {
    private Abrupt(Value value) {
      super(value);
    }

    @Override
    public final boolean isAbrupt() {
      return true;
    }
  }

  /** A thrown value. */
  public static final class Throw extends Abrupt {
    private Throw(Value value) {
      super(value);
    }

    @Override
    public boolean isThrow() {
      return true;
    }

    /** Returns a BuiltinException carrying this completion. */
    public BuiltinException asException() {
      return new BuiltinException(this);
    }

    @Override
    public String toString() {
      return "Throw(" + value() + ")";
    }
  }

  /** An early return from the enclosing function. */
  public static final class Return extends Abrupt {
    private Return(Value value) {
      super(value);
    }

    @Override
    public String toString() {
      return "Return(" + value() + ")";
    }
  }

  /**
   * The shared part of {@link Break} and {@link Continue}: both transfer control to a (possibly
   * labelled) enclosing statement and carry no value.
   */
  abstract static class Jump extends Abrupt {
    final @Nullable String target;

    private Jump(@Nullable String target) {
      super(Core.UNDEFINED);
      this.target = target;
    }

    /** The label of the targeted statement, or null for the innermost one. */
    public @Nullable String target() {
      return target;
    }

    String describe(String kind) {
      return (target == null) ? kind : kind + "(" + target + ")";
    }
  }

  /** A {@code break}, optionally labelled. */
  public static final class Break extends Jump {
    private Break(@Nullable String target) {
      super(target);
    }

    @Override
    public String toString() {
      return describe("Break");
    }
  }

  /** A {@code continue}, optionally labelled. */
  public static final class Continue extends Jump {
    private Continue(@Nullable String target) {
      super(target);
    }

    @Override
    public String toString() {
      return describe("Continue");
    }
  }
}
