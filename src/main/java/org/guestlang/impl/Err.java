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
import org.jspecify.annotations.Nullable;

/**
 * Describes an error that can be raised by the runtime, with a static instance for each one. The
 * message may contain {@code %s} placeholders that are filled in from the details passed to {@link
 * #asException(Realm, Object...)}; every placeholder must be given a detail.
 */
public final class Err {
  public final ErrorKind kind;
  private final String msg;

  /** The number of {@code %s} placeholders in {@link #msg}. */
  private final int numDetails;

  private Err(ErrorKind kind, String msg) {
    this.kind = kind;
    this.msg = msg;
    int count = 0;
    for (int i = msg.indexOf('%'); i >= 0; i = msg.indexOf('%', i + 2)) {
      Preconditions.checkArgument(msg.startsWith("%s", i), "Bad placeholder in \"%s\"", msg);
      count++;
    }
    this.numDetails = count;
  }

  /**
   * Operations that fail with a guest error throw a BuiltinException that wraps the corresponding
   * throw completion.
   */
  public static final class BuiltinException extends Exception {
    private final Completion.Throw completion;

    BuiltinException(Completion.Throw completion) {
      this.completion = completion;
    }

    /** The throw completion carried by this exception. */
    public Completion.Throw completion() {
      return completion;
    }

    /** The thrown guest value. */
    public Value thrownValue() {
      return completion.value();
    }

    /** If the thrown value was created by the runtime, its kind; otherwise null. */
    public @Nullable ErrorKind errorKind() {
      return (completion.value() instanceof ErrorObject err) ? err.kind() : null;
    }

    @Override
    public String getMessage() {
      return completion.value().toString();
    }
  }

  /**
   * Returns a BuiltinException for this Err. There must be exactly one detail for each placeholder
   * in the message.
   */
  public BuiltinException asException(Realm realm, Object... details) {
    Preconditions.checkArgument(
        details.length == numDetails,
        "%s takes %s details, not %s",
        this,
        numDetails,
        details.length);
    String message = (numDetails == 0) ? msg : String.format(msg, details);
    return realm.createErrorThrowCompletion(kind, message).asException();
  }

  @Override
  public String toString() {
    return kind.errorName + ": " + msg;
  }

  public static final Err NOT_CALLABLE = new Err(ErrorKind.TYPE_ERROR, "%s is not a function");

  public static final Err NULLISH_PROPERTY_ACCESS =
      new Err(ErrorKind.TYPE_ERROR, "Cannot read property %s of %s");

  public static final Err NOT_ITERABLE = new Err(ErrorKind.TYPE_ERROR, "%s is not iterable");

  public static final Err ITERATOR_RESULT_NOT_OBJECT =
      new Err(ErrorKind.TYPE_ERROR, "Iterator result %s is not an object");

  public static final Err RETURN_RESULT_NOT_OBJECT =
      new Err(ErrorKind.TYPE_ERROR, "Iterator return() result %s is not an object");

  public static final Err MISSING_INTERNAL_STATE =
      new Err(ErrorKind.TYPE_ERROR, "%s does not have an [[IteratorNext]] internal slot");

  public static final Err FOREIGN_RECEIVER =
      new Err(ErrorKind.TYPE_ERROR, "next() called on %s, which belongs to a different iterator");

  public static final Err NOT_AN_OBJECT = new Err(ErrorKind.TYPE_ERROR, "%s is not an object");

  public static final Err NOT_A_MAP =
      new Err(ErrorKind.TYPE_ERROR, "%s does not have a [[MapData]] internal slot");

  public static final Err NOT_A_SET =
      new Err(ErrorKind.TYPE_ERROR, "%s does not have a [[SetData]] internal slot");
}
