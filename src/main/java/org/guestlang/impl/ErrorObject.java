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

/**
 * An error object created by the runtime. It is an ordinary guest object (with a {@code message}
 * property and one of the realm's error prototypes), but also remembers its kind so that Java code
 * can inspect it without property lookups.
 */
public final class ErrorObject extends ObjectValue {
  private final ErrorKind kind;
  private final String message;

  ErrorObject(ObjectValue prototype, ErrorKind kind, String message) {
    super(prototype);
    this.kind = kind;
    this.message = message;
    defineMethod(Core.MESSAGE, StringValue.of(message));
  }

  public ErrorKind kind() {
    return kind;
  }

  public String message() {
    return message;
  }

  @Override
  public String className() {
    return "Error";
  }

  @Override
  public String toString() {
    return message.isEmpty() ? kind.errorName : kind.errorName + ": " + message;
  }
}
