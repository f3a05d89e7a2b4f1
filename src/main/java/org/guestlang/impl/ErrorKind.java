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

/** The guest error constructors that the runtime itself may raise. */
public enum ErrorKind {
  ERROR("Error"),
  TYPE_ERROR("TypeError");

  /** The value of {@code name} on this kind's prototype. */
  public final String errorName;

  ErrorKind(String errorName) {
    this.errorName = errorName;
  }
}
