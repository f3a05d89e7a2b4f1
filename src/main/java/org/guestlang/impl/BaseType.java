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
 * Every Value has a BaseType. The set of BaseTypes is closed: the object model extends the guest
 * language through objects and their prototypes, never by adding new BaseTypes.
 */
public enum BaseType {
  UNDEFINED,
  NULL,
  BOOLEAN,
  NUMBER,
  STRING,
  SYMBOL,
  OBJECT;

  /** True for {@link #UNDEFINED} and {@link #NULL}, the values that have no properties at all. */
  public boolean isNullish() {
    return this == UNDEFINED || this == NULL;
  }
}
