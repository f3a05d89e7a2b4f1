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

/**
 * An iterator object created by the runtime. Apart from its {@link IteratorState} it is an ordinary
 * object: its properties (including {@code next}) may be read, replaced, or deleted by guest code.
 */
public final class IteratorObject extends ObjectValue {
  private final IteratorState state;

  IteratorObject(ObjectValue prototype, IteratorState state) {
    super(prototype);
    this.state = Preconditions.checkNotNull(state);
  }

  public IteratorState state() {
    return state;
  }

  @Override
  public String className() {
    return state.className();
  }
}
