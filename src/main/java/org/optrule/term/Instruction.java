/*
 * Copyright 2025 The Retrospect Authors
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

package org.optrule.term;

import org.jspecify.annotations.Nullable;

/**
 * A value computed by an operation on other values. Instructions are always given a name when
 * printed (they are never inlined into their users), so rules usually name them explicitly.
 */
public abstract class Instruction extends Value {
  private final @Nullable String name;

  /** {@code name} may be null or empty if the instruction is unnamed. */
  protected Instruction(@Nullable String name) {
    this.name = (name == null || name.isEmpty()) ? null : name;
  }

  @Override
  public @Nullable String name() {
    return name;
  }
}
