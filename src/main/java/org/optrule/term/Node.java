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

import java.util.stream.Collectors;

/** The base class of every {@link Term}; fixes identity semantics and a debugging toString. */
public abstract class Node implements Term {

  protected Node() {}

  @Override
  public final boolean equals(Object other) {
    return this == other;
  }

  @Override
  public final int hashCode() {
    return System.identityHashCode(this);
  }

  /**
   * Returns a compact, unambiguous description of this term (e.g. {@code add(%x, 1)}), intended
   * for error messages and debugging; use a Formatter for readable output.
   */
  @Override
  public String toString() {
    String name = name();
    if (name != null) {
      return name;
    }
    return args().stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", opcode() + "(", ")"));
  }

  /** The operation name used by {@link #toString}. */
  protected String opcode() {
    return getClass().getSimpleName();
  }
}
