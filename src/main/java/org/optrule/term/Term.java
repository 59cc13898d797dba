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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/**
 * A node in the directed acyclic graph of values and predicates that make up a transformation.
 *
 * <p>Terms are compared by identity: two terms are the same only if they are the same object, and
 * a term may be shared by any number of parents. Every implementation extends {@link Node}, which
 * makes {@code equals} and {@code hashCode} final, so Terms can be used safely as keys in ordinary
 * hash-based collections.
 */
public interface Term {

  /** The operands of this term, in order. */
  ImmutableList<Term> args();

  /** The name chosen for this term by the rule's author, or null if it has none. */
  default @Nullable String name() {
    return null;
  }

  /**
   * Describes this term's own typing rules to {@code tcs}; does not recurse into the operands,
   * which are expected to be visited separately.
   */
  void typeConstraints(TypeCollector tcs) throws TypeException;
}
