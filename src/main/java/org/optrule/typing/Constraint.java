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

package org.optrule.typing;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The abstract constraint on a type variable, i.e. the set of kinds of {@link Type} it may be
 * assigned. Constraints form a meet-semilattice:
 *
 * <pre>
 *          FIRST_CLASS
 *         /           \
 *     NUMBER        INT_PTR
 *     /    \        /     \
 *  FLOAT     INT        PTR
 *             |
 *           BOOL
 * </pre>
 *
 * BOOL admits only {@code i1}.
 */
public enum Constraint {
  FIRST_CLASS(Kinds.INT | Kinds.FLOAT | Kinds.PTR),
  NUMBER(Kinds.INT | Kinds.FLOAT),
  INT_PTR(Kinds.INT | Kinds.PTR),
  FLOAT(Kinds.FLOAT),
  PTR(Kinds.PTR),
  INT(Kinds.INT),
  BOOL(Kinds.INT);

  private static class Kinds {
    static final int INT = 1;
    static final int FLOAT = 2;
    static final int PTR = 4;
  }

  private final int kinds;

  Constraint(int kinds) {
    this.kinds = kinds;
  }

  /**
   * Returns the most general constraint satisfied by every type that satisfies both this and
   * {@code other}, or null if there is no such type.
   */
  public @Nullable Constraint meet(Constraint other) {
    if (this == other) {
      return this;
    } else if (this == BOOL || other == BOOL) {
      return ((this.kinds & other.kinds & Kinds.INT) != 0) ? BOOL : null;
    }
    int both = this.kinds & other.kinds;
    for (Constraint c : values()) {
      if (c != BOOL && c.kinds == both) {
        return c;
      }
    }
    return null;
  }

  /** Returns true if {@code type} satisfies this constraint. */
  public boolean admits(Type type) {
    if (this == BOOL) {
      return type.equals(IntType.I1);
    }
    return (kinds & kindOf(type)) != 0;
  }

  /**
   * Returns the types that satisfy this constraint, in the order in which they should be tried:
   * integers (of the configured widths) first, then floating point types, then pointers.
   */
  public ImmutableList<Type> candidates(TypingOptions options) {
    if (this == BOOL) {
      return ImmutableList.of(IntType.I1);
    }
    ImmutableList.Builder<Type> result = ImmutableList.builder();
    if ((kinds & Kinds.INT) != 0) {
      result.addAll(options.intTypes());
    }
    if ((kinds & Kinds.FLOAT) != 0) {
      result.add(FloatType.values());
    }
    if ((kinds & Kinds.PTR) != 0) {
      result.add(PtrType.PTR);
    }
    return result.build();
  }

  private static int kindOf(Type type) {
    if (type instanceof IntType) {
      return Kinds.INT;
    } else if (type instanceof FloatType) {
      return Kinds.FLOAT;
    } else {
      return Kinds.PTR;
    }
  }
}
