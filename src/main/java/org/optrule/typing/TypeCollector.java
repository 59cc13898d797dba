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

import org.jspecify.annotations.Nullable;
import org.optrule.term.Term;

/**
 * The operations a {@link Term} uses to describe its own typing rules (see {@link
 * Term#typeConstraints}).
 *
 * <p>There are two implementations: {@link TypeConstraints} accumulates the constraints into an
 * abstract model, and {@link Validator} checks each constraint against a concrete assignment of
 * types. Either may throw a {@link TypeException} if a constraint is violated.
 */
public interface TypeCollector {

  /** Requires all of the given terms to have the same type. */
  void eqTypes(Term... terms) throws TypeException;

  /** Requires {@code term} to have the given type; does nothing if {@code type} is null. */
  void specific(Term term, @Nullable Type type) throws TypeException;

  /** Requires {@code term} to have an integer type. */
  void integer(Term term) throws TypeException;

  /** Requires {@code term} to have type {@code i1}. */
  void bool(Term term) throws TypeException;

  /** Requires {@code term} to have a pointer type. */
  void pointer(Term term) throws TypeException;

  /** Requires {@code term} to have an integer or pointer type. */
  void intPtr(Term term) throws TypeException;

  /** Requires {@code term} to have a floating-point type. */
  void floatingPoint(Term term) throws TypeException;

  /** Requires {@code term} to have an integer or floating-point type. */
  void number(Term term) throws TypeException;

  /** Requires {@code term} to have some type. */
  void firstClass(Term term) throws TypeException;

  /**
   * Requires {@code lo}'s type to be strictly narrower than {@code hi}'s; both must be integers or
   * both floating point.
   */
  void widthOrder(Term lo, Term hi) throws TypeException;

  /** Requires {@code term}'s type to satisfy {@code constraint}. */
  default void constrain(Term term, Constraint constraint) throws TypeException {
    switch (constraint) {
      case FIRST_CLASS -> firstClass(term);
      case NUMBER -> number(term);
      case INT_PTR -> intPtr(term);
      case FLOAT -> floatingPoint(term);
      case PTR -> pointer(term);
      case INT -> integer(term);
      case BOOL -> bool(term);
    }
  }
}
