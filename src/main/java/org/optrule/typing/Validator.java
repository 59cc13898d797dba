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
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.optrule.term.Term;

/**
 * A TypeCollector that checks each constraint against a concrete type vector for a {@link
 * TypeModel}, throwing a {@link TypeException} at the first violation.
 */
public final class Validator implements TypeCollector {

  private final TypeModel model;
  private final ImmutableList<Type> vector;

  public Validator(TypeModel model, List<Type> vector) {
    this.model = model;
    this.vector = ImmutableList.copyOf(vector);
  }

  /** Returns the type that the vector assigns to {@code term}. */
  public Type typeOf(Term term) throws TypeException {
    if (vector.size() != model.numVars()) {
      throw new TypeException(
          String.format("Type vector has %s entries, expected %s", vector.size(), model.numVars()));
    }
    int index = model.varIndex(term);
    if (index < 0) {
      throw new TypeException("No type variable for " + term);
    }
    return vector.get(index);
  }

  private void check(Term term, Constraint constraint) throws TypeException {
    Type type = typeOf(term);
    if (!constraint.admits(type)) {
      throw new TypeException(
          String.format("Type of %s is %s, which is not %s", term, type, constraint));
    }
  }

  @Override
  public void eqTypes(Term... terms) throws TypeException {
    if (terms.length == 0) {
      return;
    }
    Type first = typeOf(terms[0]);
    for (int i = 1; i < terms.length; i++) {
      Type type = typeOf(terms[i]);
      if (!type.equals(first)) {
        throw new TypeException(
            String.format("%s has type %s but %s has type %s", terms[0], first, terms[i], type));
      }
    }
  }

  @Override
  public void specific(Term term, @Nullable Type type) throws TypeException {
    if (type != null && !typeOf(term).equals(type)) {
      throw new TypeException(
          String.format("Type of %s is %s, expected %s", term, typeOf(term), type));
    }
  }

  @Override
  public void integer(Term term) throws TypeException {
    check(term, Constraint.INT);
  }

  @Override
  public void bool(Term term) throws TypeException {
    check(term, Constraint.BOOL);
  }

  @Override
  public void pointer(Term term) throws TypeException {
    check(term, Constraint.PTR);
  }

  @Override
  public void intPtr(Term term) throws TypeException {
    check(term, Constraint.INT_PTR);
  }

  @Override
  public void floatingPoint(Term term) throws TypeException {
    check(term, Constraint.FLOAT);
  }

  @Override
  public void number(Term term) throws TypeException {
    check(term, Constraint.NUMBER);
  }

  @Override
  public void firstClass(Term term) throws TypeException {
    var unused = typeOf(term);
  }

  @Override
  public void widthOrder(Term lo, Term hi) throws TypeException {
    Type loType = typeOf(lo);
    Type hiType = typeOf(hi);
    if (!loType.isNarrowerThan(hiType)) {
      throw new TypeException(
          String.format("%s (%s) must be narrower than %s (%s)", lo, loType, hi, hiType));
    }
  }
}
