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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.optrule.term.Term;

/**
 * A TypeConstraints accumulates the typing rules of a set of terms. Each term is a type variable;
 * {@link #eqTypes} merges variables (in a {@link DisjointSubsets}), and the remaining methods
 * narrow the {@link Constraint} of a variable's subset or pin it to a specific {@link Type}.
 *
 * <p>All per-subset state is keyed by the subset's current representative. Once every term has
 * recorded its constraints, {@link #getTypeModel} freezes the result into a {@link TypeModel}.
 */
public final class TypeConstraints implements TypeCollector {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TypingOptions options;

  private final DisjointSubsets<Term> sets = new DisjointSubsets<>();

  /** The constraint of each subset, keyed by representative. */
  private final Map<Term, Constraint> constraints = Maps.newIdentityHashMap();

  /** The subsets that have been pinned to a specific type, keyed by representative. */
  private final Map<Term, Type> specifics = Maps.newIdentityHashMap();

  /** Each call to {@link #widthOrder}, in order. */
  private final List<WidthOrder> widthOrders = new ArrayList<>();

  private record WidthOrder(Term lo, Term hi) {}

  public TypeConstraints() {
    this(TypingOptions.DEFAULT);
  }

  public TypeConstraints(TypingOptions options) {
    this.options = options;
  }

  public TypingOptions options() {
    return options;
  }

  /** Returns true if {@code term} has recorded at least one constraint. */
  public boolean contains(Term term) {
    return sets.contains(term);
  }

  /** Returns the representative of each type variable subset, in the order they were created. */
  public ImmutableList<Term> reps() {
    return sets.reps();
  }

  /** Returns the representative of the subset containing {@code term}. */
  public Term rep(Term term) {
    return sets.rep(term);
  }

  /** Returns the constraint on the subset represented by {@code rep}. */
  public Constraint constraint(Term rep) {
    Preconditions.checkArgument(sets.isRep(rep), "Not a representative: %s", rep);
    return constraints.get(rep);
  }

  /** Returns true if the subset represented by {@code rep} has been pinned to a specific type. */
  public boolean isSpecific(Term rep) {
    return specifics.containsKey(rep);
  }

  /** Returns the type that the subset represented by {@code rep} is pinned to, if any. */
  public @Nullable Type specificType(Term rep) {
    return specifics.get(rep);
  }

  /** Adds {@code term} as an unconstrained variable if it is new; returns its representative. */
  private Term ensure(Term term) {
    if (sets.add(term)) {
      constraints.put(term, Constraint.FIRST_CLASS);
    }
    return sets.rep(term);
  }

  private void narrow(Term term, Constraint constraint) throws TypeException {
    Term rep = ensure(term);
    Constraint prev = constraints.get(rep);
    Constraint meet = prev.meet(constraint);
    if (meet == null) {
      throw new TypeException(
          String.format(
              "Type of %s must be %s, but is also required to be %s", term, prev, constraint));
    }
    Type specific = specifics.get(rep);
    if (specific != null && !meet.admits(specific)) {
      throw new TypeException(
          String.format("Type of %s is %s, which is not %s", term, specific, constraint));
    }
    constraints.put(rep, meet);
  }

  @Override
  public void eqTypes(Term... terms) throws TypeException {
    if (terms.length == 0) {
      return;
    }
    Term first = terms[0];
    ensure(first);
    for (int i = 1; i < terms.length; i++) {
      merge(sets.rep(first), ensure(terms[i]));
    }
  }

  private void merge(Term r1, Term r2) throws TypeException {
    if (r1 == r2) {
      return;
    }
    Constraint c1 = constraints.get(r1);
    Constraint c2 = constraints.get(r2);
    Constraint meet = c1.meet(c2);
    if (meet == null) {
      throw new TypeException(
          String.format("Types of %s (%s) and %s (%s) cannot be equal", r1, c1, r2, c2));
    }
    Type s1 = specifics.get(r1);
    Type s2 = specifics.get(r2);
    if (s1 != null && s2 != null && !s1.equals(s2)) {
      throw new TypeException(
          String.format("Types of %s (%s) and %s (%s) cannot be equal", r1, s1, r2, s2));
    }
    Type specific = (s1 != null) ? s1 : s2;
    if (specific != null && !meet.admits(specific)) {
      throw new TypeException(
          String.format("Type %s of %s is not %s", specific, (s1 != null) ? r1 : r2, meet));
    }
    Term rep = sets.unify(r1, r2);
    Term absorbed = (rep == r1) ? r2 : r1;
    constraints.remove(absorbed);
    specifics.remove(absorbed);
    constraints.put(rep, meet);
    if (specific != null) {
      specifics.put(rep, specific);
    }
  }

  @Override
  public void specific(Term term, @Nullable Type type) throws TypeException {
    if (type == null) {
      return;
    }
    Term rep = ensure(term);
    Type prev = specifics.get(rep);
    if (prev != null && !prev.equals(type)) {
      throw new TypeException(
          String.format("Type of %s cannot be both %s and %s", term, prev, type));
    }
    Constraint constraint = constraints.get(rep);
    if (!constraint.admits(type)) {
      throw new TypeException(
          String.format("Type of %s must be %s, but is required to be %s", term, constraint, type));
    }
    specifics.put(rep, type);
  }

  @Override
  public void integer(Term term) throws TypeException {
    narrow(term, Constraint.INT);
  }

  @Override
  public void bool(Term term) throws TypeException {
    narrow(term, Constraint.BOOL);
  }

  @Override
  public void pointer(Term term) throws TypeException {
    narrow(term, Constraint.PTR);
  }

  @Override
  public void intPtr(Term term) throws TypeException {
    narrow(term, Constraint.INT_PTR);
  }

  @Override
  public void floatingPoint(Term term) throws TypeException {
    narrow(term, Constraint.FLOAT);
  }

  @Override
  public void number(Term term) throws TypeException {
    narrow(term, Constraint.NUMBER);
  }

  @Override
  public void firstClass(Term term) {
    ensure(term);
  }

  @Override
  public void widthOrder(Term lo, Term hi) {
    ensure(lo);
    ensure(hi);
    widthOrders.add(new WidthOrder(lo, hi));
  }

  /**
   * Pins the subset represented by {@code rep} to the default type for its constraint: the default
   * float type if it must be floating point, {@code ptr} if it must be a pointer, and otherwise the
   * default integer type. Booleans and subsets that are already specific are left alone.
   */
  public void applyDefault(Term rep) {
    Preconditions.checkArgument(sets.isRep(rep), "Not a representative: %s", rep);
    if (specifics.containsKey(rep)) {
      return;
    }
    Constraint constraint = constraints.get(rep);
    Type type =
        switch (constraint) {
          case BOOL -> null;
          case FLOAT -> options.defaultFloat();
          case PTR -> PtrType.PTR;
          default -> options.defaultInt();
        };
    if (type != null) {
      logger.atFine().log("Defaulting %s (%s) to %s", rep, constraint, type);
      specifics.put(rep, type);
    }
  }

  /**
   * Returns an immutable summary of these constraints, with one type variable per subset. Throws a
   * TypeException if a width order relates a subset to itself.
   */
  public TypeModel getTypeModel() throws TypeException {
    ImmutableList<Term> reps = sets.reps();
    Map<Term, Integer> repIndex = Maps.newIdentityHashMap();
    for (int i = 0; i < reps.size(); i++) {
      repIndex.put(reps.get(i), i);
    }
    Map<Term, Integer> varIndex = Maps.newIdentityHashMap();
    for (Term term : sets.elements()) {
      varIndex.put(term, repIndex.get(sets.rep(term)));
    }
    ImmutableList<Constraint> varConstraints =
        reps.stream().map(constraints::get).collect(ImmutableList.toImmutableList());
    ImmutableMap.Builder<Integer, Type> varSpecifics = ImmutableMap.builder();
    for (int i = 0; i < reps.size(); i++) {
      Type specific = specifics.get(reps.get(i));
      if (specific != null) {
        varSpecifics.put(i, specific);
      }
    }
    ImmutableList.Builder<TypeModel.WidthOrder> orders = ImmutableList.builder();
    for (WidthOrder order : widthOrders) {
      int lo = varIndex.get(order.lo());
      int hi = varIndex.get(order.hi());
      if (lo == hi) {
        throw new TypeException(
            String.format(
                "%s must be narrower than %s, but they have the same type",
                order.lo(), order.hi()));
      }
      orders.add(new TypeModel.WidthOrder(lo, hi));
    }
    logger.atFine().log(
        "Type model has %s variables (%s specific), %s width orders",
        reps.size(), specifics.size(), widthOrders.size());
    return new TypeModel(
        options,
        reps,
        varConstraints,
        varSpecifics.buildOrThrow(),
        orders.build(),
        Collections.unmodifiableMap(varIndex));
  }
}
