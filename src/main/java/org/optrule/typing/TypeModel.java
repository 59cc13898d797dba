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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.optrule.term.Term;

/**
 * An immutable summary of a completed {@link TypeConstraints}. Each subset of unified terms is a
 * type variable, numbered in the order its representative was created; a <i>type vector</i>
 * assigns a concrete {@link Type} to each variable.
 *
 * <p>{@link #typeVectors} enumerates every type vector that satisfies the variables' constraints,
 * specific types, and width orders.
 */
public final class TypeModel {

  /** Requires the type of variable {@code lo} to be narrower than that of variable {@code hi}. */
  record WidthOrder(int lo, int hi) {}

  private final TypingOptions options;
  private final ImmutableList<Term> vars;
  private final ImmutableList<Constraint> constraints;
  private final ImmutableMap<Integer, Type> specifics;
  private final ImmutableList<WidthOrder> widthOrders;
  private final Map<Term, Integer> varIndex;

  /** The types to try for each variable. */
  private final ImmutableList<ImmutableList<Type>> candidates;

  /**
   * Each width order, keyed by the larger of its two variable indices (i.e. by the variable whose
   * assignment completes it during enumeration).
   */
  private final ImmutableListMultimap<Integer, WidthOrder> ordersByLastVar;

  TypeModel(
      TypingOptions options,
      ImmutableList<Term> vars,
      ImmutableList<Constraint> constraints,
      ImmutableMap<Integer, Type> specifics,
      ImmutableList<WidthOrder> widthOrders,
      Map<Term, Integer> varIndex) {
    this.options = options;
    this.vars = vars;
    this.constraints = constraints;
    this.specifics = specifics;
    this.widthOrders = widthOrders;
    this.varIndex = varIndex;
    ImmutableList.Builder<ImmutableList<Type>> candidates = ImmutableList.builder();
    for (int i = 0; i < vars.size(); i++) {
      Type specific = specifics.get(i);
      candidates.add(
          (specific != null) ? ImmutableList.of(specific) : constraints.get(i).candidates(options));
    }
    this.candidates = candidates.build();
    this.ordersByLastVar =
        widthOrders.stream()
            .collect(
                ImmutableListMultimap.toImmutableListMultimap(
                    order -> Math.max(order.lo(), order.hi()), order -> order));
  }

  public TypingOptions options() {
    return options;
  }

  /** The number of type variables. */
  public int numVars() {
    return vars.size();
  }

  /** The representative term of the given type variable. */
  public Term var(int index) {
    return vars.get(index);
  }

  /** The constraint on the given type variable. */
  public Constraint constraint(int index) {
    return constraints.get(index);
  }

  /** The type the given variable is pinned to, or null if it is not specific. */
  public @Nullable Type specificType(int index) {
    return specifics.get(index);
  }

  /** The number of width orders between variables. */
  public int numWidthOrders() {
    return widthOrders.size();
  }

  /** The types that will be tried for the given variable. */
  public ImmutableList<Type> candidates(int index) {
    return candidates.get(index);
  }

  /** Returns the index of the type variable for {@code term}, or -1 if it has none. */
  public int varIndex(Term term) {
    Integer result = varIndex.get(term);
    return (result == null) ? -1 : result;
  }

  /**
   * Returns true if the types {@code vector} assigns to variables {@code 0..index} satisfy every
   * width order among those variables that involves {@code index}.
   */
  boolean satisfiesWidthOrders(int index, Type[] vector) {
    for (WidthOrder order : ordersByLastVar.get(index)) {
      if (!vector[order.lo()].isNarrowerThan(vector[order.hi()])) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns every valid type vector. The enumeration is lazy and each call to {@code iterator()}
   * starts again from the beginning; callers may stop iterating at any point.
   *
   * <p>Vectors are enumerated in lexicographic order of candidate choices, with the first variable
   * varying slowest.
   */
  public Iterable<ImmutableList<Type>> typeVectors() {
    return VectorIterator::new;
  }

  /** A depth-first search over the candidates for each variable, pruned by width orders. */
  private class VectorIterator extends AbstractIterator<ImmutableList<Type>> {
    private final int[] choices = new int[vars.size()];
    private final Type[] vector = new Type[vars.size()];

    /** The variable whose choice will be advanced next; -1 once the search is exhausted. */
    private int next;

    /** True until the first vector has been returned. */
    private boolean first = true;

    VectorIterator() {
      if (vars.isEmpty()) {
        next = -1;
      } else {
        next = 0;
        choices[0] = -1;
      }
    }

    @Override
    protected @Nullable ImmutableList<Type> computeNext() {
      if (vars.isEmpty()) {
        // There is exactly one (empty) vector.
        if (first) {
          first = false;
          return ImmutableList.of();
        }
        return endOfData();
      }
      int i = next;
      while (i >= 0) {
        if (++choices[i] >= candidates.get(i).size()) {
          i--;
          continue;
        }
        vector[i] = candidates.get(i).get(choices[i]);
        if (!satisfiesWidthOrders(i, vector)) {
          continue;
        }
        if (i == vector.length - 1) {
          next = i;
          first = false;
          return ImmutableList.copyOf(vector);
        }
        choices[++i] = -1;
      }
      next = -1;
      return endOfData();
    }
  }
}
