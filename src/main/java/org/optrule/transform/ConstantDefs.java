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

package org.optrule.transform;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import org.optrule.term.Constant;
import org.optrule.term.Symbol;
import org.optrule.term.Term;
import org.optrule.term.Terms;

/** Finds the constants that should be given their own definitions when printing a target. */
public final class ConstantDefs {

  private ConstantDefs() {}

  /**
   * Returns the constants (other than symbols) in {@code tgt} that are used more than once,
   * counting uses in both {@code tgt} and {@code extraRoots}. The result is in the order the
   * constants are reached by {@link Terms#subterms}, so a constant appears before any constant
   * that refers to it.
   */
  public static ImmutableList<Constant> find(Term tgt, Iterable<? extends Term> extraRoots) {
    Multiset<Term> uses = Terms.countUses(tgt, HashMultiset.create());
    for (Term root : extraRoots) {
      Terms.countUses(root, uses);
    }
    ImmutableList.Builder<Constant> result = ImmutableList.builder();
    for (Term term : Terms.subterms(tgt)) {
      if (uses.count(term) > 1 && term instanceof Constant c && !(term instanceof Symbol)) {
        result.add(c);
      }
    }
    return result.build();
  }

  public static ImmutableList<Constant> find(Term tgt) {
    return find(tgt, ImmutableList.of());
  }
}
