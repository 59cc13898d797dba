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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Static methods for walking the DAG of terms below a root. */
public final class Terms {

  private Terms() {}

  /**
   * Returns the terms reachable from {@code root} (including {@code root} itself) that are not
   * already in {@code seen}, each operand before the terms that use it. Each term is added to
   * {@code seen} as it is reached, so passing the same set when walking several roots visits each
   * shared term only once.
   *
   * <p>The walk is lazy; since it consumes {@code seen}, iterating the result a second time yields
   * nothing new. To restart a walk, pass a fresh set.
   */
  public static Iterable<Term> subterms(Term root, Set<Term> seen) {
    return () -> new SubtermIterator(root, seen);
  }

  /** Equivalent to {@code subterms(root, Sets.newIdentityHashSet())}. */
  public static Iterable<Term> subterms(Term root) {
    return subterms(root, Sets.newIdentityHashSet());
  }

  /**
   * Returns the instructions reachable from {@code root} through other instructions, each operand
   * before its users. Returns an empty list if {@code root} is not an Instruction.
   */
  public static ImmutableList<Instruction> getInsts(Term root) {
    ImmutableList.Builder<Instruction> insts = ImmutableList.builder();
    walkInsts(root, insts, Sets.newIdentityHashSet());
    return insts.build();
  }

  private static void walkInsts(
      Term term, ImmutableList.Builder<Instruction> insts, Set<Term> seen) {
    if (!(term instanceof Instruction inst) || !seen.add(term)) {
      return;
    }
    for (Term arg : inst.args()) {
      walkInsts(arg, insts, seen);
    }
    insts.add(inst);
  }

  /**
   * Adds to {@code uses} one use of each operand for every parent that refers to it in the DAG
   * rooted at {@code root}. A term's operands are only counted the first time the term is reached,
   * so the same multiset can accumulate the uses of several roots that share terms. The root itself
   * is not counted.
   */
  @CanIgnoreReturnValue
  public static Multiset<Term> countUses(Term root, Multiset<Term> uses) {
    for (Term arg : root.args()) {
      if (!uses.contains(arg)) {
        countUses(arg, uses);
      }
      uses.add(arg);
    }
    return uses;
  }

  /** Returns the number of uses of each term below {@code root}; see {@link #countUses}. */
  public static Multiset<Term> countUses(Term root) {
    return countUses(root, HashMultiset.create());
  }

  /** A post-order walk that keeps an explicit stack of the terms whose operands are in progress. */
  private static final class SubtermIterator extends AbstractIterator<Term> {
    private final Set<Term> seen;
    private final ArrayDeque<Frame> stack = new ArrayDeque<>();
    private @Nullable Term root;

    SubtermIterator(Term root, Set<Term> seen) {
      this.root = root;
      this.seen = seen;
    }

    private void visit(Term term) {
      if (seen.add(term)) {
        stack.push(new Frame(term));
      }
    }

    @Override
    protected @Nullable Term computeNext() {
      if (root != null) {
        visit(root);
        root = null;
      }
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (top.next < top.args.size()) {
          visit(top.args.get(top.next++));
        } else {
          stack.pop();
          return top.term;
        }
      }
      return endOfData();
    }
  }

  private static final class Frame {
    final Term term;
    final ImmutableList<Term> args;
    int next;

    Frame(Term term) {
      this.term = term;
      this.args = term.args();
    }
  }
}
