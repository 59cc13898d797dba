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
import java.util.Arrays;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/**
 * A disjunction of predicates; the empty disjunction is false.
 *
 * <p>Clauses that are themselves {@link OrPred}s are flattened into this one, so the clause list
 * never contains a nested OrPred.
 */
public final class OrPred extends Predicate {
  public final ImmutableList<Predicate> clauses;

  public OrPred(Predicate... clauses) {
    this(Arrays.asList(clauses));
  }

  public OrPred(Iterable<? extends Predicate> clauses) {
    ImmutableList.Builder<Predicate> builder = ImmutableList.builder();
    for (Predicate p : clauses) {
      if (p instanceof OrPred nested) {
        builder.addAll(nested.clauses);
      } else {
        builder.add(p);
      }
    }
    this.clauses = builder.build();
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.copyOf(clauses);
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.bool(this);
  }
}
