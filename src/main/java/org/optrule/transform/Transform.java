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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.optrule.term.Comparison;
import org.optrule.term.Constant;
import org.optrule.term.FunPred;
import org.optrule.term.Predicate;
import org.optrule.term.Term;
import org.optrule.term.Terms;
import org.optrule.typing.AmbiguousTypeException;
import org.optrule.typing.Constraint;
import org.optrule.typing.Type;
import org.optrule.typing.TypeConstraints;
import org.optrule.typing.TypeException;
import org.optrule.typing.TypeModel;
import org.optrule.typing.TypingOptions;
import org.optrule.typing.Validator;

/**
 * A transformation rule: wherever the {@link #src} pattern matches and the optional precondition
 * {@link #pre} holds, the {@link #tgt} pattern may be substituted for it.
 *
 * <p>Terms may be shared between the source, target, and precondition; an {@link
 * org.optrule.term.Input} that appears in more than one of them refers to the same value.
 */
public final class Transform {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public final String name;
  public final Term src;
  public final Term tgt;
  public final @Nullable Predicate pre;
  public final TypingOptions options;

  /** Computed by {@link #abstractTypeModel} the first time it is needed. */
  private @Nullable TypeModel model;

  public Transform(Term src, Term tgt) {
    this("", src, tgt, null);
  }

  public Transform(String name, Term src, Term tgt, @Nullable Predicate pre) {
    this(name, src, tgt, pre, TypingOptions.DEFAULT);
  }

  public Transform(
      String name, Term src, Term tgt, @Nullable Predicate pre, TypingOptions options) {
    this.name = name;
    this.src = src;
    this.tgt = tgt;
    this.pre = pre;
    this.options = options;
  }

  /**
   * Returns each term of the source, target, and precondition once. Each iteration makes a new
   * walk.
   */
  public Iterable<Term> subterms() {
    return () -> {
      Set<Term> seen = Sets.newIdentityHashSet();
      Iterator<Term> result =
          Iterators.concat(
              Terms.subterms(src, seen).iterator(), Terms.subterms(tgt, seen).iterator());
      return (pre == null)
          ? result
          : Iterators.concat(result, Terms.subterms(pre, seen).iterator());
    };
  }

  /**
   * Collects the typing constraints of every term in this transformation, and requires the source
   * and target to have the same type.
   *
   * <p>A type variable introduced by the target or precondition that is not unified with any term
   * of the source would make the transformation ambiguous. If such a variable includes an
   * immediate operand of a comparison or predicate function in the precondition, it is given a
   * default type; otherwise an {@link AmbiguousTypeException} is thrown.
   */
  public TypeConstraints typeConstraints() throws TypeException {
    logger.atFine().log("%s: Gathering type constraints", name);
    TypeConstraints tcs = new TypeConstraints(options);
    Set<Term> seen = Sets.newIdentityHashSet();
    for (Term term : Terms.subterms(src, seen)) {
      term.typeConstraints(tcs);
    }
    // The type variables fixed by the source.
    ImmutableList<Term> srcReps = tcs.reps();

    List<Term> defaultable = new ArrayList<>();
    if (pre != null) {
      for (Term term : Terms.subterms(pre, seen)) {
        term.typeConstraints(tcs);
        if (term instanceof Comparison || term instanceof FunPred) {
          defaultable.addAll(term.args());
        }
      }
    }
    for (Term term : Terms.subterms(tgt, seen)) {
      term.typeConstraints(tcs);
    }
    tcs.eqTypes(src, tgt);

    // The variables introduced by the target or precondition.
    Set<Term> reps = new LinkedHashSet<>();
    for (Term rep : tcs.reps()) {
      if (!tcs.isSpecific(rep) && tcs.constraint(rep) != Constraint.BOOL) {
        reps.add(rep);
      }
    }
    for (Term rep : srcReps) {
      reps.remove(tcs.rep(rep));
    }
    if (!reps.isEmpty()) {
      for (Term term : defaultable) {
        Term rep = tcs.rep(term);
        if (reps.remove(rep)) {
          tcs.applyDefault(rep);
        }
      }
    }
    if (!reps.isEmpty()) {
      Formatter fmt = new Formatter();
      throw new AmbiguousTypeException(
          reps.stream()
              .map(rep -> fmt.operand(rep).toString())
              .collect(ImmutableList.toImmutableList()));
    }
    return tcs;
  }

  /** Returns the type model of this transformation, computing it the first time it is called. */
  public TypeModel abstractTypeModel() throws TypeException {
    if (model == null) {
      model = typeConstraints().getTypeModel();
    }
    return model;
  }

  /**
   * Returns each assignment of concrete types to the type variables of {@link #abstractTypeModel}
   * that satisfies its constraints. The result is computed lazily, and may be iterated more than
   * once.
   */
  public Iterable<ImmutableList<Type>> typeModels() throws TypeException {
    return abstractTypeModel().typeVectors();
  }

  /**
   * Returns true if assigning the given types to the variables of {@link #abstractTypeModel}
   * satisfies every constraint of this transformation. Never throws; returns false if this
   * transformation cannot be typed at all, or if {@code vector} has the wrong length or a null
   * entry.
   */
  public boolean validateModel(List<Type> vector) {
    if (vector.stream().anyMatch(Objects::isNull)) {
      logger.atFine().log("%s: rejected vector with a missing type", name);
      return false;
    }
    try {
      Validator validator = new Validator(abstractTypeModel(), vector);
      validator.eqTypes(src, tgt);
      for (Term term : subterms()) {
        logger.atFinest().log("checking %s", new Formatted(term));
        term.typeConstraints(validator);
      }
    } catch (TypeException e) {
      logger.atFine().log("%s: %s rejected: %s", name, vector, e.getMessage());
      return false;
    }
    return true;
  }

  /**
   * Returns the constants that should be defined separately when this transformation is printed:
   * those used more than once in the target and precondition. Each is listed before any that
   * refer to it.
   */
  public ImmutableList<Constant> constantDefs() {
    return ConstantDefs.find(
        tgt, (pre == null) ? Collections.<Term>emptyList() : ImmutableList.<Term>of(pre));
  }

  /** Returns a Doc that formats this transformation when rendered. */
  public Formatted format() {
    return new Formatted(this);
  }

  @Override
  public String toString() {
    return format().toString();
  }
}
