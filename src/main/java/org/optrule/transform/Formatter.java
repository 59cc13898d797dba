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

import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.optrule.pretty.Doc;
import org.optrule.term.Constant;
import org.optrule.term.Instruction;
import org.optrule.term.Term;
import org.optrule.typing.Type;

/**
 * Chooses the names used when printing terms, and formats terms using a {@link TermPrinters}.
 *
 * <p>A Formatter should be used for a single print session: once a term has been given a name it
 * keeps it, and no two terms are given the same name.
 */
public final class Formatter {
  private final TermPrinters printers;

  /** The name assigned to each term. */
  private final Map<Term, String> ids = Maps.newIdentityHashMap();

  /** Every name that has been assigned. */
  private final Set<String> names = new HashSet<>();

  /** The counter used to generate names for unnamed terms. */
  private int fresh;

  public Formatter() {
    this(TermPrinters.STANDARD);
  }

  public Formatter(TermPrinters printers) {
    this.printers = printers;
  }

  public TermPrinters printers() {
    return printers;
  }

  /**
   * Returns the name of {@code term}, assigning one if it has not already been named.
   *
   * <p>A term's own name is used if it has one and that name is still free; otherwise the name is
   * generated from a counter shared by all terms, with the prefix {@code C} for constants and
   * {@code %} for anything else.
   */
  public String name(Term term) {
    String result = ids.get(term);
    if (result != null) {
      return result;
    }
    String prefix = (term instanceof Constant) ? "C" : "%";
    result = term.name();
    if (result == null) {
      result = prefix + fresh++;
    }
    while (names.contains(result)) {
      result = prefix + fresh++;
    }
    ids.put(term, result);
    names.add(result);
    return result;
  }

  /** Returns true if {@code term} has already been assigned a name. */
  public boolean hasName(Term term) {
    return ids.containsKey(term);
  }

  /**
   * Makes {@code term} print as {@code name}. Only used to give a transformation's target root the
   * same name as its source root, so {@code name} will already have been assigned.
   */
  void alias(Term term, String name) {
    ids.put(term, name);
  }

  /**
   * Returns a Doc that refers to {@code term} where it is used as an operand: its name if it has
   * been named (instructions are always named), otherwise {@code term} formatted with the given
   * precedence. If {@code type} is non-null it is printed before the operand.
   */
  public Doc operand(Term term, int prec, @Nullable Type type) {
    Doc doc =
        (ids.containsKey(term) || term instanceof Instruction)
            ? Doc.text(name(term))
            : new Formatted(term, this, prec);
    return (type == null) ? doc : Doc.seq(Doc.text(type + " "), doc);
  }

  public Doc operand(Term term, int prec) {
    return operand(term, prec, null);
  }

  public Doc operand(Term term) {
    return operand(term, 0, null);
  }

  /**
   * Returns a Doc for {@code item} (usually a Term) using the printer registered for its class.
   * {@code prec} is the precedence of the context in which it appears; a result that binds less
   * tightly must be parenthesized.
   */
  public Doc format(Object item, int prec) {
    return printers.format(item, this, prec);
  }
}
