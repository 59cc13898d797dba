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

import static org.optrule.pretty.Doc.BREAK;
import static org.optrule.pretty.Doc.EMPTY;
import static org.optrule.pretty.Doc.LINE;
import static org.optrule.pretty.Doc.group;
import static org.optrule.pretty.Doc.seq;
import static org.optrule.pretty.Doc.text;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.optrule.pretty.Doc;
import org.optrule.term.AndPred;
import org.optrule.term.BinaryCnxp;
import org.optrule.term.BinaryOperator;
import org.optrule.term.Comparison;
import org.optrule.term.ConversionInst;
import org.optrule.term.FLiteral;
import org.optrule.term.FcmpInst;
import org.optrule.term.FunCnxp;
import org.optrule.term.FunPred;
import org.optrule.term.IcmpInst;
import org.optrule.term.Input;
import org.optrule.term.Instruction;
import org.optrule.term.Literal;
import org.optrule.term.NotPred;
import org.optrule.term.OrPred;
import org.optrule.term.PoisonValue;
import org.optrule.term.Predicate;
import org.optrule.term.SelectInst;
import org.optrule.term.Symbol;
import org.optrule.term.Term;
import org.optrule.term.Terms;
import org.optrule.term.UndefValue;
import org.optrule.term.UnaryCnxp;
import org.optrule.term.Value;

/**
 * An immutable mapping from classes to the {@link Printer} used to format instances of them.
 *
 * <p>The printer for an object is the one registered for its class or, failing that, for its
 * nearest registered superclass. New kinds of term can be supported by registering a printer for
 * them with {@link #withPrinter}; asking for the printer of an object with no registered printer is
 * an error in the caller.
 */
public final class TermPrinters {

  /** Formats an item as a Doc. */
  @FunctionalInterface
  public interface Printer<T> {
    /**
     * Returns a Doc for {@code item}, using {@code fmt} for its operands. {@code prec} is the
     * precedence of the enclosing context (0 if there is none); if the result would bind less
     * tightly it should be parenthesized.
     */
    Doc print(T item, Formatter fmt, int prec);
  }

  /** A TermPrinters with no printers. */
  public static final TermPrinters EMPTY_PRINTERS = new TermPrinters(ImmutableMap.of());

  /** Printers for Docs (which format as themselves), Transforms, and each built-in kind of term. */
  public static final TermPrinters STANDARD =
      EMPTY_PRINTERS
          .withPrinter(Doc.class, (doc, fmt, prec) -> doc)
          .withPrinter(Transform.class, (opt, fmt, prec) -> formatTransform(opt, fmt))
          .withPrinter(Input.class, (term, fmt, prec) -> text(fmt.name(term)))
          .withPrinter(Symbol.class, (term, fmt, prec) -> text(fmt.name(term)))
          .withPrinter(BinaryOperator.class, TermPrinters::binaryOperator)
          .withPrinter(ConversionInst.class, TermPrinters::conversion)
          .withPrinter(IcmpInst.class, TermPrinters::icmp)
          .withPrinter(FcmpInst.class, TermPrinters::fcmp)
          .withPrinter(SelectInst.class, TermPrinters::select)
          .withPrinter(Literal.class, (term, fmt, prec) -> text(Long.toString(term.value)))
          .withPrinter(FLiteral.class, (term, fmt, prec) -> text(Double.toString(term.value)))
          .withPrinter(UndefValue.class, (term, fmt, prec) -> text("undef"))
          .withPrinter(PoisonValue.class, (term, fmt, prec) -> text("poison"))
          .withPrinter(BinaryCnxp.class, TermPrinters::binaryCnxp)
          .withPrinter(UnaryCnxp.class, TermPrinters::unaryCnxp)
          .withPrinter(
              FunCnxp.class, (term, fmt, prec) -> function(term.fn.code, term.fnArgs, fmt))
          .withPrinter(
              FunPred.class, (term, fmt, prec) -> function(term.fn.code, term.fnArgs, fmt))
          .withPrinter(AndPred.class, TermPrinters::and)
          .withPrinter(OrPred.class, TermPrinters::or)
          .withPrinter(NotPred.class, (term, fmt, prec) -> seq(text("!"), fmt.operand(term.p, 10)))
          .withPrinter(Comparison.class, TermPrinters::comparison);

  /** The precedence of {@code &&}; see {@link BinaryCnxp.Code#precedence}. */
  private static final int AND_PREC = 2;

  /** The precedence of {@code ||}. */
  private static final int OR_PREC = 1;

  /** The precedence of comparisons. */
  private static final int CMP_PREC = 3;

  /** Used for the operand of a prefix operator, which is parenthesized unless it is atomic. */
  private static final int PREFIX_PREC = 10;

  private final ImmutableMap<Class<?>, Printer<?>> printers;

  private TermPrinters(ImmutableMap<Class<?>, Printer<?>> printers) {
    this.printers = printers;
  }

  /**
   * Returns a TermPrinters that uses {@code printer} for instances of {@code cls} (and of any
   * subclass without a more specific printer), and otherwise behaves like this one.
   */
  public <T> TermPrinters withPrinter(Class<T> cls, Printer<? super T> printer) {
    Map<Class<?>, Printer<?>> newPrinters = new LinkedHashMap<>(printers);
    newPrinters.put(cls, printer);
    return new TermPrinters(ImmutableMap.copyOf(newPrinters));
  }

  /** Returns the printer that would be used for an instance of {@code cls}, or null if none. */
  public @Nullable Printer<?> printerFor(Class<?> cls) {
    for (Class<?> c = cls; c != null; c = c.getSuperclass()) {
      Printer<?> printer = printers.get(c);
      if (printer != null) {
        return printer;
      }
    }
    return null;
  }

  /**
   * Formats {@code item} with the printer registered for it.
   *
   * @throws AssertionError if there is no suitable printer
   */
  @SuppressWarnings("unchecked")
  public Doc format(Object item, Formatter fmt, int prec) {
    Printer<Object> printer = (Printer<Object>) printerFor(item.getClass());
    if (printer == null) {
      throw new AssertionError("Can't format " + item.getClass().getSimpleName());
    }
    return printer.print(item, fmt, prec);
  }

  private static Doc binaryOperator(BinaryOperator term, Formatter fmt, int prec) {
    String code = term.code.toString();
    return group(
            text(code + " "),
            term.flags.isEmpty() ? EMPTY : text(String.join(" ", term.flags) + " "),
            fmt.operand(term.x, 0, term.ty),
            text(","),
            LINE,
            fmt.operand(term.y, 0))
        .nest(code.length() + 1);
  }

  private static Doc conversion(ConversionInst term, Formatter fmt, int prec) {
    String code = term.code.toString();
    Doc body = seq(text(code + " "), fmt.operand(term.arg, 0, term.srcTy));
    if (term.ty != null) {
      body = seq(body, LINE, text("to " + term.ty));
    }
    return group(body).nest(code.length() + 1);
  }

  private static Doc icmp(IcmpInst term, Formatter fmt, int prec) {
    return group(
            text("icmp " + term.pred),
            LINE,
            fmt.operand(term.x, 0, term.ty),
            text(","),
            LINE,
            fmt.operand(term.y, 0))
        .nest(5);
  }

  private static Doc fcmp(FcmpInst term, Formatter fmt, int prec) {
    StringBuilder head = new StringBuilder("fcmp");
    term.flags.forEach(f -> head.append(' ').append(f));
    if (!term.pred.isEmpty()) {
      head.append(' ').append(term.pred);
    }
    boolean hasModifiers = !term.flags.isEmpty() || !term.pred.isEmpty();
    return group(
            text(head.toString()),
            hasModifiers ? LINE : text(" "),
            fmt.operand(term.x, 0, term.ty),
            text(","),
            LINE,
            fmt.operand(term.y, 0))
        .nest(5);
  }

  private static Doc select(SelectInst term, Formatter fmt, int prec) {
    return group(
            text("select "),
            fmt.operand(term.sel, 0),
            text(","),
            LINE,
            fmt.operand(term.arg1, 0, term.ty1),
            text(","),
            LINE,
            fmt.operand(term.arg2, 0, term.ty2))
        .nest(7);
  }

  /**
   * Formats a chain of BinaryCnxps with the same precedence as a single sequence, e.g. {@code a +
   * b - c} rather than {@code (a + b) - c}. Right operands are only included in the chain if the
   * operator is associative.
   */
  private static Doc binaryCnxp(BinaryCnxp term, Formatter fmt, int prec) {
    int opPrec = term.code.precedence;
    Doc body = gather(term, opPrec, fmt);
    if (prec >= opPrec || (0 < prec && prec < 8)) {
      body = seq(text("("), body, text(")"));
    }
    return group(body).nest(2);
  }

  private static Doc gather(Term term, int opPrec, Formatter fmt) {
    if (!(term instanceof BinaryCnxp cnxp) || cnxp.code.precedence != opPrec) {
      return fmt.operand(term, opPrec);
    }
    return seq(
        gather(cnxp.x, opPrec, fmt),
        LINE,
        text(cnxp.code.symbol + " "),
        cnxp.code.leftAssociative ? fmt.operand(cnxp.y, opPrec) : gather(cnxp.y, opPrec, fmt));
  }

  private static Doc unaryCnxp(UnaryCnxp term, Formatter fmt, int prec) {
    return seq(text(term.code.symbol), fmt.operand(term.x, PREFIX_PREC));
  }

  private static Doc function(String code, List<Value> args, Formatter fmt) {
    List<Doc> docs = new ArrayList<>();
    for (Value arg : args) {
      docs.add(fmt.operand(arg, 0));
    }
    return group(
            text(code + "("),
            args.isEmpty() ? EMPTY : BREAK,
            seq(text(","), LINE).join(docs),
            text(")"))
        .nest(2);
  }

  private static Doc and(AndPred term, Formatter fmt, int prec) {
    if (term.clauses.isEmpty()) {
      return text("true");
    }
    return connective(term.clauses, "&& ", AND_PREC, fmt, prec);
  }

  private static Doc or(OrPred term, Formatter fmt, int prec) {
    if (term.clauses.isEmpty()) {
      return text("!true");
    }
    return connective(term.clauses, "|| ", OR_PREC, fmt, prec);
  }

  private static Doc connective(
      List<Predicate> clauses, String op, int opPrec, Formatter fmt, int prec) {
    List<Doc> docs = new ArrayList<>();
    for (Predicate clause : clauses) {
      docs.add(fmt.operand(clause, opPrec).nest(3));
    }
    Doc body = seq(LINE, text(op)).join(docs);
    if (prec > opPrec) {
      body = seq(text("("), body, text(")"));
    }
    return group(body);
  }

  private static Doc comparison(Comparison term, Formatter fmt, int prec) {
    Doc body =
        seq(
            fmt.operand(term.x, CMP_PREC).nest(3),
            LINE,
            text(term.op.symbol + " "),
            fmt.operand(term.y, CMP_PREC).nest(3));
    if (prec > CMP_PREC) {
      body = seq(text("("), body, text(")"));
    }
    return group(body);
  }

  /** One line of a formatted transform: {@code name = decl}. */
  private record Decl(String name, Doc decl) {}

  /**
   * Formats a whole transformation: an optional {@code Name:} line, the precondition, the source
   * instructions, {@code =>}, then any shared constants and the target instructions. The target
   * root is given the name of the source root, and the {@code =} signs are aligned.
   */
  private static Doc formatTransform(Transform opt, Formatter fmt) {
    ImmutableList<Term> headerTerms =
        (opt.pre == null) ? ImmutableList.of() : ImmutableList.of(opt.pre);
    List<Decl> srcDecls = new ArrayList<>();
    for (Instruction inst : Terms.getInsts(opt.src)) {
      srcDecls.add(new Decl(fmt.name(inst), fmt.format(inst, 0)));
    }
    List<Decl> tgtDecls = new ArrayList<>();
    for (Term cdef : ConstantDefs.find(opt.tgt, headerTerms)) {
      tgtDecls.add(new Decl(fmt.name(cdef), fmt.format(cdef, 0)));
    }
    Doc heads =
        (opt.pre == null)
            ? EMPTY
            : seq(text("Pre: "), fmt.format(opt.pre, 0).nest("Pre:".length() + 1), LINE);
    if (opt.tgt instanceof Instruction) {
      fmt.alias(opt.tgt, fmt.name(opt.src));
    }
    for (Instruction inst : Terms.getInsts(opt.tgt)) {
      if (!fmt.hasName(inst)) {
        tgtDecls.add(new Decl(fmt.name(inst), fmt.format(inst, 0)));
      }
    }
    tgtDecls.add(new Decl(fmt.name(opt.src), fmt.format(opt.tgt, 0)));

    int nameWidth = 0;
    for (Decl d : srcDecls) {
      nameWidth = Math.max(nameWidth, d.name().length());
    }
    for (Decl d : tgtDecls) {
      nameWidth = Math.max(nameWidth, d.name().length());
    }
    return seq(
        opt.name.isEmpty() ? EMPTY : seq(text("Name: " + opt.name), LINE),
        heads,
        text("  "),
        LINE.join(alignDecls(srcDecls, nameWidth)).nest(2),
        LINE,
        text("=>"),
        LINE,
        text("  "),
        LINE.join(alignDecls(tgtDecls, nameWidth)).nest(2),
        LINE);
  }

  private static List<Doc> alignDecls(List<Decl> decls, int nameWidth) {
    List<Doc> result = new ArrayList<>();
    for (Decl d : decls) {
      String padding = " ".repeat(nameWidth - d.name().length());
      result.add(seq(text(d.name() + padding + " = "), d.decl()).nest(nameWidth + 3));
    }
    return result;
  }
}
