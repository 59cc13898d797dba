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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
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
import org.optrule.term.Literal;
import org.optrule.term.NotPred;
import org.optrule.term.OrPred;
import org.optrule.term.PoisonValue;
import org.optrule.term.SelectInst;
import org.optrule.term.Symbol;
import org.optrule.term.Term;
import org.optrule.term.UnaryCnxp;
import org.optrule.term.UndefValue;
import org.optrule.term.Value;
import org.optrule.typing.IntType;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

@RunWith(TestParameterInjector.class)
public class TermPrintersTest {

  private static final IntType I8 = new IntType(8);

  private final Input a = new Input("%a");
  private final Input b = new Input("%b");
  private final Input c = new Input("%c");
  private final Input x = new Input("%x");
  private final Input y = new Input("%y");

  private static String format(Object item) {
    return new Formatted(item).toString();
  }

  private static BinaryCnxp cnxp(BinaryCnxp.Code code, Value x, Value y) {
    return new BinaryCnxp(code, x, y);
  }

  @Test
  public void binaryPrecedence() {
    assertThat(format(cnxp(BinaryCnxp.Code.ADD, a, cnxp(BinaryCnxp.Code.MUL, b, c))))
        .isEqualTo("%a + %b * %c");
    assertThat(format(cnxp(BinaryCnxp.Code.MUL, cnxp(BinaryCnxp.Code.ADD, a, b), c)))
        .isEqualTo("(%a + %b) * %c");
    assertThat(format(cnxp(BinaryCnxp.Code.AND, a, cnxp(BinaryCnxp.Code.SHL, b, c))))
        .isEqualTo("%a & (%b << %c)");
  }

  @Test
  public void associativity() {
    assertThat(format(cnxp(BinaryCnxp.Code.SUB, a, cnxp(BinaryCnxp.Code.SUB, b, c))))
        .isEqualTo("%a - (%b - %c)");
    assertThat(format(cnxp(BinaryCnxp.Code.SUB, cnxp(BinaryCnxp.Code.SUB, a, b), c)))
        .isEqualTo("%a - %b - %c");
    assertThat(format(cnxp(BinaryCnxp.Code.ADD, a, cnxp(BinaryCnxp.Code.ADD, b, c))))
        .isEqualTo("%a + %b + %c");
  }

  @Test
  public void unaryAndFunctions() {
    assertThat(format(new UnaryCnxp(UnaryCnxp.Code.NEG, cnxp(BinaryCnxp.Code.ADD, a, b))))
        .isEqualTo("-(%a + %b)");
    assertThat(format(new UnaryCnxp(UnaryCnxp.Code.NOT, a))).isEqualTo("~%a");
    assertThat(format(new FunCnxp(FunCnxp.Function.LOG2, a))).isEqualTo("log2(%a)");
    assertThat(format(new FunCnxp(FunCnxp.Function.MAX, a, b))).isEqualTo("max(%a, %b)");
  }

  @Test
  public void constants() {
    assertThat(format(new Literal(-3))).isEqualTo("-3");
    assertThat(format(new FLiteral(1.5))).isEqualTo("1.5");
    assertThat(format(new UndefValue())).isEqualTo("undef");
    assertThat(format(new PoisonValue())).isEqualTo("poison");
    assertThat(format(new Symbol("C1"))).isEqualTo("C1");
  }

  @Test
  public void predicates() {
    assertThat(
            format(
                new AndPred(
                    new Comparison(Comparison.Op.ULT, a, b),
                    new FunPred(FunPred.Function.IS_POWER_OF_2, a))))
        .isEqualTo("%a u< %b && isPowerOf2(%a)");
    Comparison ab = new Comparison(Comparison.Op.EQ, a, b);
    Comparison ac = new Comparison(Comparison.Op.EQ, a, c);
    Comparison bc = new Comparison(Comparison.Op.EQ, b, c);
    assertThat(format(new AndPred(new OrPred(ab, ac), bc)))
        .isEqualTo("(%a == %b || %a == %c) && %b == %c");
    assertThat(format(new OrPred(ab, new AndPred(ac, bc))))
        .isEqualTo("%a == %b || %a == %c && %b == %c");
    assertThat(format(new AndPred())).isEqualTo("true");
    assertThat(format(new OrPred())).isEqualTo("!true");
    assertThat(format(new NotPred(ab))).isEqualTo("!(%a == %b)");
  }

  @Test
  public void comparisonSymbols(@TestParameter Comparison.Op op) {
    assertThat(format(new Comparison(op, a, b))).isEqualTo("%a " + op.symbol + " %b");
  }

  @Test
  public void instructions() {
    assertThat(
            format(
                new BinaryOperator(
                    BinaryOperator.Code.ADD, x, y, I8, ImmutableList.of("nsw"), "%r")))
        .isEqualTo("add nsw i8 %x, %y");
    assertThat(
            format(
                new ConversionInst(ConversionInst.Code.ZEXT, x, I8, new IntType(16), "%r")))
        .isEqualTo("zext i8 %x to i16");
    assertThat(format(new ConversionInst(ConversionInst.Code.ZEXT, x))).isEqualTo("zext %x");
    assertThat(format(new IcmpInst("eq", x, y))).isEqualTo("icmp eq %x, %y");
    assertThat(format(new FcmpInst("oeq", x, y, null, ImmutableList.of("nnan"), null)))
        .isEqualTo("fcmp nnan oeq %x, %y");
    assertThat(format(new FcmpInst("", x, y))).isEqualTo("fcmp %x, %y");
    assertThat(format(new SelectInst(c, a, b, I8, null, null)))
        .isEqualTo("select %c, i8 %a, %b");
  }

  @Test
  public void instructionOperandsAreNamed() {
    BinaryOperator inner = new BinaryOperator(BinaryOperator.Code.MUL, x, y);
    assertThat(format(new BinaryOperator(BinaryOperator.Code.ADD, inner, y)))
        .isEqualTo("add %0, %y");
  }

  @Test
  public void longOperandsWrap() {
    Input p = new Input("%" + "p".repeat(40));
    Input q = new Input("%" + "q".repeat(40));
    assertThat(format(new FunPred(FunPred.Function.WILL_NOT_OVERFLOW_SIGNED_ADD, p, q)))
        .isEqualTo(
            "WillNotOverflowSignedAdd( \\\n  " + p.name() + ", \\\n  " + q.name() + ")");
  }

  /** A kind of value that the standard printers know nothing about. */
  private static final class Weird extends Value {
    @Override
    public ImmutableList<Term> args() {
      return ImmutableList.of();
    }

    @Override
    public void typeConstraints(TypeCollector tcs) throws TypeException {
      tcs.firstClass(this);
    }
  }

  @Test
  public void unsupportedTerm() {
    AssertionError e = assertThrows(AssertionError.class, () -> format(new Weird()));
    assertThat(e).hasMessageThat().isEqualTo("Can't format Weird");
  }

  @Test
  public void customPrinter() {
    TermPrinters printers =
        TermPrinters.STANDARD.withPrinter(Weird.class, (term, fmt, prec) -> Doc.text("???"));
    Formatter fmt = new Formatter(printers);
    assertThat(fmt.printers()).isSameInstanceAs(printers);
    assertThat(new Formatter().printers()).isSameInstanceAs(TermPrinters.STANDARD);
    assertThat(fmt.format(new NotPred(new FunPred(FunPred.Function.IS_CONSTANT, new Weird())), 0)
            .toString())
        .isEqualTo("!isConstant(???)");
    assertThat(TermPrinters.STANDARD.printerFor(Weird.class)).isNull();
    assertThat(TermPrinters.EMPTY_PRINTERS.printerFor(Input.class)).isNull();
  }

  @Test
  public void printersAreInheritedBySubclasses() {
    TermPrinters printers =
        TermPrinters.EMPTY_PRINTERS.withPrinter(Value.class, (term, fmt, prec) -> Doc.text("v"));
    assertThat(printers.printerFor(Literal.class)).isNotNull();
    assertThat(new Formatter(printers).format(new Literal(7), 0).toString()).isEqualTo("v");
    assertThat(printers.printerFor(Comparison.class)).isNull();
  }
}
