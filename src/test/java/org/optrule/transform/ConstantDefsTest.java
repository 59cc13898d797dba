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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.optrule.term.BinaryCnxp;
import org.optrule.term.BinaryOperator;
import org.optrule.term.Comparison;
import org.optrule.term.Input;
import org.optrule.term.Literal;
import org.optrule.term.Symbol;
import org.optrule.term.UnaryCnxp;

@RunWith(JUnit4.class)
public class ConstantDefsTest {

  private final Input x = new Input("%x");
  private final Symbol c1 = new Symbol("C1");
  private final Symbol c2 = new Symbol("C2");

  @Test
  public void sharedConstantsAreHoisted() {
    BinaryCnxp sum = new BinaryCnxp(BinaryCnxp.Code.ADD, c1, c2);
    BinaryOperator or = new BinaryOperator(BinaryOperator.Code.OR, x, sum);
    BinaryOperator and = new BinaryOperator(BinaryOperator.Code.AND, or, sum);
    assertThat(ConstantDefs.find(and)).containsExactly(sum);
  }

  @Test
  public void constantsUsedOnceAreNotHoisted() {
    BinaryCnxp sum = new BinaryCnxp(BinaryCnxp.Code.ADD, c1, c2);
    assertThat(ConstantDefs.find(new BinaryOperator(BinaryOperator.Code.OR, x, sum))).isEmpty();
  }

  @Test
  public void symbolsAreNeverHoisted() {
    BinaryOperator or = new BinaryOperator(BinaryOperator.Code.OR, x, c1);
    assertThat(ConstantDefs.find(new BinaryOperator(BinaryOperator.Code.AND, or, c1))).isEmpty();
  }

  @Test
  public void usesInPreconditionCount() {
    UnaryCnxp neg = new UnaryCnxp(UnaryCnxp.Code.NEG, c1);
    BinaryOperator tgt = new BinaryOperator(BinaryOperator.Code.ADD, x, neg);
    Comparison pre = new Comparison(Comparison.Op.NE, neg, new Literal(0));
    assertThat(ConstantDefs.find(tgt)).isEmpty();
    assertThat(ConstantDefs.find(tgt, ImmutableList.of(pre))).containsExactly(neg);
  }

  @Test
  public void operandsComeFirst() {
    UnaryCnxp inner = new UnaryCnxp(UnaryCnxp.Code.NOT, c1);
    BinaryCnxp outer = new BinaryCnxp(BinaryCnxp.Code.MUL, inner, inner);
    BinaryOperator first = new BinaryOperator(BinaryOperator.Code.ADD, x, outer);
    BinaryOperator second = new BinaryOperator(BinaryOperator.Code.SUB, first, outer);
    assertThat(ConstantDefs.find(second)).containsExactly(inner, outer).inOrder();
  }
}
