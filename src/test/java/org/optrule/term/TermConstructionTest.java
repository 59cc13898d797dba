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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TermConstructionTest {

  private final Input x = new Input("%x");

  @Test
  public void rejectsUnknownPredicates() {
    assertThrows(IllegalArgumentException.class, () -> new IcmpInst("olt", x, x));
    assertThrows(IllegalArgumentException.class, () -> new FcmpInst("slt", x, x));
    assertThat(new IcmpInst("", x, x).pred).isEmpty();
  }

  @Test
  public void rejectsWrongArity() {
    assertThrows(IllegalArgumentException.class, () -> new FunCnxp(FunCnxp.Function.MAX, x));
    assertThrows(
        IllegalArgumentException.class, () -> new FunPred(FunPred.Function.IS_POWER_OF_2, x, x));
  }

  @Test
  public void emptyInstructionNameMeansUnnamed() {
    ConversionInst zext = new ConversionInst(ConversionInst.Code.ZEXT, x, null, null, "");
    assertThat(zext.name()).isNull();
  }

  @Test
  public void inputsMustBeNamed() {
    assertThrows(IllegalArgumentException.class, () -> new Input(""));
    assertThrows(IllegalArgumentException.class, () -> new Symbol(""));
  }

  @Test
  public void comparisonLookup() {
    assertThat(Comparison.Op.forCode("uge")).isEqualTo(Comparison.Op.UGE);
    assertThrows(IllegalArgumentException.class, () -> Comparison.Op.forCode("oeq"));
  }
}
