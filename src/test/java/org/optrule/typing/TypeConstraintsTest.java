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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.optrule.term.ConversionInst;
import org.optrule.term.Input;

@RunWith(JUnit4.class)
public class TypeConstraintsTest {

  private static final IntType I8 = new IntType(8);
  private static final IntType I16 = new IntType(16);
  private static final IntType I64 = new IntType(64);

  private final TypeConstraints tcs = new TypeConstraints();
  private final Input x = new Input("%x");
  private final Input y = new Input("%y");
  private final Input z = new Input("%z");

  @Test
  public void eqTypesMergesConstraints() throws TypeException {
    tcs.integer(x);
    tcs.number(y);
    tcs.eqTypes(y, x);
    assertThat(tcs.rep(x)).isSameInstanceAs(tcs.rep(y));
    assertThat(tcs.reps()).containsExactly(x);
    assertThat(tcs.constraint(x)).isEqualTo(Constraint.INT);
  }

  @Test
  public void constrainUsesCollectorMethods() throws TypeException {
    TypeCollector collector = tcs;
    collector.constrain(x, Constraint.INT_PTR);
    collector.constrain(x, Constraint.NUMBER);
    assertThat(tcs.constraint(x)).isEqualTo(Constraint.INT);
    assertThrows(TypeException.class, () -> collector.constrain(x, Constraint.PTR));

    ConversionInst cast = new ConversionInst(ConversionInst.Code.PTRTOINT, y);
    cast.typeConstraints(tcs);
    assertThat(tcs.constraint(y)).isEqualTo(Constraint.PTR);
    assertThat(tcs.constraint(cast)).isEqualTo(Constraint.INT);
  }

  @Test
  public void conflictingConstraints() throws TypeException {
    tcs.floatingPoint(x);
    assertThrows(TypeException.class, () -> tcs.integer(x));

    tcs.pointer(y);
    assertThrows(TypeException.class, () -> tcs.eqTypes(x, y));
  }

  @Test
  public void booleansAreIntegers() throws TypeException {
    tcs.bool(x);
    tcs.integer(x);
    assertThat(tcs.constraint(x)).isEqualTo(Constraint.BOOL);
    assertThrows(TypeException.class, () -> tcs.floatingPoint(x));
  }

  @Test
  public void specificTypes() throws TypeException {
    tcs.integer(x);
    tcs.specific(x, null);
    assertThat(tcs.isSpecific(x)).isFalse();
    tcs.specific(x, I8);
    tcs.specific(x, I8);
    assertThat(tcs.isSpecific(x)).isTrue();
    assertThat(tcs.specificType(x)).isEqualTo(I8);
    assertThrows(TypeException.class, () -> tcs.specific(x, I16));
  }

  @Test
  public void specificTypeMustSatisfyConstraint() throws TypeException {
    tcs.floatingPoint(x);
    assertThrows(TypeException.class, () -> tcs.specific(x, I8));

    tcs.specific(y, I8);
    assertThrows(TypeException.class, () -> tcs.floatingPoint(y));
  }

  @Test
  public void mergingSpecificTypes() throws TypeException {
    tcs.specific(x, I8);
    tcs.eqTypes(x, y);
    assertThat(tcs.specificType(tcs.rep(y))).isEqualTo(I8);

    tcs.specific(z, I16);
    assertThrows(TypeException.class, () -> tcs.eqTypes(y, z));
  }

  @Test
  public void defaults() throws TypeException {
    Input f = new Input("%f");
    Input p = new Input("%p");
    Input b = new Input("%b");
    tcs.integer(x);
    tcs.firstClass(y);
    tcs.intPtr(z);
    tcs.floatingPoint(f);
    tcs.pointer(p);
    tcs.bool(b);
    for (Input input : new Input[] {x, y, z, f, p, b}) {
      tcs.applyDefault(input);
    }
    assertThat(tcs.specificType(x)).isEqualTo(I64);
    assertThat(tcs.specificType(y)).isEqualTo(I64);
    assertThat(tcs.specificType(z)).isEqualTo(I64);
    assertThat(tcs.specificType(f)).isEqualTo(FloatType.DOUBLE);
    assertThat(tcs.specificType(p)).isEqualTo(PtrType.PTR);
    assertThat(tcs.isSpecific(b)).isFalse();
  }

  @Test
  public void defaultDoesNotReplaceSpecificType() throws TypeException {
    tcs.specific(x, I8);
    tcs.applyDefault(x);
    assertThat(tcs.specificType(x)).isEqualTo(I8);
  }

  @Test
  public void defaultsComeFromOptions() throws TypeException {
    TypingOptions options =
        new TypingOptions(TypingOptions.DEFAULT.intTypes(), new IntType(32), FloatType.FLOAT);
    TypeConstraints custom = new TypeConstraints(options);
    custom.number(x);
    custom.floatingPoint(y);
    custom.applyDefault(x);
    custom.applyDefault(y);
    assertThat(custom.specificType(x)).isEqualTo(new IntType(32));
    assertThat(custom.specificType(y)).isEqualTo(FloatType.FLOAT);
  }

  @Test
  public void applyDefaultRequiresRepresentative() throws TypeException {
    tcs.eqTypes(x, y);
    assertThrows(IllegalArgumentException.class, () -> tcs.applyDefault(y));
  }

  @Test
  public void widthOrderWithinOneVariable() throws TypeException {
    tcs.integer(x);
    tcs.widthOrder(x, y);
    tcs.eqTypes(x, y);
    assertThrows(TypeException.class, tcs::getTypeModel);
  }

  @Test
  public void typeModelSummarizesSubsets() throws TypeException {
    tcs.integer(x);
    tcs.eqTypes(x, y);
    tcs.specific(z, I16);
    tcs.widthOrder(x, z);
    TypeModel model = tcs.getTypeModel();
    assertThat(model.numVars()).isEqualTo(2);
    assertThat(model.var(0)).isSameInstanceAs(x);
    assertThat(model.varIndex(y)).isEqualTo(0);
    assertThat(model.varIndex(z)).isEqualTo(1);
    assertThat(model.constraint(0)).isEqualTo(Constraint.INT);
    assertThat(model.specificType(1)).isEqualTo(I16);
    assertThat(model.numWidthOrders()).isEqualTo(1);
  }
}
