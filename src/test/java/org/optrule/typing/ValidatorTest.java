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

import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.optrule.term.Input;

@RunWith(JUnit4.class)
public class ValidatorTest {

  private static final IntType I8 = new IntType(8);
  private static final IntType I16 = new IntType(16);

  private final Input x = new Input("%x");
  private final Input y = new Input("%y");
  private final Input z = new Input("%z");
  private TypeModel model;

  @Before
  public void setup() throws TypeException {
    TypeConstraints tcs = new TypeConstraints();
    tcs.integer(x);
    tcs.eqTypes(x, y);
    tcs.firstClass(z);
    model = tcs.getTypeModel();
  }

  @Test
  public void acceptsSatisfiedConstraints() throws TypeException {
    Validator v = new Validator(model, ImmutableList.of(I8, FloatType.FLOAT));
    v.integer(x);
    v.number(y);
    v.eqTypes(x, y);
    v.floatingPoint(z);
    v.firstClass(z);
    v.specific(x, I8);
    v.specific(x, null);
  }

  @Test
  public void rejectsViolatedConstraints() {
    Validator v = new Validator(model, ImmutableList.of(I8, PtrType.PTR));
    assertThrows(TypeException.class, () -> v.floatingPoint(x));
    assertThrows(TypeException.class, () -> v.bool(x));
    assertThrows(TypeException.class, () -> v.eqTypes(x, z));
    assertThrows(TypeException.class, () -> v.specific(x, I16));
    assertThrows(TypeException.class, () -> v.number(z));
  }

  @Test
  public void booleans() throws TypeException {
    Validator v = new Validator(model, ImmutableList.of(IntType.I1, PtrType.PTR));
    v.bool(x);
    v.intPtr(z);
    v.pointer(z);
  }

  @Test
  public void widthOrders() throws TypeException {
    Validator narrow = new Validator(model, ImmutableList.of(I8, I16));
    narrow.widthOrder(x, z);
    assertThrows(TypeException.class, () -> narrow.widthOrder(z, x));
    assertThrows(TypeException.class, () -> narrow.widthOrder(x, y));
  }

  @Test
  public void rejectsBadVectors() {
    assertThrows(
        TypeException.class, () -> new Validator(model, ImmutableList.of(I8)).integer(x));
    Validator v = new Validator(model, ImmutableList.of(I8, I8));
    assertThrows(TypeException.class, () -> v.firstClass(new Input("%w")));
  }
}
