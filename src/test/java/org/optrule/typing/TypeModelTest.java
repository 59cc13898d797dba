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

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.optrule.term.Input;

@RunWith(JUnit4.class)
public class TypeModelTest {

  private static final IntType I8 = new IntType(8);
  private static final IntType I16 = new IntType(16);
  private static final IntType I32 = new IntType(32);

  private final TypeConstraints tcs =
      new TypeConstraints(TypingOptions.DEFAULT.withIntWidths(8, 16, 32));
  private final Input x = new Input("%x");
  private final Input y = new Input("%y");

  @Test
  public void noVariablesHasOneEmptyVector() throws TypeException {
    TypeModel model = new TypeConstraints().getTypeModel();
    assertThat(model.typeVectors()).containsExactly(ImmutableList.of());
  }

  @Test
  public void enumeratesCandidates() throws TypeException {
    tcs.integer(x);
    tcs.number(y);
    TypeModel model = tcs.getTypeModel();
    assertThat(model.candidates(0)).containsExactly(I8, I16, I32).inOrder();
    assertThat(model.typeVectors()).hasSize(3 * 6);
    assertThat(model.typeVectors().iterator().next()).containsExactly(I8, I8).inOrder();
  }

  @Test
  public void widthOrdersPruneVectors() throws TypeException {
    tcs.integer(x);
    tcs.integer(y);
    tcs.widthOrder(x, y);
    TypeModel model = tcs.getTypeModel();
    assertThat(model.typeVectors())
        .containsExactly(
            ImmutableList.of(I8, I16), ImmutableList.of(I8, I32), ImmutableList.of(I16, I32))
        .inOrder();
  }

  @Test
  public void widthOrderAgainstEarlierVariable() throws TypeException {
    tcs.integer(x);
    tcs.integer(y);
    tcs.widthOrder(y, x);
    TypeModel model = tcs.getTypeModel();
    assertThat(model.typeVectors())
        .containsExactly(
            ImmutableList.of(I16, I8), ImmutableList.of(I32, I8), ImmutableList.of(I32, I16))
        .inOrder();
  }

  @Test
  public void unsatisfiableWidthOrders() throws TypeException {
    tcs.specific(x, I8);
    tcs.integer(y);
    tcs.widthOrder(y, x);
    assertThat(tcs.getTypeModel().typeVectors()).isEmpty();
  }

  @Test
  public void specificVariablesHaveOneCandidate() throws TypeException {
    tcs.specific(x, FloatType.HALF);
    TypeModel model = tcs.getTypeModel();
    assertThat(model.candidates(0)).containsExactly(FloatType.HALF);
    assertThat(model.typeVectors()).containsExactly(ImmutableList.of(FloatType.HALF));
  }

  @Test
  public void enumerationIsRestartable() throws TypeException {
    tcs.intPtr(x);
    TypeModel model = tcs.getTypeModel();
    Iterator<ImmutableList<Type>> partial = model.typeVectors().iterator();
    assertThat(partial.next()).containsExactly(I8);
    assertThat(model.typeVectors())
        .containsExactly(ImmutableList.of(I8), ImmutableList.of(I16), ImmutableList.of(I32),
            ImmutableList.of(PtrType.PTR))
        .inOrder();
    assertThat(partial.next()).containsExactly(I16);
  }

  @Test
  public void unknownTerm() throws TypeException {
    tcs.integer(x);
    assertThat(tcs.getTypeModel().varIndex(y)).isEqualTo(-1);
  }
}
