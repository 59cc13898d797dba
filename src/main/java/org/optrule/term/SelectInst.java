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
import org.jspecify.annotations.Nullable;
import org.optrule.typing.Type;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** Chooses between two values based on an {@code i1}, e.g. {@code select %c, %x, %y}. */
public final class SelectInst extends Instruction {
  public final Value sel;
  public final Value arg1;
  public final Value arg2;
  public final @Nullable Type ty1;
  public final @Nullable Type ty2;

  public SelectInst(Value sel, Value arg1, Value arg2) {
    this(sel, arg1, arg2, null, null, null);
  }

  public SelectInst(
      Value sel,
      Value arg1,
      Value arg2,
      @Nullable Type ty1,
      @Nullable Type ty2,
      @Nullable String name) {
    super(name);
    this.sel = sel;
    this.arg1 = arg1;
    this.arg2 = arg2;
    this.ty1 = ty1;
    this.ty2 = ty2;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(sel, arg1, arg2);
  }

  @Override
  protected String opcode() {
    return "select";
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.bool(sel);
    tcs.firstClass(this);
    tcs.eqTypes(this, arg1, arg2);
    tcs.specific(arg1, ty1);
    tcs.specific(arg2, ty2);
  }
}
