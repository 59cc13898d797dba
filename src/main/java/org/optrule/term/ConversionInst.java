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
import org.optrule.typing.Constraint;
import org.optrule.typing.Type;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** An instruction that converts its operand to another type, e.g. {@code zext i8 %x to i16}. */
public final class ConversionInst extends Instruction {

  /** Whether a conversion makes its operand wider, narrower, or leaves the width unconstrained. */
  enum Resize {
    WIDENS,
    NARROWS,
    ANY
  }

  public enum Code {
    TRUNC("trunc", Constraint.INT, Constraint.INT, Resize.NARROWS),
    ZEXT("zext", Constraint.INT, Constraint.INT, Resize.WIDENS),
    SEXT("sext", Constraint.INT, Constraint.INT, Resize.WIDENS),
    ZEXT_OR_TRUNC("ZExtOrTrunc", Constraint.INT, Constraint.INT, Resize.ANY),
    PTRTOINT("ptrtoint", Constraint.PTR, Constraint.INT, Resize.ANY),
    INTTOPTR("inttoptr", Constraint.INT, Constraint.PTR, Resize.ANY),
    BITCAST("bitcast", Constraint.FIRST_CLASS, Constraint.FIRST_CLASS, Resize.ANY),
    FPEXT("fpext", Constraint.FLOAT, Constraint.FLOAT, Resize.WIDENS),
    FPTRUNC("fptrunc", Constraint.FLOAT, Constraint.FLOAT, Resize.NARROWS),
    FPTOSI("fptosi", Constraint.FLOAT, Constraint.INT, Resize.ANY),
    FPTOUI("fptoui", Constraint.FLOAT, Constraint.INT, Resize.ANY),
    SITOFP("sitofp", Constraint.INT, Constraint.FLOAT, Resize.ANY),
    UITOFP("uitofp", Constraint.INT, Constraint.FLOAT, Resize.ANY);

    private final String opcode;
    final Constraint argConstraint;
    final Constraint resultConstraint;
    final Resize resize;

    Code(String opcode, Constraint argConstraint, Constraint resultConstraint, Resize resize) {
      this.opcode = opcode;
      this.argConstraint = argConstraint;
      this.resultConstraint = resultConstraint;
      this.resize = resize;
    }

    @Override
    public String toString() {
      return opcode;
    }
  }

  public final Code code;
  public final Value arg;

  /** If non-null, the type explicitly given to the operand. */
  public final @Nullable Type srcTy;

  /** If non-null, the type explicitly given to the result. */
  public final @Nullable Type ty;

  public ConversionInst(Code code, Value arg) {
    this(code, arg, null, null, null);
  }

  public ConversionInst(
      Code code, Value arg, @Nullable Type srcTy, @Nullable Type ty, @Nullable String name) {
    super(name);
    this.code = code;
    this.arg = arg;
    this.srcTy = srcTy;
    this.ty = ty;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(arg);
  }

  @Override
  protected String opcode() {
    return code.toString();
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.constrain(arg, code.argConstraint);
    tcs.constrain(this, code.resultConstraint);
    switch (code.resize) {
      case WIDENS -> tcs.widthOrder(arg, this);
      case NARROWS -> tcs.widthOrder(this, arg);
      case ANY -> {}
    }
    tcs.specific(arg, srcTy);
    tcs.specific(this, ty);
  }
}
