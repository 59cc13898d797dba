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
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.optrule.typing.Type;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** A two-operand arithmetic or bitwise instruction, e.g. {@code add nsw %x, %y}. */
public final class BinaryOperator extends Instruction {

  /** The supported operations; the integer operations come first. */
  public enum Code {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    SDIV("sdiv"),
    UDIV("udiv"),
    SREM("srem"),
    UREM("urem"),
    SHL("shl"),
    ASHR("ashr"),
    LSHR("lshr"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    FADD("fadd"),
    FSUB("fsub"),
    FMUL("fmul"),
    FDIV("fdiv"),
    FREM("frem");

    private final String opcode;

    Code(String opcode) {
      this.opcode = opcode;
    }

    /** True for the floating-point operations. */
    public boolean isFloat() {
      return compareTo(FADD) >= 0;
    }

    @Override
    public String toString() {
      return opcode;
    }
  }

  public final Code code;
  public final Value x;
  public final Value y;

  /** If non-null, the type explicitly given to this instruction's operands and result. */
  public final @Nullable Type ty;

  /** Flags such as {@code nsw} or {@code exact}, in the order they were given. */
  public final ImmutableList<String> flags;

  public BinaryOperator(Code code, Value x, Value y) {
    this(code, x, y, null, ImmutableList.of(), null);
  }

  public BinaryOperator(
      Code code,
      Value x,
      Value y,
      @Nullable Type ty,
      List<String> flags,
      @Nullable String name) {
    super(name);
    this.code = code;
    this.x = x;
    this.y = y;
    this.ty = ty;
    this.flags = ImmutableList.copyOf(flags);
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(x, y);
  }

  @Override
  protected String opcode() {
    return code.toString();
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    if (code.isFloat()) {
      tcs.floatingPoint(this);
    } else {
      tcs.integer(this);
    }
    tcs.eqTypes(this, x, y);
    tcs.specific(this, ty);
  }
}
