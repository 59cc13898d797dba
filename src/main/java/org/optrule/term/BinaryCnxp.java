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
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** A binary operation on constants, written infix (e.g. {@code C1 + C2}). */
public final class BinaryCnxp extends Constant {

  /**
   * The infix operators. Each has a precedence (higher binds tighter) and is either left
   * associative or fully associative; chains of the latter can be printed without parentheses.
   */
  public enum Code {
    MUL("*", 9, false, true),
    SDIV("/", 9, true, true),
    UDIV("/u", 9, true, false),
    SREM("%", 9, true, true),
    UREM("%u", 9, true, false),
    ADD("+", 8, false, true),
    SUB("-", 8, true, true),
    SHL("<<", 7, true, false),
    ASHR(">>", 7, true, false),
    LSHR("u>>", 7, true, false),
    AND("&", 6, false, false),
    XOR("^", 5, false, false),
    OR("|", 4, false, false);

    public final String symbol;
    public final int precedence;
    public final boolean leftAssociative;

    /** True if the operation also applies to floating-point constants. */
    final boolean numeric;

    Code(String symbol, int precedence, boolean leftAssociative, boolean numeric) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.leftAssociative = leftAssociative;
      this.numeric = numeric;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  public final Code code;
  public final Value x;
  public final Value y;

  public BinaryCnxp(Code code, Value x, Value y) {
    this.code = code;
    this.x = x;
    this.y = y;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(x, y);
  }

  @Override
  protected String opcode() {
    return code.symbol;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    if (code.numeric) {
      tcs.number(this);
    } else {
      tcs.integer(this);
    }
    tcs.eqTypes(this, x, y);
  }
}
