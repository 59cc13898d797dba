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

/** A precondition comparing two values, e.g. {@code C1 u< width(%x)}. */
public final class Comparison extends Predicate {

  public enum Op {
    EQ("eq", "=="),
    NE("ne", "!="),
    SLT("slt", "<"),
    SLE("sle", "<="),
    SGT("sgt", ">"),
    SGE("sge", ">="),
    ULT("ult", "u<"),
    ULE("ule", "u<="),
    UGT("ugt", "u>"),
    UGE("uge", "u>=");

    public final String code;

    /** The infix symbol used when printing. */
    public final String symbol;

    Op(String code, String symbol) {
      this.code = code;
      this.symbol = symbol;
    }

    /** Returns the Op with the given code (e.g. {@code "ult"}). */
    public static Op forCode(String code) {
      for (Op op : values()) {
        if (op.code.equals(code)) {
          return op;
        }
      }
      throw new IllegalArgumentException("Unknown comparison: " + code);
    }

    @Override
    public String toString() {
      return code;
    }
  }

  public final Op op;
  public final Value x;
  public final Value y;

  public Comparison(Op op, Value x, Value y) {
    this.op = op;
    this.x = x;
    this.y = y;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(x, y);
  }

  @Override
  protected String opcode() {
    return op.code;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.bool(this);
    if (op == Op.EQ || op == Op.NE) {
      tcs.firstClass(x);
    } else {
      tcs.integer(x);
    }
    tcs.eqTypes(x, y);
  }
}
