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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** A constant computed by a named function of other values, e.g. {@code log2(C1)}. */
public final class FunCnxp extends Constant {

  public enum Function {
    ABS("abs", 1),
    LOG2("log2", 1),
    MAX("max", 2),
    MIN("min", 2),
    UMAX("umax", 2),
    UMIN("umin", 2),
    WIDTH("width", 1),
    TRUNC("trunc", 1),
    ZEXT("zext", 1),
    SEXT("sext", 1),
    ZEXT_OR_TRUNC("ZExtOrTrunc", 1),
    COUNT_LEADING_ZEROS("countLeadingZeros", 1),
    COUNT_TRAILING_ZEROS("countTrailingZeros", 1);

    public final String code;
    public final int arity;

    Function(String code, int arity) {
      this.code = code;
      this.arity = arity;
    }

    @Override
    public String toString() {
      return code;
    }
  }

  public final Function fn;
  public final ImmutableList<Value> fnArgs;

  public FunCnxp(Function fn, Value... args) {
    this(fn, ImmutableList.copyOf(args));
  }

  public FunCnxp(Function fn, List<? extends Value> args) {
    Preconditions.checkArgument(
        args.size() == fn.arity, "%s expects %s arguments, got %s", fn, fn.arity, args.size());
    this.fn = fn;
    this.fnArgs = ImmutableList.copyOf(args);
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.copyOf(fnArgs);
  }

  @Override
  protected String opcode() {
    return fn.code;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    Value a = fnArgs.get(0);
    switch (fn) {
      case ABS -> {
        tcs.number(this);
        tcs.eqTypes(this, a);
      }
      case MAX, MIN -> {
        tcs.number(this);
        tcs.eqTypes(this, a, fnArgs.get(1));
      }
      case UMAX, UMIN -> {
        tcs.integer(this);
        tcs.eqTypes(this, a, fnArgs.get(1));
      }
      case COUNT_LEADING_ZEROS, COUNT_TRAILING_ZEROS -> {
        tcs.integer(this);
        tcs.eqTypes(this, a);
      }
      case LOG2, ZEXT_OR_TRUNC -> {
        tcs.integer(this);
        tcs.integer(a);
      }
      case WIDTH -> {
        tcs.integer(this);
        tcs.firstClass(a);
      }
      case TRUNC -> {
        tcs.integer(this);
        tcs.integer(a);
        tcs.widthOrder(this, a);
      }
      case ZEXT, SEXT -> {
        tcs.integer(this);
        tcs.integer(a);
        tcs.widthOrder(a, this);
      }
    }
  }
}
