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

/** A precondition written as a call to a named analysis, e.g. {@code isPowerOf2(%x)}. */
public final class FunPred extends Predicate {

  public enum Function {
    IS_POWER_OF_2("isPowerOf2", 1, true),
    IS_POWER_OF_2_OR_ZERO("isPowerOf2OrZero", 1, true),
    IS_SIGN_BIT("isSignBit", 1, true),
    IS_SHIFTED_MASK("isShiftedMask", 1, true),
    MASKED_VALUE_IS_ZERO("MaskedValueIsZero", 2, true),
    WILL_NOT_OVERFLOW_SIGNED_ADD("WillNotOverflowSignedAdd", 2, true),
    WILL_NOT_OVERFLOW_UNSIGNED_ADD("WillNotOverflowUnsignedAdd", 2, true),
    WILL_NOT_OVERFLOW_SIGNED_SUB("WillNotOverflowSignedSub", 2, true),
    WILL_NOT_OVERFLOW_UNSIGNED_SUB("WillNotOverflowUnsignedSub", 2, true),
    WILL_NOT_OVERFLOW_SIGNED_MUL("WillNotOverflowSignedMul", 2, true),
    WILL_NOT_OVERFLOW_UNSIGNED_MUL("WillNotOverflowUnsignedMul", 2, true),
    WILL_NOT_OVERFLOW_UNSIGNED_SHL("WillNotOverflowUnsignedShl", 2, true),
    HAS_ONE_USE("hasOneUse", 1, false),
    IS_CONSTANT("isConstant", 1, false);

    public final String code;
    public final int arity;

    /**
     * If true the arguments must be integers of a common type; otherwise each argument may have
     * any type.
     */
    final boolean integerArgs;

    Function(String code, int arity, boolean integerArgs) {
      this.code = code;
      this.arity = arity;
      this.integerArgs = integerArgs;
    }

    @Override
    public String toString() {
      return code;
    }
  }

  public final Function fn;
  public final ImmutableList<Value> fnArgs;

  public FunPred(Function fn, Value... args) {
    this(fn, ImmutableList.copyOf(args));
  }

  public FunPred(Function fn, List<? extends Value> args) {
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
    tcs.bool(this);
    if (fn.integerArgs) {
      tcs.integer(fnArgs.get(0));
      tcs.eqTypes(fnArgs.toArray(new Term[0]));
    } else {
      for (Value a : fnArgs) {
        tcs.firstClass(a);
      }
    }
  }
}
