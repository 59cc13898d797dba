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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.optrule.typing.Type;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** A floating-point comparison, e.g. {@code fcmp nnan olt %x, %y}. */
public final class FcmpInst extends Instruction {

  /** The predicates an fcmp may use; the empty string stands for an unspecified predicate. */
  public static final ImmutableSet<String> PREDICATES =
      ImmutableSet.of(
          "", "false", "oeq", "ogt", "oge", "olt", "ole", "one", "ord", "ueq", "ugt", "uge", "ult",
          "ule", "une", "uno", "true");

  public final String pred;
  public final Value x;
  public final Value y;

  /** If non-null, the type explicitly given to the operands. */
  public final @Nullable Type ty;

  /** Fast-math flags such as {@code nnan}. */
  public final ImmutableList<String> flags;

  public FcmpInst(String pred, Value x, Value y) {
    this(pred, x, y, null, ImmutableList.of(), null);
  }

  public FcmpInst(
      String pred,
      Value x,
      Value y,
      @Nullable Type ty,
      List<String> flags,
      @Nullable String name) {
    super(name);
    Preconditions.checkArgument(PREDICATES.contains(pred), "Unknown fcmp predicate: %s", pred);
    this.pred = pred;
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
    return "fcmp " + pred;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.bool(this);
    tcs.floatingPoint(x);
    tcs.eqTypes(x, y);
    tcs.specific(x, ty);
  }
}
