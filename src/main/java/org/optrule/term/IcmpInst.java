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
import org.jspecify.annotations.Nullable;
import org.optrule.typing.Type;
import org.optrule.typing.TypeCollector;
import org.optrule.typing.TypeException;

/** An integer or pointer comparison, e.g. {@code icmp ult %x, %y}; its result is an {@code i1}. */
public final class IcmpInst extends Instruction {

  /** The predicates an icmp may use; the empty string stands for an unspecified predicate. */
  public static final ImmutableSet<String> PREDICATES =
      ImmutableSet.of("", "eq", "ne", "ugt", "uge", "ult", "ule", "sgt", "sge", "slt", "sle");

  public final String pred;
  public final Value x;
  public final Value y;

  /** If non-null, the type explicitly given to the operands. */
  public final @Nullable Type ty;

  public IcmpInst(String pred, Value x, Value y) {
    this(pred, x, y, null, null);
  }

  public IcmpInst(String pred, Value x, Value y, @Nullable Type ty, @Nullable String name) {
    super(name);
    Preconditions.checkArgument(PREDICATES.contains(pred), "Unknown icmp predicate: %s", pred);
    this.pred = pred;
    this.x = x;
    this.y = y;
    this.ty = ty;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(x, y);
  }

  @Override
  protected String opcode() {
    return "icmp " + pred;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.bool(this);
    tcs.intPtr(x);
    tcs.eqTypes(x, y);
    tcs.specific(x, ty);
  }
}
