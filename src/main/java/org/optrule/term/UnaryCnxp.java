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

/** Negation ({@code -C}) or bitwise complement ({@code ~C}) of a constant. */
public final class UnaryCnxp extends Constant {

  public enum Code {
    NEG("-"),
    NOT("~");

    public final String symbol;

    Code(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  public final Code code;
  public final Value x;

  public UnaryCnxp(Code code, Value x) {
    this.code = code;
    this.x = x;
  }

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of(x);
  }

  @Override
  protected String opcode() {
    return code.symbol;
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    if (code == Code.NEG) {
      tcs.number(this);
    } else {
      tcs.integer(this);
    }
    tcs.eqTypes(this, x);
  }
}
