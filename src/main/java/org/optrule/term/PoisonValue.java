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

/** The {@code poison} value of some first-class type. */
public final class PoisonValue extends Constant {

  public PoisonValue() {}

  @Override
  public ImmutableList<Term> args() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return "poison";
  }

  @Override
  public void typeConstraints(TypeCollector tcs) throws TypeException {
    tcs.firstClass(this);
  }
}
