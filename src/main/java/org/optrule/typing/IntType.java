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

package org.optrule.typing;

import com.google.common.base.Preconditions;

/** An integer type of a fixed bit width, printed as {@code i<width>}. */
public record IntType(int width) implements Type {

  /** The type of booleans and of every predicate. */
  public static final IntType I1 = new IntType(1);

  public IntType {
    Preconditions.checkArgument(width > 0, "Integer width must be positive: %s", width);
  }

  @Override
  public String toString() {
    return "i" + width;
  }
}
