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
import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * Settings that control type inference: which integer widths are enumerated by a {@link
 * TypeModel}, and which types are chosen when a type variable is defaulted.
 */
public final class TypingOptions {

  /** Integer widths 1, 4, 8, 16, 32 and 64; defaults to {@code i64} and {@code double}. */
  public static final TypingOptions DEFAULT =
      new TypingOptions(
          ImmutableList.of(
              new IntType(1),
              new IntType(4),
              new IntType(8),
              new IntType(16),
              new IntType(32),
              new IntType(64)),
          new IntType(64),
          FloatType.DOUBLE);

  private final ImmutableList<IntType> intTypes;
  private final IntType defaultInt;
  private final FloatType defaultFloat;

  public TypingOptions(
      ImmutableList<IntType> intTypes, IntType defaultInt, FloatType defaultFloat) {
    Preconditions.checkArgument(!intTypes.isEmpty(), "At least one integer width is required");
    this.intTypes = intTypes;
    this.defaultInt = defaultInt;
    this.defaultFloat = defaultFloat;
  }

  /** Returns a copy of these options that enumerates only the given integer widths. */
  public TypingOptions withIntWidths(int... widths) {
    return new TypingOptions(
        Arrays.stream(widths).mapToObj(IntType::new).collect(ImmutableList.toImmutableList()),
        defaultInt,
        defaultFloat);
  }

  /** The integer types tried, in order, for a variable that may be an integer. */
  public ImmutableList<IntType> intTypes() {
    return intTypes;
  }

  /** The type given to a defaulted variable that may be an integer. */
  public IntType defaultInt() {
    return defaultInt;
  }

  /** The type given to a defaulted variable that must be floating point. */
  public FloatType defaultFloat() {
    return defaultFloat;
  }
}
