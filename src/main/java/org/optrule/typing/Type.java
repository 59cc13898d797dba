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

/**
 * A concrete type that may be assigned to a term. There are exactly three kinds: {@link IntType}
 * (one per bit width), {@link FloatType}, and {@link PtrType}.
 *
 * <p>Types are values; two Types are equal iff they print the same way.
 */
public sealed interface Type permits IntType, FloatType, PtrType {

  /** The size of a value of this type, in bits. */
  int width();

  /**
   * Returns true if this type and {@code other} are of the same kind (both integers or both
   * floating point) and this one is strictly narrower. Pointers are never ordered.
   */
  default boolean isNarrowerThan(Type other) {
    if (this instanceof IntType && other instanceof IntType) {
      return width() < other.width();
    } else if (this instanceof FloatType && other instanceof FloatType) {
      return width() < other.width();
    }
    return false;
  }
}
