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

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a transformation's target or precondition introduces a type variable that is not
 * determined by its source and cannot be defaulted.
 */
public class AmbiguousTypeException extends TypeException {

  /** The printed form of each term whose type could not be determined. */
  public final ImmutableList<String> terms;

  public AmbiguousTypeException(ImmutableList<String> terms) {
    super("Ambiguous type for " + String.join(", ", terms));
    this.terms = terms;
  }
}
