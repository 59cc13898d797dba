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
 * Thrown when a set of type constraints cannot be satisfied, either while they are being collected
 * by a {@link TypeConstraints} or while a {@link Validator} checks them against a concrete type
 * vector.
 */
public class TypeException extends Exception {

  public TypeException(String message) {
    super(message);
  }
}
