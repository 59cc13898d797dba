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

/** The IEEE floating-point types, in order of increasing width. */
public enum FloatType implements Type {
  HALF(16, "half"),
  FLOAT(32, "float"),
  DOUBLE(64, "double");

  private final int width;
  private final String name;

  FloatType(int width, String name) {
    this.width = width;
    this.name = name;
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  public String toString() {
    return name;
  }
}
