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

package org.optrule.pretty;

/**
 * Renders a Doc so that each group either fits entirely on the rest of its line or has all its
 * own lines broken.
 */
public final class WidthRenderer extends LayoutRenderer {
  private final int width;

  /** The position (as counted by {@link GroupEndFinder}) at which the current line is full. */
  private int hpEol;

  /** The number of open groups that fit, or zero if the innermost open group is broken. */
  private int fits;

  public WidthRenderer(Appendable out, int width) {
    super(out);
    this.width = width;
    this.hpEol = width;
  }

  @Override
  public void text(String s) {
    write(s);
  }

  @Override
  public void line(int hp, int indent) {
    if (fits > 0) {
      write(" ");
    } else {
      hpEol = hp + width - indent;
      newline("", indent);
    }
  }

  @Override
  public void lineBreak(int hp, int indent) {
    if (fits == 0) {
      hpEol = hp + width - indent;
      newline("", indent);
    }
  }

  @Override
  public void beginGroup(int endHp) {
    if (fits > 0) {
      ++fits;
    } else if (endHp != UNKNOWN && endHp <= hpEol) {
      fits = 1;
    }
  }

  @Override
  public void endGroup() {
    if (fits > 0) {
      --fits;
    }
  }
}
