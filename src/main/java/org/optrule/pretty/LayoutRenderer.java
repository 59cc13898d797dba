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

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * The final stage of rendering a Doc: decides which lines to break and writes the result.
 *
 * <p>A LayoutRenderer receives the events from a {@link GroupEndFinder}, which adds positions to
 * them. Positions are measured as if the whole document were rendered on a single line: a soft
 * line counts as one column and a break as none, and the position passed with a line or break is
 * the position just after it. Each group begin is annotated with the position at which the group
 * (with any text that immediately follows it) would end, or {@link #UNKNOWN} if it is already known
 * to be too wide to fit.
 */
public abstract class LayoutRenderer {

  /** Passed to {@link #beginGroup} when the group is known not to fit. */
  public static final int UNKNOWN = -1;

  private final Appendable out;

  protected LayoutRenderer(Appendable out) {
    this.out = out;
  }

  public abstract void text(String s);

  public abstract void line(int hp, int indent);

  public abstract void lineBreak(int hp, int indent);

  public abstract void beginGroup(int endHp);

  public abstract void endGroup();

  /** Writes {@code s} to the output; IOExceptions are rethrown unchecked. */
  protected void write(CharSequence s) {
    try {
      out.append(s);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Writes a newline followed by {@code prefix} and {@code indent} spaces. */
  protected void newline(String prefix, int indent) {
    write("\n");
    write(prefix);
    write(" ".repeat(indent));
  }
}
