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
 * Renders a Doc as a single logical line: once a group has been broken, each newline is preceded by
 * a continuation marker (by default {@code " \\"}). Each continuation line starts with a fixed
 * prefix, which is not counted against the indent.
 *
 * <p>Like {@link WidthRenderer}, each group either fits or has all its own lines broken, but the
 * space needed by the continuation marker is reserved on every line of a broken group.
 */
public final class ContinuationRenderer extends LayoutRenderer {
  public static final String DEFAULT_SUFFIX = " \\";

  private final int width;
  private final String prefix;
  private final String suffix;

  private int hpEol;

  /** The number of open groups that fit; if non-zero, {@link #broken} is not changed. */
  private int fits;

  /** The number of open broken groups. */
  private int broken;

  public ContinuationRenderer(Appendable out, int width) {
    this(out, width, "", DEFAULT_SUFFIX, 0);
  }

  /**
   * @param width the total width of each line, including {@code prefix}
   * @param startAt the column at which the first line starts
   */
  public ContinuationRenderer(
      Appendable out, int width, String prefix, String suffix, int startAt) {
    super(out);
    this.width = width - prefix.length();
    this.prefix = prefix;
    this.suffix = suffix;
    this.hpEol = this.width - startAt;
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
      breakLine(hp, indent);
    }
  }

  @Override
  public void lineBreak(int hp, int indent) {
    if (fits == 0) {
      breakLine(hp, indent);
    }
  }

  private void breakLine(int hp, int indent) {
    hpEol = hp + width - indent;
    if (broken > 0) {
      write(suffix);
      hpEol -= suffix.length();
    }
    newline(prefix, indent);
  }

  @Override
  public void beginGroup(int endHp) {
    if (fits > 0) {
      ++fits;
    } else if (endHp != UNKNOWN && endHp <= hpEol) {
      fits = 1;
    } else if (broken > 0) {
      ++broken;
    } else {
      broken = 1;
      hpEol -= suffix.length();
    }
  }

  @Override
  public void endGroup() {
    if (fits > 0) {
      --fits;
    } else {
      --broken;
    }
  }
}
