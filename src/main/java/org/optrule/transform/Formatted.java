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

package org.optrule.transform;

import org.optrule.pretty.ContinuationRenderer;
import org.optrule.pretty.Doc;
import org.optrule.pretty.DocSink;
import org.optrule.pretty.GroupEndFinder;

/**
 * A Doc that formats a term (or a {@link Transform}) only when it is rendered.
 *
 * <p>A Formatted renders with line continuations, so the result remains a single logical line;
 * this makes it suitable as a log argument, e.g.
 *
 * <pre>
 * logger.atFine().log("rewrote %s", new Formatted(term));
 * </pre>
 *
 * <p>It should not generally be combined with other Docs and rendered by {@link Doc#render}.
 */
public final class Formatted extends Doc {
  private final Object item;
  private final Formatter fmt;
  private final int prec;

  public Formatted(Object item) {
    this(item, new Formatter(), 0);
  }

  public Formatted(Object item, Formatter fmt, int prec) {
    this.item = item;
    this.fmt = fmt;
    this.prec = prec;
  }

  @Override
  public void sendTo(DocSink out, int indent) {
    fmt.format(item, prec).sendTo(out, indent);
  }

  @Override
  public void writeTo(Appendable out, int width, int indent) {
    writeTo(out, width, indent, "", 0);
  }

  /**
   * Renders with line continuations: each continuation line starts with {@code prefix}, and the
   * first line is assumed to start at column {@code startAt}.
   */
  public void writeTo(Appendable out, int width, int indent, String prefix, int startAt) {
    ContinuationRenderer renderer =
        new ContinuationRenderer(out, width, prefix, ContinuationRenderer.DEFAULT_SUFFIX, startAt);
    try (GroupEndFinder sink = new GroupEndFinder(width, renderer)) {
      sendTo(sink, indent);
    }
  }
}
