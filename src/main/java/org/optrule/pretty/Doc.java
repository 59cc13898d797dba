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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * An immutable description of some text, with optional line breaks whose use is decided when the
 * Doc is rendered at a particular width.
 *
 * <p>The building blocks are:
 *
 * <ul>
 *   <li>{@link #text}: literal text, which is never broken.
 *   <li>{@link #LINE}: a space if the enclosing group fits, otherwise a newline followed by the
 *       current indent.
 *   <li>{@link #BREAK}: nothing if the enclosing group fits, otherwise a newline followed by the
 *       current indent.
 *   <li>{@link #group}: a span that is rendered either entirely on one line (if it fits, together
 *       with any text that follows it up to the next line or break) or with each of its own lines
 *       broken.
 *   <li>{@link #nest}: increases the indent used by the lines and breaks within a span.
 *   <li>{@link #seq}, {@link #join}, and {@link #iterSeq}: concatenation.
 * </ul>
 *
 * <p>A Doc is rendered by sending it as a sequence of events to a {@link DocSink}; see {@link
 * #writeTo}.
 */
public abstract class Doc {

  /** A Doc that renders as nothing. */
  public static final Doc EMPTY = new Seq(ImmutableList.of());

  /** A soft line: a single space, or a newline and indent if the enclosing group is broken. */
  public static final Doc LINE =
      new Doc() {
        @Override
        public void sendTo(DocSink out, int indent) {
          out.line(indent);
        }
      };

  /** A zero-width break: nothing, or a newline and indent if the enclosing group is broken. */
  public static final Doc BREAK =
      new Doc() {
        @Override
        public void sendTo(DocSink out, int indent) {
          out.lineBreak(indent);
        }
      };

  /** The width used by {@link #toString}. */
  public static final int DEFAULT_WIDTH = 80;

  protected Doc() {}

  /**
   * Sends the events describing this Doc to {@code out}. {@code indent} is the column at which a
   * line started by this Doc should continue.
   */
  public abstract void sendTo(DocSink out, int indent);

  /** Returns a Doc consisting of the given text, which should not contain any newlines. */
  public static Doc text(String s) {
    return new Text(s);
  }

  /** Returns the concatenation of the given Docs. */
  public static Doc seq(Doc... docs) {
    return (docs.length == 0) ? EMPTY : new Seq(ImmutableList.copyOf(docs));
  }

  /** Returns the concatenation of the given Docs. */
  public static Doc iterSeq(Iterable<? extends Doc> docs) {
    return new Seq(ImmutableList.copyOf(docs));
  }

  /** Returns a group containing the concatenation of the given Docs. */
  public static Doc group(Doc... docs) {
    return new Group(seq(docs));
  }

  /** Returns a Doc that renders this one with the indent increased by {@code n}. */
  public Doc nest(int n) {
    return (n == 0) ? this : new Nest(this, n);
  }

  /** Returns a Doc that renders each of {@code docs}, separated by this Doc. */
  public Doc join(Iterable<? extends Doc> docs) {
    ImmutableList.Builder<Doc> builder = ImmutableList.builder();
    boolean first = true;
    for (Doc doc : docs) {
      if (!first) {
        builder.add(this);
      }
      builder.add(doc);
      first = false;
    }
    return new Seq(builder.build());
  }

  /** Returns a Doc that renders each of {@code docs}, separated by this Doc. */
  public Doc join(Doc... docs) {
    return join(Arrays.asList(docs));
  }

  /** Renders this Doc to {@code out}, breaking groups that would not fit in {@code width}. */
  public void writeTo(Appendable out, int width, int indent) {
    try (GroupEndFinder sink = new GroupEndFinder(width, new WidthRenderer(out, width))) {
      sendTo(sink, indent);
    }
  }

  /** Returns the result of rendering this Doc at the given width. */
  public String render(int width) {
    StringBuilder sb = new StringBuilder();
    writeTo(sb, width, 0);
    return sb.toString();
  }

  @Override
  public String toString() {
    return render(DEFAULT_WIDTH);
  }

  private static final class Text extends Doc {
    final String text;

    Text(String text) {
      Preconditions.checkArgument(text.indexOf('\n') < 0, "Text may not contain newlines");
      this.text = text;
    }

    @Override
    public void sendTo(DocSink out, int indent) {
      out.text(text);
    }
  }

  private static final class Seq extends Doc {
    final ImmutableList<Doc> docs;

    Seq(ImmutableList<Doc> docs) {
      this.docs = docs;
    }

    @Override
    public void sendTo(DocSink out, int indent) {
      for (Doc doc : docs) {
        doc.sendTo(out, indent);
      }
    }
  }

  private static final class Group extends Doc {
    final Doc body;

    Group(Doc body) {
      this.body = body;
    }

    @Override
    public void sendTo(DocSink out, int indent) {
      out.beginGroup();
      body.sendTo(out, indent);
      out.endGroup();
    }
  }

  private static final class Nest extends Doc {
    final Doc body;
    final int n;

    Nest(Doc body, int n) {
      this.body = body;
      this.n = n;
    }

    @Override
    public void sendTo(DocSink out, int indent) {
      body.sendTo(out, indent + n);
    }
  }
}
