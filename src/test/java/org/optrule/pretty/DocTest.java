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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.optrule.pretty.Doc.BREAK;
import static org.optrule.pretty.Doc.LINE;
import static org.optrule.pretty.Doc.group;
import static org.optrule.pretty.Doc.seq;
import static org.optrule.pretty.Doc.text;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DocTest {

  @Test
  public void groupThatFits() {
    Doc doc = group(text("aaaa"), LINE, text("bbbb"));
    assertThat(doc.render(9)).isEqualTo("aaaa bbbb");
    assertThat(doc.toString()).isEqualTo("aaaa bbbb");
  }

  @Test
  public void groupThatDoesNotFit() {
    Doc doc = group(text("aaaa"), LINE, text("bbbb"));
    assertThat(doc.render(5)).isEqualTo("aaaa\nbbbb");
  }

  @Test
  public void linesOutsideAnyGroupAlwaysBreak() {
    assertThat(seq(text("a"), LINE, text("b")).render(80)).isEqualTo("a\nb");
    assertThat(seq(text("a"), BREAK, text("b")).render(80)).isEqualTo("a\nb");
  }

  @Test
  public void breakIsEmptyWhenGroupFits() {
    assertThat(group(text("f("), BREAK, text("x)")).render(80)).isEqualTo("f(x)");
  }

  @Test
  public void nestedIndent() {
    Doc doc =
        group(text("f("), seq(BREAK, text("x,"), LINE, text("y")).nest(2), text(")"));
    assertThat(doc.render(80)).isEqualTo("f(x, y)");
    assertThat(doc.render(4)).isEqualTo("f(\n  x,\n  y)");
  }

  @Test
  public void innerGroupFitsAfterOuterBreaks() {
    Doc doc = group(text("aaa"), LINE, group(text("b"), LINE, text("c")));
    assertThat(doc.render(6)).isEqualTo("aaa\nb c");
  }

  @Test
  public void textFollowingGroupCountsTowardsFit() {
    Doc doc = seq(group(text("a"), LINE, text("b")), text("cccc"));
    assertThat(doc.render(4)).isEqualTo("a\nbcccc");
    assertThat(doc.render(7)).isEqualTo("a bcccc");
  }

  @Test
  public void join() {
    Doc doc = group(seq(text(","), LINE).join(text("x"), text("y"), text("z")));
    assertThat(doc.render(80)).isEqualTo("x, y, z");
    assertThat(seq(text(","), LINE).join(ImmutableList.<Doc>of()).render(80)).isEmpty();
    assertThat(Doc.iterSeq(ImmutableList.of(text("p"), text("q"))).render(80)).isEqualTo("pq");
  }

  @Test
  public void writeToWithIndent() {
    StringBuilder sb = new StringBuilder();
    seq(text("a"), LINE, text("b")).writeTo(sb, 80, 4);
    assertThat(sb.toString()).isEqualTo("a\n    b");
  }

  @Test
  public void emptyDocs() {
    assertThat(Doc.EMPTY.render(80)).isEmpty();
    assertThat(seq().render(80)).isEmpty();
    assertThat(group().render(80)).isEmpty();
  }

  @Test
  public void textMayNotContainNewlines() {
    assertThrows(IllegalArgumentException.class, () -> text("a\nb"));
  }

  @Test
  public void unbalancedGroups() {
    StringBuilder sb = new StringBuilder();
    GroupEndFinder sink = new GroupEndFinder(80, new WidthRenderer(sb, 80));
    sink.beginGroup();
    sink.text("x");
    assertThrows(IllegalStateException.class, sink::close);

    GroupEndFinder sink2 = new GroupEndFinder(80, new WidthRenderer(sb, 80));
    assertThrows(IllegalStateException.class, sink2::endGroup);
  }

  @Test
  public void widthMustBePositive() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new GroupEndFinder(0, new WidthRenderer(new StringBuilder(), 0)));
  }
}
