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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A DocSink that computes the positions needed by a {@link LayoutRenderer} and forwards the events
 * to it.
 *
 * <p>The begin of a group can only be forwarded once we know where the group ends, so the events
 * following an unresolved group begin are buffered. A group is resolved when it ends or when its
 * content has grown wider than the page (at which point it cannot fit, whatever follows), so no
 * more than a page width of events is ever buffered.
 *
 * <p>A group end is not applied until the next line, break, or group begin, so that text
 * immediately following a group is considered part of it when deciding whether it fits.
 */
public final class GroupEndFinder implements DocSink {
  private final int width;
  private final LayoutRenderer next;

  /** The current position, as if everything so far had been rendered on a single line. */
  private int hp;

  /** The number of groups begun and not yet ended. */
  private int depth;

  /** The number of group ends that have been received but not yet applied. */
  private int delayedEnds;

  /** Groups whose begin has not yet been forwarded, outermost first. */
  private final ArrayDeque<PendingGroup> pending = new ArrayDeque<>();

  private static final class PendingGroup {
    final int startHp;

    /** The events received since this group began, up to the start of the next pending group. */
    final List<Consumer<LayoutRenderer>> events = new ArrayList<>();

    PendingGroup(int startHp) {
      this.startHp = startHp;
    }
  }

  public GroupEndFinder(int width, LayoutRenderer next) {
    Preconditions.checkArgument(width > 0, "width must be positive");
    this.width = width;
    this.next = next;
  }

  @Override
  public void text(String s) {
    hp += s.length();
    emit(r -> r.text(s));
  }

  @Override
  public void line(int indent) {
    applyEnds();
    hp += 1;
    int at = hp;
    emit(r -> r.line(at, indent));
  }

  @Override
  public void lineBreak(int indent) {
    applyEnds();
    int at = hp;
    emit(r -> r.lineBreak(at, indent));
  }

  @Override
  public void beginGroup() {
    applyEnds();
    ++depth;
    pending.addLast(new PendingGroup(hp));
  }

  @Override
  public void endGroup() {
    Preconditions.checkState(depth > delayedEnds, "endGroup() without matching beginGroup()");
    ++delayedEnds;
  }

  @Override
  public void close() {
    applyEnds();
    Preconditions.checkState(depth == 0, "%s groups were not ended", depth);
  }

  private void applyEnds() {
    for (; delayedEnds > 0; --delayedEnds) {
      --depth;
      PendingGroup group = pending.pollLast();
      if (group == null) {
        // The innermost open group was already forwarded.
        emit(LayoutRenderer::endGroup);
        continue;
      }
      int end = hp;
      PendingGroup outer = pending.peekLast();
      if (outer == null) {
        next.beginGroup(end);
        replay(group);
        next.endGroup();
      } else {
        outer.events.add(r -> r.beginGroup(end));
        outer.events.addAll(group.events);
        outer.events.add(LayoutRenderer::endGroup);
      }
    }
  }

  private void emit(Consumer<LayoutRenderer> event) {
    PendingGroup innermost = pending.peekLast();
    if (innermost == null) {
      event.accept(next);
      return;
    }
    innermost.events.add(event);
    // Any group that is already wider than the page can be forwarded now.
    while (!pending.isEmpty() && hp - pending.peekFirst().startHp > width) {
      next.beginGroup(LayoutRenderer.UNKNOWN);
      replay(pending.removeFirst());
    }
  }

  private void replay(PendingGroup group) {
    for (Consumer<LayoutRenderer> event : group.events) {
      event.accept(next);
    }
  }
}
