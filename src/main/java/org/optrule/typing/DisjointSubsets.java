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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * A union-find structure over elements compared by identity.
 *
 * <p>Each element is assigned a stable index when it is added; subsets are tracked with parent
 * links between indices (union by size, with path halving). When two subsets of the same size are
 * merged the earlier-added representative wins, so the partition and its representatives depend
 * only on the order of operations.
 */
public final class DisjointSubsets<T> {

  private final Map<T, Integer> indices = Maps.newIdentityHashMap();
  private final List<T> elements = new ArrayList<>();
  private int[] parents = new int[16];
  private int[] sizes = new int[16];

  /** Returns true if {@code x} has been added. */
  public boolean contains(T x) {
    return indices.containsKey(x);
  }

  /** The number of elements that have been added. */
  public int size() {
    return elements.size();
  }

  /** Adds {@code x} as a singleton subset; returns false if it was already present. */
  @CanIgnoreReturnValue
  public boolean add(T x) {
    if (indices.containsKey(x)) {
      return false;
    }
    int index = elements.size();
    if (index == parents.length) {
      parents = Arrays.copyOf(parents, index * 2);
      sizes = Arrays.copyOf(sizes, index * 2);
    }
    parents[index] = index;
    sizes[index] = 1;
    elements.add(x);
    indices.put(x, index);
    return true;
  }

  private int index(T x) {
    Integer result = indices.get(x);
    Preconditions.checkArgument(result != null, "Not in any subset: %s", x);
    return result;
  }

  private int find(int i) {
    while (parents[i] != i) {
      parents[i] = parents[parents[i]];
      i = parents[i];
    }
    return i;
  }

  /** Returns the representative of the subset containing {@code x}, which must have been added. */
  public T rep(T x) {
    return elements.get(find(index(x)));
  }

  /** Returns true if {@code x} is the representative of its subset. */
  public boolean isRep(T x) {
    int i = index(x);
    return find(i) == i;
  }

  /**
   * Merges the subsets containing {@code x} and {@code y} (both of which must have been added) and
   * returns the representative of the merged subset.
   */
  @CanIgnoreReturnValue
  public T unify(T x, T y) {
    int rx = find(index(x));
    int ry = find(index(y));
    if (rx == ry) {
      return elements.get(rx);
    }
    if (sizes[rx] < sizes[ry] || (sizes[rx] == sizes[ry] && ry < rx)) {
      int tmp = rx;
      rx = ry;
      ry = tmp;
    }
    parents[ry] = rx;
    sizes[rx] += sizes[ry];
    return elements.get(rx);
  }

  /** Returns every element, in the order they were added. */
  public ImmutableList<T> elements() {
    return ImmutableList.copyOf(elements);
  }

  /** Returns the representative of each subset, in the order they were added. */
  public ImmutableList<T> reps() {
    return IntStream.range(0, elements.size())
        .filter(i -> find(i) == i)
        .mapToObj(elements::get)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns every member of the subset containing {@code x}, in the order they were added. */
  public ImmutableList<T> subset(T x) {
    int root = find(index(x));
    return IntStream.range(0, elements.size())
        .filter(i -> find(i) == root)
        .mapToObj(elements::get)
        .collect(ImmutableList.toImmutableList());
  }
}
