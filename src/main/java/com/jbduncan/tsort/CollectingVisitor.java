// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.jbduncan.tsort;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A {@link SortVisitor} that remembers the sorted keys and the broken cycles. */
public final class CollectingVisitor<K> extends AbstractSortVisitor<K> {

  private final ImmutableList.Builder<K> sortedKeys = ImmutableList.builder();
  private final ImmutableList.Builder<ImmutableList<K>> cycles = ImmutableList.builder();

  @Override
  public void visitNode(K key) {
    sortedKeys.add(key);
  }

  @Override
  public void visitCycle(List<? extends K> members) {
    cycles.add(ImmutableList.copyOf(members));
  }

  /** Returns the keys visited so far, in visitation order. */
  public ImmutableList<K> getSortedKeys() {
    return sortedKeys.build();
  }

  public ImmutableList<ImmutableList<K>> getCycles() {
    return cycles.build();
  }
}
