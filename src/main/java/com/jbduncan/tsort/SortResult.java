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

import com.google.common.base.MoreObjects;

/** Summary of one run of a {@link TopologicalSorter}. */
public final class SortResult {

  private final int numKeys;
  private final long numEdges;
  private final int numCyclesBroken;

  SortResult(int numKeys, long numEdges, int numCyclesBroken) {
    this.numKeys = numKeys;
    this.numEdges = numEdges;
    this.numCyclesBroken = numCyclesBroken;
  }

  /** Returns the number of distinct keys, all of which were visited. */
  public int numKeys() {
    return numKeys;
  }

  /** Returns the number of edges recorded, self-edges excluded and parallel edges included. */
  public long numEdges() {
    return numEdges;
  }

  public int numCyclesBroken() {
    return numCyclesBroken;
  }

  /**
   * Returns true iff the input described a partial order, so that the visited keys form a
   * topological order of every recorded edge.
   */
  public boolean isAcyclic() {
    return numCyclesBroken == 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("numKeys", numKeys)
        .add("numEdges", numEdges)
        .add("numCyclesBroken", numCyclesBroken)
        .toString();
  }
}
