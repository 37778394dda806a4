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

import java.util.List;

/**
 * A visitor of the results of a topological sort. {@link #visitNode} receives the keys in their
 * sorted order; {@link #visitCycle} receives each dependency cycle that had to be broken to let the
 * sort make progress, interleaved with the keys at the point the cycle was found.
 */
public interface SortVisitor<K> {

  /** Called before visitation commences. */
  void beginVisit();

  /** Called after visitation is complete. */
  void endVisit();

  void visitNode(K key);

  /**
   * Called with the members of a cycle, in edge order: each member must precede the next one, and
   * the last must precede the first. The edge from the last member to the first is the one that
   * was dropped.
   */
  void visitCycle(List<? extends K> members);
}
