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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and breaks one dependency cycle among the nodes of a {@link KeyRegistry} that have not yet
 * been emitted.
 *
 * <p>The search is a depth-first walk along successor edges. Start nodes are tried in key order,
 * and edges in successor-list order, so the cycle found is deterministic. Each call keeps its own
 * scratch state, addressed by node id: the set of nodes on the current walk, and the set of nodes
 * already known to lead to no cycle.
 *
 * <p>Clients should not modify the registry while a search is in progress.
 */
final class CycleBreaker<K> {

  private static final Logger log = LoggerFactory.getLogger(CycleBreaker.class);

  /** A node on the walk, and the next of its edges to follow. */
  private static final class Frame<K> {
    final Node<K> node;
    @Nullable Node.Edge<K> cursor;

    Frame(Node<K> node) {
      this.node = node;
      this.cursor = node.getFirstSuccessor();
    }
  }

  private final KeyRegistry<K> registry;

  CycleBreaker(KeyRegistry<K> registry) {
    this.registry = checkNotNull(registry, "registry");
  }

  /**
   * Finds a cycle among the unemitted nodes, retracts the edge that closes it and returns its
   * members in edge order, starting with the node whose indegree was decremented.
   *
   * @throws IllegalStateException if the unemitted nodes contain no cycle.
   */
  ImmutableList<Node<K>> breakCycle() {
    BitSet onStack = new BitSet(registry.size());
    BitSet exhausted = new BitSet(registry.size());
    Deque<Frame<K>> stack = new ArrayDeque<>();

    for (Iterator<Node<K>> starts = registry.inOrder(); starts.hasNext(); ) {
      Node<K> start = starts.next();
      if (start.isEmitted() || start.getIndegree() == 0 || exhausted.get(start.getId())) {
        continue;
      }

      stack.push(new Frame<>(start));
      onStack.set(start.getId());
      while (!stack.isEmpty()) {
        Frame<K> top = stack.peek();
        Node.Edge<K> edge = top.cursor;
        if (edge == null) {
          // Dead end: nothing reachable from here closes a cycle.
          stack.pop();
          onStack.clear(top.node.getId());
          exhausted.set(top.node.getId());
          continue;
        }
        top.cursor = edge.next;

        Node<K> target = edge.target;
        if (target.isEmitted() || exhausted.get(target.getId())) {
          continue;
        }
        if (onStack.get(target.getId())) {
          return retract(stack, top.node, target);
        }
        stack.push(new Frame<>(target));
        onStack.set(target.getId());
      }
    }

    throw new IllegalStateException(
        "No cycle found although some nodes of " + registry + " cannot be emitted");
  }

  private ImmutableList<Node<K>> retract(Deque<Frame<K>> stack, Node<K> last, Node<K> first) {
    ImmutableList.Builder<Node<K>> members = ImmutableList.builder();
    boolean inCycle = false;
    for (Iterator<Frame<K>> frames = stack.descendingIterator(); frames.hasNext(); ) {
      Node<K> node = frames.next().node;
      inCycle |= node == first;
      if (inCycle) {
        members.add(node);
      }
    }

    last.retractSuccessor(first);
    ImmutableList<Node<K>> cycle = members.build();
    log.debug("Dropped edge {} -> {} to break a cycle of {} keys", last, first, cycle.size());
    return cycle;
  }
}
