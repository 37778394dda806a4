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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code TopologicalSorter} computes a total order consistent with a list of pairwise ordering
 * constraints, in the manner of the POSIX {@code tsort} utility.
 *
 * <p>The input is a sequence of keys read two at a time: each pair {@code (a, b)} states that
 * {@code a} must precede {@code b}. A pair {@code (a, a)} only states that {@code a} exists.
 *
 * <p>The order is computed with a ready list (Kahn's algorithm). Keys with no predecessors are
 * queued in ascending key order; emitting a key retires its outgoing edges, and keys whose last
 * predecessor was just emitted join the back of the queue in the order they were discovered. The
 * result is therefore fully determined by the input.
 *
 * <p>If the queue runs dry while keys remain, the remaining keys contain a cycle. One cycle is
 * found and reported with {@link SortVisitor#visitCycle}, one of its edges is dropped, and the sort
 * resumes. Every key is visited exactly once even when the input has cycles; only the cycle edges
 * that were dropped may be violated.
 *
 * <p>Instances are immutable and may be reused; a single sort runs on the calling thread.
 */
public final class TopologicalSorter<K> {

  private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

  private final Comparator<? super K> keyOrder;

  private TopologicalSorter(Comparator<? super K> keyOrder) {
    this.keyOrder = checkNotNull(keyOrder, "keyOrder");
  }

  /** Returns a sorter that breaks ties between ready keys by their natural order. */
  public static <K extends Comparable<? super K>> TopologicalSorter<K> naturalOrder() {
    return new TopologicalSorter<>(Ordering.natural());
  }

  /** Returns a sorter that breaks ties between ready keys using {@code keyOrder}. */
  public static <K> TopologicalSorter<K> orderedBy(Comparator<? super K> keyOrder) {
    return new TopologicalSorter<>(keyOrder);
  }

  /**
   * Sorts the whitespace-separated tokens of {@code in}. Tokens are compared byte-wise; see {@link
   * TokenReader}.
   */
  public static SortResult sortTokens(InputStream in, SortVisitor<? super String> visitor) {
    return TopologicalSorter.<String>naturalOrder().sort(new TokenReader(in), visitor);
  }

  /**
   * Sorts the pairs of {@code keys} and passes the result to {@code visitor}.
   *
   * @throws MalformedInputException if {@code keys} yields an odd number of keys. Nothing is
   *     visited in that case.
   */
  public SortResult sort(Iterator<? extends K> keys, SortVisitor<? super K> visitor) {
    checkNotNull(keys, "keys");
    checkNotNull(visitor, "visitor");

    GraphBuilder<K> builder = new GraphBuilder<K>(keyOrder).addAll(keys);
    SortState<K> state = new SortState<>(builder.registry());

    visitor.beginVisit();
    while (state.remaining > 0) {
      if (!seed(state)) {
        breakCycle(state, visitor);
        continue;
      }
      drain(state, visitor);
    }
    visitor.endVisit();

    log.debug("Sorted {} keys, breaking {} cycles", state.registry.size(), state.cyclesBroken);
    return new SortResult(state.registry.size(), builder.numEdges(), state.cyclesBroken);
  }

  /** Convenience form of {@link #sort(Iterator, SortVisitor)} that collects the sorted keys. */
  public ImmutableList<K> sort(Iterable<? extends K> keys) {
    CollectingVisitor<K> visitor = new CollectingVisitor<>();
    sort(keys.iterator(), visitor);
    return visitor.getSortedKeys();
  }

  /** Mutable state of one sort, threaded through every phase. */
  private static final class SortState<K> {
    final KeyRegistry<K> registry;
    final Deque<Node<K>> ready = new ArrayDeque<>();
    int remaining;
    int cyclesBroken;

    SortState(KeyRegistry<K> registry) {
      this.registry = registry;
      this.remaining = registry.size();
    }

    void enqueue(Node<K> node) {
      node.setStatus(Node.Status.QUEUED);
      ready.addLast(node);
    }
  }

  /**
   * Queues every pending node without predecessors, in key order.
   *
   * @return true iff at least one node was queued.
   */
  private static <K> boolean seed(SortState<K> state) {
    for (Iterator<Node<K>> nodes = state.registry.inOrder(); nodes.hasNext(); ) {
      Node<K> node = nodes.next();
      if (node.getStatus() == Node.Status.PENDING && node.getIndegree() == 0) {
        state.enqueue(node);
      }
    }
    log.trace("Seeded {} ready keys", state.ready.size());
    return !state.ready.isEmpty();
  }

  private static <K> void drain(SortState<K> state, SortVisitor<? super K> visitor) {
    while (!state.ready.isEmpty()) {
      Node<K> node = state.ready.removeFirst();
      visitor.visitNode(node.getKey());
      node.setStatus(Node.Status.EMITTED);
      state.remaining--;

      for (Iterator<Node<K>> successors = node.successors(); successors.hasNext(); ) {
        Node<K> successor = successors.next();
        if (successor.decrementIndegree()) {
          checkState(
              successor.getStatus() == Node.Status.PENDING, "%s became ready twice", successor);
          state.enqueue(successor);
        }
      }
    }
  }

  private static <K> void breakCycle(SortState<K> state, SortVisitor<? super K> visitor) {
    ImmutableList<Node<K>> cycle = new CycleBreaker<>(state.registry).breakCycle();
    ImmutableList.Builder<K> members = ImmutableList.builderWithExpectedSize(cycle.size());
    for (Node<K> node : cycle) {
      members.add(node.getKey());
    }
    visitor.visitCycle(members.build());
    state.cyclesBroken++;
  }
}
