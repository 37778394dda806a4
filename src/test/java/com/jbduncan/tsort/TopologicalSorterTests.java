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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Test for {@link TopologicalSorter}. */
class TopologicalSorterTests {

  private final TopologicalSorter<String> sorter = TopologicalSorter.naturalOrder();

  @Test
  void testChain() {
    assertSortsTo("a b\nb c\n", "a", "b", "c");
  }

  @Test
  void testEmptyInput() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    SortResult result = sorter.sort(TokenReader.of(""), visitor);

    assertThat(visitor.getSortedKeys()).isEmpty();
    assertThat(result.isAcyclic()).isTrue();
    assertThat(result.numKeys()).isEqualTo(0);
  }

  @Test
  void testSelfEdgeIsOnlyAKey() {
    assertSortsTo("x x\n", "x");
  }

  @Test
  void testSelfEdgeDoesNotDelayKey() {
    assertSortsTo("b b a b", "a", "b");
  }

  @Test
  void testDiamond() {
    // Keys made ready by the same emission follow the successor list, newest edge first.
    assertSortsTo("a b\na c\nb d\nc d\n", "a", "c", "b", "d");
  }

  @Test
  void testReadyKeysAreSeededInKeyOrder() {
    assertSortsTo("c z b z a z", "a", "b", "c", "z");
  }

  @Test
  void testKeysReadyMidDrainAreNotResorted() {
    // "m" becomes ready while draining the seed and is emitted after "z", not before it.
    assertSortsTo("a m z z", "a", "z", "m");
  }

  @Test
  void testCompatibleWithTsortUtility() {
    assertSortsTo(
        "3 8\n3 10\n5 11\n7 8\n7 11\n8 9\n11 2\n11 9\n11 10",
        "3", "5", "7", "11", "8", "10", "2", "9");
    assertSortsTo(
        "8 9\n1 4\n1 2\n4 2\n4 3\n3 2\n5 2\n3 5\n8 2\n8 6",
        "1", "8", "4", "6", "9", "3", "5", "2");
    assertSortsTo("4 4\n2 4\n4 1\n3 1", "2", "3", "4", "1");
  }

  @Test
  void testRepeatedPairs() {
    assertSortsTo("a b a b b c a b", "a", "b", "c");
  }

  @Test
  void testOddNumberOfTokensVisitsNothing() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    assertThrows(
        MalformedInputException.class, () -> sorter.sort(TokenReader.of("a b c"), visitor));
    assertThat(visitor.getSortedKeys()).isEmpty();
  }

  @Test
  void testTwoCycle() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    SortResult result = sorter.sort(TokenReader.of("a b\nb a\n"), visitor);

    assertThat(visitor.getSortedKeys()).containsExactly("a", "b").inOrder();
    assertThat(visitor.getCycles()).containsExactly(ImmutableList.of("a", "b"));
    assertThat(result.isAcyclic()).isFalse();
    assertThat(result.numCyclesBroken()).isEqualTo(1);
  }

  @Test
  void testThreeCycle() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    SortResult result = sorter.sort(TokenReader.of("a b\nb c\nc a\n"), visitor);

    assertThat(visitor.getSortedKeys()).containsExactly("a", "b", "c");
    assertThat(visitor.getCycles()).hasSize(1);
    assertThat(visitor.getCycles().get(0)).containsExactly("a", "b", "c");
    assertThat(result.isAcyclic()).isFalse();
  }

  @Test
  void testCycleAfterChain() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    sorter.sort(TokenReader.of("x a a b b a"), visitor);

    assertThat(visitor.getSortedKeys()).containsExactly("x", "a", "b").inOrder();
    assertThat(visitor.getCycles()).containsExactly(ImmutableList.of("a", "b"));
  }

  @Test
  void testIndependentCyclesAreBrokenInTurn() {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    SortResult result = sorter.sort(TokenReader.of("a b b a c d d c"), visitor);

    assertThat(visitor.getSortedKeys()).containsExactly("a", "b", "c", "d").inOrder();
    assertThat(visitor.getCycles())
        .containsExactly(ImmutableList.of("a", "b"), ImmutableList.of("c", "d"))
        .inOrder();
    assertThat(result.numCyclesBroken()).isEqualTo(2);
  }

  @Test
  void testOrderedBy() {
    TopologicalSorter<String> reversed = TopologicalSorter.orderedBy(Comparator.reverseOrder());

    assertThat(reversed.sort(ImmutableList.of("c", "z", "b", "z", "a", "z")))
        .containsExactly("c", "b", "a", "z")
        .inOrder();
  }

  @Test
  void testNonStringKeys() {
    TopologicalSorter<Integer> integers = TopologicalSorter.naturalOrder();

    // 10 sorts after 9 numerically, unlike the byte order of the tokens "10" and "9".
    assertThat(integers.sort(ImmutableList.of(10, 20, 9, 20)))
        .containsExactly(9, 10, 20)
        .inOrder();
  }

  @Test
  void testVisitorLifecycle() {
    List<String> calls = new ArrayList<>();
    SortVisitor<String> visitor =
        new AbstractSortVisitor<String>() {
          @Override
          public void beginVisit() {
            calls.add("begin");
          }

          @Override
          public void endVisit() {
            calls.add("end");
          }

          @Override
          public void visitNode(String key) {
            calls.add(key);
          }

          @Override
          public void visitCycle(List<? extends String> members) {
            calls.add("cycle" + members);
          }
        };

    sorter.sort(TokenReader.of("x y a b b a"), visitor);

    assertThat(calls).containsExactly("begin", "x", "y", "cycle[a, b]", "a", "b", "end").inOrder();
  }

  @Test
  void testRandomAcyclicGraphs() {
    Random random = new Random(7);
    for (int i = 0; i < 25; i++) {
      MutableGraph<String> graph = randomGraph(random, 40, 120, /* acyclic= */ true);
      List<String> tokens = toTokens(graph);

      ImmutableList<String> order = sorter.sort(tokens);

      assertThat(Graphs.hasCycle(graph)).isFalse();
      assertValidTopologicalOrdering(graph, order);
      assertThat(sorter.sort(tokens)).isEqualTo(order);
    }
  }

  @Test
  void testRandomCyclicGraphs() {
    Random random = new Random(11);
    for (int i = 0; i < 25; i++) {
      MutableGraph<String> graph = randomGraph(random, 30, 60, /* acyclic= */ false);
      CollectingVisitor<String> visitor = new CollectingVisitor<>();

      SortResult result = sorter.sort(toTokens(graph).iterator(), visitor);

      ImmutableList<String> order = visitor.getSortedKeys();
      assertThat(order).containsExactlyElementsIn(graph.nodes());
      assertThat(result.isAcyclic()).isEqualTo(!Graphs.hasCycle(graph));
      for (List<String> cycle : visitor.getCycles()) {
        assertIsCycle(graph, cycle);
      }
      for (EndpointPair<String> edge : graph.edges()) {
        if (!onCycle(graph, edge.source()) && !onCycle(graph, edge.target())) {
          assertThat(order).containsAtLeast(edge.source(), edge.target()).inOrder();
        }
      }
    }
  }

  private void assertSortsTo(String input, String... expected) {
    CollectingVisitor<String> visitor = new CollectingVisitor<>();

    SortResult result = sorter.sort(TokenReader.of(input), visitor);

    assertThat(visitor.getSortedKeys()).containsExactlyElementsIn(expected).inOrder();
    assertThat(visitor.getCycles()).isEmpty();
    assertThat(result.isAcyclic()).isTrue();
  }

  static <T> void assertValidTopologicalOrdering(Graph<T> graph, List<T> topologicalOrdering) {
    assertThat(topologicalOrdering).containsExactlyElementsIn(graph.nodes());
    for (EndpointPair<T> edge : graph.edges()) {
      assertThat(edge.isOrdered()).isTrue();
      if (!edge.source().equals(edge.target())) {
        assertThat(topologicalOrdering).containsAtLeast(edge.source(), edge.target()).inOrder();
      }
    }
  }

  private static <T> void assertIsCycle(Graph<T> graph, List<T> cycle) {
    assertThat(cycle.size()).isAtLeast(2);
    for (int i = 0; i < cycle.size(); i++) {
      T from = cycle.get(i);
      T to = cycle.get((i + 1) % cycle.size());
      assertThat(graph.hasEdgeConnecting(from, to)).isTrue();
    }
  }

  private static <T> boolean onCycle(Graph<T> graph, T node) {
    for (T successor : graph.successors(node)) {
      if (!successor.equals(node) && Graphs.reachableNodes(graph, successor).contains(node)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a random graph over keys "k0", "k1", ... without self-edges. Acyclic graphs only have
   * edges from a lower to a higher position of a random permutation.
   */
  private static MutableGraph<String> randomGraph(
      Random random, int numNodes, int numEdges, boolean acyclic) {
    List<String> nodes = new ArrayList<>();
    for (int i = 0; i < numNodes; i++) {
      nodes.add("k" + i);
    }
    Collections.shuffle(nodes, random);

    MutableGraph<String> graph = com.google.common.graph.GraphBuilder.directed().build();
    nodes.forEach(graph::addNode);
    for (int i = 0; i < numEdges; i++) {
      int from = random.nextInt(numNodes);
      int to = random.nextInt(numNodes);
      if (from == to) {
        continue;
      }
      if (acyclic && from > to) {
        int swap = from;
        from = to;
        to = swap;
      }
      graph.putEdge(nodes.get(from), nodes.get(to));
    }
    return graph;
  }

  /** Writes every edge as a pair, and every node as a self-pair so isolated nodes are kept. */
  private static List<String> toTokens(Graph<String> graph) {
    List<String> tokens = new ArrayList<>();
    for (String node : graph.nodes()) {
      tokens.add(node);
      tokens.add(node);
    }
    for (EndpointPair<String> edge : graph.edges()) {
      tokens.add(edge.source());
      tokens.add(edge.target());
    }
    return tokens;
  }
}
