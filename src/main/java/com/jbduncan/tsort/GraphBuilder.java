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

import java.util.Comparator;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the dependency graph of a sort: resolves every token through a {@link KeyRegistry} and
 * records one edge per (predecessor, successor) pair.
 *
 * <p>Self-edges are dropped. Repeated pairs are recorded as parallel edges, each of which counts
 * once towards the successor's indegree.
 */
final class GraphBuilder<K> {

  private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

  private final KeyRegistry<K> registry;
  private long numEdges;

  GraphBuilder(Comparator<? super K> comparator) {
    this.registry = new KeyRegistry<>(comparator);
  }

  /**
   * Consumes {@code tokens} two at a time as (predecessor, successor) pairs.
   *
   * @throws MalformedInputException if the tokens run out in the middle of a pair.
   */
  GraphBuilder<K> addAll(Iterator<? extends K> tokens) {
    checkNotNull(tokens, "tokens");
    while (tokens.hasNext()) {
      K predecessor = tokens.next();
      if (!tokens.hasNext()) {
        throw new MalformedInputException("input contains an odd number of tokens");
      }
      putEdge(predecessor, tokens.next());
    }
    log.debug("Read {} distinct keys and {} edges", registry.size(), numEdges);
    return this;
  }

  /**
   * Registers both keys and adds an edge from {@code predecessor} to {@code successor}.
   *
   * @return false iff the pair was a self-edge, which registers the key but adds no edge.
   */
  boolean putEdge(K predecessor, K successor) {
    Node<K> from = registry.findOrInsert(checkNotNull(predecessor, "predecessor"));
    Node<K> to = registry.findOrInsert(checkNotNull(successor, "successor"));
    if (from == to) {
      return false;
    }
    from.addSuccessor(to);
    numEdges++;
    return true;
  }

  KeyRegistry<K> registry() {
    return registry;
  }

  long numEdges() {
    return numEdges;
  }
}
