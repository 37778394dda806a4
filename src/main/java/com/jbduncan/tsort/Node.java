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

import com.google.common.collect.AbstractIterator;
import java.util.Iterator;
import javax.annotation.Nullable;

/**
 * A node of a {@link KeyRegistry}. Each node carries one distinct key and plays two roles: it is a
 * vertex of the AVL tree that deduplicates keys ({@link #left}, {@link #right}, {@link #balance}),
 * and it is a vertex of the dependency graph being sorted ({@link #indegree} and the successor
 * list).
 *
 * <p>Nodes are created only by {@link KeyRegistry#findOrInsert} and are never removed from their
 * registry; emission only changes their {@link Status}.
 */
final class Node<K> {

  /** Where a node is in the scheduling lifecycle. */
  enum Status {
    /** Not yet emitted and not on the ready list. */
    PENDING,
    /** On the ready list, waiting to be emitted. */
    QUEUED,
    /** Written to the output. Terminal. */
    EMITTED
  }

  /** An edge of the successor list: "this node must precede {@code target}". */
  static final class Edge<K> {
    final Node<K> target;
    @Nullable Edge<K> next;

    private Edge(Node<K> target, @Nullable Edge<K> next) {
      this.target = target;
      this.next = next;
    }
  }

  private final K key;

  /** Dense creation index within the owning registry. */
  private final int id;

  // AVL tree structure; height(right) - height(left), always in {-1, 0, +1} between insertions.
  @Nullable Node<K> left;
  @Nullable Node<K> right;
  int balance;

  private int indegree;
  @Nullable private Edge<K> firstSuccessor;
  private int numSuccessors;
  private Status status = Status.PENDING;

  Node(K key, int id) {
    this.key = checkNotNull(key, "key");
    this.id = id;
  }

  K getKey() {
    return key;
  }

  int getId() {
    return id;
  }

  int getIndegree() {
    return indegree;
  }

  int numSuccessors() {
    return numSuccessors;
  }

  Status getStatus() {
    return status;
  }

  boolean isEmitted() {
    return status == Status.EMITTED;
  }

  void setStatus(Status status) {
    checkState(this.status != Status.EMITTED, "%s has already been emitted", this);
    this.status = checkNotNull(status, "status");
  }

  /**
   * Records that this node must precede {@code successor}. The edge goes to the front of the
   * successor list, so successors are iterated most-recently-added first. Multi-edges are kept.
   */
  void addSuccessor(Node<K> successor) {
    checkNotNull(successor, "successor");
    firstSuccessor = new Edge<>(successor, firstSuccessor);
    numSuccessors++;
    successor.indegree++;
  }

  /**
   * Retires one incoming edge.
   *
   * @return true iff the indegree dropped to zero.
   */
  boolean decrementIndegree() {
    checkState(indegree > 0, "indegree of %s is already zero", this);
    return --indegree == 0;
  }

  /**
   * Unlinks the first edge from this node to {@code successor} and retires it on the successor's
   * side.
   *
   * @throws IllegalArgumentException if there is no such edge.
   */
  void retractSuccessor(Node<K> successor) {
    Edge<K> previous = null;
    for (Edge<K> edge = firstSuccessor; edge != null; previous = edge, edge = edge.next) {
      if (edge.target == successor) {
        if (previous == null) {
          firstSuccessor = edge.next;
        } else {
          previous.next = edge.next;
        }
        numSuccessors--;
        successor.decrementIndegree();
        return;
      }
    }
    throw new IllegalArgumentException("No edge from " + this + " to " + successor);
  }

  @Nullable
  Edge<K> getFirstSuccessor() {
    return firstSuccessor;
  }

  /** Returns the targets of the successor list, duplicates included, in list order. */
  Iterator<Node<K>> successors() {
    return new AbstractIterator<Node<K>>() {
      @Nullable private Edge<K> cursor = firstSuccessor;

      @Override
      protected Node<K> computeNext() {
        if (cursor == null) {
          return endOfData();
        }
        Node<K> target = cursor.target;
        cursor = cursor.next;
        return target;
      }
    };
  }

  @Override
  public String toString() {
    return "Node[" + key + "]";
  }
}
