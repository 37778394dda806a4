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

import com.google.common.collect.AbstractIterator;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import javax.annotation.Nullable;

/**
 * {@code KeyRegistry} maps each distinct key to exactly one {@link Node}, using an AVL tree ordered
 * by a caller-supplied comparator.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>Each registry "owns" the nodes it creates. Nodes are never removed.
 *   <li>Between insertions, every node's {@code balance} equals the height of its right subtree
 *       minus the height of its left subtree, and lies in {-1, 0, +1}.
 *   <li>Node ids are dense: the n-th node created has id n - 1.
 *   <li>{@code KeyRegistry} assumes immutability of keys, much like {@link java.util.TreeMap} does.
 * </ul>
 *
 * <p>This class is not thread-safe.
 */
final class KeyRegistry<K> {

  private final Comparator<? super K> comparator;

  @Nullable private Node<K> root;
  private int size;

  /** Result slot threaded through one recursive insertion. */
  private static final class Insertion<K> {
    Node<K> node;
    boolean heightChanged;
  }

  KeyRegistry(Comparator<? super K> comparator) {
    this.comparator = checkNotNull(comparator, "comparator");
  }

  /**
   * Returns the node for {@code key}, creating it if necessary. This is the <i>only</i> factory of
   * Nodes. Time: O(log n).
   */
  Node<K> findOrInsert(K key) {
    checkNotNull(key, "key");
    Insertion<K> insertion = new Insertion<>();
    root = insert(root, key, insertion);
    return insertion.node;
  }

  /** Returns the node for {@code key}, or null if it was never inserted. */
  @Nullable
  Node<K> find(K key) {
    checkNotNull(key, "key");
    Node<K> node = root;
    while (node != null) {
      int cmp = comparator.compare(key, node.getKey());
      if (cmp == 0) {
        return node;
      }
      node = cmp < 0 ? node.left : node.right;
    }
    return null;
  }

  /** Returns the number of distinct keys. */
  int size() {
    return size;
  }

  boolean isEmpty() {
    return size == 0;
  }

  /** Returns a lazy iterator over all nodes in strictly increasing key order. */
  Iterator<Node<K>> inOrder() {
    return new AbstractIterator<Node<K>>() {
      private final Deque<Node<K>> path = new ArrayDeque<>();
      @Nullable private Node<K> next = root;

      @Override
      protected Node<K> computeNext() {
        while (next != null) {
          path.push(next);
          next = next.left;
        }
        if (path.isEmpty()) {
          return endOfData();
        }
        Node<K> node = path.pop();
        next = node.right;
        return node;
      }
    };
  }

  @Nullable
  Node<K> getRoot() {
    return root;
  }

  /**
   * Inserts {@code key} into the subtree rooted at {@code node} and returns the subtree's new root.
   * On return, {@code insertion.heightChanged} tells the caller whether the subtree grew taller.
   */
  private Node<K> insert(@Nullable Node<K> node, K key, Insertion<K> insertion) {
    if (node == null) {
      Node<K> created = new Node<>(key, size++);
      insertion.node = created;
      insertion.heightChanged = true;
      return created;
    }

    int cmp = comparator.compare(key, node.getKey());
    if (cmp == 0) {
      insertion.node = node;
      insertion.heightChanged = false;
      return node;
    }

    if (cmp < 0) {
      node.left = insert(node.left, key, insertion);
      if (!insertion.heightChanged) {
        return node;
      }
      switch (node.balance) {
        case 1:
          node.balance = 0;
          insertion.heightChanged = false;
          return node;
        case 0:
          node.balance = -1;
          return node;
        default:
          insertion.heightChanged = false;
          return rebalanceLeftHeavy(node);
      }
    }

    node.right = insert(node.right, key, insertion);
    if (!insertion.heightChanged) {
      return node;
    }
    switch (node.balance) {
      case -1:
        node.balance = 0;
        insertion.heightChanged = false;
        return node;
      case 0:
        node.balance = 1;
        return node;
      default:
        insertion.heightChanged = false;
        return rebalanceRightHeavy(node);
    }
  }

  /** Restores a node whose left subtree became two levels taller than its right one. */
  private static <K> Node<K> rebalanceLeftHeavy(Node<K> node) {
    Node<K> left = node.left;
    if (left.balance == -1) {
      // Single right rotation.
      node.left = left.right;
      left.right = node;
      node.balance = 0;
      left.balance = 0;
      return left;
    }

    // Double rotation: left-right.
    Node<K> pivot = left.right;
    left.right = pivot.left;
    node.left = pivot.right;
    pivot.left = left;
    pivot.right = node;
    left.balance = pivot.balance == 1 ? -1 : 0;
    node.balance = pivot.balance == -1 ? 1 : 0;
    pivot.balance = 0;
    return pivot;
  }

  /** Mirror image of {@link #rebalanceLeftHeavy}. */
  private static <K> Node<K> rebalanceRightHeavy(Node<K> node) {
    Node<K> right = node.right;
    if (right.balance == 1) {
      node.right = right.left;
      right.left = node;
      node.balance = 0;
      right.balance = 0;
      return right;
    }

    Node<K> pivot = right.left;
    right.left = pivot.right;
    node.right = pivot.left;
    pivot.right = right;
    pivot.left = node;
    right.balance = pivot.balance == -1 ? 1 : 0;
    node.balance = pivot.balance == 1 ? -1 : 0;
    pivot.balance = 0;
    return pivot;
  }

  @Override
  public String toString() {
    return "KeyRegistry[" + size + " keys]";
  }
}
