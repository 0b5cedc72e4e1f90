/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.bidi;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * Traversal order of the keys of an ordered store: a circular doubly linked list of nodes,
 * plus an index from key to node so that any node can be found, unlinked, relinked or renamed
 * in constant time.
 */
final class OrderLinks<K> implements Iterable<K> {

  private final Map<K, Node<K>> nodes;

  /*
   * Sentinel of the circular list: head.next is the first node and head.prev the last.
   */
  private final Node<K> head = new Node<>(null);

  private int modCount;

  OrderLinks(int expectedSize) {
    this.nodes = Maps.newHashMapWithExpectedSize(expectedSize);
    head.prev = head;
    head.next = head;
  }

  /**
   * Position of one key in the traversal order.
   */
  static final class Node<K> {
    K key;
    Node<K> prev;
    Node<K> next;

    Node(K key) {
      this.key = key;
    }
  }

  int size() {
    return nodes.size();
  }

  boolean contains(Object key) {
    return nodes.containsKey(key);
  }

  void append(K key) {
    Node<K> node = new Node<>(key);
    Node<K> previous = nodes.put(key, node);
    Preconditions.checkState(previous == null, "key %s is already linked", key);
    linkBefore(node, head);
  }

  boolean remove(Object key) {
    Node<K> node = nodes.remove(key);
    if (node == null) {
      return false;
    }
    unlink(node);
    return true;
  }

  /**
   * Gives the position of {@code oldKey} to {@code newKey}.
   */
  void rename(K oldKey, K newKey) {
    Node<K> node = nodes.remove(oldKey);
    Preconditions.checkState(node != null, "key %s is not linked", oldKey);
    node.key = newKey;
    nodes.put(newKey, node);
    modCount++;
  }

  boolean moveToFront(Object key) {
    Node<K> node = nodes.get(key);
    if (node == null) {
      return false;
    }
    if (head.next != node) {
      unlink(node);
      linkBefore(node, head.next);
    }
    return true;
  }

  boolean moveToBack(Object key) {
    Node<K> node = nodes.get(key);
    if (node == null) {
      return false;
    }
    if (head.prev != node) {
      unlink(node);
      linkBefore(node, head);
    }
    return true;
  }

  K first() {
    return head.next == head ? null : head.next.key;
  }

  K last() {
    return head.prev == head ? null : head.prev.key;
  }

  void clear() {
    nodes.clear();
    head.prev = head;
    head.next = head;
    modCount++;
  }

  private void linkBefore(Node<K> node, Node<K> successor) {
    node.next = successor;
    node.prev = successor.prev;
    successor.prev.next = node;
    successor.prev = node;
    modCount++;
  }

  private void unlink(Node<K> node) {
    node.prev.next = node.next;
    node.next.prev = node.prev;
    node.prev = null;
    node.next = null;
    modCount++;
  }

  /**
   * Iterates the keys front to back. The iterator is fail-fast; its {@link Iterator#remove()}
   * only unlinks the key from this order.
   */
  @Override
  public Iterator<K> iterator() {
    return new Iterator<K>() {
      private Node<K> next = head.next;
      private Node<K> current;
      private int expectedModCount = modCount;

      @Override
      public boolean hasNext() {
        return next != head;
      }

      @Override
      public K next() {
        checkForComodification();
        if (next == head) {
          throw new NoSuchElementException();
        }
        current = next;
        next = next.next;
        return current.key;
      }

      @Override
      public void remove() {
        Preconditions.checkState(current != null, "no calls to next() since the last call to remove()");
        checkForComodification();
        OrderLinks.this.remove(current.key);
        current = null;
        expectedModCount = modCount;
      }

      private void checkForComodification() {
        if (modCount != expectedModCount) {
          throw new ConcurrentModificationException();
        }
      }
    };
  }
}
