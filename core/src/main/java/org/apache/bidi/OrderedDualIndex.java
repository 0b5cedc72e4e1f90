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

import java.util.Iterator;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * A {@link DualIndex} composed with {@link OrderLinks}, keeping the associations in insertion
 * order.
 *
 * <p>Positions follow associations rather than insertion recency:
 * <ul>
 *   <li>a new association is appended at the back;</li>
 *   <li>a new value for an existing key keeps the key's position;</li>
 *   <li>an existing value moved to a new key keeps its position, now held by the new key;</li>
 *   <li>a write colliding with two associations keeps the position of the key's association
 *       and drops the one that held the value.</li>
 * </ul>
 *
 * <p>The order links are only touched after the dual index has committed, so a rejected write
 * leaves the order unchanged too.
 */
final class OrderedDualIndex<K, V> implements OrderedBidiStore<K, V> {

  private final DualIndex<K, V> index;
  private final OrderLinks<K> order;
  private OrderedInverseView<V, K> inverseView;

  OrderedDualIndex(DuplicationPolicy policy) {
    this(policy, 0);
  }

  OrderedDualIndex(DuplicationPolicy policy, int expectedSize) {
    this.index = new DualIndex<>(policy, expectedSize);
    this.order = new OrderLinks<>(expectedSize);
  }

  @Override
  public DuplicationPolicy policy() {
    return index.policy();
  }

  @Override
  public int size() {
    return index.size();
  }

  @Override
  public V get(Object key) {
    return index.get(key);
  }

  @Override
  public K getKey(Object value) {
    return index.getKey(value);
  }

  @Override
  public boolean containsKey(Object key) {
    return index.containsKey(key);
  }

  @Override
  public boolean containsValue(Object value) {
    return index.containsValue(value);
  }

  @Override
  public void put(K key, V value, DuplicationPolicy policy) {
    DualIndex.Write<K, V> write = index.plan(key, value, policy);
    if (write == null) {
      return;
    }
    index.commit(write);
    if (write.isNewAssociation()) {
      order.append(key);
    } else if (write.oldKey != null) {
      if (write.oldValue != null) {
        order.remove(write.oldKey);
      } else {
        order.rename(write.oldKey, key);
      }
    }
  }

  @Override
  public V removeKey(Object key) {
    V value = index.removeKey(key);
    if (value != null) {
      order.remove(key);
    }
    return value;
  }

  @Override
  public K removeValue(Object value) {
    K key = index.removeValue(value);
    if (key != null) {
      order.remove(key);
    }
    return key;
  }

  @Override
  public void clear() {
    index.clear();
    order.clear();
  }

  @Override
  public Map.Entry<K, V> first() {
    return entryOf(order.first());
  }

  @Override
  public Map.Entry<K, V> last() {
    return entryOf(order.last());
  }

  private Map.Entry<K, V> entryOf(K key) {
    return key == null ? null : Maps.immutableEntry(key, index.get(key));
  }

  @Override
  public boolean moveToFront(Object key) {
    return order.moveToFront(key);
  }

  @Override
  public boolean moveToBack(Object key) {
    return order.moveToBack(key);
  }

  @Override
  public Iterator<Map.Entry<K, V>> iterator() {
    final Iterator<K> keys = order.iterator();
    return new Iterator<Map.Entry<K, V>>() {
      private K last;

      @Override
      public boolean hasNext() {
        return keys.hasNext();
      }

      @Override
      public Map.Entry<K, V> next() {
        last = keys.next();
        return Maps.immutableEntry(last, index.get(last));
      }

      @Override
      public void remove() {
        Preconditions.checkState(last != null, "no calls to next() since the last call to remove()");
        keys.remove();
        index.removeKey(last);
        last = null;
      }
    };
  }

  @Override
  public OrderedBidiStore<V, K> inverse() {
    OrderedInverseView<V, K> result = inverseView;
    if (result == null) {
      result = new OrderedInverseView<>(this);
      inverseView = result;
    }
    return result;
  }

  @Override
  public OrderedDualIndex<K, V> copy() {
    OrderedDualIndex<K, V> copy = new OrderedDualIndex<>(index.policy(), index.size());
    for (K key : order) {
      copy.put(key, index.get(key), DuplicationPolicy.RAISE);
    }
    return copy;
  }
}
