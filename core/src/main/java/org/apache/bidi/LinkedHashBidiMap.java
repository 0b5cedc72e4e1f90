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

import java.util.Map;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

import org.apache.bidi.util.BidiMaps;

/**
 * A mutable bidirectional map that keeps its associations in insertion order, with the
 * ordering rules of {@link OrderedBidiMap}. All single-association operations, including
 * {@link #popFirst()}, {@link #popLast()}, {@link #moveToFront(Object)} and
 * {@link #moveToBack(Object)}, run in constant average time.
 *
 * <pre>{@code
 * LinkedHashBidiMap<String, Integer> m = new LinkedHashBidiMap<>(DuplicationPolicy.STRICT);
 * m.put("a", 1);
 * m.put("b", 2);
 * m.inverse().put(1, "c");   // m is now {c=1, b=2}
 * }</pre>
 *
 * <p>This class is not thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LinkedHashBidiMap<K, V> extends AbstractMutableBidiMap<K, V> implements OrderedBidiMap<K, V> {

  private final OrderedBidiStore<K, V> orderedStore;
  private LinkedHashBidiMap<V, K> inverse;

  /**
   * Creates an empty map with the {@link DefaultDuplicationPolicyOption default policy}.
   */
  public LinkedHashBidiMap() {
    this(DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  public LinkedHashBidiMap(DuplicationPolicy policy) {
    this(new OrderedDualIndex<>(policy), null);
  }

  /**
   * Creates a map holding the entries of {@code map} in its iteration order, added with the
   * {@link DefaultDuplicationPolicyOption default policy}.
   */
  public LinkedHashBidiMap(Map<? extends K, ? extends V> map) {
    this(map, DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  /**
   * Creates a map holding the entries of {@code map} in its iteration order, added one by one
   * with {@code policy}.
   *
   * @throws DuplicationException if the policy raises on a duplicate found in {@code map}
   */
  public LinkedHashBidiMap(Map<? extends K, ? extends V> map, DuplicationPolicy policy) {
    this(new OrderedDualIndex<>(policy, Preconditions.checkNotNull(map, "map must not be null").size()), null);
    putAll(map.entrySet(), policy);
  }

  private LinkedHashBidiMap(OrderedBidiStore<K, V> store, LinkedHashBidiMap<V, K> inverse) {
    super(store);
    this.orderedStore = store;
    this.inverse = inverse;
  }

  /**
   * Creates a map holding the entries of {@code map}, added with the
   * {@link DefaultDuplicationPolicyOption default policy}.
   */
  public static <K, V> LinkedHashBidiMap<K, V> create(Map<? extends K, ? extends V> map) {
    return new LinkedHashBidiMap<>(map);
  }

  /**
   * Creates a map from a sequence of pairs, added in order with {@code policy}.
   */
  public static <K, V> LinkedHashBidiMap<K, V> create(
      Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, DuplicationPolicy policy) {
    LinkedHashBidiMap<K, V> map = new LinkedHashBidiMap<>(policy);
    map.putAll(entries, policy);
    return map;
  }

  @Override
  public Map.Entry<K, V> firstEntry() {
    return orderedStore.first();
  }

  @Override
  public Map.Entry<K, V> lastEntry() {
    return orderedStore.last();
  }

  @Override
  public Map.Entry<K, V> popFirst() {
    return pop(orderedStore.first());
  }

  @Override
  public Map.Entry<K, V> popLast() {
    return pop(orderedStore.last());
  }

  private Map.Entry<K, V> pop(Map.Entry<K, V> entry) {
    if (entry == null) {
      throw new NoSuchElementException("map is empty");
    }
    orderedStore.removeKey(entry.getKey());
    return entry;
  }

  @Override
  public void moveToFront(K key) {
    Preconditions.checkNotNull(key, "key must not be null");
    if (!orderedStore.moveToFront(key)) {
      throw AssociationNotFoundException.forKey(key);
    }
  }

  @Override
  public void moveToBack(K key) {
    Preconditions.checkNotNull(key, "key must not be null");
    if (!orderedStore.moveToBack(key)) {
      throw AssociationNotFoundException.forKey(key);
    }
  }

  @Override
  public LinkedHashBidiMap<V, K> inverse() {
    LinkedHashBidiMap<V, K> result = inverse;
    if (result == null) {
      result = new LinkedHashBidiMap<>(orderedStore.inverse(), this);
      inverse = result;
    }
    return result;
  }

  @Override
  public LinkedHashBidiMap<K, V> copy() {
    return new LinkedHashBidiMap<>(orderedStore.copy(), null);
  }

  @Override
  public ImmutableOrderedBidiMap<K, V> freeze() {
    return new ImmutableOrderedBidiMap<>(new FrozenOrderedStore<>(orderedStore.copy()));
  }

  /**
   * Order-sensitive against another {@link OrderedBidiMap}, content-only against any other
   * {@link Map}.
   */
  @Override
  public boolean equals(Object o) {
    return BidiMaps.orderAwareEquals(this, o);
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }
}
