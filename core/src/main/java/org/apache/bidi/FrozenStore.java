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

import com.google.common.collect.Iterators;

/**
 * Wraps a fully built store and removes its write capability: every mutation throws
 * {@link UnsupportedOperationException} before reaching the wrapped store.
 *
 * <p>The wrapped store must not be reachable from anywhere else.
 */
class FrozenStore<K, V> implements BidiStore<K, V> {

  private final BidiStore<K, V> store;
  private FrozenStore<V, K> inverse;

  FrozenStore(BidiStore<K, V> store) {
    this.store = store;
  }

  FrozenStore(BidiStore<K, V> store, FrozenStore<V, K> inverse) {
    this.store = store;
    this.inverse = inverse;
  }

  static UnsupportedOperationException immutable() {
    return new UnsupportedOperationException("immutable bidirectional map cannot be modified");
  }

  @Override
  public DuplicationPolicy policy() {
    return store.policy();
  }

  @Override
  public int size() {
    return store.size();
  }

  @Override
  public V get(Object key) {
    return store.get(key);
  }

  @Override
  public K getKey(Object value) {
    return store.getKey(value);
  }

  @Override
  public boolean containsKey(Object key) {
    return store.containsKey(key);
  }

  @Override
  public boolean containsValue(Object value) {
    return store.containsValue(value);
  }

  @Override
  public void put(K key, V value, DuplicationPolicy policy) {
    throw immutable();
  }

  @Override
  public V removeKey(Object key) {
    throw immutable();
  }

  @Override
  public K removeValue(Object value) {
    throw immutable();
  }

  @Override
  public void clear() {
    throw immutable();
  }

  @Override
  public Iterator<Map.Entry<K, V>> iterator() {
    return Iterators.unmodifiableIterator(store.iterator());
  }

  @Override
  public FrozenStore<V, K> inverse() {
    FrozenStore<V, K> result = inverse;
    if (result == null) {
      result = new FrozenStore<>(store.inverse(), this);
      inverse = result;
    }
    return result;
  }

  /**
   * Returns a mutable copy of the wrapped store.
   */
  @Override
  public BidiStore<K, V> copy() {
    return store.copy();
  }
}
