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
import com.google.common.collect.Maps;

/**
 * A store seen from the other direction: its keys are the values of the underlying store and
 * its values are the keys. It owns no storage.
 *
 * <p>The policy of the view is the policy of the underlying store, applied from the view's own
 * perspective. A write {@code (value, key)} through the view is therefore the write
 * {@code (key, value)} on the underlying store with the key and value halves of the policy
 * swapped.
 */
class InverseView<V, K> implements BidiStore<V, K> {

  private final BidiStore<K, V> store;

  InverseView(BidiStore<K, V> store) {
    this.store = store;
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
  public K get(Object value) {
    return store.getKey(value);
  }

  @Override
  public V getKey(Object key) {
    return store.get(key);
  }

  @Override
  public boolean containsKey(Object value) {
    return store.containsValue(value);
  }

  @Override
  public boolean containsValue(Object key) {
    return store.containsKey(key);
  }

  @Override
  public void put(V value, K key, DuplicationPolicy policy) {
    try {
      store.put(key, value, policy.inverse());
    } catch (KeyDuplicationException e) {
      // the underlying key is this view's value
      ValueDuplicationException swapped = new ValueDuplicationException(e.getExistingValue(), e.getExistingKey());
      swapped.initCause(e);
      throw swapped;
    } catch (ValueDuplicationException e) {
      KeyDuplicationException swapped = new KeyDuplicationException(e.getExistingValue(), e.getExistingKey());
      swapped.initCause(e);
      throw swapped;
    }
  }

  @Override
  public K removeKey(Object value) {
    return store.removeValue(value);
  }

  @Override
  public V removeValue(Object key) {
    return store.removeKey(key);
  }

  @Override
  public void clear() {
    store.clear();
  }

  @Override
  public Iterator<Map.Entry<V, K>> iterator() {
    return Iterators.transform(store.iterator(), InverseView::swap);
  }

  @Override
  public BidiStore<K, V> inverse() {
    return store;
  }

  @Override
  public BidiStore<V, K> copy() {
    return store.copy().inverse();
  }

  static <A, B> Map.Entry<B, A> swap(Map.Entry<A, B> entry) {
    return entry == null ? null : Maps.immutableEntry(entry.getValue(), entry.getKey());
  }
}
