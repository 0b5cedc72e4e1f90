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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * Write side shared by the mutable bidirectional maps. Every write funnels into
 * {@link #put(Object, Object, DuplicationPolicy)} and from there into the store, which checks
 * the policy against both indices before mutating either.
 *
 * @param <K> key type
 * @param <V> value type
 */
abstract class AbstractMutableBidiMap<K, V> extends AbstractBidiMap<K, V> implements MutableBidiMap<K, V> {

  AbstractMutableBidiMap(BidiStore<K, V> store) {
    super(store);
  }

  @Override
  public V put(K key, V value) {
    return put(key, value, store.policy());
  }

  @Override
  public V put(K key, V value, DuplicationPolicy policy) {
    Preconditions.checkNotNull(key, "key must not be null");
    Preconditions.checkNotNull(value, "value must not be null");
    Preconditions.checkNotNull(policy, "policy must not be null");
    V previous = store.get(key);
    store.put(key, value, policy);
    return previous;
  }

  @Override
  public V putUnique(K key, V value) {
    return put(key, value, DuplicationPolicy.RAISE);
  }

  @Override
  public V forcePut(K key, V value) {
    return put(key, value, DuplicationPolicy.OVERWRITE);
  }

  @Override
  public void putAll(Map<? extends K, ? extends V> map) {
    putAll(map.entrySet(), store.policy());
  }

  @Override
  public void putAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, DuplicationPolicy policy) {
    Preconditions.checkNotNull(entries, "entries must not be null");
    for (Map.Entry<? extends K, ? extends V> entry : entries) {
      put(entry.getKey(), entry.getValue(), policy);
    }
  }

  @Override
  public void forcePutAll(Map<? extends K, ? extends V> map) {
    putAll(map.entrySet(), DuplicationPolicy.OVERWRITE);
  }

  @Override
  public V remove(Object key) {
    return key == null ? null : store.removeKey(key);
  }

  @Override
  public V delete(K key) {
    Preconditions.checkNotNull(key, "key must not be null");
    V value = store.removeKey(key);
    if (value == null) {
      throw AssociationNotFoundException.forKey(key);
    }
    return value;
  }

  @Override
  public K removeValue(Object value) {
    return value == null ? null : store.removeValue(value);
  }

  @Override
  public void clear() {
    store.clear();
  }

  /**
   * Computes every replacement first, then writes them in iteration order with this map's
   * policy, one entry at a time.
   */
  @Override
  public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
    Preconditions.checkNotNull(function, "function must not be null");
    List<Map.Entry<K, V>> replacements = new ArrayList<>(size());
    for (Map.Entry<K, V> entry : entrySet()) {
      replacements.add(Maps.immutableEntry(entry.getKey(), function.apply(entry.getKey(), entry.getValue())));
    }
    putAll(replacements, store.policy());
  }
}
