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

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

/**
 * Read side shared by all bidirectional maps: a {@link Map} face over a {@link BidiStore}.
 *
 * <p>The {@link #keySet()}, {@link #values()} and {@link #entrySet()} views are live and route
 * removals to the store, so removing through a view keeps both directions consistent. Over a
 * frozen store those removals throw.
 *
 * @param <K> key type
 * @param <V> value type
 */
abstract class AbstractBidiMap<K, V> extends AbstractMap<K, V> implements BidiMap<K, V> {

  final BidiStore<K, V> store;

  private Set<K> keySet;
  private Set<V> values;
  private Set<Map.Entry<K, V>> entrySet;

  AbstractBidiMap(BidiStore<K, V> store) {
    this.store = store;
  }

  @Override
  public DuplicationPolicy duplicationPolicy() {
    return store.policy();
  }

  @Override
  public int size() {
    return store.size();
  }

  @Override
  public boolean isEmpty() {
    return store.size() == 0;
  }

  @Override
  public boolean containsKey(Object key) {
    return key != null && store.containsKey(key);
  }

  /**
   * Constant time, through the inverse index.
   */
  @Override
  public boolean containsValue(Object value) {
    return value != null && store.containsValue(value);
  }

  @Override
  public V get(Object key) {
    return key == null ? null : store.get(key);
  }

  @Override
  public K getKey(Object value) {
    return value == null ? null : store.getKey(value);
  }

  @Override
  public V getOrThrow(K key) {
    Preconditions.checkNotNull(key, "key must not be null");
    V value = store.get(key);
    if (value == null) {
      throw AssociationNotFoundException.forKey(key);
    }
    return value;
  }

  @Override
  public K getKeyOrThrow(V value) {
    Preconditions.checkNotNull(value, "value must not be null");
    K key = store.getKey(value);
    if (key == null) {
      throw AssociationNotFoundException.forValue(value);
    }
    return key;
  }

  @Override
  public Set<K> keySet() {
    Set<K> result = keySet;
    if (result == null) {
      result = new KeySet();
      keySet = result;
    }
    return result;
  }

  @Override
  public Set<V> values() {
    Set<V> result = values;
    if (result == null) {
      result = new ValueSet();
      values = result;
    }
    return result;
  }

  @Override
  public Set<Map.Entry<K, V>> entrySet() {
    Set<Map.Entry<K, V>> result = entrySet;
    if (result == null) {
      result = new EntrySet();
      entrySet = result;
    }
    return result;
  }

  private final class KeySet extends AbstractSet<K> {
    @Override
    public Iterator<K> iterator() {
      return Iterators.transform(store.iterator(), Map.Entry::getKey);
    }

    @Override
    public int size() {
      return store.size();
    }

    @Override
    public boolean contains(Object o) {
      return containsKey(o);
    }

    @Override
    public boolean remove(Object o) {
      return o != null && store.removeKey(o) != null;
    }

    @Override
    public void clear() {
      store.clear();
    }
  }

  private final class ValueSet extends AbstractSet<V> {
    @Override
    public Iterator<V> iterator() {
      return Iterators.transform(store.iterator(), Map.Entry::getValue);
    }

    @Override
    public int size() {
      return store.size();
    }

    @Override
    public boolean contains(Object o) {
      return containsValue(o);
    }

    @Override
    public boolean remove(Object o) {
      return o != null && store.removeValue(o) != null;
    }

    @Override
    public void clear() {
      store.clear();
    }
  }

  private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
      return store.iterator();
    }

    @Override
    public int size() {
      return store.size();
    }

    @Override
    public boolean contains(Object o) {
      if (!(o instanceof Map.Entry)) {
        return false;
      }
      Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;
      Object key = entry.getKey();
      if (key == null) {
        return false;
      }
      V value = store.get(key);
      return value != null && value.equals(entry.getValue());
    }

    @Override
    public boolean remove(Object o) {
      if (!contains(o)) {
        return false;
      }
      store.removeKey(((Map.Entry<?, ?>) o).getKey());
      return true;
    }

    @Override
    public void clear() {
      store.clear();
    }
  }
}
