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

/**
 * A {@link BidiMap} that can be modified.
 *
 * <p>Every write is checked against a {@link DuplicationPolicy} before either index is touched,
 * so a write either commits to both directions or throws and leaves the map unchanged.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface MutableBidiMap<K, V> extends BidiMap<K, V> {

  /**
   * Associates {@code key} with {@code value} under this map's {@link #duplicationPolicy()}.
   *
   * @return the value previously associated with {@code key}, or {@code null}
   * @throws KeyDuplicationException if the key is present and the policy raises on keys
   * @throws ValueDuplicationException if the value belongs to another key and the policy raises
   *     on values
   */
  @Override
  V put(K key, V value);

  /**
   * Associates {@code key} with {@code value} under the given policy, for this write only.
   *
   * @return the value previously associated with {@code key}, or {@code null}
   */
  V put(K key, V value, DuplicationPolicy policy);

  /**
   * Inserts a new association, failing if either the key or the value is already present.
   */
  V putUnique(K key, V value);

  /**
   * Associates {@code key} with {@code value}, evicting any association that holds either.
   */
  V forcePut(K key, V value);

  /**
   * Applies each entry in turn with this map's policy. Each entry is applied atomically, the
   * batch is not: if an entry fails, the entries before it stay applied.
   */
  @Override
  void putAll(Map<? extends K, ? extends V> map);

  /**
   * Applies each entry in turn with the given policy, with the same per-entry atomicity as
   * {@link #putAll(Map)}.
   */
  void putAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, DuplicationPolicy policy);

  /**
   * Applies each entry in turn with {@link DuplicationPolicy#OVERWRITE}.
   */
  void forcePutAll(Map<? extends K, ? extends V> map);

  /**
   * Removes the association of {@code key}.
   *
   * @return the value that was associated with {@code key}
   * @throws AssociationNotFoundException if the key is absent
   */
  V delete(K key);

  /**
   * Removes the association of {@code value}.
   *
   * @return the key that was associated with {@code value}, or {@code null}
   */
  K removeValue(Object value);

  @Override
  MutableBidiMap<V, K> inverse();

  /**
   * Returns a new map of the same kind with the same policy and content.
   */
  MutableBidiMap<K, V> copy();

  /**
   * Returns an immutable copy of this map.
   */
  BidiMap<K, V> freeze();
}
