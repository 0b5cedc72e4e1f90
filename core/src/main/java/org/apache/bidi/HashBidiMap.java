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

import com.google.common.base.Preconditions;

/**
 * A mutable bidirectional map backed by two hash indices. All single-association operations
 * run in constant average time, in both directions.
 *
 * <pre>{@code
 * HashBidiMap<String, Integer> ids = new HashBidiMap<>(DuplicationPolicy.STRICT);
 * ids.put("alice", 1);
 * ids.inverse().get(1);   // "alice"
 * ids.put("bob", 1);      // ValueDuplicationException, ids is unchanged
 * }</pre>
 *
 * <p>Iteration order is unspecified. This class is not thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class HashBidiMap<K, V> extends AbstractMutableBidiMap<K, V> {

  private HashBidiMap<V, K> inverse;

  /**
   * Creates an empty map with the {@link DefaultDuplicationPolicyOption default policy}.
   */
  public HashBidiMap() {
    this(DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  public HashBidiMap(DuplicationPolicy policy) {
    super(new DualIndex<>(policy));
  }

  /**
   * Creates a map holding the entries of {@code map}, added with the
   * {@link DefaultDuplicationPolicyOption default policy}.
   */
  public HashBidiMap(Map<? extends K, ? extends V> map) {
    this(map, DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  /**
   * Creates a map holding the entries of {@code map}, added one by one with {@code policy}.
   *
   * @throws DuplicationException if the policy raises on a duplicate found in {@code map}
   */
  public HashBidiMap(Map<? extends K, ? extends V> map, DuplicationPolicy policy) {
    super(new DualIndex<>(policy, Preconditions.checkNotNull(map, "map must not be null").size()));
    putAll(map.entrySet(), policy);
  }

  private HashBidiMap(BidiStore<K, V> store, HashBidiMap<V, K> inverse) {
    super(store);
    this.inverse = inverse;
  }

  /**
   * Creates a map holding the entries of {@code map}, added with the
   * {@link DefaultDuplicationPolicyOption default policy}.
   */
  public static <K, V> HashBidiMap<K, V> create(Map<? extends K, ? extends V> map) {
    return new HashBidiMap<>(map);
  }

  /**
   * Creates a map from a sequence of pairs, added one by one with {@code policy}.
   */
  public static <K, V> HashBidiMap<K, V> create(
      Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, DuplicationPolicy policy) {
    HashBidiMap<K, V> map = new HashBidiMap<>(policy);
    map.putAll(entries, policy);
    return map;
  }

  @Override
  public HashBidiMap<V, K> inverse() {
    HashBidiMap<V, K> result = inverse;
    if (result == null) {
      result = new HashBidiMap<>(store.inverse(), this);
      inverse = result;
    }
    return result;
  }

  @Override
  public HashBidiMap<K, V> copy() {
    return new HashBidiMap<>(store.copy(), null);
  }

  @Override
  public ImmutableBidiMap<K, V> freeze() {
    return new ImmutableBidiMap<>(new FrozenStore<>(store.copy()));
  }
}
