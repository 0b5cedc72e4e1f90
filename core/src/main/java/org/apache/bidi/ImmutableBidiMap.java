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
 * A bidirectional map whose contents never change. Safe to use as a {@link Map} key or set
 * element: its hash code follows the {@link Map#hashCode()} contract and is computed once.
 *
 * <p>Instances come from the static factories, from a {@link Builder}, or from
 * {@link MutableBidiMap#freeze()}. Construction input goes through the same duplication policy
 * as {@link MutableBidiMap#put(Object, Object, DuplicationPolicy)}; the factories without a
 * policy argument use the {@link DefaultDuplicationPolicyOption default policy}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ImmutableBidiMap<K, V> extends AbstractImmutableBidiMap<K, V> {

  private final FrozenStore<K, V> frozen;
  private ImmutableBidiMap<V, K> inverse;

  ImmutableBidiMap(FrozenStore<K, V> store) {
    super(store);
    this.frozen = store;
  }

  private ImmutableBidiMap(FrozenStore<K, V> store, ImmutableBidiMap<V, K> inverse) {
    this(store);
    this.inverse = inverse;
  }

  public static <K, V> ImmutableBidiMap<K, V> of() {
    return new Builder<K, V>().build();
  }

  public static <K, V> ImmutableBidiMap<K, V> of(K k1, V v1) {
    return new Builder<K, V>().put(k1, v1).build();
  }

  public static <K, V> ImmutableBidiMap<K, V> of(K k1, V v1, K k2, V v2) {
    return new Builder<K, V>().put(k1, v1).put(k2, v2).build();
  }

  public static <K, V> ImmutableBidiMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
    return new Builder<K, V>().put(k1, v1).put(k2, v2).put(k3, v3).build();
  }

  public static <K, V> ImmutableBidiMap<K, V> copyOf(Map<? extends K, ? extends V> map) {
    return copyOf(map, DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  /**
   * Copies {@code map}. An {@code ImmutableBidiMap} is returned as is.
   *
   * @throws DuplicationException if {@code policy} raises on a duplicate found in {@code map}
   */
  @SuppressWarnings("unchecked")
  public static <K, V> ImmutableBidiMap<K, V> copyOf(Map<? extends K, ? extends V> map, DuplicationPolicy policy) {
    Preconditions.checkNotNull(map, "map must not be null");
    if (map instanceof ImmutableBidiMap && ((ImmutableBidiMap<?, ?>) map).duplicationPolicy().equals(policy)) {
      return (ImmutableBidiMap<K, V>) map;
    }
    return new Builder<K, V>(policy).putAll(map).build();
  }

  public static <K, V> Builder<K, V> builder() {
    return new Builder<>();
  }

  public static <K, V> Builder<K, V> builder(DuplicationPolicy policy) {
    return new Builder<>(policy);
  }

  @Override
  public ImmutableBidiMap<V, K> inverse() {
    ImmutableBidiMap<V, K> result = inverse;
    if (result == null) {
      result = new ImmutableBidiMap<>(frozen.inverse(), this);
      inverse = result;
    }
    return result;
  }

  @Override
  public HashBidiMap<K, V> toMutable() {
    return new HashBidiMap<>(this, duplicationPolicy());
  }

  /**
   * Accumulates associations for an {@link ImmutableBidiMap}. Each {@code put} applies the
   * builder's policy immediately, so a raising policy fails at the offending call.
   * {@link #build()} may be called more than once.
   */
  public static final class Builder<K, V> {

    private final DualIndex<K, V> index;

    Builder() {
      this(DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
    }

    Builder(DuplicationPolicy policy) {
      this.index = new DualIndex<>(Preconditions.checkNotNull(policy, "policy must not be null"));
    }

    public Builder<K, V> put(K key, V value) {
      Preconditions.checkNotNull(key, "key must not be null");
      Preconditions.checkNotNull(value, "value must not be null");
      index.put(key, value, index.policy());
      return this;
    }

    public Builder<K, V> put(Map.Entry<? extends K, ? extends V> entry) {
      return put(entry.getKey(), entry.getValue());
    }

    public Builder<K, V> putAll(Map<? extends K, ? extends V> map) {
      for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
        put(entry);
      }
      return this;
    }

    public ImmutableBidiMap<K, V> build() {
      return new ImmutableBidiMap<>(new FrozenStore<>(index.copy()));
    }
  }
}
