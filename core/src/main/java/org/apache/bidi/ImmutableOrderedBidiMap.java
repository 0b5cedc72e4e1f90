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

import org.apache.bidi.util.BidiMaps;

/**
 * An {@link ImmutableBidiMap} that remembers insertion order. Equality against another
 * {@link OrderedBidiMap} is order-sensitive; the hash code is not, so it stays consistent with
 * plain {@link Map} equality.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ImmutableOrderedBidiMap<K, V> extends AbstractImmutableBidiMap<K, V>
    implements OrderedBidiMap<K, V> {

  private final FrozenOrderedStore<K, V> frozen;
  private ImmutableOrderedBidiMap<V, K> inverse;

  ImmutableOrderedBidiMap(FrozenOrderedStore<K, V> store) {
    super(store);
    this.frozen = store;
  }

  private ImmutableOrderedBidiMap(FrozenOrderedStore<K, V> store, ImmutableOrderedBidiMap<V, K> inverse) {
    this(store);
    this.inverse = inverse;
  }

  public static <K, V> ImmutableOrderedBidiMap<K, V> of() {
    return new Builder<K, V>().build();
  }

  public static <K, V> ImmutableOrderedBidiMap<K, V> of(K k1, V v1) {
    return new Builder<K, V>().put(k1, v1).build();
  }

  public static <K, V> ImmutableOrderedBidiMap<K, V> of(K k1, V v1, K k2, V v2) {
    return new Builder<K, V>().put(k1, v1).put(k2, v2).build();
  }

  public static <K, V> ImmutableOrderedBidiMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
    return new Builder<K, V>().put(k1, v1).put(k2, v2).put(k3, v3).build();
  }

  public static <K, V> ImmutableOrderedBidiMap<K, V> copyOf(Map<? extends K, ? extends V> map) {
    return copyOf(map, DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
  }

  /**
   * Copies {@code map} in its iteration order. An {@code ImmutableOrderedBidiMap} with the same
   * policy is returned as is.
   *
   * @throws DuplicationException if {@code policy} raises on a duplicate found in {@code map}
   */
  @SuppressWarnings("unchecked")
  public static <K, V> ImmutableOrderedBidiMap<K, V> copyOf(
      Map<? extends K, ? extends V> map, DuplicationPolicy policy) {
    Preconditions.checkNotNull(map, "map must not be null");
    if (map instanceof ImmutableOrderedBidiMap
        && ((ImmutableOrderedBidiMap<?, ?>) map).duplicationPolicy().equals(policy)) {
      return (ImmutableOrderedBidiMap<K, V>) map;
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
  public Map.Entry<K, V> firstEntry() {
    return frozen.first();
  }

  @Override
  public Map.Entry<K, V> lastEntry() {
    return frozen.last();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public Map.Entry<K, V> popFirst() {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public Map.Entry<K, V> popLast() {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public void moveToFront(K key) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public void moveToBack(K key) {
    throw FrozenStore.immutable();
  }

  @Override
  public ImmutableOrderedBidiMap<V, K> inverse() {
    ImmutableOrderedBidiMap<V, K> result = inverse;
    if (result == null) {
      result = new ImmutableOrderedBidiMap<>(frozen.inverse(), this);
      inverse = result;
    }
    return result;
  }

  @Override
  public LinkedHashBidiMap<K, V> toMutable() {
    return new LinkedHashBidiMap<>(this, duplicationPolicy());
  }

  @Override
  public boolean equals(Object o) {
    return BidiMaps.orderAwareEquals(this, o);
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }

  /**
   * Accumulates associations, in order, for an {@link ImmutableOrderedBidiMap}. Each
   * {@code put} applies the builder's policy immediately. {@link #build()} may be called more
   * than once.
   */
  public static final class Builder<K, V> {

    private final OrderedDualIndex<K, V> index;

    Builder() {
      this(DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy());
    }

    Builder(DuplicationPolicy policy) {
      this.index = new OrderedDualIndex<>(Preconditions.checkNotNull(policy, "policy must not be null"));
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

    public ImmutableOrderedBidiMap<K, V> build() {
      return new ImmutableOrderedBidiMap<>(new FrozenOrderedStore<>(index.copy()));
    }
  }
}
