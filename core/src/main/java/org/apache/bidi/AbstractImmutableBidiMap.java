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
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Read-only face over a {@link FrozenStore}. Every {@link Map} mutator throws
 * {@link UnsupportedOperationException} and leaves the map unchanged.
 *
 * <p>The contents never change, so the hash code is computed once, on first use.
 *
 * @param <K> key type
 * @param <V> value type
 */
abstract class AbstractImmutableBidiMap<K, V> extends AbstractBidiMap<K, V> {

  private int hash;
  private boolean hashComputed;

  AbstractImmutableBidiMap(FrozenStore<K, V> store) {
    super(store);
  }

  /**
   * Returns a mutable copy holding the same associations with the same policy.
   */
  public abstract MutableBidiMap<K, V> toMutable();

  @Override
  public int hashCode() {
    if (!hashComputed) {
      hash = super.hashCode();
      hashComputed = true;
    }
    return hash;
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V put(K key, V value) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V remove(Object key) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final boolean remove(Object key, Object value) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final void putAll(Map<? extends K, ? extends V> map) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final void clear() {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V putIfAbsent(K key, V value) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final boolean replace(K key, V oldValue, V newValue) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V replace(K key, V value) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V compute(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    throw FrozenStore.immutable();
  }

  /**
   * Guaranteed to throw an exception and leave the map unmodified.
   *
   * @deprecated Unsupported operation.
   */
  @Deprecated
  @Override
  public final V merge(K key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
    throw FrozenStore.immutable();
  }
}
