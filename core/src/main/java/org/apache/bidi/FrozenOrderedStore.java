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
 * {@link FrozenStore} over an ordered store. Reordering is a mutation and is rejected.
 */
final class FrozenOrderedStore<K, V> extends FrozenStore<K, V> implements OrderedBidiStore<K, V> {

  private final OrderedBidiStore<K, V> store;
  private FrozenOrderedStore<V, K> inverse;

  FrozenOrderedStore(OrderedBidiStore<K, V> store) {
    super(store);
    this.store = store;
  }

  private FrozenOrderedStore(OrderedBidiStore<K, V> store, FrozenOrderedStore<V, K> inverse) {
    super(store, inverse);
    this.store = store;
    this.inverse = inverse;
  }

  @Override
  public Map.Entry<K, V> first() {
    return store.first();
  }

  @Override
  public Map.Entry<K, V> last() {
    return store.last();
  }

  @Override
  public boolean moveToFront(Object key) {
    throw immutable();
  }

  @Override
  public boolean moveToBack(Object key) {
    throw immutable();
  }

  @Override
  public FrozenOrderedStore<V, K> inverse() {
    FrozenOrderedStore<V, K> result = inverse;
    if (result == null) {
      result = new FrozenOrderedStore<>(store.inverse(), this);
      inverse = result;
    }
    return result;
  }

  @Override
  public OrderedBidiStore<K, V> copy() {
    return store.copy();
  }
}
