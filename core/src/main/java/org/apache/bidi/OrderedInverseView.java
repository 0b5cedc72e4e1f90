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
 * {@link InverseView} of an ordered store. The view shares the order of the underlying store.
 */
final class OrderedInverseView<V, K> extends InverseView<V, K> implements OrderedBidiStore<V, K> {

  private final OrderedBidiStore<K, V> store;

  OrderedInverseView(OrderedBidiStore<K, V> store) {
    super(store);
    this.store = store;
  }

  @Override
  public Map.Entry<V, K> first() {
    return swap(store.first());
  }

  @Override
  public Map.Entry<V, K> last() {
    return swap(store.last());
  }

  @Override
  public boolean moveToFront(Object value) {
    K key = store.getKey(value);
    return key != null && store.moveToFront(key);
  }

  @Override
  public boolean moveToBack(Object value) {
    K key = store.getKey(value);
    return key != null && store.moveToBack(key);
  }

  @Override
  public OrderedBidiStore<K, V> inverse() {
    return store;
  }

  @Override
  public OrderedBidiStore<V, K> copy() {
    return store.copy().inverse();
  }
}
