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

package org.apache.bidi.util;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import org.apache.bidi.BidiMap;
import org.apache.bidi.OrderedBidiMap;

/**
 * Static helpers for working with bidirectional maps and plain {@link Map}s side by side.
 */
public final class BidiMaps {

  private BidiMaps() {
  }

  /**
   * Returns the associations of {@code map} with keys and values swapped, in the map's
   * iteration order. A {@link BidiMap} answers with its own inverse; any other map is swapped
   * lazily, so duplicate values in a plain map show up as duplicate keys.
   */
  public static <K, V> Iterable<Map.Entry<V, K>> inverted(Map<K, V> map) {
    Preconditions.checkNotNull(map, "map must not be null");
    if (map instanceof BidiMap) {
      return ((BidiMap<K, V>) map).inverse().entrySet();
    }
    return Iterables.transform(map.entrySet(), e -> Maps.immutableEntry(e.getValue(), e.getKey()));
  }

  /**
   * Returns true when both maps hold the same associations in the same iteration order.
   */
  public static boolean equalsInOrder(Map<?, ?> left, Map<?, ?> right) {
    if (left == right) {
      return true;
    }
    if (left == null || right == null || left.size() != right.size()) {
      return false;
    }
    return Iterators.elementsEqual(left.entrySet().iterator(), right.entrySet().iterator());
  }

  /**
   * Equality for ordered bidirectional maps: order-sensitive when {@code other} is an
   * {@link OrderedBidiMap} too, plain {@link Map} content equality otherwise.
   */
  public static boolean orderAwareEquals(OrderedBidiMap<?, ?> self, Object other) {
    if (self == other) {
      return true;
    }
    if (other instanceof OrderedBidiMap) {
      return equalsInOrder(self, (Map<?, ?>) other);
    }
    if (!(other instanceof Map)) {
      return false;
    }
    return self.entrySet().equals(((Map<?, ?>) other).entrySet());
  }
}
