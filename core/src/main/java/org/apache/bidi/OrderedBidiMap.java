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
 * A {@link BidiMap} that remembers the order in which associations were inserted.
 *
 * <p>Updating the value of an existing key keeps its position. Moving an existing value to a
 * new key keeps the position as well, now attributed to the new key. Iteration over the map
 * and over its inverse follows the same order.
 *
 * <p>Two ordered maps are equal only if they hold the same associations in the same order. An
 * ordered map and any other {@link Map} are equal if they hold the same associations.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface OrderedBidiMap<K, V> extends BidiMap<K, V> {

  /**
   * Returns the first association, or {@code null} if the map is empty.
   */
  Map.Entry<K, V> firstEntry();

  /**
   * Returns the last association, or {@code null} if the map is empty.
   */
  Map.Entry<K, V> lastEntry();

  /**
   * Removes and returns the first association.
   *
   * @throws java.util.NoSuchElementException if the map is empty
   */
  Map.Entry<K, V> popFirst();

  /**
   * Removes and returns the last association.
   *
   * @throws java.util.NoSuchElementException if the map is empty
   */
  Map.Entry<K, V> popLast();

  /**
   * Moves the association of {@code key} to the front of the order.
   *
   * @throws AssociationNotFoundException if the key is absent
   */
  void moveToFront(K key);

  /**
   * Moves the association of {@code key} to the back of the order.
   *
   * @throws AssociationNotFoundException if the key is absent
   */
  void moveToBack(K key);

  @Override
  OrderedBidiMap<V, K> inverse();
}
