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
import java.util.Set;

/**
 * A map that keeps a one-to-one relation between its keys and values, and that can be read in
 * both directions in constant time.
 *
 * <p>This is the read capability shared by every variant. Mutable variants add
 * {@link MutableBidiMap}, insertion-ordered variants add {@link OrderedBidiMap}. Immutable
 * variants implement this interface only and reject the mutators inherited from {@link Map}
 * with {@link UnsupportedOperationException}.
 *
 * <p>Keys and values must not be {@code null}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface BidiMap<K, V> extends Map<K, V> {

  /**
   * Returns the key associated with the given value, or {@code null} if there is none.
   */
  K getKey(Object value);

  /**
   * Returns the value associated with the given key.
   *
   * @throws AssociationNotFoundException if the key is absent
   */
  V getOrThrow(K key);

  /**
   * Returns the key associated with the given value.
   *
   * @throws AssociationNotFoundException if the value is absent
   */
  K getKeyOrThrow(V value);

  /**
   * Returns the values of this map. Since values are unique this is a {@link Set}.
   */
  @Override
  Set<V> values();

  /**
   * Returns the inverse view of this map, backed by the same storage. The inverse of the
   * inverse is this map.
   */
  BidiMap<V, K> inverse();

  /**
   * Returns the policy this map applies on writes.
   */
  DuplicationPolicy duplicationPolicy();
}
