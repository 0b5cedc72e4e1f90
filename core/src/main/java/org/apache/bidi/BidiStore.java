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

import java.util.Iterator;
import java.util.Map;

/**
 * Storage behind a bidirectional map: the two indices and the algorithms that keep them
 * consistent. Public maps are thin faces over a store; an inverse map is the same kind of face
 * over an {@link InverseView} of the store.
 *
 * <p>Arguments are never {@code null}; the faces check them.
 */
interface BidiStore<K, V> {

  DuplicationPolicy policy();

  int size();

  V get(Object key);

  K getKey(Object value);

  boolean containsKey(Object key);

  boolean containsValue(Object value);

  /**
   * Writes {@code (key, value)} under the given policy, or throws without touching the store.
   */
  void put(K key, V value, DuplicationPolicy policy);

  /**
   * Removes the association of {@code key}, returning its value or {@code null}.
   */
  V removeKey(Object key);

  /**
   * Removes the association of {@code value}, returning its key or {@code null}.
   */
  K removeValue(Object value);

  void clear();

  /**
   * Iterates the associations in storage order. {@link Iterator#remove()} removes the last
   * returned association from both indices.
   */
  Iterator<Map.Entry<K, V>> iterator();

  BidiStore<V, K> inverse();

  /**
   * Returns an independent store of the same kind with the same policy and content.
   */
  BidiStore<K, V> copy();
}
