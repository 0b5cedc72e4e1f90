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
 * A {@link BidiStore} that also keeps the insertion order of its associations.
 */
interface OrderedBidiStore<K, V> extends BidiStore<K, V> {

  Map.Entry<K, V> first();

  Map.Entry<K, V> last();

  /**
   * Moves the association of {@code key} to the front, returning false if the key is absent.
   */
  boolean moveToFront(Object key);

  /**
   * Moves the association of {@code key} to the back, returning false if the key is absent.
   */
  boolean moveToBack(Object key);

  @Override
  OrderedBidiStore<V, K> inverse();

  @Override
  OrderedBidiStore<K, V> copy();
}
