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

package org.apache.bidi.named;

import org.apache.bidi.MutableBidiMap;

/**
 * A mutable bidirectional map with named directions. Created by {@link NamedBidiMapBuilder}.
 *
 * @param <K> forward key type
 * @param <V> forward value type
 */
public final class NamedBidiMap<K, V> {

  private final String typeName;
  private final String forwardName;
  private final String inverseName;
  private final MutableBidiMap<K, V> map;

  NamedBidiMap(String typeName, String forwardName, String inverseName, MutableBidiMap<K, V> map) {
    this.typeName = typeName;
    this.forwardName = forwardName;
    this.inverseName = inverseName;
    this.map = map;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getForwardName() {
    return forwardName;
  }

  public String getInverseName() {
    return inverseName;
  }

  public MutableBidiMap<K, V> forward() {
    return map;
  }

  public MutableBidiMap<V, K> inverse() {
    return map.inverse();
  }

  /**
   * Returns the direction called {@code name}: the forward map for the forward name, the
   * inverse map for the inverse name.
   *
   * @throws IllegalArgumentException if {@code name} is neither
   */
  public MutableBidiMap<?, ?> view(String name) {
    if (forwardName.equals(name)) {
      return forward();
    }
    if (inverseName.equals(name)) {
      return inverse();
    }
    throw new IllegalArgumentException(
        typeName + " has no view named '" + name + "', expected '" + forwardName + "' or '" + inverseName + "'");
  }

  @Override
  public String toString() {
    return typeName + "(" + forwardName + "->" + inverseName + ")" + map;
  }
}
