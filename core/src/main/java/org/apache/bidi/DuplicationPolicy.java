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

import java.util.Locale;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * The pair of {@link CollisionPolicy collision policies} a bidirectional map applies on every
 * write: one for a key that is already present, one for a value that is already owned by a
 * different key.
 *
 * <p>Instances are immutable and fixed when a map is constructed. A single write may still be
 * performed with another policy through {@link MutableBidiMap#put(Object, Object, DuplicationPolicy)}.
 */
public final class DuplicationPolicy {

  /**
   * Replaces the value of an existing key, fails when the value belongs to another key.
   */
  public static final DuplicationPolicy STRICT =
      new DuplicationPolicy(CollisionPolicy.OVERWRITE, CollisionPolicy.RAISE);

  /**
   * Replaces the value of an existing key and evicts any other association holding the value.
   */
  public static final DuplicationPolicy OVERWRITE =
      new DuplicationPolicy(CollisionPolicy.OVERWRITE, CollisionPolicy.OVERWRITE);

  /**
   * Fails on any duplicate key or duplicate value.
   */
  public static final DuplicationPolicy RAISE =
      new DuplicationPolicy(CollisionPolicy.RAISE, CollisionPolicy.RAISE);

  private final CollisionPolicy onDupKey;
  private final CollisionPolicy onDupValue;

  private DuplicationPolicy(CollisionPolicy onDupKey, CollisionPolicy onDupValue) {
    this.onDupKey = onDupKey;
    this.onDupValue = onDupValue;
  }

  /**
   * Creates a policy from its two halves.
   *
   * @param onDupKey what to do when the key of a write is already present
   * @param onDupValue what to do when the value of a write already belongs to another key
   * @return the policy
   */
  public static DuplicationPolicy of(CollisionPolicy onDupKey, CollisionPolicy onDupValue) {
    Preconditions.checkNotNull(onDupKey, "onDupKey must not be null");
    Preconditions.checkNotNull(onDupValue, "onDupValue must not be null");
    if (onDupKey == CollisionPolicy.OVERWRITE && onDupValue == CollisionPolicy.RAISE) {
      return STRICT;
    }
    if (onDupKey == CollisionPolicy.OVERWRITE && onDupValue == CollisionPolicy.OVERWRITE) {
      return OVERWRITE;
    }
    if (onDupKey == CollisionPolicy.RAISE && onDupValue == CollisionPolicy.RAISE) {
      return RAISE;
    }
    return new DuplicationPolicy(onDupKey, onDupValue);
  }

  /**
   * Looks up one of the named policies: {@code STRICT}, {@code OVERWRITE} or {@code RAISE}
   * (case-insensitive).
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static DuplicationPolicy forName(String name) {
    Preconditions.checkNotNull(name, "policy name must not be null");
    switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "STRICT":
        return STRICT;
      case "OVERWRITE":
        return OVERWRITE;
      case "RAISE":
        return RAISE;
      default:
        throw new IllegalArgumentException("Unknown duplication policy: " + name);
    }
  }

  public CollisionPolicy getOnDupKey() {
    return onDupKey;
  }

  public CollisionPolicy getOnDupValue() {
    return onDupValue;
  }

  /**
   * The same policy seen from the inverse direction, where keys and values trade places.
   */
  public DuplicationPolicy inverse() {
    return of(onDupValue, onDupKey);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DuplicationPolicy that = (DuplicationPolicy) o;
    return onDupKey == that.onDupKey && onDupValue == that.onDupValue;
  }

  @Override
  public int hashCode() {
    return Objects.hash(onDupKey, onDupValue);
  }

  @Override
  public String toString() {
    return "DuplicationPolicy[onDupKey=" + onDupKey + ",onDupValue=" + onDupValue + "]";
  }
}
