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

/**
 * How a write into a bidirectional map resolves a collision with an association that is
 * already present.
 *
 * <p>A policy is a pure decision table: {@link #resolve(boolean)} never looks at the map.
 * The engine asks the policy once for the key condition and once for the value condition,
 * and only mutates its indices after both answers allow it.
 */
public enum CollisionPolicy {

  /**
   * Fail the write with a {@link DuplicationException}, leaving the map unchanged.
   */
  RAISE,

  /**
   * Drop the association that holds the colliding key or value, then perform the write.
   */
  OVERWRITE,

  /**
   * Keep the existing association and silently skip the write.
   */
  IGNORE;

  /**
   * The outcome of applying a policy to a single collision check.
   */
  public enum Resolution {
    /**
     * No collision, the write may go ahead.
     */
    PROCEED,

    /**
     * The colliding association is evicted before the write is installed.
     */
    EVICT_AND_PROCEED,

    /**
     * The write fails.
     */
    REJECT,

    /**
     * The write is dropped without error.
     */
    SKIP
  }

  /**
   * Decides what happens to a write.
   *
   * @param collides whether the write collides with an association that is already present
   * @return the resolution for this policy
   */
  public Resolution resolve(boolean collides) {
    if (!collides) {
      return Resolution.PROCEED;
    }
    switch (this) {
      case RAISE:
        return Resolution.REJECT;
      case OVERWRITE:
        return Resolution.EVICT_AND_PROCEED;
      case IGNORE:
        return Resolution.SKIP;
      default:
        throw new IllegalStateException("Unknown collision policy: " + this);
    }
  }
}
