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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class TestCollisionPolicy {

  @ParameterizedTest
  @EnumSource(CollisionPolicy.class)
  void testNoCollisionAlwaysProceeds(CollisionPolicy policy) {
    assertEquals(CollisionPolicy.Resolution.PROCEED, policy.resolve(false));
  }

  @Test
  void testCollisionResolution() {
    assertEquals(CollisionPolicy.Resolution.REJECT, CollisionPolicy.RAISE.resolve(true));
    assertEquals(CollisionPolicy.Resolution.EVICT_AND_PROCEED, CollisionPolicy.OVERWRITE.resolve(true));
    assertEquals(CollisionPolicy.Resolution.SKIP, CollisionPolicy.IGNORE.resolve(true));
  }

  @Test
  void testNamedDuplicationPolicies() {
    assertEquals(CollisionPolicy.OVERWRITE, DuplicationPolicy.STRICT.getOnDupKey());
    assertEquals(CollisionPolicy.RAISE, DuplicationPolicy.STRICT.getOnDupValue());
    assertEquals(CollisionPolicy.OVERWRITE, DuplicationPolicy.OVERWRITE.getOnDupKey());
    assertEquals(CollisionPolicy.OVERWRITE, DuplicationPolicy.OVERWRITE.getOnDupValue());
    assertEquals(CollisionPolicy.RAISE, DuplicationPolicy.RAISE.getOnDupKey());
    assertEquals(CollisionPolicy.RAISE, DuplicationPolicy.RAISE.getOnDupValue());
  }

  @Test
  void testOfReturnsCanonicalInstances() {
    assertSame(DuplicationPolicy.STRICT, DuplicationPolicy.of(CollisionPolicy.OVERWRITE, CollisionPolicy.RAISE));
    assertSame(DuplicationPolicy.OVERWRITE,
        DuplicationPolicy.of(CollisionPolicy.OVERWRITE, CollisionPolicy.OVERWRITE));
    assertSame(DuplicationPolicy.RAISE, DuplicationPolicy.of(CollisionPolicy.RAISE, CollisionPolicy.RAISE));

    DuplicationPolicy custom = DuplicationPolicy.of(CollisionPolicy.IGNORE, CollisionPolicy.RAISE);
    assertEquals(custom, DuplicationPolicy.of(CollisionPolicy.IGNORE, CollisionPolicy.RAISE));
    assertEquals(custom.hashCode(), DuplicationPolicy.of(CollisionPolicy.IGNORE, CollisionPolicy.RAISE).hashCode());
  }

  @Test
  void testOfRejectsNull() {
    assertThrows(NullPointerException.class, () -> DuplicationPolicy.of(null, CollisionPolicy.RAISE));
    assertThrows(NullPointerException.class, () -> DuplicationPolicy.of(CollisionPolicy.RAISE, null));
  }

  @Test
  void testInverseSwapsHalves() {
    DuplicationPolicy inverse = DuplicationPolicy.STRICT.inverse();
    assertEquals(CollisionPolicy.RAISE, inverse.getOnDupKey());
    assertEquals(CollisionPolicy.OVERWRITE, inverse.getOnDupValue());
    assertEquals(DuplicationPolicy.STRICT, inverse.inverse());
    assertSame(DuplicationPolicy.OVERWRITE, DuplicationPolicy.OVERWRITE.inverse());
  }

  @ParameterizedTest
  @ValueSource(strings = {"strict", "STRICT", " Strict "})
  void testForName(String name) {
    assertSame(DuplicationPolicy.STRICT, DuplicationPolicy.forName(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "ignore", "on_dup_value"})
  void testForNameRejectsUnknown(String name) {
    assertThrows(IllegalArgumentException.class, () -> DuplicationPolicy.forName(name));
  }
}
