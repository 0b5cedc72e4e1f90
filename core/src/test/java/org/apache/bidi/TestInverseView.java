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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

class TestInverseView {

  private static HashBidiMap<String, Integer> sample(DuplicationPolicy policy) {
    HashBidiMap<String, Integer> map = new HashBidiMap<>(policy);
    map.put("H", 1);
    map.put("He", 2);
    return map;
  }

  @Test
  void testInverseSharesStorage() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    HashBidiMap<Integer, String> inverse = map.inverse();
    assertEquals(ImmutableMap.of(1, "H", 2, "He"), inverse);

    inverse.put(3, "Li");
    assertEquals(Integer.valueOf(3), map.get("Li"));
    map.remove("H");
    assertFalse(inverse.containsKey(1));
    assertEquals(map.size(), inverse.size());
  }

  @Test
  void testDoubleInverseIsIdentity() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    assertSame(map, map.inverse().inverse());
    assertSame(map.inverse(), map.inverse());
  }

  @Test
  void testPolicyIsAppliedFromTheInverseDirection() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    HashBidiMap<Integer, String> inverse = map.inverse();
    assertEquals(DuplicationPolicy.STRICT, inverse.duplicationPolicy());

    // an existing inverse key is updated in place
    assertEquals("H", inverse.put(1, "Hydrogen"));
    assertEquals(ImmutableMap.of("Hydrogen", 1, "He", 2), map);

    // an inverse value owned by another inverse key is rejected
    assertThrows(ValueDuplicationException.class, () -> inverse.put(3, "He"));
    assertEquals(ImmutableMap.of("Hydrogen", 1, "He", 2), map);
  }

  @Test
  void testEquivalentOperationsYieldIdenticalState() {
    HashBidiMap<String, Integer> viaForward = sample(DuplicationPolicy.OVERWRITE);
    HashBidiMap<String, Integer> viaInverse = sample(DuplicationPolicy.OVERWRITE);

    viaForward.put("He", 1);
    viaInverse.inverse().put(1, "He");
    assertEquals(viaForward, viaInverse);
    assertEquals(ImmutableMap.of("He", 1), viaInverse);
  }

  @Test
  void testPutUniqueThroughInverse() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    KeyDuplicationException e = assertThrows(KeyDuplicationException.class, () -> map.inverse().putUnique(1, "x"));
    assertEquals(1, e.getExistingKey());
    assertEquals("H", e.getExistingValue());
    ValueDuplicationException v = assertThrows(ValueDuplicationException.class,
        () -> map.inverse().putUnique(5, "H"));
    assertEquals(1, v.getExistingKey());
    assertEquals("H", v.getExistingValue());
  }

  @Test
  void testLookupsThroughInverse() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    assertEquals("He", map.inverse().get(2));
    assertEquals(Integer.valueOf(2), map.inverse().getKey("He"));
    assertNull(map.inverse().get(9));
    assertTrue(map.inverse().containsValue("H"));
    assertEquals("He", map.inverse().removeValue(2));
    assertEquals(ImmutableMap.of("H", 1), map);
  }

  @Test
  void testCopyOfInverse() {
    HashBidiMap<String, Integer> map = sample(DuplicationPolicy.STRICT);
    HashBidiMap<Integer, String> copy = map.inverse().copy();
    copy.put(9, "F");
    assertFalse(map.containsKey("F"));
    assertEquals(ImmutableMap.of(1, "H", 2, "He", 9, "F"), copy);
    assertEquals(ImmutableMap.of("H", 1, "He", 2, "F", 9), copy.inverse());
  }
}
