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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

class TestLinkedHashBidiMap {

  private LinkedHashBidiMap<String, Integer> map;

  @BeforeEach
  void beforeEach() {
    map = new LinkedHashBidiMap<>(DuplicationPolicy.STRICT);
    map.put("a", 1);
    map.put("b", 2);
  }

  private static <K> List<K> keys(Map<K, ?> map) {
    return new ArrayList<>(map.keySet());
  }

  @Test
  void testInsertionOrder() {
    map.put("c", 3);
    assertEquals(ImmutableList.of("a", "b", "c"), keys(map));
    assertEquals(ImmutableList.of(1, 2, 3), keys(map.inverse()));
    assertEquals(ImmutableList.of(1, 2, 3), new ArrayList<>(map.values()));
    assertEquals("{a=1, b=2, c=3}", map.toString());
  }

  @Test
  void testSamePairIsIdempotent() {
    map.put("c", 3);
    assertEquals(Integer.valueOf(1), map.put("a", 1));
    assertEquals("a", map.inverse().put(1, "a"));
    assertEquals(ImmutableList.of("a", "b", "c"), keys(map));
    assertEquals(ImmutableList.of(1, 2, 3), keys(map.inverse()));
    assertEquals(3, map.size());
  }

  @Test
  void testKeyUpdateKeepsPosition() {
    map.put("c", 3);
    map.put("a", 10);
    assertEquals(ImmutableList.of("a", "b", "c"), keys(map));
    assertEquals(Integer.valueOf(10), map.get("a"));
  }

  @Test
  void testValueRenameKeepsPosition() {
    map.inverse().put(1, "c");
    assertEquals(ImmutableList.of(Maps.immutableEntry("c", 1), Maps.immutableEntry("b", 2)),
        new ArrayList<>(map.entrySet()));
    assertNull(map.get("a"));
  }

  @Test
  void testDoubleCollisionKeepsKeyPosition() {
    LinkedHashBidiMap<String, Integer> overwrite = new LinkedHashBidiMap<>(map, DuplicationPolicy.OVERWRITE);
    overwrite.put("c", 3);
    overwrite.put("c", 1);
    assertEquals(ImmutableList.of("b", "c"), keys(overwrite));
    assertEquals(ImmutableMap.of("b", 2, "c", 1), overwrite);
  }

  @Test
  void testRejectedWriteLeavesOrderUnchanged() {
    assertThrows(ValueDuplicationException.class, () -> map.put("a", 2));
    assertEquals(ImmutableList.of("a", "b"), keys(map));
    assertEquals(ImmutableList.of(1, 2), keys(map.inverse()));
  }

  @Test
  void testFirstAndLast() {
    assertEquals(Maps.immutableEntry("a", 1), map.firstEntry());
    assertEquals(Maps.immutableEntry("b", 2), map.lastEntry());
    assertEquals(Maps.immutableEntry(1, "a"), map.inverse().firstEntry());
    map.clear();
    assertNull(map.firstEntry());
    assertNull(map.lastEntry());
  }

  @Test
  void testPop() {
    map.put("c", 3);
    assertEquals(Maps.immutableEntry("c", 3), map.popLast());
    assertEquals(Maps.immutableEntry("a", 1), map.popFirst());
    assertEquals(ImmutableMap.of("b", 2), map);
    assertNull(map.getKey(1));
    assertEquals(Maps.immutableEntry(2, "b"), map.inverse().popFirst());
    assertThrows(NoSuchElementException.class, () -> map.popFirst());
    assertThrows(NoSuchElementException.class, () -> map.popLast());
  }

  @Test
  void testMove() {
    map.put("c", 3);
    map.moveToFront("c");
    assertEquals(ImmutableList.of("c", "a", "b"), keys(map));
    map.moveToBack("c");
    assertEquals(ImmutableList.of("a", "b", "c"), keys(map));
    map.inverse().moveToFront(2);
    assertEquals(ImmutableList.of("b", "a", "c"), keys(map));
    assertThrows(AssociationNotFoundException.class, () -> map.moveToFront("z"));
    assertThrows(AssociationNotFoundException.class, () -> map.inverse().moveToBack(9));
  }

  @Test
  void testRemovalUnlinks() {
    map.put("c", 3);
    map.remove("b");
    map.inverse().remove(1);
    assertEquals(ImmutableList.of("c"), keys(map));
    map.put("b", 2);
    assertEquals(ImmutableList.of("c", "b"), keys(map));
  }

  @Test
  void testIteratorRemove() {
    map.put("c", 3);
    Iterator<String> it = map.keySet().iterator();
    it.next();
    it.next();
    it.remove();
    assertEquals(ImmutableList.of("a", "c"), keys(map));
    assertNull(map.getKey(2));
  }

  @Test
  void testIteratorFailsFast() {
    Iterator<String> it = map.keySet().iterator();
    it.next();
    map.put("c", 3);
    assertThrows(ConcurrentModificationException.class, it::next);
  }

  @Test
  void testOrderSensitiveEquality() {
    LinkedHashBidiMap<String, Integer> reversed = new LinkedHashBidiMap<>(DuplicationPolicy.STRICT);
    reversed.put("b", 2);
    reversed.put("a", 1);
    assertNotEquals(map, reversed);

    reversed.moveToBack("b");
    assertEquals(map, reversed);
    assertEquals(map.hashCode(), reversed.hashCode());
  }

  @Test
  void testContentEqualityWithUnorderedMaps() {
    Map<String, Integer> plain = new HashMap<>();
    plain.put("b", 2);
    plain.put("a", 1);
    assertEquals(map, plain);
    assertEquals(plain, map);

    HashBidiMap<String, Integer> unordered = new HashBidiMap<>(plain);
    assertEquals(map, unordered);
    assertEquals(unordered, map);
    assertEquals(unordered.hashCode(), map.hashCode());
  }

  @Test
  void testCopyKeepsOrder() {
    map.moveToFront("b");
    LinkedHashBidiMap<String, Integer> copy = map.copy();
    assertEquals(ImmutableList.of("b", "a"), keys(copy));
    copy.popFirst();
    assertEquals(2, map.size());
    assertEquals(ImmutableList.of(2, 1), keys(map.inverse().copy()));
  }

  @Test
  void testCreateFromPairsKeepsOrder() {
    LinkedHashBidiMap<String, Integer> created = LinkedHashBidiMap.create(
        ImmutableList.of(Maps.immutableEntry("z", 26), Maps.immutableEntry("y", 25)), DuplicationPolicy.RAISE);
    assertEquals(ImmutableList.of("z", "y"), keys(created));
    assertTrue(created.equals(LinkedHashBidiMap.create(ImmutableMap.of("z", 26, "y", 25))));
  }
}
