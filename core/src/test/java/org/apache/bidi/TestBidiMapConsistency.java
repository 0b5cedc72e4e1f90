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
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.google.common.collect.ImmutableMap;

/**
 * Drives a hash and a linked map through the same random operations, half of them through the
 * inverse, and checks after every step that both directions agree and that both maps hold the
 * same associations.
 */
class TestBidiMapConsistency {

  private static final int STEPS = 2_000;
  private static final int KEYS = 12;

  @ParameterizedTest
  @ValueSource(longs = {1L, 42L, 20240601L})
  void testRandomOperationsKeepIndicesConsistent(long seed) {
    Random random = new Random(seed);
    HashBidiMap<Integer, Integer> hash = new HashBidiMap<>(DuplicationPolicy.STRICT);
    LinkedHashBidiMap<Integer, Integer> linked = new LinkedHashBidiMap<>(DuplicationPolicy.STRICT);

    for (int step = 0; step < STEPS; step++) {
      int key = random.nextInt(KEYS);
      int value = random.nextInt(KEYS);
      boolean viaInverse = random.nextBoolean();
      int op = random.nextInt(6);
      Map<Integer, Integer> before = ImmutableMap.copyOf(hash);

      boolean hashFailed = apply(hash, op, key, value, viaInverse);
      boolean linkedFailed = apply(linked, op, key, value, viaInverse);

      assertEquals(hashFailed, linkedFailed, "step " + step);
      if (hashFailed) {
        assertEquals(before, hash, "failed write changed state at step " + step);
      }
      assertConsistent(hash);
      assertConsistent(linked);
      assertEquals(hash, linked, "step " + step);
    }
  }

  private static boolean apply(MutableBidiMap<Integer, Integer> map, int op, int key, int value,
                               boolean viaInverse) {
    try {
      if (viaInverse) {
        applyTo(map.inverse(), op, value, key);
      } else {
        applyTo(map, op, key, value);
      }
      return false;
    } catch (DuplicationException e) {
      return true;
    }
  }

  private static void applyTo(MutableBidiMap<Integer, Integer> map, int op, int key, int value) {
    switch (op) {
      case 0:
        map.put(key, value);
        break;
      case 1:
        map.forcePut(key, value);
        break;
      case 2:
        map.putUnique(key, value);
        break;
      case 3:
        map.remove(key);
        break;
      case 4:
        map.removeValue(value);
        break;
      default:
        map.put(key, value, DuplicationPolicy.of(CollisionPolicy.IGNORE, CollisionPolicy.OVERWRITE));
        break;
    }
  }

  private static void assertConsistent(MutableBidiMap<Integer, Integer> map) {
    BidiMap<Integer, Integer> inverse = map.inverse();
    assertEquals(map.size(), inverse.size());
    for (Map.Entry<Integer, Integer> entry : map.entrySet()) {
      assertEquals(entry.getKey(), inverse.get(entry.getValue()));
      assertEquals(entry.getKey(), map.getKey(entry.getValue()));
    }
    for (Map.Entry<Integer, Integer> entry : inverse.entrySet()) {
      assertEquals(entry.getKey(), map.get(entry.getValue()));
    }
    for (int i = 0; i < KEYS; i++) {
      if (!map.containsKey(i)) {
        assertNull(map.get(i));
      }
      if (!map.containsValue(i)) {
        assertNull(inverse.get(i));
      }
    }
    if (map instanceof OrderedBidiMap) {
      List<Map.Entry<Integer, Integer>> forwardOrder = new ArrayList<>();
      for (Map.Entry<Integer, Integer> entry : inverse.entrySet()) {
        forwardOrder.add(InverseView.swap(entry));
      }
      assertEquals(new ArrayList<>(map.entrySet()), forwardOrder);
    }
  }
}
