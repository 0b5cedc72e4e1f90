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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.bidi.DuplicationPolicy;
import org.apache.bidi.HashBidiMap;
import org.apache.bidi.LinkedHashBidiMap;
import org.apache.bidi.ValueDuplicationException;

class TestNamedBidiMapBuilder {

  @Test
  void testViewsByName() {
    NamedBidiMap<String, Integer> elements = NamedBidiMapBuilder.named("ElementMap", "symbol", "number").build();
    elements.forward().put("H", 1);
    elements.inverse().put(2, "He");

    assertEquals("ElementMap", elements.getTypeName());
    assertEquals(ImmutableMap.of("H", 1, "He", 2), elements.view("symbol"));
    assertEquals(ImmutableMap.of(1, "H", 2, "He"), elements.view("number"));
    assertSame(elements.forward(), elements.view("symbol"));
    assertInstanceOf(HashBidiMap.class, elements.forward());
    assertThrows(IllegalArgumentException.class, () -> elements.view("name"));
  }

  @Test
  void testOrderedWithPolicy() {
    NamedBidiMap<String, Integer> elements = NamedBidiMapBuilder.named("ElementMap", "symbol", "number")
        .ordered(true)
        .policy(DuplicationPolicy.RAISE)
        .build(ImmutableMap.of("He", 2, "H", 1));
    assertInstanceOf(LinkedHashBidiMap.class, elements.forward());
    assertEquals(ImmutableList.of("He", "H"), new ArrayList<>(elements.forward().keySet()));
    assertEquals(DuplicationPolicy.RAISE, elements.forward().duplicationPolicy());
    assertThrows(ValueDuplicationException.class, () -> elements.forward().put("Hydrogen", 1));
    assertEquals("ElementMap(symbol->number){He=2, H=1}", elements.toString());
  }

  @Test
  void testEveryBuildIsIndependent() {
    NamedBidiMapBuilder builder = NamedBidiMapBuilder.named("Ids", "byName", "byId");
    NamedBidiMap<String, Integer> first = builder.build();
    NamedBidiMap<String, Integer> second = builder.build();
    first.forward().put("a", 1);
    assertNotSame(first.forward(), second.forward());
    assertEquals(0, second.forward().size());
    // same names may be reused, nothing is registered
    NamedBidiMapBuilder.named("Ids", "byName", "byId").build();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1abc", "class", "with space", "a-b", "a.b"})
  void testInvalidAccessorNames(String name) {
    assertThrows(IllegalArgumentException.class, () -> NamedBidiMapBuilder.named("Ok", name, "other"));
    assertThrows(IllegalArgumentException.class, () -> NamedBidiMapBuilder.named("Ok", "other", name));
    assertThrows(IllegalArgumentException.class, () -> NamedBidiMapBuilder.named(name, "one", "other"));
  }

  @Test
  void testAccessorNamesMustDiffer() {
    assertThrows(IllegalArgumentException.class, () -> NamedBidiMapBuilder.named("Ok", "same", "same"));
    assertThrows(NullPointerException.class, () -> NamedBidiMapBuilder.named("Ok", null, "other"));
  }
}
