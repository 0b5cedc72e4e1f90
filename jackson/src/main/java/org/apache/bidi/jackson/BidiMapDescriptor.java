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

package org.apache.bidi.jackson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.bidi.BidiMap;
import org.apache.bidi.CollisionPolicy;
import org.apache.bidi.DuplicationPolicy;
import org.apache.bidi.ImmutableBidiMap;
import org.apache.bidi.ImmutableOrderedBidiMap;
import org.apache.bidi.OrderedBidiMap;

/**
 * The persisted form of a bidirectional map: which kind it is, whether it is frozen, its two
 * collision policies and its associations in iteration order. Keys and values are kept as
 * JSON trees until the caller supplies their types.
 */
@JsonPropertyOrder({"kind", "frozen", "onDupKey", "onDupValue", "entries"})
final class BidiMapDescriptor {

  /**
   * Storage kind, which decides the class the map is rebuilt as.
   */
  enum Kind {
    HASH,
    LINKED
  }

  private final Kind kind;
  private final boolean frozen;
  private final CollisionPolicy onDupKey;
  private final CollisionPolicy onDupValue;
  private final List<Pair> entries;

  @JsonCreator
  BidiMapDescriptor(@JsonProperty("kind") Kind kind,
                    @JsonProperty("frozen") boolean frozen,
                    @JsonProperty("onDupKey") CollisionPolicy onDupKey,
                    @JsonProperty("onDupValue") CollisionPolicy onDupValue,
                    @JsonProperty("entries") List<Pair> entries) {
    this.kind = Preconditions.checkNotNull(kind, "kind is required");
    this.frozen = frozen;
    this.onDupKey = Preconditions.checkNotNull(onDupKey, "onDupKey is required");
    this.onDupValue = Preconditions.checkNotNull(onDupValue, "onDupValue is required");
    this.entries = entries == null ? ImmutableList.of() : ImmutableList.copyOf(entries);
  }

  static BidiMapDescriptor describe(BidiMap<?, ?> map, ObjectMapper mapper) {
    Kind kind = map instanceof OrderedBidiMap ? Kind.LINKED : Kind.HASH;
    boolean frozen = map instanceof ImmutableBidiMap || map instanceof ImmutableOrderedBidiMap;
    DuplicationPolicy policy = map.duplicationPolicy();
    List<Pair> entries = new ArrayList<>(map.size());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      entries.add(new Pair(mapper.valueToTree(entry.getKey()), mapper.valueToTree(entry.getValue())));
    }
    return new BidiMapDescriptor(kind, frozen, policy.getOnDupKey(), policy.getOnDupValue(), entries);
  }

  @JsonProperty("kind")
  Kind getKind() {
    return kind;
  }

  @JsonProperty("frozen")
  boolean isFrozen() {
    return frozen;
  }

  @JsonProperty("onDupKey")
  CollisionPolicy getOnDupKey() {
    return onDupKey;
  }

  @JsonProperty("onDupValue")
  CollisionPolicy getOnDupValue() {
    return onDupValue;
  }

  @JsonProperty("entries")
  List<Pair> getEntries() {
    return entries;
  }

  DuplicationPolicy policy() {
    return DuplicationPolicy.of(onDupKey, onDupValue);
  }

  /**
   * One association, serialized as {@code {"key": ..., "value": ...}}.
   */
  @JsonPropertyOrder({"key", "value"})
  static final class Pair {
    private final JsonNode key;
    private final JsonNode value;

    @JsonCreator
    Pair(@JsonProperty("key") JsonNode key, @JsonProperty("value") JsonNode value) {
      Preconditions.checkArgument(isPresent(key), "entry key is required");
      Preconditions.checkArgument(isPresent(value), "entry value is required");
      this.key = key;
      this.value = value;
    }

    private static boolean isPresent(JsonNode node) {
      return node != null && !node.isNull() && !node.isMissingNode();
    }

    @JsonProperty("key")
    JsonNode getKey() {
      return key;
    }

    @JsonProperty("value")
    JsonNode getValue() {
      return value;
    }
  }
}
