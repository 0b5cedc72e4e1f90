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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Preconditions;

import org.apache.bidi.BidiMap;
import org.apache.bidi.DuplicationPolicy;
import org.apache.bidi.HashBidiMap;
import org.apache.bidi.LinkedHashBidiMap;
import org.apache.bidi.MutableBidiMap;

/**
 * JSON form of the bidirectional maps. A map written by {@link #toJson(BidiMap)} reads back
 * through {@link #fromJson(String, Class, Class)} as an equal map of the same kind, with the same
 * duplication policy, the same order (for ordered maps) and the same frozen state.
 *
 * <pre>{@code
 * {
 *   "kind" : "LINKED",
 *   "frozen" : false,
 *   "onDupKey" : "OVERWRITE",
 *   "onDupValue" : "RAISE",
 *   "entries" : [ { "key" : "H", "value" : 1 }, { "key" : "He", "value" : 2 } ]
 * }
 * }</pre>
 */
public final class BidiMapJson {
  private static final Logger logger = LoggerFactory.getLogger(BidiMapJson.class);

  private static final ObjectMapper mapper = new ObjectMapper();
  private static final ObjectWriter writer = mapper.writerWithDefaultPrettyPrinter();
  private static final ObjectReader reader = mapper.readerFor(BidiMapDescriptor.class);

  private BidiMapJson() {
  }

  /**
   * Returns the JSON representation of {@code map}. Keys and values are written with Jackson's
   * default serializers.
   */
  public static String toJson(BidiMap<?, ?> map) {
    Preconditions.checkNotNull(map, "map must not be null");
    try {
      return writer.writeValueAsString(BidiMapDescriptor.describe(map, mapper));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize bidirectional map", e);
    }
  }

  /**
   * Rebuilds a map from its JSON representation, reading keys as {@code keyType} and values as
   * {@code valueType}.
   *
   * @throws IOException if the input is malformed, is missing a required field, or holds a key or
   *     value that cannot be read as the requested type
   */
  public static <K, V> BidiMap<K, V> fromJson(String json, Class<K> keyType, Class<V> valueType)
      throws IOException {
    return fromJson(json, mapper.constructType(keyType), mapper.constructType(valueType));
  }

  /**
   * Same as {@link #fromJson(String, Class, Class)}, for generic key or value types.
   */
  public static <K, V> BidiMap<K, V> fromJson(String json, JavaType keyType, JavaType valueType)
      throws IOException {
    Preconditions.checkNotNull(json, "json must not be null");
    BidiMapDescriptor descriptor = reader.readValue(json);
    ObjectReader keyReader = mapper.readerFor(keyType);
    ObjectReader valueReader = mapper.readerFor(valueType);

    DuplicationPolicy policy = descriptor.policy();
    MutableBidiMap<K, V> map = descriptor.getKind() == BidiMapDescriptor.Kind.LINKED
        ? new LinkedHashBidiMap<>(policy)
        : new HashBidiMap<>(policy);
    for (BidiMapDescriptor.Pair pair : descriptor.getEntries()) {
      K key = keyReader.readValue(pair.getKey());
      V value = valueReader.readValue(pair.getValue());
      map.put(key, value, policy);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Read {} map with {} entries, policy {}, frozen {}",
          descriptor.getKind(), map.size(), policy, descriptor.isFrozen());
    }
    return descriptor.isFrozen() ? map.freeze() : map;
  }
}
