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

import java.util.Map;

import javax.lang.model.SourceVersion;

import com.google.common.base.Preconditions;

import org.apache.bidi.DefaultDuplicationPolicyOption;
import org.apache.bidi.DuplicationPolicy;
import org.apache.bidi.HashBidiMap;
import org.apache.bidi.LinkedHashBidiMap;
import org.apache.bidi.MutableBidiMap;

/**
 * Builds {@link NamedBidiMap}s: bidirectional maps whose two directions are reachable under
 * caller-chosen names, e.g. {@code "symbol"} for element symbol to atomic number and
 * {@code "number"} for the way back.
 *
 * <pre>{@code
 * NamedBidiMap<String, Integer> elements =
 *     NamedBidiMapBuilder.named("ElementMap", "symbol", "number").ordered(true).build();
 * elements.forward().put("H", 1);
 * elements.view("number").get(1);   // "H"
 * }</pre>
 *
 * <p>The type name and both accessor names must be legal Java identifiers that are not
 * keywords, and the two accessor names must differ. Names are checked when the builder is
 * created. Nothing is registered globally: two builders may reuse the same names.
 */
public final class NamedBidiMapBuilder {

  private final String typeName;
  private final String forwardName;
  private final String inverseName;
  private boolean ordered;
  private DuplicationPolicy policy = DefaultDuplicationPolicyOption.getDefaultDuplicationPolicy();

  private NamedBidiMapBuilder(String typeName, String forwardName, String inverseName) {
    this.typeName = checkName(typeName, "type name");
    this.forwardName = checkName(forwardName, "forward name");
    this.inverseName = checkName(inverseName, "inverse name");
    Preconditions.checkArgument(!forwardName.equals(inverseName),
        "forward and inverse names must differ, both are '%s'", forwardName);
  }

  /**
   * Starts a builder for maps called {@code typeName} whose forward direction is named
   * {@code forwardName} and whose inverse direction is named {@code inverseName}.
   *
   * @throws IllegalArgumentException if a name is not a valid identifier, or the accessor names
   *     are equal
   */
  public static NamedBidiMapBuilder named(String typeName, String forwardName, String inverseName) {
    return new NamedBidiMapBuilder(typeName, forwardName, inverseName);
  }

  private static String checkName(String name, String role) {
    Preconditions.checkNotNull(name, "%s must not be null", role);
    Preconditions.checkArgument(SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name),
        "%s '%s' is not a valid identifier", role, name);
    return name;
  }

  /**
   * Whether built maps keep insertion order ({@link LinkedHashBidiMap}) or not
   * ({@link HashBidiMap}, the default).
   */
  public NamedBidiMapBuilder ordered(boolean ordered) {
    this.ordered = ordered;
    return this;
  }

  public NamedBidiMapBuilder policy(DuplicationPolicy policy) {
    this.policy = Preconditions.checkNotNull(policy, "policy must not be null");
    return this;
  }

  /**
   * Builds an empty named map. Every call returns a new, independent map.
   */
  public <K, V> NamedBidiMap<K, V> build() {
    MutableBidiMap<K, V> map = ordered ? new LinkedHashBidiMap<>(policy) : new HashBidiMap<>(policy);
    return new NamedBidiMap<>(typeName, forwardName, inverseName, map);
  }

  /**
   * Builds a named map holding the entries of {@code initial}, added with the builder's policy.
   */
  public <K, V> NamedBidiMap<K, V> build(Map<? extends K, ? extends V> initial) {
    NamedBidiMap<K, V> named = build();
    named.forward().putAll(initial.entrySet(), policy);
    return named;
  }
}
