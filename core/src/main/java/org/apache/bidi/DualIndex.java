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

import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * The dual-index engine: a forward index (key to value) and an inverse index (value to key)
 * that always describe the same set of associations.
 *
 * <p>Writes happen in two steps. {@link #plan} inspects both indices and the policy and either
 * throws, returns {@code null} (nothing to do), or returns a {@link Write} naming every
 * association the write displaces. {@link #commit} then applies the write to both indices and
 * cannot fail. Since nothing is mutated before a plan exists, a rejected write leaves the
 * indices untouched.
 *
 * <p>Not thread-safe.
 */
final class DualIndex<K, V> implements BidiStore<K, V> {
  private static final Logger logger = LoggerFactory.getLogger(DualIndex.class);

  private final Map<K, V> forward;
  private final Map<V, K> inverse;
  private final DuplicationPolicy policy;
  private InverseView<V, K> inverseView;

  DualIndex(DuplicationPolicy policy) {
    this(policy, 0);
  }

  DualIndex(DuplicationPolicy policy, int expectedSize) {
    this.policy = Preconditions.checkNotNull(policy, "policy must not be null");
    this.forward = Maps.newHashMapWithExpectedSize(expectedSize);
    this.inverse = Maps.newHashMapWithExpectedSize(expectedSize);
  }

  /**
   * A validated write, ready to be committed.
   */
  static final class Write<K, V> {
    final K key;
    final V value;
    /* The value key held before the write, or null if key was absent. */
    final V oldValue;
    /* The key that held value before the write, or null if value was absent. */
    final K oldKey;

    Write(K key, V value, V oldValue, K oldKey) {
      this.key = key;
      this.value = value;
      this.oldValue = oldValue;
      this.oldKey = oldKey;
    }

    boolean isNewAssociation() {
      return oldValue == null && oldKey == null;
    }
  }

  /**
   * Decides how {@code (key, value)} is written under {@code policy}, without mutating anything.
   *
   * @return the write to commit, or {@code null} if the pair is already present or the policy
   *     says to skip it
   * @throws KeyDuplicationException if the key is present and the key policy raises
   * @throws ValueDuplicationException if the value belongs to another key and the value policy
   *     raises
   */
  Write<K, V> plan(K key, V value, DuplicationPolicy policy) {
    V oldValue = forward.get(key);
    if (oldValue != null && oldValue.equals(value)) {
      return null;
    }
    K oldKey = inverse.get(value);

    switch (policy.getOnDupKey().resolve(oldValue != null)) {
      case REJECT:
        if (logger.isDebugEnabled()) {
          logger.debug("Rejecting {}={}: key already maps to {}", key, value, oldValue);
        }
        throw new KeyDuplicationException(key, oldValue);
      case SKIP:
        return null;
      default:
        break;
    }
    switch (policy.getOnDupValue().resolve(oldKey != null)) {
      case REJECT:
        if (logger.isDebugEnabled()) {
          logger.debug("Rejecting {}={}: value already belongs to {}", key, value, oldKey);
        }
        throw new ValueDuplicationException(oldKey, value);
      case SKIP:
        return null;
      default:
        break;
    }
    return new Write<>(key, value, oldValue, oldKey);
  }

  /**
   * Applies a write produced by {@link #plan} against the current state.
   */
  void commit(Write<K, V> write) {
    if (write.oldKey != null) {
      if (logger.isDebugEnabled()) {
        logger.debug("Evicting {}={} for {}={}", write.oldKey, write.value, write.key, write.value);
      }
      forward.remove(write.oldKey);
    }
    if (write.oldValue != null) {
      inverse.remove(write.oldValue);
    }
    forward.put(write.key, write.value);
    inverse.put(write.value, write.key);
  }

  @Override
  public DuplicationPolicy policy() {
    return policy;
  }

  @Override
  public int size() {
    return forward.size();
  }

  @Override
  public V get(Object key) {
    return forward.get(key);
  }

  @Override
  public K getKey(Object value) {
    return inverse.get(value);
  }

  @Override
  public boolean containsKey(Object key) {
    return forward.containsKey(key);
  }

  @Override
  public boolean containsValue(Object value) {
    return inverse.containsKey(value);
  }

  @Override
  public void put(K key, V value, DuplicationPolicy policy) {
    Write<K, V> write = plan(key, value, policy);
    if (write != null) {
      commit(write);
    }
  }

  @Override
  public V removeKey(Object key) {
    V value = forward.remove(key);
    if (value != null) {
      inverse.remove(value);
    }
    return value;
  }

  @Override
  public K removeValue(Object value) {
    K key = inverse.remove(value);
    if (key != null) {
      forward.remove(key);
    }
    return key;
  }

  @Override
  public void clear() {
    forward.clear();
    inverse.clear();
  }

  @Override
  public Iterator<Map.Entry<K, V>> iterator() {
    final Iterator<Map.Entry<K, V>> entries = forward.entrySet().iterator();
    return new Iterator<Map.Entry<K, V>>() {
      private Map.Entry<K, V> last;

      @Override
      public boolean hasNext() {
        return entries.hasNext();
      }

      @Override
      public Map.Entry<K, V> next() {
        Map.Entry<K, V> entry = entries.next();
        last = Maps.immutableEntry(entry.getKey(), entry.getValue());
        return last;
      }

      @Override
      public void remove() {
        Preconditions.checkState(last != null, "no calls to next() since the last call to remove()");
        entries.remove();
        inverse.remove(last.getValue());
        last = null;
      }
    };
  }

  @Override
  public BidiStore<V, K> inverse() {
    InverseView<V, K> result = inverseView;
    if (result == null) {
      result = new InverseView<>(this);
      inverseView = result;
    }
    return result;
  }

  @Override
  public DualIndex<K, V> copy() {
    DualIndex<K, V> copy = new DualIndex<>(policy, forward.size());
    copy.forward.putAll(forward);
    copy.inverse.putAll(inverse);
    return copy;
  }
}
