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
 * Thrown when a write collides with an existing association under a {@link CollisionPolicy#RAISE}
 * policy. The map is left exactly as it was before the write.
 */
public abstract class DuplicationException extends BidiException {

  private final transient Object existingKey;
  private final transient Object existingValue;

  protected DuplicationException(String message, Object existingKey, Object existingValue) {
    super(message);
    this.existingKey = existingKey;
    this.existingValue = existingValue;
  }

  /**
   * The key of the association the write collided with.
   */
  public Object getExistingKey() {
    return existingKey;
  }

  /**
   * The value of the association the write collided with.
   */
  public Object getExistingValue() {
    return existingValue;
  }
}
