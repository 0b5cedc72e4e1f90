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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

/**
 * A class for choosing the duplication policy of maps constructed without an explicit one.
 *
 * <p>The policy is read once, from the system property {@value #DUPLICATION_POLICY_PROPERTY_NAME}
 * or the environmental variable {@value #DUPLICATION_POLICY_ENV_NAME}. Accepted values are the
 * names understood by {@link DuplicationPolicy#forName(String)}. When both are set, the system
 * property takes precedence. When neither is set, or the value is not recognized,
 * {@link DuplicationPolicy#STRICT} is used.
 */
public final class DefaultDuplicationPolicyOption {

  /**
   * The environmental variable to set the default duplication policy.
   */
  public static final String DUPLICATION_POLICY_ENV_NAME = "BIDI_DUPLICATION_POLICY";

  /**
   * The system property to set the default duplication policy.
   */
  public static final String DUPLICATION_POLICY_PROPERTY_NAME = "bidi.duplication.policy";

  static final Logger LOGGER = LoggerFactory.getLogger(DefaultDuplicationPolicyOption.class);

  private static final DuplicationPolicy DEFAULT_DUPLICATION_POLICY = resolve(
      System.getenv(DUPLICATION_POLICY_ENV_NAME),
      System.getProperty(DUPLICATION_POLICY_PROPERTY_NAME));

  private DefaultDuplicationPolicyOption() {
  }

  /**
   * Returns the process-wide default duplication policy.
   */
  public static DuplicationPolicy getDefaultDuplicationPolicy() {
    return DEFAULT_DUPLICATION_POLICY;
  }

  @VisibleForTesting
  static DuplicationPolicy resolve(String envValue, String propValue) {
    DuplicationPolicy ret = parse(envValue, DUPLICATION_POLICY_ENV_NAME);
    // system property takes precedence
    DuplicationPolicy fromProperty = parse(propValue, DUPLICATION_POLICY_PROPERTY_NAME);
    if (fromProperty != null) {
      ret = fromProperty;
    }
    if (ret == null) {
      LOGGER.debug("duplication policy not specified, using {} as the default", DuplicationPolicy.STRICT);
      ret = DuplicationPolicy.STRICT;
    }
    return ret;
  }

  private static DuplicationPolicy parse(String value, String source) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    try {
      return DuplicationPolicy.forName(value);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring \"{}\" from {}: {}", value, source, e.getMessage());
      return null;
    }
  }
}
