/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.constraint.infer;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.constraint.model.PatternVerification;
import net.hydromatic.constraint.model.Verification;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of the verification functions that match a regular expression,
 * keyed by function name.
 *
 * <p>Built once per symbol table and passed to each inference that needs it.
 */
public class PatternVerificationsByName {
  private final ImmutableMap<String, PatternVerification> map;

  private PatternVerificationsByName(
      ImmutableMap<String, PatternVerification> map) {
    this.map = map;
  }

  /**
   * Creates a registry from a list of verification functions, ignoring those
   * that do not match a pattern.
   *
   * <p>If two functions have the same name, the later wins.
   */
  public static PatternVerificationsByName of(
      List<? extends Verification> verifications) {
    final Map<String, PatternVerification> map = new LinkedHashMap<>();
    for (Verification verification : verifications) {
      if (verification instanceof PatternVerification) {
        map.put(verification.name, (PatternVerification) verification);
      }
    }
    return new PatternVerificationsByName(ImmutableMap.copyOf(map));
  }

  /** Returns the pattern verification with a given name, or null. */
  public @Nullable PatternVerification get(String name) {
    return map.get(name);
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.keySet().toString();
  }
}

// End PatternVerificationsByName.java
