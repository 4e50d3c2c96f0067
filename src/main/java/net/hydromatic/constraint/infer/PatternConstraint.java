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

import static java.util.Objects.requireNonNull;

/**
 * Constraint that a string matches a regular expression.
 *
 * <p>Several pattern constraints on one property are a conjunction.
 */
public class PatternConstraint {
  public final String pattern;

  public PatternConstraint(String pattern) {
    this.pattern = requireNonNull(pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PatternConstraint
            && pattern.equals(((PatternConstraint) o).pattern);
  }

  @Override
  public String toString() {
    return "PatternConstraint(pattern=" + Dumper.repr(pattern) + ")";
  }
}

// End PatternConstraint.java
