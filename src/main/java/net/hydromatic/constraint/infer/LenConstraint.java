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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Inferred constraint on the length of a value.
 *
 * <p>Both bounds are inclusive, {@code minValue <= len <= maxValue}. A null
 * bound means that side is unconstrained.
 */
public class LenConstraint {
  /** Constraint with neither bound. */
  public static final LenConstraint UNBOUNDED = new LenConstraint(null, null);

  public final @Nullable Integer minValue;
  public final @Nullable Integer maxValue;

  public LenConstraint(@Nullable Integer minValue, @Nullable Integer maxValue) {
    checkArgument(
        minValue == null || maxValue == null || minValue <= maxValue,
        "minimum %s exceeds maximum %s",
        minValue,
        maxValue);
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  /** Creates a copy of this constraint. */
  public LenConstraint copy() {
    return new LenConstraint(minValue, maxValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minValue, maxValue);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LenConstraint
            && Objects.equals(minValue, ((LenConstraint) o).minValue)
            && Objects.equals(maxValue, ((LenConstraint) o).maxValue);
  }

  @Override
  public String toString() {
    return "LenConstraint(min_value="
        + (minValue == null ? "None" : minValue)
        + ", max_value="
        + (maxValue == null ? "None" : maxValue)
        + ")";
  }

  /** Returns the larger of two bounds, ignoring nulls. */
  static @Nullable Integer maxWithNull(
      @Nullable Integer a, @Nullable Integer b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return Math.max(a, b);
  }

  /** Returns the smaller of two bounds, ignoring nulls. */
  static @Nullable Integer minWithNull(
      @Nullable Integer a, @Nullable Integer b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return Math.min(a, b);
  }
}

// End LenConstraint.java
