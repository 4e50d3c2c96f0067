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

import java.util.Objects;
import net.hydromatic.constraint.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bound on a length, as read directly from one comparison such as
 * "{@code len(self.x) < 42}".
 *
 * <p>Unlike {@link LenConstraint}, which is reduced from many invariants, a
 * bound comes from a single node.
 */
public class LengthBound {
  public final Kind kind;
  public final int value;
  /** Argument of {@code len}: {@code self} or {@code self.property}. */
  public final Ast.Exp target;
  /** The comparison the bound was read from. */
  public final Ast.Comparison node;

  LengthBound(Kind kind, int value, Ast.Exp target, Ast.Comparison node) {
    this.kind = requireNonNull(kind);
    this.value = value;
    this.target = requireNonNull(target);
    this.node = requireNonNull(node);
  }

  /**
   * Returns the name of the property whose length is bounded, or null if the
   * bound is on {@code self}.
   */
  public @Nullable String propertyName() {
    return Idioms.matchProperty(target);
  }

  /** Returns whether the bound is on the length of {@code self}. */
  public boolean isOnSelf() {
    return Idioms.isSelf(target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  /**
   * Two bounds are equal if they have the same kind and value, regardless of
   * where they came from.
   */
  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LengthBound
            && kind == ((LengthBound) o).kind
            && value == ((LengthBound) o).value;
  }

  @Override
  public String toString() {
    return kind + "(" + value + ")";
  }

  /** Kind of length bound. */
  public enum Kind {
    /** The length is at least the value. */
    MIN,
    /** The length is at most the value. */
    MAX,
    /** The length equals the value. */
    EXACT
  }
}

// End LengthBound.java
