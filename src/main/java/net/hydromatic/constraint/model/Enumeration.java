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
package net.hydromatic.constraint.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.constraint.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Enumeration of the meta-model. */
public class Enumeration extends Symbol {
  public final ImmutableList<Literal> literals;
  private final ImmutableMap<String, Literal> literalsByName;

  private Enumeration(Pos pos, String name, Map<String, String> valuesByName) {
    super(pos, name);
    final ImmutableList.Builder<Literal> literals = ImmutableList.builder();
    final ImmutableMap.Builder<String, Literal> literalsByName =
        ImmutableMap.builder();
    int handle = 0;
    for (Map.Entry<String, String> entry : valuesByName.entrySet()) {
      final Literal literal =
          new Literal(this, handle++, entry.getKey(), entry.getValue());
      literals.add(literal);
      literalsByName.put(literal.name, literal);
    }
    this.literals = literals.build();
    this.literalsByName = literalsByName.build();
  }

  /** Creates a builder for an enumeration. */
  public static Builder builder(Pos pos, String name) {
    return new Builder(pos, name);
  }

  @Override
  public List<Symbol> parents() {
    return ImmutableList.of();
  }

  /** Returns the literal with a given name, or null. */
  public @Nullable Literal literal(String name) {
    return literalsByName.get(name);
  }

  /** Returns the literal with a given name; throws if not found. */
  public Literal mustLiteral(String name) {
    final Literal literal = literalsByName.get(name);
    checkArgument(
        literal != null, "enumeration %s has no literal %s", this.name, name);
    return literal;
  }

  /**
   * Literal of an enumeration.
   *
   * <p>The {@link #handle} is the literal's ordinal within its enumeration. A
   * literal is identified by its enumeration and its handle, never by its
   * value; two enumerations may have literals with the same value.
   */
  public static class Literal {
    public final Enumeration enumeration;
    public final int handle;
    public final String name;
    public final String value;

    Literal(Enumeration enumeration, int handle, String name, String value) {
      this.enumeration = requireNonNull(enumeration);
      this.handle = handle;
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return enumeration.name + "." + name;
    }
  }

  /** Builder for {@link Enumeration}. */
  public static class Builder {
    private final Pos pos;
    private final String name;
    private final Map<String, String> valuesByName = new LinkedHashMap<>();

    private Builder(Pos pos, String name) {
      this.pos = pos;
      this.name = name;
    }

    /** Adds a literal. */
    public Builder literal(String name, String value) {
      checkArgument(
          valuesByName.put(name, value) == null,
          "duplicate literal %s in enumeration %s",
          name,
          this.name);
      return this;
    }

    public Enumeration build() {
      return new Enumeration(pos, name, valuesByName);
    }
  }
}

// End Enumeration.java
