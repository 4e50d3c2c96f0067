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
import java.util.List;
import net.hydromatic.constraint.ast.Pos;

/** Module-level constant of the meta-model. */
public abstract class Constant {
  public final Pos pos;
  public final String name;

  private Constant(Pos pos, String name) {
    this.pos = requireNonNull(pos);
    this.name = requireNonNull(name);
  }

  /** Creates a constant holding a single primitive value. */
  public static Primitive primitive(
      Pos pos, String name, PrimitiveType aType, Object value) {
    return new Primitive(pos, name, aType, value);
  }

  /**
   * Creates a constant set of primitive values, all of the same type.
   *
   * @throws IllegalArgumentException if a value is not of the given type
   * @see PrimitiveSetLiteral#normalize
   */
  public static SetOfPrimitives setOfPrimitives(
      Pos pos, String name, PrimitiveType aType, List<?> values) {
    final ImmutableList.Builder<PrimitiveSetLiteral> literals =
        ImmutableList.builder();
    for (Object value : values) {
      literals.add(new PrimitiveSetLiteral(value, aType));
    }
    return new SetOfPrimitives(pos, name, aType, literals.build());
  }

  /** Creates a constant set of literals of one enumeration. */
  public static SetOfEnumerationLiterals setOfEnumerationLiterals(
      Pos pos,
      String name,
      Enumeration enumeration,
      List<Enumeration.Literal> literals) {
    return new SetOfEnumerationLiterals(
        pos, name, enumeration, ImmutableList.copyOf(literals));
  }

  @Override
  public String toString() {
    return name;
  }

  /** Constant with a single primitive value. It is not a set. */
  public static class Primitive extends Constant {
    public final PrimitiveType aType;
    public final Object value;

    Primitive(Pos pos, String name, PrimitiveType aType, Object value) {
      super(pos, name);
      this.aType = requireNonNull(aType);
      this.value = PrimitiveSetLiteral.normalize(aType, value);
    }
  }

  /** Constant set of primitive values. */
  public static class SetOfPrimitives extends Constant {
    public final PrimitiveType aType;
    public final ImmutableList<PrimitiveSetLiteral> literals;

    SetOfPrimitives(
        Pos pos,
        String name,
        PrimitiveType aType,
        ImmutableList<PrimitiveSetLiteral> literals) {
      super(pos, name);
      this.aType = requireNonNull(aType);
      this.literals = requireNonNull(literals);
    }
  }

  /** Constant set of literals of one enumeration. */
  public static class SetOfEnumerationLiterals extends Constant {
    public final Enumeration enumeration;
    public final ImmutableList<Enumeration.Literal> literals;

    SetOfEnumerationLiterals(
        Pos pos,
        String name,
        Enumeration enumeration,
        ImmutableList<Enumeration.Literal> literals) {
      super(pos, name);
      this.enumeration = requireNonNull(enumeration);
      this.literals = requireNonNull(literals);
      for (Enumeration.Literal literal : literals) {
        checkArgument(
            literal.enumeration == enumeration,
            "literal %s does not belong to enumeration %s",
            literal,
            enumeration.name);
      }
    }
  }
}

// End Constant.java
