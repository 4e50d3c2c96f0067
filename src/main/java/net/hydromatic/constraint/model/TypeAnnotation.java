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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type of a property.
 *
 * <p>A type annotation is a primitive type, a reference to a symbol, a list,
 * or an optional wrapper around any of those.
 */
public abstract class TypeAnnotation {
  private TypeAnnotation() {}

  /** Creates an annotation of a primitive type. */
  public static Primitive primitive(PrimitiveType primitiveType) {
    return new Primitive(primitiveType);
  }

  /** Creates an annotation that references a symbol. */
  public static Our our(Symbol symbol) {
    return new Our(symbol);
  }

  /** Creates an annotation of a list. */
  public static ListOf listOf(TypeAnnotation items) {
    return new ListOf(items);
  }

  /** Creates an annotation of an optional value. */
  public static OptionalOf optional(TypeAnnotation value) {
    return new OptionalOf(value);
  }

  /**
   * Returns the annotation beneath any number of {@link OptionalOf} wrappers.
   *
   * <p>For example, {@code beneathOptional(Optional[Optional[str]])} returns
   * {@code str}.
   */
  public TypeAnnotation beneathOptional() {
    TypeAnnotation type = this;
    while (type instanceof OptionalOf) {
      type = ((OptionalOf) type).value;
    }
    return type;
  }

  /**
   * Returns the primitive type that values of this annotation hold, or null.
   *
   * <p>A primitive annotation returns its type, and a reference to a
   * constrained primitive returns the constrainee. Everything else, including
   * an optional, returns null.
   */
  public @Nullable PrimitiveType tryPrimitiveType() {
    return null;
  }

  /** Annotation of a primitive type, e.g. "{@code str}". */
  public static class Primitive extends TypeAnnotation {
    public final PrimitiveType primitiveType;

    Primitive(PrimitiveType primitiveType) {
      this.primitiveType = requireNonNull(primitiveType);
    }

    @Override
    public PrimitiveType tryPrimitiveType() {
      return primitiveType;
    }

    @Override
    public String toString() {
      return primitiveType.moniker;
    }
  }

  /** Annotation that references a symbol, e.g. "{@code Id_short}". */
  public static class Our extends TypeAnnotation {
    public final Symbol symbol;

    Our(Symbol symbol) {
      this.symbol = requireNonNull(symbol);
    }

    @Override
    public @Nullable PrimitiveType tryPrimitiveType() {
      return symbol instanceof ConstrainedPrimitive
          ? ((ConstrainedPrimitive) symbol).constrainee
          : null;
    }

    @Override
    public String toString() {
      return symbol.name;
    }
  }

  /** Annotation of a list, e.g. "{@code List[Key]}". */
  public static class ListOf extends TypeAnnotation {
    public final TypeAnnotation items;

    ListOf(TypeAnnotation items) {
      this.items = requireNonNull(items);
    }

    @Override
    public String toString() {
      return "List[" + items + "]";
    }
  }

  /** Annotation of an optional value, e.g. "{@code Optional[str]}". */
  public static class OptionalOf extends TypeAnnotation {
    public final TypeAnnotation value;

    OptionalOf(TypeAnnotation value) {
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return "Optional[" + value + "]";
    }
  }
}

// End TypeAnnotation.java
