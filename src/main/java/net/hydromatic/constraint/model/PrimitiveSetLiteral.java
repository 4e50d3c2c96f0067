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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * Member of a constant set of primitive values.
 *
 * <p>The value is held in one canonical Java type per primitive type, so that
 * literals compare equal exactly when their values do:
 *
 * <ul>
 * <li>{@link PrimitiveType#BOOL}: {@link Boolean};
 * <li>{@link PrimitiveType#INT}: {@link Long};
 * <li>{@link PrimitiveType#FLOAT}: {@link Double};
 * <li>{@link PrimitiveType#STR}: {@link String};
 * <li>{@link PrimitiveType#BYTEARRAY}: {@code ImmutableList<Byte>}.
 * </ul>
 */
public class PrimitiveSetLiteral {
  public final Object value;
  public final PrimitiveType aType;

  /**
   * Creates a PrimitiveSetLiteral.
   *
   * @throws IllegalArgumentException if the value cannot represent a value of
   *     the given type
   */
  public PrimitiveSetLiteral(Object value, PrimitiveType aType) {
    this.aType = requireNonNull(aType);
    this.value = normalize(aType, value);
  }

  /**
   * Converts a value to the canonical representation of a primitive type.
   *
   * <p>An integer of any width becomes a {@link Long}, a {@link Float} becomes
   * a {@link Double}, and a byte array, {@link ByteBuffer} or list of bytes
   * becomes an immutable list of bytes.
   *
   * @throws IllegalArgumentException if the value cannot represent a value of
   *     the given type
   */
  public static Object normalize(PrimitiveType aType, Object value) {
    requireNonNull(value, "value");
    switch (aType) {
      case BOOL:
        if (value instanceof Boolean) {
          return value;
        }
        break;
      case INT:
        if (value instanceof Long) {
          return value;
        }
        if (value instanceof Integer
            || value instanceof Short
            || value instanceof Byte) {
          return ((Number) value).longValue();
        }
        break;
      case FLOAT:
        if (value instanceof Double) {
          return value;
        }
        if (value instanceof Float) {
          return ((Float) value).doubleValue();
        }
        break;
      case STR:
        if (value instanceof String) {
          return value;
        }
        break;
      case BYTEARRAY:
        if (value instanceof byte[]) {
          return ImmutableList.copyOf(Bytes.asList((byte[]) value));
        }
        if (value instanceof ByteBuffer) {
          final ByteBuffer buffer = ((ByteBuffer) value).duplicate();
          final byte[] bytes = new byte[buffer.remaining()];
          buffer.get(bytes);
          return ImmutableList.copyOf(Bytes.asList(bytes));
        }
        if (value instanceof List
            && ((List<?>) value).stream().allMatch(b -> b instanceof Byte)) {
          return ImmutableList.copyOf((List<?>) value);
        }
        break;
      default:
        throw new AssertionError(aType);
    }
    throw new IllegalArgumentException(
        "value " + value + " of " + value.getClass()
            + " is not a valid " + aType.moniker);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, aType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PrimitiveSetLiteral
            && value.equals(((PrimitiveSetLiteral) o).value)
            && aType == ((PrimitiveSetLiteral) o).aType;
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}

// End PrimitiveSetLiteral.java
