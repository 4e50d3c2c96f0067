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
package net.hydromatic.constraint.ast;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  NAME(true),
  MEMBER(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),

  FUNCTION_CALL(true),

  // comparisons
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  IS_IN(" in ", 4),
  IS_NONE(" is None", 4),
  IS_NOT_NONE(" is not None", 4),

  // boolean connectives
  NOT("not ", 3),
  AND(" and ", 2),
  OR(" or ", 1),
  /** "a implies b"; written as "not (a) or b". */
  IMPLICATION(" or ", 1);

  /** Padded name, e.g. " and ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is one of the six ordering/equality comparators. */
  public boolean isComparator() {
    switch (this) {
      case LT:
      case LE:
      case GT:
      case GE:
      case EQ:
      case NE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the comparator that gives the same result when its operands are
   * swapped.
   *
   * <p>For example, "{@code 10 < x}" is equivalent to "{@code x > 10}", so the
   * reverse of {@link #LT} is {@link #GT}.
   */
  public Op reverse() {
    switch (this) {
      case LT:
        return GT;
      case LE:
        return GE;
      case GT:
        return LT;
      case GE:
        return LE;
      case EQ:
      case NE:
        return this;
      default:
        throw new AssertionError("not a comparator: " + this);
    }
  }
}

// End Op.java
