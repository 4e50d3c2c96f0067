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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** The name of the receiver of an invariant. */
  public static final String SELF = "self";

  /** Creates a name. */
  public Ast.Name name(Pos pos, String identifier) {
    return new Ast.Name(pos, identifier);
  }

  /** Creates a reference to "{@code self}". */
  public Ast.Name self(Pos pos) {
    return new Ast.Name(pos, SELF);
  }

  /** Creates a member access, e.g. "{@code instance.name}". */
  public Ast.Member member(Pos pos, Ast.Exp instance, String name) {
    return new Ast.Member(pos, instance, name);
  }

  /** Creates a reference to a property, "{@code self.name}". */
  public Ast.Member property(Pos pos, String name) {
    return member(pos, self(pos), name);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal floatLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a call to a function. */
  public Ast.FunctionCall call(Pos pos, String name, List<Ast.Exp> args) {
    return new Ast.FunctionCall(
        pos, name(pos, name), ImmutableList.copyOf(args));
  }

  /** Creates a call to a function. */
  public Ast.FunctionCall call(Pos pos, String name, Ast.Exp... args) {
    return call(pos, name, ImmutableList.copyOf(args));
  }

  /** Creates a comparison. */
  public Ast.Comparison comparison(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.Comparison(pos, op, a0, a1);
  }

  public Ast.Comparison lessThan(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.LT, a0, a1);
  }

  public Ast.Comparison lessThanOrEqual(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.LE, a0, a1);
  }

  public Ast.Comparison greaterThan(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.GT, a0, a1);
  }

  public Ast.Comparison greaterThanOrEqual(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.GE, a0, a1);
  }

  public Ast.Comparison equal(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.EQ, a0, a1);
  }

  public Ast.Comparison notEqual(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return comparison(pos, Op.NE, a0, a1);
  }

  /** Creates a membership test, "{@code member in container}". */
  public Ast.IsIn isIn(Pos pos, Ast.Exp member, Ast.Exp container) {
    return new Ast.IsIn(pos, member, container);
  }

  public Ast.IsNone isNone(Pos pos, Ast.Exp value) {
    return new Ast.IsNone(pos, value);
  }

  public Ast.IsNotNone isNotNone(Pos pos, Ast.Exp value) {
    return new Ast.IsNotNone(pos, value);
  }

  public Ast.Not not(Pos pos, Ast.Exp operand) {
    return new Ast.Not(pos, operand);
  }

  /** Creates a conjunction of two or more expressions. */
  public Ast.And and(Pos pos, List<Ast.Exp> values) {
    return new Ast.And(pos, ImmutableList.copyOf(values));
  }

  /** Creates a conjunction of two or more expressions. */
  public Ast.And and(Pos pos, Ast.Exp... values) {
    return and(pos, ImmutableList.copyOf(values));
  }

  /** Creates a disjunction of two or more expressions. */
  public Ast.Or or(Pos pos, List<Ast.Exp> values) {
    return new Ast.Or(pos, ImmutableList.copyOf(values));
  }

  /** Creates a disjunction of two or more expressions. */
  public Ast.Or or(Pos pos, Ast.Exp... values) {
    return or(pos, ImmutableList.copyOf(values));
  }

  /** Creates an implication, "{@code not (antecedent) or consequent}". */
  public Ast.Implication implication(
      Pos pos, Ast.Exp antecedent, Ast.Exp consequent) {
    return new Ast.Implication(pos, antecedent, consequent);
  }
}

// End AstBuilder.java
