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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>The set of node kinds is closed. Each node has exactly one {@link Op},
 * and code that needs to distinguish kinds of node either switches on {@link
 * AstNode#op} or extends {@link Visitor}.
 */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Reference to a variable or constant, e.g. "{@code self}". */
  public static class Name extends Exp {
    public final String identifier;

    /** Creates a Name. */
    Name(Pos pos, String identifier) {
      super(pos, Op.NAME);
      this.identifier = requireNonNull(identifier);
    }

    @Override
    public int hashCode() {
      return identifier.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Name && identifier.equals(((Name) o).identifier);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(identifier);
    }
  }

  /**
   * Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link Boolean}, {@link Long}, {@link Double} or {@link
   * String}, according to {@link #op}.
   */
  public static class Literal extends Exp {
    @SuppressWarnings("rawtypes")
    public final Comparable value;

    /** Creates a Literal. */
    @SuppressWarnings("rawtypes")
    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && this.value.equals(((Literal) o).value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Member access, e.g. "{@code self.id_short}". */
  public static class Member extends Exp {
    public final Exp instance;
    public final String name;

    Member(Pos pos, Exp instance, String name) {
      super(pos, Op.MEMBER);
      this.instance = requireNonNull(instance);
      this.name = requireNonNull(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      instance.unparse(w, left, op.left);
      return w.append(".").id(name);
    }
  }

  /**
   * Call to a function with positional arguments, e.g. "{@code len(self.x)}"
   * or "{@code is_MIME_type(self.content_type)}".
   */
  public static class FunctionCall extends Exp {
    public final Name name;
    public final ImmutableList<Exp> args;

    FunctionCall(Pos pos, Name name, ImmutableList<Exp> args) {
      super(pos, Op.FUNCTION_CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.call(name.identifier, args);
    }
  }

  /**
   * Comparison of two expressions, e.g. "{@code len(self.x) < 10}".
   *
   * <p>The operator is one of {@link Op#LT}, {@link Op#LE}, {@link Op#GT},
   * {@link Op#GE}, {@link Op#EQ}, {@link Op#NE}.
   */
  public static class Comparison extends Exp {
    public final Exp a0;
    public final Exp a1;

    Comparison(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      checkArgument(op.isComparator(), "not a comparator: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this {@code Comparison} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Comparison copy(Op op, Exp a0, Exp a1) {
      return this.op == op && this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : new Comparison(pos, op, a0, a1);
    }
  }

  /** Membership test, e.g. "{@code self.kind in Valid_kinds}". */
  public static class IsIn extends Exp {
    public final Exp member;
    public final Exp container;

    IsIn(Pos pos, Exp member, Exp container) {
      super(pos, Op.IS_IN);
      this.member = requireNonNull(member);
      this.container = requireNonNull(container);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, member, op, container, right);
    }
  }

  /** Test that a value is absent, e.g. "{@code self.x is None}". */
  public static class IsNone extends Exp {
    public final Exp value;

    IsNone(Pos pos, Exp value) {
      super(pos, Op.IS_NONE);
      this.value = requireNonNull(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, value, op, right);
    }
  }

  /** Test that a value is present, e.g. "{@code self.x is not None}". */
  public static class IsNotNone extends Exp {
    public final Exp value;

    IsNotNone(Pos pos, Exp value) {
      super(pos, Op.IS_NOT_NONE);
      this.value = requireNonNull(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, value, op, right);
    }
  }

  /** Logical negation. */
  public static class Not extends Exp {
    public final Exp operand;

    Not(Pos pos, Exp operand) {
      super(pos, Op.NOT);
      this.operand = requireNonNull(operand);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, operand, right);
    }
  }

  /** Conjunction or disjunction of two or more expressions. */
  public abstract static class Connective extends Exp {
    public final ImmutableList<Exp> values;

    Connective(Pos pos, Op op, ImmutableList<Exp> values) {
      super(pos, op);
      this.values = requireNonNull(values);
      checkArgument(values.size() >= 2, "%s needs at least two values", op);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, values, op, right);
    }
  }

  /** Logical "and". */
  public static class And extends Connective {
    And(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.AND, values);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Logical "or". */
  public static class Or extends Connective {
    Or(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.OR, values);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Logical implication, "{@code antecedent implies consequent}".
   *
   * <p>The meta-model has no implication operator, so this node is written as
   * "{@code not (antecedent) or consequent}".
   */
  public static class Implication extends Exp {
    public final Exp antecedent;
    public final Exp consequent;

    Implication(Pos pos, Exp antecedent, Exp consequent) {
      super(pos, Op.IMPLICATION);
      this.antecedent = requireNonNull(antecedent);
      this.consequent = requireNonNull(consequent);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      w.append("not (").append(antecedent, 0, 0).append(")");
      w.append(op.padded);
      return consequent.unparse(w, op.right, right);
    }
  }
}

// End Ast.java
