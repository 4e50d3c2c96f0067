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

import static net.hydromatic.constraint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the expression tree of invariants. */
public class AstTest {
  private static final Pos POS = Pos.ZERO;

  private static Ast.Member prop(String name) {
    return ast.property(POS, name);
  }

  private static Ast.Literal i(long value) {
    return ast.intLiteral(POS, value);
  }

  @Test
  void testUnparseAtoms() {
    assertThat(ast.self(POS), hasToString("self"));
    assertThat(prop("id_short"), hasToString("self.id_short"));
    assertThat(i(42), hasToString("42"));
    assertThat(ast.floatLiteral(POS, 1.5), hasToString("1.5"));
    assertThat(ast.boolLiteral(POS, true), hasToString("True"));
    assertThat(ast.boolLiteral(POS, false), hasToString("False"));
    assertThat(ast.stringLiteral(POS, "a\"b"), hasToString("\"a\\\"b\""));
    assertThat(
        ast.call(POS, "len", prop("value")), hasToString("len(self.value)"));
    assertThat(
        ast.call(POS, "matches", prop("a"), ast.stringLiteral(POS, "x")),
        hasToString("matches(self.a, \"x\")"));
  }

  @Test
  void testUnparseOperators() {
    final Ast.Exp lenX = ast.call(POS, "len", prop("x"));
    assertThat(ast.lessThan(POS, lenX, i(10)), hasToString("len(self.x) < 10"));
    assertThat(
        ast.greaterThanOrEqual(POS, i(1), lenX),
        hasToString("1 >= len(self.x)"));
    assertThat(ast.isNone(POS, prop("x")), hasToString("self.x is None"));
    assertThat(
        ast.isNotNone(POS, prop("x")), hasToString("self.x is not None"));
    assertThat(
        ast.isIn(POS, prop("kind"), ast.name(POS, "Valid_kinds")),
        hasToString("self.kind in Valid_kinds"));
    assertThat(
        ast.or(POS, ast.isNone(POS, prop("x")), ast.lessThan(POS, lenX, i(10))),
        hasToString("self.x is None or len(self.x) < 10"));
    assertThat(
        ast.implication(
            POS,
            ast.isNotNone(POS, prop("x")),
            ast.lessThan(POS, lenX, i(10))),
        hasToString("not (self.x is not None) or len(self.x) < 10"));
    assertThat(
        ast.or(
            POS,
            ast.not(POS, ast.isNotNone(POS, prop("x"))),
            ast.equal(POS, lenX, i(3))),
        hasToString("not self.x is not None or len(self.x) == 3"));
  }

  /** Tests that parentheses are added only where precedence requires. */
  @Test
  void testUnparsePrecedence() {
    final Ast.Exp a = ast.name(POS, "a");
    final Ast.Exp b = ast.name(POS, "b");
    final Ast.Exp c = ast.name(POS, "c");
    assertThat(ast.or(POS, a, ast.and(POS, b, c)), hasToString("a or b and c"));
    assertThat(
        ast.and(POS, a, ast.or(POS, b, c)), hasToString("a and (b or c)"));
    assertThat(
        ast.not(POS, ast.and(POS, a, b)), hasToString("not (a and b)"));
    assertThat(ast.and(POS, a, b, c), hasToString("a and b and c"));
  }

  @Test
  void testConnectiveNeedsTwoValues() {
    final Ast.Exp a = ast.name(POS, "a");
    assertThrows(
        IllegalArgumentException.class,
        () -> ast.and(POS, ImmutableList.of(a)));
  }

  @Test
  void testComparisonCopy() {
    final Ast.Comparison c =
        ast.lessThan(POS, ast.call(POS, "len", prop("x")), i(10));
    assertThat(c.copy(c.op, c.a0, c.a1), sameInstance(c));
    final Ast.Comparison c2 = c.copy(Op.GT, c.a1, c.a0);
    assertThat(c2, hasToString("10 > len(self.x)"));
  }

  /** Reversing a comparator twice gives the original comparator. */
  @Test
  void testReverse() {
    for (Op op : Op.values()) {
      if (op.isComparator()) {
        assertThat(op.reverse().reverse(), is(op));
      }
    }
    assertThat(Op.LT.reverse(), is(Op.GT));
    assertThat(Op.LE.reverse(), is(Op.GE));
    assertThat(Op.EQ.reverse(), is(Op.EQ));
    assertThat(Op.NE.reverse(), is(Op.NE));
    assertThrows(AssertionError.class, Op.AND::reverse);
  }

  @Test
  void testVisitor() {
    final Ast.Exp exp =
        ast.and(
            POS,
            ast.lessThan(POS, ast.call(POS, "len", prop("x")), i(10)),
            ast.isIn(POS, prop("y"), ast.name(POS, "Ys")));
    final List<String> names = new ArrayList<>();
    exp.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Name name) {
            names.add(name.identifier);
          }
        });
    assertThat(names, hasToString("[len, self, self, Ys]"));
  }

  @Test
  void testPos() {
    final Pos p1 = new Pos("model.py", 3, 5, 3, 20);
    final Pos p2 = new Pos("model.py", 4, 1, 4, 10);
    assertThat(p1, hasToString("model.py:3.5-3.20"));
    assertThat(p1.plus(p2), hasToString("model.py:3.5-4.10"));
    assertThat(p2.plus(p1), hasToString("model.py:3.5-4.10"));
    assertThat(p1.plus(Pos.ZERO), sameInstance(p1));
    assertThat(
        Pos.sum(ImmutableList.of(ast.name(p2, "a"), ast.name(p1, "b"))),
        is(p1.plus(p2)));
    assertThat(Pos.sum(ImmutableList.of(ast.name(POS, "a"))), is(Pos.ZERO));
  }

  /** Tests that positions in different files are different. */
  @Test
  void testPosFile() {
    final Pos p1 = new Pos("model.py", 3, 5, 3, 20);
    final Pos p2 = new Pos("other.py", 3, 5, 3, 20);
    assertThat(p1.equals(p2), is(false));
    assertThat(p1.equals(new Pos("model.py", 3, 5, 3, 20)), is(true));

    // Line 0, column 0 of a named file is a real position, not ZERO.
    final Pos start = new Pos("other.py", 0, 0, 0, 0);
    assertThat(start.equals(Pos.ZERO), is(false));
    assertThat(Pos.ZERO.plus(start), sameInstance(start));
  }
}

// End AstTest.java
