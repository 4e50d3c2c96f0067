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

import static net.hydromatic.constraint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.Op;
import net.hydromatic.constraint.ast.Pos;
import net.hydromatic.constraint.model.PatternVerification;
import net.hydromatic.constraint.model.Verification;
import org.junit.jupiter.api.Test;

/** Tests for {@link Idioms}. */
public class IdiomsTest {
  private static final Pos POS = Pos.ZERO;

  private static Ast.Exp lenOf(String property) {
    return ast.call(POS, Idioms.LEN, ast.property(POS, property));
  }

  private static Ast.Exp lenOfSelf() {
    return ast.call(POS, Idioms.LEN, ast.self(POS));
  }

  private static Ast.Exp i(long value) {
    return ast.intLiteral(POS, value);
  }

  private static Ast.Exp isNotNone(String property) {
    return ast.isNotNone(POS, ast.property(POS, property));
  }

  /** Returns the bound of "{@code len(self.x) op value}" as a string. */
  private static String bound(Op op, long value) {
    final LengthBound bound =
        Idioms.matchLenConstraint(
            ast.comparison(POS, op, lenOf("x"), i(value)));
    return String.valueOf(bound);
  }

  /** Returns the bound of "{@code value op len(self.x)}" as a string. */
  private static String flippedBound(Op op, long value) {
    final LengthBound bound =
        Idioms.matchLenConstraint(
            ast.comparison(POS, op, i(value), lenOf("x")));
    return String.valueOf(bound);
  }

  @Test
  void testMatchLenConstraint() {
    assertThat(bound(Op.LT, 10), is("MAX(9)"));
    assertThat(bound(Op.LE, 10), is("MAX(10)"));
    assertThat(bound(Op.EQ, 10), is("EXACT(10)"));
    assertThat(bound(Op.GT, 10), is("MIN(11)"));
    assertThat(bound(Op.GE, 10), is("MIN(10)"));
    assertThat(bound(Op.NE, 10), is("null"));
  }

  /** Tests that "{@code 10 > len(self.x)}" means the same as
   * "{@code len(self.x) < 10}". */
  @Test
  void testMatchLenConstraintFlipped() {
    assertThat(flippedBound(Op.GT, 10), is("MAX(9)"));
    assertThat(flippedBound(Op.GE, 10), is("MAX(10)"));
    assertThat(flippedBound(Op.EQ, 10), is("EXACT(10)"));
    assertThat(flippedBound(Op.LT, 10), is("MIN(11)"));
    assertThat(flippedBound(Op.LE, 10), is("MIN(10)"));
    assertThat(flippedBound(Op.NE, 10), is("null"));
    for (Op op : ImmutableList.of(Op.LT, Op.LE, Op.EQ, Op.GT, Op.GE)) {
      assertThat(flippedBound(op.reverse(), 42), is(bound(op, 42)));
    }
  }

  @Test
  void testMatchLenConstraintTarget() {
    final LengthBound onProperty =
        Idioms.matchLenConstraint(ast.lessThan(POS, lenOf("x"), i(5)));
    assertThat(onProperty, notNullValue());
    assertThat(onProperty.propertyName(), is("x"));
    assertThat(onProperty.isOnSelf(), is(false));

    final Ast.Comparison comparison = ast.lessThan(POS, lenOfSelf(), i(5));
    final LengthBound onSelf = Idioms.matchLenConstraint(comparison);
    assertThat(onSelf, notNullValue());
    assertThat(onSelf.propertyName(), nullValue());
    assertThat(onSelf.isOnSelf(), is(true));
    assertThat(onSelf.node, sameInstance(comparison));
  }

  /** Tests that expressions that are almost, but not quite, a bound on a
   * length do not match, and do not throw. */
  @Test
  void testMatchLenConstraintNoMatch() {
    // Bound does not fit in an int.
    assertThat(bound(Op.LT, 3_000_000_000L), is("null"));
    assertThat(bound(Op.GT, Integer.MAX_VALUE), is("null"));
    assertThat(bound(Op.LE, Integer.MAX_VALUE), is("MAX(2147483647)"));

    // "len" with the wrong number of arguments.
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(POS, ast.call(POS, Idioms.LEN), i(5))),
        nullValue());
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(
                POS,
                ast.call(
                    POS,
                    Idioms.LEN,
                    ast.property(POS, "x"),
                    ast.property(POS, "y")),
                i(5))),
        nullValue());

    // "len" of something other than self or a property of self.
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(
                POS, ast.call(POS, Idioms.LEN, ast.name(POS, "x")), i(5))),
        nullValue());
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(
                POS,
                ast.call(
                    POS,
                    Idioms.LEN,
                    ast.member(POS, ast.property(POS, "x"), "y")),
                i(5))),
        nullValue());

    // Another function, a non-integer literal, two lengths, not a comparison.
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(
                POS, ast.call(POS, "size", ast.property(POS, "x")), i(5))),
        nullValue());
    assertThat(
        Idioms.matchLenConstraint(
            ast.lessThan(POS, lenOf("x"), ast.floatLiteral(POS, 5.0))),
        nullValue());
    assertThat(
        Idioms.matchLenConstraint(ast.lessThan(POS, lenOf("x"), lenOf("y"))),
        nullValue());
    assertThat(Idioms.matchLenConstraint(lenOf("x")), nullValue());
  }

  @Test
  void testMatchConditionalOnProperty() {
    final Ast.Exp consequent = ast.lessThan(POS, lenOf("x"), i(5));

    final Idioms.ConditionalOnProperty implication =
        Idioms.matchConditionalOnProperty(
            ast.implication(POS, isNotNone("x"), consequent));
    assertThat(implication, notNullValue());
    assertThat(implication.propertyName, is("x"));
    assertThat(implication.consequent, sameInstance(consequent));

    final Idioms.ConditionalOnProperty notOr =
        Idioms.matchConditionalOnProperty(
            ast.or(POS, ast.not(POS, isNotNone("y")), consequent));
    assertThat(notOr, notNullValue());
    assertThat(notOr.propertyName, is("y"));
    assertThat(notOr.consequent, sameInstance(consequent));

    final Idioms.ConditionalOnProperty isNoneOr =
        Idioms.matchConditionalOnProperty(
            ast.or(
                POS, ast.isNone(POS, ast.property(POS, "z")), consequent));
    assertThat(isNoneOr, notNullValue());
    assertThat(isNoneOr.propertyName, is("z"));
    assertThat(isNoneOr.consequent, sameInstance(consequent));
  }

  @Test
  void testMatchConditionalOnPropertyNoMatch() {
    final Ast.Exp consequent = ast.lessThan(POS, lenOf("x"), i(5));

    // An "or" with three values.
    assertThat(
        Idioms.matchConditionalOnProperty(
            ast.or(
                POS,
                ast.isNone(POS, ast.property(POS, "x")),
                consequent,
                consequent)),
        nullValue());
    // The antecedent is not a test on a property.
    assertThat(
        Idioms.matchConditionalOnProperty(
            ast.implication(
                POS, ast.isNotNone(POS, ast.name(POS, "x")), consequent)),
        nullValue());
    assertThat(
        Idioms.matchConditionalOnProperty(
            ast.or(POS, ast.not(POS, lenOf("x")), consequent)),
        nullValue());
    // Not in the first position.
    assertThat(
        Idioms.matchConditionalOnProperty(
            ast.or(POS, consequent, ast.isNone(POS, ast.property(POS, "x")))),
        nullValue());
    assertThat(Idioms.matchConditionalOnProperty(consequent), nullValue());
  }

  @Test
  void testMatchPropertyInNamedContainer() {
    final Idioms.PropertyInNamedContainer match =
        Idioms.matchPropertyInNamedContainer(
            ast.isIn(
                POS, ast.property(POS, "unit"), ast.name(POS, "Valid_units")));
    assertThat(match, notNullValue());
    assertThat(match.propertyName, is("unit"));
    assertThat(match.containerName, is("Valid_units"));

    assertThat(
        Idioms.matchPropertyInNamedContainer(
            ast.isIn(
                POS,
                ast.property(POS, "unit"),
                ast.property(POS, "valid_units"))),
        nullValue());
    assertThat(
        Idioms.matchPropertyInNamedContainer(
            ast.isIn(
                POS, ast.name(POS, "unit"), ast.name(POS, "Valid_units"))),
        nullValue());
  }

  @Test
  void testMatchPattern() {
    final List<Verification> verifications =
        ImmutableList.of(
            new PatternVerification(POS, "is_id", "^[a-z]+$"),
            new Verification(POS, "is_xml"));
    final PatternVerificationsByName registry =
        PatternVerificationsByName.of(verifications);
    assertThat(registry.size(), is(1));
    assertThat(registry, hasToString("[is_id]"));

    final Idioms.PatternOnProperty onProperty =
        Idioms.matchPatternOnProperty(
            ast.call(POS, "is_id", ast.property(POS, "x")), registry);
    assertThat(onProperty, notNullValue());
    assertThat(onProperty.propertyName, is("x"));
    assertThat(onProperty.constraint.pattern, is("^[a-z]+$"));

    // Registered function, wrong target.
    assertThat(
        Idioms.matchPatternOnProperty(
            ast.call(POS, "is_id", ast.self(POS)), registry),
        nullValue());
    // Verification function that is not a pattern.
    assertThat(
        Idioms.matchPatternOnProperty(
            ast.call(POS, "is_xml", ast.property(POS, "x")), registry),
        nullValue());

    final PatternConstraint onSelf =
        Idioms.matchPatternOnSelf(
            ast.call(POS, "is_id", ast.self(POS)), registry);
    assertThat(onSelf, is(new PatternConstraint("^[a-z]+$")));
    assertThat(
        Idioms.matchPatternOnSelf(
            ast.call(POS, "is_unknown", ast.self(POS)), registry),
        nullValue());
    assertThat(
        Idioms.matchPatternOnSelf(
            ast.call(POS, "is_id", ast.self(POS), ast.self(POS)), registry),
        nullValue());
  }

  @Test
  void testConjuncts() {
    final Ast.Exp a = ast.lessThan(POS, lenOf("a"), i(1));
    final Ast.Exp b = ast.lessThan(POS, lenOf("b"), i(2));
    final Ast.Exp c = ast.lessThan(POS, lenOf("c"), i(3));
    final Ast.Exp d = ast.lessThan(POS, lenOf("d"), i(4));

    assertThat(Idioms.conjuncts(a), is(ImmutableList.of(a)));
    final List<Ast.Exp> conjuncts =
        Idioms.conjuncts(ast.and(POS, a, ast.and(POS, b, c), d));
    assertThat(conjuncts, hasSize(4));
    assertThat(conjuncts.get(0), sameInstance(a));
    assertThat(conjuncts.get(1), sameInstance(b));
    assertThat(conjuncts.get(2), sameInstance(c));
    assertThat(conjuncts.get(3), sameInstance(d));

    // An "or" is a single conjunct, even if it contains an "and".
    final Ast.Exp or = ast.or(POS, a, ast.and(POS, b, c));
    assertThat(Idioms.conjuncts(or), hasSize(1));
  }

  @Test
  void testMatchOnProperties() {
    final Ast.Exp x = ast.lessThan(POS, lenOf("x"), i(10));
    final Ast.Exp y = ast.greaterThan(POS, lenOf("y"), i(2));
    final Ast.Exp self = ast.greaterThan(POS, lenOfSelf(), i(2));

    // Unconditional: every match on a property.
    assertThat(
        Idioms.matchOnProperties(
            ast.and(POS, x, y, self),
            Idioms::matchLenConstraint,
            LengthBound::propertyName),
        hasToString("[MAX(9), MIN(3)]"));

    // Conditional on "x": only matches on "x".
    assertThat(
        Idioms.matchOnProperties(
            ast.implication(POS, isNotNone("x"), ast.and(POS, x, y)),
            Idioms::matchLenConstraint,
            LengthBound::propertyName),
        hasToString("[MAX(9)]"));
    assertThat(
        Idioms.matchOnProperties(
            ast.or(POS, ast.isNone(POS, ast.property(POS, "y")), x),
            Idioms::matchLenConstraint,
            LengthBound::propertyName),
        hasToString("[]"));
  }
}

// End IdiomsTest.java
