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
import static net.hydromatic.constraint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.Op;
import net.hydromatic.constraint.ast.Pos;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.PrimitiveType;
import net.hydromatic.constraint.model.Property;
import net.hydromatic.constraint.model.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link LenInference}. */
public class LenInferenceTest {
  private static final Pos POS = Pos.ZERO;

  private static final TypeAnnotation STR =
      TypeAnnotation.primitive(PrimitiveType.STR);

  /** Creates "{@code len(self.property) op value}". */
  private static Ast.Exp len(String property, Op op, long value) {
    return ast.comparison(
        POS,
        op,
        ast.call(POS, Idioms.LEN, ast.property(POS, property)),
        ast.intLiteral(POS, value));
  }

  /** Creates "{@code len(self) op value}". */
  private static Ast.Exp lenSelf(Op op, long value) {
    return ast.comparison(
        POS,
        op,
        ast.call(POS, Idioms.LEN, ast.self(POS)),
        ast.intLiteral(POS, value));
  }

  private static ConstrainedPrimitive str(
      String name,
      @Nullable ConstrainedPrimitive parent,
      Ast.Exp... invariants) {
    final ConstrainedPrimitive.Builder b =
        ConstrainedPrimitive.builder(POS, name, PrimitiveType.STR);
    if (parent != null) {
      b.inherit(parent);
    }
    for (Ast.Exp invariant : invariants) {
      b.invariant(invariant);
    }
    return b.build();
  }

  @Test
  void testFromInvariants() {
    final ClassType cls =
        ClassType.builder(POS, "Something")
            .property("x", STR)
            .property("y", STR)
            .property("z", STR)
            .invariant(len("x", Op.GE, 1))
            .invariant(
                ast.and(POS, len("x", Op.LT, 10), len("y", Op.EQ, 3)))
            .build();
    final ImmutableMap<Property, LenConstraint> map =
        LenInference.lenConstraintsFromInvariants(cls);
    assertThat(map.size(), is(2));
    assertThat(map.get(cls.property("x")), is(new LenConstraint(1, 9)));
    assertThat(map.get(cls.property("y")), is(new LenConstraint(3, 3)));
  }

  /** Tests that a bound on an optional property is inferred, and that a
   * conditional invariant only bounds the property it is conditional on. */
  @Test
  void testFromConditionalInvariant() {
    final ClassType cls =
        ClassType.builder(POS, "Something")
            .property("x", TypeAnnotation.optional(STR))
            .property("y", STR)
            .invariant(
                ast.implication(
                    POS,
                    ast.isNotNone(POS, ast.property(POS, "x")),
                    ast.and(POS, len("x", Op.LE, 10), len("y", Op.LE, 5))))
            .build();
    final ImmutableMap<Property, LenConstraint> map =
        LenInference.lenConstraintsFromInvariants(cls);
    assertThat(
        map,
        hasToString(
            "{Something.x=LenConstraint(min_value=None, max_value=10)}"));
  }

  /** Tests that "{@code not (self.p is not None) or len(self.p) == 10}"
   * gives the same bound as "{@code len(self.p) == 10}". */
  @Test
  void testConditionalEquivalentToUnconditioned() {
    final ClassType conditioned =
        ClassType.builder(POS, "Something")
            .property("p", TypeAnnotation.optional(STR))
            .invariant(
                ast.or(
                    POS,
                    ast.not(POS, ast.isNotNone(POS, ast.property(POS, "p"))),
                    len("p", Op.EQ, 10)))
            .build();
    final ClassType unconditioned =
        ClassType.builder(POS, "Something")
            .property("p", TypeAnnotation.optional(STR))
            .invariant(len("p", Op.EQ, 10))
            .build();
    final LenConstraint expected = new LenConstraint(10, 10);
    assertThat(
        LenInference.lenConstraintsFromInvariants(conditioned)
            .get(conditioned.property("p")),
        is(expected));
    assertThat(
        LenInference.lenConstraintsFromInvariants(unconditioned)
            .get(unconditioned.property("p")),
        is(expected));
    assertThat(
        expected, hasToString("LenConstraint(min_value=10, max_value=10)"));
  }

  @Test
  void testInheritedInvariantsAreIgnored() {
    final ClassType parent =
        ClassType.builder(POS, "Parent")
            .property("x", STR)
            .invariant(len("x", Op.LT, 10))
            .build();
    final ClassType child =
        ClassType.builder(POS, "Child")
            .inherit(parent)
            .invariant(len("x", Op.GT, 2))
            .build();
    final ImmutableMap<Property, LenConstraint> map =
        LenInference.lenConstraintsFromInvariants(child);
    assertThat(
        map.get(parent.property("x")), is(new LenConstraint(3, null)));
  }

  @Test
  void testConflictingInvariants() {
    final ClassType cls =
        ClassType.builder(POS, "Something")
            .property("x", STR)
            .invariant(len("x", Op.GT, 10))
            .invariant(len("x", Op.LT, 3))
            .build();
    final ConstraintException e =
        assertThrows(
            ConstraintException.class,
            () -> LenInference.lenConstraintsFromInvariants(cls));
    assertThat(
        e.messages(),
        is(
            ImmutableList.of(
                "The property x has conflicting invariants on the length: "
                    + "the minimum length, 11, contradicts the maximum "
                    + "length 2.")));
  }

  @Test
  void testUnknownProperty() {
    final ClassType cls =
        ClassType.builder(POS, "Something")
            .property("x", STR)
            .invariant(ast.and(POS, len("y", Op.LT, 3), len("z", Op.LT, 3)))
            .build();
    final ConstraintException e =
        assertThrows(
            ConstraintException.class,
            () -> LenInference.lenConstraintsFromInvariants(cls));
    assertThat(
        e.messages(),
        is(
            ImmutableList.of(
                "The property y does not appear in the properties of the "
                    + "class Something",
                "The property z does not appear in the properties of the "
                    + "class Something")));
  }

  @Test
  void testErrorPosition() {
    final Pos pos = new Pos("model.py", 7, 5, 7, 20);
    final Ast.Exp tooShort =
        ast.lessThan(
            pos,
            ast.call(pos, Idioms.LEN, ast.property(pos, "x")),
            ast.intLiteral(pos, 1));
    final ClassType cls =
        ClassType.builder(POS, "Something")
            .property("x", STR)
            .invariant(tooShort)
            .invariant(len("x", Op.GE, 5))
            .build();
    final ConstraintException e =
        assertThrows(
            ConstraintException.class,
            () -> LenInference.lenConstraintsFromInvariants(cls));
    assertThat(e.errors, hasSize(1));
    assertThat(e.errors.get(0).pos, is(pos));
  }

  @Test
  void testReduce() {
    final List<String> messages = new ArrayList<>();
    assertThat(
        LenInference.reduce(ImmutableList.of(), messages),
        is(LenConstraint.UNBOUNDED));
    assertThat(
        LenInference.reduce(
            ImmutableList.of(
                bound(Op.GE, 2), bound(Op.EQ, 5), bound(Op.LT, 10)),
            messages),
        is(new LenConstraint(5, 5)));
    assertThat(messages, hasSize(0));

    assertThat(
        LenInference.reduce(
            ImmutableList.of(bound(Op.EQ, 5), bound(Op.EQ, 6)), messages),
        nullValue());
    assertThat(
        messages,
        is(
            ImmutableList.of(
                "The exact length, 5, contradicts another exactly expected "
                    + "length 6.")));

    messages.clear();
    assertThat(
        LenInference.reduce(
            ImmutableList.of(bound(Op.EQ, 5), bound(Op.GT, 6)), messages),
        nullValue());
    assertThat(
        messages,
        is(
            ImmutableList.of(
                "the minimum length, 7, contradicts the exactly expected "
                    + "length 5.")));

    messages.clear();
    assertThat(
        LenInference.reduce(
            ImmutableList.of(bound(Op.LE, 4), bound(Op.EQ, 5)), messages),
        nullValue());
    assertThat(
        messages,
        is(
            ImmutableList.of(
                "the maximum length, 4, contradicts the exactly expected "
                    + "length 5.")));
  }

  private static LengthBound bound(Op op, long value) {
    final LengthBound bound = Idioms.matchLenConstraint(len("x", op, value));
    return requireNonNull(bound);
  }

  @Test
  void testOfSelf() {
    final ConstrainedPrimitive idShort =
        str(
            "Id_short",
            null,
            ast.and(POS, lenSelf(Op.GE, 1), lenSelf(Op.LE, 128)),
            len("x", Op.LT, 3));
    assertThat(
        LenInference.inferLenConstraintOfSelf(idShort),
        is(new LenConstraint(1, 128)));

    final ConstrainedPrimitive child = str("Child", idShort);
    assertThat(
        LenInference.inferLenConstraintOfSelf(child),
        is(LenConstraint.UNBOUNDED));
  }

  @Test
  void testOfSelfConflict() {
    final ConstrainedPrimitive cp =
        str("Bad", null, lenSelf(Op.GT, 5), lenSelf(Op.LT, 5));
    final ConstraintException e =
        assertThrows(
            ConstraintException.class,
            () -> LenInference.inferLenConstraintOfSelf(cp));
    assertThat(
        e.messages(),
        is(
            ImmutableList.of(
                "There are conflicting invariants on the length: the minimum "
                    + "length, 6, contradicts the maximum length 4.")));
  }

  @Test
  void testOfSelfNotLengthable() {
    final ConstrainedPrimitive cp =
        ConstrainedPrimitive.builder(POS, "Positive", PrimitiveType.INT)
            .build();
    assertThrows(
        IllegalArgumentException.class,
        () -> LenInference.inferLenConstraintOfSelf(cp));
  }

  @Test
  void testNarrowByAncestors() {
    final ConstrainedPrimitive parent = str("Parent", null);
    final ConstrainedPrimitive child = str("Child", parent);
    final ConstrainedPrimitive grandchild = str("Grandchild", child);
    final Map<ConstrainedPrimitive, LenConstraint> own =
        ImmutableMap.of(
            parent, new LenConstraint(6, 20),
            child, new LenConstraint(4, 10),
            grandchild, new LenConstraint(null, 30));
    final ImmutableMap<ConstrainedPrimitive, LenConstraint> narrowed =
        LenInference.narrowByAncestors(
            ImmutableList.of(parent, child, grandchild), own);
    assertThat(narrowed.get(parent), is(new LenConstraint(6, 20)));
    assertThat(narrowed.get(child), is(new LenConstraint(6, 10)));
    assertThat(narrowed.get(grandchild), is(new LenConstraint(6, 10)));
  }

  @Test
  void testNarrowByAncestorsUnbounded() {
    final ConstrainedPrimitive parent = str("Parent", null);
    final ConstrainedPrimitive child = str("Child", parent);
    final ConstrainedPrimitive grandchild = str("Grandchild", child);
    final Map<ConstrainedPrimitive, LenConstraint> own =
        ImmutableMap.of(
            parent, LenConstraint.UNBOUNDED,
            child, LenConstraint.UNBOUNDED,
            grandchild, new LenConstraint(null, 8));
    final ImmutableMap<ConstrainedPrimitive, LenConstraint> narrowed =
        LenInference.narrowByAncestors(
            ImmutableList.of(parent, child, grandchild), own);
    assertThat(narrowed.get(parent), is(LenConstraint.UNBOUNDED));
    assertThat(narrowed.get(child), is(LenConstraint.UNBOUNDED));
    assertThat(narrowed.get(grandchild), is(new LenConstraint(null, 8)));
  }

  @Test
  void testNarrowByAncestorsContradiction() {
    final ConstrainedPrimitive parent = str("Parent", null);
    final ConstrainedPrimitive child = str("Child", parent);
    final ConstrainedPrimitive grandchild = str("Grandchild", child);
    final Map<ConstrainedPrimitive, LenConstraint> own =
        ImmutableMap.of(
            parent, new LenConstraint(10, null),
            child, new LenConstraint(null, 5),
            grandchild, LenConstraint.UNBOUNDED);
    final ConstraintException e =
        assertThrows(
            ConstraintException.class,
            () ->
                LenInference.narrowByAncestors(
                    ImmutableList.of(parent, child, grandchild), own));
    // Only the child is reported; the grandchild inherits its error.
    assertThat(
        e.messages(),
        is(
            ImmutableList.of(
                "The length constraint of the constrained primitive Child "
                    + "contradicts the constraints of its ancestors: "
                    + "minimum = 10, maximum = 5")));
  }

  @Test
  void testNarrowByAncestorsRequiresParentsFirst() {
    final ConstrainedPrimitive parent = str("Parent", null);
    final ConstrainedPrimitive child = str("Child", parent);
    final Map<ConstrainedPrimitive, LenConstraint> own =
        ImmutableMap.of(
            parent, LenConstraint.UNBOUNDED, child, LenConstraint.UNBOUNDED);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            LenInference.narrowByAncestors(
                ImmutableList.of(child, parent), own));
  }
}

// End LenInferenceTest.java
