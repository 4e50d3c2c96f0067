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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.constraint.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Hierarchy} and {@link SymbolTable}. */
public class HierarchyTest {
  private static final Pos POS = Pos.ZERO;

  private static final TypeAnnotation STR =
      TypeAnnotation.primitive(PrimitiveType.STR);

  private final ClassType a = ClassType.builder(POS, "A").build();
  private final ClassType b = ClassType.builder(POS, "B").inherit(a).build();
  private final ClassType c = ClassType.builder(POS, "C").build();
  private final ClassType d =
      ClassType.builder(POS, "D").inherit(b).inherit(c).build();

  @Test
  void testSortIsStable() {
    final List<Symbol> sorted = ImmutableList.of(a, c, b, d);
    assertThat(Hierarchy.topologicallySort(sorted), is(sorted));
  }

  @Test
  void testSortMovesParentsFirst() {
    assertThat(
        Hierarchy.topologicallySort(ImmutableList.of(d, c, b, a)),
        hasToString("[A, B, C, D]"));
    assertThat(
        Hierarchy.topologicallySort(ImmutableList.of(c, b, a, d)),
        hasToString("[C, A, B, D]"));
  }

  @Test
  void testSortMissingParent() {
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Hierarchy.topologicallySort(ImmutableList.of(b, d, c)));
    assertThat(
        e.getMessage(), is("parent A of B is not among the symbols"));
  }

  @Test
  void testSortDuplicate() {
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Hierarchy.topologicallySort(ImmutableList.of(a, b, a)));
    assertThat(e.getMessage(), is("duplicate symbol A"));
  }

  @Test
  void testSymbolTable() {
    final Enumeration units =
        Enumeration.builder(POS, "Units").literal("M", "m").build();
    final ConstrainedPrimitive nonEmpty =
        ConstrainedPrimitive.builder(POS, "Non_empty", PrimitiveType.STR)
            .build();
    final ClassType e =
        ClassType.builder(POS, "E")
            .inherit(a)
            .property("unit", TypeAnnotation.our(units))
            .property("name", TypeAnnotation.our(nonEmpty))
            .property("comment", STR)
            .build();
    final Constant constant =
        Constant.setOfEnumerationLiterals(
            POS, "Lengths", units, units.literals);
    final SymbolTable symbolTable =
        SymbolTable.create(
            Hierarchy.topologicallySort(
                ImmutableList.of(e, units, nonEmpty, a)),
            ImmutableList.of(constant),
            ImmutableList.of(
                new Verification(POS, "is_lower"),
                new PatternVerification(POS, "matches_id", "^[a-z]+$")));

    assertThat(symbolTable.symbols, hasToString("[A, E, Units, Non_empty]"));
    assertThat(symbolTable.classes(), hasToString("[A, E]"));
    assertThat(
        symbolTable.constrainedPrimitives(), hasToString("[Non_empty]"));
    assertThat(symbolTable.enumerations(), hasToString("[Units]"));
    assertThat(symbolTable.find("E"), sameInstance(e));
    assertThat(symbolTable.find("F"), nullValue());
    assertThat(symbolTable.mustFind("Units"), sameInstance(units));
    assertThrows(
        IllegalArgumentException.class, () -> symbolTable.mustFind("F"));
    assertThat(symbolTable.constant("Lengths"), sameInstance(constant));
    assertThat(symbolTable.constant("Widths"), nullValue());
    assertThat(
        symbolTable.verifications, hasToString("[is_lower, matches_id]"));
  }

  @Test
  void testSymbolTableRejectsUnsortedSymbols() {
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                SymbolTable.create(
                    ImmutableList.of(b, a),
                    ImmutableList.of(),
                    ImmutableList.of()));
    assertThat(e.getMessage(), containsString("B precedes its parent A"));
  }

  @Test
  void testSymbolTableRejectsDuplicateNames() {
    final ClassType a2 = ClassType.builder(POS, "A").build();
    assertThrows(
        IllegalArgumentException.class,
        () ->
            SymbolTable.create(
                ImmutableList.of(a, a2),
                ImmutableList.of(),
                ImmutableList.of()));
  }
}

// End HierarchyTest.java
