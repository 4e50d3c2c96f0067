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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.constraint.util.Static.skip;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.Constant;
import net.hydromatic.constraint.model.Enumeration;
import net.hydromatic.constraint.model.Invariant;
import net.hydromatic.constraint.model.PrimitiveSetLiteral;
import net.hydromatic.constraint.model.Property;
import net.hydromatic.constraint.model.SymbolTable;
import net.hydromatic.constraint.model.TypeAnnotation;

/**
 * Infers the constant sets that properties must belong to, from invariants
 * such as "{@code self.category in Valid_categories}".
 */
public abstract class SetInference {
  private SetInference() {}

  /**
   * Infers the set constraints on each property of a class, from the
   * invariants declared on the class itself.
   *
   * <p>If a property must belong to several sets, its constraint is their
   * intersection. A container that is not a known constant, or is a constant
   * that is not a set, is ignored.
   *
   * @throws ConstraintException if an invariant refers to a property the class
   *     does not have, or the type of a property does not match the set
   */
  public static SetConstraintsByProperty inferSetConstraintsByProperty(
      ClassType cls, SymbolTable symbolTable) {
    final List<ConstraintError> errors = new ArrayList<>();
    final Map<Property, List<SetOfPrimitivesConstraint>> primitiveSets =
        new LinkedHashMap<>();
    final Map<Property, List<SetOfEnumerationLiteralsConstraint>>
        enumerationSets = new LinkedHashMap<>();

    for (Invariant invariant : cls.invariants) {
      if (invariant.specifiedFor != cls) {
        continue;
      }
      final List<Idioms.PropertyInNamedContainer> matches =
          Idioms.matchOnProperties(
              invariant.body,
              Idioms::matchPropertyInNamedContainer,
              match -> match.propertyName);
      for (Idioms.PropertyInNamedContainer match : matches) {
        final Property property = cls.property(match.propertyName);
        if (property == null) {
          errors.add(
              new ConstraintError(
                  format(
                      "The property '%s' does not belong to the class '%s'",
                      match.propertyName, cls.name),
                  match.node.member.pos));
          continue;
        }

        final Constant constant = symbolTable.constant(match.containerName);
        if (constant == null || constant instanceof Constant.Primitive) {
          continue;
        }

        final TypeAnnotation type = property.typeAnnotation.beneathOptional();
        if (constant instanceof Constant.SetOfPrimitives) {
          final Constant.SetOfPrimitives set =
              (Constant.SetOfPrimitives) constant;
          if (type.tryPrimitiveType() != set.aType) {
            errors.add(
                new ConstraintError(
                    format(
                        "The container is a constant set of %s's while the "
                            + "property '%s' in class '%s' has type %s",
                        set.aType.moniker,
                        property.name,
                        cls.name,
                        property.typeAnnotation),
                    match.node.container.pos));
            continue;
          }
          primitiveSets
              .computeIfAbsent(property, p -> new ArrayList<>())
              .add(new SetOfPrimitivesConstraint(set.aType, set.literals));
        } else if (constant instanceof Constant.SetOfEnumerationLiterals) {
          final Constant.SetOfEnumerationLiterals set =
              (Constant.SetOfEnumerationLiterals) constant;
          if (!(type instanceof TypeAnnotation.Our
              && ((TypeAnnotation.Our) type).symbol == set.enumeration)) {
            errors.add(
                new ConstraintError(
                    format(
                        "The container is a constant set of enumeration "
                            + "literals of %s while the property '%s' in "
                            + "class '%s' has type %s",
                        set.enumeration.name,
                        property.name,
                        cls.name,
                        property.typeAnnotation),
                    match.node.container.pos));
            continue;
          }
          enumerationSets
              .computeIfAbsent(property, p -> new ArrayList<>())
              .add(
                  new SetOfEnumerationLiteralsConstraint(
                      set.enumeration, set.literals));
        } else {
          throw new AssertionError("unexpected constant " + constant);
        }
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }

    final ImmutableMap.Builder<Property, SetOfPrimitivesConstraint>
        setOfPrimitivesByProperty = ImmutableMap.builder();
    primitiveSets.forEach(
        (property, constraints) ->
            setOfPrimitivesByProperty.put(
                property, intersectSetOfPrimitivesConstraints(constraints)));
    final ImmutableMap.Builder<Property, SetOfEnumerationLiteralsConstraint>
        setOfEnumerationLiteralsByProperty = ImmutableMap.builder();
    enumerationSets.forEach(
        (property, constraints) ->
            setOfEnumerationLiteralsByProperty.put(
                property,
                intersectSetOfEnumerationLiteralsConstraints(constraints)));
    return new SetConstraintsByProperty(
        setOfPrimitivesByProperty.build(),
        setOfEnumerationLiteralsByProperty.build());
  }

  /**
   * Intersects sets of primitive literals.
   *
   * <p>Literals are compared by value. The result keeps the literals of the
   * first set that occur in every other set, in the order of the first set.
   */
  public static SetOfPrimitivesConstraint intersectSetOfPrimitivesConstraints(
      List<SetOfPrimitivesConstraint> constraints) {
    checkArgument(!constraints.isEmpty(), "nothing to intersect");
    final SetOfPrimitivesConstraint first = constraints.get(0);
    final List<PrimitiveSetLiteral> literals = new ArrayList<>(first.literals);
    for (SetOfPrimitivesConstraint constraint : skip(constraints)) {
      checkArgument(
          constraint.aType == first.aType,
          "cannot intersect a set of %s with a set of %s",
          first.aType.moniker,
          constraint.aType.moniker);
      final Set<Object> values = new HashSet<>();
      for (PrimitiveSetLiteral literal : constraint.literals) {
        values.add(literal.value);
      }
      literals.removeIf(literal -> !values.contains(literal.value));
    }
    return new SetOfPrimitivesConstraint(first.aType, literals);
  }

  /**
   * Intersects sets of literals of one enumeration.
   *
   * <p>Literals are compared by identity, never by value. The result keeps
   * the literals of the first set that occur in every other set, in the order
   * of the first set.
   *
   * @throws IllegalArgumentException if the list is empty, or the sets are of
   *     different enumerations
   */
  public static SetOfEnumerationLiteralsConstraint
      intersectSetOfEnumerationLiteralsConstraints(
          List<SetOfEnumerationLiteralsConstraint> constraints) {
    checkArgument(!constraints.isEmpty(), "nothing to intersect");
    final Enumeration enumeration = constraints.get(0).enumeration;
    final List<Enumeration.Literal> literals =
        new ArrayList<>(constraints.get(0).literals);
    for (SetOfEnumerationLiteralsConstraint constraint :
        skip(constraints)) {
      checkArgument(
          constraint.enumeration == enumeration,
          "cannot intersect literals of %s with literals of %s",
          enumeration.name,
          constraint.enumeration.name);
      // Within one enumeration, the handle identifies the literal.
      final Set<Integer> handles = new HashSet<>();
      for (Enumeration.Literal literal : constraint.literals) {
        handles.add(literal.handle);
      }
      literals.removeIf(literal -> !handles.contains(literal.handle));
    }
    return new SetOfEnumerationLiteralsConstraint(enumeration, literals);
  }

  /** Set constraints of the properties of one class. */
  public static class SetConstraintsByProperty {
    public final ImmutableMap<Property, SetOfPrimitivesConstraint>
        setOfPrimitivesByProperty;
    public final ImmutableMap<Property, SetOfEnumerationLiteralsConstraint>
        setOfEnumerationLiteralsByProperty;

    SetConstraintsByProperty(
        ImmutableMap<Property, SetOfPrimitivesConstraint>
            setOfPrimitivesByProperty,
        ImmutableMap<Property, SetOfEnumerationLiteralsConstraint>
            setOfEnumerationLiteralsByProperty) {
      this.setOfPrimitivesByProperty =
          requireNonNull(setOfPrimitivesByProperty);
      this.setOfEnumerationLiteralsByProperty =
          requireNonNull(setOfEnumerationLiteralsByProperty);
    }
  }
}

// End SetInference.java
