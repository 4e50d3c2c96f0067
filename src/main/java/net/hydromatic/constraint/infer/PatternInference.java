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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.Invariant;
import net.hydromatic.constraint.model.PrimitiveType;
import net.hydromatic.constraint.model.Property;

/**
 * Infers pattern constraints from invariants that call a pattern-verification
 * function.
 *
 * <p>The list of patterns on a property is a conjunction: a value must match
 * all of them. Only calls to registered functions are understood, so the
 * actual invariants might be tighter.
 */
public abstract class PatternInference {
  private PatternInference() {}

  /**
   * Infers the patterns on each property of a class, from the invariants
   * declared on the class itself.
   *
   * <p>Patterns are listed in the order they occur in the invariants. A call
   * on a property that the class does not have is ignored.
   */
  public static ImmutableMap<Property, ImmutableList<PatternConstraint>>
      patternsFromInvariants(
          ClassType cls, PatternVerificationsByName verifications) {
    final Map<Property, List<PatternConstraint>> patternsByProperty =
        new LinkedHashMap<>();
    for (Invariant invariant : cls.invariants) {
      if (invariant.specifiedFor != cls) {
        continue;
      }
      final List<Idioms.PatternOnProperty> matches =
          Idioms.matchOnProperties(
              invariant.body,
              exp -> Idioms.matchPatternOnProperty(exp, verifications),
              match -> match.propertyName);
      for (Idioms.PatternOnProperty match : matches) {
        final Property property = cls.property(match.propertyName);
        if (property == null) {
          continue;
        }
        patternsByProperty
            .computeIfAbsent(property, p -> new ArrayList<>())
            .add(match.constraint);
      }
    }

    final ImmutableMap.Builder<Property, ImmutableList<PatternConstraint>>
        result = ImmutableMap.builder();
    patternsByProperty.forEach(
        (property, patterns) ->
            result.put(property, ImmutableList.copyOf(patterns)));
    return result.build();
  }

  /**
   * Infers the patterns on {@code self} of a constrained string, from the
   * invariants declared on the constrained primitive itself.
   *
   * @throws IllegalArgumentException if the constrainee is not {@code str}
   */
  public static ImmutableList<PatternConstraint> inferPatternsOnSelf(
      ConstrainedPrimitive constrainedPrimitive,
      PatternVerificationsByName verifications) {
    checkArgument(
        constrainedPrimitive.constrainee == PrimitiveType.STR,
        "patterns are inferred only on constrained strings; %s is a %s",
        constrainedPrimitive.name,
        constrainedPrimitive.constrainee.moniker);
    final ImmutableList.Builder<PatternConstraint> result =
        ImmutableList.builder();
    for (Invariant invariant : constrainedPrimitive.invariants) {
      if (invariant.specifiedFor != constrainedPrimitive) {
        continue;
      }
      for (Ast.Exp conjunct : Idioms.conjuncts(invariant.body)) {
        final PatternConstraint pattern =
            Idioms.matchPatternOnSelf(conjunct, verifications);
        if (pattern != null) {
          result.add(pattern);
        }
      }
    }
    return result.build();
  }
}

// End PatternInference.java
