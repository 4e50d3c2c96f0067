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
import static net.hydromatic.constraint.infer.LenConstraint.maxWithNull;
import static net.hydromatic.constraint.infer.LenConstraint.minWithNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.PrimitiveType;
import net.hydromatic.constraint.model.Property;
import net.hydromatic.constraint.model.SymbolTable;
import net.hydromatic.constraint.model.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the constraints of every class in a symbol table.
 *
 * <p>Combines the inference of lengths, patterns and sets for each class with
 * the constraints of the constrained primitives that type its properties,
 * and optionally merges each class's constraints with its ancestors'.
 *
 * <p>If any class has errors, every other class is still inferred, so that
 * all errors are reported together in one {@link ConstraintException}; no
 * partial result is returned.
 */
public class ConstraintInference {
  public final SymbolTable symbolTable;
  /** Property values; a property not in the map has its default value. */
  public final ImmutableMap<Prop, Object> map;

  private final Tracer tracer;
  private final PatternVerificationsByName patternVerifications;

  public ConstraintInference(
      SymbolTable symbolTable, Map<Prop, Object> map, Tracer tracer) {
    this.symbolTable = requireNonNull(symbolTable);
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
    this.patternVerifications =
        PatternVerificationsByName.of(symbolTable.verifications);
  }

  /** Creates an inference with default properties and no tracing. */
  public static ConstraintInference of(SymbolTable symbolTable) {
    return new ConstraintInference(
        symbolTable, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Infers the length constraint of each constrained {@code str} and
   * {@code bytearray} from its own invariants, ignoring its ancestors.
   */
  public ImmutableMap<ConstrainedPrimitive, LenConstraint>
      ownLenConstraintsByConstrainedPrimitive() {
    final List<ConstraintError> errors = new ArrayList<>();
    final ImmutableMap.Builder<ConstrainedPrimitive, LenConstraint> result =
        ImmutableMap.builder();
    for (ConstrainedPrimitive constrainedPrimitive :
        symbolTable.constrainedPrimitives()) {
      if (!constrainedPrimitive.constrainee.isLengthable()) {
        continue;
      }
      try {
        result.put(
            constrainedPrimitive,
            LenInference.inferLenConstraintOfSelf(constrainedPrimitive));
      } catch (ConstraintException e) {
        tracer.onException(constrainedPrimitive, e);
        errors.addAll(e.errors);
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return result.build();
  }

  /**
   * Infers the length constraint of each constrained {@code str} and
   * {@code bytearray}, narrowed by the constraints of its ancestors.
   */
  public ImmutableMap<ConstrainedPrimitive, LenConstraint>
      lenConstraintsByConstrainedPrimitive() {
    final ImmutableMap<ConstrainedPrimitive, LenConstraint> narrowed =
        LenInference.narrowByAncestors(
            symbolTable.constrainedPrimitives(),
            ownLenConstraintsByConstrainedPrimitive());
    narrowed.forEach(tracer::onConstrainedPrimitive);
    return narrowed;
  }

  /**
   * Infers the patterns of each constrained {@code str}, stacked over its
   * ancestors.
   *
   * <p>The list of a constrained primitive holds the lists of its parents,
   * in the order it inherits them, followed by the patterns of its own
   * invariants.
   */
  public ImmutableMap<ConstrainedPrimitive, ImmutableList<PatternConstraint>>
      patternsByConstrainedPrimitive() {
    final Map<ConstrainedPrimitive, ImmutableList<PatternConstraint>> result =
        new LinkedHashMap<>();
    for (ConstrainedPrimitive constrainedPrimitive :
        symbolTable.constrainedPrimitives()) {
      if (constrainedPrimitive.constrainee != PrimitiveType.STR) {
        continue;
      }
      final ImmutableList.Builder<PatternConstraint> patterns =
          ImmutableList.builder();
      for (ConstrainedPrimitive parent : constrainedPrimitive.inheritances) {
        patterns.addAll(requireNonNull(result.get(parent), "parent"));
      }
      patterns.addAll(
          PatternInference.inferPatternsOnSelf(
              constrainedPrimitive, patternVerifications));
      result.put(constrainedPrimitive, patterns.build());
    }
    return ImmutableMap.copyOf(result);
  }

  /**
   * Infers the constraints of each class, from its own invariants and, if
   * {@link Prop#INLINE_CONSTRAINED_PRIMITIVES} is set, from the constrained
   * primitives of the properties it declares.
   *
   * <p>Constraints are inferred even for optional properties; a schema
   * usually states optionality separately from constraints.
   *
   * @throws ConstraintException if any constrained primitive or class has
   *     errors
   */
  public ImmutableMap<ClassType, ConstraintsByProperty>
      inferConstraintsByClass() {
    // Errors in the constrained primitives are thrown before any class is
    // inferred.
    final ImmutableMap<ConstrainedPrimitive, LenConstraint> lenConstraints =
        lenConstraintsByConstrainedPrimitive();
    final ImmutableMap<ConstrainedPrimitive, ImmutableList<PatternConstraint>>
        patterns = patternsByConstrainedPrimitive();
    final boolean inline = Prop.INLINE_CONSTRAINED_PRIMITIVES.booleanValue(map);

    final List<ConstraintError> errors = new ArrayList<>();
    final ImmutableMap.Builder<ClassType, ConstraintsByProperty> result =
        ImmutableMap.builder();
    for (ClassType cls : symbolTable.classes()) {
      try {
        final ConstraintsByProperty constraints =
            inferConstraints(cls, inline, lenConstraints, patterns);
        result.put(cls, constraints);
        tracer.onClassConstraints(cls, constraints);
      } catch (ConstraintException e) {
        tracer.onException(cls, e);
        errors.addAll(e.errors);
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return result.build();
  }

  private ConstraintsByProperty inferConstraints(
      ClassType cls,
      boolean inline,
      Map<ConstrainedPrimitive, LenConstraint> lenConstraintsByPrimitive,
      Map<ConstrainedPrimitive, ImmutableList<PatternConstraint>>
          patternsByPrimitive) {
    final ImmutableMap<Property, LenConstraint> lenConstraintsFromInvariants =
        LenInference.lenConstraintsFromInvariants(cls);
    final ImmutableMap<Property, ImmutableList<PatternConstraint>>
        patternsFromInvariants =
            PatternInference.patternsFromInvariants(cls, patternVerifications);

    final List<ConstraintError> errors = new ArrayList<>();
    final Map<Property, LenConstraint> lenConstraints = new LinkedHashMap<>();
    final Map<Property, List<PatternConstraint>> patterns =
        new LinkedHashMap<>();
    for (Property property : cls.properties) {
      final ConstrainedPrimitive constrainedPrimitive =
          inline ? inlinedConstrainedPrimitive(cls, property) : null;

      // Both the type and the invariants must be satisfied, so take the
      // narrower bounds.
      @Nullable Integer minValue = null;
      @Nullable Integer maxValue = null;
      final LenConstraint fromType =
          constrainedPrimitive == null
              ? null
              : lenConstraintsByPrimitive.get(constrainedPrimitive);
      if (fromType != null) {
        minValue = fromType.minValue;
        maxValue = fromType.maxValue;
      }
      final LenConstraint fromInvariants =
          lenConstraintsFromInvariants.get(property);
      if (fromInvariants != null) {
        minValue = maxWithNull(minValue, fromInvariants.minValue);
        maxValue = minWithNull(maxValue, fromInvariants.maxValue);
      }
      if (minValue != null && maxValue != null && minValue > maxValue) {
        errors.add(
            new ConstraintError(
                format(
                    "The inferred minimum and maximum value on len(.) is "
                        + "contradictory: minimum = %d, maximum = %d; please "
                        + "check the invariants and any involved constrained "
                        + "primitives",
                    minValue, maxValue),
                property.pos));
      } else if (minValue != null || maxValue != null) {
        lenConstraints.put(property, new LenConstraint(minValue, maxValue));
      }

      final List<PatternConstraint> propertyPatterns = new ArrayList<>();
      if (constrainedPrimitive != null) {
        propertyPatterns.addAll(
            patternsByPrimitive.getOrDefault(
                constrainedPrimitive, ImmutableList.of()));
      }
      propertyPatterns.addAll(
          patternsFromInvariants.getOrDefault(property, ImmutableList.of()));
      if (!propertyPatterns.isEmpty()) {
        patterns.put(property, propertyPatterns);
      }
    }

    SetInference.@Nullable SetConstraintsByProperty sets = null;
    try {
      sets = SetInference.inferSetConstraintsByProperty(cls, symbolTable);
    } catch (ConstraintException e) {
      errors.addAll(e.errors);
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    requireNonNull(sets);
    return new ConstraintsByProperty(
        lenConstraints,
        patterns,
        sets.setOfPrimitivesByProperty,
        sets.setOfEnumerationLiteralsByProperty);
  }

  /**
   * Returns the constrained primitive whose constraints a property receives,
   * or null.
   *
   * <p>Only a property declared by the class itself receives them; a
   * descendant class would only repeat them. Use
   * {@link #mergeConstraintsWithAncestors} to stack constraints over the
   * hierarchy.
   */
  private static @Nullable ConstrainedPrimitive inlinedConstrainedPrimitive(
      ClassType cls, Property property) {
    if (property.specifiedFor != cls) {
      return null;
    }
    final TypeAnnotation type = property.typeAnnotation.beneathOptional();
    if (type instanceof TypeAnnotation.Our
        && ((TypeAnnotation.Our) type).symbol instanceof ConstrainedPrimitive) {
      return (ConstrainedPrimitive) ((TypeAnnotation.Our) type).symbol;
    }
    return null;
  }

  /**
   * Merges the constraints of each class with the merged constraints of its
   * parents.
   *
   * <p>A schema engine that supports inheritance does not need this; the
   * unmerged constraints are more readable, because each shows where it came
   * from. Merged constraints are for consumers that see each class on its
   * own, such as generators of test data.
   *
   * <p>Lengths are merged by taking the narrowest interval. Patterns are
   * stacked: the class's own patterns, followed by those of each parent. Sets
   * are intersected.
   *
   * @param constraintsByClass Constraints of every class, as returned by
   *     {@link #inferConstraintsByClass()}
   * @throws IllegalArgumentException if a class has no entry in
   *     {@code constraintsByClass}
   * @throws ConstraintException if merged constraints contradict
   */
  public ImmutableMap<ClassType, ConstraintsByProperty>
      mergeConstraintsWithAncestors(
          Map<ClassType, ConstraintsByProperty> constraintsByClass) {
    final boolean deduplicate =
        Prop.DEDUPLICATE_INHERITED_PATTERNS.booleanValue(map);
    final boolean rejectEmptySets = Prop.REJECT_EMPTY_SETS.booleanValue(map);

    final List<ConstraintError> errors = new ArrayList<>();
    final Map<ClassType, ConstraintsByProperty> merged = new LinkedHashMap<>();
    final Set<ClassType> failed = new HashSet<>();
    for (ClassType cls : symbolTable.classes()) {
      final ConstraintsByProperty own = constraintsByClass.get(cls);
      checkArgument(own != null, "no constraints for class %s", cls.name);
      if (cls.inheritances.stream().anyMatch(failed::contains)) {
        // the parent's error has been reported already
        failed.add(cls);
        continue;
      }
      try {
        final ConstraintsByProperty constraints =
            merge(cls, own, merged, deduplicate, rejectEmptySets);
        merged.put(cls, constraints);
        tracer.onMergedConstraints(cls, constraints);
      } catch (ConstraintException e) {
        tracer.onException(cls, e);
        errors.addAll(e.errors);
        failed.add(cls);
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return ImmutableMap.copyOf(merged);
  }

  private static ConstraintsByProperty merge(
      ClassType cls,
      ConstraintsByProperty own,
      Map<ClassType, ConstraintsByProperty> merged,
      boolean deduplicate,
      boolean rejectEmptySets) {
    final List<ConstraintsByProperty> parents = new ArrayList<>();
    for (ClassType parent : cls.inheritances) {
      parents.add(requireNonNull(merged.get(parent), "parent"));
    }

    final List<ConstraintError> errors = new ArrayList<>();
    final Map<Property, LenConstraint> lenConstraints = new LinkedHashMap<>();
    final Map<Property, List<PatternConstraint>> patterns =
        new LinkedHashMap<>();
    final Map<Property, SetOfPrimitivesConstraint> setsOfPrimitives =
        new LinkedHashMap<>();
    final Map<Property, SetOfEnumerationLiteralsConstraint>
        setsOfEnumerationLiterals = new LinkedHashMap<>();

    for (Property property : cls.properties) {
      // Length
      final List<LenConstraint> lens =
          collect(own, parents, property, x -> x.lenConstraintsByProperty);
      @Nullable Integer minValue = null;
      @Nullable Integer maxValue = null;
      for (LenConstraint c : lens) {
        minValue = maxWithNull(minValue, c.minValue);
        maxValue = minWithNull(maxValue, c.maxValue);
      }
      if (minValue != null && maxValue != null && minValue > maxValue) {
        errors.add(
            new ConstraintError(
                format(
                    "We could not stack the length constraints on the "
                        + "property %s as they are contradicting: "
                        + "min_value == %d and max_value == %d. Please check "
                        + "the invariants and the invariants of all the "
                        + "ancestors.",
                    property.name, minValue, maxValue),
                cls.pos));
      } else if (minValue != null || maxValue != null) {
        lenConstraints.put(property, new LenConstraint(minValue, maxValue));
      }

      // Patterns
      final List<PatternConstraint> ownPatterns =
          own.patternsByProperty.getOrDefault(property, ImmutableList.of());
      final List<PatternConstraint> propertyPatterns =
          new ArrayList<>(ownPatterns);
      final Set<String> ownPatternTexts = new HashSet<>();
      ownPatterns.forEach(p -> ownPatternTexts.add(p.pattern));
      for (ConstraintsByProperty parent : parents) {
        for (PatternConstraint pattern :
            parent.patternsByProperty.getOrDefault(
                property, ImmutableList.of())) {
          if (!deduplicate || !ownPatternTexts.contains(pattern.pattern)) {
            propertyPatterns.add(pattern);
          }
        }
      }
      if (!propertyPatterns.isEmpty()) {
        patterns.put(property, propertyPatterns);
      }

      // Sets
      final List<SetOfPrimitivesConstraint> primitiveSets =
          collect(own, parents, property, x -> x.setOfPrimitivesByProperty);
      if (!primitiveSets.isEmpty()) {
        final SetOfPrimitivesConstraint intersection =
            SetInference.intersectSetOfPrimitivesConstraints(primitiveSets);
        if (rejectEmptySets && intersection.literals.isEmpty()) {
          errors.add(emptySet(cls, property, "primitive literals"));
        } else {
          setsOfPrimitives.put(property, intersection);
        }
      }
      final List<SetOfEnumerationLiteralsConstraint> enumerationSets =
          collect(
              own,
              parents,
              property,
              x -> x.setOfEnumerationLiteralsByProperty);
      if (!enumerationSets.isEmpty()) {
        final SetOfEnumerationLiteralsConstraint intersection =
            SetInference.intersectSetOfEnumerationLiteralsConstraints(
                enumerationSets);
        if (rejectEmptySets && intersection.literals.isEmpty()) {
          errors.add(emptySet(cls, property, "enumeration literals"));
        } else {
          setsOfEnumerationLiterals.put(property, intersection);
        }
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return new ConstraintsByProperty(
        lenConstraints, patterns, setsOfPrimitives, setsOfEnumerationLiterals);
  }

  /**
   * Returns the constraint of a class on a property, if any, followed by the
   * constraints of its parents.
   */
  private static <C> List<C> collect(
      ConstraintsByProperty own,
      List<ConstraintsByProperty> parents,
      Property property,
      Function<ConstraintsByProperty, Map<Property, C>> mapOf) {
    final List<C> list = new ArrayList<>();
    final C c = mapOf.apply(own).get(property);
    if (c != null) {
      list.add(c);
    }
    for (ConstraintsByProperty parent : parents) {
      final C c2 = mapOf.apply(parent).get(property);
      if (c2 != null) {
        list.add(c2);
      }
    }
    return list;
  }

  private static ConstraintError emptySet(
      ClassType cls, Property property, String what) {
    return new ConstraintError(
        format(
            "The property '%s' of our type '%s' is constrained to an empty "
                + "set of %s",
            property.name, cls.name, what),
        property.pos);
  }
}

// End ConstraintInference.java
