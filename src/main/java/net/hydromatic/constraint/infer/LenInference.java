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
import static net.hydromatic.constraint.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.Pos;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.Invariant;
import net.hydromatic.constraint.model.Property;
import net.hydromatic.constraint.model.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers constraints on {@code len} from invariants.
 *
 * <p>The constraints are not exhaustive. Only invariants that compare a length
 * with an integer literal are understood; the actual invariants might be
 * tighter.
 */
public abstract class LenInference {
  private LenInference() {}

  /**
   * Infers the constraint on the length of each property of a class, from the
   * invariants declared on the class itself.
   *
   * <p>A constraint is inferred even if the property is optional.
   *
   * @throws ConstraintException if an invariant refers to a property the
   *     class does not have, or the invariants on a property contradict each
   *     other
   */
  public static ImmutableMap<Property, LenConstraint>
      lenConstraintsFromInvariants(ClassType cls) {
    final List<ConstraintError> errors = new ArrayList<>();

    // One pass over the invariants, rather than one per property.
    final Map<Property, List<LengthBound>> boundsByProperty =
        new LinkedHashMap<>();
    for (Invariant invariant : cls.invariants) {
      if (invariant.specifiedFor != cls) {
        continue;
      }
      final List<LengthBound> bounds =
          Idioms.matchOnProperties(
              invariant.body,
              Idioms::matchLenConstraint,
              LengthBound::propertyName);
      for (LengthBound bound : bounds) {
        final String name = requireNonNull(bound.propertyName());
        final Property property = cls.property(name);
        if (property == null) {
          errors.add(
              new ConstraintError(
                  format(
                      "The property %s does not appear in the properties "
                          + "of the class %s",
                      name, cls.name),
                  bound.node.pos));
          continue;
        }
        boundsByProperty
            .computeIfAbsent(property, p -> new ArrayList<>())
            .add(bound);
      }
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }

    final ImmutableMap.Builder<Property, LenConstraint> result =
        ImmutableMap.builder();
    boundsByProperty.forEach(
        (property, bounds) -> {
          final List<String> messages = new ArrayList<>();
          final LenConstraint constraint = reduce(bounds, messages);
          if (constraint == null) {
            for (String message : messages) {
              errors.add(
                  new ConstraintError(
                      "The property "
                          + property.name
                          + " has conflicting invariants on the length: "
                          + message,
                      pos(cls, bounds)));
            }
          } else {
            result.put(property, constraint);
          }
        });
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return result.build();
  }

  /**
   * Infers the constraint on {@code len(self)} of a constrained primitive,
   * from the invariants declared on the constrained primitive itself.
   *
   * @throws IllegalArgumentException if the constrainee has no length
   * @throws ConstraintException if the invariants contradict each other
   */
  public static LenConstraint inferLenConstraintOfSelf(
      ConstrainedPrimitive constrainedPrimitive) {
    checkArgument(
        constrainedPrimitive.constrainee.isLengthable(),
        "length is inferred only for str and bytearray; %s is a %s",
        constrainedPrimitive.name,
        constrainedPrimitive.constrainee.moniker);

    final List<LengthBound> bounds = new ArrayList<>();
    for (Invariant invariant : constrainedPrimitive.invariants) {
      if (invariant.specifiedFor != constrainedPrimitive) {
        continue;
      }
      for (Ast.Exp conjunct : Idioms.conjuncts(invariant.body)) {
        final LengthBound bound = Idioms.matchLenConstraint(conjunct);
        if (bound != null && bound.isOnSelf()) {
          bounds.add(bound);
        }
      }
    }

    final List<String> messages = new ArrayList<>();
    final LenConstraint constraint = reduce(bounds, messages);
    if (constraint == null) {
      final List<ConstraintError> errors = new ArrayList<>();
      for (String message : messages) {
        errors.add(
            new ConstraintError(
                "There are conflicting invariants on the length: " + message,
                pos(constrainedPrimitive, bounds)));
      }
      throw new ConstraintException(errors);
    }
    return constraint;
  }

  /**
   * Narrows the constraint of each constrained primitive by the constraints
   * of its ancestors.
   *
   * <p>The minimum becomes the largest of the minimums, and the maximum the
   * smallest of the maximums, so a descendant satisfies all of its ancestors'
   * constraints as well as its own.
   *
   * @param constrainedPrimitives Constrained primitives, parents before
   *     children
   * @param ownConstraints Constraint of each constrained primitive from its own
   *     invariants; those with no entry are skipped
   * @throws ConstraintException if the narrowed minimum of some constrained
   *     primitive exceeds its narrowed maximum
   */
  public static ImmutableMap<ConstrainedPrimitive, LenConstraint>
      narrowByAncestors(
          List<ConstrainedPrimitive> constrainedPrimitives,
          Map<ConstrainedPrimitive, LenConstraint> ownConstraints) {
    final List<ConstraintError> errors = new ArrayList<>();
    final Map<ConstrainedPrimitive, LenConstraint> narrowed =
        new LinkedHashMap<>();
    final Set<ConstrainedPrimitive> failed = new HashSet<>();

    for (ConstrainedPrimitive constrainedPrimitive : constrainedPrimitives) {
      final LenConstraint own = ownConstraints.get(constrainedPrimitive);
      if (own == null) {
        continue;
      }
      if (constrainedPrimitive.inheritances.isEmpty()) {
        narrowed.put(constrainedPrimitive, own.copy());
        continue;
      }
      @Nullable Integer minValue = own.minValue;
      @Nullable Integer maxValue = own.maxValue;
      boolean parentFailed = false;
      for (ConstrainedPrimitive parent : constrainedPrimitive.inheritances) {
        if (failed.contains(parent)) {
          parentFailed = true;
          break;
        }
        final LenConstraint inherited = narrowed.get(parent);
        checkArgument(
            inherited != null,
            "expected topological order, but %s precedes its parent %s",
            constrainedPrimitive,
            parent);
        minValue = maxWithNull(minValue, inherited.minValue);
        maxValue = minWithNull(maxValue, inherited.maxValue);
      }
      if (parentFailed) {
        // the parent's error has been reported already
        failed.add(constrainedPrimitive);
        continue;
      }
      if (minValue != null && maxValue != null && minValue > maxValue) {
        errors.add(
            new ConstraintError(
                format(
                    "The length constraint of the constrained primitive %s "
                        + "contradicts the constraints of its ancestors: "
                        + "minimum = %d, maximum = %d",
                    constrainedPrimitive.name, minValue, maxValue),
                constrainedPrimitive.pos));
        failed.add(constrainedPrimitive);
        continue;
      }
      narrowed.put(constrainedPrimitive, new LenConstraint(minValue, maxValue));
    }
    if (!errors.isEmpty()) {
      throw new ConstraintException(errors);
    }
    return ImmutableMap.copyOf(narrowed);
  }

  /**
   * Reduces a list of bounds to a constraint that satisfies all of them.
   *
   * <p>Returns null, and adds one message per conflict to {@code messages},
   * if the bounds contradict each other.
   */
  static @Nullable LenConstraint reduce(
      List<LengthBound> bounds, List<String> messages) {
    @Nullable Integer minValue = null;
    @Nullable Integer maxValue = null;
    @Nullable Integer exactValue = null;
    final int messageCount = messages.size();

    for (LengthBound bound : bounds) {
      switch (bound.kind) {
        case MIN:
          minValue = maxWithNull(bound.value, minValue);
          break;
        case MAX:
          maxValue = minWithNull(bound.value, maxValue);
          break;
        case EXACT:
          if (exactValue != null) {
            messages.add(
                format(
                    "The exact length, %d, contradicts another exactly "
                        + "expected length %d.",
                    exactValue, bound.value));
          }
          exactValue = bound.value;
          break;
        default:
          throw new AssertionError(bound.kind);
      }
    }

    if (exactValue != null) {
      if (minValue != null && minValue > exactValue) {
        messages.add(
            format(
                "the minimum length, %d, contradicts the exactly expected "
                    + "length %d.",
                minValue, exactValue));
      }
      if (maxValue != null && exactValue > maxValue) {
        messages.add(
            format(
                "the maximum length, %d, contradicts the exactly expected "
                    + "length %d.",
                maxValue, exactValue));
      }
    }

    if (minValue != null && maxValue != null && minValue > maxValue) {
      messages.add(
          format(
              "the minimum length, %d, contradicts the maximum length %d.",
              minValue, maxValue));
    }

    if (messages.size() > messageCount) {
      return null;
    }
    if (exactValue != null) {
      return new LenConstraint(exactValue, exactValue);
    }
    return new LenConstraint(minValue, maxValue);
  }

  /** Returns the position spanning the nodes of some bounds, or the position
   * of the symbol if the nodes have none. */
  private static Pos pos(Symbol symbol, List<LengthBound> bounds) {
    final Pos pos = Pos.sum(transformEager(bounds, bound -> bound.node));
    return pos.equals(Pos.ZERO) ? symbol.pos : pos;
  }
}

// End LenInference.java
