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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Primitive type refined by invariants on {@code self}, e.g. a string whose
 * length is at most 128.
 *
 * <p>A constrained primitive may inherit from other constrained primitives of
 * the same constrainee.
 */
public class ConstrainedPrimitive extends Symbol {
  public final PrimitiveType constrainee;
  public final ImmutableList<ConstrainedPrimitive> inheritances;
  /** Inherited invariants, then the invariants declared here. */
  public final ImmutableList<Invariant> invariants;

  private ConstrainedPrimitive(Builder b) {
    super(b.pos, b.name);
    this.constrainee = requireNonNull(b.constrainee);
    this.inheritances = ImmutableList.copyOf(b.inheritances);

    final Set<Invariant> seen = new HashSet<>();
    final ImmutableList.Builder<Invariant> invariants = ImmutableList.builder();
    for (ConstrainedPrimitive parent : inheritances) {
      checkArgument(
          parent.constrainee == constrainee,
          "constrained primitive %s of %s cannot inherit from %s of %s",
          name,
          constrainee.moniker,
          parent.name,
          parent.constrainee.moniker);
      for (Invariant invariant : parent.invariants) {
        if (seen.add(invariant)) {
          invariants.add(invariant);
        }
      }
    }
    for (ClassType.InvariantDef def : b.invariantDefs) {
      invariants.add(new Invariant(this, def.body, def.description));
    }
    this.invariants = invariants.build();
  }

  /** Creates a builder for a constrained primitive. */
  public static Builder builder(
      Pos pos, String name, PrimitiveType constrainee) {
    return new Builder(pos, name, constrainee);
  }

  @Override
  public List<ConstrainedPrimitive> parents() {
    return inheritances;
  }

  /** Builder for {@link ConstrainedPrimitive}. */
  public static class Builder {
    private final Pos pos;
    private final String name;
    private final PrimitiveType constrainee;
    private final List<ConstrainedPrimitive> inheritances = new ArrayList<>();
    private final List<ClassType.InvariantDef> invariantDefs =
        new ArrayList<>();

    private Builder(Pos pos, String name, PrimitiveType constrainee) {
      this.pos = pos;
      this.name = name;
      this.constrainee = constrainee;
    }

    public Builder inherit(ConstrainedPrimitive parent) {
      inheritances.add(parent);
      return this;
    }

    public Builder invariant(Ast.Exp body) {
      return invariant(body, null);
    }

    public Builder invariant(Ast.Exp body, @Nullable String description) {
      invariantDefs.add(new ClassType.InvariantDef(body, description));
      return this;
    }

    public ConstrainedPrimitive build() {
      return new ConstrainedPrimitive(this);
    }
  }
}

// End ConstrainedPrimitive.java
