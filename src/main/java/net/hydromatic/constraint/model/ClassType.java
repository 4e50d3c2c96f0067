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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Class of the meta-model, abstract or concrete.
 *
 * <p>The properties and invariants of a class start with those of its
 * ancestors (the same objects, in inheritance order) followed by its own.
 */
public class ClassType extends Symbol {
  public final boolean isAbstract;
  public final ImmutableList<ClassType> inheritances;
  public final ImmutableList<Property> properties;
  public final ImmutableMap<String, Property> propertiesByName;
  public final ImmutableList<Invariant> invariants;

  private ClassType(Builder b) {
    super(b.pos, b.name);
    this.isAbstract = b.isAbstract;
    this.inheritances = ImmutableList.copyOf(b.inheritances);

    final Map<String, Property> propertyMap = new LinkedHashMap<>();
    for (ClassType parent : inheritances) {
      for (Property property : parent.properties) {
        final Property previous = propertyMap.put(property.name, property);
        checkArgument(
            previous == null || previous == property,
            "class %s inherits two properties named %s",
            name,
            property.name);
      }
    }
    for (PropertyDef def : b.propertyDefs) {
      final Property property =
          new Property(def.pos, def.name, def.typeAnnotation, this);
      checkArgument(
          propertyMap.put(def.name, property) == null,
          "property %s of class %s is already defined",
          def.name,
          name);
    }
    this.propertiesByName = ImmutableMap.copyOf(propertyMap);
    this.properties = propertiesByName.values().asList();

    final Set<Invariant> seen = new HashSet<>();
    final ImmutableList.Builder<Invariant> invariants = ImmutableList.builder();
    for (ClassType parent : inheritances) {
      for (Invariant invariant : parent.invariants) {
        if (seen.add(invariant)) {
          invariants.add(invariant);
        }
      }
    }
    for (InvariantDef def : b.invariantDefs) {
      invariants.add(new Invariant(this, def.body, def.description));
    }
    this.invariants = invariants.build();
  }

  /** Creates a builder for a class. */
  public static Builder builder(Pos pos, String name) {
    return new Builder(pos, name);
  }

  @Override
  public List<ClassType> parents() {
    return inheritances;
  }

  /** Returns the property with a given name, or null. */
  public @Nullable Property property(String name) {
    return propertiesByName.get(name);
  }

  /** Builder for {@link ClassType}. */
  public static class Builder {
    private final Pos pos;
    private final String name;
    private boolean isAbstract;
    private final List<ClassType> inheritances = new ArrayList<>();
    private final List<PropertyDef> propertyDefs = new ArrayList<>();
    private final List<InvariantDef> invariantDefs = new ArrayList<>();

    private Builder(Pos pos, String name) {
      this.pos = pos;
      this.name = name;
    }

    /** Sets whether the class is abstract. */
    public Builder isAbstract(boolean isAbstract) {
      this.isAbstract = isAbstract;
      return this;
    }

    /** Adds a parent class. */
    public Builder inherit(ClassType parent) {
      inheritances.add(parent);
      return this;
    }

    /** Declares a property. */
    public Builder property(Pos pos, String name, TypeAnnotation type) {
      propertyDefs.add(new PropertyDef(pos, name, type));
      return this;
    }

    /** Declares a property. */
    public Builder property(String name, TypeAnnotation type) {
      return property(pos, name, type);
    }

    /** Declares an invariant. */
    public Builder invariant(Ast.Exp body) {
      return invariant(body, null);
    }

    /** Declares an invariant with a description. */
    public Builder invariant(Ast.Exp body, @Nullable String description) {
      invariantDefs.add(new InvariantDef(body, description));
      return this;
    }

    public ClassType build() {
      return new ClassType(this);
    }
  }

  /** Declaration of a property, before the class exists. */
  private static class PropertyDef {
    final Pos pos;
    final String name;
    final TypeAnnotation typeAnnotation;

    PropertyDef(Pos pos, String name, TypeAnnotation typeAnnotation) {
      this.pos = pos;
      this.name = name;
      this.typeAnnotation = typeAnnotation;
    }
  }

  /** Declaration of an invariant, before its symbol exists. */
  static class InvariantDef {
    final Ast.Exp body;
    final @Nullable String description;

    InvariantDef(Ast.Exp body, @Nullable String description) {
      this.body = body;
      this.description = description;
    }
  }
}

// End ClassType.java
