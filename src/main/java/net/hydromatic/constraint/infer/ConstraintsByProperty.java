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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.constraint.model.Property;

/**
 * All inferred constraints on the properties of one class.
 *
 * <p>Each map preserves the order in which properties were first
 * constrained. A property absent from a map has no constraint of that kind.
 */
public class ConstraintsByProperty {
  public final ImmutableMap<Property, LenConstraint> lenConstraintsByProperty;
  public final ImmutableMap<Property, ImmutableList<PatternConstraint>>
      patternsByProperty;
  public final ImmutableMap<Property, SetOfPrimitivesConstraint>
      setOfPrimitivesByProperty;
  public final ImmutableMap<Property, SetOfEnumerationLiteralsConstraint>
      setOfEnumerationLiteralsByProperty;

  public ConstraintsByProperty(
      Map<Property, LenConstraint> lenConstraintsByProperty,
      Map<Property, ? extends List<PatternConstraint>> patternsByProperty,
      Map<Property, SetOfPrimitivesConstraint> setOfPrimitivesByProperty,
      Map<Property, SetOfEnumerationLiteralsConstraint>
          setOfEnumerationLiteralsByProperty) {
    this.lenConstraintsByProperty =
        ImmutableMap.copyOf(lenConstraintsByProperty);
    final ImmutableMap.Builder<Property, ImmutableList<PatternConstraint>>
        patterns = ImmutableMap.builder();
    patternsByProperty.forEach(
        (property, list) -> patterns.put(property, ImmutableList.copyOf(list)));
    this.patternsByProperty = patterns.build();
    this.setOfPrimitivesByProperty =
        ImmutableMap.copyOf(setOfPrimitivesByProperty);
    this.setOfEnumerationLiteralsByProperty =
        ImmutableMap.copyOf(setOfEnumerationLiteralsByProperty);
  }

  /** Returns whether there are no constraints at all. */
  public boolean isEmpty() {
    return lenConstraintsByProperty.isEmpty()
        && patternsByProperty.isEmpty()
        && setOfPrimitivesByProperty.isEmpty()
        && setOfEnumerationLiteralsByProperty.isEmpty();
  }

  @Override
  public String toString() {
    return Dumper.dump(this);
  }
}

// End ConstraintsByProperty.java
