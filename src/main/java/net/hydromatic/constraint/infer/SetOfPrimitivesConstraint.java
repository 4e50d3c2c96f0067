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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.constraint.model.PrimitiveSetLiteral;
import net.hydromatic.constraint.model.PrimitiveType;

/** Constraint that a value is one of a set of primitive literals. */
public class SetOfPrimitivesConstraint {
  public final PrimitiveType aType;
  public final ImmutableList<PrimitiveSetLiteral> literals;

  public SetOfPrimitivesConstraint(
      PrimitiveType aType, List<PrimitiveSetLiteral> literals) {
    this.aType = requireNonNull(aType);
    this.literals = ImmutableList.copyOf(literals);
    for (PrimitiveSetLiteral literal : this.literals) {
      checkArgument(
          literal.aType == aType,
          "literal %s has type %s, expected %s",
          literal,
          literal.aType,
          aType);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(aType, literals);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SetOfPrimitivesConstraint
            && aType == ((SetOfPrimitivesConstraint) o).aType
            && literals.equals(((SetOfPrimitivesConstraint) o).literals);
  }

  @Override
  public String toString() {
    return "SetOfPrimitivesConstraint(a_type=" + aType + ", " + literals + ")";
  }
}

// End SetOfPrimitivesConstraint.java
