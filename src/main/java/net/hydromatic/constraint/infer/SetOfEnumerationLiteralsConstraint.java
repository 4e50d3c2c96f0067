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
import net.hydromatic.constraint.model.Enumeration;

/**
 * Constraint that a value is one of a set of literals of a given
 * enumeration.
 */
public class SetOfEnumerationLiteralsConstraint {
  public final Enumeration enumeration;
  public final ImmutableList<Enumeration.Literal> literals;

  public SetOfEnumerationLiteralsConstraint(
      Enumeration enumeration, List<Enumeration.Literal> literals) {
    this.enumeration = requireNonNull(enumeration);
    this.literals = ImmutableList.copyOf(literals);
    for (Enumeration.Literal literal : this.literals) {
      checkArgument(
          literal.enumeration == enumeration,
          "literal %s does not belong to enumeration %s",
          literal,
          enumeration);
    }
  }

  @Override
  public String toString() {
    return "SetOfEnumerationLiteralsConstraint(enumeration="
        + enumeration
        + ", "
        + literals
        + ")";
  }
}

// End SetOfEnumerationLiteralsConstraint.java
