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

import static java.util.Objects.requireNonNull;

import net.hydromatic.constraint.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Boolean predicate that must hold for every instance of a class or
 * constrained primitive.
 */
public class Invariant {
  /**
   * Class or constrained primitive on which the invariant is declared. A
   * descendant lists the invariant too, but this field does not change.
   */
  public final Symbol specifiedFor;

  public final Ast.Exp body;
  public final @Nullable String description;

  Invariant(Symbol specifiedFor, Ast.Exp body, @Nullable String description) {
    this.specifiedFor = requireNonNull(specifiedFor);
    this.body = requireNonNull(body);
    this.description = description;
  }

  @Override
  public String toString() {
    return body.toString();
  }
}

// End Invariant.java
