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

import net.hydromatic.constraint.ast.Pos;

/**
 * Property of a class.
 *
 * <p>A class lists the properties it inherits as the same objects that its
 * ancestor lists. Properties do not override {@link #equals}, so two
 * same-named properties declared on different classes are different keys.
 */
public class Property {
  public final Pos pos;
  public final String name;
  public final TypeAnnotation typeAnnotation;
  /** Class that declares this property. */
  public final ClassType specifiedFor;

  Property(
      Pos pos,
      String name,
      TypeAnnotation typeAnnotation,
      ClassType specifiedFor) {
    this.pos = requireNonNull(pos);
    this.name = requireNonNull(name);
    this.typeAnnotation = requireNonNull(typeAnnotation);
    this.specifiedFor = requireNonNull(specifiedFor);
  }

  @Override
  public String toString() {
    return specifiedFor.name + "." + name;
  }
}

// End Property.java
