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

import java.util.List;
import net.hydromatic.constraint.ast.Pos;

/**
 * A type defined in the meta-model: a class, a constrained primitive or an
 * enumeration.
 *
 * <p>Symbols are compared by identity.
 */
public abstract class Symbol {
  public final Pos pos;
  public final String name;

  protected Symbol(Pos pos, String name) {
    this.pos = requireNonNull(pos);
    this.name = requireNonNull(name);
  }

  /** Returns the symbols that this symbol directly inherits from. */
  public abstract List<? extends Symbol> parents();

  @Override
  public String toString() {
    return name;
  }
}

// End Symbol.java
