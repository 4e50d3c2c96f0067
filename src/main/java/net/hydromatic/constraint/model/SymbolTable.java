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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finalized meta-model: symbols, constants and verification functions.
 *
 * <p>Symbols are held in one explicit order in which every symbol comes after
 * its parents. {@link Hierarchy#topologicallySort} produces such an order
 * from declaration order.
 */
public class SymbolTable {
  /** Symbols, parents before children. */
  public final ImmutableList<Symbol> symbols;

  public final ImmutableMap<String, Constant> constantsByName;
  public final ImmutableList<Verification> verifications;

  private final ImmutableMap<String, Symbol> symbolsByName;

  private SymbolTable(
      ImmutableList<Symbol> symbols,
      ImmutableMap<String, Symbol> symbolsByName,
      ImmutableMap<String, Constant> constantsByName,
      ImmutableList<Verification> verifications) {
    this.symbols = symbols;
    this.symbolsByName = symbolsByName;
    this.constantsByName = constantsByName;
    this.verifications = verifications;
  }

  /**
   * Creates a symbol table.
   *
   * @param symbolsTopologicallySorted Symbols; each must occur after all of
   *     its parents
   * @param constants Constants, with distinct names
   * @param verifications Verification functions
   * @throws IllegalArgumentException if the symbols are not in topological
   *     order, or names are not unique
   */
  public static SymbolTable create(
      List<? extends Symbol> symbolsTopologicallySorted,
      List<? extends Constant> constants,
      List<? extends Verification> verifications) {
    final Set<Symbol> seen = new HashSet<>();
    final Map<String, Symbol> symbolsByName = new LinkedHashMap<>();
    for (Symbol symbol : symbolsTopologicallySorted) {
      for (Symbol parent : symbol.parents()) {
        checkArgument(
            seen.contains(parent),
            "symbols are not in topological order: %s precedes its parent %s",
            symbol,
            parent);
      }
      seen.add(symbol);
      checkArgument(
          symbolsByName.put(symbol.name, symbol) == null,
          "duplicate symbol name %s",
          symbol.name);
    }
    final Map<String, Constant> constantsByName = new LinkedHashMap<>();
    for (Constant constant : constants) {
      checkArgument(
          constantsByName.put(constant.name, constant) == null,
          "duplicate constant name %s",
          constant.name);
    }
    return new SymbolTable(
        ImmutableList.copyOf(symbolsTopologicallySorted),
        ImmutableMap.copyOf(symbolsByName),
        ImmutableMap.copyOf(constantsByName),
        ImmutableList.copyOf(verifications));
  }

  /** Returns the classes, parents before children. */
  public ImmutableList<ClassType> classes() {
    return ofType(ClassType.class);
  }

  /** Returns the constrained primitives, parents before children. */
  public ImmutableList<ConstrainedPrimitive> constrainedPrimitives() {
    return ofType(ConstrainedPrimitive.class);
  }

  public ImmutableList<Enumeration> enumerations() {
    return ofType(Enumeration.class);
  }

  private <S extends Symbol> ImmutableList<S> ofType(Class<S> clazz) {
    final ImmutableList.Builder<S> list = ImmutableList.builder();
    for (Symbol symbol : symbols) {
      if (clazz.isInstance(symbol)) {
        list.add(clazz.cast(symbol));
      }
    }
    return list.build();
  }

  /** Looks up a symbol by name; returns null if not found. */
  public @Nullable Symbol find(String name) {
    return symbolsByName.get(name);
  }

  /** Looks up a symbol by name; throws if not found. */
  public Symbol mustFind(String name) {
    final Symbol symbol = symbolsByName.get(name);
    if (symbol == null) {
      throw new IllegalArgumentException("symbol not found: " + name);
    }
    return symbol;
  }

  /** Looks up a constant by name; returns null if not found. */
  public @Nullable Constant constant(String name) {
    return constantsByName.get(name);
  }
}

// End SymbolTable.java
