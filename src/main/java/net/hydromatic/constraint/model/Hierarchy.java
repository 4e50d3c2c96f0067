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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Utilities for the inheritance hierarchy of symbols. */
public abstract class Hierarchy {
  private Hierarchy() {}

  /**
   * Sorts symbols so that every symbol comes after all of its parents.
   *
   * <p>The sort is stable: a symbol moves earlier only as far as needed to
   * follow its parents, so a list that is already sorted is returned in the
   * same order.
   *
   * <p>Because symbols are immutable and a parent must be built before its
   * child, the hierarchy cannot contain a cycle.
   *
   * @throws IllegalArgumentException if a parent of a symbol is not in the
   *     list, or a symbol occurs more than once
   */
  public static ImmutableList<Symbol> topologicallySort(
      List<? extends Symbol> symbols) {
    final Set<Symbol> all = new HashSet<>();
    for (Symbol symbol : symbols) {
      checkArgument(all.add(symbol), "duplicate symbol %s", symbol);
    }
    final Set<Symbol> sorted = new LinkedHashSet<>();
    for (Symbol symbol : symbols) {
      visit(symbol, all, sorted);
    }
    return ImmutableList.copyOf(sorted);
  }

  private static void visit(
      Symbol symbol, Set<Symbol> all, Set<Symbol> sorted) {
    if (sorted.contains(symbol)) {
      return;
    }
    for (Symbol parent : symbol.parents()) {
      checkArgument(
          all.contains(parent),
          "parent %s of %s is not among the symbols",
          parent,
          symbol);
      visit(parent, all, sorted);
    }
    sorted.add(symbol);
  }
}

// End Hierarchy.java
