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

import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.Symbol;

/** Called on various events during constraint inference. */
public interface Tracer {
  /**
   * Called when the length constraint of a constrained primitive has been
   * narrowed by its ancestors.
   */
  void onConstrainedPrimitive(
      ConstrainedPrimitive constrainedPrimitive, LenConstraint constraint);

  /**
   * Called with the constraints inferred for a class from its own invariants
   * and, if inlining is enabled, the constrained primitives of its
   * properties.
   */
  void onClassConstraints(ClassType cls, ConstraintsByProperty constraints);

  /** Called with the constraints of a class merged with its ancestors'. */
  void onMergedConstraints(ClassType cls, ConstraintsByProperty constraints);

  /**
   * Called with the errors found for a class or constrained primitive. The
   * errors are still thrown when inference finishes.
   */
  void onException(Symbol symbol, ConstraintException e);
}

// End Tracer.java
