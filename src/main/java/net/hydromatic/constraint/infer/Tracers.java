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

import java.util.function.BiConsumer;
import net.hydromatic.constraint.model.ClassType;
import net.hydromatic.constraint.model.ConstrainedPrimitive;
import net.hydromatic.constraint.model.Symbol;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the narrowed length
   * constraint of a constrained primitive, then calls the underlying tracer.
   */
  public static Tracer withOnConstrainedPrimitive(
      Tracer tracer, BiConsumer<ConstrainedPrimitive, LenConstraint> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConstrainedPrimitive(
          ConstrainedPrimitive constrainedPrimitive, LenConstraint constraint) {
        consumer.accept(constrainedPrimitive, constraint);
        super.onConstrainedPrimitive(constrainedPrimitive, constraint);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the constraints of a
   * class, then calls the underlying tracer.
   */
  public static Tracer withOnClassConstraints(
      Tracer tracer, BiConsumer<ClassType, ConstraintsByProperty> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onClassConstraints(
          ClassType cls, ConstraintsByProperty constraints) {
        consumer.accept(cls, constraints);
        super.onClassConstraints(cls, constraints);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the merged constraints
   * of a class, then calls the underlying tracer.
   */
  public static Tracer withOnMergedConstraints(
      Tracer tracer, BiConsumer<ClassType, ConstraintsByProperty> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onMergedConstraints(
          ClassType cls, ConstraintsByProperty constraints) {
        consumer.accept(cls, constraints);
        super.onMergedConstraints(cls, constraints);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when inference of a symbol
   * fails, then calls the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, BiConsumer<Symbol, ConstraintException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(Symbol symbol, ConstraintException e) {
        consumer.accept(symbol, e);
        super.onException(symbol, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onConstrainedPrimitive(
        ConstrainedPrimitive constrainedPrimitive, LenConstraint constraint) {}

    @Override
    public void onClassConstraints(
        ClassType cls, ConstraintsByProperty constraints) {}

    @Override
    public void onMergedConstraints(
        ClassType cls, ConstraintsByProperty constraints) {}

    @Override
    public void onException(Symbol symbol, ConstraintException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onConstrainedPrimitive(
        ConstrainedPrimitive constrainedPrimitive, LenConstraint constraint) {
      tracer.onConstrainedPrimitive(constrainedPrimitive, constraint);
    }

    @Override
    public void onClassConstraints(
        ClassType cls, ConstraintsByProperty constraints) {
      tracer.onClassConstraints(cls, constraints);
    }

    @Override
    public void onMergedConstraints(
        ClassType cls, ConstraintsByProperty constraints) {
      tracer.onMergedConstraints(cls, constraints);
    }

    @Override
    public void onException(Symbol symbol, ConstraintException e) {
      tracer.onException(symbol, e);
    }
  }
}

// End Tracers.java
