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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.constraint.ast.AstBuilder.SELF;

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import net.hydromatic.constraint.ast.Ast;
import net.hydromatic.constraint.ast.AstNode;
import net.hydromatic.constraint.ast.Op;
import net.hydromatic.constraint.ast.Visitor;
import net.hydromatic.constraint.model.PatternVerification;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matchers that recognize the shapes of invariant that imply a constraint.
 *
 * <p>Every matcher is total: it returns null for any expression it does not
 * recognize, and never throws.
 */
public abstract class Idioms {
  /** Name of the built-in function that computes a length. */
  public static final String LEN = "len";

  private Idioms() {}

  /** Returns whether an expression is a reference to {@code self}. */
  public static boolean isSelf(Ast.Exp exp) {
    return exp.op == Op.NAME && ((Ast.Name) exp).identifier.equals(SELF);
  }

  /**
   * Matches an access to a property, "{@code self.name}", and returns the
   * name of the property, or null.
   */
  public static @Nullable String matchProperty(Ast.Exp exp) {
    if (exp.op == Op.MEMBER) {
      final Ast.Member member = (Ast.Member) exp;
      if (isSelf(member.instance)) {
        return member.name;
      }
    }
    return null;
  }

  /** Matches an integer literal and returns its value, or null. */
  public static @Nullable Long matchIntLiteral(Ast.Exp exp) {
    return exp.op == Op.INT_LITERAL ? (Long) ((Ast.Literal) exp).value : null;
  }

  /**
   * Matches "{@code len(self)}" or "{@code len(self.name)}" and returns the
   * argument, or null.
   */
  public static Ast.@Nullable Exp matchLenCall(Ast.Exp exp) {
    if (exp.op != Op.FUNCTION_CALL) {
      return null;
    }
    final Ast.FunctionCall call = (Ast.FunctionCall) exp;
    if (!call.name.identifier.equals(LEN) || call.args.size() != 1) {
      return null;
    }
    final Ast.Exp arg = call.args.get(0);
    return isSelf(arg) || matchProperty(arg) != null ? arg : null;
  }

  /**
   * Matches a comparison between the length of {@code self} or of a property
   * and an integer literal, such as "{@code len(self.x) < 42}" or "{@code 42 >
   * len(self.x)}".
   *
   * <p>A comparison with the literal on the left is first reversed, so that
   * both forms give the same bound. The comparator {@code !=} gives no bound,
   * nor does a bound that does not fit in an {@code int}.
   */
  public static @Nullable LengthBound matchLenConstraint(Ast.Exp exp) {
    if (!exp.op.isComparator()) {
      return null;
    }
    final Ast.Comparison comparison = (Ast.Comparison) exp;

    Ast.@Nullable Exp target = matchLenCall(comparison.a0);
    if (target != null) {
      final Long constant = matchIntLiteral(comparison.a1);
      if (constant != null) {
        return toBound(comparison.op, constant, target, comparison);
      }
    }

    target = matchLenCall(comparison.a1);
    if (target != null) {
      final Long constant = matchIntLiteral(comparison.a0);
      if (constant != null) {
        return toBound(comparison.op.reverse(), constant, target, comparison);
      }
    }
    return null;
  }

  /**
   * Converts "{@code len(target) op constant}" into a bound, or returns null
   * if it does not constrain the length.
   */
  private static @Nullable LengthBound toBound(
      Op op, long constant, Ast.Exp target, Ast.Comparison node) {
    final LengthBound.Kind kind;
    final long value;
    switch (op) {
      case LT:
        kind = LengthBound.Kind.MAX;
        value = constant - 1;
        break;
      case LE:
        kind = LengthBound.Kind.MAX;
        value = constant;
        break;
      case EQ:
        kind = LengthBound.Kind.EXACT;
        value = constant;
        break;
      case GT:
        kind = LengthBound.Kind.MIN;
        value = constant + 1;
        break;
      case GE:
        kind = LengthBound.Kind.MIN;
        value = constant;
        break;
      case NE:
        // "len(x) != 42" has no simple representation in a schema
        return null;
      default:
        throw new AssertionError("unexpected comparator " + op);
    }
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      return null;
    }
    return new LengthBound(kind, (int) value, target, node);
  }

  /**
   * Matches an invariant that holds only if an optional property is set, in
   * one of the forms
   *
   * <ul>
   *   <li>{@code not (self.p is not None) or CONSEQUENT}, as an {@link
   *       Ast.Implication} or as an {@link Ast.Or} whose first value is an
   *       {@link Ast.Not};
   *   <li>{@code self.p is None or CONSEQUENT}.
   * </ul>
   */
  public static @Nullable ConditionalOnProperty matchConditionalOnProperty(
      Ast.Exp exp) {
    switch (exp.op) {
      case IMPLICATION:
        final Ast.Implication implication = (Ast.Implication) exp;
        return conditional(
            matchIsNotNoneOnProperty(implication.antecedent),
            implication.consequent);

      case OR:
        final Ast.Or or = (Ast.Or) exp;
        if (or.values.size() != 2) {
          return null;
        }
        final Ast.Exp first = or.values.get(0);
        switch (first.op) {
          case IS_NONE:
            return conditional(
                matchProperty(((Ast.IsNone) first).value), or.values.get(1));
          case NOT:
            return conditional(
                matchIsNotNoneOnProperty(((Ast.Not) first).operand),
                or.values.get(1));
          default:
            return null;
        }

      default:
        return null;
    }
  }

  /** Matches "{@code self.p is not None}" and returns "p", or null. */
  private static @Nullable String matchIsNotNoneOnProperty(Ast.Exp exp) {
    return exp.op == Op.IS_NOT_NONE
        ? matchProperty(((Ast.IsNotNone) exp).value)
        : null;
  }

  private static @Nullable ConditionalOnProperty conditional(
      @Nullable String propertyName, Ast.Exp consequent) {
    return propertyName == null
        ? null
        : new ConditionalOnProperty(propertyName, consequent);
  }

  /** Matches "{@code self.p in NAME}", where NAME is not yet resolved. */
  public static @Nullable PropertyInNamedContainer
      matchPropertyInNamedContainer(Ast.Exp exp) {
    if (exp.op != Op.IS_IN) {
      return null;
    }
    final Ast.IsIn isIn = (Ast.IsIn) exp;
    final String propertyName = matchProperty(isIn.member);
    if (propertyName == null || isIn.container.op != Op.NAME) {
      return null;
    }
    return new PropertyInNamedContainer(
        propertyName, ((Ast.Name) isIn.container).identifier, isIn);
  }

  /**
   * Matches a call to a function with a single argument that is a property,
   * "{@code f(self.p)}".
   *
   * <p>Only positional arguments are matched.
   */
  public static @Nullable FunctionOnProperty matchSingleArgFunctionOnProperty(
      Ast.Exp exp) {
    if (exp.op != Op.FUNCTION_CALL) {
      return null;
    }
    final Ast.FunctionCall call = (Ast.FunctionCall) exp;
    if (call.args.size() != 1) {
      return null;
    }
    final String propertyName = matchProperty(call.args.get(0));
    return propertyName == null
        ? null
        : new FunctionOnProperty(call.name.identifier, propertyName, call);
  }

  /**
   * Matches a call to a function whose single argument is {@code self},
   * "{@code f(self)}", and returns the function name, or null.
   */
  public static @Nullable String matchSingleArgFunctionOnSelf(Ast.Exp exp) {
    if (exp.op != Op.FUNCTION_CALL) {
      return null;
    }
    final Ast.FunctionCall call = (Ast.FunctionCall) exp;
    return call.args.size() == 1 && isSelf(call.args.get(0))
        ? call.name.identifier
        : null;
  }

  /**
   * Matches a call to a registered pattern-verification function on a
   * property, such as "{@code is_MIME_type(self.content_type)}".
   */
  public static @Nullable PatternOnProperty matchPatternOnProperty(
      Ast.Exp exp, PatternVerificationsByName verifications) {
    final FunctionOnProperty match = matchSingleArgFunctionOnProperty(exp);
    if (match == null) {
      return null;
    }
    final PatternVerification verification =
        verifications.get(match.functionName);
    return verification == null
        ? null
        : new PatternOnProperty(
            match.propertyName, new PatternConstraint(verification.pattern));
  }

  /**
   * Matches a call to a registered pattern-verification function on
   * {@code self}, such as "{@code is_MIME_type(self)}".
   */
  public static @Nullable PatternConstraint matchPatternOnSelf(
      Ast.Exp exp, PatternVerificationsByName verifications) {
    final String functionName = matchSingleArgFunctionOnSelf(exp);
    if (functionName == null) {
      return null;
    }
    final PatternVerification verification = verifications.get(functionName);
    return verification == null
        ? null
        : new PatternConstraint(verification.pattern);
  }

  /**
   * Splits a conjunction into its conjuncts.
   *
   * <p>Nested conjunctions are flattened; an expression that is not a
   * conjunction is its own single conjunct.
   */
  public static ImmutableList<Ast.Exp> conjuncts(Ast.Exp exp) {
    final ConjunctCollector collector = new ConjunctCollector();
    collector.accept(exp);
    return collector.conjuncts.build();
  }

  /**
   * Applies a matcher to the conjuncts of an invariant body, and returns the
   * matches that name a property.
   *
   * <p>If the body is conditional on an optional property, the matcher is
   * applied to the conjuncts of the consequent, and only the matches on that
   * property are returned. Conjuncts that do not match are dropped.
   *
   * @param body Body of an invariant
   * @param matcher Matcher; returns null if a conjunct does not match
   * @param propertyOf Returns the name of the property a match is on, or null
   * @param <M> Type of match
   */
  public static <M> ImmutableList<M> matchOnProperties(
      Ast.Exp body,
      Function<Ast.Exp, @Nullable M> matcher,
      Function<M, @Nullable String> propertyOf) {
    final ImmutableList.Builder<M> matches = ImmutableList.builder();
    final ConditionalOnProperty conditional = matchConditionalOnProperty(body);
    final Ast.Exp exp = conditional != null ? conditional.consequent : body;
    for (Ast.Exp conjunct : conjuncts(exp)) {
      final M match = matcher.apply(conjunct);
      if (match == null) {
        continue;
      }
      final String propertyName = propertyOf.apply(match);
      if (propertyName == null) {
        continue;
      }
      if (conditional == null
          || conditional.propertyName.equals(propertyName)) {
        matches.add(match);
      }
    }
    return matches.build();
  }

  /** Visitor that collects the conjuncts of an expression. */
  private static class ConjunctCollector extends Visitor {
    final ImmutableList.Builder<Ast.Exp> conjuncts = ImmutableList.builder();

    @Override
    protected <E extends AstNode> void accept(E e) {
      if (e.op == Op.AND) {
        // visit(Ast.And) calls back into this method for each value
        e.accept(this);
      } else {
        conjuncts.add((Ast.Exp) e);
      }
    }
  }

  /** Match of an invariant that is conditional on an optional property. */
  public static class ConditionalOnProperty {
    public final String propertyName;
    public final Ast.Exp consequent;

    ConditionalOnProperty(String propertyName, Ast.Exp consequent) {
      this.propertyName = requireNonNull(propertyName);
      this.consequent = requireNonNull(consequent);
    }
  }

  /** Match of "{@code self.p in NAME}". */
  public static class PropertyInNamedContainer {
    public final String propertyName;
    public final String containerName;
    public final Ast.IsIn node;

    PropertyInNamedContainer(
        String propertyName, String containerName, Ast.IsIn node) {
      this.propertyName = requireNonNull(propertyName);
      this.containerName = requireNonNull(containerName);
      this.node = requireNonNull(node);
    }
  }

  /** Match of "{@code f(self.p)}". */
  public static class FunctionOnProperty {
    public final String functionName;
    public final String propertyName;
    public final Ast.FunctionCall node;

    FunctionOnProperty(
        String functionName, String propertyName, Ast.FunctionCall node) {
      this.functionName = requireNonNull(functionName);
      this.propertyName = requireNonNull(propertyName);
      this.node = requireNonNull(node);
    }
  }

  /** Match of a registered pattern function applied to a property. */
  public static class PatternOnProperty {
    public final String propertyName;
    public final PatternConstraint constraint;

    PatternOnProperty(String propertyName, PatternConstraint constraint) {
      this.propertyName = requireNonNull(propertyName);
      this.constraint = requireNonNull(constraint);
    }
  }
}

// End Idioms.java
