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
package net.hydromatic.constraint.ast;

/**
 * Visits syntax trees.
 *
 * <p>The default implementation of each method visits the node's children.
 */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Ast.Name name) {}

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Member member) {
    member.instance.accept(this);
  }

  protected void visit(Ast.FunctionCall functionCall) {
    functionCall.name.accept(this);
    functionCall.args.forEach(this::accept);
  }

  protected void visit(Ast.Comparison comparison) {
    comparison.a0.accept(this);
    comparison.a1.accept(this);
  }

  protected void visit(Ast.IsIn isIn) {
    isIn.member.accept(this);
    isIn.container.accept(this);
  }

  protected void visit(Ast.IsNone isNone) {
    isNone.value.accept(this);
  }

  protected void visit(Ast.IsNotNone isNotNone) {
    isNotNone.value.accept(this);
  }

  protected void visit(Ast.Not not) {
    not.operand.accept(this);
  }

  protected void visit(Ast.And and) {
    and.values.forEach(this::accept);
  }

  protected void visit(Ast.Or or) {
    or.values.forEach(this::accept);
  }

  protected void visit(Ast.Implication implication) {
    implication.antecedent.accept(this);
    implication.consequent.accept(this);
  }
}

// End Visitor.java
