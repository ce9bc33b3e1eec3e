// Copyright 2026 The Green-Marl Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.greenmarl.java.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)} or {@link #visitAll} on child fields.
 *
 * <p>Symbol tables are not nodes and are not visited; see {@link Traversal} for a walk that also
 * reports declarations.
 */
public class NodeVisitor {

  // visit() overloads in this class are ordered by node type, first by category (root / statement /
  // expression), then alphabetically within category.

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  public void visit(ProcedureDefinition node) {
    visit(node.getBody());
  }

  // ==== Statement nodes ====

  public void visit(AssignmentStatement node) {
    visit(node.getTarget());
    visit(node.getRHS());
  }

  public void visit(CallStatement node) {
    visit(node.getCall());
  }

  public void visit(ForeachStatement node) {
    visit(node.getIterator());
    visit(node.getSource());
    visit(node.getBody());
  }

  public void visit(IfStatement node) {
    visit(node.getCondition());
    visit(node.getThenBranch());
    if (node.getElseBranch() != null) {
      visit(node.getElseBranch());
    }
  }

  public void visit(ReturnStatement node) {
    if (node.getResult() != null) {
      visit(node.getResult());
    }
  }

  public void visit(SequenceStatement node) {
    visitAll(node.getStatements());
  }

  public void visit(WhileStatement node) {
    if (node.isDoWhile()) {
      visit(node.getBody());
      visit(node.getCondition());
    } else {
      visit(node.getCondition());
      visit(node.getBody());
    }
  }

  // ==== Expression nodes ====

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(@SuppressWarnings("unused") BooleanLiteral node) {}

  public void visit(BuiltinCall node) {
    visit(node.getDriver());
    visitAll(node.getArguments());
  }

  public void visit(FieldAccess node) {
    visit(node.getBase());
    visit(node.getMember());
  }

  public void visit(Identifier node) {}

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Helpers for sequences of nodes ====

  /** Visits a sequence of nodes (e.g. the statements of a block, or call arguments). */
  // Final because this method is called across completely different categories of nodes, so it is
  // usually a mistake to attempt to override it.
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }
}
