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

import com.google.common.base.Preconditions;

/**
 * A Traversal walks a procedure once, depth first and in source order, and reports what it meets to
 * a {@link TraversalCallback}: symbols at their declaring scope, statements before (and, with
 * {@link TraversalOptions#separatePostPass}, after) their children, and expressions before their
 * operands.
 *
 * <p>Only expressions used as values are reported. The target of an assignment, the iterator and
 * source of a foreach loop, the driver of a builtin call, and the two names of a field access are
 * not.
 *
 * <p>A callback returning false stops the walk locally:
 *
 * <ul>
 *   <li>from {@code onEnterStatement}: the statement's children are skipped, and so are its
 *       remaining siblings in the enclosing sequence. {@code onExitStatement} is still called for
 *       the statement itself, and enclosing statements carry on as usual.
 *   <li>from {@code onExitStatement}: the statement's remaining siblings are skipped.
 *   <li>from {@code onExpression}: the expression's operands are skipped.
 *   <li>from {@code onSymbol}: the remaining symbols of the same scope are skipped.
 * </ul>
 *
 * <p>The traversal never aborts as a whole and never inspects errors; callbacks that detect
 * problems record them themselves and the caller decides the outcome after the walk.
 */
public final class Traversal extends NodeVisitor {

  private final TraversalOptions options;
  private final TraversalCallback callback;

  private Traversal(TraversalOptions options, TraversalCallback callback) {
    this.options = Preconditions.checkNotNull(options);
    this.callback = Preconditions.checkNotNull(callback);
  }

  /** Walks the parameters and body of a procedure. */
  public static void walk(
      ProcedureDefinition proc, TraversalOptions options, TraversalCallback callback) {
    new Traversal(options, callback).visit(proc);
  }

  /** Walks a single statement and everything below it. */
  public static void walk(Statement stmt, TraversalOptions options, TraversalCallback callback) {
    new Traversal(options, callback).traverse(stmt);
  }

  @Override
  public void visit(Node node) {
    if (node instanceof Statement stmt) {
      traverse(stmt);
    } else if (node instanceof Expression expr) {
      traverse(expr);
    } else {
      node.accept(this);
    }
  }

  // Returns false if the statement's remaining siblings should be skipped.
  private boolean traverse(Statement stmt) {
    boolean cont = true;
    if (options.visitStatements()) {
      cont = callback.onEnterStatement(stmt);
    }
    if (cont) {
      stmt.accept(this);
    }
    if (options.separatePostPass()) {
      cont &= callback.onExitStatement(stmt);
    }
    return cont;
  }

  private void traverse(Expression expr) {
    if (!options.visitExpressions()) {
      return; // no statement is nested in an expression
    }
    if (callback.onExpression(expr)) {
      expr.accept(this);
    }
  }

  private void visitSymbols(SymbolTable symbols, Node declaringNode) {
    if (!options.visitSymbols()) {
      return;
    }
    for (Symbol sym : symbols.getSymbols()) {
      if (!callback.onSymbol(sym, declaringNode)) {
        break;
      }
    }
  }

  @Override
  public void visit(ProcedureDefinition node) {
    visitSymbols(node.getParameters(), node);
    traverse(node.getBody());
  }

  @Override
  public void visit(SequenceStatement node) {
    visitSymbols(node.getSymbols(), node);
    for (Statement stmt : node.getStatements()) {
      if (!traverse(stmt)) {
        break;
      }
    }
  }

  @Override
  public void visit(ForeachStatement node) {
    visitSymbols(node.getSymbols(), node);
    traverse(node.getBody());
  }

  @Override
  public void visit(AssignmentStatement node) {
    traverse(node.getRHS());
  }

  @Override
  public void visit(CallStatement node) {
    traverse(node.getCall());
  }

  @Override
  public void visit(BuiltinCall node) {
    visitAll(node.getArguments());
  }

  @Override
  public void visit(FieldAccess node) {}
}
