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
package net.greenmarl.java.gps;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.annotation.Flag;
import net.greenmarl.java.annotation.ValueKey;
import net.greenmarl.java.check.ErrorReporter;
import net.greenmarl.java.check.ProcedurePass;
import net.greenmarl.java.syntax.BinaryOperatorExpression;
import net.greenmarl.java.syntax.BuiltinCall;
import net.greenmarl.java.syntax.Expression;
import net.greenmarl.java.syntax.FieldAccess;
import net.greenmarl.java.syntax.ForeachStatement;
import net.greenmarl.java.syntax.Identifier;
import net.greenmarl.java.syntax.Node;
import net.greenmarl.java.syntax.ProcedureDefinition;
import net.greenmarl.java.syntax.Statement;
import net.greenmarl.java.syntax.Symbol;
import net.greenmarl.java.syntax.Traversal;
import net.greenmarl.java.syntax.TraversalCallback;
import net.greenmarl.java.syntax.TraversalOptions;
import net.greenmarl.java.syntax.UnaryOperatorExpression;

/**
 * Records the {@link ExpressionScope} of every expression used as a value. Requires the loop
 * classification of {@link InnerLoopClassifier}. Never fails.
 */
public final class ExpressionScopeAnalyzer implements ProcedurePass {

  /** On an expression: the innermost scope of the values it reads. */
  public static final ValueKey<ExpressionScope> EXPRESSION_SCOPE =
      ValueKey.of("EXPRESSION_SCOPE", ExpressionScope.class);

  @Override
  public String name() {
    return "expression scope analysis";
  }

  @Override
  public boolean process(ProcedureDefinition proc, AnnotationStore store, ErrorReporter reporter) {
    Traversal.walk(proc, TraversalOptions.all(), new Analyzer(store));
    return true;
  }

  private static final class Analyzer implements TraversalCallback {
    private final AnnotationStore store;
    private final Map<Symbol, ExpressionScope> declared = new HashMap<>();
    @Nullable private ForeachStatement outerLoop;
    @Nullable private ForeachStatement innerLoop;

    Analyzer(AnnotationStore store) {
      this.store = store;
    }

    @Override
    public boolean onEnterStatement(Statement stmt) {
      if (stmt.kind() == Statement.Kind.FOREACH) {
        if (store.isSet(stmt, Flag.OUTER_LOOP)) {
          outerLoop = (ForeachStatement) stmt;
        } else if (store.isSet(stmt, Flag.INNER_LOOP)) {
          innerLoop = (ForeachStatement) stmt;
        }
      }
      return true;
    }

    @Override
    public boolean onExitStatement(Statement stmt) {
      if (stmt == innerLoop) {
        innerLoop = null;
      } else if (stmt == outerLoop) {
        outerLoop = null;
      }
      return true;
    }

    // Loop iterators are declared by the loop itself, so they are seen after the loop is entered.
    @Override
    public boolean onSymbol(Symbol symbol, Node declaringNode) {
      ExpressionScope scope;
      if (innerLoop != null) {
        scope = symbol.getType().isEdge() ? ExpressionScope.EDGE : ExpressionScope.IN;
      } else if (outerLoop != null) {
        scope = ExpressionScope.OUT;
      } else {
        scope = ExpressionScope.GLOBAL;
      }
      declared.put(symbol, scope);
      return true;
    }

    // Annotates the whole expression tree at once, so its operands need not be visited again.
    @Override
    public boolean onExpression(Expression expr) {
      annotate(expr);
      return false;
    }

    private ExpressionScope annotate(Expression expr) {
      ExpressionScope scope;
      switch (expr.kind()) {
        case IDENTIFIER:
          scope = scopeOf(((Identifier) expr).getSymbol());
          break;
        case FIELD_ACCESS:
          scope = scopeOfDriver(((FieldAccess) expr).getBase().getSymbol());
          break;
        case BUILTIN_CALL:
          BuiltinCall call = (BuiltinCall) expr;
          scope = scopeOf(call.getDriver().getSymbol());
          for (Expression arg : call.getArguments()) {
            scope = ExpressionScope.max(scope, annotate(arg));
          }
          break;
        case BINARY_OPERATOR:
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          scope = ExpressionScope.max(annotate(binop.getX()), annotate(binop.getY()));
          break;
        case UNARY_OPERATOR:
          scope = annotate(((UnaryOperatorExpression) expr).getX());
          break;
        case INT_LITERAL:
        case BOOLEAN_LITERAL:
          scope = ExpressionScope.GLOBAL;
          break;
        default:
          throw new AssertionError(expr.kind());
      }
      store.setValue(expr, EXPRESSION_SCOPE, scope);
      return scope;
    }

    private ExpressionScope scopeOf(Symbol symbol) {
      // Symbols not declared in the walked tree (e.g. properties) are treated as global.
      return declared.getOrDefault(symbol, ExpressionScope.GLOBAL);
    }

    // Scope of a property read through the given node or edge.
    private ExpressionScope scopeOfDriver(Symbol driver) {
      if (outerLoop != null && driver == outerLoop.getIterator().getSymbol()) {
        return ExpressionScope.OUT;
      }
      if (innerLoop != null && driver == innerLoop.getIterator().getSymbol()) {
        return ExpressionScope.IN;
      }
      if (innerLoop != null && scopeOf(driver) == ExpressionScope.EDGE) {
        return ExpressionScope.EDGE;
      }
      return ExpressionScope.RANDOM;
    }
  }
}
