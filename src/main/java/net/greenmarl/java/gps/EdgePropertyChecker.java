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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.annotation.Flag;
import net.greenmarl.java.annotation.StatementList;
import net.greenmarl.java.annotation.SymbolMap;
import net.greenmarl.java.check.ErrorReporter;
import net.greenmarl.java.check.ProcedurePass;
import net.greenmarl.java.check.SemanticError;
import net.greenmarl.java.syntax.AssignmentStatement;
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

/**
 * Checks that every edge-property access in a two-level loop can be realized by the distributed
 * backend, where a vertex sends its out-going edges' property values along with its messages.
 *
 * <pre>
 * Foreach (n : G.Nodes) {
 *   Foreach (s : n.Nbrs) {
 *     Edge e = s.ToEdge();
 *     if (s.Y &gt; 10) e.C = 10; // error: conditional write
 *     e.A = e.B + n.Y;         // ok: e.B and n.Y are available to the sender
 *     e.B = s.Y;               // error: s.Y is only known to the receiver
 *     ... = e.A;               // A: write, sent
 *     e.A = 0;                 // A: sent, written again
 *     ... = e.A;               // error: two versions of A in one message
 *   }
 * }
 * </pre>
 *
 * <p>Edge properties may only be accessed through an edge variable bound in the inner loop as
 * {@code iterator.ToEdge()}, wherever the variable is declared. Such variables get {@link
 * Flag#EDGE_DEFINED_INNER}, cleared again when the loop ends if the variable outlives it; their
 * binding assignment gets {@link Flag#EDGE_DEFINING_WRITE}, and the loop {@link
 * Flag#EDGE_DEFINING_INNER}. When it ends, the loop also gets the list of its edge-property writes
 * ({@link StatementList#EDGE_PROP_WRITES}) and the final {@link EdgeAccessState} of each property
 * ({@link SymbolMap#EDGE_PROP_ACCESS}), which code generation uses to lay out messages. Both are
 * computed afresh on every run, replacing what an earlier run stored.
 *
 * <p>Requires the annotations of {@link InnerLoopClassifier} and {@link ExpressionScopeAnalyzer}.
 */
public final class EdgePropertyChecker implements ProcedurePass {

  @Override
  public String name() {
    return "edge property check";
  }

  @Override
  public boolean process(ProcedureDefinition proc, AnnotationStore store, ErrorReporter reporter) {
    Checker checker = new Checker(store, reporter);
    Traversal.walk(proc, TraversalOptions.all(), checker);
    return checker.ok;
  }

  // One instance per procedure.
  private static final class Checker implements TraversalCallback {
    private final AnnotationStore store;
    private final ErrorReporter reporter;
    // Edge variables currently bound to the inner iterator's edge.
    private final Set<Symbol> boundEdges = new HashSet<>();
    // Access state of each edge property in the current inner loop. Published on loop exit.
    private final Map<Symbol, EdgeAccessState> accessStates = new LinkedHashMap<>();
    // Edge-property writes of the current inner loop, in source order. Published on loop exit.
    private final List<Statement> writes = new ArrayList<>();
    @Nullable private ForeachStatement innerLoop;
    @Nullable private Symbol innerIterator;
    // Set while visiting the RHS of an assignment to an edge property.
    private boolean targetIsEdgeProperty;
    private boolean ok = true;

    Checker(AnnotationStore store, ErrorReporter reporter) {
      this.store = store;
      this.reporter = reporter;
    }

    @Override
    public boolean onEnterStatement(Statement stmt) {
      switch (stmt.kind()) {
        case FOREACH:
          if (store.isSet(stmt, Flag.INNER_LOOP)) {
            innerLoop = (ForeachStatement) stmt;
            innerIterator = innerLoop.getIterator().getSymbol();
            boundEdges.clear();
            accessStates.clear();
            writes.clear();
          }
          break;
        case ASSIGNMENT:
          AssignmentStatement assign = (AssignmentStatement) stmt;
          if (assign.isTargetScalar()) {
            checkEdgeBinding(assign);
          } else {
            checkEdgePropertyWrite(assign);
          }
          break;
        default:
          break;
      }
      return true;
    }

    @Override
    public boolean onExitStatement(Statement stmt) {
      if (stmt.kind() == Statement.Kind.FOREACH) {
        if (stmt == innerLoop) {
          leaveInnerLoop();
        }
      } else if (stmt.kind() == Statement.Kind.ASSIGNMENT) {
        targetIsEdgeProperty = false;
      }
      return true;
    }

    private void leaveInnerLoop() {
      Map<Symbol, Integer> ordinals = new LinkedHashMap<>();
      accessStates.forEach((property, state) -> ordinals.put(property, state.ordinal()));
      store.setMap(innerLoop, SymbolMap.EDGE_PROP_ACCESS, ordinals);
      store.setList(innerLoop, StatementList.EDGE_PROP_WRITES, writes);
      // An edge declared outside the loop no longer denotes the iterator's edge after it.
      for (Symbol edge : boundEdges) {
        if (!isDeclaredWithin(edge, innerLoop)) {
          store.setFlag(edge, Flag.EDGE_DEFINED_INNER, false);
        }
      }
      boundEdges.clear();
      accessStates.clear();
      writes.clear();
      innerLoop = null;
      innerIterator = null;
    }

    private static boolean isDeclaredWithin(Symbol symbol, Node scope) {
      for (Node n = symbol.getDeclaringTable().getOwner(); n != null; n = n.getParent()) {
        if (n == scope) {
          return true;
        }
      }
      return false;
    }

    // e = s.ToEdge(), where s is the inner iterator, binds e to the edge that reached s.
    private void checkEdgeBinding(AssignmentStatement assign) {
      Symbol sym = assign.getTargetIdentifier().getSymbol();
      if (!sym.getType().isEdge()) {
        return;
      }
      if (innerLoop != null && isInnerIteratorToEdge(assign.getRHS())) {
        boundEdges.add(sym);
        store.setFlag(sym, Flag.EDGE_DEFINED_INNER, true);
        store.setFlag(innerLoop, Flag.EDGE_DEFINING_INNER, true);
        store.setFlag(assign, Flag.EDGE_DEFINING_WRITE, true);
      } else if (boundEdges.remove(sym) || store.isSet(sym, Flag.EDGE_DEFINED_INNER)) {
        // Rebound to something else: later reads through it are random.
        store.setFlag(sym, Flag.EDGE_DEFINED_INNER, false);
      }
    }

    private boolean isInnerIteratorToEdge(Expression rhs) {
      if (rhs.kind() != Expression.Kind.BUILTIN_CALL) {
        return false;
      }
      BuiltinCall call = (BuiltinCall) rhs;
      return call.isToEdge() && call.getDriver().getSymbol() == innerIterator;
    }

    private void checkEdgePropertyWrite(AssignmentStatement assign) {
      FieldAccess target = assign.getTargetField();
      Symbol edge = target.getBase().getSymbol();
      if (!edge.getType().isEdgeCompatible() || !boundEdges.contains(edge)) {
        return;
      }
      Preconditions.checkState(
          innerLoop != null, "%s: edge '%s' used outside its inner loop", target, edge.getName());

      if (isConditional(assign)) {
        reporter.report(
            SemanticError.Kind.EDGE_WRITE_CONDITIONAL,
            target.getLocation(),
            edge.getName(),
            "write to edge property '%s' must not be conditional within the inner loop",
            target);
        ok = false;
      }

      targetIsEdgeProperty = true;
      writes.add(assign);
      boolean twoVersions =
          recordAccess(target.getMember().getSymbol(), EdgeAccessState.Access.WRITE);
      Preconditions.checkState(!twoVersions, "a write cannot create a second sent version");
    }

    // Reports whether a loop or conditional lies between the statement and the inner loop.
    private boolean isConditional(Statement stmt) {
      for (Node parent = stmt.getParent(); parent != innerLoop; parent = parent.getParent()) {
        Preconditions.checkState(parent != null, "%s is not inside the inner loop", stmt);
        if (parent instanceof Statement && ((Statement) parent).isLoopOrConditional()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public boolean onExpression(Expression expr) {
      if (targetIsEdgeProperty) {
        checkWriteOperand(expr);
      }
      if (expr.kind() == Expression.Kind.FIELD_ACCESS) {
        checkEdgePropertyRead((FieldAccess) expr);
      }
      return true;
    }

    // The RHS of an edge-property write is evaluated by the sender, which cannot see values that
    // only exist at the receiving end.
    private void checkWriteOperand(Expression expr) {
      ExpressionScope scope = store.getValueOrNull(expr, ExpressionScopeAnalyzer.EXPRESSION_SCOPE);
      if (scope == null || !scope.isInnerOrRandom()) {
        return;
      }
      Identifier offender;
      if (expr.kind() == Expression.Kind.FIELD_ACCESS) {
        offender = ((FieldAccess) expr).getBase();
      } else if (expr.kind() == Expression.Kind.IDENTIFIER) {
        offender = (Identifier) expr;
      } else {
        return;
      }
      reporter.report(
          SemanticError.Kind.EDGE_WRITE_RHS,
          expr.getLocation(),
          offender.getName(),
          "edge property write may not read '%s', which is not available to the sender",
          offender.getName());
      ok = false;
    }

    private void checkEdgePropertyRead(FieldAccess field) {
      Symbol edge = field.getBase().getSymbol();
      if (!edge.getType().isEdgeCompatible()) {
        return;
      }
      if (!boundEdges.contains(edge)) {
        reporter.report(
            SemanticError.Kind.EDGE_READ_RANDOM,
            field.getLocation(),
            edge.getName(),
            "edge property '%s' may only be read through an edge bound by the inner loop's"
                + " iterator",
            field);
        ok = false;
        return;
      }
      Preconditions.checkState(
          innerLoop != null, "%s: edge '%s' used outside its inner loop", field, edge.getName());
      if (recordAccess(field.getMember().getSymbol(), EdgeAccessState.Access.SEND)) {
        reporter.report(
            SemanticError.Kind.EDGE_SEND_TWO_VERSIONS,
            field.getLocation(),
            edge.getName(),
            "edge property '%s' is read after being sent and rewritten; a message cannot carry"
                + " two versions of it",
            field);
        ok = false;
      }
    }

    // Advances the access state of a property in the current inner loop. Returns true if this
    // access made the state ERROR.
    private boolean recordAccess(Symbol property, EdgeAccessState.Access access) {
      EdgeAccessState current = accessStates.get(property);
      EdgeAccessState next = EdgeAccessState.next(current, access);
      accessStates.put(property, next);
      return next == EdgeAccessState.ERROR && current != EdgeAccessState.ERROR;
    }
  }
}
