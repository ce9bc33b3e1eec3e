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

import java.util.ArrayDeque;
import java.util.Deque;
import javax.annotation.Nullable;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.annotation.Flag;
import net.greenmarl.java.annotation.ValueKey;
import net.greenmarl.java.check.ErrorReporter;
import net.greenmarl.java.check.ProcedurePass;
import net.greenmarl.java.check.SemanticError;
import net.greenmarl.java.syntax.ForeachStatement;
import net.greenmarl.java.syntax.IterationKind;
import net.greenmarl.java.syntax.ProcedureDefinition;
import net.greenmarl.java.syntax.Statement;
import net.greenmarl.java.syntax.Symbol;
import net.greenmarl.java.syntax.Traversal;
import net.greenmarl.java.syntax.TraversalCallback;
import net.greenmarl.java.syntax.TraversalOptions;

/**
 * Finds the two-level loops that the distributed backend turns into supersteps.
 *
 * <p>An outer loop iterates over all nodes of a graph and is not nested in another foreach loop. An
 * inner loop iterates over the relations of its outer loop's iterator and has the outer loop as its
 * nearest enclosing foreach loop:
 *
 * <pre>
 * Foreach (n : G.Nodes) {       // OUTER_LOOP
 *   Foreach (s : n.Nbrs) {...}  // INNER_LOOP, INNER_ITERATOR = s
 * }
 * </pre>
 *
 * <p>An inner loop must follow out-going relations; any other direction is reported.
 */
public final class InnerLoopClassifier implements ProcedurePass {

  /** On an inner loop: the symbol of its iterator. */
  public static final ValueKey<Symbol> INNER_ITERATOR = ValueKey.of("INNER_ITERATOR", Symbol.class);

  @Override
  public String name() {
    return "inner loop classification";
  }

  @Override
  public boolean process(ProcedureDefinition proc, AnnotationStore store, ErrorReporter reporter) {
    Classifier classifier = new Classifier(store, reporter);
    Traversal.walk(
        proc, TraversalOptions.builder().separatePostPass(true).build(), classifier);
    return classifier.ok;
  }

  private static final class Classifier implements TraversalCallback {
    private final AnnotationStore store;
    private final ErrorReporter reporter;
    // Enclosing foreach loops, innermost first.
    private final Deque<ForeachStatement> loops = new ArrayDeque<>();
    private boolean ok = true;

    Classifier(AnnotationStore store, ErrorReporter reporter) {
      this.store = store;
      this.reporter = reporter;
    }

    @Override
    public boolean onEnterStatement(Statement stmt) {
      if (stmt.kind() != Statement.Kind.FOREACH) {
        return true;
      }
      ForeachStatement loop = (ForeachStatement) stmt;
      @Nullable ForeachStatement enclosing = loops.peek();
      if (enclosing == null) {
        if (loop.getIterationKind() == IterationKind.NODES) {
          store.setFlag(loop, Flag.OUTER_LOOP, true);
        }
      } else if (isInnerLoopOf(loop, enclosing)) {
        store.setFlag(loop, Flag.INNER_LOOP, true);
        store.setValue(loop, INNER_ITERATOR, loop.getIterator().getSymbol());
        if (!loop.getIterationKind().isOutgoing()) {
          reporter.report(
              SemanticError.Kind.INNER_LOOP_NOT_OUTGOING,
              loop.getLocation(),
              loop.getSource().getName(),
              "inner loop over '%s.%s' must iterate over out-going neighbors",
              loop.getSource().getName(),
              loop.getIterationKind());
          ok = false;
        }
      }
      loops.push(loop);
      return true;
    }

    private boolean isInnerLoopOf(ForeachStatement loop, ForeachStatement enclosing) {
      return store.isSet(enclosing, Flag.OUTER_LOOP)
          && loop.getIterationKind().isNeighborIteration()
          && loop.getSource().getSymbol() == enclosing.getIterator().getSymbol();
    }

    @Override
    public boolean onExitStatement(Statement stmt) {
      if (stmt.kind() == Statement.Kind.FOREACH) {
        loops.pop();
      }
      return true;
    }
  }
}
