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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Traversal}. */
@RunWith(JUnit4.class)
public final class TraversalTest {

  /** Records every callback as a string, optionally stopping at a chosen one. */
  private static class Recorder implements TraversalCallback {
    final List<String> events = new ArrayList<>();
    String stopAt = null;

    private boolean record(String event) {
      events.add(event);
      return !event.equals(stopAt);
    }

    @Override
    public boolean onSymbol(Symbol symbol, Node declaringNode) {
      return record("sym " + symbol.getName());
    }

    @Override
    public boolean onEnterStatement(Statement stmt) {
      return record("enter " + stmt.kind());
    }

    @Override
    public boolean onExpression(Expression expr) {
      return record("expr " + expr);
    }

    @Override
    public boolean onExitStatement(Statement stmt) {
      return record("exit " + stmt.kind());
    }
  }

  //  p(G: Graph, Y: N_P<Int>) {
  //    Int x = 0;
  //    Foreach (n : G.Nodes) {
  //      If (n.Y > 1) x += n.Y;
  //    }
  //    Return x;
  //  }
  private static ProcedureDefinition sumProcedure() {
    ProcedureBuilder b = new ProcedureBuilder();
    b.param("G", Type.GRAPH);
    b.param("Y", Type.NODE_PROPERTY);
    return b.procedure(
        "p",
        body -> {
          body.declareAndAssign("x", Type.INT, () -> b.intLiteral(0));
          body.add(
              () ->
                  b.foreach(
                      "n",
                      "G",
                      IterationKind.NODES,
                      loop ->
                          loop.add(
                              () ->
                                  b.ifThen(
                                      b.binary(
                                          b.field("n", "Y"), Operator.GREATER, b.intLiteral(1)),
                                      b.reduce(
                                          b.id("x"), ReduceOperator.SUM, b.field("n", "Y"))))));
          body.add(() -> b.returnStatement(b.id("x")));
        });
  }

  private static List<String> walk(TraversalOptions options, Recorder recorder) {
    Traversal.walk(sumProcedure(), options, recorder);
    return recorder.events;
  }

  @Test
  public void everyCategoryInSourceOrder() {
    assertThat(walk(TraversalOptions.all(), new Recorder()))
        .containsExactly(
            "sym G",
            "sym Y",
            "enter SEQUENCE",
            "sym x",
            "enter ASSIGNMENT",
            "expr 0",
            "exit ASSIGNMENT",
            "enter FOREACH",
            "sym n",
            "enter SEQUENCE",
            "enter IF",
            "expr (n.Y > 1)",
            "expr n.Y",
            "expr 1",
            "enter ASSIGNMENT",
            "expr n.Y",
            "exit ASSIGNMENT",
            "exit IF",
            "exit SEQUENCE",
            "exit FOREACH",
            "enter RETURN",
            "expr x",
            "exit RETURN",
            "exit SEQUENCE")
        .inOrder();
  }

  @Test
  public void defaultOptionsVisitStatementsOnly() {
    assertThat(walk(TraversalOptions.DEFAULT, new Recorder()))
        .containsExactly(
            "enter SEQUENCE",
            "enter ASSIGNMENT",
            "enter FOREACH",
            "enter SEQUENCE",
            "enter IF",
            "enter ASSIGNMENT",
            "enter RETURN")
        .inOrder();
  }

  @Test
  public void postPassWithoutPreOrder() {
    TraversalOptions options =
        TraversalOptions.builder().visitStatements(false).separatePostPass(true).build();
    assertThat(walk(options, new Recorder()))
        .containsExactly(
            "exit ASSIGNMENT",
            "exit ASSIGNMENT",
            "exit IF",
            "exit SEQUENCE",
            "exit FOREACH",
            "exit RETURN",
            "exit SEQUENCE")
        .inOrder();
  }

  @Test
  public void expressionsOnly() {
    TraversalOptions options =
        TraversalOptions.builder().visitStatements(false).visitExpressions(true).build();
    assertThat(walk(options, new Recorder()))
        .containsExactly("expr 0", "expr (n.Y > 1)", "expr n.Y", "expr 1", "expr n.Y", "expr x")
        .inOrder();
  }

  @Test
  public void stopOnStatementSkipsChildrenAndLaterSiblings() {
    Recorder recorder = new Recorder();
    recorder.stopAt = "enter FOREACH";
    TraversalOptions options = TraversalOptions.builder().separatePostPass(true).build();
    assertThat(walk(options, recorder))
        .containsExactly(
            "enter SEQUENCE",
            "enter ASSIGNMENT",
            "exit ASSIGNMENT",
            "enter FOREACH",
            "exit FOREACH",
            "exit SEQUENCE")
        .inOrder();
  }

  @Test
  public void stopIsLocalToTheEnclosingSequence() {
    ProcedureBuilder b = new ProcedureBuilder();
    b.param("G", Type.GRAPH);
    ProcedureDefinition proc =
        b.procedure(
            "p",
            body -> {
              body.declare("x", Type.INT);
              body.add(
                  () ->
                      b.whileLoop(
                          b.binary(b.id("x"), Operator.LESS, b.intLiteral(10)),
                          loop -> {
                            loop.add(
                                () -> b.reduce(b.id("x"), ReduceOperator.SUM, b.intLiteral(1)));
                            loop.add(() -> b.returnStatement(b.id("x")));
                          }));
              body.add(() -> b.assign(b.id("x"), b.intLiteral(0)));
            });
    Recorder recorder = new Recorder();
    recorder.stopAt = "enter ASSIGNMENT";
    Traversal.walk(proc, TraversalOptions.DEFAULT, recorder);

    // The return after the first assignment is skipped; the statement after the loop is not.
    assertThat(recorder.events)
        .containsExactly(
            "enter SEQUENCE",
            "enter WHILE",
            "enter SEQUENCE",
            "enter ASSIGNMENT",
            "enter ASSIGNMENT")
        .inOrder();
  }

  @Test
  public void stopOnExpressionSkipsOperands() {
    Recorder recorder = new Recorder();
    recorder.stopAt = "expr (n.Y > 1)";
    TraversalOptions options =
        TraversalOptions.builder().visitStatements(false).visitExpressions(true).build();
    assertThat(walk(options, recorder))
        .containsExactly("expr 0", "expr (n.Y > 1)", "expr n.Y", "expr x")
        .inOrder();
  }

  @Test
  public void stopOnSymbolSkipsRestOfScope() {
    Recorder recorder = new Recorder();
    recorder.stopAt = "sym G";
    TraversalOptions options =
        TraversalOptions.builder().visitStatements(false).visitSymbols(true).build();
    assertThat(walk(options, recorder)).containsExactly("sym G", "sym x", "sym n").inOrder();
  }

  @Test
  public void symbolsAreReportedWithTheirDeclaringNode() {
    ProcedureDefinition proc = sumProcedure();
    List<String> declarations = new ArrayList<>();
    Traversal.walk(
        proc,
        TraversalOptions.builder().visitSymbols(true).build(),
        new TraversalCallback() {
          @Override
          public boolean onSymbol(Symbol symbol, Node declaringNode) {
            assertThat(symbol.getDeclaringTable().getOwner()).isSameInstanceAs(declaringNode);
            declarations.add(symbol.getName() + "@" + declaringNode.getClass().getSimpleName());
            return true;
          }
        });
    assertThat(declarations)
        .containsExactly(
            "G@ProcedureDefinition",
            "Y@ProcedureDefinition",
            "x@SequenceStatement",
            "n@ForeachStatement")
        .inOrder();
  }

  //  p(flag: Bool) {
  //    Int x = 0;
  //    Do { x += 1; } While (!flag && True);
  //  }
  @Test
  public void doWhileReportsBodyBeforeCondition() {
    ProcedureBuilder b = new ProcedureBuilder();
    b.param("flag", Type.BOOL);
    ProcedureDefinition proc =
        b.procedure(
            "p",
            body -> {
              body.declareAndAssign("x", Type.INT, () -> b.intLiteral(0));
              body.add(
                  () ->
                      b.doWhileLoop(
                          loop ->
                              loop.add(
                                  () -> b.reduce(b.id("x"), ReduceOperator.SUM, b.intLiteral(1))),
                          () ->
                              b.binary(
                                  b.not(b.id("flag")), Operator.AND, b.booleanLiteral(true))));
            });
    Recorder recorder = new Recorder();
    Traversal.walk(proc, TraversalOptions.all(), recorder);

    assertThat(recorder.events)
        .containsExactly(
            "sym flag",
            "enter SEQUENCE",
            "sym x",
            "enter ASSIGNMENT",
            "expr 0",
            "exit ASSIGNMENT",
            "enter WHILE",
            "enter SEQUENCE",
            "enter ASSIGNMENT",
            "expr 1",
            "exit ASSIGNMENT",
            "exit SEQUENCE",
            "expr (!flag && True)",
            "expr !flag",
            "expr flag",
            "expr True",
            "exit WHILE",
            "exit SEQUENCE")
        .inOrder();
  }

  @Test
  public void walkSingleStatement() {
    ProcedureDefinition proc = sumProcedure();
    Statement loop = proc.getBody().getStatements().get(1);
    Recorder recorder = new Recorder();
    Traversal.walk(loop, TraversalOptions.DEFAULT, recorder);
    assertThat(recorder.events)
        .containsExactly("enter FOREACH", "enter SEQUENCE", "enter IF", "enter ASSIGNMENT")
        .inOrder();
  }
}
