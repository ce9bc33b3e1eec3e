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
package net.greenmarl.java.check;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.annotation.Flag;
import net.greenmarl.java.syntax.ProcedureBuilder;
import net.greenmarl.java.syntax.ProcedureDefinition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PassPipelineTest {

  private final List<String> ran = new ArrayList<>();
  private final ProcedureDefinition proc = new ProcedureBuilder().procedure("p", body -> {});

  // A pass that records its run, flags the procedure body, and fails if asked to.
  private final class FakePass implements ProcedurePass {
    private final String name;
    private final boolean fail;

    FakePass(String name, boolean fail) {
      this.name = name;
      this.fail = fail;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean process(
        ProcedureDefinition procedure, AnnotationStore store, ErrorReporter reporter) {
      ran.add(name);
      store.setFlag(procedure.getBody(), Flag.OUTER_LOOP, true);
      if (fail) {
        reporter.report(
            SemanticError.Kind.EDGE_READ_RANDOM, procedure.getLocation(), null, "%s failed", name);
      }
      return !fail;
    }
  }

  @Test
  public void allPassesRunInOrder() {
    PassPipeline pipeline =
        new PassPipeline(
            ImmutableList.of(new FakePass("a", false), new FakePass("b", false)),
            PipelineOptions.DEFAULT);

    PassPipeline.Result result = pipeline.run(proc);

    assertThat(ran).containsExactly("a", "b").inOrder();
    assertThat(result.ok()).isTrue();
    assertThat(result.getErrors()).isEmpty();
    assertThat(result.getFailedPasses()).isEmpty();
    assertThat(result.getAnnotations().isSet(proc.getBody(), Flag.OUTER_LOOP)).isTrue();
    assertThat(result.toString()).isEqualTo("p: ok");
  }

  @Test
  public void stopsAfterFirstFailure() {
    PassPipeline pipeline =
        new PassPipeline(
            ImmutableList.of(
                new FakePass("a", true), new FakePass("b", true), new FakePass("c", false)),
            PipelineOptions.DEFAULT);

    PassPipeline.Result result = pipeline.run(proc);

    assertThat(ran).containsExactly("a");
    assertThat(result.ok()).isFalse();
    assertThat(result.getFailedPasses()).containsExactly("a");
    TestUtils.assertContainsError(result.getErrors(), "a failed");
    assertThat(result.toString()).isEqualTo("p: failed [a]");
  }

  @Test
  public void keepGoingCollectsEveryFailure() {
    PassPipeline pipeline =
        new PassPipeline(
            ImmutableList.of(
                new FakePass("a", true), new FakePass("b", false), new FakePass("c", true)),
            PipelineOptions.builder().keepGoing(true).build());

    PassPipeline.Result result = pipeline.run(proc);

    assertThat(ran).containsExactly("a", "b", "c").inOrder();
    assertThat(result.getFailedPasses()).containsExactly("a", "c").inOrder();
    assertThat(result.getErrors()).hasSize(2);
  }

  @Test
  public void checkOkThrowsWithAllErrors() {
    PassPipeline pipeline =
        new PassPipeline(
            ImmutableList.of(new FakePass("a", true), new FakePass("b", true)),
            PipelineOptions.DEFAULT.toBuilder().keepGoing(true).build());

    PassPipeline.Result result = pipeline.run(proc);
    SemanticError.Exception ex = assertThrows(SemanticError.Exception.class, result::checkOk);

    assertThat(ex.errors()).hasSize(2);
    assertThat(ex).hasMessageThat().contains("a failed");
    assertThat(ex).hasMessageThat().contains("b failed");
    assertThat(ex.errors().get(0).toString()).isEqualTo("test.gm:1:1: a failed");
  }

  @Test
  public void checkOkReturnsAnnotations() throws Exception {
    PassPipeline pipeline =
        new PassPipeline(ImmutableList.of(new FakePass("a", false)), PipelineOptions.DEFAULT);
    AnnotationStore store = new AnnotationStore();

    assertThat(pipeline.run(proc, store).checkOk()).isSameInstanceAs(store);
  }

  @Test
  public void emptyPipelineIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PassPipeline(ImmutableList.<ProcedurePass>of(), PipelineOptions.DEFAULT));
  }

  @Test
  public void errorListSummary() {
    PassPipeline.Result result =
        new PassPipeline(ImmutableList.of(new FakePass("a", true)), PipelineOptions.DEFAULT)
            .run(proc);

    assertThat(SemanticError.toString(result.getErrors()))
        .isEqualTo("EDGE_READ_RANDOM: test.gm:1:1: a failed\n");
  }
}
