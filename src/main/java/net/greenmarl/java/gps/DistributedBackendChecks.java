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

import com.google.common.collect.ImmutableList;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.check.PassPipeline;
import net.greenmarl.java.check.PipelineOptions;
import net.greenmarl.java.check.SemanticError;
import net.greenmarl.java.syntax.ProcedureDefinition;

/**
 * The passes a procedure must pass before the distributed (Pregel-style) backend may generate code
 * for it, in the order they must run.
 */
public final class DistributedBackendChecks {

  private DistributedBackendChecks() {}

  /** Returns the pipeline of distributed-backend checks. */
  public static PassPipeline pipeline(PipelineOptions options) {
    return new PassPipeline(
        ImmutableList.of(
            new InnerLoopClassifier(), new ExpressionScopeAnalyzer(), new EdgePropertyChecker()),
        options);
  }

  /**
   * Runs the checks over a procedure and returns the annotations code generation needs.
   *
   * @throws SemanticError.Exception with every collected error if the procedure fails a check
   */
  public static AnnotationStore check(ProcedureDefinition proc) throws SemanticError.Exception {
    return pipeline(PipelineOptions.DEFAULT).run(proc).checkOk();
  }
}
