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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.syntax.ProcedureDefinition;

/**
 * A PassPipeline runs an ordered list of {@link ProcedurePass}es over a procedure, sharing one
 * {@link AnnotationStore} and one {@link ErrorReporter} among them.
 *
 * <p>A code generator runs the pipeline its backend requires and must not emit code for a
 * procedure whose {@link Result} is not ok.
 */
public final class PassPipeline {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableList<ProcedurePass> passes;
  private final PipelineOptions options;

  public PassPipeline(List<? extends ProcedurePass> passes, PipelineOptions options) {
    Preconditions.checkArgument(!passes.isEmpty(), "empty pipeline");
    this.passes = ImmutableList.copyOf(passes);
    this.options = Preconditions.checkNotNull(options);
  }

  public ImmutableList<ProcedurePass> getPasses() {
    return passes;
  }

  /** Runs the passes over the procedure with a fresh annotation store. */
  public Result run(ProcedureDefinition proc) {
    return run(proc, new AnnotationStore());
  }

  /**
   * Runs the passes over the procedure, on top of the annotations already in {@code store}. The
   * store is mutated in place.
   */
  public Result run(ProcedureDefinition proc, AnnotationStore store) {
    ErrorReporter reporter = new ErrorReporter();
    ImmutableList.Builder<String> failed = ImmutableList.builder();
    for (ProcedurePass pass : passes) {
      logger.atFine().log("running %s on %s", pass.name(), proc.getName());
      int before = reporter.count();
      boolean ok = pass.process(proc, store, reporter);
      logger.atFine().log(
          "%s on %s: %s, %d new error(s)",
          pass.name(), proc.getName(), ok ? "ok" : "failed", reporter.count() - before);
      if (!ok) {
        failed.add(pass.name());
        if (!options.keepGoing()) {
          break;
        }
      }
    }
    Result result = new Result(proc, failed.build(), reporter.getErrors(), store);
    if (!result.ok()) {
      logger.atInfo().log(
          "procedure %s failed %s with %d error(s)",
          proc.getName(), result.getFailedPasses(), result.getErrors().size());
    }
    return result;
  }

  /** The outcome of running a pipeline over one procedure. */
  public static final class Result {
    private final ProcedureDefinition proc;
    private final ImmutableList<String> failedPasses;
    private final ImmutableList<SemanticError> errors;
    private final AnnotationStore annotations;

    private Result(
        ProcedureDefinition proc,
        ImmutableList<String> failedPasses,
        ImmutableList<SemanticError> errors,
        AnnotationStore annotations) {
      this.proc = proc;
      this.failedPasses = failedPasses;
      this.errors = errors;
      this.annotations = annotations;
    }

    /** Reports whether every pass that ran succeeded. */
    public boolean ok() {
      return failedPasses.isEmpty();
    }

    /** Returns the names of the passes that failed, in the order they ran. */
    public ImmutableList<String> getFailedPasses() {
      return failedPasses;
    }

    /** Returns every error reported, in the order reported. */
    public ImmutableList<SemanticError> getErrors() {
      return errors;
    }

    /** Returns the annotations the passes recorded, for use by code generation. */
    public AnnotationStore getAnnotations() {
      return annotations;
    }

    /**
     * Returns the annotations if the procedure passed.
     *
     * @throws SemanticError.Exception carrying every collected error if a pass failed
     */
    public AnnotationStore checkOk() throws SemanticError.Exception {
      if (!ok()) {
        throw new SemanticError.Exception(errors);
      }
      return annotations;
    }

    @Override
    public String toString() {
      return proc.getName() + (ok() ? ": ok" : ": failed " + failedPasses);
    }
  }
}
