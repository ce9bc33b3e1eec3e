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

import net.greenmarl.java.annotation.AnnotationStore;
import net.greenmarl.java.syntax.ProcedureDefinition;

/**
 * A legality or analysis pass run once per procedure.
 *
 * <p>A pass reads the annotations left by earlier passes, adds its own, and reports every
 * violation it finds to the reporter rather than stopping at the first. Any per-procedure state
 * lives in objects created by {@link #process}, so a pass instance may be reused across
 * procedures.
 */
public interface ProcedurePass {

  /** Returns a short name for logs and failure summaries. */
  String name();

  /**
   * Runs the pass over one procedure.
   *
   * @return true if the procedure passed, false if at least one violation was reported
   */
  boolean process(ProcedureDefinition proc, AnnotationStore store, ErrorReporter reporter);
}
