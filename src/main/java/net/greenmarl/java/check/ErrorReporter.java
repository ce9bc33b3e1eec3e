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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.greenmarl.java.syntax.Location;

/**
 * Collects the errors reported by the passes run over one procedure, in the order they were
 * reported.
 */
public final class ErrorReporter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final List<SemanticError> errors = new ArrayList<>();

  /**
   * Formats and records an error.
   *
   * @param symbolName the source name of the offending symbol, or null
   */
  @FormatMethod
  public void report(
      SemanticError.Kind kind,
      Location location,
      @Nullable String symbolName,
      @FormatString String format,
      Object... args) {
    SemanticError error =
        new SemanticError(kind, location, String.format(format, args), symbolName);
    logger.atFine().log("%s: %s", kind, error);
    errors.add(error);
  }

  /** Returns the errors reported so far. */
  public ImmutableList<SemanticError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Returns the number of errors reported so far. */
  public int count() {
    return errors.size();
  }
}
