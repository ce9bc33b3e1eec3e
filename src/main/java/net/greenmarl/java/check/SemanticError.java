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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import net.greenmarl.java.syntax.Location;

/**
 * A SemanticError represents a legality error found by a backend check, with its kind, the
 * location it was found at, and the name of the offending symbol where there is one.
 */
public final class SemanticError {

  /** The legality rules a program can violate. */
  public enum Kind {
    /** An edge-property write is reachable only conditionally within its inner loop. */
    EDGE_WRITE_CONDITIONAL,
    /** An edge-property write's right-hand side reads an inner-loop or unrelated symbol. */
    EDGE_WRITE_RHS,
    /** An edge property is read through an edge not bound by the current inner loop. */
    EDGE_READ_RANDOM,
    /** One edge property would need two versions sent in the same superstep. */
    EDGE_SEND_TWO_VERSIONS,
    /** An inner loop iterates over relations other than out-going ones. */
    INNER_LOOP_NOT_OUTGOING,
  }

  private final Kind kind;
  private final Location location;
  private final String message;
  @Nullable private final String symbolName;

  public SemanticError(
      Kind kind, Location location, String message, @Nullable String symbolName) {
    this.kind = Preconditions.checkNotNull(kind);
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
    this.symbolName = symbolName;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns the source name of the offending symbol, or null if the error names none. */
  @Nullable
  public String symbolName() {
    return symbolName;
  }

  /** Returns a string of the form "file:line:col: message". */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * Returns a string summarizing the specified list of errors, one per line, prefixed by the kind
   * of each.
   */
  public static String toString(List<SemanticError> errors) {
    StringBuilder buf = new StringBuilder();
    for (SemanticError error : errors) {
      buf.append(error.kind).append(": ").append(error).append('\n');
    }
    return buf.toString();
  }

  /** A SemanticError.Exception is thrown when a procedure fails the checks its backend requires. */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SemanticError> errors;

    public Exception(List<SemanticError> errors) {
      super(errors.isEmpty() ? "no errors" : Joiner.on('\n').join(errors));
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SemanticError> errors() {
      return errors;
    }
  }
}
