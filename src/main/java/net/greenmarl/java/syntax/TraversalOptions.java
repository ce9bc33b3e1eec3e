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

import com.google.auto.value.AutoValue;

/**
 * TraversalOptions selects which callbacks of a {@link TraversalCallback} a {@link Traversal}
 * invokes. Categories that are not selected are skipped without consulting the callback.
 */
@AutoValue
public abstract class TraversalOptions {

  /** Statements only, pre-order. */
  public static final TraversalOptions DEFAULT = builder().build();

  /** Invoke {@link TraversalCallback#onSymbol} for every declaration of every scope. */
  public abstract boolean visitSymbols();

  /** Invoke {@link TraversalCallback#onEnterStatement} before a statement's children. */
  public abstract boolean visitStatements();

  /** Invoke {@link TraversalCallback#onExpression} before an expression's operands. */
  public abstract boolean visitExpressions();

  /**
   * Invoke {@link TraversalCallback#onExitStatement} after a statement's children, whether or not
   * {@link #visitStatements} is set.
   */
  public abstract boolean separatePostPass();

  /** Returns options that select every callback. */
  public static TraversalOptions all() {
    return builder()
        .visitSymbols(true)
        .visitStatements(true)
        .visitExpressions(true)
        .separatePostPass(true)
        .build();
  }

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_TraversalOptions.Builder()
        .visitSymbols(false)
        .visitStatements(true)
        .visitExpressions(false)
        .separatePostPass(false);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link TraversalOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder visitSymbols(boolean value);

    public abstract Builder visitStatements(boolean value);

    public abstract Builder visitExpressions(boolean value);

    public abstract Builder separatePostPass(boolean value);

    public abstract TraversalOptions build();
  }
}
