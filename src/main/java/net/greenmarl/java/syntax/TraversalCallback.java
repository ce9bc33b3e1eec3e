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

/**
 * The client side of a {@link Traversal}. Each method returns true to continue, or false to stop
 * descending locally; see {@link Traversal} for the exact effect of a stop.
 *
 * <p>All methods default to doing nothing. Which of them are called is decided by the {@link
 * TraversalOptions} of the traversal, not by which ones are overridden.
 */
public interface TraversalCallback {

  /**
   * Called for each symbol declared by a scope, in declaration order, after the callback for the
   * node that opens the scope and before the scope's statements.
   *
   * @param declaringNode the procedure, foreach loop or sequence that declares the symbol
   */
  default boolean onSymbol(Symbol symbol, Node declaringNode) {
    return true;
  }

  /** Called for a statement before any of its children. */
  default boolean onEnterStatement(Statement stmt) {
    return true;
  }

  /** Called for an expression used as a value, before its operands. */
  default boolean onExpression(Expression expr) {
    return true;
  }

  /** Called for a statement after all of its children. */
  default boolean onExitStatement(Statement stmt) {
    return true;
  }
}
