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

/**
 * Where the values read by an expression live, relative to the two-level loop being compiled to
 * message passing. Constants are ordered from outermost to innermost; an expression takes the
 * innermost scope of its operands.
 */
public enum ExpressionScope {
  /** Declared outside the outer loop, or a literal. */
  GLOBAL,
  /** The outer loop's iterator, its properties, or a variable declared in the outer loop. */
  OUT,
  /** An edge variable bound in the inner loop, or one of its properties. */
  EDGE,
  /** The inner loop's iterator, its properties, or a variable declared in the inner loop. */
  IN,
  /** A property read through a node or edge that is not a loop iterator. */
  RANDOM;

  /** Returns the innermost of the two scopes. */
  public static ExpressionScope max(ExpressionScope x, ExpressionScope y) {
    return x.compareTo(y) >= 0 ? x : y;
  }

  /** Reports whether a value of this scope is unavailable to the sender of a message. */
  public boolean isInnerOrRandom() {
    return this == IN || this == RANDOM;
  }
}
