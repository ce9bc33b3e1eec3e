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

/** Base class for all statements nodes in the AST. */
public abstract class Statement extends Node {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient and
   * can be used in a switch/case.
   */
  public enum Kind {
    ASSIGNMENT,
    CALL,
    FOREACH,
    IF,
    RETURN,
    SEQUENCE,
    WHILE,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Statement(Location location, Kind kind) {
    super(location);
    this.kind = kind;
  }

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient and
   * can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  /**
   * Reports whether this statement makes the execution of its body conditional: a loop of either
   * kind, or an if statement.
   */
  public final boolean isLoopOrConditional() {
    return kind == Kind.FOREACH || kind == Kind.WHILE || kind == Kind.IF;
  }
}
