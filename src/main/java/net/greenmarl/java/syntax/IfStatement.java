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

import javax.annotation.Nullable;

/** Syntax node for an if statement, with an optional else branch. */
public final class IfStatement extends Statement {

  private final Expression condition;
  private final Statement thenBranch;
  @Nullable private final Statement elseBranch;

  public IfStatement(
      Location location,
      Expression condition,
      Statement thenBranch,
      @Nullable Statement elseBranch) {
    super(location, Kind.IF);
    this.condition = adopt(this, condition);
    this.thenBranch = adopt(this, thenBranch);
    this.elseBranch = elseBranch == null ? null : adopt(this, elseBranch);
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getThenBranch() {
    return thenBranch;
  }

  @Nullable
  public Statement getElseBranch() {
    return elseBranch;
  }

  @Override
  public String toString() {
    return "If (" + condition + ") ...\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
