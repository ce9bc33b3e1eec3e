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

/** Syntax node for a {@code While (cond) body} or {@code Do body While (cond)} loop. */
public final class WhileStatement extends Statement {

  private final Expression condition;
  private final Statement body;
  private final boolean doWhile;

  public WhileStatement(Location location, Expression condition, Statement body, boolean doWhile) {
    super(location, Kind.WHILE);
    this.condition = adopt(this, condition);
    this.body = adopt(this, body);
    this.doWhile = doWhile;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getBody() {
    return body;
  }

  /** Reports whether the body runs once before the condition is first tested. */
  public boolean isDoWhile() {
    return doWhile;
  }

  @Override
  public String toString() {
    return (doWhile ? "Do ... While (" : "While (") + condition + ")\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
