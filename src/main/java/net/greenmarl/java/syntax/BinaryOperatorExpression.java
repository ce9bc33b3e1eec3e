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

import com.google.common.base.Preconditions;

/** A BinaryExpression represents a binary operator expression 'x op y'. */
public final class BinaryOperatorExpression extends Expression {

  private final Expression x;
  private final Operator op;
  private final Expression y;

  public BinaryOperatorExpression(Location location, Expression x, Operator op, Expression y) {
    super(location, Kind.BINARY_OPERATOR);
    Preconditions.checkArgument(op != Operator.NOT, "'!' is not a binary operator");
    this.x = adopt(this, x);
    this.op = op;
    this.y = adopt(this, y);
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  /** Returns the operator. */
  public Operator getOperator() {
    return op;
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  @Override
  public String toString() {
    // Fully parenthesized: operator precedence is not tracked.
    return "(" + x + " " + op + " " + y + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
