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
import javax.annotation.Nullable;

/**
 * Syntax node for an assignment statement ({@code target = rhs}) or reduction assignment ({@code
 * target op= rhs}).
 *
 * <p>The target is either a scalar identifier or a field access {@code base.member}, never
 * anything else.
 */
public final class AssignmentStatement extends Statement {

  private final Expression target; // = IDENTIFIER | FIELD_ACCESS
  @Nullable private final ReduceOperator op;
  private final Expression rhs;

  public AssignmentStatement(
      Location location, Expression target, @Nullable ReduceOperator op, Expression rhs) {
    super(location, Kind.ASSIGNMENT);
    Preconditions.checkArgument(
        target.kind() == Expression.Kind.IDENTIFIER
            || target.kind() == Expression.Kind.FIELD_ACCESS,
        "cannot assign to '%s'",
        target);
    this.target = adopt(this, target);
    this.op = op;
    this.rhs = adopt(this, rhs);
  }

  /** Returns the target of the assignment. */
  public Expression getTarget() {
    return target;
  }

  /** Reports whether the target is an identifier rather than a field access. */
  public boolean isTargetScalar() {
    return target.kind() == Expression.Kind.IDENTIFIER;
  }

  /**
   * Returns the target identifier.
   *
   * @throws IllegalStateException if the target is a field access
   */
  public Identifier getTargetIdentifier() {
    Preconditions.checkState(isTargetScalar(), "target '%s' is a field access", target);
    return (Identifier) target;
  }

  /**
   * Returns the target field access.
   *
   * @throws IllegalStateException if the target is an identifier
   */
  public FieldAccess getTargetField() {
    Preconditions.checkState(!isTargetScalar(), "target '%s' is an identifier", target);
    return (FieldAccess) target;
  }

  /** Returns the operator of a reduction assignment, or null for an ordinary assignment. */
  @Nullable
  public ReduceOperator getOperator() {
    return op;
  }

  public boolean isReduction() {
    return op != null;
  }

  /** Returns the RHS of the assignment. */
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public String toString() {
    return target + " " + (op == null ? "=" : op.toString()) + " " + rhs + ";\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
