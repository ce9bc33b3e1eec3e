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

/**
 * Syntax node for a property access {@code base.member}, such as {@code n.dist} or {@code e.len}.
 *
 * <p>The base denotes a node or edge (or an iterator over them); the member denotes a property
 * symbol.
 */
public final class FieldAccess extends Expression {

  private final Identifier base;
  private final Identifier member;

  public FieldAccess(Location location, Identifier base, Identifier member) {
    super(location, Kind.FIELD_ACCESS);
    this.base = adopt(this, base);
    this.member = adopt(this, member);
    Preconditions.checkArgument(
        member.getSymbol().getType().isProperty(), "'%s' is not a property", member.getName());
  }

  /** Returns the identifier of the node or edge whose property is accessed. */
  public Identifier getBase() {
    return base;
  }

  /** Returns the identifier of the property. */
  public Identifier getMember() {
    return member;
  }

  @Override
  public String toString() {
    return base + "." + member;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
