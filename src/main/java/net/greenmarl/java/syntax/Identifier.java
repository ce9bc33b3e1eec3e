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

/** Syntax node for an identifier, a use of a resolved {@link Symbol}. */
public final class Identifier extends Expression {

  private final Symbol symbol;

  public Identifier(Location location, Symbol symbol) {
    super(location, Kind.IDENTIFIER);
    this.symbol = Preconditions.checkNotNull(symbol);
  }

  /** Returns the name of the identifier, which is the name of its symbol. */
  public String getName() {
    return symbol.getName();
  }

  /** Returns the symbol that the identifier denotes. Set by name resolution. */
  public Symbol getSymbol() {
    return symbol;
  }

  @Override
  public String toString() {
    return symbol.getName();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
