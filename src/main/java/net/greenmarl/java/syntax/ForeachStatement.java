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
 * Syntax node for a foreach loop, {@code Foreach (it : source.Kind) body}.
 *
 * <p>The loop opens a scope holding exactly its iterator. Whether the loop is an inner loop of a
 * two-level graph traversal is not a syntactic property; it is recorded by a classification pass.
 */
public final class ForeachStatement extends Statement {

  private final SymbolTable symbols;
  private final Identifier iterator;
  private final Identifier source;
  private final IterationKind iterationKind;
  private final Statement body;

  public ForeachStatement(
      Location location,
      SymbolTable symbols,
      Identifier iterator,
      Identifier source,
      IterationKind iterationKind,
      Statement body) {
    super(location, Kind.FOREACH);
    Preconditions.checkArgument(
        iterator.getSymbol().getDeclaringTable() == symbols,
        "iterator '%s' must be declared by the loop",
        iterator.getName());
    this.symbols = symbols;
    symbols.setOwner(this);
    this.iterator = adopt(this, iterator);
    this.source = adopt(this, source);
    this.iterationKind = Preconditions.checkNotNull(iterationKind);
    this.body = adopt(this, body);
  }

  /** Returns the scope declaring the iterator. */
  public SymbolTable getSymbols() {
    return symbols;
  }

  public Identifier getIterator() {
    return iterator;
  }

  /** Returns the graph, node or collection that the loop ranges over. */
  public Identifier getSource() {
    return source;
  }

  public IterationKind getIterationKind() {
    return iterationKind;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "Foreach (" + iterator + " : " + source + "." + iterationKind + ") ...\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
