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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax node for a sequence of statements enclosed in braces, {@code { ... }}.
 *
 * <p>A sequence opens a scope: the local variables declared in it are held by its {@link
 * SymbolTable}.
 */
public final class SequenceStatement extends Statement {

  private final SymbolTable symbols;
  private final ImmutableList<Statement> statements;

  public SequenceStatement(
      Location location, SymbolTable symbols, List<? extends Statement> statements) {
    super(location, Kind.SEQUENCE);
    this.symbols = symbols;
    symbols.setOwner(this);
    ImmutableList.Builder<Statement> stmts =
        ImmutableList.builderWithExpectedSize(statements.size());
    for (Statement stmt : statements) {
      stmts.add(adopt(this, stmt));
    }
    this.statements = stmts.build();
  }

  /** Returns the local variables declared by this block. */
  public SymbolTable getSymbols() {
    return symbols;
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public String toString() {
    return "{ ... }\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
