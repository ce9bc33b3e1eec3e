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
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A SymbolTable holds the symbols declared by one scope: a procedure's parameters, a foreach
 * loop's iterator, or the local variables of a sequence block.
 *
 * <p>The table is populated while its scope is being built, then attached to the node that opens
 * the scope. Symbols are kept in declaration order.
 */
public final class SymbolTable {

  private final Map<String, Symbol> symbols = new LinkedHashMap<>();
  @Nullable private Node owner;

  public SymbolTable() {}

  /**
   * Declares a new symbol in this table.
   *
   * @throws IllegalArgumentException if the name is already declared in this table
   */
  public Symbol declare(String name, Type type, Location location) {
    Preconditions.checkArgument(
        !symbols.containsKey(name), "'%s' is already declared in this scope", name);
    Symbol sym = new Symbol(name, type, location, this);
    symbols.put(name, sym);
    return sym;
  }

  /** Returns the symbol of the given name declared in this table, or null. */
  @Nullable
  public Symbol get(String name) {
    return symbols.get(name);
  }

  /** Returns the declared symbols in declaration order. */
  public ImmutableList<Symbol> getSymbols() {
    return ImmutableList.copyOf(symbols.values());
  }

  public boolean isEmpty() {
    return symbols.isEmpty();
  }

  /** Returns the node that opens this scope, or null if the table is not yet attached. */
  @Nullable
  public Node getOwner() {
    return owner;
  }

  void setOwner(Node owner) {
    Preconditions.checkState(this.owner == null, "symbol table is already owned by %s", this.owner);
    this.owner = owner;
  }
}
