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
 * A Symbol is an entry of a {@link SymbolTable}: a named variable, iterator, parameter or property
 * with a fixed {@link Type}.
 *
 * <p>A symbol is owned by the table that declares it and referenced, not owned, by every {@link
 * Identifier} that uses its name. Symbols compare by identity.
 */
public final class Symbol implements Annotatable {

  private final String name;
  private final Type type;
  private final Location location;
  private final SymbolTable table;

  Symbol(String name, Type type, Location location, SymbolTable table) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
    this.location = location;
    this.table = table;
  }

  /** Returns the name of the symbol as written in the source. */
  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  /** Returns the location of the declaration. */
  public Location getLocation() {
    return location;
  }

  /** Returns the table that declares this symbol. */
  public SymbolTable getDeclaringTable() {
    return table;
  }

  @Override
  public String toString() {
    return String.format("%s %s @ %s", type, name, location);
  }
}
