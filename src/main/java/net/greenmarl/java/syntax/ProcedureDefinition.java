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

/**
 * The root of a Green-Marl syntax tree: a procedure with its parameters and body.
 *
 * <p>Backend checks run once per procedure.
 */
public final class ProcedureDefinition extends Node {

  private final String name;
  private final SymbolTable parameters;
  private final SequenceStatement body;

  public ProcedureDefinition(
      Location location, String name, SymbolTable parameters, SequenceStatement body) {
    super(location);
    this.name = name;
    this.parameters = parameters;
    parameters.setOwner(this);
    this.body = adopt(this, body);
  }

  public String getName() {
    return name;
  }

  /** Returns the scope declaring the procedure's parameters. */
  public SymbolTable getParameters() {
    return parameters;
  }

  public SequenceStatement getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "Procedure " + name + "(...)";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
