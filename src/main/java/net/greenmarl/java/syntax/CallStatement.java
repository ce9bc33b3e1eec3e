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

/** Syntax node for a builtin call evaluated for its effect. */
public final class CallStatement extends Statement {

  private final BuiltinCall call;

  public CallStatement(Location location, BuiltinCall call) {
    super(location, Kind.CALL);
    this.call = adopt(this, call);
  }

  public BuiltinCall getCall() {
    return call;
  }

  @Override
  public String toString() {
    return call + ";\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
