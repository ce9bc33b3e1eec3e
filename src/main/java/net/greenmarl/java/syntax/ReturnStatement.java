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

import javax.annotation.Nullable;

/** A syntax node for return statements. */
public final class ReturnStatement extends Statement {

  @Nullable private final Expression result;

  public ReturnStatement(Location location, @Nullable Expression result) {
    super(location, Kind.RETURN);
    this.result = result == null ? null : adopt(this, result);
  }

  /** Returns the returned value, or null for a bare {@code Return;}. */
  @Nullable
  public Expression getResult() {
    return result;
  }

  @Override
  public String toString() {
    return result == null ? "Return;\n" : "Return " + result + ";\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
