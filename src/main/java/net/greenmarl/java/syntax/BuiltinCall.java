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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Syntax node for a builtin method call, {@code driver.Method(args)}. */
public final class BuiltinCall extends Expression {

  private final Identifier driver;
  private final Builtin builtin;
  private final ImmutableList<Expression> arguments;

  public BuiltinCall(
      Location location, Identifier driver, Builtin builtin, List<? extends Expression> arguments) {
    super(location, Kind.BUILTIN_CALL);
    this.driver = adopt(this, driver);
    this.builtin = builtin;
    ImmutableList.Builder<Expression> args =
        ImmutableList.builderWithExpectedSize(arguments.size());
    for (Expression arg : arguments) {
      args.add(adopt(this, arg));
    }
    this.arguments = args.build();
  }

  /** Returns the identifier on which the method is invoked. */
  public Identifier getDriver() {
    return driver;
  }

  public Builtin getBuiltin() {
    return builtin;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  /** Reports whether this call converts its driver, a neighbor iterator, to an edge. */
  public boolean isToEdge() {
    return builtin == Builtin.TO_EDGE;
  }

  @Override
  public String toString() {
    return driver + "." + builtin.getMethodName() + "(" + Joiner.on(", ").join(arguments) + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
