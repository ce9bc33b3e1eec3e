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

/** The builtin methods that a {@link BuiltinCall} may invoke on its driver. */
public enum Builtin {
  /** Converts a neighbor iterator to the edge it was reached through. */
  TO_EDGE("ToEdge", Type.EDGE),
  DEGREE("Degree", Type.INT),
  IN_DEGREE("InDegree", Type.INT),
  NUM_NODES("NumNodes", Type.INT),
  NUM_EDGES("NumEdges", Type.INT),
  PICK_RANDOM("PickRandom", Type.NODE);

  private final String methodName;
  private final Type resultType;

  Builtin(String methodName, Type resultType) {
    this.methodName = methodName;
    this.resultType = resultType;
  }

  public String getMethodName() {
    return methodName;
  }

  public Type getResultType() {
    return resultType;
  }
}
