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

/** What a {@link ForeachStatement} ranges over, relative to its source. */
public enum IterationKind {
  /** All nodes of a graph. */
  NODES("Nodes"),
  /** All edges of a graph. */
  EDGES("Edges"),
  /** Out-going neighbors of a node. */
  NBRS("Nbrs"),
  /** Out-going neighbors of a node. */
  OUT_NBRS("OutNbrs"),
  /** In-coming neighbors of a node. */
  IN_NBRS("InNbrs"),
  /** Neighbors one level closer to the root in a BFS traversal. */
  UP_NBRS("UpNbrs"),
  /** Neighbors one level further from the root in a BFS traversal. */
  DOWN_NBRS("DownNbrs"),
  /** Elements of a node collection. */
  ITEMS("Items");

  private final String keyword;

  IterationKind(String keyword) {
    this.keyword = keyword;
  }

  /** Reports whether the iteration ranges over the relations of a single node. */
  public boolean isNeighborIteration() {
    return this == NBRS || this == OUT_NBRS || this == IN_NBRS || this == UP_NBRS
        || this == DOWN_NBRS;
  }

  /** Reports whether the iteration follows out-going relations only. */
  public boolean isOutgoing() {
    return this == NBRS || this == OUT_NBRS;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
