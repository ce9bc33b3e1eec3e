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
import javax.annotation.Nullable;

/**
 * A Node is a node in a Green-Marl syntax tree.
 *
 * <p>Each node owns its children. The parent link is a back-reference, set exactly once when the
 * node is adopted by the constructor of its parent; it is null only for the root {@link
 * ProcedureDefinition} and for nodes not yet attached to a tree.
 */
public abstract class Node implements Annotatable {

  private final Location location;
  @Nullable private Node parent;

  Node(Location location) {
    this.location = Preconditions.checkNotNull(location);
  }

  /** Returns the location of the start of this syntax node. */
  public final Location getLocation() {
    return location;
  }

  /** Returns the enclosing node, or null if this is the root of a tree. */
  @Nullable
  public final Node getParent() {
    return parent;
  }

  // Records the parent of the specified child and returns it.
  static <T extends Node> T adopt(Node parent, T child) {
    Node node = child;
    Preconditions.checkState(
        node.parent == null, "%s at %s already has a parent", node, node.location);
    node.parent = parent;
    return child;
  }

  /**
   * Implements the double dispatch by invoking into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}.
   */
  public abstract void accept(NodeVisitor visitor);
}
