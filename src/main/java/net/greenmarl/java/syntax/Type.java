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
 * The declared type of a Green-Marl symbol.
 *
 * <p>Types are fixed at declaration; the classifiers below are what the backend checks consult.
 */
public enum Type {
  GRAPH("Graph"),
  NODE("Node"),
  EDGE("Edge"),
  NODE_ITERATOR("Node"),
  EDGE_ITERATOR("Edge"),
  NODE_PROPERTY("N_P"),
  EDGE_PROPERTY("E_P"),
  INT("Int"),
  LONG("Long"),
  FLOAT("Float"),
  DOUBLE("Double"),
  BOOL("Bool"),
  NODE_SET("N_S"),
  NODE_SEQUENCE("N_Q"),
  NODE_ORDER("N_O");

  private final String keyword;

  Type(String keyword) {
    this.keyword = keyword;
  }

  /** Reports whether values of this type denote a node, including node iterators. */
  public boolean isNode() {
    return this == NODE || this == NODE_ITERATOR;
  }

  /** Reports whether values of this type denote an edge, including edge iterators. */
  public boolean isEdge() {
    return this == EDGE || this == EDGE_ITERATOR;
  }

  /** Reports whether edge properties may be addressed through values of this type. */
  public boolean isEdgeCompatible() {
    return isEdge();
  }

  public boolean isIterator() {
    return this == NODE_ITERATOR || this == EDGE_ITERATOR;
  }

  public boolean isProperty() {
    return this == NODE_PROPERTY || this == EDGE_PROPERTY;
  }

  public boolean isScalar() {
    switch (this) {
      case INT:
      case LONG:
      case FLOAT:
      case DOUBLE:
      case BOOL:
        return true;
      default:
        return false;
    }
  }

  public boolean isCollection() {
    return this == NODE_SET || this == NODE_SEQUENCE || this == NODE_ORDER;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
