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
package net.greenmarl.java.annotation;

/** Keys of boolean annotations. Each documents the kind of owner it is recorded on. */
public enum Flag {
  /** On a foreach loop: the loop iterates over all nodes and has no enclosing foreach loop. */
  OUTER_LOOP,
  /** On a foreach loop: the loop iterates over the relations of its outer loop's iterator. */
  INNER_LOOP,
  /** On an edge symbol: the symbol is bound by converting the inner iterator to its edge. */
  EDGE_DEFINED_INNER,
  /** On an inner loop: the loop binds at least one edge symbol. */
  EDGE_DEFINING_INNER,
  /** On an assignment: the assignment binds an edge symbol by an iterator-to-edge conversion. */
  EDGE_DEFINING_WRITE,
}
