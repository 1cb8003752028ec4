// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
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

package dev.issuepert.graph;

/**
 * A graph visitor interface for depth-first visitations driven by {@link DFS}. Each node reached
 * is reported once when it is entered and once when all of its successors are done; every edge
 * examined in between is reported too, whether or not its target has been seen before.
 */
interface GraphVisitor<T> {

  /** Called before visitation commences. */
  void beginVisit();

  /** Called after visitation is complete. */
  void endVisit();

  /** Called when the visitation first reaches {@code node}. */
  void visitNode(T node);

  /**
   * Called for each edge leaving a node on the visitation stack, before {@code rhs} is entered (if
   * it has not been already).
   */
  void visitEdge(T lhs, T rhs);

  /** Called once every successor of {@code node} has been visited. */
  void finishNode(T node);
}
