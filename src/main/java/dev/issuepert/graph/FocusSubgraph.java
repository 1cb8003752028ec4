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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;

/**
 * The neighbourhood of a selected node: the nodes reached within the depth bound and the edges of
 * the full graph between them.
 */
public final class FocusSubgraph {

  private final String focusId;
  private final FocusDirection direction;
  private final int depth;
  private final ImmutableSet<String> nodes;
  private final ImmutableList<EndpointPair<String>> edges;

  FocusSubgraph(
      String focusId,
      FocusDirection direction,
      int depth,
      ImmutableSet<String> nodes,
      ImmutableList<EndpointPair<String>> edges) {
    this.focusId = focusId;
    this.direction = direction;
    this.depth = depth;
    this.nodes = nodes;
    this.edges = edges;
  }

  public String focusId() {
    return focusId;
  }

  public FocusDirection direction() {
    return direction;
  }

  /** The depth actually used, after clamping. */
  public int depth() {
    return depth;
  }

  /** Reached node ids in breadth-first order, starting with the focus node. */
  public ImmutableSet<String> nodes() {
    return nodes;
  }

  public ImmutableList<EndpointPair<String>> edges() {
    return edges;
  }

  /** True when the focus id was not a node of the graph. */
  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public boolean contains(String id) {
    return nodes.contains(id);
  }

  /** Returns {@code graph} restricted to this subgraph's nodes, for rendering. */
  public PertGraph applyTo(PertGraph graph) {
    checkNotNull(graph, "graph");
    return graph.filterByNodes(nodes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("focusId", focusId)
        .add("direction", direction)
        .add("depth", depth)
        .add("nodes", nodes)
        .add("edges", edges)
        .toString();
  }
}
