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
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import com.google.common.primitives.Ints;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the bounded neighbourhood of a selected node from an already built {@link PertGraph}.
 * This is a view filter: it reads the graph's edges and never recomputes metrics.
 */
public final class FocusSubgraphExtractor {

  public static final int MIN_DEPTH = 1;
  public static final int MAX_DEPTH = 10;

  private FocusSubgraphExtractor() {}

  /**
   * Runs a breadth-first search from {@code focusId}, following edges in {@code direction}, and
   * stops {@code depth} steps away. Depth is clamped to [{@value #MIN_DEPTH}, {@value
   * #MAX_DEPTH}]. An id that is not in the graph yields an empty subgraph.
   */
  public static FocusSubgraph extract(
      PertGraph graph, String focusId, FocusDirection direction, int depth) {
    checkNotNull(graph, "graph");
    checkNotNull(focusId, "focusId");
    checkNotNull(direction, "direction");
    int boundedDepth = clampDepth(depth);
    if (!graph.contains(focusId)) {
      return new FocusSubgraph(
          focusId, direction, boundedDepth, ImmutableSet.of(), ImmutableList.of());
    }

    Graph<String> edges = graph.graph();
    Set<String> reached = new LinkedHashSet<>();
    Map<String, Integer> distance = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    reached.add(focusId);
    distance.put(focusId, 0);
    queue.add(focusId);

    while (!queue.isEmpty()) {
      String node = queue.remove();
      int nodeDistance = distance.get(node);
      if (nodeDistance >= boundedDepth) {
        continue;
      }
      for (String neighbour : direction.neighbours(edges, node)) {
        if (reached.add(neighbour)) {
          distance.put(neighbour, nodeDistance + 1);
          queue.addLast(neighbour);
        }
      }
    }

    ImmutableList<EndpointPair<String>> induced =
        graph.edges().stream()
            .filter(edge -> reached.contains(edge.source()) && reached.contains(edge.target()))
            .collect(toImmutableList());
    return new FocusSubgraph(
        focusId, direction, boundedDepth, ImmutableSet.copyOf(reached), induced);
  }

  static int clampDepth(int depth) {
    return Ints.constrainToRange(depth, MIN_DEPTH, MAX_DEPTH);
  }
}
