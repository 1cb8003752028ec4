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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import java.util.HashMap;
import java.util.Map;

/**
 * Places the nodes of a scheduled {@link PertGraph} on a grid for box-and-arrow rendering.
 *
 * <p>A node's column is its rank, the length of the longest path reaching it from a node without
 * predecessors, so independent chains line up by dependency depth. Within a column nodes are
 * stacked top to bottom in topological order, one {@link LayoutOptions#rowSpacing()} apart. This is
 * a greedy heuristic and makes no attempt to minimize edge crossings; views are pannable.
 */
public final class LayoutAssigner {

  private LayoutAssigner() {}

  public static void assign(PertGraph graph, LayoutOptions options) {
    checkNotNull(graph, "graph");
    checkNotNull(options, "options");
    checkArgument(graph.isScheduled(), "graph must be scheduled before layout: %s", graph);
    Map<String, PertNode> nodes = graph.nodes();
    Graph<String> edges = graph.graph();

    Map<String, Integer> ranks = new HashMap<>();
    Map<Integer, Integer> rowsUsed = new HashMap<>();
    int width = 0;
    int height = 0;
    for (String id : graph.topologicalOrder()) {
      int rank = 0;
      for (String predecessor : edges.predecessors(id)) {
        rank = Math.max(rank, ranks.get(predecessor) + 1);
      }
      ranks.put(id, rank);
      int row = rowsUsed.merge(rank, 1, Integer::sum) - 1;

      int x = rank * options.columnSpacing();
      int y = row * options.rowSpacing();
      nodes.get(id).setPosition(rank, x, y);
      width = Math.max(width, x + options.nodeWidth());
      height = Math.max(height, y + options.nodeHeight());
    }

    ImmutableList.Builder<EdgeRoute> routes = ImmutableList.builder();
    int middle = options.nodeHeight() / 2;
    for (EndpointPair<String> edge : graph.edges()) {
      PertNode source = nodes.get(edge.source());
      PertNode target = nodes.get(edge.target());
      routes.add(
          new EdgeRoute(
              edge,
              source.x() + options.nodeWidth(),
              source.y() + middle,
              target.x(),
              target.y() + middle,
              target.rank() - source.rank(),
              graph.isCriticalEdge(edge)));
    }
    graph.setLayout(routes.build(), width, height);
  }
}
