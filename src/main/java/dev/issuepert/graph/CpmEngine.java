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
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import java.util.Map;

/**
 * Critical Path Method over a scheduled {@link PertGraph}.
 *
 * <p>The forward pass, in topological order, starts each node at the latest earliest-finish of its
 * predecessors (0 for nodes without any). The backward pass, in reverse order, finishes each node
 * at the earliest latest-start of its successors; nodes without successors finish at the project
 * end, which is the latest earliest-finish of all sinks unless a deadline is configured.
 *
 * <p>A node is critical when its slack is within epsilon of the smallest slack in the graph. That
 * minimum is zero without a deadline, but may be positive or negative against one.
 */
public final class CpmEngine {

  private CpmEngine() {}

  /**
   * Fills in timing, slack and critical flags of every node and records the critical path.
   *
   * @throws IllegalArgumentException if the graph has a cycle
   */
  public static void schedule(PertGraph graph, ScheduleOptions options) {
    checkNotNull(graph, "graph");
    checkNotNull(options, "options");
    checkArgument(
        !graph.cycleDetection().hasCycle(), "cannot schedule a cyclic graph: %s", graph);
    ImmutableList<String> order = graph.topologicalOrder();
    Map<String, PertNode> nodes = graph.nodes();
    verify(
        order.size() == nodes.size(),
        "topological order has %s of %s nodes",
        order.size(),
        nodes.size());
    Graph<String> edges = graph.graph();

    double projectFinish = 0;
    for (String id : order) {
      double start = 0;
      for (String predecessor : edges.predecessors(id)) {
        start = Math.max(start, nodes.get(predecessor).earliestFinish());
      }
      PertNode node = nodes.get(id);
      node.setEarliest(start);
      if (edges.successors(id).isEmpty()) {
        projectFinish = Math.max(projectFinish, node.earliestFinish());
      }
    }

    double sinkFinish = options.deadlineHours().orElse(projectFinish);
    double minSlack = Double.POSITIVE_INFINITY;
    for (String id : order.reverse()) {
      double finish = sinkFinish;
      if (!edges.successors(id).isEmpty()) {
        finish = Double.POSITIVE_INFINITY;
        for (String successor : edges.successors(id)) {
          finish = Math.min(finish, nodes.get(successor).latestStart());
        }
      }
      PertNode node = nodes.get(id);
      node.setLatest(finish);
      minSlack = Math.min(minSlack, node.slack());
    }

    ImmutableList.Builder<String> criticalPath = ImmutableList.builder();
    for (String id : order) {
      PertNode node = nodes.get(id);
      boolean critical = Math.abs(node.slack() - minSlack) <= options.criticalEpsilon();
      node.setCritical(critical);
      if (critical) {
        criticalPath.add(id);
      }
    }
    graph.setSchedule(criticalPath.build());
  }
}
