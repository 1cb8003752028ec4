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
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders the nodes of an acyclic dependency graph so that every edge points forward.
 *
 * <p>Uses Kahn's algorithm: nodes whose predecessors have all been emitted are ready, and among
 * ready nodes the smallest label is emitted first. The same graph therefore always yields the same
 * order, which keeps next/previous navigation stable between rebuilds.
 */
public final class TopologicalSorter {

  private TopologicalSorter() {}

  /**
   * Returns the nodes of {@code graph} in topological order, ties broken by ascending label.
   *
   * @throws com.google.common.base.VerifyException if the graph contains a cycle; callers must run
   *     {@link CycleDetector} first
   */
  public static ImmutableList<String> sort(Graph<String> graph) {
    checkNotNull(graph, "graph");
    Map<String, Integer> unresolved = new HashMap<>();
    PriorityQueue<String> ready = new PriorityQueue<>();
    for (String node : graph.nodes()) {
      int inDegree = graph.predecessors(node).size();
      unresolved.put(node, inDegree);
      if (inDegree == 0) {
        ready.add(node);
      }
    }

    ImmutableList.Builder<String> order = ImmutableList.builderWithExpectedSize(unresolved.size());
    int emitted = 0;
    while (!ready.isEmpty()) {
      String node = ready.poll();
      order.add(node);
      emitted++;
      for (String successor : graph.successors(node)) {
        if (unresolved.merge(successor, -1, Integer::sum) == 0) {
          ready.add(successor);
        }
      }
    }

    verify(
        emitted == unresolved.size(),
        "topological order covers %s of %s nodes; the graph has a cycle",
        emitted,
        unresolved.size());
    return order.build();
  }
}
