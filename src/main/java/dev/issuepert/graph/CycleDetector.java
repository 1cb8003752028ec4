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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds every edge of a dependency graph that lies on a directed cycle.
 *
 * <p>An edge {@code (u, v)} lies on a cycle exactly when {@code v} can reach {@code u}, that is when
 * both endpoints belong to the same strongly connected component. Components are found with a
 * path-based strong component algorithm run over a single iterative {@link DFS}; self-edges are
 * cycles of length one.
 *
 * <p>Nodes and successors are visited in ascending label order, so repeated runs over the same
 * graph report the same edges in the same order.
 */
public final class CycleDetector {

  private CycleDetector() {}

  public static CycleDetection detect(Graph<String> graph) {
    checkNotNull(graph, "graph");
    Comparator<String> order = Comparator.naturalOrder();
    ImmutableSortedSet<String> sortedNodes = ImmutableSortedSet.copyOf(order, graph.nodes());

    ComponentVisitor components = new ComponentVisitor();
    new DFS<>(graph, order).visitAll(sortedNodes, components);

    Set<EndpointPair<String>> cycleEdges = new LinkedHashSet<>();
    for (String from : sortedNodes) {
      for (String to : ImmutableList.sortedCopyOf(order, graph.successors(from))) {
        if (from.equals(to) || components.sameComponent(from, to)) {
          cycleEdges.add(EndpointPair.ordered(from, to));
        }
      }
    }
    return CycleDetection.of(cycleEdges);
  }

  /**
   * Assigns each node a strongly connected component number.
   *
   * <p>Nodes are numbered in the order they are first visited (preorder). Every visited node is
   * pushed on {@code stack} and stays "on stack" until its component is known. {@code boundaries}
   * holds the preorder number of the first-visited node of each component that is still open. An
   * edge to an on-stack node closes a cycle, so every component opened after that node is merged
   * into it by popping {@code boundaries}. When a node finishes and its own number is on top of
   * {@code boundaries}, it is the first node of its component and the component is everything
   * pushed on {@code stack} since.
   */
  private static final class ComponentVisitor extends AbstractGraphVisitor<String> {

    private final Map<String, Integer> preorder = new HashMap<>();
    private final Map<String, Integer> component = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Deque<Integer> boundaries = new ArrayDeque<>();
    private int counter = 0;
    private int componentCount = 0;

    @Override
    public void visitNode(String node) {
      preorder.put(node, counter);
      stack.push(node);
      boundaries.push(counter++);
    }

    @Override
    public void visitEdge(String lhs, String rhs) {
      Integer rhsPreorder = preorder.get(rhs);
      if (rhsPreorder == null || component.containsKey(rhs)) {
        return;
      }
      while (boundaries.peek() > rhsPreorder) {
        boundaries.pop();
      }
    }

    @Override
    public void finishNode(String node) {
      if (!boundaries.peek().equals(preorder.get(node))) {
        return;
      }
      boundaries.pop();
      String member;
      do {
        member = stack.pop();
        component.put(member, componentCount);
      } while (!member.equals(node));
      componentCount++;
    }

    boolean sameComponent(String a, String b) {
      return component.get(a).equals(component.get(b));
    }
  }
}
