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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A dependency graph of issues together with everything derived from it for one view: cycle
 * report, topological order, CPM metrics, critical path and layout.
 *
 * <p>Nodes are stored by id and edges as plain {@code (from, to)} id pairs; nodes never refer to
 * one another. A graph is built in full by {@link PertEngine} from one issue snapshot and is owned
 * by the view that asked for it. It is never updated incrementally: a changed issue set yields a
 * new graph.
 *
 * <p>When {@link #cycleDetection()} reports a cycle the graph is not scheduled: the topological
 * order, critical path and edge routes are empty and node timings and positions keep their
 * defaults.
 */
public final class PertGraph {

  private final ImmutableMap<String, PertNode> nodes;
  private final ImmutableList<EndpointPair<String>> edges;
  private final Digraph<String> digraph;

  private CycleDetection cycleDetection = CycleDetection.acyclic();
  private ImmutableList<String> topologicalOrder = ImmutableList.of();
  private ImmutableList<String> criticalPath = ImmutableList.of();
  private ImmutableList<EdgeRoute> edgeRoutes = ImmutableList.of();
  private boolean scheduled;
  private int width;
  private int height;

  PertGraph(
      ImmutableMap<String, PertNode> nodes,
      ImmutableList<EndpointPair<String>> edges,
      Digraph<String> digraph) {
    this.nodes = nodes;
    this.edges = edges;
    this.digraph = digraph;
  }

  /** Nodes by issue id, in the order the issues were supplied. */
  public ImmutableMap<String, PertNode> nodes() {
    return nodes;
  }

  public Optional<PertNode> node(String id) {
    return Optional.ofNullable(nodes.get(id));
  }

  public boolean contains(String id) {
    return nodes.containsKey(id);
  }

  /** True when there are no issues to display. */
  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** Unique dependency edges, {@code source} finishing before {@code target} starts. */
  public ImmutableList<EndpointPair<String>> edges() {
    return edges;
  }

  /** A read-only Guava graph view over the same nodes and edges. */
  public Graph<String> graph() {
    return digraph;
  }

  public ImmutableList<EndpointPair<String>> edgesFrom(String id) {
    return edges.stream().filter(edge -> edge.source().equals(id)).collect(toImmutableList());
  }

  public ImmutableList<EndpointPair<String>> edgesTo(String id) {
    return edges.stream().filter(edge -> edge.target().equals(id)).collect(toImmutableList());
  }

  public CycleDetection cycleDetection() {
    return cycleDetection;
  }

  /** Node ids in topological order; empty when the graph has a cycle. */
  public ImmutableList<String> topologicalOrder() {
    return topologicalOrder;
  }

  /** Ids of the critical nodes, in topological order. */
  public ImmutableList<String> criticalPath() {
    return criticalPath;
  }

  /** Whether CPM metrics have been computed; false for cyclic graphs. */
  public boolean isScheduled() {
    return scheduled;
  }

  public ImmutableList<EdgeRoute> edgeRoutes() {
    return edgeRoutes;
  }

  /** Width of the laid-out graph in cells. */
  public int width() {
    return width;
  }

  /** Height of the laid-out graph in cells. */
  public int height() {
    return height;
  }

  public ImmutableList<PertNode> nodesInOrder() {
    return topologicalOrder.stream().map(nodes::get).collect(toImmutableList());
  }

  public ImmutableList<PertNode> criticalPathNodes() {
    return criticalPath.stream().map(nodes::get).collect(toImmutableList());
  }

  /** An edge is critical when both of its endpoints are. */
  public boolean isCriticalEdge(EndpointPair<String> edge) {
    PertNode source = nodes.get(edge.source());
    PertNode target = nodes.get(edge.target());
    return source != null && target != null && source.isCritical() && target.isCritical();
  }

  /**
   * Returns the node after {@code current} in topological order, wrapping around at the end. With
   * no current selection, or one not in the order, returns the first node.
   */
  public Optional<String> next(@Nullable String current) {
    return step(current, 1);
  }

  /**
   * Returns the node before {@code current} in topological order, wrapping around at the start.
   * With no current selection, or one not in the order, returns the first node.
   */
  public Optional<String> previous(@Nullable String current) {
    return step(current, -1);
  }

  private Optional<String> step(@Nullable String current, int delta) {
    if (topologicalOrder.isEmpty()) {
      return Optional.empty();
    }
    int index = current == null ? -1 : topologicalOrder.indexOf(current);
    if (index < 0) {
      return Optional.of(topologicalOrder.get(0));
    }
    int size = topologicalOrder.size();
    return Optional.of(topologicalOrder.get(Math.floorMod(index + delta, size)));
  }

  /**
   * Returns a copy of this graph restricted to {@code ids}. Metrics and positions are kept as
   * computed on the full graph; edges, topological order, critical path, routes and cycle edges are
   * filtered to those among the kept nodes.
   */
  public PertGraph filterByNodes(Set<String> ids) {
    checkNotNull(ids, "ids");
    ImmutableMap.Builder<String, PertNode> keptNodes = ImmutableMap.builder();
    for (Map.Entry<String, PertNode> entry : nodes.entrySet()) {
      if (ids.contains(entry.getKey())) {
        keptNodes.put(entry.getKey(), entry.getValue().copy());
      }
    }
    PertGraph filtered =
        new PertGraph(
            keptNodes.buildOrThrow(),
            edges.stream().filter(edge -> keeps(ids, edge)).collect(toImmutableList()),
            digraph.inducedSubgraph(ids));
    filtered.cycleDetection =
        CycleDetection.of(
            cycleDetection.cycleEdges().stream()
                .filter(edge -> keeps(ids, edge))
                .collect(ImmutableSet.toImmutableSet()));
    filtered.topologicalOrder =
        topologicalOrder.stream().filter(ids::contains).collect(toImmutableList());
    filtered.criticalPath = criticalPath.stream().filter(ids::contains).collect(toImmutableList());
    filtered.edgeRoutes =
        edgeRoutes.stream().filter(route -> keeps(ids, route.edge())).collect(toImmutableList());
    filtered.scheduled = scheduled;
    filtered.width = width;
    filtered.height = height;
    return filtered;
  }

  private static boolean keeps(Set<String> ids, EndpointPair<String> edge) {
    return ids.contains(edge.source()) && ids.contains(edge.target());
  }

  void setCycleDetection(CycleDetection cycleDetection) {
    this.cycleDetection = checkNotNull(cycleDetection, "cycleDetection");
  }

  void setTopologicalOrder(ImmutableList<String> topologicalOrder) {
    this.topologicalOrder = checkNotNull(topologicalOrder, "topologicalOrder");
  }

  void setSchedule(ImmutableList<String> criticalPath) {
    this.criticalPath = checkNotNull(criticalPath, "criticalPath");
    this.scheduled = true;
  }

  void setLayout(ImmutableList<EdgeRoute> edgeRoutes, int width, int height) {
    this.edgeRoutes = checkNotNull(edgeRoutes, "edgeRoutes");
    this.width = width;
    this.height = height;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodes", nodes.size())
        .add("edges", edges.size())
        .add("hasCycle", cycleDetection.hasCycle())
        .add("scheduled", scheduled)
        .add("criticalPath", criticalPath)
        .toString();
  }
}
