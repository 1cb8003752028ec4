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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@code Digraph} a directed graph keyed by node label, suitable for modeling the "must finish
 * before" relation between issues.
 *
 * <p>An instance <code>G = &lt;V,E&gt;</code> consists of a set of nodes <code>V</code> and a set of
 * directed edges <code>E</code>, a subset of <code>V &times; V</code>. This permits self-edges but
 * does not represent multiple edges between the same pair of nodes.
 *
 * <p>Nodes hold no references to each other: each label maps to its own successor and predecessor
 * label sets. Nodes and adjacency sets iterate in insertion order, so two graphs built from the
 * same input visit identically.
 *
 * <p>Instances are only mutated while being built by this package; clients see a read-only {@link
 * com.google.common.graph.Graph} and may use Guava's {@link com.google.common.graph.Graphs}
 * algorithms on it.
 */
final class Digraph<T> extends AbstractGraph<T> {

  /** Maps labels to adjacency, which are in strict 1:1 correspondence. */
  private final Map<T, Adjacency<T>> nodes = new LinkedHashMap<>();

  /** Construct an empty Digraph. */
  Digraph() {}

  /** Adds a node with the given label. Returns true iff it was not already present. */
  boolean addNode(T node) {
    checkNotNull(node, "node");
    boolean modified = !nodes.containsKey(node);
    createNode(node);
    return modified;
  }

  /**
   * Adds a directed edge between the nodes labelled 'from' and 'to', creating them if necessary.
   *
   * @return true iff the edge was not already present.
   */
  boolean putEdge(T from, T to) {
    checkNotNull(from, "from");
    checkNotNull(to, "to");
    Adjacency<T> fromNode = createNode(from);
    Adjacency<T> toNode = createNode(to);
    if (!fromNode.successors.add(to)) {
      return false;
    }
    toNode.predecessors.add(from);
    return true;
  }

  /** Find or create the adjacency of the specified label. */
  private Adjacency<T> createNode(T label) {
    return nodes.computeIfAbsent(label, unused -> new Adjacency<>());
  }

  private Adjacency<T> getNode(T label) {
    Adjacency<T> node = nodes.get(checkNotNull(label, "node"));
    checkArgument(node != null, "No such node label: %s", label);
    return node;
  }

  /**
   * Returns the subgraph containing exactly the nodes of {@code subset} that belong to this graph,
   * and every edge of this graph between two of them.
   */
  Digraph<T> inducedSubgraph(Set<T> subset) {
    checkNotNull(subset, "subset");
    Digraph<T> subgraph = new Digraph<>();
    for (Map.Entry<T, Adjacency<T>> entry : nodes.entrySet()) {
      T from = entry.getKey();
      if (!subset.contains(from)) {
        continue;
      }
      subgraph.addNode(from);
      for (T to : entry.getValue().successors) {
        if (subset.contains(to)) {
          subgraph.putEdge(from, to);
        }
      }
    }
    return subgraph;
  }

  /** Returns an immutable view of the nodes of this graph. */
  @Override
  public Set<T> nodes() {
    return Collections.unmodifiableSet(nodes.keySet());
  }

  /** @return the set of root nodes: those with no predecessors. */
  public ImmutableSet<T> roots() {
    ImmutableSet.Builder<T> roots = ImmutableSet.builder();
    nodes.forEach(
        (label, node) -> {
          if (node.predecessors.isEmpty()) {
            roots.add(label);
          }
        });
    return roots.build();
  }

  /** @return the set of leaf nodes: those with no successors. */
  public ImmutableSet<T> leaves() {
    ImmutableSet.Builder<T> leaves = ImmutableSet.builder();
    nodes.forEach(
        (label, node) -> {
          if (node.successors.isEmpty()) {
            leaves.add(label);
          }
        });
    return leaves.build();
  }

  @Override
  public Set<T> adjacentNodes(T node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<T> predecessors(T node) {
    return Collections.unmodifiableSet(getNode(node).predecessors);
  }

  @Override
  public Set<T> successors(T node) {
    return Collections.unmodifiableSet(getNode(node).successors);
  }

  @Override
  public boolean isDirected() {
    return true;
  }

  @Override
  public boolean allowsSelfLoops() {
    return true;
  }

  @Override
  public ElementOrder<T> nodeOrder() {
    return ElementOrder.insertion();
  }

  @Override
  public String toString() {
    return "Digraph[" + nodes.size() + " nodes]";
  }

  private static final class Adjacency<T> {
    private final Set<T> successors = new LinkedHashSet<>();
    private final Set<T> predecessors = new LinkedHashSet<>();
  }
}
