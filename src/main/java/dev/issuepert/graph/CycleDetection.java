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

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;
import java.util.Set;

/**
 * The outcome of cycle detection over a dependency graph: whether a cycle exists and every edge
 * that lies on at least one cycle, so a view can highlight the whole offending subset.
 */
public final class CycleDetection {

  private static final CycleDetection ACYCLIC = new CycleDetection(ImmutableSet.of());

  private final ImmutableSet<EndpointPair<String>> cycleEdges;

  private CycleDetection(ImmutableSet<EndpointPair<String>> cycleEdges) {
    this.cycleEdges = cycleEdges;
  }

  public static CycleDetection acyclic() {
    return ACYCLIC;
  }

  static CycleDetection of(Set<EndpointPair<String>> cycleEdges) {
    checkNotNull(cycleEdges, "cycleEdges");
    return cycleEdges.isEmpty() ? ACYCLIC : new CycleDetection(ImmutableSet.copyOf(cycleEdges));
  }

  public boolean hasCycle() {
    return !cycleEdges.isEmpty();
  }

  /** Edges lying on some directed cycle, ordered by source id and then target id. */
  public ImmutableSet<EndpointPair<String>> cycleEdges() {
    return cycleEdges;
  }

  public boolean isCycleEdge(String from, String to) {
    return cycleEdges.contains(EndpointPair.ordered(from, to));
  }

  /**
   * Returns a message naming the offending edges, e.g. {@code "cycle detected: A→B, B→A"}, or the
   * empty string when there is no cycle.
   */
  public String describe() {
    if (!hasCycle()) {
      return "";
    }
    StringBuilder message = new StringBuilder("cycle detected: ");
    Joiner.on(", ")
        .appendTo(
            message,
            cycleEdges.stream().map(edge -> edge.source() + "→" + edge.target()).iterator());
    return message.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CycleDetection && cycleEdges.equals(((CycleDetection) o).cycleEdges);
  }

  @Override
  public int hashCode() {
    return cycleEdges.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hasCycle", hasCycle())
        .add("cycleEdges", cycleEdges)
        .toString();
  }
}
