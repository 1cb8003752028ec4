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
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.EndpointPair;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an issue snapshot into the unscheduled skeleton of a {@link PertGraph}: one node per issue
 * and one edge per distinct {@code (from, to)} pair named by any issue's dependency or blocks list.
 *
 * <p>Input is normalized rather than rejected. A repeated issue id keeps its first occurrence.
 * Edges naming an issue outside the snapshot are dropped, since they refer to work that is simply
 * not loaded. The same edge declared from both ends is kept once.
 */
public final class GraphBuilder {

  private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

  private GraphBuilder() {}

  public static PertGraph build(List<Issue> issues, ScheduleOptions options) {
    checkNotNull(issues, "issues");
    checkNotNull(options, "options");

    Map<String, PertNode> nodes = new LinkedHashMap<>();
    List<Issue> kept = new ArrayList<>(issues.size());
    Digraph<String> digraph = new Digraph<>();
    for (Issue issue : issues) {
      if (nodes.containsKey(issue.id())) {
        log.debug("Ignoring repeated issue id {}", issue.id());
        continue;
      }
      nodes.put(
          issue.id(),
          new PertNode(issue.id(), issue.title(), issue.status(), durationOf(issue, options)));
      digraph.addNode(issue.id());
      kept.add(issue);
    }

    Set<EndpointPair<String>> edges = new LinkedHashSet<>();
    int dangling = 0;
    for (Issue issue : kept) {
      for (String dependency : issue.dependencies()) {
        dangling += addEdge(nodes, digraph, edges, dependency, issue.id()) ? 0 : 1;
      }
      for (String blocked : issue.blocks()) {
        dangling += addEdge(nodes, digraph, edges, issue.id(), blocked) ? 0 : 1;
      }
    }
    if (dangling > 0) {
      log.debug("Dropped {} dependency references to issues outside the snapshot", dangling);
    }

    return new PertGraph(ImmutableMap.copyOf(nodes), ImmutableList.copyOf(edges), digraph);
  }

  /** Returns false if either endpoint is not a loaded issue. */
  private static boolean addEdge(
      Map<String, PertNode> nodes,
      Digraph<String> digraph,
      Set<EndpointPair<String>> edges,
      String from,
      String to) {
    if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
      return false;
    }
    if (digraph.putEdge(from, to)) {
      edges.add(EndpointPair.ordered(from, to));
    }
    return true;
  }

  /** The estimate in hours when it is positive, otherwise the configured default. */
  static double durationOf(Issue issue, ScheduleOptions options) {
    return issue
        .estimate()
        .map(TimeEstimate::hours)
        .filter(hours -> hours > 0)
        .orElse(options.defaultDurationHours());
  }
}
