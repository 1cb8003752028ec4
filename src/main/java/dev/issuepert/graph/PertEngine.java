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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds render-ready dependency graphs for PERT and critical-path views.
 *
 * <p>Each call to {@link #build(List)} runs the whole pipeline synchronously on the caller's
 * thread:
 *
 * <ol>
 *   <li>{@link GraphBuilder} turns the issues into nodes and deduplicated edges;
 *   <li>{@link CycleDetector} reports every edge on a cycle;
 *   <li>for acyclic graphs only, {@link TopologicalSorter}, {@link CpmEngine} and {@link
 *       LayoutAssigner} compute order, timings and coordinates.
 * </ol>
 *
 * <p>A cycle or an empty snapshot is not an error: both come back as a {@link PertGraph} the view
 * can render, with {@link PertGraph#cycleDetection()} naming the offending edges in the first case.
 * The engine holds no state besides its options, and each returned graph belongs to its caller.
 */
public final class PertEngine {

  private static final Logger log = LoggerFactory.getLogger(PertEngine.class);

  private final ScheduleOptions options;

  public PertEngine(ScheduleOptions options) {
    this.options = checkNotNull(options, "options");
  }

  public PertEngine() {
    this(ScheduleOptions.defaults());
  }

  public ScheduleOptions options() {
    return options;
  }

  public PertGraph build(List<Issue> issues) {
    checkNotNull(issues, "issues");
    Stopwatch stopwatch = Stopwatch.createStarted();
    PertGraph graph = GraphBuilder.build(ImmutableList.copyOf(issues), options);

    CycleDetection cycles = CycleDetector.detect(graph.graph());
    graph.setCycleDetection(cycles);
    if (cycles.hasCycle()) {
      log.warn(
          "Not scheduling {} issues: {} ({} edges involved)",
          graph.nodes().size(),
          cycles.describe(),
          cycles.cycleEdges().size());
      return graph;
    }

    graph.setTopologicalOrder(TopologicalSorter.sort(graph.graph()));
    CpmEngine.schedule(graph, options);
    LayoutAssigner.assign(graph, options.layout());

    log.debug(
        "Scheduled {} issues and {} edges in {}: critical path {}",
        graph.nodes().size(),
        graph.edges().size(),
        stopwatch,
        graph.criticalPath());
    return graph;
  }

  /** Shorthand for {@link FocusSubgraphExtractor#extract}. */
  public FocusSubgraph focus(PertGraph graph, String focusId, FocusDirection direction, int depth) {
    return FocusSubgraphExtractor.extract(graph, focusId, direction, depth);
  }
}
