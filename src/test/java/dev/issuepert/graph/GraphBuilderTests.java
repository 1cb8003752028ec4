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

import static com.google.common.truth.Truth.assertThat;
import static dev.issuepert.graph.Issues.task;
import static dev.issuepert.graph.Issues.unestimated;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import org.junit.jupiter.api.Test;

/** Test for {@link GraphBuilder}. */
class GraphBuilderTests {

  private static final ScheduleOptions OPTIONS =
      ScheduleOptions.builder().defaultDurationHours(8).build();

  @Test
  void testEmptySnapshot() {
    PertGraph graph = GraphBuilder.build(ImmutableList.of(), OPTIONS);

    assertThat(graph.isEmpty()).isTrue();
    assertThat(graph.edges()).isEmpty();
    assertThat(graph.graph().nodes()).isEmpty();
  }

  @Test
  void testOneNodePerIssueInInputOrder() {
    PertGraph graph =
        GraphBuilder.build(
            ImmutableList.of(
                Issue.builder("b-2").title("Write docs").status(IssueStatus.IN_PROGRESS).build(),
                Issue.builder("a-1").title("Ship it").build()),
            OPTIONS);

    assertThat(graph.nodes().keySet()).containsExactly("b-2", "a-1").inOrder();
    PertNode docs = graph.node("b-2").orElseThrow();
    assertThat(docs.title()).isEqualTo("Write docs");
    assertThat(docs.status()).isEqualTo(IssueStatus.IN_PROGRESS);
    assertThat(docs.isCritical()).isFalse();
    assertThat(docs.earliestStart()).isEqualTo(0.0);
  }

  @Test
  void testBlocksAndDependenciesDescribeTheSameEdge() {
    PertGraph graph =
        GraphBuilder.build(
            ImmutableList.of(
                Issue.builder("A").blocks("B").build(),
                Issue.builder("B").dependsOn("A").build(),
                Issue.builder("C").dependsOn("A", "A").build()),
            OPTIONS);

    assertThat(graph.edges())
        .containsExactly(EndpointPair.ordered("A", "B"), EndpointPair.ordered("A", "C"))
        .inOrder();
    assertThat(graph.graph().successors("A")).containsExactly("B", "C");
  }

  @Test
  void testDanglingReferencesAreDropped() {
    PertGraph graph =
        GraphBuilder.build(
            ImmutableList.of(
                Issue.builder("A").blocks("missing").dependsOn("elsewhere").build(),
                Issue.builder("B").dependsOn("A").build()),
            OPTIONS);

    assertThat(graph.nodes().keySet()).containsExactly("A", "B");
    assertThat(graph.edges()).containsExactly(EndpointPair.ordered("A", "B"));
  }

  @Test
  void testRepeatedIssueIdKeepsFirstOccurrence() {
    PertGraph graph =
        GraphBuilder.build(
            ImmutableList.of(
                Issue.builder("A").title("first").blocks("B").build(),
                Issue.builder("B").build(),
                Issue.builder("A").title("second").dependsOn("B").build()),
            OPTIONS);

    assertThat(graph.nodes()).hasSize(2);
    assertThat(graph.node("A").orElseThrow().title()).isEqualTo("first");
    assertThat(graph.edges()).containsExactly(EndpointPair.ordered("A", "B"));
  }

  @Test
  void testSelfReferenceIsKept() {
    PertGraph graph = GraphBuilder.build(ImmutableList.of(unestimated("A", "A")), OPTIONS);

    assertThat(graph.edges()).containsExactly(EndpointPair.ordered("A", "A"));
  }

  @Test
  void testDurationFallsBackToDefault() {
    PertGraph graph =
        GraphBuilder.build(
            ImmutableList.of(
                task("estimated", 3),
                unestimated("unestimated"),
                task("zero", 0),
                task("negative", -2),
                Issue.builder("days").estimate(TimeEstimate.ofDays(2)).build(),
                Issue.builder("weeks").estimate(TimeEstimate.ofWeeks(0.5)).build()),
            OPTIONS);

    assertThat(graph.node("estimated").orElseThrow().duration()).isEqualTo(3.0);
    assertThat(graph.node("unestimated").orElseThrow().duration()).isEqualTo(8.0);
    assertThat(graph.node("zero").orElseThrow().duration()).isEqualTo(8.0);
    assertThat(graph.node("negative").orElseThrow().duration()).isEqualTo(8.0);
    assertThat(graph.node("days").orElseThrow().duration()).isEqualTo(16.0);
    assertThat(graph.node("weeks").orElseThrow().duration()).isEqualTo(20.0);
  }

  @Test
  void testBuildDoesNotScheduleOrDetectCycles() {
    PertGraph graph = GraphBuilder.build(Issues.chain(), OPTIONS);

    assertThat(graph.isScheduled()).isFalse();
    assertThat(graph.topologicalOrder()).isEmpty();
    assertThat(graph.cycleDetection().hasCycle()).isFalse();
  }
}
