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
import static dev.issuepert.graph.Issues.schedule;
import static dev.issuepert.graph.Issues.task;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Test for {@link CpmEngine}. */
class CpmEngineTests {

  private static final double TOLERANCE = 1e-9;

  private static PertNode node(PertGraph graph, String id) {
    return graph.node(id).orElseThrow();
  }

  @Test
  void testChain() {
    PertGraph graph = schedule(Issues.chain());

    assertThat(graph.topologicalOrder()).containsExactly("A", "B", "C").inOrder();
    assertThat(node(graph, "A").earliestFinish()).isWithin(TOLERANCE).of(2);
    assertThat(node(graph, "B").earliestFinish()).isWithin(TOLERANCE).of(5);
    assertThat(node(graph, "C").earliestFinish()).isWithin(TOLERANCE).of(6);
    assertThat(node(graph, "C").latestFinish()).isWithin(TOLERANCE).of(6);
    for (PertNode node : graph.nodes().values()) {
      assertThat(node.slack()).isWithin(TOLERANCE).of(0);
      assertThat(node.latestFinish()).isWithin(TOLERANCE).of(node.earliestFinish());
      assertThat(node.isCritical()).isTrue();
    }
    assertThat(graph.criticalPath()).containsExactly("A", "B", "C").inOrder();
  }

  @Test
  void testDiamondTakesTheLongerBranch() {
    PertGraph graph = schedule(Issues.diamond());

    PertNode d = node(graph, "D");
    assertThat(d.earliestStart()).isWithin(TOLERANCE).of(5);
    assertThat(d.earliestStart())
        .isWithin(TOLERANCE)
        .of(Math.max(node(graph, "B").earliestFinish(), node(graph, "C").earliestFinish()));
    assertThat(d.earliestFinish()).isWithin(TOLERANCE).of(6);

    PertNode c = node(graph, "C");
    assertThat(c.earliestStart()).isWithin(TOLERANCE).of(1);
    assertThat(c.latestStart()).isWithin(TOLERANCE).of(3);
    assertThat(c.latestFinish()).isWithin(TOLERANCE).of(5);
    assertThat(c.slack()).isWithin(TOLERANCE).of(2);
    assertThat(c.isCritical()).isFalse();

    assertThat(node(graph, "A").latestFinish()).isWithin(TOLERANCE).of(1);
    assertThat(graph.criticalPath()).containsExactly("A", "B", "D").inOrder();
    assertThat(graph.isCriticalEdge(EndpointPair.ordered("B", "D"))).isTrue();
    assertThat(graph.isCriticalEdge(EndpointPair.ordered("A", "C"))).isFalse();
    assertThat(graph.isCriticalEdge(EndpointPair.ordered("C", "D"))).isFalse();
  }

  @Test
  void testEqualBranchesAreBothCritical() {
    PertGraph graph =
        schedule(
            ImmutableList.of(
                task("A", 1, "B", "C"), task("B", 1, "D"), task("C", 1, "D"), task("D", 1)));

    assertThat(graph.criticalPath()).containsExactly("A", "B", "C", "D").inOrder();
  }

  @Test
  void testIndependentIssuesStartAtZero() {
    PertGraph graph = schedule(ImmutableList.of(task("A", 8), task("B", 3), task("C", 5)));

    for (PertNode node : graph.nodes().values()) {
      assertThat(node.earliestStart()).isEqualTo(0.0);
      assertThat(node.latestFinish()).isWithin(TOLERANCE).of(8);
    }
    assertThat(graph.criticalPath()).containsExactly("A");
    assertThat(node(graph, "B").slack()).isWithin(TOLERANCE).of(5);
  }

  @Test
  void testSlackWithinEpsilonIsCritical() {
    PertGraph graph =
        schedule(
            ImmutableList.of(
                task("A", 0.1, "B"), task("B", 0.2, "D"), task("C", 0.3, "D"), task("D", 1)));

    assertThat(graph.criticalPath()).containsExactly("A", "B", "C", "D").inOrder();
  }

  @Test
  void testDeadlineShiftsMinimumSlack() {
    ScheduleOptions options = ScheduleOptions.builder().deadlineHours(10.0).build();

    PertGraph graph = schedule(Issues.diamond(), options);

    assertThat(node(graph, "D").latestFinish()).isWithin(TOLERANCE).of(10);
    assertThat(node(graph, "A").slack()).isWithin(TOLERANCE).of(4);
    assertThat(node(graph, "C").slack()).isWithin(TOLERANCE).of(6);
    assertThat(graph.criticalPath()).containsExactly("A", "B", "D").inOrder();
  }

  @Test
  void testMissedDeadlineGivesNegativeSlack() {
    ScheduleOptions options = ScheduleOptions.builder().deadlineHours(4.0).build();

    PertGraph graph = schedule(Issues.chain(), options);

    for (PertNode node : graph.nodes().values()) {
      assertThat(node.slack()).isWithin(TOLERANCE).of(-2);
      assertThat(node.isCritical()).isTrue();
    }
  }

  @Test
  void testCyclicGraphIsRejected() {
    PertGraph graph = schedule(ImmutableList.of(task("A", 1, "B"), task("B", 1, "A")));

    assertThrows(
        IllegalArgumentException.class, () -> CpmEngine.schedule(graph, ScheduleOptions.defaults()));
  }

  @Test
  void testRandomGraphsSatisfyCpmProperties() {
    Random random = new Random(1234);
    for (int round = 0; round < 40; round++) {
      int size = 1 + random.nextInt(12);
      List<Issue> issues = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        Issue.Builder issue = Issue.builder("t" + i).estimateHours(1 + random.nextInt(9));
        for (int j = i + 1; j < size; j++) {
          if (random.nextInt(3) == 0) {
            issue.blocks("t" + j);
          }
        }
        issues.add(issue.build());
      }

      PertGraph graph = schedule(issues);

      double maxSinkFinish = 0;
      for (String id : graph.graph().nodes()) {
        if (graph.graph().successors(id).isEmpty()) {
          maxSinkFinish = Math.max(maxSinkFinish, node(graph, id).earliestFinish());
        }
      }
      double minSlack = Double.POSITIVE_INFINITY;
      for (PertNode node : graph.nodes().values()) {
        minSlack = Math.min(minSlack, node.slack());
      }
      for (PertNode node : graph.nodes().values()) {
        String id = node.id();
        assertThat(node.slack()).isAtLeast(minSlack);
        assertThat(node.earliestFinish() - node.earliestStart())
            .isWithin(TOLERANCE)
            .of(node.duration());
        if (graph.graph().predecessors(id).isEmpty()) {
          assertThat(node.earliestStart()).isEqualTo(0.0);
        }
        if (graph.graph().successors(id).isEmpty()) {
          assertThat(node.latestFinish()).isWithin(TOLERANCE).of(maxSinkFinish);
        }
      }
      assertThat(minSlack).isWithin(TOLERANCE).of(0);
      assertThat(graph.criticalPath()).isNotEmpty();
    }
  }
}
