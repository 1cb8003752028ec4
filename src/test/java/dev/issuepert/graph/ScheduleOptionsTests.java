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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Test for {@link ScheduleOptions}, {@link LayoutOptions} and {@link TimeEstimate}. */
class ScheduleOptionsTests {

  @Test
  void testDefaults() {
    ScheduleOptions options = ScheduleOptions.defaults();

    assertThat(options.defaultDurationHours()).isEqualTo(24.0);
    assertThat(options.criticalEpsilon()).isEqualTo(1e-6);
    assertThat(options.deadlineHours().isPresent()).isFalse();
    assertThat(options.layout().columnSpacing()).isEqualTo(24);
    assertThat(options.layout().rowSpacing()).isEqualTo(4);
  }

  @Test
  void testToBuilderCopiesEverySetting() {
    ScheduleOptions options =
        ScheduleOptions.builder()
            .defaultDurationHours(4)
            .criticalEpsilon(0.01)
            .deadlineHours(40.0)
            .layout(LayoutOptions.builder().nodeWidth(12).build())
            .build();

    ScheduleOptions copy = options.toBuilder().build();

    assertThat(copy.defaultDurationHours()).isEqualTo(4.0);
    assertThat(copy.criticalEpsilon()).isEqualTo(0.01);
    assertThat(copy.deadlineHours().getAsDouble()).isEqualTo(40.0);
    assertThat(copy.layout().nodeWidth()).isEqualTo(12);
    assertThat(options.toBuilder().deadlineHours(null).build().deadlineHours().isPresent())
        .isFalse();
  }

  @Test
  void testInvalidValuesAreRejected() {
    ScheduleOptions.Builder builder = ScheduleOptions.builder();

    assertThrows(IllegalArgumentException.class, () -> builder.defaultDurationHours(0));
    assertThrows(IllegalArgumentException.class, () -> builder.defaultDurationHours(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> builder.criticalEpsilon(-1));
    assertThrows(IllegalArgumentException.class, () -> builder.deadlineHours(-5.0));
    assertThrows(NullPointerException.class, () -> builder.layout(null));
    assertThrows(IllegalArgumentException.class, () -> LayoutOptions.builder().nodeWidth(0));
    assertThrows(IllegalArgumentException.class, () -> LayoutOptions.builder().verticalGap(-1));
  }

  @Test
  void testTimeEstimateHours() {
    assertThat(TimeEstimate.ofHours(5).hours()).isEqualTo(5.0);
    assertThat(TimeEstimate.ofDays(3).hours()).isEqualTo(24.0);
    assertThat(TimeEstimate.ofWeeks(2).hours()).isEqualTo(80.0);
    assertThat(TimeEstimate.of(1, TimeEstimate.Unit.DAYS)).isEqualTo(TimeEstimate.ofDays(1));
    assertThrows(IllegalArgumentException.class, () -> TimeEstimate.ofHours(Double.NaN));
  }

  @Test
  void testIssueBuilder() {
    Issue issue = Issue.builder("X-1").dependsOn("X-0").blocks("X-2", "X-3").build();

    assertThat(issue.title()).isEqualTo("X-1");
    assertThat(issue.status()).isEqualTo(IssueStatus.OPEN);
    assertThat(issue.estimate().isPresent()).isFalse();
    assertThat(issue.dependencies()).containsExactly("X-0");
    assertThat(issue.blocks()).containsExactly("X-2", "X-3").inOrder();
    assertThrows(IllegalArgumentException.class, () -> Issue.builder(""));
  }
}
