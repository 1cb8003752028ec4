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

import com.google.common.base.MoreObjects;
import java.util.OptionalDouble;
import javax.annotation.Nullable;

/**
 * Settings for one graph build. Instances are immutable and passed explicitly into {@link
 * PertEngine} and {@link GraphBuilder}; nothing in this package reads global configuration.
 */
public final class ScheduleOptions {

  /** One working day. */
  public static final double DEFAULT_DURATION_HOURS = 24.0;

  public static final double DEFAULT_CRITICAL_EPSILON = 1e-6;

  private static final ScheduleOptions DEFAULTS = builder().build();

  private final double defaultDurationHours;
  private final double criticalEpsilon;
  @Nullable private final Double deadlineHours;
  private final LayoutOptions layout;

  private ScheduleOptions(Builder builder) {
    this.defaultDurationHours = builder.defaultDurationHours;
    this.criticalEpsilon = builder.criticalEpsilon;
    this.deadlineHours = builder.deadlineHours;
    this.layout = builder.layout;
  }

  public static ScheduleOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .defaultDurationHours(defaultDurationHours)
        .criticalEpsilon(criticalEpsilon)
        .deadlineHours(deadlineHours)
        .layout(layout);
  }

  /** Duration given to issues without a usable estimate. */
  public double defaultDurationHours() {
    return defaultDurationHours;
  }

  /** Tolerance used when comparing a node's slack against the minimum slack. */
  public double criticalEpsilon() {
    return criticalEpsilon;
  }

  /**
   * The externally imposed finish time for sink nodes, if any. When absent, sinks finish at the
   * latest earliest-finish of the whole graph.
   */
  public OptionalDouble deadlineHours() {
    return deadlineHours == null ? OptionalDouble.empty() : OptionalDouble.of(deadlineHours);
  }

  public LayoutOptions layout() {
    return layout;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("defaultDurationHours", defaultDurationHours)
        .add("criticalEpsilon", criticalEpsilon)
        .add("deadlineHours", deadlineHours)
        .add("layout", layout)
        .toString();
  }

  /** Builder for {@link ScheduleOptions}. */
  public static final class Builder {
    private double defaultDurationHours = DEFAULT_DURATION_HOURS;
    private double criticalEpsilon = DEFAULT_CRITICAL_EPSILON;
    @Nullable private Double deadlineHours;
    private LayoutOptions layout = LayoutOptions.defaults();

    private Builder() {}

    public Builder defaultDurationHours(double hours) {
      checkArgument(
          Double.isFinite(hours) && hours > 0, "default duration must be positive: %s", hours);
      this.defaultDurationHours = hours;
      return this;
    }

    public Builder criticalEpsilon(double epsilon) {
      checkArgument(
          Double.isFinite(epsilon) && epsilon >= 0, "epsilon must not be negative: %s", epsilon);
      this.criticalEpsilon = epsilon;
      return this;
    }

    public Builder deadlineHours(@Nullable Double hours) {
      checkArgument(
          hours == null || (Double.isFinite(hours) && hours >= 0),
          "deadline must not be negative: %s",
          hours);
      this.deadlineHours = hours;
      return this;
    }

    public Builder layout(LayoutOptions layout) {
      this.layout = checkNotNull(layout, "layout");
      return this;
    }

    public ScheduleOptions build() {
      return new ScheduleOptions(this);
    }
  }
}
