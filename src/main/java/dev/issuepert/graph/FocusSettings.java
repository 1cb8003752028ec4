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

import com.google.common.base.MoreObjects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The focus parameters a PERT view keeps between key presses: whether focus mode is on, the
 * selected node, the direction and the depth. Instances are immutable; every change returns a new
 * value, so the view can hand the current one to {@link #extract(PertGraph)} on each rebuild.
 */
public final class FocusSettings {

  private static final FocusSettings DEFAULTS =
      new FocusSettings(false, null, FocusDirection.BOTH, FocusSubgraphExtractor.MIN_DEPTH);

  private final boolean enabled;
  @Nullable private final String selectedId;
  private final FocusDirection direction;
  private final int depth;

  private FocusSettings(
      boolean enabled, @Nullable String selectedId, FocusDirection direction, int depth) {
    this.enabled = enabled;
    this.selectedId = selectedId;
    this.direction = direction;
    this.depth = FocusSubgraphExtractor.clampDepth(depth);
  }

  /** Focus off, nothing selected, both directions, depth 1. */
  public static FocusSettings defaults() {
    return DEFAULTS;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Optional<String> selectedId() {
    return Optional.ofNullable(selectedId);
  }

  public FocusDirection direction() {
    return direction;
  }

  public int depth() {
    return depth;
  }

  public FocusSettings toggled() {
    return new FocusSettings(!enabled, selectedId, direction, depth);
  }

  public FocusSettings select(@Nullable String id) {
    return new FocusSettings(enabled, id, direction, depth);
  }

  public FocusSettings withDirection(FocusDirection direction) {
    return new FocusSettings(enabled, selectedId, checkNotNull(direction, "direction"), depth);
  }

  public FocusSettings withNextDirection() {
    return withDirection(direction.next());
  }

  /** One step deeper, up to {@value FocusSubgraphExtractor#MAX_DEPTH}. */
  public FocusSettings deeper() {
    return new FocusSettings(enabled, selectedId, direction, depth + 1);
  }

  /** One step shallower, down to {@value FocusSubgraphExtractor#MIN_DEPTH}. */
  public FocusSettings shallower() {
    return new FocusSettings(enabled, selectedId, direction, depth - 1);
  }

  /**
   * Returns the focus subgraph of {@code graph} for these settings, or empty when focus mode is off
   * or nothing is selected.
   */
  public Optional<FocusSubgraph> extract(PertGraph graph) {
    checkNotNull(graph, "graph");
    if (!enabled || selectedId == null) {
      return Optional.empty();
    }
    return Optional.of(FocusSubgraphExtractor.extract(graph, selectedId, direction, depth));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("enabled", enabled)
        .add("selectedId", selectedId)
        .add("direction", direction.label())
        .add("depth", depth)
        .toString();
  }
}
