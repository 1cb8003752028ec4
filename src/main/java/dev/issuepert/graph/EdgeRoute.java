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

import com.google.common.base.MoreObjects;
import com.google.common.graph.EndpointPair;

/**
 * A routing hint for drawing one dependency arrow: it leaves the middle of the right side of the
 * source box and enters the middle of the left side of the target box.
 */
public final class EdgeRoute {

  private final EndpointPair<String> edge;
  private final int startX;
  private final int startY;
  private final int endX;
  private final int endY;
  private final int rankSpan;
  private final boolean critical;

  EdgeRoute(
      EndpointPair<String> edge,
      int startX,
      int startY,
      int endX,
      int endY,
      int rankSpan,
      boolean critical) {
    this.edge = edge;
    this.startX = startX;
    this.startY = startY;
    this.endX = endX;
    this.endY = endY;
    this.rankSpan = rankSpan;
    this.critical = critical;
  }

  public EndpointPair<String> edge() {
    return edge;
  }

  public int startX() {
    return startX;
  }

  public int startY() {
    return startY;
  }

  public int endX() {
    return endX;
  }

  public int endY() {
    return endY;
  }

  /** Number of rank columns the arrow crosses; always at least 1. */
  public int rankSpan() {
    return rankSpan;
  }

  /** True when the arrow passes over intermediate columns and has to be routed around them. */
  public boolean skipsRanks() {
    return rankSpan > 1;
  }

  public boolean isCritical() {
    return critical;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("edge", edge)
        .add("start", startX + "," + startY)
        .add("end", endX + "," + endY)
        .add("rankSpan", rankSpan)
        .add("critical", critical)
        .toString();
  }
}
