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

import com.google.common.base.MoreObjects;

/**
 * Box and spacing sizes used by {@link LayoutAssigner}, in terminal cells.
 *
 * <p>Each rank occupies a column {@link #columnSpacing()} cells wide; each node within a rank
 * occupies a row {@link #rowSpacing()} cells tall, which reserves {@link #verticalGap()} blank
 * cells below every box.
 */
public final class LayoutOptions {

  public static final int DEFAULT_NODE_WIDTH = 20;
  public static final int DEFAULT_NODE_HEIGHT = 3;
  public static final int DEFAULT_HORIZONTAL_GAP = 4;
  public static final int DEFAULT_VERTICAL_GAP = 1;

  private static final LayoutOptions DEFAULTS = builder().build();

  private final int nodeWidth;
  private final int nodeHeight;
  private final int horizontalGap;
  private final int verticalGap;

  private LayoutOptions(Builder builder) {
    this.nodeWidth = builder.nodeWidth;
    this.nodeHeight = builder.nodeHeight;
    this.horizontalGap = builder.horizontalGap;
    this.verticalGap = builder.verticalGap;
  }

  public static LayoutOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int nodeWidth() {
    return nodeWidth;
  }

  public int nodeHeight() {
    return nodeHeight;
  }

  public int horizontalGap() {
    return horizontalGap;
  }

  public int verticalGap() {
    return verticalGap;
  }

  public int columnSpacing() {
    return nodeWidth + horizontalGap;
  }

  public int rowSpacing() {
    return nodeHeight + verticalGap;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodeWidth", nodeWidth)
        .add("nodeHeight", nodeHeight)
        .add("horizontalGap", horizontalGap)
        .add("verticalGap", verticalGap)
        .toString();
  }

  /** Builder for {@link LayoutOptions}. */
  public static final class Builder {
    private int nodeWidth = DEFAULT_NODE_WIDTH;
    private int nodeHeight = DEFAULT_NODE_HEIGHT;
    private int horizontalGap = DEFAULT_HORIZONTAL_GAP;
    private int verticalGap = DEFAULT_VERTICAL_GAP;

    private Builder() {}

    public Builder nodeWidth(int nodeWidth) {
      checkArgument(nodeWidth > 0, "nodeWidth must be positive: %s", nodeWidth);
      this.nodeWidth = nodeWidth;
      return this;
    }

    public Builder nodeHeight(int nodeHeight) {
      checkArgument(nodeHeight > 0, "nodeHeight must be positive: %s", nodeHeight);
      this.nodeHeight = nodeHeight;
      return this;
    }

    public Builder horizontalGap(int horizontalGap) {
      checkArgument(horizontalGap >= 0, "horizontalGap must not be negative: %s", horizontalGap);
      this.horizontalGap = horizontalGap;
      return this;
    }

    public Builder verticalGap(int verticalGap) {
      checkArgument(verticalGap >= 0, "verticalGap must not be negative: %s", verticalGap);
      this.verticalGap = verticalGap;
      return this;
    }

    public LayoutOptions build() {
      return new LayoutOptions(this);
    }
  }
}
