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

import com.google.common.graph.Graph;
import java.util.Locale;
import java.util.Set;

/** Which way a focus subgraph grows from the selected node. */
public enum FocusDirection {
  /** Toward the issues the selection depends on, following edges backwards. */
  UPSTREAM {
    @Override
    <N> Set<N> neighbours(Graph<N> graph, N node) {
      return graph.predecessors(node);
    }
  },
  /** Toward the issues the selection blocks, following edges forwards. */
  DOWNSTREAM {
    @Override
    <N> Set<N> neighbours(Graph<N> graph, N node) {
      return graph.successors(node);
    }
  },
  /** Both ways at every step. */
  BOTH {
    @Override
    <N> Set<N> neighbours(Graph<N> graph, N node) {
      return graph.adjacentNodes(node);
    }
  };

  abstract <N> Set<N> neighbours(Graph<N> graph, N node);

  /** Returns the direction a toggle key moves to: both, upstream, downstream, then both again. */
  public FocusDirection next() {
    switch (this) {
      case BOTH:
        return UPSTREAM;
      case UPSTREAM:
        return DOWNSTREAM;
      default:
        return BOTH;
    }
  }

  /** The lower-case name shown in the view's status line. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses {@code "upstream"}, {@code "downstream"} or {@code "both"}, ignoring case and
   * surrounding whitespace.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static FocusDirection parse(String value) {
    checkNotNull(value, "value");
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (FocusDirection direction : values()) {
      if (direction.label().equals(normalized)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown focus direction: " + value);
  }
}
