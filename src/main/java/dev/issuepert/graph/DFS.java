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

import com.google.common.collect.ImmutableList;
import com.google.common.graph.SuccessorsFunction;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The DFS class encapsulates a depth-first search visitation, including the order in which the
 * edges leaving a node are followed and which nodes have been seen already.
 *
 * <p>The visitation keeps its own stack of partially explored nodes instead of recursing, so the
 * depth of the graph is bounded only by available heap. Issue graphs are user data and a long
 * dependency chain must not overflow the call stack.
 *
 * <p>Clients should not modify the graph while a traversal is in progress.
 */
final class DFS<T> {

  private final SuccessorsFunction<T> graph;

  @Nullable private final Comparator<? super T> edgeOrder;

  private final Set<T> marked = new HashSet<>();

  /**
   * Constructs a DFS instance for searching over {@code graph}.
   *
   * @param edgeOrder an ordering in which the edges originating from the same node should be
   *     visited (if null, the graph's own iteration order is used)
   */
  DFS(SuccessorsFunction<T> graph, @Nullable Comparator<? super T> edgeOrder) {
    this.graph = graph;
    this.edgeOrder = edgeOrder;
  }

  /** Returns the (immutable) set of nodes visited so far. */
  Set<T> getMarked() {
    return Collections.unmodifiableSet(marked);
  }

  /** Visits from every node of {@code startNodes} in turn, skipping ones already reached. */
  void visitAll(Iterable<T> startNodes, GraphVisitor<T> visitor) {
    visitor.beginVisit();
    for (T node : startNodes) {
      visit(node, visitor);
    }
    visitor.endVisit();
  }

  void visit(T node, GraphVisitor<T> visitor) {
    if (!marked.add(node)) {
      return;
    }

    Deque<Frame<T>> stack = new ArrayDeque<>();
    visitor.visitNode(node);
    stack.push(new Frame<>(node, edgeTargets(node)));

    while (!stack.isEmpty()) {
      Frame<T> top = stack.peek();
      if (top.remaining.hasNext()) {
        T next = top.remaining.next();
        visitor.visitEdge(top.node, next);
        if (marked.add(next)) {
          visitor.visitNode(next);
          stack.push(new Frame<>(next, edgeTargets(next)));
        }
      } else {
        stack.pop();
        visitor.finishNode(top.node);
      }
    }
  }

  private Iterator<T> edgeTargets(T node) {
    Iterable<? extends T> successors = graph.successors(node);
    if (edgeOrder != null) {
      return ImmutableList.<T>sortedCopyOf(edgeOrder, successors).iterator();
    }
    return ImmutableList.<T>copyOf(successors).iterator();
  }

  /** A node on the visitation stack, with the edge targets still to be followed. */
  private static final class Frame<T> {
    private final T node;
    private final Iterator<T> remaining;

    private Frame(T node, Iterator<T> remaining) {
      this.node = node;
      this.remaining = remaining;
    }
  }
}
