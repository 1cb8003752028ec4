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

/**
 * One issue in a {@link PertGraph}, with its scheduling metrics and layout position.
 *
 * <p>Timing fields are zero and {@link #isCritical()} is false until the owning graph has been
 * scheduled; check {@link PertGraph#isScheduled()} before reading them. Durations and times are in
 * hours, coordinates in terminal cells.
 */
public final class PertNode {

  private final String id;
  private final String title;
  private final IssueStatus status;
  private final double duration;

  private double earliestStart;
  private double earliestFinish;
  private double latestStart;
  private double latestFinish;
  private double slack;
  private boolean critical;

  private int rank;
  private int x;
  private int y;

  PertNode(String id, String title, IssueStatus status, double duration) {
    this.id = checkNotNull(id, "id");
    this.title = checkNotNull(title, "title");
    this.status = checkNotNull(status, "status");
    this.duration = duration;
  }

  public String id() {
    return id;
  }

  public String title() {
    return title;
  }

  public IssueStatus status() {
    return status;
  }

  public double duration() {
    return duration;
  }

  public double earliestStart() {
    return earliestStart;
  }

  public double earliestFinish() {
    return earliestFinish;
  }

  public double latestStart() {
    return latestStart;
  }

  public double latestFinish() {
    return latestFinish;
  }

  /** How long this node's start can slip without delaying the project; latest minus earliest. */
  public double slack() {
    return slack;
  }

  public boolean isCritical() {
    return critical;
  }

  /** Longest-path distance from a node without predecessors. */
  public int rank() {
    return rank;
  }

  public int x() {
    return x;
  }

  public int y() {
    return y;
  }

  void setEarliest(double start) {
    this.earliestStart = start;
    this.earliestFinish = start + duration;
  }

  void setLatest(double finish) {
    this.latestFinish = finish;
    this.latestStart = finish - duration;
    this.slack = latestStart - earliestStart;
  }

  void setCritical(boolean critical) {
    this.critical = critical;
  }

  void setPosition(int rank, int x, int y) {
    this.rank = rank;
    this.x = x;
    this.y = y;
  }

  PertNode copy() {
    PertNode copy = new PertNode(id, title, status, duration);
    copy.earliestStart = earliestStart;
    copy.earliestFinish = earliestFinish;
    copy.latestStart = latestStart;
    copy.latestFinish = latestFinish;
    copy.slack = slack;
    copy.critical = critical;
    copy.rank = rank;
    copy.x = x;
    copy.y = y;
    return copy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("duration", duration)
        .add("earliestStart", earliestStart)
        .add("earliestFinish", earliestFinish)
        .add("latestStart", latestStart)
        .add("latestFinish", latestFinish)
        .add("slack", slack)
        .add("critical", critical)
        .add("x", x)
        .add("y", y)
        .toString();
  }
}
