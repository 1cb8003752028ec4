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
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A snapshot of one tracker issue, as handed to the engine by the surrounding application.
 *
 * <p>{@link #dependencies()} and {@link #blocks()} are the two directions of the same relation:
 * {@code a.blocks()} containing {@code b} and {@code b.dependencies()} containing {@code a} both
 * describe the edge {@code a -> b}, meaning "a must finish before b starts". Ids in either list
 * need not name an issue of the same snapshot.
 */
public final class Issue {

  private final String id;
  private final String title;
  private final IssueStatus status;
  @Nullable private final TimeEstimate estimate;
  private final ImmutableList<String> dependencies;
  private final ImmutableList<String> blocks;

  private Issue(Builder builder) {
    this.id = builder.id;
    this.title = builder.title;
    this.status = builder.status;
    this.estimate = builder.estimate;
    this.dependencies = builder.dependencies.build();
    this.blocks = builder.blocks.build();
  }

  public static Builder builder(String id) {
    return new Builder(id);
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

  public Optional<TimeEstimate> estimate() {
    return Optional.ofNullable(estimate);
  }

  /** Ids of the issues this issue depends on, i.e. is blocked by. */
  public ImmutableList<String> dependencies() {
    return dependencies;
  }

  /** Ids of the issues this issue blocks. */
  public ImmutableList<String> blocks() {
    return blocks;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", id)
        .add("title", title)
        .add("status", status)
        .add("estimate", estimate)
        .add("dependencies", dependencies)
        .add("blocks", blocks)
        .toString();
  }

  /** Builder for {@link Issue}. The title defaults to the id and the status to OPEN. */
  public static final class Builder {
    private final String id;
    private String title;
    private IssueStatus status = IssueStatus.OPEN;
    @Nullable private TimeEstimate estimate;
    private final ImmutableList.Builder<String> dependencies = ImmutableList.builder();
    private final ImmutableList.Builder<String> blocks = ImmutableList.builder();

    private Builder(String id) {
      checkNotNull(id, "id");
      checkArgument(!id.isEmpty(), "issue id must not be empty");
      this.id = id;
      this.title = id;
    }

    public Builder title(String title) {
      this.title = checkNotNull(title, "title");
      return this;
    }

    public Builder status(IssueStatus status) {
      this.status = checkNotNull(status, "status");
      return this;
    }

    public Builder estimate(@Nullable TimeEstimate estimate) {
      this.estimate = estimate;
      return this;
    }

    public Builder estimateHours(double hours) {
      return estimate(TimeEstimate.ofHours(hours));
    }

    public Builder dependsOn(String... ids) {
      return dependsOn(Arrays.asList(ids));
    }

    public Builder dependsOn(Iterable<String> ids) {
      dependencies.addAll(ids);
      return this;
    }

    public Builder blocks(String... ids) {
      return blocks(Arrays.asList(ids));
    }

    public Builder blocks(Iterable<String> ids) {
      blocks.addAll(ids);
      return this;
    }

    public Issue build() {
      return new Issue(this);
    }
  }
}
