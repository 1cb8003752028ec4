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
import java.util.Objects;

/**
 * An effort estimate attached to an issue, expressed in hours, working days or working weeks.
 *
 * <p>A working day is 8 hours and a working week is 40 hours.
 */
public final class TimeEstimate {

  /** The unit an estimate was entered in. */
  public enum Unit {
    HOURS(1),
    DAYS(8),
    WEEKS(40);

    private final int hoursPerUnit;

    Unit(int hoursPerUnit) {
      this.hoursPerUnit = hoursPerUnit;
    }

    int hoursPerUnit() {
      return hoursPerUnit;
    }
  }

  private final double amount;
  private final Unit unit;

  private TimeEstimate(double amount, Unit unit) {
    checkArgument(Double.isFinite(amount), "amount must be finite: %s", amount);
    this.amount = amount;
    this.unit = checkNotNull(unit, "unit");
  }

  public static TimeEstimate of(double amount, Unit unit) {
    return new TimeEstimate(amount, unit);
  }

  public static TimeEstimate ofHours(double hours) {
    return new TimeEstimate(hours, Unit.HOURS);
  }

  public static TimeEstimate ofDays(double days) {
    return new TimeEstimate(days, Unit.DAYS);
  }

  public static TimeEstimate ofWeeks(double weeks) {
    return new TimeEstimate(weeks, Unit.WEEKS);
  }

  public double amount() {
    return amount;
  }

  public Unit unit() {
    return unit;
  }

  /** Returns this estimate converted to working hours. */
  public double hours() {
    return amount * unit.hoursPerUnit();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeEstimate)) {
      return false;
    }
    TimeEstimate that = (TimeEstimate) o;
    return Double.compare(amount, that.amount) == 0 && unit == that.unit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(amount, unit);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("amount", amount).add("unit", unit).toString();
  }
}
