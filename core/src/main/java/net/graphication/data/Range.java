// This file is part of Graphication.
// Copyright (C) 2026  The Graphication Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.graphication.data;

import com.google.common.base.Objects;

/**
 * An inclusive (min, max) pair of doubles, as returned for key and value
 * ranges.
 */
public final class Range {

  /** The smallest value. */
  private final double min;

  /** The largest value. */
  private final double max;

  /**
   * Default ctor.
   * @param min The minimum.
   * @param max The maximum.
   */
  public Range(final double min, final double max) {
    this.min = min;
    this.max = max;
  }

  /** @return The minimum. */
  public double getMin() {
    return min;
  }

  /** @return The maximum. */
  public double getMax() {
    return max;
  }

  /** @return The distance from min to max. */
  public double getSpan() {
    return max - min;
  }

  /**
   * Widens this range to cover another.
   * @param other A non-null range.
   * @return A range covering both.
   */
  public Range union(final Range other) {
    return new Range(Math.min(min, other.min), Math.max(max, other.max));
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Range)) {
      return false;
    }
    final Range other = (Range) o;
    return Double.compare(min, other.min) == 0 
        && Double.compare(max, other.max) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(min, max);
  }

  @Override
  public String toString() {
    return "[" + min + ", " + max + "]";
  }
}
