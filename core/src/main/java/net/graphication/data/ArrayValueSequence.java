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

import java.util.Arrays;

/**
 * A {@link ValueSequence} over a copy of a primitive array.
 */
public class ArrayValueSequence implements ValueSequence {

  /** The title, may be null. */
  private final String title;

  /** The values. */
  private final double[] values;

  /**
   * Default ctor.
   * @param title An optional title, may be null.
   * @param values The non-null values, copied.
   * @throws IllegalArgumentException if the values were null.
   */
  public ArrayValueSequence(final String title, final double... values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.title = title;
    this.values = Arrays.copyOf(values, values.length);
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public double get(final int index) {
    return values[index];
  }

  @Override
  public String title() {
    return title;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("title=")
        .append(title)
        .append(", values=")
        .append(Arrays.toString(values))
        .toString();
  }
}
