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

/**
 * The narrow view of a value series that a {@link MultiSeries} needs: a fixed
 * length, zero based positional reads and an optional title.
 */
public interface ValueSequence {

  /** @return The number of values in the sequence. */
  public int size();

  /**
   * @param index A zero based index.
   * @return The value at the index.
   * @throws IndexOutOfBoundsException if the index is out of range.
   */
  public double get(final int index);

  /** @return The display title, may be null. */
  public default String title() {
    return null;
  }
}
