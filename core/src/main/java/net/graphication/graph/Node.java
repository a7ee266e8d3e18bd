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
package net.graphication.graph;

import net.graphication.utils.Colors;

/**
 * A node in a structure diagram with a single value, a title and a color.
 */
public class Node {

  /** Title used when none is given. */
  public static final String DEFAULT_TITLE = "Node";

  /** Color used when none is given. */
  public static final String DEFAULT_COLOR = "036";

  /** The node's value. */
  private final double value;

  /** The display title. */
  private final String title;

  /** The color without a leading hash. */
  private final String color;

  /**
   * Ctor with the default title and color.
   * @param value The value.
   */
  public Node(final double value) {
    this(value, DEFAULT_TITLE, DEFAULT_COLOR);
  }

  /**
   * Default ctor.
   * @param value The value.
   * @param title The display title, may be null.
   * @param color A hex color with or without a leading hash.
   * @throws IllegalArgumentException if the color was null or empty.
   */
  public Node(final double value, final String title, final String color) {
    this.value = value;
    this.title = title;
    this.color = Colors.normalize(color);
  }

  /** @return The value. */
  public double getValue() {
    return value;
  }

  /** @return The display title. */
  public String getTitle() {
    return title;
  }

  /** @return The color without a leading hash. */
  public String getColor() {
    return color;
  }

  /** @return The color as red, green, blue and alpha in [0, 1]. */
  public double[] colorAsRgba() {
    return Colors.hexToRgba(color);
  }

  @Override
  public String toString() {
    return "Node{title=" + title + ", value=" + value + ", color=" + color + "}";
  }
}
