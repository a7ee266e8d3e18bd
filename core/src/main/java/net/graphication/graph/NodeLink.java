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
 * A weighted link between two {@link Node}s. Some diagrams treat the link as
 * directed from start to end.
 */
public class NodeLink {

  /** Weight used when none is given. */
  public static final double DEFAULT_WEIGHT = 1;

  /** Color used when none is given. */
  public static final String DEFAULT_COLOR = "600";

  private final Node start;
  private final Node end;
  private final double weight;
  private final String color;

  /**
   * Ctor with the default weight and color.
   * @param start The non-null start node.
   * @param end The non-null end node.
   * @throws IllegalArgumentException if a node was null.
   */
  public NodeLink(final Node start, final Node end) {
    this(start, end, DEFAULT_WEIGHT, DEFAULT_COLOR);
  }

  /**
   * Default ctor.
   * @param start The non-null start node.
   * @param end The non-null end node.
   * @param weight The link weight.
   * @param color A hex color with or without a leading hash.
   * @throws IllegalArgumentException if a node was null or the color was
   * null or empty.
   */
  public NodeLink(final Node start,
                  final Node end,
                  final double weight,
                  final String color) {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Link nodes cannot be null.");
    }
    this.start = start;
    this.end = end;
    this.weight = weight;
    this.color = Colors.normalize(color);
  }

  /** @return The start node. */
  public Node getStart() {
    return start;
  }

  /** @return The end node. */
  public Node getEnd() {
    return end;
  }

  /** @return The weight. */
  public double getWeight() {
    return weight;
  }

  /** @return The color without a leading hash. */
  public String getColor() {
    return color;
  }

  @Override
  public String toString() {
    return "NodeLink{" + start.getTitle() + " -> " + end.getTitle()
        + ", weight=" + weight + "}";
  }
}
