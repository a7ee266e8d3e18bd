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
package net.graphication.core;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import net.graphication.config.Config;
import net.graphication.data.Series;
import net.graphication.graph.Node;
import net.graphication.graph.NodeLink;
import net.graphication.utils.Colors;
import net.graphication.utils.JSON;

/**
 * Builds series, nodes and links with the defaults from a {@link Config}.
 * Colors are validated once, here, so a bad configured color fails fast.
 */
public class ChartDataFactory {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChartDataFactory.class);

  private final String series_color;
  private final String node_color;
  private final String node_title;
  private final String link_color;
  private final double link_weight;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @throws IllegalArgumentException if the config was null or a configured
   * color is invalid.
   * @throws NumberFormatException if the link weight isn't a number.
   */
  public ChartDataFactory(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    series_color = validColor(config, Config.SERIES_COLOR_KEY);
    node_color = validColor(config, Config.NODE_COLOR_KEY);
    node_title = config.getString(Config.NODE_TITLE_KEY);
    link_color = validColor(config, Config.LINK_COLOR_KEY);
    link_weight = config.getDouble(Config.LINK_WEIGHT_KEY);
    LOG.debug("Chart data defaults: series color {}, node color {}, "
        + "link color {}, link weight {}",
        series_color, node_color, link_color, link_weight);
  }

  /**
   * @param title The title.
   * @param data The data points.
   * @return A series with the configured color.
   */
  public Series newSeries(final String title,
                          final Map<? extends Number, ? extends Number> data) {
    return new Series(title, data, series_color);
  }

  /**
   * Parses a series from JSON. A missing color takes the configured
   * default.
   * @param json A JSON object with title, data and optional color.
   * @return The series.
   * @throws IllegalArgumentException if the JSON was null, empty or invalid.
   */
  public Series parseSeries(final String json) {
    final JsonNode root = JSON.parseToObject(json, JsonNode.class);
    if (!root.isObject()) {
      throw new IllegalArgumentException("Series JSON must be an object.");
    }
    if (!root.hasNonNull("color")) {
      ((ObjectNode) root).put("color", series_color);
    }
    return JSON.getMapper().convertValue(root, Series.class);
  }

  /**
   * @param value The node value.
   * @return A node with the configured title and color.
   */
  public Node newNode(final double value) {
    return new Node(value, node_title, node_color);
  }

  /**
   * @param value The node value.
   * @param title The title.
   * @return A node with the configured color.
   */
  public Node newNode(final double value, final String title) {
    return new Node(value, title, node_color);
  }

  /**
   * @param start The start node.
   * @param end The end node.
   * @return A link with the configured weight and color.
   */
  public NodeLink newLink(final Node start, final Node end) {
    return new NodeLink(start, end, link_weight, link_color);
  }

  private static String validColor(final Config config, final String key) {
    final String color = config.getString(key);
    try {
      Colors.hexToRgba(color);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid color for " + key, e);
    }
    return Colors.normalize(color);
  }
}
