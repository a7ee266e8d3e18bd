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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.graphication.config.Config;
import net.graphication.data.Series;
import net.graphication.data.SeriesSet;
import net.graphication.graph.Node;
import net.graphication.graph.NodeLink;

public class TestChartDataFactory {

  private Config config;

  @Before
  public void before() throws Exception {
    config = new Config();
  }

  @Test
  public void defaults() throws Exception {
    final ChartDataFactory factory = new ChartDataFactory(config);

    final Series series = factory.newSeries("s", ImmutableMap.of(1, 2));
    assertEquals("000000ff", series.getColor());

    final Node node = factory.newNode(3);
    assertEquals("Node", node.getTitle());
    assertEquals("036", node.getColor());
    assertEquals("named", factory.newNode(4, "named").getTitle());

    final NodeLink link = factory.newLink(node, node);
    assertSame(node, link.getStart());
    assertEquals(1, link.getWeight(), 0.0);
    assertEquals("600", link.getColor());
  }

  @Test
  public void overrides() throws Exception {
    config.overrideConfig(Config.SERIES_COLOR_KEY, "#336699");
    config.overrideConfig(Config.NODE_TITLE_KEY, "Box");
    config.overrideConfig(Config.LINK_WEIGHT_KEY, "0.5");
    final ChartDataFactory factory = new ChartDataFactory(config);

    assertEquals("336699",
        factory.newSeries("s", ImmutableMap.of(1, 2)).getColor());
    assertEquals("Box", factory.newNode(1).getTitle());
    assertEquals(0.5, factory.newLink(factory.newNode(1), factory.newNode(2))
        .getWeight(), 0.0);
  }

  @Test
  public void badConfig() throws Exception {
    config.overrideConfig(Config.NODE_COLOR_KEY, "#12");
    try {
      new ChartDataFactory(config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    config = new Config();
    config.overrideConfig(Config.LINK_WEIGHT_KEY, "heavy");
    try {
      new ChartDataFactory(config);
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }

    try {
      new ChartDataFactory(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseSeries() throws Exception {
    config.overrideConfig(Config.SERIES_COLOR_KEY, "#abcdef80");
    final ChartDataFactory factory = new ChartDataFactory(config);

    final Series configured = factory.parseSeries(
        "{\"title\":\"mem\",\"data\":{\"0\":5,\"10\":15}}");
    assertEquals("mem", configured.getTitle());
    assertEquals("abcdef80", configured.getColor());
    assertEquals(10, configured.interpolate(5), 0.0000001);

    final Series explicit = factory.parseSeries(
        "{\"title\":\"cpu\",\"color\":\"#ff0000ff\",\"data\":{\"1\":1}}");
    assertEquals("ff0000ff", explicit.getColor());

    try {
      factory.parseSeries("[1, 2]");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      factory.parseSeries("{\"title\":");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parsedSeriesAggregate() throws Exception {
    final ChartDataFactory factory = new ChartDataFactory(config);
    final SeriesSet set = new SeriesSet(Lists.newArrayList(
        factory.parseSeries("{\"title\":\"a\",\"data\":{\"1\":1,\"3\":3}}"),
        factory.parseSeries("{\"title\":\"b\",\"data\":{\"2\":20}}")));
    assertEquals(Lists.newArrayList(1.0, 2.0, 3.0), set.keys());
    assertEquals(22, set.stack(2).get(0).getValue()
        + set.stack(2).get(1).getValue(), 0.0000001);
  }
}
