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
package net.graphication.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableList;

public class TestConfig {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void defaults() throws Exception {
    final Config config = new Config();
    assertNull(config.configLocation());
    assertEquals("#000000ff", config.getString(Config.SERIES_COLOR_KEY));
    assertEquals("#036", config.getString(Config.NODE_COLOR_KEY));
    assertEquals("Node", config.getString(Config.NODE_TITLE_KEY));
    assertEquals("#600", config.getString(Config.LINK_COLOR_KEY));
    assertEquals(1, config.getInt(Config.LINK_WEIGHT_KEY));
    assertEquals(1.0, config.getDouble(Config.LINK_WEIGHT_KEY), 0.0);
  }

  @Test
  public void loadFile() throws Exception {
    final File file = folder.newFile("graphication.conf");
    Files.write(file.toPath(), ("graphication.series.default_color = #ff0000ff\n"
        + "graphication.link.default_weight=2.5 \n"
        + "custom.flag=yes\n").getBytes(StandardCharsets.UTF_8));

    final Config config = new Config(file.getAbsolutePath());
    assertEquals(file.getAbsolutePath(), config.configLocation());
    assertEquals("#ff0000ff", config.getString(Config.SERIES_COLOR_KEY));
    assertEquals(2.5, config.getDouble(Config.LINK_WEIGHT_KEY), 0.0);
    assertTrue(config.getBoolean("custom.flag"));
    // untouched defaults are still filled in
    assertEquals("#036", config.getString(Config.NODE_COLOR_KEY));
  }

  @Test
  public void loadMissingFile() throws Exception {
    try {
      new Config(new File(folder.getRoot(), "nope.conf").getAbsolutePath());
      fail("Expected FileNotFoundException");
    } catch (FileNotFoundException e) { }
  }

  @Test
  public void searchLoadsFirstReadableFile() throws Exception {
    final File first = folder.newFile("first.conf");
    Files.write(first.toPath(), "graphication.node.default_title=First\n"
        .getBytes(StandardCharsets.UTF_8));
    final File second = folder.newFile("second.conf");
    Files.write(second.toPath(), "graphication.node.default_title=Second\n"
        .getBytes(StandardCharsets.UTF_8));
    final String missing =
        new File(folder.getRoot(), "missing.conf").getAbsolutePath();

    final Config config = new Config(true, ImmutableList.of(missing,
        first.getAbsolutePath(), second.getAbsolutePath()));
    assertEquals(first.getAbsolutePath(), config.configLocation());
    assertEquals("First", config.getString(Config.NODE_TITLE_KEY));
    assertEquals("#036", config.getString(Config.NODE_COLOR_KEY));
  }

  @Test
  public void searchFallsBackToDefaults() throws Exception {
    final Config config = new Config(true, ImmutableList.of(
        new File(folder.getRoot(), "a.conf").getAbsolutePath(),
        new File(folder.getRoot(), "b.conf").getAbsolutePath()));
    assertNull(config.configLocation());
    assertEquals("Node", config.getString(Config.NODE_TITLE_KEY));
    assertEquals(5, config.getMap().size());
  }

  @Test
  public void searchDisabled() throws Exception {
    final File file = folder.newFile("ignored.conf");
    Files.write(file.toPath(), "graphication.node.default_title=Nope\n"
        .getBytes(StandardCharsets.UTF_8));
    final Config config =
        new Config(false, ImmutableList.of(file.getAbsolutePath()));
    assertNull(config.configLocation());
    assertEquals("Node", config.getString(Config.NODE_TITLE_KEY));
  }

  @Test
  public void copyIsIndependent() throws Exception {
    final Config parent = new Config();
    final Config child = new Config(parent);
    child.overrideConfig(Config.NODE_TITLE_KEY, "Box");
    assertEquals("Box", child.getString(Config.NODE_TITLE_KEY));
    assertEquals("Node", parent.getString(Config.NODE_TITLE_KEY));
  }

  @Test
  public void typedGetters() throws Exception {
    final Config config = new Config();
    config.overrideConfig("a.bool", "TRUE");
    config.overrideConfig("b.bool", "0");
    config.overrideConfig("an.int", " 42 ");
    config.overrideConfig("not.a.number", "forty");
    config.overrideConfig("empty", "");

    assertTrue(config.getBoolean("a.bool"));
    assertFalse(config.getBoolean("b.bool"));
    assertEquals(42, config.getInt("an.int"));
    assertTrue(config.hasProperty("an.int"));
    assertFalse(config.hasProperty("empty"));
    assertFalse(config.hasProperty("missing"));

    try {
      config.getInt("not.a.number");
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }

    try {
      config.getDouble("missing");
      fail("Expected NumberFormatException");
    } catch (NumberFormatException e) { }
  }

  @Test
  public void dumpConfiguration() throws Exception {
    final Config config = new Config();
    final String dump = config.dumpConfiguration();
    assertTrue(dump.startsWith("Graphication Configuration:"));
    assertTrue(dump.contains("Key [graphication.node.default_title]  Value [Node]"));
    assertEquals(5, config.getMap().size());
  }
}
