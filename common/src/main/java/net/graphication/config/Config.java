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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Graphication configuration.
 * <p>
 * Holds the user configurable defaults applied when building chart data:
 * colors for series, nodes and links plus the default link weight. On
 * construction the defaults are populated, then an optional properties file
 * is loaded over them. Values can be replaced at runtime with
 * {@link #overrideConfig(String, String)}.
 * <p>
 * The numeric getters throw {@link NumberFormatException} if the property is
 * missing or unparseable. {@link #getString(String)} returns null for a
 * missing property.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Default color for new series. */
  public static final String SERIES_COLOR_KEY =
      "graphication.series.default_color";

  /** Default color for new nodes. */
  public static final String NODE_COLOR_KEY =
      "graphication.node.default_color";

  /** Default title for new nodes. */
  public static final String NODE_TITLE_KEY =
      "graphication.node.default_title";

  /** Default color for new links. */
  public static final String LINK_COLOR_KEY =
      "graphication.link.default_color";

  /** Default weight for new links. */
  public static final String LINK_WEIGHT_KEY =
      "graphication.link.default_weight";

  /** Holds default values for the config */
  protected static final Map<String, String> DEFAULTS =
      ImmutableMap.<String, String>builder()
        .put(SERIES_COLOR_KEY, "#000000ff")
        .put(NODE_COLOR_KEY, "#036")
        .put(NODE_TITLE_KEY, "Node")
        .put(LINK_COLOR_KEY, "#600")
        .put(LINK_WEIGHT_KEY, "1")
        .build();

  /** Files searched, in order, by {@link #Config(boolean)}. */
  protected static final ImmutableList<String> SEARCH_LOCATIONS =
      ImmutableList.of("graphication.conf",
                       "/etc/graphication/graphication.conf");

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final Map<String, String> properties = Maps.newHashMap();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Creates a config with the defaults only.
   */
  public Config() {
    setDefaults();
  }

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   */
  public Config(final boolean auto_load_config) {
    this(auto_load_config, SEARCH_LOCATIONS);
  }

  /**
   * Constructor that searches the given locations instead of the defaults.
   * @param auto_load_config When set to true, attempts to load the first
   *          readable file in the list
   * @param search_locations The files to try, in order
   */
  protected Config(final boolean auto_load_config,
                   final List<String> search_locations) {
    if (auto_load_config) {
      loadConfig(search_locations);
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Constructor that copies a parent's properties. Changes to the copy do
   * not affect the parent.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation or loading.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if not present.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer
   * @throws NumberFormatException if the property was missing or invalid
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a double
   * @param property The property to load
   * @return A parsed double
   * @throws NumberFormatException if the property was missing or invalid
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a boolean. "1", "true" and "yes" in any
   * case are true, everything else false.
   * @param property The property to load
   * @return A boolean
   * @throws NullPointerException if the property was missing
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * Determines if the given property is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    return val != null && !val.isEmpty();
  }

  /**
   * Returns a simple string with the configured properties for debugging,
   * sorted by key.
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }

    final StringBuilder response = new StringBuilder("Graphication Configuration:\n");
    response.append("File [" + config_location + "]\n");
    for (final Map.Entry<String, String> entry :
        new TreeMap<String, String>(properties).entrySet()) {
      response.append("Key [" + entry.getKey() + "]  Value [")
        .append(entry.getValue() + "]\n");
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads the defaults for any property not already set.
   */
  protected void setDefaults() {
    for (final Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches the locations for a configuration file. The first file that
   * loads wins. Missing files are not an error.
   * @param search_locations The files to try, in order
   */
  protected void loadConfig(final List<String> search_locations) {
    for (final String file : search_locations) {
      try {
        loadConfig(file);
        return;
      } catch (IOException e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find or load {}", file, e);
      }
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   */
  protected void loadConfig(final String file) throws IOException {
    try (final InputStream file_stream = new FileInputStream(file)) {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
    }
    LOG.info("Successfully loaded configuration file: {}", file);
    config_location = file;
  }

  /**
   * Copies the properties into the local map, trimming values.
   * @param props The loaded properties
   */
  private void loadHashMap(final Properties props) {
    for (final String key : props.stringPropertyNames()) {
      properties.put(key, props.getProperty(key).trim());
    }
  }

  /**
   * Trims a value before numeric parsing.
   * @param s The raw value, may be null.
   * @return The trimmed value.
   * @throws NumberFormatException if the value was null.
   */
  private static String sanitize(final String s) {
    if (s == null) {
      throw new NumberFormatException("Property was missing");
    }
    return s.trim();
  }
}
