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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import net.graphication.exceptions.EmptySeriesException;
import net.graphication.utils.Colors;
import net.graphication.utils.Pair;

/**
 * A single named set of numeric data points with unique keys, a title and
 * an RGBA color.
 * <p>
 * Points are kept in a sorted map so the key, value and item views are
 * always ascending by key. A series is immutable once built.
 * <p>
 * The main operation is {@link #interpolate(double)} which returns the value
 * at any key: exact at observed keys, linear between neighbors and constant
 * beyond either end of the observed range.
 * <p>
 * As a {@link ValueSequence} the series reads positionally over its values
 * in key order so it can be attached to a {@link MultiSeries}.
 */
public class Series implements ValueSequence {

  /** The display title. */
  private final String title;

  /** The color without a leading hash. */
  private final String color;

  /** The data points sorted by key. */
  private final NavigableMap<Double, Double> data;

  /** Ascending keys. */
  private final ImmutableList<Double> keys;

  /** Values in ascending key order. */
  private final ImmutableList<Double> values;

  /**
   * Ctor using the default fully opaque black color.
   * @param title The display title, may be null.
   * @param data The non-null data points. Copied.
   * @throws IllegalArgumentException if the data was null or contained a
   * null or NaN key or a null value.
   */
  public Series(final String title,
                final Map<? extends Number, ? extends Number> data) {
    this(title, data, Colors.BLACK);
  }

  /**
   * Default ctor.
   * @param title The display title, may be null.
   * @param data The non-null data points. Copied.
   * @param color An RGBA hex color with or without a leading hash.
   * @throws IllegalArgumentException if the data was null or contained a
   * null or NaN key or a null value or if the color was null or empty.
   */
  public Series(final String title,
                final Map<? extends Number, ? extends Number> data,
                final String color) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    this.title = title;
    this.color = Colors.normalize(color);
    this.data = new TreeMap<Double, Double>();
    for (final Map.Entry<? extends Number, ? extends Number> entry :
        data.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("Null key in series " + title);
      }
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Null value for key "
            + entry.getKey() + " in series " + title);
      }
      final double key = entry.getKey().doubleValue();
      if (Double.isNaN(key)) {
        throw new IllegalArgumentException("NaN key in series " + title);
      }
      // -0.0 and 0.0 are the same key
      this.data.put(key + 0.0, entry.getValue().doubleValue());
    }
    keys = ImmutableList.copyOf(this.data.keySet());
    values = ImmutableList.copyOf(this.data.values());
  }

  @JsonCreator
  private static Series fromJson(@JsonProperty("title") final String title,
                                 @JsonProperty("data") final Map<Double, Double> data,
                                 @JsonProperty("color") final String color) {
    return new Series(title,
        data == null ? Collections.<Double, Double>emptyMap() : data,
        color == null ? Colors.BLACK : color);
  }

  /** @return The display title, may be null. */
  public String getTitle() {
    return title;
  }

  /** @return The color without a leading hash. */
  public String getColor() {
    return color;
  }

  /** @return An unmodifiable, key sorted view of the data points. */
  public SortedMap<Double, Double> getData() {
    return Collections.unmodifiableSortedMap(data);
  }

  /**
   * @return The color as red, green, blue and alpha in [0, 1].
   * @throws IllegalArgumentException if the stored color isn't valid hex.
   */
  public double[] colorAsRgba() {
    return Colors.hexToRgba(color);
  }

  /** @return The keys in ascending order. */
  public List<Double> keys() {
    return keys;
  }

  /** @return The values in ascending key order. */
  public List<Double> values() {
    return values;
  }

  /** @return The (key, value) pairs in ascending key order. */
  public List<Pair<Double, Double>> items() {
    final ImmutableList.Builder<Pair<Double, Double>> items =
        ImmutableList.builder();
    for (final Map.Entry<Double, Double> entry : data.entrySet()) {
      items.add(Pair.of(entry.getKey(), entry.getValue()));
    }
    return items.build();
  }

  /**
   * @return The smallest and largest keys.
   * @throws EmptySeriesException if the series has no points.
   */
  public Range keyRange() {
    if (data.isEmpty()) {
      throw new EmptySeriesException("No keys in series " + title);
    }
    return new Range(data.firstKey(), data.lastKey());
  }

  /**
   * @return The smallest and largest values.
   * @throws EmptySeriesException if the series has no points.
   */
  public Range valueRange() {
    if (data.isEmpty()) {
      throw new EmptySeriesException("No values in series " + title);
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (final double value : values) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    return new Range(min, max);
  }

  /**
   * Returns the value at the key with linear interpolation between the
   * nearest observed keys and constant extrapolation outside the observed
   * range.
   * @param key The key to read.
   * @return The value at the key.
   * @throws EmptySeriesException if the series has no points.
   * @throws IllegalArgumentException if the key was NaN.
   */
  public double interpolate(final double key) {
    if (data.isEmpty()) {
      throw new EmptySeriesException(
          "No values to interpolate between in series " + title);
    }
    if (Double.isNaN(key)) {
      throw new IllegalArgumentException("Cannot interpolate at NaN.");
    }

    final Double exact = data.get(key + 0.0);
    if (exact != null) {
      return exact;
    }

    final Map.Entry<Double, Double> pre = data.floorEntry(key);
    if (pre == null) {
      // below the first key
      return data.firstEntry().getValue();
    }
    final Map.Entry<Double, Double> post = data.higherEntry(key);
    if (post == null) {
      // above the last key
      return pre.getValue();
    }

    final double fraction = (key - pre.getKey())
        / (post.getKey() - pre.getKey());
    return pre.getValue() + fraction * (post.getValue() - pre.getValue());
  }

  /** @return True if the series has no points. */
  @JsonIgnore
  public boolean isEmpty() {
    return data.isEmpty();
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  public double get(final int index) {
    return values.get(index);
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
        .append(", color=")
        .append(color)
        .append(", data=")
        .append(data)
        .toString();
  }
}
