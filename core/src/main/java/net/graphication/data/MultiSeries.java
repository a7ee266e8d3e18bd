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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.primitives.Doubles;

import net.graphication.exceptions.DuplicateKeyException;
import net.graphication.exceptions.KeyNotFoundException;
import net.graphication.exceptions.LengthMismatchException;
import net.graphication.exceptions.NonNumericKeyException;
import net.graphication.utils.Pair;

/**
 * One or more value sequences that share a single, fixed list of keys.
 * <p>
 * The keys are validated once at construction: they must be distinct and
 * numeric. They are then sorted ascending and frozen. Every attached
 * {@link ValueSequence} must have exactly one value per key and is read
 * positionally, so value {@code i} of each child belongs to key {@code i}.
 * <p>
 * Unlike {@link Series}, lookups are exact. There is no interpolation.
 */
public class MultiSeries {
  private static final Logger LOG = LoggerFactory.getLogger(MultiSeries.class);

  /** The sorted, distinct keys. */
  private final double[] keys;

  /** The attached children in attachment order. */
  private final List<ValueSequence> series;

  /**
   * Ctor from primitive keys.
   * @param keys The keys, need not be sorted.
   * @throws DuplicateKeyException if a key is repeated.
   * @throws NonNumericKeyException if a key is NaN.
   */
  public MultiSeries(final double... keys) {
    this(Doubles.asList(keys == null ? new double[0] : keys));
  }

  /**
   * Default ctor. Keys may be {@link Number}s or strings that parse as
   * doubles.
   * @param keys The non-null keys, need not be sorted.
   * @throws IllegalArgumentException if the list was null.
   * @throws DuplicateKeyException if a key is repeated, before or after
   * conversion to a double.
   * @throws NonNumericKeyException if a key is null, NaN or can't be
   * converted.
   */
  public MultiSeries(final List<?> keys) {
    if (keys == null) {
      throw new IllegalArgumentException("Keys cannot be null.");
    }

    final Set<Object> seen = Sets.newHashSetWithExpectedSize(keys.size());
    for (final Object key : keys) {
      // numbers compare by value so 1, 1L and 1.0 are the same key
      final Object distinct = key instanceof Number
          ? (Object) (((Number) key).doubleValue() + 0.0) : key;
      if (!seen.add(distinct)) {
        throw new DuplicateKeyException("Key [" + key
            + "] appears more than once. Keys must be distinct.");
      }
    }

    this.keys = new double[keys.size()];
    for (int i = 0; i < this.keys.length; i++) {
      this.keys[i] = toDouble(keys.get(i));
    }
    Arrays.sort(this.keys);
    for (int i = 1; i < this.keys.length; i++) {
      if (this.keys[i] == this.keys[i - 1]) {
        throw new DuplicateKeyException("Key [" + this.keys[i]
            + "] appears more than once. Keys must be distinct.");
      }
    }

    series = Lists.newArrayList();
    LOG.debug("Created multi series with {} keys", this.keys.length);
  }

  /**
   * Attaches a child sequence.
   * @param values A non-null sequence with one value per key.
   * @throws IllegalArgumentException if the sequence was null.
   * @throws LengthMismatchException if the length differs from the number
   * of keys.
   */
  public void addSeries(final ValueSequence values) {
    if (values == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    if (values.size() != keys.length) {
      throw new LengthMismatchException("Series has " + values.size()
          + " values but there are " + keys.length + " keys.");
    }
    series.add(values);
  }

  /**
   * Attaches an untitled child built from the values.
   * @param values One value per key.
   * @throws IllegalArgumentException if the values were null.
   * @throws LengthMismatchException if the length differs from the number
   * of keys.
   */
  public void addSeries(final double... values) {
    addSeries(new ArrayValueSequence(null, values));
  }

  /** @return The frozen keys, ascending. */
  public List<Double> keys() {
    return ImmutableList.copyOf(Doubles.asList(keys));
  }

  /** @return The number of attached children. */
  public int size() {
    return series.size();
  }

  /**
   * A fresh, lazy view of (key, values) for each key in ascending order
   * where the values hold one entry per attached child. Children are read
   * as the iterator advances.
   * @return A re-iterable sequence of (key, values) pairs.
   */
  public Iterable<Pair<Double, List<Double>>> items() {
    return new Iterable<Pair<Double, List<Double>>>() {
      @Override
      public Iterator<Pair<Double, List<Double>>> iterator() {
        return new Iterator<Pair<Double, List<Double>>>() {
          private int index;

          @Override
          public boolean hasNext() {
            return index < keys.length;
          }

          @Override
          public Pair<Double, List<Double>> next() {
            if (!hasNext()) {
              throw new NoSuchElementException("No more keys in "
                  + MultiSeries.this);
            }
            final Pair<Double, List<Double>> item =
                Pair.<Double, List<Double>>of(keys[index], valuesAt(index));
            index++;
            return item;
          }
        };
      }
    };
  }

  /**
   * Exact lookup of the values at a key.
   * @param key The key to find.
   * @return One value per attached child in attachment order.
   * @throws KeyNotFoundException if the key isn't one of the frozen keys.
   */
  public List<Double> get(final double key) {
    final int index = Arrays.binarySearch(keys, key + 0.0);
    if (index < 0) {
      throw new KeyNotFoundException("No such key: " + key);
    }
    return valuesAt(index);
  }

  /**
   * @param index The zero based attachment index.
   * @return The attached child.
   * @throws IndexOutOfBoundsException if the index is out of range.
   */
  public ValueSequence getSeries(final int index) {
    return series.get(index);
  }

  /** @return The sum across all children for each key, ascending. */
  public List<Double> totals() {
    final List<Double> totals = Lists.newArrayListWithCapacity(keys.length);
    for (int i = 0; i < keys.length; i++) {
      double sum = 0;
      for (final ValueSequence child : series) {
        sum += child.get(i);
      }
      totals.add(sum);
    }
    return totals;
  }

  /** @return A lazy view of each child's title in attachment order. */
  public Iterable<String> titles() {
    return Iterables.transform(series, ValueSequence::title);
  }

  /**
   * @param index A key position.
   * @return The value of each child at the position.
   */
  private List<Double> valuesAt(final int index) {
    final List<Double> values = Lists.newArrayListWithCapacity(series.size());
    for (final ValueSequence child : series) {
      values.add(child.get(index));
    }
    return values;
  }

  /**
   * Converts a raw key.
   * @param key The raw key.
   * @return The key as a double, with -0.0 folded into 0.0.
   * @throws NonNumericKeyException if the key can't be converted or is NaN.
   */
  private static double toDouble(final Object key) {
    final double value;
    if (key instanceof Number) {
      value = ((Number) key).doubleValue();
    } else if (key instanceof String) {
      try {
        value = Double.parseDouble(((String) key).trim());
      } catch (NumberFormatException e) {
        throw new NonNumericKeyException("All keys must be numeric, got ["
            + key + "]", e);
      }
    } else {
      throw new NonNumericKeyException("All keys must be numeric, got ["
          + key + "]");
    }
    if (Double.isNaN(value)) {
      throw new NonNumericKeyException("Keys cannot be NaN");
    }
    return value + 0.0;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("keys=")
        .append(Arrays.toString(keys))
        .append(", series=")
        .append(series.size())
        .toString();
  }
}
