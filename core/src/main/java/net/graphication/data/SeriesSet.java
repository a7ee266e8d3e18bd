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

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;

import net.graphication.exceptions.EmptySeriesException;
import net.graphication.utils.Pair;

/**
 * An ordered collection of zero or more {@link Series} that may have
 * different key sets. Aggregates such as stacks and totals are computed over
 * the union of every member's keys, reading each member through
 * {@link Series#interpolate(double)}.
 * <p>
 * Insertion order is preserved and drives the order of stacks and of the
 * series lists returned by {@link #keysWithSeries()}. Members are never
 * removed. Mutation isn't synchronized.
 */
public class SeriesSet implements Iterable<Series> {
  private static final Logger LOG = LoggerFactory.getLogger(SeriesSet.class);

  /** The members in insertion order. */
  private final List<Series> series;

  /**
   * Creates an empty set.
   */
  public SeriesSet() {
    series = Lists.newArrayList();
  }

  /**
   * Creates a set seeded with the given series. The collection is copied.
   * @param series A non-null collection of non-null series.
   * @throws IllegalArgumentException if the collection or a member was null.
   */
  public SeriesSet(final Collection<Series> series) {
    if (series == null) {
      throw new IllegalArgumentException("Series collection cannot be null.");
    }
    this.series = Lists.newArrayListWithCapacity(series.size());
    for (final Series member : series) {
      addSeries(member);
    }
  }

  /**
   * Appends a series. No compatibility checks are made against existing
   * members.
   * @param series A non-null series.
   * @throws IllegalArgumentException if the series was null.
   */
  public void addSeries(final Series series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    this.series.add(series);
    LOG.debug("Added series [{}] with {} points, set now has {}",
        series.getTitle(), series.size(), this.series.size());
  }

  /** @return The number of member series. */
  public int size() {
    return series.size();
  }

  /**
   * @param index A zero based index.
   * @return The member at the index.
   * @throws IndexOutOfBoundsException if the index is out of range.
   */
  public Series get(final int index) {
    return series.get(index);
  }

  @Override
  public Iterator<Series> iterator() {
    return Iterators.unmodifiableIterator(series.iterator());
  }

  /**
   * @return The smallest and largest keys across all members.
   * @throws EmptySeriesException if the set or any member is empty.
   */
  public Range keyRange() {
    if (series.isEmpty()) {
      throw new EmptySeriesException("No series in the set.");
    }
    Range range = null;
    for (final Series member : series) {
      range = range == null ? member.keyRange()
          : range.union(member.keyRange());
    }
    return range;
  }

  /**
   * @return The smallest and largest values across all members.
   * @throws EmptySeriesException if the set or any member is empty.
   */
  public Range valueRange() {
    if (series.isEmpty()) {
      throw new EmptySeriesException("No series in the set.");
    }
    Range range = null;
    for (final Series member : series) {
      range = range == null ? member.valueRange()
          : range.union(member.valueRange());
    }
    return range;
  }

  /**
   * @return Every key of every member, ascending and without duplicates.
   * Interpolated coverage doesn't count, only observed keys.
   */
  public List<Double> keys() {
    final TreeSet<Double> keys = new TreeSet<Double>();
    for (final Series member : series) {
      keys.addAll(member.keys());
    }
    return ImmutableList.copyOf(keys);
  }

  /**
   * @return Every key of every member, ascending, each paired with the
   * members that have an observed point at that key in insertion order.
   */
  public List<Pair<Double, List<Series>>> keysWithSeries() {
    final ListMultimap<Double, Series> keys =
        MultimapBuilder.treeKeys().arrayListValues().build();
    for (final Series member : series) {
      for (final Double key : member.keys()) {
        keys.put(key, member);
      }
    }

    final ImmutableList.Builder<Pair<Double, List<Series>>> result =
        ImmutableList.builder();
    for (final Map.Entry<Double, Collection<Series>> entry :
        keys.asMap().entrySet()) {
      result.add(Pair.<Double, List<Series>>of(
          entry.getKey(), ImmutableList.copyOf(entry.getValue())));
    }
    return result.build();
  }

  /**
   * Reads every member at the key.
   * @param key The key to read.
   * @return A (series, interpolated value) pair per member in insertion
   * order.
   * @throws EmptySeriesException if a member has no points.
   */
  public List<Pair<Series, Double>> stack(final double key) {
    final ImmutableList.Builder<Pair<Series, Double>> stack =
        ImmutableList.builder();
    for (final Series member : series) {
      stack.add(Pair.of(member, member.interpolate(key)));
    }
    return stack.build();
  }

  /**
   * @return A (key, stack) pair for every key in the union keyspace,
   * ascending.
   * @throws EmptySeriesException if a member has no points.
   */
  public List<Pair<Double, List<Pair<Series, Double>>>> stacks() {
    final ImmutableList.Builder<Pair<Double, List<Pair<Series, Double>>>> stacks =
        ImmutableList.builder();
    for (final Double key : keys()) {
      stacks.add(Pair.of(key, stack(key)));
    }
    return stacks.build();
  }

  /**
   * Sums of every member's interpolated value for each key in the union
   * keyspace, ascending. Nothing is cached: each call to
   * {@link Iterable#iterator()} takes a fresh view of the members and their
   * keys, and totals are computed as the iterator advances.
   * @return A lazy, re-iterable sequence of (key, total) pairs.
   */
  public Iterable<Pair<Double, Double>> totals() {
    return new Iterable<Pair<Double, Double>>() {
      @Override
      public Iterator<Pair<Double, Double>> iterator() {
        final List<Series> members = ImmutableList.copyOf(series);
        return Iterators.transform(keys().iterator(),
            key -> Pair.of(key, total(members, key)));
      }
    };
  }

  /**
   * Sums the interpolated values.
   * @param members The members to read.
   * @param key The key.
   * @return The sum.
   */
  private static double total(final List<Series> members, final double key) {
    double sum = 0;
    for (final Series member : members) {
      sum += member.interpolate(key);
    }
    return sum;
  }

  @Override
  public String toString() {
    return "SeriesSet" + series;
  }
}
