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
package net.graphication.utils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * An immutable key/value pair where either side may be null. Used for the
 * (key, value), (series, value) and (key, values) tuples handed to the
 * rendering layer. Serializes through Jackson as
 * {@code {"key":..,"value":..}}.
 *
 * @param <K> Object type for the key
 * @param <V> Object type for the value
 */
public final class Pair<K, V> {

  /** The key or left hand value */
  private final K key;

  /** The value or right hand value */
  private final V value;

  /**
   * Ctor that stores references to the objects
   * @param key The key or left hand value to store
   * @param value The value or right hand value to store
   */
  @JsonCreator
  public Pair(@JsonProperty("key") final K key,
              @JsonProperty("value") final V value) {
    this.key = key;
    this.value = value;
  }

  /**
   * Shorthand for the constructor.
   * @param key The key, may be null.
   * @param value The value, may be null.
   * @return A new pair.
   */
  public static <K, V> Pair<K, V> of(final K key, final V value) {
    return new Pair<K, V>(key, value);
  }

  /** @return The stored key/left value, may be null */
  public K getKey() {
    return key;
  }

  /** @return The stored value/right value, may be null */
  public V getValue() {
    return value;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key, value);
  }

  @Override
  public boolean equals(final Object object) {
    if (object == this) {
      return true;
    }
    if (!(object instanceof Pair<?, ?>)) {
      return false;
    }
    final Pair<?, ?> other = (Pair<?, ?>) object;
    return Objects.equal(key, other.key) && Objects.equal(value, other.value);
  }

  /** @return a descriptive string in the format "key=K, value=V" */
  @Override
  public String toString() {
    return new StringBuilder().append("key=")
      .append(key).append(", value=").append(value).toString();
  }
}
