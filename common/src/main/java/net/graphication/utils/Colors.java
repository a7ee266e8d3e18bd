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

import com.google.common.base.Strings;

/**
 * Helpers for the hexadecimal color strings carried by series, nodes and
 * links. Colors are written as {@code RGB}, {@code RGBA}, {@code RRGGBB} or
 * {@code RRGGBBAA} with an optional leading {@code #}. A missing alpha
 * channel means fully opaque.
 */
public final class Colors {

  /** Fully opaque black, the default series color. */
  public static final String BLACK = "000000ff";

  private Colors() {
    // Statics only.
  }

  /**
   * Strips the leading hash, if present.
   * @param color A non-null color string.
   * @return The color without the hash.
   * @throws IllegalArgumentException if the color was null or empty.
   */
  public static String normalize(final String color) {
    if (Strings.isNullOrEmpty(color)) {
      throw new IllegalArgumentException("Color cannot be null or empty.");
    }
    return color.startsWith("#") ? color.substring(1) : color;
  }

  /**
   * Parses a hex color into red, green, blue and alpha channels, each scaled
   * to the range [0, 1].
   * @param color The color string, with or without a leading hash.
   * @return A four element array of r, g, b, a.
   * @throws IllegalArgumentException if the string isn't 3, 4, 6 or 8 hex
   * digits.
   */
  public static double[] hexToRgba(final String color) {
    String hex = normalize(color);
    switch (hex.length()) {
    case 3:
    case 4:
      final StringBuilder buf = new StringBuilder(8);
      for (int i = 0; i < hex.length(); i++) {
        buf.append(hex.charAt(i)).append(hex.charAt(i));
      }
      hex = buf.toString();
      break;
    case 6:
    case 8:
      break;
    default:
      throw new IllegalArgumentException("Invalid color length for '"
          + color + "', expected 3, 4, 6 or 8 hex digits.");
    }
    if (hex.length() == 6) {
      hex = hex + "ff";
    }

    final double[] rgba = new double[4];
    for (int i = 0; i < 4; i++) {
      rgba[i] = channel(hex, i * 2, color) / 255.0;
    }
    return rgba;
  }

  /**
   * Parses two hex digits.
   * @param hex The expanded 8 digit string.
   * @param offset Offset of the first digit.
   * @param input The caller's string for error messages.
   * @return The channel value, 0 to 255.
   */
  private static int channel(final String hex,
                             final int offset,
                             final String input) {
    final int hi = Character.digit(hex.charAt(offset), 16);
    final int lo = Character.digit(hex.charAt(offset + 1), 16);
    if (hi < 0 || lo < 0) {
      throw new IllegalArgumentException("Invalid hex digit in color '"
          + input + "'");
    }
    return (hi << 4) | lo;
  }
}
