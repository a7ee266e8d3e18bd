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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestColors {
  private static final double EPSILON = 0.0001;

  @Test
  public void normalize() throws Exception {
    assertEquals("000000ff", Colors.normalize("#000000ff"));
    assertEquals("000000ff", Colors.normalize("000000ff"));
    assertEquals("036", Colors.normalize("#036"));

    try {
      Colors.normalize(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Colors.normalize("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void hexToRgbaEightDigits() throws Exception {
    assertArrayEquals(new double[] { 1, 0, 0, 128 / 255.0 },
        Colors.hexToRgba("ff000080"), EPSILON);
    assertArrayEquals(new double[] { 0, 0, 0, 1 },
        Colors.hexToRgba(Colors.BLACK), EPSILON);
    assertArrayEquals(new double[] { 0, 1, 0, 1 },
        Colors.hexToRgba("#00FF00FF"), EPSILON);
  }

  @Test
  public void hexToRgbaShortForms() throws Exception {
    // 6 digits, opaque
    assertArrayEquals(new double[] { 0x12 / 255.0, 0x34 / 255.0, 0x56 / 255.0, 1 },
        Colors.hexToRgba("123456"), EPSILON);
    // 3 digits double up
    assertArrayEquals(new double[] { 0, 0x33 / 255.0, 0x66 / 255.0, 1 },
        Colors.hexToRgba("#036"), EPSILON);
    // 4 digits with alpha
    assertArrayEquals(new double[] { 0x66 / 255.0, 0, 0, 0 },
        Colors.hexToRgba("6000"), EPSILON);
  }

  @Test
  public void hexToRgbaInvalid() throws Exception {
    try {
      Colors.hexToRgba("12345");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Colors.hexToRgba("zz0000ff");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Colors.hexToRgba("#");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
