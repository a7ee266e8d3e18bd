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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestPair {

  @Test
  public void ctors() throws Exception {
    Pair<String, Double> pair = new Pair<String, Double>("a", 1.5);
    assertEquals("a", pair.getKey());
    assertEquals(1.5, pair.getValue(), 0.0);

    pair = Pair.of(null, null);
    assertNull(pair.getKey());
    assertNull(pair.getValue());
  }

  @Test
  public void equalsAndHash() throws Exception {
    final Pair<Double, Double> a = Pair.of(1.0, 10.0);
    final Pair<Double, Double> b = Pair.of(1.0, 10.0);
    assertTrue(a.equals(b));
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, Pair.of(1.0, 11.0));
    assertNotEquals(a, Pair.of(2.0, 10.0));
    assertTrue(Pair.of(null, null).equals(Pair.of(null, null)));
    assertFalse(a.equals("key=1.0, value=10.0"));
  }

  @Test
  public void serdes() throws Exception {
    final String json = JSON.serializeToString(Pair.of("k", 42));
    assertTrue(json.contains("\"key\":\"k\""));
    assertTrue(json.contains("\"value\":42"));

    final Pair<?, ?> parsed = JSON.parseToObject(json, Pair.class);
    assertEquals("k", parsed.getKey());
    assertEquals(42, parsed.getValue());
  }

  @Test
  public void string() throws Exception {
    assertEquals("key=1.0, value=2.0", Pair.of(1.0, 2.0).toString());
  }
}
