/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pyunparse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("indentWidth"), is(Prop.INDENT_WIDTH));
    assertThat(Prop.lookup("INDENT_WIDTH"), is(Prop.INDENT_WIDTH));
    assertThat(Prop.lookup("quote"), is(Prop.QUOTE));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("lineWidth"));
    assertThat(e.getMessage(), is("property lineWidth not found"));
    assertThat(Prop.BY_CAMEL_NAME,
        contains(Prop.INDENT_WIDTH, Prop.MAX_DEPTH, Prop.QUOTE));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.INDENT_WIDTH.intValue(map), is(4));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(1_000));
    assertThat(Prop.QUOTE.enumValue(map, Prop.Quote.class),
        is(Prop.Quote.DOUBLE));
    assertThat(Prop.QUOTE.get(map), is(Prop.Quote.DOUBLE));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.INDENT_WIDTH.set(map, 8);
    assertThat(Prop.INDENT_WIDTH.intValue(map), is(8));
    assertThat(Prop.INDENT_WIDTH.remove(map), is(8));
    assertThat(Prop.INDENT_WIDTH.remove(map), nullValue());
    assertThat(Prop.INDENT_WIDTH.intValue(map), is(4));

    Prop.QUOTE.setLenient(map, "single");
    assertThat(Prop.QUOTE.enumValue(map, Prop.Quote.class),
        is(Prop.Quote.SINGLE));
    assertThat(Prop.QUOTE.enumValue(map, Prop.Quote.class).c, is('\''));

    Prop.MAX_DEPTH.setLenient(map, "50");
    assertThat(Prop.MAX_DEPTH.intValue(map), is(50));
  }

  @Test
  void testSetInvalid() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    // Wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_WIDTH.set(map, "4"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.QUOTE.set(map, "single"));
    // Required properties cannot be unset
    assertThrows(IllegalArgumentException.class,
        () -> Prop.QUOTE.set(map, null));
    // Not an integer
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.setLenient(map, "deep"));
    // Asking for the wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.QUOTE.intValue(map));
    assertThat(map.isEmpty(), is(true));
  }
}

// End PropTest.java
