/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.shapeshift.serializer.converter;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;

import java.util.Date;
import org.testng.annotations.Test;

public class FieldConvertersTest {

  @Test
  public void testWidening() {
    FieldConverter<?> converter = FieldConverters.getConverter(int.class, long.class);
    assertNotNull(converter);
    assertEquals(converter.getTargetType(), long.class);
    assertEquals(converter.convert(7), 7L);
    assertEquals(FieldConverters.getConverter(Integer.class, double.class).convert(3), 3.0d);
    assertEquals(FieldConverters.getConverter(long.class, Float.class).convert(2L), 2.0f);
  }

  @Test
  public void testNarrowing() {
    FieldConverter<?> converter = FieldConverters.getConverter(long.class, int.class);
    assertEquals(converter.convert(42L), 42);
    assertThrows(ArithmeticException.class, () -> converter.convert(Long.MAX_VALUE));
    FieldConverter<?> toByte = FieldConverters.getConverter(int.class, byte.class);
    assertEquals(toByte.convert(12), (byte) 12);
    assertThrows(ArithmeticException.class, () -> toByte.convert(300));
    assertThrows(
        ArithmeticException.class,
        () -> FieldConverters.getConverter(int.class, short.class).convert(Integer.MAX_VALUE));
  }

  @Test
  public void testStrings() {
    assertEquals(FieldConverters.getConverter(String.class, int.class).convert("12"), 12);
    assertEquals(FieldConverters.getConverter(String.class, boolean.class).convert("true"), true);
    assertEquals(FieldConverters.getConverter(long.class, String.class).convert(5L), "5");
    assertEquals(FieldConverters.getConverter(char.class, String.class).convert('c'), "c");
  }

  @Test
  public void testNulls() {
    assertEquals(FieldConverters.getConverter(Integer.class, int.class).convert(null), 0);
    assertNull(FieldConverters.getConverter(int.class, Integer.class).convert(null));
    assertEquals(FieldConverters.getConverter(String.class, boolean.class).convert(null), false);
    assertNull(FieldConverters.getConverter(int.class, String.class).convert(null));
  }

  @Test
  public void testIncompatible() {
    assertNull(FieldConverters.getConverter(boolean.class, int.class));
    assertNull(FieldConverters.getConverter(double.class, long.class));
    assertNull(FieldConverters.getConverter(Date.class, String.class));
    assertNull(FieldConverters.getConverter(int.class, Date.class));
  }
}
