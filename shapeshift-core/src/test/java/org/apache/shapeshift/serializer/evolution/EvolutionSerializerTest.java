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

package org.apache.shapeshift.serializer.evolution;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import org.apache.shapeshift.Shapeshift;
import org.apache.shapeshift.ShapeshiftTestBase;
import org.apache.shapeshift.TestUtils;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.serializer.Serializer;
import org.testng.annotations.Test;

public class EvolutionSerializerTest extends ShapeshiftTestBase {
  private static final String PKG = "demo.evolution";

  private static Class<?> compile(String className, String code) {
    return TestUtils.compileClass(PKG, className, code);
  }

  /** Serialize {@code obj} with one instance and read it back through {@code readerClass}. */
  private static Object evolve(Object obj, Class<?> readerClass) {
    Shapeshift writer = newShapeshift();
    Shapeshift reader = newShapeshift(readerClass.getClassLoader());
    return reader.deserialize(writer.serialize(obj));
  }

  @Test
  public void testRemovedProperty() {
    Class<?> v1 = compile("Item", "public class Item { public int a; public String b; }");
    Class<?> v2 = compile("Item", "public class Item { public int a; }");
    Object result = evolve(TestUtils.newInstance(v1, "a", 7, "b", "gone"), v2);
    assertSame(result.getClass(), v2);
    assertEquals(TestUtils.<Integer>getFieldValue(result, "a"), (Integer) 7);
  }

  @Test
  public void testAddedProperties() {
    Class<?> v1 = compile("Item", "public class Item { public String b; }");
    Class<?> v2 =
        compile(
            "Item",
            "public class Item { public String b; public long c; public Integer d; public String e;"
                + " }");
    Object result = evolve(TestUtils.newInstance(v1, "b", "kept"), v2);
    assertSame(result.getClass(), v2);
    assertEquals(TestUtils.getFieldValue(result, "b"), "kept");
    assertEquals(TestUtils.<Long>getFieldValue(result, "c"), (Long) 0L);
    assertNull(TestUtils.getFieldValue(result, "d"));
    assertNull(TestUtils.getFieldValue(result, "e"));
  }

  @Test
  public void testRetypedProperty() {
    Class<?> v1 = compile("Item", "public class Item { public int a; public int b; }");
    Class<?> v2 = compile("Item", "public class Item { public long a; public String b; }");
    Object result = evolve(TestUtils.newInstance(v1, "a", 5, "b", 6), v2);
    assertEquals(TestUtils.<Long>getFieldValue(result, "a"), (Long) 5L);
    assertEquals(TestUtils.getFieldValue(result, "b"), "6");
  }

  @Test
  public void testIncompatibleRetype() {
    Class<?> v1 = compile("Item", "public class Item { public String a; }");
    Class<?> v2 = compile("Item", "public class Item { public java.util.Date a; }");
    TypeNotSerializableException e =
        expectThrows(
            TypeNotSerializableException.class,
            () -> evolve(TestUtils.newInstance(v1, "a", "x"), v2));
    assertTrue(e.getMessage().contains("Unable to evolve property a"), e.getMessage());
  }

  @Test
  public void testFailedConversionNamesProperty() {
    Class<?> v1 = compile("Item", "public class Item { public long a; public String b; }");
    Class<?> v2 = compile("Item", "public class Item { public int a; public int b; }");
    Object overflow = TestUtils.newInstance(v1, "a", Long.MAX_VALUE, "b", "1");
    DeserializationException e =
        expectThrows(DeserializationException.class, () -> evolve(overflow, v2));
    assertTrue(e.getMessage().contains("property a"), e.getMessage());
    assertTrue(e.getCause() instanceof ArithmeticException, String.valueOf(e.getCause()));
    Object notANumber = TestUtils.newInstance(v1, "a", 1L, "b", "one");
    e = expectThrows(DeserializationException.class, () -> evolve(notANumber, v2));
    assertTrue(e.getMessage().contains("property b"), e.getMessage());
    assertTrue(e.getCause() instanceof NumberFormatException, String.valueOf(e.getCause()));
    Object fits = evolve(TestUtils.newInstance(v1, "a", 3L, "b", "4"), v2);
    assertEquals(TestUtils.<Integer>getFieldValue(fits, "a"), (Integer) 3);
    assertEquals(TestUtils.<Integer>getFieldValue(fits, "b"), (Integer) 4);
  }

  @Test
  public void testNestedEvolution() {
    Class<?> inner1 = compile("Inner", "public class Inner { public int v; public int w; }");
    Class<?> outer1 =
        TestUtils.compileClass(
            inner1.getClassLoader(),
            PKG,
            "Outer",
            "public class Outer { public Inner inner; public String name; }");
    Class<?> inner2 = compile("Inner", "public class Inner { public int v; }");
    Class<?> outer2 =
        TestUtils.compileClass(
            inner2.getClassLoader(),
            PKG,
            "Outer",
            "public class Outer { public Inner inner; public String name; }");
    Object inner1Value = TestUtils.newInstance(inner1, "v", 1, "w", 2);
    Object outer = TestUtils.newInstance(outer1, "inner", inner1Value, "name", "n");
    Object result = evolve(outer, outer2);
    assertSame(result.getClass(), outer2);
    Object inner = TestUtils.getFieldValue(result, "inner");
    assertSame(inner.getClass(), inner2);
    assertEquals(TestUtils.<Integer>getFieldValue(inner, "v"), (Integer) 1);
  }

  @Test
  public void testEnumConstantsReordered() {
    Class<?> v1 = compile("Shade", "public enum Shade { LIGHT, DARK, DIM }");
    Class<?> v2 = compile("Shade", "public enum Shade { DARK, LIGHT, DIM, BRIGHT }");
    Object result = evolve(v1.getEnumConstants()[1], v2);
    assertSame(result, v2.getEnumConstants()[0]);
  }

  @Test
  public void testEnumConstantRemoved() {
    Class<?> v1 = compile("Shade", "public enum Shade { LIGHT, DARK, DIM }");
    Class<?> v2 = compile("Shade", "public enum Shade { LIGHT, DARK }");
    assertSame(evolve(v1.getEnumConstants()[0], v2), v2.getEnumConstants()[0]);
    DeserializationException e =
        expectThrows(DeserializationException.class, () -> evolve(v1.getEnumConstants()[2], v2));
    assertTrue(e.getMessage().contains("DIM"), e.getMessage());
  }

  /** The first version of {@link Shade}, loaded apart from the test classes. */
  private static Class<?> firstShade() {
    return TestUtils.compileClass(
        ClassLoader.getPlatformClassLoader(),
        Shade.class.getPackage().getName(),
        "Shade",
        "public enum Shade { LIGHT, DARK, DIM }");
  }

  @Test
  public void testEnumTransformsOfReader() {
    Class<?> v1 = firstShade();
    Object[] constants = v1.getEnumConstants();
    assertSame(serDe(newShapeshift(), newShapeshift(), constants[0]), Shade.LIGHT);
    assertSame(serDe(newShapeshift(), newShapeshift(), constants[1]), Shade.SHADOW);
    assertSame(serDe(newShapeshift(), newShapeshift(), constants[2]), Shade.DIM);
  }

  @Test
  public void testEnumTransformsOfWriter() {
    Class<?> v1 = firstShade();
    assertSame(evolve(Shade.BRIGHT, v1), v1.getEnumConstants()[0]);
    assertSame(evolve(Shade.SHADOW, v1), v1.getEnumConstants()[1]);
    assertSame(evolve(Shade.DIM, v1), v1.getEnumConstants()[2]);
  }

  @Test
  public void testEvolutionSerializerIsCachedUnderRemoteDescriptor() {
    Class<?> v1 = compile("Item", "public class Item { public int a; public int b; }");
    Class<?> v2 = compile("Item", "public class Item { public int a; }");
    Shapeshift writer = newShapeshift();
    Shapeshift reader = newShapeshift(v2.getClassLoader());
    Object first = TestUtils.newInstance(v1, "a", 1, "b", 2);
    byte[] bytes = writer.serialize(first);
    reader.deserialize(bytes);
    Serializer<Object> serializer =
        reader
            .getSerializerFactory()
            .get(writer.getSerializerFactory().descriptorForType(v1), null);
    assertTrue(serializer instanceof EvolutionSerializer, serializer.toString());
    assertEquals(
        TestUtils.<Integer>getFieldValue(
            reader.deserialize(writer.serialize(TestUtils.newInstance(v1, "a", 3, "b", 4))), "a"),
        (Integer) 3);
  }

  @Test
  public void testCustomProvider() {
    Class<?> v1 = compile("Item", "public class Item { public int a; public int b; }");
    Class<?> v2 = compile("Item", "public class Item { public int a; }");
    Shapeshift reader =
        builder()
            .withClassLoader(v2.getClassLoader())
            .withEvolutionSerializerProvider(
                (factory, remoteType, serializer, schema) -> {
                  throw new TypeNotSerializableException("evolution disabled");
                })
            .build();
    byte[] bytes = newShapeshift().serialize(TestUtils.newInstance(v1, "a", 1, "b", 2));
    assertThrows(TypeNotSerializableException.class, () -> reader.deserialize(bytes));
  }
}
