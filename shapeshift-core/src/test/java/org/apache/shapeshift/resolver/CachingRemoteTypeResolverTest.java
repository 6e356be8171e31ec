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

package org.apache.shapeshift.resolver;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import java.lang.reflect.Array;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import org.apache.shapeshift.Shapeshift;
import org.apache.shapeshift.ShapeshiftTestBase;
import org.apache.shapeshift.TestUtils;
import org.apache.shapeshift.meta.TypeNotation;
import org.testng.annotations.Test;

public class CachingRemoteTypeResolverTest extends ShapeshiftTestBase {
  private static final String PKG = "demo.carpentry";

  @Test
  public void testCarpentUnknownComposite() {
    Class<?> cls =
        TestUtils.compileClass(
            PKG, "Point", "public class Point { public int x; public String y; }");
    byte[] bytes = newShapeshift().serialize(TestUtils.newInstance(cls, "x", 1, "y", "one"));
    // Only the parent of the loader that compiled Point is visible to the reader.
    Shapeshift reader = Shapeshift.builder().withClassLoader(getClass().getClassLoader()).build();
    Object result = reader.deserialize(bytes);
    assertNotEquals(result.getClass(), cls);
    assertEquals(result.getClass().getName(), PKG + ".Point");
    assertTrue(reader.getSerializerFactory().getClassCarpenter().isCarpented(result.getClass()));
    assertEquals(TestUtils.<Integer>getProperty(result, "x"), (Integer) 1);
    assertEquals(TestUtils.getProperty(result, "y"), "one");
    assertTrue(result.toString().contains("y=one"), result.toString());
    // The carpented class is reused for later envelopes.
    Object second = reader.deserialize(bytes);
    assertSame(second.getClass(), result.getClass());
  }

  @Test
  public void testCarpentDependentTypes() {
    Class<?> shade = TestUtils.compileClass(PKG, "Shade", "public enum Shade { LIGHT, DARK }");
    Class<?> colour =
        TestUtils.compileClass(
            shade.getClassLoader(),
            PKG,
            "Colour",
            "public class Colour { public String name; public Shade shade; }");
    Class<?> palette =
        TestUtils.compileClass(
            colour.getClassLoader(),
            PKG,
            "Palette",
            "public class Palette { public Colour main; public Colour[] others; public Palette"
                + " parent; }");
    Object[] shades = shade.getEnumConstants();
    Object main = TestUtils.newInstance(colour, "name", "red", "shade", shades[1]);
    Object others = Array.newInstance(colour, 1);
    Array.set(others, 0, TestUtils.newInstance(colour, "name", "blue", "shade", shades[0]));
    Object root = TestUtils.newInstance(palette, "main", main, "others", others);
    Object obj = TestUtils.newInstance(palette, "main", main, "others", others, "parent", root);
    byte[] bytes = newShapeshift().serialize(obj);

    Object result = newShapeshift(getClass().getClassLoader()).deserialize(bytes);
    assertEquals(result.getClass().getName(), PKG + ".Palette");
    Object resultMain = TestUtils.getProperty(result, "main");
    assertEquals(TestUtils.getProperty(resultMain, "name"), "red");
    Enum<?> resultShade = TestUtils.getProperty(resultMain, "shade");
    assertEquals(resultShade.name(), "DARK");
    assertTrue(resultShade.getClass().isEnum());
    Object[] resultOthers = TestUtils.getProperty(result, "others");
    assertEquals(resultOthers.length, 1);
    assertEquals(TestUtils.getProperty(resultOthers[0], "name"), "blue");
    Object parent = TestUtils.getProperty(result, "parent");
    assertSame(parent.getClass(), result.getClass());
    assertNull(TestUtils.getProperty(parent, "parent"));
  }

  @Test
  public void testCarpentInterfaces() {
    Class<?> named =
        TestUtils.compileClass(PKG, "Named", "public interface Named { String getName(); }");
    Class<?> pet =
        TestUtils.compileClass(
            named.getClassLoader(),
            PKG,
            "Pet",
            "public class Pet implements Named { public String name; public int legs;"
                + " public String getName() { return name; } }");
    byte[] bytes = newShapeshift().serialize(TestUtils.newInstance(pet, "name", "Tom", "legs", 4));

    Shapeshift reader = newShapeshift(getClass().getClassLoader());
    List<TypeNotation> types =
        reader.deserializeWithEnvelope(bytes, Object.class).getEnvelope().getSchema().getTypes();
    assertEquals(types.size(), 2);
    Object result = reader.deserialize(bytes);
    List<Class<?>> interfaces = Arrays.asList(result.getClass().getInterfaces());
    assertEquals(interfaces.size(), 1);
    assertEquals(interfaces.get(0).getName(), PKG + ".Named");
    assertTrue(interfaces.get(0).isInterface());
    assertEquals(TestUtils.getProperty(result, "name"), "Tom");
  }

  @Test
  public void testTypeForNameUsesLocalTypes() throws ClassNotFoundException {
    Shapeshift shapeshift = newShapeshift();
    RemoteTypeResolver resolver = shapeshift.getSerializerFactory().getRemoteTypeResolver();
    Type type = resolver.typeForName("java.util.List<string>");
    assertEquals(type.getTypeName(), "java.util.List<java.lang.String>");
  }
}
