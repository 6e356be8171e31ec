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

package org.apache.shapeshift.type;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.google.common.reflect.TypeToken;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class TypeIdentifierTest {
  private final ClassLoader classLoader = getClass().getClassLoader();

  @DataProvider
  public static Object[][] names() {
    return new Object[][] {
      {int[].class, "int[p]"},
      {long[].class, "long[p]"},
      {byte[].class, "binary"},
      {Integer[].class, "int[]"},
      {int.class, "int"},
      {String.class, "string"},
      {String[].class, "string[]"},
      {String[][].class, "string[][]"},
      {TypeIdentifierTest.class, "org.apache.shapeshift.type.TypeIdentifierTest"},
      {TypeIdentifierTest[].class, "org.apache.shapeshift.type.TypeIdentifierTest[]"},
    };
  }

  @Test(dataProvider = "names")
  public void testClassNames(Class<?> cls, String name) {
    assertEquals(TypeIdentifier.forClass(cls).getName(), name);
    assertEquals(TypeIdentifier.parse(name), TypeIdentifier.forClass(cls));
  }

  @Test
  public void testPrimitiveArrayLocalTypes() throws ClassNotFoundException {
    assertSame(TypeIdentifier.parse("int[p]").getLocalType(classLoader), int[].class);
    assertSame(TypeIdentifier.parse("char[p]").getLocalType(classLoader), char[].class);
    assertSame(TypeIdentifier.parse("int[]").getLocalType(classLoader), Integer[].class);
    assertSame(TypeIdentifier.parse("string[][]").getLocalType(classLoader), String[][].class);
    assertSame(TypeIdentifier.parse("binary").getLocalType(classLoader), byte[].class);
  }

  @Test
  public void testBytePrimitiveArrayIsNotDeserializable() {
    assertThrows(
        TypeNotSerializableException.class,
        () -> TypeIdentifier.parse("byte[p]").getLocalType(classLoader));
  }

  @Test
  public void testGenericNames() throws ClassNotFoundException {
    Type type = new TypeToken<Map<String, List<Integer>>>() {}.getType();
    TypeIdentifier identifier = TypeIdentifier.forGenericType(type);
    assertEquals(identifier.getName(), "java.util.Map<string, java.util.List<int>>");
    assertEquals(identifier.prettyPrint(true), "Map<string, List<int>>");
    TypeIdentifier parsed = TypeIdentifier.parse(identifier.getName());
    assertTrue(parsed instanceof TypeIdentifier.Parameterised);
    assertEquals(((TypeIdentifier.Parameterised) parsed).getParameters().size(), 2);
    Type local = parsed.getLocalType(classLoader);
    assertEquals(local, type);
    assertEquals(local.hashCode(), type.hashCode());
  }

  @Test
  public void testWildcardsAreUnknown() throws ClassNotFoundException {
    Type type = new TypeToken<List<?>>() {}.getType();
    assertEquals(TypeIdentifier.forGenericType(type).getName(), "java.util.List<?>");
    ParameterizedType local =
        (ParameterizedType) TypeIdentifier.parse("java.util.List<?>").getLocalType(classLoader);
    assertEquals(local, type);
  }

  @Test
  public void testGenericArray() throws ClassNotFoundException {
    Type type = new TypeToken<List<String>[]>() {}.getType();
    assertEquals(TypeIdentifier.forGenericType(type).getName(), "java.util.List<string>[]");
    Type local = TypeIdentifier.parse("java.util.List<string>[]").getLocalType(classLoader);
    assertTrue(local instanceof GenericArrayType);
    assertEquals(local, type);
  }

  @Test
  public void testMissingClass() {
    assertThrows(
        ClassNotFoundException.class,
        () -> TypeIdentifier.parse("no.such.Clazz").getLocalType(classLoader));
  }

  @Test
  public void testMalformedNames() {
    assertThrows(TypeNotSerializableException.class, () -> TypeIdentifier.parse(""));
    assertThrows(TypeNotSerializableException.class, () -> TypeIdentifier.parse("a.B<c"));
    assertThrows(TypeNotSerializableException.class, () -> TypeIdentifier.parse("a.B<c>>d>"));
  }
}
