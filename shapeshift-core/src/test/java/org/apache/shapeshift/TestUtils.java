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

package org.apache.shapeshift;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import org.codehaus.commons.compiler.CompileException;
import org.codehaus.janino.SimpleCompiler;

/** Test utils. */
public class TestUtils {

  /**
   * Compile {@code code} into a fresh class loader whose parent is {@code parent}, so the same
   * class name can be compiled with different shapes in different loaders.
   */
  public static Class<?> compileClass(
      ClassLoader parent, String pkg, String className, String code) {
    String source = pkg.isEmpty() ? code : "package " + pkg + ";\n" + code;
    String name = pkg.isEmpty() ? className : pkg + "." + className;
    SimpleCompiler compiler = new SimpleCompiler();
    compiler.setParentClassLoader(parent);
    try {
      compiler.cook(source);
      return compiler.getClassLoader().loadClass(name);
    } catch (CompileException | ClassNotFoundException e) {
      throw new RuntimeException("Unable to compile " + name, e);
    }
  }

  public static Class<?> compileClass(String pkg, String className, String code) {
    return compileClass(TestUtils.class.getClassLoader(), pkg, className, code);
  }

  /** Instantiate {@code cls} with its no-arg constructor and set its public fields. */
  public static Object newInstance(Class<?> cls, Object... fieldNamesAndValues) {
    try {
      Object obj = cls.getConstructor().newInstance();
      for (int i = 0; i < fieldNamesAndValues.length; i += 2) {
        cls.getField((String) fieldNamesAndValues[i]).set(obj, fieldNamesAndValues[i + 1]);
      }
      return obj;
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
  }

  @SuppressWarnings("unchecked")
  public static <T> T getFieldValue(Object obj, String fieldName) {
    try {
      Field field = obj.getClass().getField(fieldName);
      return (T) field.get(obj);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
  }

  /** Read a property of a carpented object through its getter. */
  @SuppressWarnings("unchecked")
  public static <T> T getProperty(Object obj, String property) {
    String getter = "get" + Character.toUpperCase(property.charAt(0)) + property.substring(1);
    try {
      Method method = obj.getClass().getMethod(getter);
      return (T) method.invoke(obj);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
  }
}
