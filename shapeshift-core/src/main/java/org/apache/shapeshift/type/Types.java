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

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import java.lang.reflect.Type;
import java.util.Date;
import java.util.UUID;
import org.apache.qpid.proton.amqp.Decimal128;
import org.apache.qpid.proton.amqp.Decimal32;
import org.apache.qpid.proton.amqp.Decimal64;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.UnsignedByte;
import org.apache.qpid.proton.amqp.UnsignedInteger;
import org.apache.qpid.proton.amqp.UnsignedLong;
import org.apache.qpid.proton.amqp.UnsignedShort;

/**
 * AMQP primitive type names and the java classes they map to. These tables are initialized once and
 * never mutated.
 */
public class Types {
  public static final String BOOLEAN = "boolean";
  public static final String BYTE = "byte";
  public static final String UBYTE = "ubyte";
  public static final String SHORT = "short";
  public static final String USHORT = "ushort";
  public static final String INT = "int";
  public static final String UINT = "uint";
  public static final String LONG = "long";
  public static final String ULONG = "ulong";
  public static final String FLOAT = "float";
  public static final String DOUBLE = "double";
  public static final String DECIMAL32 = "decimal32";
  public static final String DECIMAL64 = "decimal64";
  public static final String DECIMAL128 = "decimal128";
  public static final String CHAR = "char";
  public static final String TIMESTAMP = "timestamp";
  public static final String UUID_NAME = "uuid";
  public static final String BINARY = "binary";
  public static final String STRING = "string";
  public static final String SYMBOL = "symbol";

  // Keys are boxed, primitive classes are wrapped before lookup.
  private static final ImmutableBiMap<Class<?>, String> PRIMITIVE_TYPE_NAMES =
      ImmutableBiMap.<Class<?>, String>builder()
          .put(Character.class, CHAR)
          .put(Boolean.class, BOOLEAN)
          .put(Byte.class, BYTE)
          .put(UnsignedByte.class, UBYTE)
          .put(Short.class, SHORT)
          .put(UnsignedShort.class, USHORT)
          .put(Integer.class, INT)
          .put(UnsignedInteger.class, UINT)
          .put(Long.class, LONG)
          .put(UnsignedLong.class, ULONG)
          .put(Float.class, FLOAT)
          .put(Double.class, DOUBLE)
          .put(Decimal32.class, DECIMAL32)
          .put(Decimal64.class, DECIMAL64)
          .put(Decimal128.class, DECIMAL128)
          .put(Date.class, TIMESTAMP)
          .put(UUID.class, UUID_NAME)
          .put(byte[].class, BINARY)
          .put(String.class, STRING)
          .put(Symbol.class, SYMBOL)
          .build();

  // byte[] is never written as `byte[p]`, it is the binary primitive.
  private static final ImmutableMap<String, Class<?>> PRIMITIVE_ARRAY_TYPES =
      ImmutableMap.<String, Class<?>>builder()
          .put(INT, int[].class)
          .put(CHAR, char[].class)
          .put(BOOLEAN, boolean[].class)
          .put(FLOAT, float[].class)
          .put(DOUBLE, double[].class)
          .put(SHORT, short[].class)
          .put(LONG, long[].class)
          .build();

  /** Whether {@code type} is written as an AMQP primitive rather than a described type. */
  public static boolean isPrimitive(Type type) {
    return primitiveTypeName(type) != null;
  }

  /** Returns the AMQP name of a primitive type, or null if {@code type} isn't primitive. */
  public static String primitiveTypeName(Type type) {
    if (!(type instanceof Class)) {
      return null;
    }
    return PRIMITIVE_TYPE_NAMES.get(Primitives.wrap((Class<?>) type));
  }

  /** Returns the boxed class for an AMQP primitive name, or null. */
  public static Class<?> primitiveType(String name) {
    return PRIMITIVE_TYPE_NAMES.inverse().get(name);
  }

  /** Returns the java primitive array class for the component name of a {@code [p]} array. */
  public static Class<?> primitiveArrayType(String componentName) {
    return PRIMITIVE_ARRAY_TYPES.get(componentName);
  }
}
