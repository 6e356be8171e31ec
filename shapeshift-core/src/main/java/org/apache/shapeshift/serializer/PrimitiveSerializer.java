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

package org.apache.shapeshift.serializer;

import com.google.common.primitives.Primitives;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Date;
import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.type.Types;

/** Writes values that map directly onto AMQP primitives, see {@link Types}. */
public final class PrimitiveSerializer extends Serializer<Object> {
  private final Symbol typeDescriptor;
  private final Class<?> boxedClass;

  public PrimitiveSerializer(Class<?> clazz) {
    super(null, clazz);
    this.typeDescriptor = Symbol.valueOf(Types.primitiveTypeName(clazz));
    this.boxedClass = Primitives.wrap(clazz);
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    writePrimitive(data, obj);
  }

  @Override
  public Object readObject(Object obj, Schema schema, DeserializationInput input) {
    return coerce(obj, boxedClass);
  }

  /** Write a primitive or null value. */
  public static void writePrimitive(Data data, Object value) {
    if (value == null) {
      data.putNull();
    } else if (value instanceof byte[]) {
      data.putBinary((byte[]) value);
    } else if (value instanceof Character) {
      data.putChar((Character) value);
    } else if (value instanceof Date) {
      data.putTimestamp((Date) value);
    } else {
      data.putObject(value);
    }
  }

  /**
   * Convert a decoded AMQP primitive to the java representation of {@code expected}: binary becomes
   * {@code byte[]} and chars, which decode as code points, become {@link Character}.
   */
  public static Object coerce(Object value, Class<?> expected) {
    if (value instanceof Binary) {
      Binary binary = (Binary) value;
      return Arrays.copyOfRange(
          binary.getArray(), binary.getArrayOffset(), binary.getArrayOffset() + binary.getLength());
    }
    if (value instanceof Integer && Primitives.wrap(expected) == Character.class) {
      return (char) ((Integer) value).intValue();
    }
    return value;
  }
}
