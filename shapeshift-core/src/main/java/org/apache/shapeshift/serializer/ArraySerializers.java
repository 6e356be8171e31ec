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
import java.lang.reflect.Array;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.type.TypeUtils;

/** Serializers for arrays, written as described lists of their elements. */
public class ArraySerializers {

  abstract static class AbstractArraySerializer extends Serializer<Object> {
    protected final Type componentType;
    protected final Class<?> componentClass;
    private final Symbol typeDescriptor;
    private final RestrictedType typeNotation;

    AbstractArraySerializer(Type type, SerializerFactory factory) {
      super(factory, type);
      this.componentType = TypeUtils.componentType(type);
      this.componentClass = TypeUtils.asClass(componentType);
      this.typeDescriptor = factory.descriptorForType(type);
      this.typeNotation =
          new RestrictedType(
              TypeUtils.nameForType(type),
              null,
              Collections.emptyList(),
              "list",
              new Descriptor(typeDescriptor),
              Collections.emptyList());
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }

    @Override
    public void writeClassInfo(SerializationOutput output) {
      if (output.writeTypeNotations(typeNotation)) {
        output.requireSerializer(componentType);
      }
    }

    @Override
    public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
      data.putDescribed();
      data.enter();
      data.putSymbol(typeDescriptor);
      data.putList();
      data.enter();
      int length = Array.getLength(obj);
      for (int i = 0; i < length; i++) {
        writeElement(Array.get(obj, i), data, output);
      }
      data.exit();
      data.exit();
    }

    protected abstract void writeElement(Object element, Data data, SerializationOutput output);

    @Override
    public Object readObject(Object obj, Schema schema, DeserializationInput input) {
      if (!(obj instanceof List)) {
        throw new DeserializationException("Expected a list for " + type + " but got " + obj);
      }
      List<?> elements = (List<?>) obj;
      Object array = Array.newInstance(componentClass, elements.size());
      for (int i = 0; i < elements.size(); i++) {
        Array.set(array, i, readElement(elements.get(i), schema, input));
      }
      return array;
    }

    protected abstract Object readElement(
        Object element, Schema schema, DeserializationInput input);
  }

  /** Arrays of objects, including nested and generic arrays. */
  public static final class ObjectArraySerializer extends AbstractArraySerializer {
    public ObjectArraySerializer(Type type, SerializerFactory factory) {
      super(type, factory);
    }

    @Override
    protected void writeElement(Object element, Data data, SerializationOutput output) {
      output.writeObjectOrNull(element, data, componentType);
    }

    @Override
    protected Object readElement(Object element, Schema schema, DeserializationInput input) {
      return input.readObjectOrNull(element, schema, componentType);
    }
  }

  /** Arrays of java primitives other than {@code byte[]}, which is the binary primitive. */
  public static final class PrimitiveArraySerializer extends AbstractArraySerializer {
    private final Class<?> boxedComponentClass;

    public PrimitiveArraySerializer(Type type, SerializerFactory factory) {
      super(type, factory);
      this.boxedComponentClass = Primitives.wrap(componentClass);
    }

    @Override
    protected void writeElement(Object element, Data data, SerializationOutput output) {
      PrimitiveSerializer.writePrimitive(data, element);
    }

    @Override
    protected Object readElement(Object element, Schema schema, DeserializationInput input) {
      Object value = PrimitiveSerializer.coerce(element, boxedComponentClass);
      if (!boxedComponentClass.isInstance(value)) {
        throw new DeserializationException(
            "Expected " + componentClass + " element in " + type + " but got " + value);
      }
      return value;
    }
  }
}
