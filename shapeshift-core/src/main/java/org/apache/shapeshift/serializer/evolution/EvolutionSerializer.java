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

import com.google.common.base.Defaults;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.Field;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.ObjectSerializer;
import org.apache.shapeshift.serializer.PropertySerializer;
import org.apache.shapeshift.serializer.SerializationOutput;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.serializer.converter.FieldConverter;
import org.apache.shapeshift.serializer.converter.FieldConverters;
import org.apache.shapeshift.type.TypeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads objects written by a version of a class with other properties than the local one.
 * Properties are matched by name: remote properties the local class lacks are skipped, local
 * properties the sender lacks get the java default of their type, and properties whose type changed
 * are converted with {@link FieldConverters}. Only ever used for reading.
 */
public class EvolutionSerializer<T> extends Serializer<T> {
  private static final Logger LOG = LoggerFactory.getLogger(EvolutionSerializer.class);

  private final ObjectSerializer<T> localSerializer;
  private final Symbol typeDescriptor;
  private final List<RemoteFieldReader> readers;
  private final Object[] defaults;

  public EvolutionSerializer(
      CompositeType remote, ObjectSerializer<T> localSerializer, SerializerFactory factory) {
    super(factory, localSerializer.getType());
    this.localSerializer = localSerializer;
    this.typeDescriptor = remote.getDescriptorElement().getName();
    List<PropertySerializer> localProperties = localSerializer.getPropertySerializers();
    this.defaults = new Object[localProperties.size()];
    for (int i = 0; i < defaults.length; i++) {
      defaults[i] = Defaults.defaultValue(localProperties.get(i).getRawType());
    }
    this.readers = new ArrayList<>(remote.getFields().size());
    for (Field field : remote.getFields()) {
      readers.add(readerFor(field, localProperties));
    }
  }

  private RemoteFieldReader readerFor(Field field, List<PropertySerializer> localProperties) {
    for (int i = 0; i < localProperties.size(); i++) {
      PropertySerializer property = localProperties.get(i);
      if (!property.getName().equals(field.getName())) {
        continue;
      }
      if (property.getField().getType().equals(field.getType())) {
        return new RemoteFieldReader(i, property, property.getResolvedType(), null);
      }
      Type remoteType;
      try {
        remoteType = factory.getRemoteTypeResolver().typeForName(field.getType());
      } catch (ClassNotFoundException e) {
        throw new TypeNotSerializableException(
            type, "Unable to locate remote type " + field.getType() + " of " + field.getName(), e);
      }
      Class<?> remoteClass = TypeUtils.asClass(remoteType);
      FieldConverter<?> converter =
          FieldConverters.getConverter(remoteClass, property.getRawType());
      if (converter == null && !property.getRawType().isAssignableFrom(remoteClass)) {
        throw new TypeNotSerializableException(
            type,
            String.format(
                "Unable to evolve property %s from %s to %s",
                field.getName(), field.getType(), property.getField().getType()));
      }
      LOG.debug(
          "Property {} of {} evolves from {} to {}",
          field.getName(),
          type.getTypeName(),
          field.getType(),
          property.getField().getType());
      return new RemoteFieldReader(i, property, remoteType, converter);
    }
    LOG.debug("Property {} of {} was removed locally", field.getName(), type.getTypeName());
    return new RemoteFieldReader(-1, null, null, null);
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    throw new UnsupportedOperationException("Evolution serializers are only used for reading");
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    throw new UnsupportedOperationException("Evolution serializers are only used for reading");
  }

  @Override
  public T readObject(Object obj, Schema schema, DeserializationInput input) {
    if (!(obj instanceof List) || ((List<?>) obj).size() != readers.size()) {
      throw new DeserializationException(
          "Expected " + readers.size() + " remote properties for " + type + " but got " + obj);
    }
    List<?> values = (List<?>) obj;
    Object[] localValues = defaults.clone();
    for (int i = 0; i < readers.size(); i++) {
      RemoteFieldReader reader = readers.get(i);
      if (reader.localIndex >= 0) {
        Object value = input.readObjectOrNull(values.get(i), schema, reader.readType);
        localValues[reader.localIndex] = toLocalValue(reader, value);
      }
    }
    return localSerializer.construct(localValues);
  }

  private Object toLocalValue(RemoteFieldReader reader, Object value) {
    String name = reader.property.getName();
    if (reader.converter == null) {
      if (value == null && reader.property.getRawType().isPrimitive()) {
        throw new DeserializationException(
            "Property " + name + " of " + type.getTypeName() + " is primitive but was null");
      }
      return value;
    }
    try {
      return reader.converter.convert(value);
    } catch (UnsupportedOperationException | ArithmeticException | IllegalArgumentException e) {
      throw new DeserializationException(
          "Unable to convert property " + name + " of " + type.getTypeName() + ": " + value, e);
    }
  }

  @Override
  public String toString() {
    return "EvolutionSerializer(" + type.getTypeName() + ", " + typeDescriptor + ")";
  }

  private static final class RemoteFieldReader {
    private final int localIndex;
    private final PropertySerializer property;
    private final Type readType;
    private final FieldConverter<?> converter;

    RemoteFieldReader(
        int localIndex, PropertySerializer property, Type readType, FieldConverter<?> converter) {
      this.localIndex = localIndex;
      this.property = property;
      this.readType = readType;
      this.converter = converter;
    }
  }
}
