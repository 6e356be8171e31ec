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

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.Field;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.reflect.LocalProperty;
import org.apache.shapeshift.reflect.ObjectCreator;
import org.apache.shapeshift.reflect.ObjectCreators;
import org.apache.shapeshift.reflect.ReflectionUtils;
import org.apache.shapeshift.type.TypeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes an object as the described list of its properties in name order, see {@link
 * ReflectionUtils#getProperties(Class)}. Interface types are only described in schemas: they have
 * getter properties and no value is ever written or read as one.
 */
public class ObjectSerializer<T> extends Serializer<T> {
  private static final Logger LOG = LoggerFactory.getLogger(ObjectSerializer.class);

  private final Class<T> clazz;
  private final List<PropertySerializer> propertySerializers;
  private final List<String> propertyNames;
  private final Symbol typeDescriptor;
  private final CompositeType typeNotation;
  private final ObjectCreator<T> objectCreator;

  @SuppressWarnings("unchecked")
  public ObjectSerializer(Type type, SerializerFactory factory) {
    super(factory, type);
    this.clazz = (Class<T>) TypeUtils.asClass(type);
    List<PropertySerializer> serializers = new ArrayList<>();
    List<String> names = new ArrayList<>();
    for (LocalProperty property : ReflectionUtils.getProperties(clazz)) {
      serializers.add(new PropertySerializer(property, type));
      names.add(property.getName());
    }
    this.propertySerializers = ImmutableList.copyOf(serializers);
    this.propertyNames = ImmutableList.copyOf(names);
    this.typeDescriptor = factory.descriptorForType(type);
    List<String> provides = new ArrayList<>();
    for (Class<?> anInterface : factory.getProvidedInterfaces(clazz)) {
      provides.add(TypeUtils.nameForType(anInterface));
    }
    this.typeNotation =
        new CompositeType(
            TypeUtils.nameForType(type),
            null,
            provides,
            new Descriptor(typeDescriptor),
            getFields());
    // Unconstructible classes are rejected on write as well as on read.
    this.objectCreator =
        clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())
            ? null
            : ObjectCreators.getObjectCreator(clazz);
    LOG.debug("Created object serializer for {}: {}", type.getTypeName(), propertySerializers);
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  public List<PropertySerializer> getPropertySerializers() {
    return propertySerializers;
  }

  /** Schema fields of the properties, in wire order. */
  public List<Field> getFields() {
    List<Field> fields = new ArrayList<>(propertySerializers.size());
    for (PropertySerializer serializer : propertySerializers) {
      fields.add(serializer.getField());
    }
    return fields;
  }

  public CompositeType getTypeNotation() {
    return typeNotation;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    if (output.writeTypeNotations(typeNotation)) {
      for (PropertySerializer serializer : propertySerializers) {
        serializer.writeClassInfo(output);
      }
      for (Class<?> anInterface : factory.getProvidedInterfaces(clazz)) {
        output.requireSerializer(anInterface);
      }
    }
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    if (clazz.isInterface()) {
      throw new TypeNotSerializableException(type, "Interface types have no instances to write");
    }
    data.putDescribed();
    data.enter();
    data.putSymbol(typeDescriptor);
    writeProperties(obj, data, output);
    data.exit();
  }

  /** Write the property values of {@code obj} as a list. */
  public void writeProperties(Object obj, Data data, SerializationOutput output) {
    data.putList();
    data.enter();
    for (PropertySerializer serializer : propertySerializers) {
      serializer.writeProperty(obj, data, output);
    }
    data.exit();
  }

  @Override
  public T readObject(Object obj, Schema schema, DeserializationInput input) {
    return construct(readProperties(obj, schema, input));
  }

  /** Read the property values of the described list {@code obj}, in property order. */
  public Object[] readProperties(Object obj, Schema schema, DeserializationInput input) {
    if (!(obj instanceof List)) {
      throw new DeserializationException(
          "Expected a property list for " + type + " but got " + obj);
    }
    List<?> values = (List<?>) obj;
    if (values.size() != propertySerializers.size()) {
      throw new DeserializationException(
          String.format(
              "Expected %d properties for %s but got %d",
              propertySerializers.size(), type.getTypeName(), values.size()));
    }
    Object[] result = new Object[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = propertySerializers.get(i).readProperty(values.get(i), schema, input);
    }
    return result;
  }

  /** Create an instance whose properties hold {@code values}, given in property order. */
  public T construct(Object[] values) {
    if (objectCreator == null) {
      throw new TypeNotSerializableException(type, "Abstract types can't be instantiated");
    }
    return objectCreator.newInstance(propertyNames, values);
  }
}
