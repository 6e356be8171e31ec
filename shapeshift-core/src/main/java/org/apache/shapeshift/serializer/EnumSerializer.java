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
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.meta.Choice;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.meta.Transform;
import org.apache.shapeshift.meta.TransformsSchema;
import org.apache.shapeshift.type.TypeUtils;

/**
 * Serializes enum constants as the described list {@code [name, ordinal]}. The notation lists the
 * constants as choices of name and ordinal.
 */
public class EnumSerializer extends Serializer<Enum<?>> {
  private final Class<?> enumClass;
  private final List<Enum<?>> constants;
  private final Symbol typeDescriptor;
  private final RestrictedType typeNotation;
  private final List<Transform> transforms;

  public EnumSerializer(Class<?> enumClass, SerializerFactory factory) {
    super(factory, enumClass);
    this.enumClass = enumClass;
    List<Enum<?>> enumConstants = new ArrayList<>();
    List<Choice> choices = new ArrayList<>();
    for (Object constant : enumClass.getEnumConstants()) {
      Enum<?> e = (Enum<?>) constant;
      enumConstants.add(e);
      choices.add(new Choice(e.name(), String.valueOf(e.ordinal())));
    }
    this.constants = ImmutableList.copyOf(enumConstants);
    this.typeDescriptor = factory.descriptorForType(enumClass);
    List<String> provides = new ArrayList<>();
    for (Class<?> anInterface : factory.getProvidedInterfaces(enumClass)) {
      provides.add(TypeUtils.nameForType(anInterface));
    }
    this.typeNotation =
        new RestrictedType(
            TypeUtils.nameForType(enumClass),
            null,
            provides,
            "list",
            new Descriptor(typeDescriptor),
            choices);
    this.transforms = TransformsSchema.enumTransforms(enumClass);
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  public RestrictedType getTypeNotation() {
    return typeNotation;
  }

  /** Defaults and renames declared on the local enum. */
  public List<Transform> getTransforms() {
    return transforms;
  }

  /** Constants of the local enum, in ordinal order. */
  public List<Enum<?>> getConstants() {
    return constants;
  }

  /** The local constant named {@code name}, or null. */
  public Enum<?> constantNamed(String name) {
    for (Enum<?> constant : constants) {
      if (constant.name().equals(name)) {
        return constant;
      }
    }
    return null;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    output.writeTypeNotations(typeNotation);
    output.writeTransforms(typeNotation.getName(), transforms);
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    Enum<?> constant = (Enum<?>) obj;
    data.putDescribed();
    data.enter();
    data.putSymbol(typeDescriptor);
    data.putList();
    data.enter();
    data.putString(constant.name());
    data.putInt(constant.ordinal());
    data.exit();
    data.exit();
  }

  @Override
  public Enum<?> readObject(Object obj, Schema schema, DeserializationInput input) {
    String name = constantName(obj);
    Enum<?> constant = constantNamed(name);
    if (constant == null) {
      throw new DeserializationException(
          "Enum " + enumClass.getName() + " has no constant named " + name);
    }
    return constant;
  }

  public static String constantName(Object obj) {
    if (!(obj instanceof List) || ((List<?>) obj).isEmpty()) {
      throw new DeserializationException("Expected [name, ordinal] for an enum but got " + obj);
    }
    return String.valueOf(((List<?>) obj).get(0));
  }
}
