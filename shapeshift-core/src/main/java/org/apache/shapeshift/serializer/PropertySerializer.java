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
import java.util.Collections;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.meta.Field;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.reflect.LocalProperty;
import org.apache.shapeshift.type.TypeUtils;

/**
 * Writes and reads one property of a by-properties object. The property type is resolved against
 * the parameterization of the owning type, so {@code T value} of a {@code Box<String>} is a string.
 */
public final class PropertySerializer {
  private final LocalProperty property;
  private final Type resolvedType;
  private final boolean mandatory;
  private final Field field;

  PropertySerializer(LocalProperty property, Type ownerType) {
    this.property = property;
    this.resolvedType = TypeUtils.resolveMemberType(ownerType, property.getGenericType());
    this.mandatory = property.getRawType().isPrimitive();
    String typeName = TypeUtils.nameForType(resolvedType);
    Class<?> rawType = property.getRawType();
    this.field =
        new Field(
            property.getName(),
            typeName,
            rawType.isInterface() ? ImmutableList.of(typeName) : Collections.emptyList(),
            null,
            null,
            mandatory,
            false);
  }

  public String getName() {
    return property.getName();
  }

  /** Type of the property as seen from the owning type. */
  public Type getResolvedType() {
    return resolvedType;
  }

  public Class<?> getRawType() {
    return property.getRawType();
  }

  public boolean isMandatory() {
    return mandatory;
  }

  /** The schema field of this property. */
  public Field getField() {
    return field;
  }

  void writeClassInfo(SerializationOutput output) {
    output.requireSerializer(resolvedType);
  }

  void writeProperty(Object owner, Data data, SerializationOutput output) {
    output.writeObjectOrNull(property.get(owner), data, resolvedType);
  }

  Object readProperty(Object obj, Schema schema, DeserializationInput input) {
    return input.readObjectOrNull(obj, schema, resolvedType);
  }

  @Override
  public String toString() {
    return "PropertySerializer(" + getName() + ": " + resolvedType.getTypeName() + ")";
  }
}
