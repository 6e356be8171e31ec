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

package org.apache.shapeshift.serializer.collection;

import com.google.common.collect.ImmutableMap;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.SerializationOutput;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.type.AnyType;
import org.apache.shapeshift.type.DeserializedParameterizedType;
import org.apache.shapeshift.type.TypeUtils;

/**
 * Serializes collections as described lists of their elements. A collection is written as one of
 * the supported shapes and read back as that shape's default implementation.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class CollectionSerializer extends Serializer<Collection<?>> {
  // Ordered from the least to the most specific shape.
  private static final Map<Class<?>, Supplier<Collection<Object>>> SUPPORTED_TYPES =
      ImmutableMap.<Class<?>, Supplier<Collection<Object>>>builder()
          .put(Collection.class, ArrayList::new)
          .put(List.class, ArrayList::new)
          .put(Set.class, LinkedHashSet::new)
          .put(SortedSet.class, TreeSet::new)
          .put(NavigableSet.class, TreeSet::new)
          .build();

  private final Type elementType;
  private final Supplier<Collection<Object>> concreteBuilder;
  private final Symbol typeDescriptor;
  private final RestrictedType typeNotation;

  public CollectionSerializer(Type type, SerializerFactory factory) {
    super(factory, type);
    Class<?> collectionClass = TypeUtils.asClass(type);
    this.concreteBuilder = SUPPORTED_TYPES.get(collectionClass);
    if (concreteBuilder == null) {
      throw new TypeNotSerializableException(type, "Unsupported collection type");
    }
    this.elementType = TypeUtils.supertypeArgument(type, Collection.class, 0);
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

  /**
   * The supported shape a collection declared as {@code declaredType} with runtime class {@code
   * actualClass} is written as. Unknown element types become {@link AnyType}.
   */
  public static ParameterizedType deriveParameterizedType(
      Type declaredType, Class<?> declaredClass, Class<?> actualClass) {
    Class<?> collectionClass;
    if (SUPPORTED_TYPES.containsKey(declaredClass)) {
      if (declaredType instanceof ParameterizedType) {
        return (ParameterizedType) declaredType;
      }
      collectionClass = declaredClass;
    } else if (actualClass != null && Collection.class.isAssignableFrom(actualClass)) {
      collectionClass = findMostSuitableCollectionType(actualClass);
    } else if (Collection.class.isAssignableFrom(declaredClass)) {
      collectionClass = findMostSuitableCollectionType(declaredClass);
    } else {
      throw new TypeNotSerializableException(
          declaredType,
          "Cannot derive collection type for declared type "
              + declaredType.getTypeName()
              + " and actual class "
              + actualClass);
    }
    Type elementType =
        Collection.class.isAssignableFrom(declaredClass)
            ? TypeUtils.supertypeArgument(declaredType, Collection.class, 0)
            : AnyType.INSTANCE;
    return DeserializedParameterizedType.make(collectionClass, elementType);
  }

  /** The most specific supported shape {@code actualClass} implements. */
  public static Class<?> findMostSuitableCollectionType(Class<?> actualClass) {
    Class<?> result = null;
    for (Class<?> supported : SUPPORTED_TYPES.keySet()) {
      if (supported.isAssignableFrom(actualClass)) {
        result = supported;
      }
    }
    if (result == null) {
      throw new TypeNotSerializableException(actualClass, "Not a collection");
    }
    return result;
  }

  public Type getElementType() {
    return elementType;
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    if (output.writeTypeNotations(typeNotation)) {
      output.requireSerializer(elementType);
    }
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    data.putDescribed();
    data.enter();
    data.putSymbol(typeDescriptor);
    data.putList();
    data.enter();
    for (Object element : (Collection<?>) obj) {
      output.writeObjectOrNull(element, data, elementType);
    }
    data.exit();
    data.exit();
  }

  @Override
  public Collection<?> readObject(Object obj, Schema schema, DeserializationInput input) {
    if (!(obj instanceof List)) {
      throw new DeserializationException("Expected a list for " + type + " but got " + obj);
    }
    Collection<Object> collection = concreteBuilder.get();
    for (Object element : (List<?>) obj) {
      collection.add(input.readObjectOrNull(element, schema, elementType));
    }
    return collection;
  }
}
