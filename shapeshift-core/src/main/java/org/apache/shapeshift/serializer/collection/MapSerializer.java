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
import java.util.Collections;
import java.util.Dictionary;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.WeakHashMap;
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
 * Serializes maps as described AMQP maps. Only maps with a stable iteration order are accepted, so
 * the same map always produces the same bytes.
 */
public class MapSerializer extends Serializer<Map<?, ?>> {
  // Ordered from the least to the most specific shape.
  private static final Map<Class<?>, Supplier<Map<Object, Object>>> SUPPORTED_TYPES =
      ImmutableMap.<Class<?>, Supplier<Map<Object, Object>>>builder()
          .put(Map.class, LinkedHashMap::new)
          .put(SortedMap.class, TreeMap::new)
          .put(NavigableMap.class, TreeMap::new)
          .build();

  private final Type keyType;
  private final Type valueType;
  private final Supplier<Map<Object, Object>> concreteBuilder;
  private final Symbol typeDescriptor;
  private final RestrictedType typeNotation;

  public MapSerializer(Type type, SerializerFactory factory) {
    super(factory, type);
    this.concreteBuilder = SUPPORTED_TYPES.get(TypeUtils.asClass(type));
    if (concreteBuilder == null) {
      throw new TypeNotSerializableException(type, "Unsupported map type");
    }
    this.keyType = TypeUtils.supertypeArgument(type, Map.class, 0);
    this.valueType = TypeUtils.supertypeArgument(type, Map.class, 1);
    this.typeDescriptor = factory.descriptorForType(type);
    this.typeNotation =
        new RestrictedType(
            TypeUtils.nameForType(type),
            null,
            Collections.emptyList(),
            "map",
            new Descriptor(typeDescriptor),
            Collections.emptyList());
  }

  /**
   * Reject map implementations without a stable iteration order, or with identity or weak key
   * semantics.
   *
   * @throws TypeNotSerializableException for an unsupported map class
   */
  public static void checkSupportedMapType(Class<?> mapClass) {
    if (HashMap.class.isAssignableFrom(mapClass)
        && !LinkedHashMap.class.isAssignableFrom(mapClass)) {
      throw new TypeNotSerializableException(
          mapClass,
          "Map type "
              + mapClass.getName()
              + " is unstable under iteration. Suggested fix: use java.util.LinkedHashMap"
              + " instead.");
    } else if (WeakHashMap.class.isAssignableFrom(mapClass)) {
      throw new TypeNotSerializableException(
          mapClass,
          "Weak references with map types not supported. Suggested fix: use"
              + " java.util.LinkedHashMap instead.");
    } else if (IdentityHashMap.class.isAssignableFrom(mapClass)) {
      throw new TypeNotSerializableException(
          mapClass, "Identity maps are not supported. Suggested fix: use java.util.LinkedHashMap.");
    } else if (Dictionary.class.isAssignableFrom(mapClass)) {
      throw new TypeNotSerializableException(
          mapClass,
          "Unable to serialise deprecated type "
              + mapClass.getName()
              + ". Suggested fix: prefer java.util.Map implementations");
    }
  }

  /** The supported shape a map declared as {@code declaredType} is written as. */
  public static ParameterizedType deriveParameterizedType(
      Type declaredType, Class<?> declaredClass, Class<?> actualClass) {
    Class<?> mapClass;
    if (SUPPORTED_TYPES.containsKey(declaredClass)) {
      if (declaredType instanceof ParameterizedType) {
        return (ParameterizedType) declaredType;
      }
      mapClass = declaredClass;
    } else if (actualClass != null && Map.class.isAssignableFrom(actualClass)) {
      mapClass = findMostSuitableMapType(actualClass);
    } else if (Map.class.isAssignableFrom(declaredClass)) {
      mapClass = findMostSuitableMapType(declaredClass);
    } else {
      throw new TypeNotSerializableException(
          declaredType,
          "Cannot derive map type for declared type "
              + declaredType.getTypeName()
              + " and actual class "
              + actualClass);
    }
    if (Map.class.isAssignableFrom(declaredClass)) {
      return DeserializedParameterizedType.make(
          mapClass,
          TypeUtils.supertypeArgument(declaredType, Map.class, 0),
          TypeUtils.supertypeArgument(declaredType, Map.class, 1));
    }
    return DeserializedParameterizedType.make(mapClass, AnyType.INSTANCE, AnyType.INSTANCE);
  }

  /** The most specific supported shape {@code actualClass} implements. */
  public static Class<?> findMostSuitableMapType(Class<?> actualClass) {
    Class<?> result = null;
    for (Class<?> supported : SUPPORTED_TYPES.keySet()) {
      if (supported.isAssignableFrom(actualClass)) {
        result = supported;
      }
    }
    if (result == null) {
      throw new TypeNotSerializableException(actualClass, "Not a map");
    }
    return result;
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    if (output.writeTypeNotations(typeNotation)) {
      output.requireSerializer(keyType);
      output.requireSerializer(valueType);
    }
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    checkSupportedMapType(obj.getClass());
    data.putDescribed();
    data.enter();
    data.putSymbol(typeDescriptor);
    data.putMap();
    data.enter();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) obj).entrySet()) {
      output.writeObjectOrNull(entry.getKey(), data, keyType);
      output.writeObjectOrNull(entry.getValue(), data, valueType);
    }
    data.exit();
    data.exit();
  }

  @Override
  public Map<?, ?> readObject(Object obj, Schema schema, DeserializationInput input) {
    if (!(obj instanceof Map)) {
      throw new DeserializationException("Expected a map for " + type + " but got " + obj);
    }
    Map<Object, Object> map = concreteBuilder.get();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) obj).entrySet()) {
      map.put(
          input.readObjectOrNull(entry.getKey(), schema, keyType),
          input.readObjectOrNull(entry.getValue(), schema, valueType));
    }
    return map;
  }
}
