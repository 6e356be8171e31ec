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

package org.apache.shapeshift.serializer.struct;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.shapeshift.reflect.LocalProperty;
import org.apache.shapeshift.reflect.ReflectionUtils;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.type.TypeUtils;
import org.apache.shapeshift.type.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fingerprints a type by rendering its serialized shape to a canonical string and hashing it with
 * SHA-256.
 *
 * <p><b>Fingerprint Format:</b>
 *
 * <ul>
 *   <li>Primitives: their wire name, e.g. {@code int}
 *   <li>Wildcards and type variables: {@code ?}
 *   <li>Arrays: the component followed by {@code []}, or {@code [p]} for java primitives
 *   <li>Collections and maps: {@code raw<arg,arg>}
 *   <li>Enums: {@code name enum{A,B,}}
 *   <li>Composites: {@code name{field,type,nullable;...}provides[interface,...]}, fields sorted
 *       by name and typed against the concrete parameterization; interfaces render their getters
 *   <li>Types written by a custom serializer: {@code custom(descriptor)}
 *   <li>A composite met again while rendering itself: {@code cycle(name)}
 * </ul>
 */
@ThreadSafe
public class SerializerFingerPrinter implements FingerPrinter {
  private static final Logger LOG = LoggerFactory.getLogger(SerializerFingerPrinter.class);

  private final SerializerFactory factory;
  private final ConcurrentMap<Type, String> cache = new ConcurrentHashMap<>();

  public SerializerFingerPrinter(SerializerFactory factory) {
    this.factory = factory;
  }

  @Override
  public String fingerprint(Type type) {
    String fingerprint = cache.get(type);
    if (fingerprint == null) {
      // Rendering looks up custom serializers, can't run inside computeIfAbsent.
      fingerprint = customSerializerFingerprint(type);
      if (fingerprint == null) {
        String rendered = render(type);
        LOG.trace("Fingerprint string for {} is: {}", type.getTypeName(), rendered);
        fingerprint = hash(rendered);
      }
      String previous = cache.putIfAbsent(type, fingerprint);
      if (previous != null) {
        fingerprint = previous;
      }
    }
    return fingerprint;
  }

  // A custom serialized type is fingerprinted as its serializer's descriptor.
  private String customSerializerFingerprint(Type type) {
    if (TypeUtils.isUnknown(type) || Types.isPrimitive(type) || TypeUtils.isArray(type)) {
      return null;
    }
    Serializer<?> customSerializer = factory.findCustomSerializer(TypeUtils.asClass(type), type);
    if (customSerializer == null) {
      return null;
    }
    String descriptor = customSerializer.getTypeDescriptor().toString();
    return descriptor.substring(descriptor.indexOf(':') + 1);
  }

  /** Fingerprint of a descriptor derived from other descriptors or names. */
  public static String fingerprintForDescriptors(String... typeDescriptors) {
    return hash(String.join("", typeDescriptors));
  }

  private static String hash(String value) {
    return BaseEncoding.base64()
        .encode(Hashing.sha256().hashString(value, StandardCharsets.UTF_8).asBytes());
  }

  private String render(Type type) {
    StringBuilder builder = new StringBuilder();
    render(type, builder, new HashSet<>());
    return builder.toString();
  }

  private void render(Type type, StringBuilder builder, Set<Type> visiting) {
    if (TypeUtils.isUnknown(type)) {
      builder.append('?');
      return;
    }
    String primitiveName = Types.primitiveTypeName(type);
    if (primitiveName != null) {
      builder.append(primitiveName);
      return;
    }
    if (type instanceof GenericArrayType) {
      render(((GenericArrayType) type).getGenericComponentType(), builder, visiting);
      builder.append("[]");
      return;
    }
    Class<?> cls = TypeUtils.asClass(type);
    if (cls.isArray()) {
      render(cls.getComponentType(), builder, visiting);
      builder.append(cls.getComponentType().isPrimitive() ? "[p]" : "[]");
      return;
    }
    Serializer<?> customSerializer = factory.findCustomSerializer(cls, type);
    if (customSerializer != null) {
      builder.append("custom(").append(customSerializer.getTypeDescriptor()).append(')');
      return;
    }
    if (Collection.class.isAssignableFrom(cls) || Map.class.isAssignableFrom(cls)) {
      builder.append(cls.getName());
      if (type instanceof ParameterizedType) {
        builder.append('<');
        for (Type argument : ((ParameterizedType) type).getActualTypeArguments()) {
          render(argument, builder, visiting);
          builder.append(',');
        }
        builder.append('>');
      }
      return;
    }
    if (cls.isEnum() || (cls.getSuperclass() != null && cls.getSuperclass().isEnum())) {
      Class<?> enumClass = cls.isEnum() ? cls : cls.getSuperclass();
      builder.append(enumClass.getName()).append(" enum{");
      for (Object constant : enumClass.getEnumConstants()) {
        builder.append(((Enum<?>) constant).name()).append(',');
      }
      builder.append('}');
      return;
    }
    renderComposite(cls, type, builder, visiting);
  }

  private void renderComposite(Class<?> cls, Type type, StringBuilder builder, Set<Type> visiting) {
    if (!visiting.add(type)) {
      builder.append("cycle(").append(cls.getName()).append(')');
      return;
    }
    builder.append(cls.getName()).append(cls.isInterface() ? " interface{" : "{");
    for (LocalProperty property : ReflectionUtils.getProperties(cls)) {
      builder.append(property.getName()).append(',');
      render(TypeUtils.resolveMemberType(type, property.getGenericType()), builder, visiting);
      builder.append(',').append(property.getRawType().isPrimitive() ? '0' : '1').append(';');
    }
    builder.append("}provides[");
    for (Class<?> anInterface : factory.getProvidedInterfaces(cls)) {
      builder.append(anInterface.getName()).append(',');
    }
    builder.append(']');
    visiting.remove(type);
  }
}
