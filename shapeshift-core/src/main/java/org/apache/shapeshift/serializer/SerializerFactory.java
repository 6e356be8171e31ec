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

import com.google.common.base.Preconditions;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.shapeshift.annotation.ShapeshiftSerializable;
import org.apache.shapeshift.carpenter.RemoteTypeCarpenter;
import org.apache.shapeshift.exception.InsecureException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.reflect.ReflectionUtils;
import org.apache.shapeshift.resolver.CachingRemoteTypeResolver;
import org.apache.shapeshift.resolver.ClassWhitelist;
import org.apache.shapeshift.resolver.RemoteType;
import org.apache.shapeshift.resolver.RemoteTypeResolver;
import org.apache.shapeshift.serializer.collection.CollectionSerializer;
import org.apache.shapeshift.serializer.collection.MapSerializer;
import org.apache.shapeshift.serializer.custom.CustomSerializer;
import org.apache.shapeshift.serializer.custom.ExternalCustomSerializer;
import org.apache.shapeshift.serializer.evolution.EvolutionSerializerProvider;
import org.apache.shapeshift.serializer.struct.FingerPrinter;
import org.apache.shapeshift.type.TypeUtils;
import org.apache.shapeshift.type.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, caches and looks up serializers.
 *
 * <p>On the encode path serializers are found by the runtime class and declared type of a value;
 * on the decode path by the descriptor written before the value. A descriptor missing from the
 * cache makes the factory resolve the whole schema that came with the payload, carpenting types
 * that don't exist locally and installing evolution serializers where the sender's shape of a type
 * differs from the local one.
 *
 * <p>Every cache is safe for concurrent use, and at most one serializer is ever published per type
 * and per descriptor.
 */
@ThreadSafe
@SuppressWarnings("unchecked")
public class SerializerFactory {
  private static final Logger LOG = LoggerFactory.getLogger(SerializerFactory.class);

  public static final String DESCRIPTOR_DOMAIN = "org.apache.shapeshift";

  private final ClassWhitelist whitelist;
  private final RemoteTypeCarpenter classCarpenter;
  private final EvolutionSerializerProvider evolutionSerializerProvider;
  private final boolean onlyCustomSerializers;
  private final FingerPrinter fingerPrinter;
  private final RemoteTypeResolver remoteTypeResolver;

  private final ConcurrentMap<Type, Serializer<?>> serializersByType = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Serializer<?>> serializersByDescriptor =
      new ConcurrentHashMap<>();
  private final List<Serializer<?>> customSerializers = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<CustomSerializersCacheKey, Optional<Serializer<?>>>
      customSerializersCache = new ConcurrentHashMap<>();

  public SerializerFactory(
      ClassWhitelist whitelist,
      RemoteTypeCarpenter classCarpenter,
      EvolutionSerializerProvider evolutionSerializerProvider,
      Function<SerializerFactory, FingerPrinter> fingerPrinterConstructor,
      boolean onlyCustomSerializers) {
    this.whitelist = Preconditions.checkNotNull(whitelist);
    this.classCarpenter = Preconditions.checkNotNull(classCarpenter);
    this.evolutionSerializerProvider = Preconditions.checkNotNull(evolutionSerializerProvider);
    this.onlyCustomSerializers = onlyCustomSerializers;
    this.fingerPrinter = fingerPrinterConstructor.apply(this);
    this.remoteTypeResolver =
        new CachingRemoteTypeResolver(classCarpenter, fingerPrinter, DESCRIPTOR_DOMAIN);
  }

  /** Descriptor symbol for a fingerprint. */
  public static Symbol descriptorFor(String fingerprint) {
    return Symbol.valueOf(DESCRIPTOR_DOMAIN + ":" + fingerprint);
  }

  /** Descriptor symbol for the fingerprint of {@code type}. */
  public Symbol descriptorForType(Type type) {
    return descriptorFor(fingerPrinter.fingerprint(type));
  }

  public FingerPrinter getFingerPrinter() {
    return fingerPrinter;
  }

  public RemoteTypeCarpenter getClassCarpenter() {
    return classCarpenter;
  }

  public ClassLoader getClassLoader() {
    return classCarpenter.getClassLoader();
  }

  public ClassWhitelist getWhitelist() {
    return whitelist;
  }

  public RemoteTypeResolver getRemoteTypeResolver() {
    return remoteTypeResolver;
  }

  public boolean isOnlyCustomSerializers() {
    return onlyCustomSerializers;
  }

  /**
   * Look up, or create, the serializer for a value of {@code actualClass} declared as {@code
   * declaredType}.
   *
   * @param actualClass runtime class of the value, null when only the declared type is known
   * @throws TypeNotSerializableException if the type can't be serialized
   * @throws InsecureException if the type isn't whitelisted
   */
  public Serializer<Object> get(Class<?> actualClass, Type declaredType) {
    Preconditions.checkNotNull(declaredType);
    LOG.trace(
        "action=\"get serializer\", actualClass=\"{}\", declaredType=\"{}\"",
        actualClass,
        declaredType);
    Class<?> declaredClass = TypeUtils.asClass(declaredType);
    Class<?> effectiveClass = actualClass == null ? declaredClass : actualClass;
    Type actualType =
        actualClass == null
            ? declaredType
            : TypeUtils.inferTypeVariables(actualClass, declaredClass, declaredType);
    Serializer<?> serializer;
    if (Collection.class.isAssignableFrom(effectiveClass)
        && !EnumSet.class.isAssignableFrom(effectiveClass)) {
      Type amended =
          CollectionSerializer.deriveParameterizedType(declaredType, declaredClass, actualClass);
      serializer =
          serializersByType.computeIfAbsent(amended, t -> new CollectionSerializer(amended, this));
    } else if (Map.class.isAssignableFrom(effectiveClass)) {
      if (Map.class.isAssignableFrom(declaredClass)) {
        MapSerializer.checkSupportedMapType(declaredClass);
      }
      if (actualClass != null) {
        MapSerializer.checkSupportedMapType(actualClass);
      }
      Type amended =
          MapSerializer.deriveParameterizedType(declaredType, declaredClass, actualClass);
      serializer =
          serializersByType.computeIfAbsent(amended, t -> new MapSerializer(amended, this));
    } else if (Enum.class.isAssignableFrom(effectiveClass)) {
      // Constants with bodies are anonymous subclasses of the enum.
      Class<?> enumClass =
          effectiveClass.isEnum() ? effectiveClass : effectiveClass.getSuperclass();
      serializer =
          serializersByType.computeIfAbsent(
              enumClass,
              t -> {
                requireWhitelisted(enumClass);
                return new EnumSerializer(enumClass, this);
              });
    } else {
      serializer = makeClassSerializer(effectiveClass, actualType, declaredType);
    }
    serializersByDescriptor.putIfAbsent(serializer.getTypeDescriptor().toString(), serializer);
    return (Serializer<Object>) serializer;
  }

  /**
   * Look up the serializer for values written with {@code typeDescriptor}, resolving {@code schema}
   * if the descriptor isn't known yet.
   *
   * @throws TypeNotSerializableException if the schema doesn't define the descriptor, or a type in
   *     it can neither be located nor carpented
   */
  public Serializer<Object> get(Object typeDescriptor, Schema schema) {
    String key = String.valueOf(typeDescriptor);
    Serializer<?> serializer = serializersByDescriptor.get(key);
    if (serializer == null) {
      LOG.trace("action=\"resolve schema\", descriptor=\"{}\"", key);
      processSchema(schema);
      serializer = serializersByDescriptor.get(key);
      if (serializer == null) {
        throw new TypeNotSerializableException(
            "Could not find type matching descriptor " + key + ".");
      }
    }
    return (Serializer<Object>) serializer;
  }

  private void processSchema(Schema schema) {
    for (RemoteType remoteType : remoteTypeResolver.resolveTypes(schema.getTypes())) {
      LOG.trace("action=\"process remote type\", remoteType=\"{}\"", remoteType);
      Serializer<?> serializer = processRemoteType(remoteType);
      if (serializer == null) {
        continue;
      }
      if (remoteType.isDescriptorMismatch()) {
        LOG.trace(
            "typeNotation=\"{}\" action=\"descriptor mismatch, may require evolution\"",
            remoteType.getNotation().getName());
        Serializer<?> maybeEvolved =
            evolutionSerializerProvider.getEvolutionSerializer(
                this, remoteType, serializer, schema);
        if (maybeEvolved != serializer) {
          LOG.info(
              "typeNotation=\"{}\" action=\"required evolution to {}\"",
              remoteType.getNotation().getName(),
              maybeEvolved);
        }
        serializersByDescriptor.putIfAbsent(
            remoteType.getRemoteDescriptor().toString(), maybeEvolved);
      }
    }
  }

  private Serializer<?> processRemoteType(RemoteType remoteType) {
    if (remoteType.getNotation() instanceof CompositeType) {
      Class<?> cls = TypeUtils.asClass(remoteType.getType());
      if (cls.isInterface()) {
        LOG.trace("Skipping interface {}, no value can be of it", cls.getName());
        return null;
      }
      return get(cls, remoteType.getType());
    } else if (remoteType.getNotation() instanceof RestrictedType) {
      return get(null, remoteType.getType());
    }
    throw new TypeNotSerializableException(
        remoteType.getType(), "Unknown type notation " + remoteType.getNotation());
  }

  private Serializer<?> makeClassSerializer(Class<?> clazz, Type type, Type declaredType) {
    return serializersByType.computeIfAbsent(
        type,
        t -> {
          if (clazz.isSynthetic() || clazz.isAnonymousClass()) {
            throw new TypeNotSerializableException(
                type, "Serializer does not support synthetic or anonymous classes");
          }
          if (Types.isPrimitive(clazz)) {
            return new PrimitiveSerializer(clazz);
          }
          Serializer<?> customSerializer = findCustomSerializer(clazz, declaredType);
          if (customSerializer != null) {
            return customSerializer;
          }
          if (onlyCustomSerializers) {
            throw new TypeNotSerializableException(type, "Only allowing custom serializers");
          }
          if (TypeUtils.isArray(type)) {
            Type componentType = TypeUtils.componentType(type);
            if (componentType instanceof Class && ((Class<?>) componentType).isPrimitive()) {
              return new ArraySerializers.PrimitiveArraySerializer(type, this);
            }
            return new ArraySerializers.ObjectArraySerializer(type, this);
          }
          Object singleton = ReflectionUtils.getSingletonInstance(clazz);
          if (singleton != null) {
            requireWhitelisted(clazz);
            return new SingletonSerializer(clazz, singleton, this);
          }
          requireWhitelisted(type);
          return new ObjectSerializer<>(type, this);
        });
  }

  /**
   * The registered custom serializer for {@code clazz} declared as {@code declaredType}, or null.
   * The first registered serializer claiming the class wins; a serializer that also claims the
   * declared type's superclass and reveals subclasses is wrapped to write the subclass name.
   */
  public Serializer<?> findCustomSerializer(Class<?> clazz, Type declaredType) {
    return customSerializersCache
        .computeIfAbsent(
            new CustomSerializersCacheKey(clazz, declaredType), this::doFindCustomSerializer)
        .orElse(null);
  }

  private Optional<Serializer<?>> doFindCustomSerializer(CustomSerializersCacheKey key) {
    for (Serializer<?> serializer : customSerializers) {
      SerializerFor customSerializer = (SerializerFor) serializer;
      if (customSerializer.isSerializerFor(key.clazz)) {
        Class<?> declaredSuperClass = TypeUtils.asClass(key.declaredType).getSuperclass();
        if (declaredSuperClass == null
            || !customSerializer.isSerializerFor(declaredSuperClass)
            || !customSerializer.revealSubclassesInSchema()) {
          LOG.debug("action=\"Using custom serializer\", class={}", key.clazz.getName());
          return Optional.of(serializer);
        }
        LOG.debug("action=\"Using custom serializer for subclass\", class={}", key.clazz.getName());
        return Optional.of(
            new CustomSerializer.SubClass<>(key.clazz, (CustomSerializer<Object>) serializer));
      }
    }
    return Optional.empty();
  }

  /**
   * Register a custom serializer and its additional serializers. Registering a serializer whose
   * descriptor is already registered has no effect.
   */
  public void register(CustomSerializer<?> customSerializer) {
    if (registerCustomSerializer(customSerializer)) {
      for (CustomSerializer<?> additional : customSerializer.getAdditionalSerializers()) {
        register(additional);
      }
    }
  }

  /** Register a serializer wrapping a user supplied proxy serializer. */
  public void registerExternal(ExternalCustomSerializer<?, ?> customSerializer) {
    registerCustomSerializer(customSerializer);
  }

  private boolean registerCustomSerializer(Serializer<?> customSerializer) {
    LOG.trace(
        "action=\"Registering custom serializer\", class=\"{}\"", customSerializer.getType());
    Serializer<?> existing =
        serializersByDescriptor.putIfAbsent(
            customSerializer.getTypeDescriptor().toString(), customSerializer);
    if (existing == null) {
      customSerializers.add(customSerializer);
      return true;
    }
    if (existing != customSerializer) {
      LOG.warn(
          "Ignoring custom serializer {}: descriptor {} is already registered to {}, its"
              + " additional serializers are ignored too",
          customSerializer,
          customSerializer.getTypeDescriptor(),
          existing);
    }
    return false;
  }

  /**
   * Whether values of {@code cls} may be serialized: it is whitelisted, annotated with {@link
   * ShapeshiftSerializable} on itself or a supertype, or carpented.
   */
  public boolean isWhitelisted(Class<?> cls) {
    return whitelist.hasListed(cls)
        || ReflectionUtils.isAnnotatedInHierarchy(cls, ShapeshiftSerializable.class)
        || classCarpenter.isCarpented(cls);
  }

  private void requireWhitelisted(Type type) {
    Class<?> cls = TypeUtils.asClass(type);
    if (!isWhitelisted(cls)) {
      throw new InsecureException(
          String.format(
              "Class \"%s\" is not on the whitelist or annotated with @%s.",
              type.getTypeName(), ShapeshiftSerializable.class.getSimpleName()));
    }
  }

  /**
   * Interfaces of {@code cls} written into its schema notation, sorted by name: the whitelisted
   * ones outside the {@code java.} packages.
   */
  public List<Class<?>> getProvidedInterfaces(Class<?> cls) {
    List<Class<?>> interfaces = new ArrayList<>();
    for (Class<?> anInterface : ReflectionUtils.getAllInterfaces(cls)) {
      if (!anInterface.getName().startsWith("java.") && isWhitelisted(anInterface)) {
        interfaces.add(anInterface);
      }
    }
    return interfaces;
  }

  private static final class CustomSerializersCacheKey {
    private final Class<?> clazz;
    private final Type declaredType;

    CustomSerializersCacheKey(Class<?> clazz, Type declaredType) {
      this.clazz = clazz;
      this.declaredType = declaredType;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof CustomSerializersCacheKey)) {
        return false;
      }
      CustomSerializersCacheKey that = (CustomSerializersCacheKey) o;
      return clazz.equals(that.clazz) && declaredType.equals(that.declaredType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(clazz, declaredType);
    }
  }
}
