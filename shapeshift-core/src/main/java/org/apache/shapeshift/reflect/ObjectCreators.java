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

package org.apache.shapeshift.reflect;

import com.google.common.base.Defaults;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.shapeshift.collection.ClassValueCache;
import org.apache.shapeshift.exception.ShapeshiftException;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/**
 * Factory class for creating and caching {@link ObjectCreator} instances.
 *
 * <ul>
 *   <li><strong>Record types:</strong> {@link RecordObjectCreator} invokes the canonical
 *       constructor
 *   <li><strong>Classes with a no-arg constructor:</strong> {@link DeclaredNoArgCtrObjectCreator}
 *       constructs then sets fields
 *   <li><strong>Classes with a constructor taking every property by name:</strong> {@link
 *       NamedParameterCtrObjectCreator}, which needs classes compiled with {@code -parameters}
 * </ul>
 */
@SuppressWarnings("unchecked")
public class ObjectCreators {
  private static final ClassValueCache<ObjectCreator<?>> cache =
      ClassValueCache.newClassKeySoftCache(8);

  /**
   * Returns a cached ObjectCreator for the given type.
   *
   * @throws TypeNotSerializableException if the type can't be instantiated by any strategy
   */
  public static <T> ObjectCreator<T> getObjectCreator(Class<T> type) {
    return (ObjectCreator<T>) cache.get(type, () -> createObjectCreator(type));
  }

  private static <T> ObjectCreator<T> createObjectCreator(Class<T> type) {
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new TypeNotSerializableException(type, "Abstract types can't be instantiated");
    }
    if (type.isRecord()) {
      return new RecordObjectCreator<>(type);
    }
    try {
      return new DeclaredNoArgCtrObjectCreator<>(type, type.getDeclaredConstructor());
    } catch (NoSuchMethodException e) {
      Constructor<T> constructor = findNamedParameterConstructor(type);
      if (constructor == null) {
        throw new TypeNotSerializableException(
            type,
            "No no-arg constructor, and no constructor with a parameter named after every"
                + " property");
      }
      return new NamedParameterCtrObjectCreator<>(type, constructor);
    }
  }

  private static <T> Constructor<T> findNamedParameterConstructor(Class<T> type) {
    List<LocalProperty> properties = ReflectionUtils.getProperties(type);
    for (Constructor<?> constructor : type.getDeclaredConstructors()) {
      Parameter[] parameters = constructor.getParameters();
      if (parameters.length != properties.size()) {
        continue;
      }
      boolean matches = true;
      for (Parameter parameter : parameters) {
        matches &=
            parameter.isNamePresent()
                && properties.stream().anyMatch(p -> p.getName().equals(parameter.getName()));
      }
      if (matches) {
        return (Constructor<T>) constructor;
      }
    }
    return null;
  }

  private static MethodHandle unreflect(Class<?> type, Constructor<?> constructor) {
    try {
      constructor.setAccessible(true);
      return MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (IllegalAccessException | RuntimeException e) {
      throw new TypeNotSerializableException(
          type, "Unable to access constructor " + constructor, e);
    }
  }

  /** Arguments for {@code parameterNames} from the named values, java defaults for the rest. */
  private static Object[] arguments(
      String[] parameterNames,
      Class<?>[] parameterTypes,
      List<String> propertyNames,
      Object[] values) {
    Map<String, Object> byName = new HashMap<>();
    for (int i = 0; i < values.length; i++) {
      byName.put(propertyNames.get(i), values[i]);
    }
    Object[] arguments = new Object[parameterNames.length];
    for (int i = 0; i < parameterNames.length; i++) {
      Object value = byName.get(parameterNames[i]);
      arguments[i] = value == null ? Defaults.defaultValue(parameterTypes[i]) : value;
    }
    return arguments;
  }

  public static final class DeclaredNoArgCtrObjectCreator<T> extends ObjectCreator<T> {
    private final MethodHandle handle;
    private final Map<String, FieldAccessor> accessors = new HashMap<>();

    public DeclaredNoArgCtrObjectCreator(Class<T> type, Constructor<T> constructor) {
      super(type);
      handle = unreflect(type, constructor);
      for (LocalProperty property : ReflectionUtils.getProperties(type)) {
        accessors.put(property.getName(), property.getFieldAccessor());
      }
    }

    @Override
    public T newInstance(List<String> propertyNames, Object[] values) {
      T instance;
      try {
        instance = (T) handle.invoke();
      } catch (Throwable e) {
        throw new ShapeshiftException("Failed to create instance of " + type, e);
      }
      for (int i = 0; i < values.length; i++) {
        FieldAccessor accessor = accessors.get(propertyNames.get(i));
        // Nulls for primitive fields keep the field default.
        if (accessor != null
            && !(values[i] == null && accessor.getField().getType().isPrimitive())) {
          accessor.set(instance, values[i]);
        }
      }
      return instance;
    }
  }

  public static final class RecordObjectCreator<T> extends ObjectCreator<T> {
    private final MethodHandle handle;
    private final String[] componentNames;
    private final Class<?>[] componentTypes;

    public RecordObjectCreator(Class<T> type) {
      super(type);
      RecordComponent[] components = type.getRecordComponents();
      componentNames =
          Arrays.stream(components).map(RecordComponent::getName).toArray(String[]::new);
      componentTypes =
          Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
      try {
        handle = unreflect(type, type.getDeclaredConstructor(componentTypes));
      } catch (NoSuchMethodException e) {
        throw new TypeNotSerializableException(type, "Record has no canonical constructor", e);
      }
    }

    @Override
    public T newInstance(List<String> propertyNames, Object[] values) {
      try {
        return (T)
            handle.invokeWithArguments(
                arguments(componentNames, componentTypes, propertyNames, values));
      } catch (Throwable e) {
        throw new ShapeshiftException("Failed to create record " + type, e);
      }
    }
  }

  public static final class NamedParameterCtrObjectCreator<T> extends ObjectCreator<T> {
    private final MethodHandle handle;
    private final String[] parameterNames;
    private final Class<?>[] parameterTypes;

    public NamedParameterCtrObjectCreator(Class<T> type, Constructor<T> constructor) {
      super(type);
      handle = unreflect(type, constructor);
      parameterNames =
          Arrays.stream(constructor.getParameters()).map(Parameter::getName).toArray(String[]::new);
      parameterTypes = constructor.getParameterTypes();
    }

    @Override
    public T newInstance(List<String> propertyNames, Object[] values) {
      try {
        return (T)
            handle.invokeWithArguments(
                arguments(parameterNames, parameterTypes, propertyNames, values));
      } catch (Throwable e) {
        throw new ShapeshiftException("Failed to create instance of " + type, e);
      }
    }
  }
}
