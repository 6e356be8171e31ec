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

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.apache.shapeshift.collection.ClassValueCache;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/** Reflection helpers describing how local classes are serialized. */
public class ReflectionUtils {
  private static final ClassValueCache<List<LocalProperty>> PROPERTIES_CACHE =
      ClassValueCache.newClassKeySoftCache(8);

  /**
   * Serializable properties of {@code cls}, sorted by name. For classes these are the non static,
   * non transient fields of the class and its superclasses; for interfaces the getters.
   *
   * @throws TypeNotSerializableException if a field shadows a superclass field of the same name
   */
  public static List<LocalProperty> getProperties(Class<?> cls) {
    return PROPERTIES_CACHE.get(cls, () -> buildProperties(cls));
  }

  private static List<LocalProperty> buildProperties(Class<?> cls) {
    Map<String, LocalProperty> properties = new TreeMap<>();
    if (cls.isInterface()) {
      for (Method method : cls.getMethods()) {
        String name = getterPropertyName(method);
        if (name != null && !Modifier.isStatic(method.getModifiers())) {
          properties.putIfAbsent(name, LocalProperty.ofGetter(name, method));
        }
      }
      return ImmutableList.copyOf(properties.values());
    }
    for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field field : c.getDeclaredFields()) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers)
            || Modifier.isTransient(modifiers)
            || field.isSynthetic()) {
          continue;
        }
        LocalProperty previous =
            properties.putIfAbsent(
                field.getName(), LocalProperty.ofField(FieldAccessor.createAccessor(field)));
        if (previous != null) {
          throw new TypeNotSerializableException(
              cls, "Field " + field + " is shadowed by " + previous.getFieldAccessor().getField());
        }
      }
    }
    return ImmutableList.copyOf(properties.values());
  }

  /** Property name of a getter, or null if {@code method} isn't one. */
  public static String getterPropertyName(Method method) {
    if (method.getParameterCount() != 0 || method.getReturnType() == void.class) {
      return null;
    }
    String name = method.getName();
    String suffix = null;
    if (name.startsWith("get") && name.length() > 3) {
      suffix = name.substring(3);
    } else if (name.startsWith("is")
        && name.length() > 2
        && method.getReturnType() == boolean.class) {
      suffix = name.substring(2);
    }
    if (suffix == null || !Character.isUpperCase(suffix.charAt(0))) {
      return null;
    }
    return Character.toLowerCase(suffix.charAt(0)) + suffix.substring(1);
  }

  /**
   * The instance of a singleton class: a class exposing a {@code public static final INSTANCE}
   * field of its own type and only private constructors.
   *
   * @return the instance or null if {@code cls} isn't a singleton
   */
  public static Object getSingletonInstance(Class<?> cls) {
    if (cls.isEnum() || cls.isInterface() || cls.isArray() || cls.isPrimitive()) {
      return null;
    }
    Field field;
    try {
      field = cls.getDeclaredField("INSTANCE");
    } catch (NoSuchFieldException e) {
      return null;
    }
    int modifiers = field.getModifiers();
    if (!Modifier.isPublic(modifiers)
        || !Modifier.isStatic(modifiers)
        || !Modifier.isFinal(modifiers)
        || field.getType() != cls) {
      return null;
    }
    for (Constructor<?> constructor : cls.getDeclaredConstructors()) {
      if (!Modifier.isPrivate(constructor.getModifiers())) {
        return null;
      }
    }
    try {
      return field.get(null);
    } catch (IllegalAccessException e) {
      throw new TypeNotSerializableException(cls, "Unable to read singleton instance", e);
    }
  }

  /** All interfaces {@code cls} implements, directly or through its superclasses, by name. */
  public static List<Class<?>> getAllInterfaces(Class<?> cls) {
    Set<Class<?>> interfaces = new LinkedHashSet<>();
    for (Class<?> c = cls; c != null; c = c.getSuperclass()) {
      collectInterfaces(c, interfaces);
    }
    List<Class<?>> result = new ArrayList<>(interfaces);
    result.sort(Comparator.comparing(Class::getName));
    return result;
  }

  private static void collectInterfaces(Class<?> cls, Set<Class<?>> interfaces) {
    for (Class<?> anInterface : cls.getInterfaces()) {
      if (interfaces.add(anInterface)) {
        collectInterfaces(anInterface, interfaces);
      }
    }
  }

  /** Whether {@code cls} or any of its supertypes carries {@code annotation}. */
  public static boolean isAnnotatedInHierarchy(
      Class<?> cls, Class<? extends java.lang.annotation.Annotation> annotation) {
    for (Class<?> c = cls; c != null; c = c.getSuperclass()) {
      if (c.isAnnotationPresent(annotation)) {
        return true;
      }
    }
    for (Class<?> anInterface : getAllInterfaces(cls)) {
      if (anInterface.isAnnotationPresent(annotation)) {
        return true;
      }
    }
    return false;
  }
}
