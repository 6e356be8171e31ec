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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import org.apache.shapeshift.exception.ShapeshiftException;

/**
 * A serializable property of a local type: a field of a class, or a getter of an interface. The
 * {@link #getGenericType() type} is as declared, unresolved against any parameterization.
 */
public final class LocalProperty {
  private final String name;
  private final Type genericType;
  private final Class<?> rawType;
  private final FieldAccessor fieldAccessor;
  private final Method getter;

  private LocalProperty(
      String name, Type genericType, Class<?> rawType, FieldAccessor accessor, Method getter) {
    this.name = name;
    this.genericType = genericType;
    this.rawType = rawType;
    this.fieldAccessor = accessor;
    this.getter = getter;
  }

  static LocalProperty ofField(FieldAccessor accessor) {
    return new LocalProperty(
        accessor.getField().getName(),
        accessor.getField().getGenericType(),
        accessor.getField().getType(),
        accessor,
        null);
  }

  static LocalProperty ofGetter(String name, Method getter) {
    return new LocalProperty(
        name, getter.getGenericReturnType(), getter.getReturnType(), null, getter);
  }

  public String getName() {
    return name;
  }

  public Type getGenericType() {
    return genericType;
  }

  public Class<?> getRawType() {
    return rawType;
  }

  /** The field accessor, null for interface getters. */
  public FieldAccessor getFieldAccessor() {
    return fieldAccessor;
  }

  public Object get(Object target) {
    if (fieldAccessor != null) {
      return fieldAccessor.get(target);
    }
    try {
      return getter.invoke(target);
    } catch (IllegalAccessException | InvocationTargetException e) {
      throw new ShapeshiftException("Unable to read property " + name + " of " + target, e);
    }
  }

  @Override
  public String toString() {
    return name + ": " + genericType.getTypeName();
  }
}
