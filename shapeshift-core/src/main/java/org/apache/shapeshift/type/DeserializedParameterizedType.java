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

package org.apache.shapeshift.type;

import com.google.common.base.Preconditions;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A {@link ParameterizedType} built from a schema name. Equality and hash code follow the JDK
 * implementation so instances can be mixed with reflected types as cache keys.
 */
public final class DeserializedParameterizedType implements ParameterizedType {
  private final Class<?> rawType;
  private final Type[] arguments;
  private final Type ownerType;

  public DeserializedParameterizedType(Class<?> rawType, Type[] arguments) {
    Preconditions.checkArgument(
        rawType.getTypeParameters().length == arguments.length,
        "Expected %s type arguments for %s but got %s",
        rawType.getTypeParameters().length,
        rawType.getName(),
        arguments.length);
    this.rawType = rawType;
    this.arguments = arguments.clone();
    this.ownerType = rawType.getDeclaringClass();
  }

  public static ParameterizedType make(Class<?> rawType, Type... arguments) {
    return new DeserializedParameterizedType(rawType, arguments);
  }

  @Override
  public Type[] getActualTypeArguments() {
    return arguments.clone();
  }

  @Override
  public Type getRawType() {
    return rawType;
  }

  @Override
  public Type getOwnerType() {
    return ownerType;
  }

  @Override
  public String getTypeName() {
    return rawType.getName()
        + Arrays.stream(arguments)
            .map(Type::getTypeName)
            .collect(Collectors.joining(", ", "<", ">"));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParameterizedType)) {
      return false;
    }
    ParameterizedType that = (ParameterizedType) o;
    return Objects.equals(ownerType, that.getOwnerType())
        && Objects.equals(rawType, that.getRawType())
        && Arrays.equals(arguments, that.getActualTypeArguments());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(arguments) ^ Objects.hashCode(ownerType) ^ Objects.hashCode(rawType);
  }

  @Override
  public String toString() {
    return getTypeName();
  }
}
