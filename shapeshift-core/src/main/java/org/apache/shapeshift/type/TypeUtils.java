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

import com.google.common.reflect.TypeToken;
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/** Helpers for working with reflected and deserialized {@link Type}s. */
public class TypeUtils {

  /** Erase {@code type} to the class used to instantiate or check values of it. */
  public static Class<?> asClass(Type type) {
    if (type instanceof Class) {
      return (Class<?>) type;
    } else if (type instanceof ParameterizedType) {
      return (Class<?>) ((ParameterizedType) type).getRawType();
    } else if (type instanceof GenericArrayType) {
      Class<?> component = asClass(((GenericArrayType) type).getGenericComponentType());
      return Array.newInstance(component, 0).getClass();
    } else if (type instanceof TypeVariable) {
      Type[] bounds = ((TypeVariable<?>) type).getBounds();
      return bounds.length == 0 ? Object.class : asClass(bounds[0]);
    } else if (type instanceof WildcardType) {
      Type[] bounds = ((WildcardType) type).getUpperBounds();
      return bounds.length == 0 ? Object.class : asClass(bounds[0]);
    }
    throw new TypeNotSerializableException(type, "Cannot erase type to a class");
  }

  public static boolean isArray(Type type) {
    return type instanceof GenericArrayType
        || (type instanceof Class && ((Class<?>) type).isArray());
  }

  public static Type componentType(Type type) {
    if (type instanceof GenericArrayType) {
      return ((GenericArrayType) type).getGenericComponentType();
    } else if (type instanceof Class && ((Class<?>) type).isArray()) {
      return ((Class<?>) type).getComponentType();
    }
    throw new TypeNotSerializableException(type, "Not an array type");
  }

  /** Whether {@code type} is a wildcard or a type variable. */
  public static boolean isUnknown(Type type) {
    return type instanceof WildcardType || type instanceof TypeVariable;
  }

  public static String nameForType(Type type) {
    return TypeIdentifier.forGenericType(type).getName();
  }

  /**
   * Resolve {@code memberType} declared in the class of {@code ownerType} against the concrete
   * parameterization of the owner. Unresolvable variables are kept as they are.
   */
  public static Type resolveMemberType(Type ownerType, Type memberType) {
    if (!(ownerType instanceof ParameterizedType)) {
      return memberType;
    }
    return TypeToken.of(ownerType).resolveType(memberType).getType();
  }

  /**
   * Infer the parameterization of {@code actualClass} from a declared type, e.g. an {@code
   * ArrayList} declared as {@code List<String>} becomes {@code ArrayList<String>}. Falls back to
   * {@code actualClass} when nothing can be inferred.
   */
  public static Type inferTypeVariables(
      Class<?> actualClass, Class<?> declaredClass, Type declaredType) {
    if (declaredType instanceof ParameterizedType) {
      if (actualClass == declaredClass) {
        return declaredType;
      }
      if (actualClass.getTypeParameters().length == 0
          || !declaredClass.isAssignableFrom(actualClass)) {
        return actualClass;
      }
      try {
        return TypeToken.of(declaredType).getSubtype(actualClass).getType();
      } catch (IllegalArgumentException e) {
        // Type arguments of the declared type can't be mapped onto the subclass.
        return actualClass;
      }
    } else if (declaredType instanceof GenericArrayType && actualClass.isArray()) {
      return actualClass.getComponentType().isPrimitive() ? actualClass : declaredType;
    }
    return actualClass;
  }

  /**
   * Argument {@code index} of {@code superClass} as seen from {@code type}, e.g. the element type
   * of a collection. Unknown arguments are returned as {@link AnyType}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static Type supertypeArgument(Type type, Class<?> superClass, int index) {
    TypeToken<?> token = TypeToken.of(type);
    if (!superClass.isAssignableFrom(token.getRawType())) {
      return AnyType.INSTANCE;
    }
    Type supertype = token.getSupertype((Class) superClass).getType();
    if (!(supertype instanceof ParameterizedType)) {
      return AnyType.INSTANCE;
    }
    Type argument = ((ParameterizedType) supertype).getActualTypeArguments()[index];
    return isUnknown(argument) ? AnyType.INSTANCE : argument;
  }
}
