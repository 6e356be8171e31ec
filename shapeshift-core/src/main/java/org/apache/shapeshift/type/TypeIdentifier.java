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
import com.google.common.collect.ImmutableList;
import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/**
 * Canonical, loader independent name of a type as it appears in a schema. Two identifiers are equal
 * iff their canonical names are equal.
 *
 * <p>Names follow these rules:
 *
 * <ul>
 *   <li>AMQP primitives use their wire name, e.g. {@code int}, {@code string}, {@code binary}.
 *   <li>Generic types render as {@code raw<arg1, arg2>}.
 *   <li>Arrays of objects use the {@code []} suffix, arrays of java primitives use {@code [p]}.
 *   <li>Wildcards and unresolved type variables render as {@code ?}.
 * </ul>
 */
public abstract class TypeIdentifier {
  public static final TypeIdentifier UNKNOWN = new Unknown();

  private static final String ARRAY_SUFFIX = "[]";
  private static final String PRIMITIVE_ARRAY_SUFFIX = "[p]";

  public abstract String getName();

  /** Pretty name, optionally dropping package prefixes of class names. */
  public abstract String prettyPrint(boolean simplifyClassNames);

  /**
   * Load the local type this identifier names.
   *
   * @throws ClassNotFoundException if a named class can't be found by {@code classLoader}
   */
  public abstract Type getLocalType(ClassLoader classLoader) throws ClassNotFoundException;

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof TypeIdentifier && getName().equals(((TypeIdentifier) o).getName());
  }

  @Override
  public final int hashCode() {
    return getName().hashCode();
  }

  @Override
  public String toString() {
    return "TypeIdentifier(" + getName() + ")";
  }

  public static TypeIdentifier forClass(Class<?> type) {
    String primitiveName = Types.primitiveTypeName(type);
    if (primitiveName != null) {
      return new Unparameterised(primitiveName);
    }
    if (type.isArray()) {
      Class<?> componentType = type.getComponentType();
      if (componentType.isPrimitive()) {
        return new PrimitiveArrayOf(Types.primitiveTypeName(componentType));
      }
      return new ArrayOf(forClass(componentType));
    }
    return new Unparameterised(type.getName());
  }

  public static TypeIdentifier forGenericType(Type type) {
    if (type instanceof Class) {
      return forClass((Class<?>) type);
    } else if (type instanceof ParameterizedType) {
      ParameterizedType parameterizedType = (ParameterizedType) type;
      List<TypeIdentifier> parameters = new ArrayList<>();
      for (Type argument : parameterizedType.getActualTypeArguments()) {
        parameters.add(forGenericType(argument));
      }
      return new Parameterised(((Class<?>) parameterizedType.getRawType()).getName(), parameters);
    } else if (type instanceof GenericArrayType) {
      return new ArrayOf(forGenericType(((GenericArrayType) type).getGenericComponentType()));
    } else if (type instanceof WildcardType || type instanceof TypeVariable) {
      return UNKNOWN;
    }
    throw new TypeNotSerializableException(type, "Unable to render type to a string.");
  }

  /** Parse a canonical name produced by {@link #getName()}. */
  public static TypeIdentifier parse(String name) {
    Preconditions.checkNotNull(name);
    String s = name.trim();
    if (s.isEmpty()) {
      throw new TypeNotSerializableException("Empty type name");
    }
    if (s.equals(UNKNOWN.getName())) {
      return UNKNOWN;
    }
    if (s.endsWith(PRIMITIVE_ARRAY_SUFFIX)) {
      return new PrimitiveArrayOf(s.substring(0, s.length() - PRIMITIVE_ARRAY_SUFFIX.length()));
    }
    if (s.endsWith(ARRAY_SUFFIX)) {
      return new ArrayOf(parse(s.substring(0, s.length() - ARRAY_SUFFIX.length())));
    }
    int paramsStart = s.indexOf('<');
    if (paramsStart < 0) {
      return new Unparameterised(s);
    }
    if (!s.endsWith(">") || paramsStart == 0) {
      throw new TypeNotSerializableException("Invalid type name " + name);
    }
    String rawName = s.substring(0, paramsStart).trim();
    List<TypeIdentifier> parameters = new ArrayList<>();
    for (String parameter : splitParameters(s.substring(paramsStart + 1, s.length() - 1), name)) {
      parameters.add(parse(parameter));
    }
    return new Parameterised(rawName, parameters);
  }

  private static List<String> splitParameters(String parameters, String name) {
    List<String> result = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < parameters.length(); i++) {
      char c = parameters.charAt(i);
      if (c == '<') {
        depth++;
      } else if (c == '>') {
        depth--;
        if (depth < 0) {
          throw new TypeNotSerializableException("Unbalanced type parameters in " + name);
        }
      } else if (c == ',' && depth == 0) {
        result.add(parameters.substring(start, i));
        start = i + 1;
      }
    }
    if (depth != 0) {
      throw new TypeNotSerializableException("Unbalanced type parameters in " + name);
    }
    result.add(parameters.substring(start));
    return result;
  }

  private static String simplify(String className, boolean simplifyClassNames) {
    if (!simplifyClassNames) {
      return className;
    }
    return className.substring(className.lastIndexOf('.') + 1);
  }

  /** A wildcard or an unresolved type variable. */
  public static final class Unknown extends TypeIdentifier {
    private Unknown() {}

    @Override
    public String getName() {
      return "?";
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return getName();
    }

    @Override
    public Type getLocalType(ClassLoader classLoader) {
      return AnyType.INSTANCE;
    }
  }

  /** A primitive, or a class without type parameters. */
  public static final class Unparameterised extends TypeIdentifier {
    private final String name;

    public Unparameterised(String name) {
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return simplify(name, simplifyClassNames);
    }

    @Override
    public Type getLocalType(ClassLoader classLoader) throws ClassNotFoundException {
      Class<?> primitiveType = Types.primitiveType(name);
      if (primitiveType != null) {
        return primitiveType;
      }
      return Class.forName(name, false, classLoader);
    }
  }

  public static final class Parameterised extends TypeIdentifier {
    private final String rawName;
    private final List<TypeIdentifier> parameters;
    private final String name;

    public Parameterised(String rawName, List<TypeIdentifier> parameters) {
      this.rawName = rawName;
      this.parameters = ImmutableList.copyOf(parameters);
      this.name =
          rawName
              + parameters.stream()
                  .map(TypeIdentifier::getName)
                  .collect(Collectors.joining(", ", "<", ">"));
    }

    public String getRawName() {
      return rawName;
    }

    public List<TypeIdentifier> getParameters() {
      return parameters;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return simplify(rawName, simplifyClassNames)
          + parameters.stream()
              .map(p -> p.prettyPrint(simplifyClassNames))
              .collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public Type getLocalType(ClassLoader classLoader) throws ClassNotFoundException {
      Class<?> rawType = Class.forName(rawName, false, classLoader);
      // Synthesized classes carry no type parameters, so only the raw type can be used.
      if (rawType.getTypeParameters().length != parameters.size()) {
        return rawType;
      }
      Type[] arguments = new Type[parameters.size()];
      for (int i = 0; i < arguments.length; i++) {
        arguments[i] = parameters.get(i).getLocalType(classLoader);
      }
      return DeserializedParameterizedType.make(rawType, arguments);
    }
  }

  public static final class ArrayOf extends TypeIdentifier {
    private final TypeIdentifier componentType;

    public ArrayOf(TypeIdentifier componentType) {
      this.componentType = componentType;
    }

    public TypeIdentifier getComponentType() {
      return componentType;
    }

    @Override
    public String getName() {
      return componentType.getName() + ARRAY_SUFFIX;
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return componentType.prettyPrint(simplifyClassNames) + ARRAY_SUFFIX;
    }

    @Override
    public Type getLocalType(ClassLoader classLoader) throws ClassNotFoundException {
      Type component = componentType.getLocalType(classLoader);
      if (component instanceof Class) {
        return Array.newInstance((Class<?>) component, 0).getClass();
      }
      return new DeserializedGenericArrayType(component);
    }
  }

  /** Array of java primitives, e.g. {@code int[p]} for {@code int[]}. */
  public static final class PrimitiveArrayOf extends TypeIdentifier {
    private final String primitiveName;

    public PrimitiveArrayOf(String primitiveName) {
      this.primitiveName = primitiveName;
    }

    public String getPrimitiveName() {
      return primitiveName;
    }

    @Override
    public String getName() {
      return primitiveName + PRIMITIVE_ARRAY_SUFFIX;
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return getName();
    }

    @Override
    public Type getLocalType(ClassLoader classLoader) {
      Class<?> arrayType = Types.primitiveArrayType(primitiveName);
      if (arrayType == null) {
        throw new TypeNotSerializableException("Not able to deserialize array type: " + getName());
      }
      return arrayType;
    }
  }
}
