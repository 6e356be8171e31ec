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

package org.apache.shapeshift.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.Field;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.type.TypeIdentifier;

/**
 * Interprets the notations of a schema into {@link RemoteTypeInformation}. A composite notation is
 * an interface iff another notation in the same schema names it in its {@code provides} list.
 * References to a type that is still being interpreted become {@link RemoteTypeInformation.Cycle}.
 */
public class RemoteTypeInterpreter {
  private final Map<String, TypeNotation> notationsByName = new HashMap<>();
  private final Set<String> interfaceNames = new HashSet<>();
  private final Map<TypeIdentifier, RemoteTypeInformation> interpreted = new HashMap<>();
  private final Set<TypeIdentifier> inProgress = new HashSet<>();

  private RemoteTypeInterpreter(List<TypeNotation> notations) {
    for (TypeNotation notation : notations) {
      notationsByName.put(notation.getName(), notation);
      interfaceNames.addAll(notation.getProvides());
    }
  }

  /** Interpret every notation, returning the results keyed by notation name in input order. */
  public static Map<String, RemoteTypeInformation> interpret(List<TypeNotation> notations) {
    RemoteTypeInterpreter interpreter = new RemoteTypeInterpreter(notations);
    Map<String, RemoteTypeInformation> result = new LinkedHashMap<>();
    for (TypeNotation notation : notations) {
      result.put(notation.getName(), interpreter.interpret(notation));
    }
    return result;
  }

  private RemoteTypeInformation interpret(TypeNotation notation) {
    TypeIdentifier identifier = TypeIdentifier.parse(notation.getName());
    String descriptor = String.valueOf(notation.getDescriptorElement().getName());
    RemoteTypeInformation existing = interpreted.get(identifier);
    if (existing != null) {
      return existing;
    }
    if (inProgress.contains(identifier)) {
      return new RemoteTypeInformation.Cycle(
          descriptor, identifier, () -> interpreted.get(identifier));
    }
    inProgress.add(identifier);
    try {
      RemoteTypeInformation result;
      if (notation instanceof CompositeType) {
        result = interpretComposite((CompositeType) notation, descriptor, identifier);
      } else {
        result = interpretRestricted((RestrictedType) notation, descriptor, identifier);
      }
      interpreted.put(identifier, result);
      return result;
    } finally {
      inProgress.remove(identifier);
    }
  }

  private RemoteTypeInformation interpretComposite(
      CompositeType notation, String descriptor, TypeIdentifier identifier) {
    Map<String, RemotePropertyInformation> properties = new LinkedHashMap<>();
    for (Field field : notation.getFields()) {
      properties.put(
          field.getName(),
          new RemotePropertyInformation(
              interpretIdentifier(TypeIdentifier.parse(field.getType())), field.isMandatory()));
    }
    List<RemoteTypeInformation> interfaces = interpretNames(notation.getProvides());
    List<RemoteTypeInformation> typeParameters = interpretTypeParameters(identifier);
    if (interfaceNames.contains(notation.getName())) {
      return new RemoteTypeInformation.AnInterface(
          descriptor, identifier, properties, interfaces, typeParameters);
    }
    return new RemoteTypeInformation.Composable(
        descriptor, identifier, properties, interfaces, typeParameters);
  }

  private RemoteTypeInformation interpretRestricted(
      RestrictedType notation, String descriptor, TypeIdentifier identifier) {
    if (!notation.getChoices().isEmpty()) {
      List<String> members = new ArrayList<>();
      notation.getChoices().forEach(choice -> members.add(choice.getName()));
      return new RemoteTypeInformation.AnEnum(
          descriptor, identifier, members, interpretNames(notation.getProvides()));
    }
    return interpretStructure(descriptor, identifier);
  }

  private RemoteTypeInformation interpretIdentifier(TypeIdentifier identifier) {
    TypeNotation notation = notationsByName.get(identifier.getName());
    if (notation != null) {
      return interpret(notation);
    }
    if (identifier instanceof TypeIdentifier.Unknown) {
      return RemoteTypeInformation.Unknown.INSTANCE;
    }
    return interpretStructure("", identifier);
  }

  private RemoteTypeInformation interpretStructure(String descriptor, TypeIdentifier identifier) {
    if (identifier instanceof TypeIdentifier.ArrayOf) {
      return new RemoteTypeInformation.AnArray(
          descriptor,
          identifier,
          interpretIdentifier(((TypeIdentifier.ArrayOf) identifier).getComponentType()));
    } else if (identifier instanceof TypeIdentifier.PrimitiveArrayOf) {
      TypeIdentifier component =
          new TypeIdentifier.Unparameterised(
              ((TypeIdentifier.PrimitiveArrayOf) identifier).getPrimitiveName());
      return new RemoteTypeInformation.AnArray(
          descriptor, identifier, new RemoteTypeInformation.Unparameterised("", component));
    } else if (identifier instanceof TypeIdentifier.Parameterised) {
      return new RemoteTypeInformation.Parameterised(
          descriptor, identifier, interpretTypeParameters(identifier));
    }
    return new RemoteTypeInformation.Unparameterised(descriptor, identifier);
  }

  private List<RemoteTypeInformation> interpretTypeParameters(TypeIdentifier identifier) {
    if (!(identifier instanceof TypeIdentifier.Parameterised)) {
      return Collections.emptyList();
    }
    List<RemoteTypeInformation> result = new ArrayList<>();
    for (TypeIdentifier parameter : ((TypeIdentifier.Parameterised) identifier).getParameters()) {
      result.add(interpretIdentifier(parameter));
    }
    return result;
  }

  private List<RemoteTypeInformation> interpretNames(List<String> names) {
    List<RemoteTypeInformation> result = new ArrayList<>();
    for (String name : names) {
      result.add(interpretIdentifier(TypeIdentifier.parse(name)));
    }
    return result;
  }
}
