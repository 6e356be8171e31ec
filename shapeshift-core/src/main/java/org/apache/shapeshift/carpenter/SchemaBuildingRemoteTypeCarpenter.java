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

package org.apache.shapeshift.carpenter;

import com.google.common.primitives.Primitives;
import java.lang.reflect.Array;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.shapeshift.model.RemotePropertyInformation;
import org.apache.shapeshift.model.RemoteTypeInformation;
import org.apache.shapeshift.type.TypeIdentifier;
import org.apache.shapeshift.type.TypeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carpents composites, interfaces and enums by turning them into {@link CarpenterSchema}s for a
 * {@link TypeSynthesizer}. Arrays are built from their carpented component type.
 */
public class SchemaBuildingRemoteTypeCarpenter implements RemoteTypeCarpenter {
  private static final Logger LOG =
      LoggerFactory.getLogger(SchemaBuildingRemoteTypeCarpenter.class);

  private final TypeSynthesizer synthesizer;

  public SchemaBuildingRemoteTypeCarpenter(TypeSynthesizer synthesizer) {
    this.synthesizer = synthesizer;
  }

  @Override
  public ClassLoader getClassLoader() {
    return synthesizer.getClassLoader();
  }

  @Override
  public boolean isCarpented(Class<?> cls) {
    return synthesizer.isSynthesized(cls);
  }

  @Override
  public Type carpent(RemoteTypeInformation typeInformation) {
    LOG.debug("Carpenting {}", typeInformation.prettyPrint(false));
    if (typeInformation instanceof RemoteTypeInformation.Composable) {
      RemoteTypeInformation.Composable composable =
          (RemoteTypeInformation.Composable) typeInformation;
      String name = className(composable.getTypeIdentifier());
      Class<?> existing = tryLoad(name);
      if (existing != null) {
        // Another parameterization of the same raw type was carpented already.
        return existing;
      }
      return synthesizer.synthesize(
          new CarpenterSchema.ClassSchema(
              name,
              fields(composable.getTypeIdentifier(), composable.getProperties()),
              interfaces(composable.getInterfaces())));
    } else if (typeInformation instanceof RemoteTypeInformation.AnInterface) {
      RemoteTypeInformation.AnInterface anInterface =
          (RemoteTypeInformation.AnInterface) typeInformation;
      String name = className(anInterface.getTypeIdentifier());
      Class<?> existing = tryLoad(name);
      if (existing != null) {
        return existing;
      }
      return synthesizer.synthesize(
          new CarpenterSchema.InterfaceSchema(
              name,
              fields(anInterface.getTypeIdentifier(), anInterface.getProperties()),
              interfaces(anInterface.getInterfaces())));
    } else if (typeInformation instanceof RemoteTypeInformation.AnEnum) {
      RemoteTypeInformation.AnEnum anEnum = (RemoteTypeInformation.AnEnum) typeInformation;
      return synthesizer.synthesize(
          new CarpenterSchema.EnumSchema(
              className(anEnum.getTypeIdentifier()), anEnum.getMembers()));
    } else if (typeInformation instanceof RemoteTypeInformation.AnArray) {
      Class<?> component =
          resolve(((RemoteTypeInformation.AnArray) typeInformation).getComponentType(), false);
      return Array.newInstance(component, 0).getClass();
    }
    throw new UncarpentableException("Cannot carpent " + typeInformation.prettyPrint(false));
  }

  private static String className(TypeIdentifier identifier) {
    if (identifier instanceof TypeIdentifier.Parameterised) {
      return ((TypeIdentifier.Parameterised) identifier).getRawName();
    }
    return identifier.getName();
  }

  private Class<?> tryLoad(String name) {
    try {
      return Class.forName(name, false, getClassLoader());
    } catch (ClassNotFoundException e) {
      return null;
    }
  }

  private List<CarpenterField> fields(
      TypeIdentifier owner, Map<String, RemotePropertyInformation> properties) {
    List<CarpenterField> fields = new ArrayList<>();
    for (Map.Entry<String, RemotePropertyInformation> entry : properties.entrySet()) {
      RemotePropertyInformation property = entry.getValue();
      if (property.getType().getTypeIdentifier().equals(owner)) {
        fields.add(CarpenterField.selfReference(entry.getKey()));
      } else {
        fields.add(
            CarpenterField.of(entry.getKey(), resolve(property.getType(), property.isMandatory())));
      }
    }
    return fields;
  }

  private List<Class<?>> interfaces(List<RemoteTypeInformation> interfaces) {
    List<Class<?>> result = new ArrayList<>();
    for (RemoteTypeInformation anInterface : interfaces) {
      result.add(resolve(anInterface, false));
    }
    return result;
  }

  /** Erased local class of a type the carpented type depends on. */
  private Class<?> resolve(RemoteTypeInformation type, boolean mandatory) {
    Type localType;
    try {
      localType = type.getTypeIdentifier().getLocalType(getClassLoader());
    } catch (ClassNotFoundException e) {
      throw new UncarpentableException(
          "Type " + type.prettyPrint(false) + " can't be resolved for carpentry", e);
    }
    Class<?> cls = TypeUtils.asClass(localType);
    if (mandatory && Primitives.isWrapperType(cls) && cls != Void.class) {
      return Primitives.unwrap(cls);
    }
    return cls;
  }
}
