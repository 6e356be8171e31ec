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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.shapeshift.type.TypeIdentifier;

/**
 * What a remote schema tells us about a type, independent of whether the type exists locally.
 * Equality is by {@link #getTypeDescriptor() descriptor} and {@link #getTypeIdentifier()
 * identifier} only, so a {@link Cycle} equals the type it refers to.
 */
public abstract class RemoteTypeInformation {
  private final String typeDescriptor;
  private final TypeIdentifier typeIdentifier;

  RemoteTypeInformation(String typeDescriptor, TypeIdentifier typeIdentifier) {
    this.typeDescriptor = Preconditions.checkNotNull(typeDescriptor);
    this.typeIdentifier = Preconditions.checkNotNull(typeIdentifier);
  }

  /** The wire descriptor, empty for types that only appear as a name in the schema. */
  public String getTypeDescriptor() {
    return typeDescriptor;
  }

  public TypeIdentifier getTypeIdentifier() {
    return typeIdentifier;
  }

  public String prettyPrint(boolean simplifyClassNames) {
    return typeIdentifier.prettyPrint(simplifyClassNames);
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RemoteTypeInformation)) {
      return false;
    }
    RemoteTypeInformation that = (RemoteTypeInformation) o;
    return typeDescriptor.equals(that.typeDescriptor) && typeIdentifier.equals(that.typeIdentifier);
  }

  @Override
  public final int hashCode() {
    return Objects.hash(typeDescriptor, typeIdentifier);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + typeIdentifier.getName() + ")";
  }

  /** A wildcard or type variable. */
  public static final class Unknown extends RemoteTypeInformation {
    public static final Unknown INSTANCE = new Unknown();

    private Unknown() {
      super("?", TypeIdentifier.UNKNOWN);
    }
  }

  /** A primitive, or a type that can only be located, never carpented. */
  public static final class Unparameterised extends RemoteTypeInformation {
    public Unparameterised(String typeDescriptor, TypeIdentifier typeIdentifier) {
      super(typeDescriptor, typeIdentifier);
    }
  }

  /** A type with named properties that can be synthesized as a class. */
  public static final class Composable extends RemoteTypeInformation {
    private final Map<String, RemotePropertyInformation> properties;
    private final List<RemoteTypeInformation> interfaces;
    private final List<RemoteTypeInformation> typeParameters;

    public Composable(
        String typeDescriptor,
        TypeIdentifier typeIdentifier,
        Map<String, RemotePropertyInformation> properties,
        List<RemoteTypeInformation> interfaces,
        List<RemoteTypeInformation> typeParameters) {
      super(typeDescriptor, typeIdentifier);
      this.properties = ImmutableMap.copyOf(properties);
      this.interfaces = ImmutableList.copyOf(interfaces);
      this.typeParameters = ImmutableList.copyOf(typeParameters);
    }

    /** Properties in wire order. */
    public Map<String, RemotePropertyInformation> getProperties() {
      return properties;
    }

    public List<RemoteTypeInformation> getInterfaces() {
      return interfaces;
    }

    public List<RemoteTypeInformation> getTypeParameters() {
      return typeParameters;
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return super.prettyPrint(simplifyClassNames)
          + properties.entrySet().stream()
              .map(e -> e.getKey() + ": " + e.getValue().getType().prettyPrint(simplifyClassNames))
              .collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** A type some other type in the schema provides, with its getter properties. */
  public static final class AnInterface extends RemoteTypeInformation {
    private final Map<String, RemotePropertyInformation> properties;
    private final List<RemoteTypeInformation> interfaces;
    private final List<RemoteTypeInformation> typeParameters;

    public AnInterface(
        String typeDescriptor,
        TypeIdentifier typeIdentifier,
        Map<String, RemotePropertyInformation> properties,
        List<RemoteTypeInformation> interfaces,
        List<RemoteTypeInformation> typeParameters) {
      super(typeDescriptor, typeIdentifier);
      this.properties = ImmutableMap.copyOf(properties);
      this.interfaces = ImmutableList.copyOf(interfaces);
      this.typeParameters = ImmutableList.copyOf(typeParameters);
    }

    public Map<String, RemotePropertyInformation> getProperties() {
      return properties;
    }

    public List<RemoteTypeInformation> getInterfaces() {
      return interfaces;
    }

    public List<RemoteTypeInformation> getTypeParameters() {
      return typeParameters;
    }
  }

  public static final class AnEnum extends RemoteTypeInformation {
    private final List<String> members;
    private final List<RemoteTypeInformation> interfaces;

    public AnEnum(
        String typeDescriptor,
        TypeIdentifier typeIdentifier,
        List<String> members,
        List<RemoteTypeInformation> interfaces) {
      super(typeDescriptor, typeIdentifier);
      this.members = ImmutableList.copyOf(members);
      this.interfaces = ImmutableList.copyOf(interfaces);
    }

    /** Constant names in ordinal order. */
    public List<String> getMembers() {
      return members;
    }

    public List<RemoteTypeInformation> getInterfaces() {
      return interfaces;
    }
  }

  public static final class AnArray extends RemoteTypeInformation {
    private final RemoteTypeInformation componentType;

    public AnArray(
        String typeDescriptor, TypeIdentifier typeIdentifier, RemoteTypeInformation componentType) {
      super(typeDescriptor, typeIdentifier);
      this.componentType = componentType;
    }

    public RemoteTypeInformation getComponentType() {
      return componentType;
    }
  }

  /** A parameterization of a raw type that must exist locally, e.g. a collection. */
  public static final class Parameterised extends RemoteTypeInformation {
    private final List<RemoteTypeInformation> typeParameters;

    public Parameterised(
        String typeDescriptor,
        TypeIdentifier typeIdentifier,
        List<RemoteTypeInformation> typeParameters) {
      super(typeDescriptor, typeIdentifier);
      this.typeParameters = ImmutableList.copyOf(typeParameters);
    }

    public List<RemoteTypeInformation> getTypeParameters() {
      return typeParameters;
    }
  }

  /**
   * Reference to a type whose interpretation was still in progress when it was referenced, e.g. a
   * property of a class typed as the class itself.
   */
  public static final class Cycle extends RemoteTypeInformation {
    private final Supplier<RemoteTypeInformation> follow;

    public Cycle(
        String typeDescriptor,
        TypeIdentifier typeIdentifier,
        Supplier<RemoteTypeInformation> follow) {
      super(typeDescriptor, typeIdentifier);
      this.follow = follow;
    }

    /** The referenced type, available once interpretation has finished. */
    public RemoteTypeInformation follow() {
      return follow.get();
    }

    @Override
    public String prettyPrint(boolean simplifyClassNames) {
      return "^" + super.prettyPrint(simplifyClassNames);
    }
  }
}
