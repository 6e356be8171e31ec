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

package org.apache.shapeshift.serializer.evolution;

import com.google.common.collect.ImmutableMap;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.meta.Choice;
import org.apache.shapeshift.meta.EnumDefaultTransform;
import org.apache.shapeshift.meta.RenameTransform;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.meta.Transform;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.EnumSerializer;
import org.apache.shapeshift.serializer.SerializationOutput;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;

/**
 * Reads constants of an enum whose constants differ from the local enum. A remote constant maps to
 * the local constant of the same name or else to the first local constant reached through the
 * transforms: renames, followed either way, and enum defaults, followed from the new constant to
 * the old one.
 */
public class EnumEvolutionSerializer extends Serializer<Enum<?>> {
  private final Symbol typeDescriptor;
  private final Map<String, Enum<?>> constants;

  public EnumEvolutionSerializer(
      RestrictedType remote,
      EnumSerializer localSerializer,
      List<Transform> transforms,
      SerializerFactory factory) {
    super(factory, localSerializer.getType());
    this.typeDescriptor = remote.getDescriptorElement().getName();
    Map<String, Enum<?>> mapped = new HashMap<>();
    for (Choice choice : remote.getChoices()) {
      Enum<?> local = resolve(choice.getName(), localSerializer, transforms);
      if (local != null) {
        mapped.put(choice.getName(), local);
      }
    }
    this.constants = ImmutableMap.copyOf(mapped);
  }

  private static Enum<?> resolve(
      String remoteName, EnumSerializer localSerializer, List<Transform> transforms) {
    Deque<String> pending = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    pending.add(remoteName);
    while (!pending.isEmpty()) {
      String name = pending.poll();
      if (!seen.add(name)) {
        continue;
      }
      Enum<?> local = localSerializer.constantNamed(name);
      if (local != null) {
        return local;
      }
      for (Transform transform : transforms) {
        if (transform instanceof RenameTransform) {
          RenameTransform rename = (RenameTransform) transform;
          if (rename.getFrom().equals(name)) {
            pending.add(rename.getTo());
          } else if (rename.getTo().equals(name)) {
            pending.add(rename.getFrom());
          }
        } else if (transform instanceof EnumDefaultTransform) {
          EnumDefaultTransform enumDefault = (EnumDefaultTransform) transform;
          if (enumDefault.getNewName().equals(name)) {
            pending.add(enumDefault.getOldName());
          }
        }
      }
    }
    return null;
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    throw new UnsupportedOperationException("Evolution serializers are only used for reading");
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    throw new UnsupportedOperationException("Evolution serializers are only used for reading");
  }

  @Override
  public Enum<?> readObject(Object obj, Schema schema, DeserializationInput input) {
    String name = EnumSerializer.constantName(obj);
    Enum<?> constant = constants.get(name);
    if (constant == null) {
      throw new DeserializationException(
          "Constant " + name + " of " + type.getTypeName() + " is unknown to the local enum");
    }
    return constant;
  }
}
