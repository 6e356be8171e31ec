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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.shapeshift.meta.Choice;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.Field;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.meta.Transform;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.resolver.RemoteType;
import org.apache.shapeshift.serializer.EnumSerializer;
import org.apache.shapeshift.serializer.ObjectSerializer;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;

/**
 * Evolves by-properties objects whose fields differ from the local class, and enums whose
 * constants differ, using the enum defaults and renames of whichever side declares more. Any other
 * descriptor mismatch, e.g. a different set of provided interfaces, is read by the local
 * serializer.
 */
public class DefaultEvolutionSerializerProvider implements EvolutionSerializerProvider {
  public static final DefaultEvolutionSerializerProvider INSTANCE =
      new DefaultEvolutionSerializerProvider();

  private DefaultEvolutionSerializerProvider() {}

  @Override
  public Serializer<?> getEvolutionSerializer(
      SerializerFactory factory,
      RemoteType remoteType,
      Serializer<?> newSerializer,
      Schema schema) {
    TypeNotation notation = remoteType.getNotation();
    if (notation instanceof CompositeType && newSerializer instanceof ObjectSerializer) {
      CompositeType composite = (CompositeType) notation;
      ObjectSerializer<?> objectSerializer = (ObjectSerializer<?>) newSerializer;
      if (sameFields(composite.getFields(), objectSerializer.getFields())) {
        return newSerializer;
      }
      return new EvolutionSerializer<>(composite, objectSerializer, factory);
    }
    if (notation instanceof RestrictedType
        && !((RestrictedType) notation).getChoices().isEmpty()
        && newSerializer instanceof EnumSerializer) {
      RestrictedType restricted = (RestrictedType) notation;
      EnumSerializer enumSerializer = (EnumSerializer) newSerializer;
      List<String> remoteConstants = new ArrayList<>();
      for (Choice choice : restricted.getChoices()) {
        remoteConstants.add(choice.getName());
      }
      List<String> localConstants = new ArrayList<>();
      for (Enum<?> constant : enumSerializer.getConstants()) {
        localConstants.add(constant.name());
      }
      if (remoteConstants.equals(localConstants)) {
        return newSerializer;
      }
      // The side that declares more transforms holds the newer version of the enum.
      List<Transform> remoteTransforms =
          schema == null
              ? Collections.emptyList()
              : schema.getTransforms().forType(restricted.getName());
      List<Transform> localTransforms = enumSerializer.getTransforms();
      return new EnumEvolutionSerializer(
          restricted,
          enumSerializer,
          remoteTransforms.size() > localTransforms.size() ? remoteTransforms : localTransforms,
          factory);
    }
    return newSerializer;
  }

  private static boolean sameFields(List<Field> remoteFields, List<Field> localFields) {
    if (remoteFields.size() != localFields.size()) {
      return false;
    }
    for (int i = 0; i < remoteFields.size(); i++) {
      Field remote = remoteFields.get(i);
      Field local = localFields.get(i);
      if (!remote.getName().equals(local.getName()) || !remote.getType().equals(local.getType())) {
        return false;
      }
    }
    return true;
  }
}
