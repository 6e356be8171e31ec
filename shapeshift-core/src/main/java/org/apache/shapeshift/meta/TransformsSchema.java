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

package org.apache.shapeshift.meta;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.shapeshift.annotation.ShapeshiftEnumDefault;
import org.apache.shapeshift.annotation.ShapeshiftRename;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/**
 * The {@link Transform}s of every type written in one envelope which declares any, keyed by
 * canonical type name. Written after the {@link Schema}, as the described list {@code [map]}.
 */
public final class TransformsSchema implements DescribedType {
  public static final TransformsSchema EMPTY = new TransformsSchema(ImmutableMap.of());

  private final Map<String, List<Transform>> types;

  public TransformsSchema(Map<String, ? extends List<? extends Transform>> types) {
    ImmutableMap.Builder<String, List<Transform>> builder = ImmutableMap.builder();
    types.forEach((name, transforms) -> builder.put(name, ImmutableList.copyOf(transforms)));
    this.types = builder.build();
  }

  public static TransformsSchema get(Object obj) {
    List<?> list =
        DescribedElements.describedList(obj, AmqpDescriptorRegistry.TRANSFORMS_SCHEMA, 1);
    Object types = list.get(0);
    if (types == null) {
      return EMPTY;
    }
    if (!(types instanceof Map)) {
      throw new DeserializationException("Malformed " + AmqpDescriptorRegistry.TRANSFORMS_SCHEMA);
    }
    ImmutableMap.Builder<String, List<Transform>> builder = ImmutableMap.builder();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) types).entrySet()) {
      builder.put(
          DescribedElements.string(entry.getKey()),
          DescribedElements.list(entry.getValue()).stream()
              .map(Transform::get)
              .collect(ImmutableList.toImmutableList()));
    }
    return new TransformsSchema(builder.build());
  }

  /**
   * Transforms declared on {@code enumClass} by {@link ShapeshiftEnumDefault} and {@link
   * ShapeshiftRename}, defaults first.
   *
   * @throws TypeNotSerializableException if a default doesn't name two constants of the enum, or a
   *     rename doesn't lead from a former name to a constant
   */
  public static List<Transform> enumTransforms(Class<?> enumClass) {
    Set<String> constants = new HashSet<>();
    for (Object constant : enumClass.getEnumConstants()) {
      constants.add(((Enum<?>) constant).name());
    }
    ImmutableList.Builder<Transform> transforms = ImmutableList.builder();
    for (ShapeshiftEnumDefault enumDefault :
        enumClass.getAnnotationsByType(ShapeshiftEnumDefault.class)) {
      if (!constants.contains(enumDefault.newName())
          || !constants.contains(enumDefault.oldName())
          || enumDefault.newName().equals(enumDefault.oldName())) {
        throw new TypeNotSerializableException(
            enumClass,
            "Enum default "
                + enumDefault.newName()
                + " -> "
                + enumDefault.oldName()
                + " must name two different constants");
      }
      transforms.add(new EnumDefaultTransform(enumDefault.newName(), enumDefault.oldName()));
    }
    Map<String, String> renames = new LinkedHashMap<>();
    for (ShapeshiftRename rename : enumClass.getAnnotationsByType(ShapeshiftRename.class)) {
      if (constants.contains(rename.from())) {
        throw new TypeNotSerializableException(
            enumClass, "Renamed constant " + rename.from() + " is still a constant");
      }
      if (renames.put(rename.from(), rename.to()) != null) {
        throw new TypeNotSerializableException(
            enumClass, "Constant " + rename.from() + " can only be renamed once");
      }
    }
    renames.forEach(
        (from, to) -> {
          String name = to;
          for (int i = 0; i < renames.size() && !constants.contains(name); i++) {
            name = renames.getOrDefault(name, name);
          }
          if (!constants.contains(name)) {
            throw new TypeNotSerializableException(
                enumClass, "Rename " + from + " -> " + to + " doesn't lead to a constant");
          }
          transforms.add(new RenameTransform(from, to));
        });
    return transforms.build();
  }

  /** Transforms of the type named {@code typeName}, empty if it declares none. */
  public List<Transform> forType(String typeName) {
    return types.getOrDefault(typeName, Collections.emptyList());
  }

  public Map<String, List<Transform>> getTypes() {
    return types;
  }

  public boolean isEmpty() {
    return types.isEmpty();
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.TRANSFORMS_SCHEMA.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Collections.singletonList(types);
  }

  @Override
  public String toString() {
    return "TransformsSchema(" + types + ")";
  }
}
