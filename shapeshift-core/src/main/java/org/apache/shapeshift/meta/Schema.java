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
import java.util.Collections;
import java.util.List;
import org.apache.qpid.proton.amqp.DescribedType;

/**
 * The notations of every described type written in one envelope. A schema read from an envelope
 * also carries the envelope's {@link TransformsSchema}, which is encoded next to it rather than in
 * it.
 */
public final class Schema implements DescribedType {
  private final List<TypeNotation> types;
  private final TransformsSchema transforms;

  public Schema(List<? extends TypeNotation> types) {
    this(types, TransformsSchema.EMPTY);
  }

  public Schema(List<? extends TypeNotation> types, TransformsSchema transforms) {
    this.types = ImmutableList.copyOf(types);
    this.transforms = transforms;
  }

  public static Schema get(Object obj) {
    return get(obj, TransformsSchema.EMPTY);
  }

  public static Schema get(Object obj, TransformsSchema transforms) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.SCHEMA, 1);
    return new Schema(
        DescribedElements.list(list.get(0)).stream()
            .map(TypeNotation::get)
            .collect(ImmutableList.toImmutableList()),
        transforms);
  }

  public List<TypeNotation> getTypes() {
    return types;
  }

  public TransformsSchema getTransforms() {
    return transforms;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.SCHEMA.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Collections.singletonList(types);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("Schema(");
    for (TypeNotation type : types) {
      builder.append("\n  ").append(type);
    }
    return builder.append(")").toString();
  }
}
