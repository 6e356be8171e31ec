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
import java.util.List;
import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.shapeshift.exception.DeserializationException;

/**
 * Description of one type in a {@link Schema}. A notation is either a {@link CompositeType}, a type
 * with named properties, or a {@link RestrictedType}, a type whose values are written as some
 * other type such as a list, a string or an enum constant.
 */
public abstract class TypeNotation implements DescribedType {
  private final String name;
  private final String label;
  private final List<String> provides;
  private final Descriptor descriptor;

  protected TypeNotation(String name, String label, List<String> provides, Descriptor descriptor) {
    this.name = name;
    this.label = label;
    this.provides = ImmutableList.copyOf(provides);
    this.descriptor = descriptor;
  }

  public static TypeNotation get(Object obj) {
    if (obj instanceof DescribedType) {
      Object code = ((DescribedType) obj).getDescriptor();
      if (AmqpDescriptorRegistry.COMPOSITE_TYPE.matches(code)) {
        return CompositeType.get(obj);
      } else if (AmqpDescriptorRegistry.RESTRICTED_TYPE.matches(code)) {
        return RestrictedType.get(obj);
      }
    }
    throw new DeserializationException("Not a type notation: " + obj);
  }

  /** Canonical type name, see {@link org.apache.shapeshift.type.TypeIdentifier}. */
  public String getName() {
    return name;
  }

  public String getLabel() {
    return label;
  }

  /** Canonical names of the interfaces this type implements. */
  public List<String> getProvides() {
    return provides;
  }

  public Descriptor getDescriptorElement() {
    return descriptor;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ", descriptor=" + descriptor + ")";
  }
}
