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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A type written as the list of its property values, in {@link #getFields()} order. */
public final class CompositeType extends TypeNotation {
  private final List<Field> fields;

  public CompositeType(
      String name, String label, List<String> provides, Descriptor descriptor, List<Field> fields) {
    super(name, label, provides, descriptor);
    this.fields = ImmutableList.copyOf(fields);
  }

  public static CompositeType get(Object obj) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.COMPOSITE_TYPE, 5);
    return new CompositeType(
        DescribedElements.string(list.get(0)),
        DescribedElements.string(list.get(1)),
        strings(list.get(2)),
        Descriptor.get(list.get(3)),
        DescribedElements.list(list.get(4)).stream()
            .map(Field::get)
            .collect(ImmutableList.toImmutableList()));
  }

  static List<String> strings(Object obj) {
    return DescribedElements.list(obj).stream()
        .map(DescribedElements::string)
        .collect(ImmutableList.toImmutableList());
  }

  public List<Field> getFields() {
    return fields;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.COMPOSITE_TYPE.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(getName(), getLabel(), getProvides(), getDescriptorElement(), fields);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CompositeType)) {
      return false;
    }
    CompositeType that = (CompositeType) o;
    return Objects.equals(getName(), that.getName())
        && Objects.equals(getLabel(), that.getLabel())
        && Objects.equals(getProvides(), that.getProvides())
        && Objects.equals(getDescriptorElement(), that.getDescriptorElement())
        && Objects.equals(fields, that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getLabel(), getProvides(), getDescriptorElement(), fields);
  }
}
