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

/**
 * A type written as its {@link #getSource() source} type: collections, maps and arrays as lists or
 * maps, enums as their constant with {@link #getChoices() choices}, custom types as whatever their
 * serializer writes.
 */
public final class RestrictedType extends TypeNotation {
  private final String source;
  private final List<Choice> choices;

  public RestrictedType(
      String name,
      String label,
      List<String> provides,
      String source,
      Descriptor descriptor,
      List<Choice> choices) {
    super(name, label, provides, descriptor);
    this.source = source;
    this.choices = ImmutableList.copyOf(choices);
  }

  public static RestrictedType get(Object obj) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.RESTRICTED_TYPE, 6);
    return new RestrictedType(
        DescribedElements.string(list.get(0)),
        DescribedElements.string(list.get(1)),
        CompositeType.strings(list.get(2)),
        DescribedElements.string(list.get(3)),
        Descriptor.get(list.get(4)),
        DescribedElements.list(list.get(5)).stream()
            .map(Choice::get)
            .collect(ImmutableList.toImmutableList()));
  }

  public String getSource() {
    return source;
  }

  public List<Choice> getChoices() {
    return choices;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.RESTRICTED_TYPE.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(
        getName(), getLabel(), getProvides(), source, getDescriptorElement(), choices);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RestrictedType)) {
      return false;
    }
    RestrictedType that = (RestrictedType) o;
    return Objects.equals(getName(), that.getName())
        && Objects.equals(getLabel(), that.getLabel())
        && Objects.equals(getProvides(), that.getProvides())
        && Objects.equals(source, that.source)
        && Objects.equals(getDescriptorElement(), that.getDescriptorElement())
        && Objects.equals(choices, that.choices);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        getName(), getLabel(), getProvides(), source, getDescriptorElement(), choices);
  }
}
