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
import org.apache.qpid.proton.amqp.DescribedType;

/** A named, typed property of a {@link CompositeType}. */
public final class Field implements DescribedType {
  private final String name;
  private final String type;
  private final List<String> requires;
  private final String defaultValue;
  private final String label;
  private final boolean mandatory;
  private final boolean multiple;

  public Field(
      String name,
      String type,
      List<String> requires,
      String defaultValue,
      String label,
      boolean mandatory,
      boolean multiple) {
    this.name = name;
    this.type = type;
    this.requires = ImmutableList.copyOf(requires);
    this.defaultValue = defaultValue;
    this.label = label;
    this.mandatory = mandatory;
    this.multiple = multiple;
  }

  public static Field get(Object obj) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.FIELD, 7);
    List<String> requires =
        DescribedElements.list(list.get(2)).stream()
            .map(DescribedElements::string)
            .collect(ImmutableList.toImmutableList());
    return new Field(
        DescribedElements.string(list.get(0)),
        DescribedElements.string(list.get(1)),
        requires,
        DescribedElements.string(list.get(3)),
        DescribedElements.string(list.get(4)),
        Boolean.TRUE.equals(list.get(5)),
        Boolean.TRUE.equals(list.get(6)));
  }

  public String getName() {
    return name;
  }

  /** Canonical name of the property type. */
  public String getType() {
    return type;
  }

  public List<String> getRequires() {
    return requires;
  }

  public String getDefaultValue() {
    return defaultValue;
  }

  public String getLabel() {
    return label;
  }

  /** Whether the property can never be null, i.e. it is a java primitive. */
  public boolean isMandatory() {
    return mandatory;
  }

  public boolean isMultiple() {
    return multiple;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.FIELD.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(name, type, requires, defaultValue, label, mandatory, multiple);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Field)) {
      return false;
    }
    Field that = (Field) o;
    return mandatory == that.mandatory
        && multiple == that.multiple
        && Objects.equals(name, that.name)
        && Objects.equals(type, that.type)
        && Objects.equals(requires, that.requires)
        && Objects.equals(defaultValue, that.defaultValue)
        && Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, requires, defaultValue, label, mandatory, multiple);
  }

  @Override
  public String toString() {
    return name + ": " + type + (mandatory ? "" : "?");
  }
}
