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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.apache.qpid.proton.amqp.DescribedType;

/** One constant of a restricted type, e.g. an enum constant and its ordinal. */
public final class Choice implements DescribedType {
  private final String name;
  private final String value;

  public Choice(String name, String value) {
    this.name = name;
    this.value = value;
  }

  public static Choice get(Object obj) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.CHOICE, 2);
    return new Choice(DescribedElements.string(list.get(0)), DescribedElements.string(list.get(1)));
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.CHOICE.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(name, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Choice)) {
      return false;
    }
    Choice that = (Choice) o;
    return Objects.equals(name, that.name) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
