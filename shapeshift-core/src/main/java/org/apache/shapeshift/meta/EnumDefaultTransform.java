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

/** Enum constant {@code newName} is read as {@code oldName} by peers that lack it. */
public final class EnumDefaultTransform extends Transform {
  private final String newName;
  private final String oldName;

  public EnumDefaultTransform(String newName, String oldName) {
    this.newName = newName;
    this.oldName = oldName;
  }

  public static EnumDefaultTransform get(Object obj) {
    List<?> list =
        DescribedElements.describedList(obj, AmqpDescriptorRegistry.ENUM_DEFAULT_TRANSFORM, 2);
    return new EnumDefaultTransform(
        DescribedElements.string(list.get(0)), DescribedElements.string(list.get(1)));
  }

  public String getNewName() {
    return newName;
  }

  public String getOldName() {
    return oldName;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.ENUM_DEFAULT_TRANSFORM.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(newName, oldName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EnumDefaultTransform)) {
      return false;
    }
    EnumDefaultTransform that = (EnumDefaultTransform) o;
    return Objects.equals(newName, that.newName) && Objects.equals(oldName, that.oldName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(newName, oldName);
  }

  @Override
  public String toString() {
    return "EnumDefault(" + newName + " -> " + oldName + ")";
  }
}
