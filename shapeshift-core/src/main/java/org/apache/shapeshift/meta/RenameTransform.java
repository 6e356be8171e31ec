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

/** Enum constant {@code from} was renamed to {@code to}. */
public final class RenameTransform extends Transform {
  private final String from;
  private final String to;

  public RenameTransform(String from, String to) {
    this.from = from;
    this.to = to;
  }

  public static RenameTransform get(Object obj) {
    List<?> list =
        DescribedElements.describedList(obj, AmqpDescriptorRegistry.RENAME_TRANSFORM, 2);
    return new RenameTransform(
        DescribedElements.string(list.get(0)), DescribedElements.string(list.get(1)));
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.RENAME_TRANSFORM.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(from, to);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RenameTransform)) {
      return false;
    }
    RenameTransform that = (RenameTransform) o;
    return Objects.equals(from, that.from) && Objects.equals(to, that.to);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to);
  }

  @Override
  public String toString() {
    return "Rename(" + from + " -> " + to + ")";
  }
}
