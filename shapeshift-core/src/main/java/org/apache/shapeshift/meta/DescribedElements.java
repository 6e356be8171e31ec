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

import java.util.Collections;
import java.util.List;
import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.shapeshift.exception.DeserializationException;

/** Decoding helpers shared by the schema elements. */
final class DescribedElements {
  private DescribedElements() {}

  /**
   * Check {@code obj} is a described list carrying {@code registry}'s code and return the list.
   *
   * @throws DeserializationException if it isn't
   */
  static List<?> describedList(Object obj, AmqpDescriptorRegistry registry, int minSize) {
    if (!(obj instanceof DescribedType)) {
      throw new DeserializationException("Expected a described " + registry + " but got " + obj);
    }
    DescribedType describedType = (DescribedType) obj;
    if (!registry.matches(describedType.getDescriptor())) {
      throw new DeserializationException(
          "Unexpected descriptor " + describedType.getDescriptor() + " for " + registry);
    }
    Object described = describedType.getDescribed();
    if (!(described instanceof List) || ((List<?>) described).size() < minSize) {
      throw new DeserializationException("Malformed " + registry + ": " + described);
    }
    return (List<?>) described;
  }

  static String string(Object obj) {
    return obj == null ? null : obj.toString();
  }

  @SuppressWarnings("unchecked")
  static List<Object> list(Object obj) {
    if (obj == null) {
      return Collections.emptyList();
    }
    if (!(obj instanceof List)) {
      throw new DeserializationException("Expected a list but got " + obj);
    }
    return (List<Object>) obj;
  }
}
