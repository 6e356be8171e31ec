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

package org.apache.shapeshift.serializer.converter;

/**
 * Converts a property value read in the type an older or newer class declared to the type the
 * local class declares, e.g. an {@code int} written by a sender to the {@code long} the receiver
 * declares.
 *
 * <p>Converters for primitive targets map null to the java default of the target, converters for
 * boxed targets keep null.
 *
 * @param <T> the target type that this converter produces
 * @see FieldConverters for the converter of a source and target type
 */
public abstract class FieldConverter<T> {
  private final Class<?> targetType;

  protected FieldConverter(Class<?> targetType) {
    this.targetType = targetType;
  }

  /**
   * Converts {@code from} to the target type.
   *
   * @throws UnsupportedOperationException if the source type is not compatible with this converter
   * @throws NumberFormatException if converting from String to a numeric type and the string is not
   *     a valid number
   * @throws ArithmeticException if the numeric conversion would overflow
   */
  public abstract T convert(Object from);

  public Class<?> getTargetType() {
    return targetType;
  }
}
