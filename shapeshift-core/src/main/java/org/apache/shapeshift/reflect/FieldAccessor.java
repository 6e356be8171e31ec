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

package org.apache.shapeshift.reflect;

import java.lang.reflect.Field;
import org.apache.shapeshift.exception.ShapeshiftException;
import org.apache.shapeshift.exception.TypeNotSerializableException;

/** Reads and writes one instance field, bypassing access checks. */
public final class FieldAccessor {
  private final Field field;

  private FieldAccessor(Field field) {
    this.field = field;
  }

  /**
   * Create an accessor for {@code field}.
   *
   * @throws TypeNotSerializableException if the field can't be made accessible, e.g. it belongs to
   *     a module that isn't open
   */
  public static FieldAccessor createAccessor(Field field) {
    try {
      field.setAccessible(true);
    } catch (RuntimeException e) {
      throw new TypeNotSerializableException(
          field.getDeclaringClass(), "Unable to access field " + field.getName(), e);
    }
    return new FieldAccessor(field);
  }

  public Field getField() {
    return field;
  }

  public Object get(Object target) {
    try {
      return field.get(target);
    } catch (IllegalAccessException e) {
      throw new ShapeshiftException("Unable to read field " + field, e);
    }
  }

  public void set(Object target, Object value) {
    try {
      field.set(target, value);
    } catch (IllegalAccessException e) {
      throw new ShapeshiftException("Unable to set field " + field, e);
    }
  }
}
