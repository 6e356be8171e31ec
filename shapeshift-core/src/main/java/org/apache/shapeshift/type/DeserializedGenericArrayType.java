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

package org.apache.shapeshift.type;

import com.google.common.base.Preconditions;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Type;
import java.util.Objects;

/** A generic array type such as {@code List<String>[]} built from a schema name. */
public final class DeserializedGenericArrayType implements GenericArrayType {
  private final Type componentType;

  public DeserializedGenericArrayType(Type componentType) {
    Preconditions.checkArgument(
        !(componentType instanceof Class), "Use a Class for arrays of %s", componentType);
    this.componentType = componentType;
  }

  @Override
  public Type getGenericComponentType() {
    return componentType;
  }

  @Override
  public String getTypeName() {
    return componentType.getTypeName() + "[]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof GenericArrayType
        && Objects.equals(componentType, ((GenericArrayType) o).getGenericComponentType());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(componentType);
  }

  @Override
  public String toString() {
    return getTypeName();
  }
}
