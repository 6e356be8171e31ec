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

package org.apache.shapeshift.serializer.custom;

import com.google.common.reflect.TypeToken;
import java.lang.reflect.TypeVariable;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.serializer.SerializerFactory;

/**
 * Adapts a {@link SerializationCustomSerializer} to a proxy custom serializer. The object and proxy
 * classes are read from the type arguments the implementation binds.
 */
@SuppressWarnings("unchecked")
public class ExternalCustomSerializer<OBJ, PROXY> extends CustomSerializer.Proxy<OBJ, PROXY> {
  private final SerializationCustomSerializer<OBJ, PROXY> serializer;

  public ExternalCustomSerializer(
      SerializationCustomSerializer<OBJ, PROXY> serializer, SerializerFactory factory) {
    super(
        (Class<OBJ>) typeArgument(serializer, 0),
        (Class<PROXY>) typeArgument(serializer, 1),
        factory,
        false);
    this.serializer = serializer;
  }

  private static Class<?> typeArgument(SerializationCustomSerializer<?, ?> serializer, int index) {
    TypeToken<?> argument =
        TypeToken.of(serializer.getClass())
            .resolveType(SerializationCustomSerializer.class.getTypeParameters()[index]);
    if (argument.getType() instanceof TypeVariable) {
      throw new TypeNotSerializableException(
          serializer.getClass(),
          "Custom serializer must bind the object and proxy types of "
              + SerializationCustomSerializer.class.getSimpleName());
    }
    return argument.getRawType();
  }

  @Override
  protected PROXY toProxy(OBJ obj) {
    return serializer.toProxy(obj);
  }

  @Override
  protected OBJ fromProxy(PROXY proxy) {
    return serializer.fromProxy(proxy);
  }

  @Override
  public String toString() {
    return "ExternalCustomSerializer(" + serializer.getClass().getName() + ")";
  }
}
