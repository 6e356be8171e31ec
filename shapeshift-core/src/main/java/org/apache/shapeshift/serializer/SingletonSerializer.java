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

package org.apache.shapeshift.serializer;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.type.TypeUtils;

/** Writes a singleton as its descriptor alone and reads it back as the local instance. */
public class SingletonSerializer extends Serializer<Object> {
  private final Object singleton;
  private final Symbol typeDescriptor;
  private final RestrictedType typeNotation;

  public SingletonSerializer(Class<?> clazz, Object singleton, SerializerFactory factory) {
    super(factory, clazz);
    this.singleton = singleton;
    this.typeDescriptor = factory.descriptorForType(clazz);
    List<String> provides = new ArrayList<>();
    for (Class<?> anInterface : factory.getProvidedInterfaces(clazz)) {
      provides.add(TypeUtils.nameForType(anInterface));
    }
    this.typeNotation =
        new RestrictedType(
            TypeUtils.nameForType(clazz),
            "Singleton",
            provides,
            "boolean",
            new Descriptor(typeDescriptor),
            Collections.emptyList());
  }

  @Override
  public Symbol getTypeDescriptor() {
    return typeDescriptor;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    output.writeTypeNotations(typeNotation);
  }

  @Override
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    data.putDescribed();
    data.enter();
    data.putSymbol(typeDescriptor);
    data.putBoolean(false);
    data.exit();
  }

  @Override
  public Object readObject(Object obj, Schema schema, DeserializationInput input) {
    return singleton;
  }
}
