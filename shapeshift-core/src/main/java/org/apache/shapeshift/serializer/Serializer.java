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
import javax.annotation.concurrent.ThreadSafe;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.meta.Schema;

/**
 * Serialize/deserialize objects of one type to and from AMQP data. Serializers are cached and
 * shared by the {@link SerializerFactory}, so they hold no per call state; the per call state lives
 * in {@link SerializationOutput} and {@link DeserializationInput}.
 *
 * <p>Constructors must not ask the factory for other serializers, dependent serializers are looked
 * up lazily when first needed.
 *
 * @param <T> type of objects being serializing/deserializing
 */
@ThreadSafe
public abstract class Serializer<T> {
  protected final SerializerFactory factory;
  protected final Type type;

  protected Serializer(SerializerFactory factory, Type type) {
    this.factory = factory;
    this.type = type;
  }

  public SerializerFactory getFactory() {
    return factory;
  }

  /** The local type this serializer handles. */
  public Type getType() {
    return type;
  }

  /** Descriptor values of this type are written with, also the key of its schema notation. */
  public abstract Symbol getTypeDescriptor();

  /**
   * Add the schema notations needed to read values written by this serializer. Called at most once
   * per {@link SerializationOutput}.
   */
  public void writeClassInfo(SerializationOutput output) {}

  /** Write the non null {@code obj}, declared as {@code declaredType}, to {@code data}. */
  public void writeObject(Object obj, Data data, Type declaredType, SerializationOutput output) {
    throw new UnsupportedOperationException("Please implement serialization for " + type);
  }

  /**
   * Read a value from its decoded AMQP form: the described part of a described type, or a
   * primitive.
   */
  public T readObject(Object obj, Schema schema, DeserializationInput input) {
    throw new UnsupportedOperationException("Please implement deserialization for " + type);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + type.getTypeName() + ")";
  }
}
