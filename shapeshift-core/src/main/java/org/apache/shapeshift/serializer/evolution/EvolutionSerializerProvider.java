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

package org.apache.shapeshift.serializer.evolution;

import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.resolver.RemoteType;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;

/**
 * Chooses how values of a type are read when the sender's descriptor for it differs from the local
 * one.
 */
public interface EvolutionSerializerProvider {

  /**
   * The serializer reading values written with {@code remoteType}'s descriptor.
   *
   * @param newSerializer the serializer of the local type
   * @param schema the schema {@code remoteType} was read from, with the transforms of its envelope
   * @return {@code newSerializer} if it can read the remote form as is, otherwise a serializer
   *     adapting the remote form to the local type
   * @throws org.apache.shapeshift.exception.TypeNotSerializableException if the remote form can't
   *     be adapted
   */
  Serializer<?> getEvolutionSerializer(
      SerializerFactory factory, RemoteType remoteType, Serializer<?> newSerializer, Schema schema);
}
