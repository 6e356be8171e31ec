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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.concurrent.NotThreadSafe;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.meta.AmqpDescriptorRegistry;
import org.apache.shapeshift.meta.Envelope;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.meta.Transform;
import org.apache.shapeshift.meta.TransformsSchema;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.type.TypeUtils;
import org.apache.shapeshift.type.Types;

/**
 * Serializes one object graph at a time into an envelope: the magic, then the object followed by
 * the schema of every described type written and the transforms those types declare.
 */
@NotThreadSafe
public class SerializationOutput {
  private final SerializerFactory factory;
  private final Map<String, TypeNotation> schemaHistory = new LinkedHashMap<>();
  private final Set<Serializer<?>> serializerHistory = Sets.newIdentityHashSet();
  private final Map<String, List<Transform>> transformsHistory = new LinkedHashMap<>();

  public SerializationOutput(SerializerFactory factory) {
    this.factory = Preconditions.checkNotNull(factory);
  }

  /** Serialize {@code obj} and everything reachable from it. */
  public byte[] serialize(Object obj) {
    try {
      Data data = Data.Factory.create();
      data.putDescribed();
      data.enter();
      data.putUnsignedLong(AmqpDescriptorRegistry.ENVELOPE.getAmqpDescriptor());
      data.putList();
      data.enter();
      writeObjectOrNull(obj, data, obj == null ? Object.class : obj.getClass());
      data.putObject(new Schema(ImmutableList.copyOf(schemaHistory.values())));
      data.putObject(new TransformsSchema(transformsHistory));
      data.exit();
      data.exit();
      ByteBuffer buffer = ByteBuffer.allocate(Envelope.MAGIC.length + (int) data.encodedSize());
      buffer.put(Envelope.MAGIC);
      data.encode(buffer);
      return buffer.array();
    } finally {
      schemaHistory.clear();
      serializerHistory.clear();
      transformsHistory.clear();
    }
  }

  public void writeObjectOrNull(Object obj, Data data, Type type) {
    if (obj == null) {
      data.putNull();
    } else {
      writeObject(obj, data, type);
    }
  }

  /** Write the non null {@code obj} declared as {@code type}. */
  public void writeObject(Object obj, Data data, Type type) {
    Serializer<Object> serializer = factory.get(obj.getClass(), type);
    if (serializerHistory.add(serializer)) {
      serializer.writeClassInfo(this);
    }
    serializer.writeObject(obj, data, type, this);
  }

  /**
   * Add {@code notation} to the schema.
   *
   * @return false if a notation with the same descriptor was already written
   */
  public boolean writeTypeNotations(TypeNotation notation) {
    String descriptor = String.valueOf(notation.getDescriptorElement().getName());
    if (schemaHistory.containsKey(descriptor)) {
      return false;
    }
    schemaHistory.put(descriptor, notation);
    return true;
  }

  /** Record the transforms of the type named {@code typeName}, if it declares any. */
  public void writeTransforms(String typeName, List<Transform> transforms) {
    if (!transforms.isEmpty()) {
      transformsHistory.putIfAbsent(typeName, transforms);
    }
  }

  /**
   * Make sure the schema describes {@code type}, e.g. the declared type of a property. Abstract
   * types get no notation unless a value of theirs could be read as one: collections, maps, arrays,
   * enums and whitelisted interfaces.
   */
  public void requireSerializer(Type type) {
    if (TypeUtils.isUnknown(type) || type == Object.class || Types.isPrimitive(type)) {
      return;
    }
    Class<?> cls = TypeUtils.asClass(type);
    if (cls.isPrimitive()) {
      return;
    }
    boolean structural =
        Collection.class.isAssignableFrom(cls)
            || Map.class.isAssignableFrom(cls)
            || TypeUtils.isArray(type)
            || cls.isEnum();
    if (!structural && cls.isInterface() && !factory.isWhitelisted(cls)) {
      return;
    }
    if (!structural && !cls.isInterface() && Modifier.isAbstract(cls.getModifiers())) {
      return;
    }
    Serializer<Object> serializer = factory.get(null, type);
    if (serializerHistory.add(serializer)) {
      serializer.writeClassInfo(this);
    }
  }

  public SerializerFactory getFactory() {
    return factory;
  }
}
