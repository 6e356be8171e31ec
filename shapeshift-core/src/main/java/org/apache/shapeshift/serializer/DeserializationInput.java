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
import com.google.common.primitives.Primitives;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.util.Arrays;
import javax.annotation.concurrent.NotThreadSafe;
import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.ShapeshiftException;
import org.apache.shapeshift.meta.Envelope;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.type.TypeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads object graphs from envelopes written by {@link SerializationOutput}. */
@NotThreadSafe
public class DeserializationInput {
  private static final Logger LOG = LoggerFactory.getLogger(DeserializationInput.class);

  private final SerializerFactory factory;

  public DeserializationInput(SerializerFactory factory) {
    this.factory = Preconditions.checkNotNull(factory);
  }

  public <T> T deserialize(byte[] bytes, Class<T> clazz) {
    return deserializeAndReturnEnvelope(bytes, clazz).getObj();
  }

  /**
   * Read the envelope in {@code bytes} and the object it holds.
   *
   * @throws DeserializationException if the bytes aren't an envelope or hold an object of another
   *     type than {@code clazz}
   */
  @SuppressWarnings("unchecked")
  public <T> ObjectAndEnvelope<T> deserializeAndReturnEnvelope(byte[] bytes, Class<T> clazz) {
    Envelope envelope = readEnvelope(bytes);
    try {
      Object obj = readObjectOrNull(envelope.getObj(), envelope.getSchema(), clazz);
      return new ObjectAndEnvelope<>((T) obj, envelope);
    } catch (ShapeshiftException e) {
      throw e;
    } catch (RuntimeException e) {
      LOG.debug("Deserialization failed", e);
      throw new DeserializationException("Unable to deserialize " + clazz.getName(), e);
    }
  }

  /** Check the magic and decode the envelope without reading the object. */
  public static Envelope readEnvelope(byte[] bytes) {
    Preconditions.checkNotNull(bytes);
    byte[] magic = Envelope.MAGIC;
    if (bytes.length < magic.length
        || !Arrays.equals(Arrays.copyOfRange(bytes, 0, magic.length), magic)) {
      throw new DeserializationException("Serialization header does not match.");
    }
    Data data = Data.Factory.create();
    try {
      data.decode(ByteBuffer.wrap(bytes, magic.length, bytes.length - magic.length));
      data.rewind();
      if (data.next() == null) {
        throw new DeserializationException("No envelope after the serialization header.");
      }
      return Envelope.get(data.getObject());
    } catch (ShapeshiftException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DeserializationException("Malformed envelope", e);
    }
  }

  public Object readObjectOrNull(Object obj, Schema schema, Type type) {
    return obj == null ? null : readObject(obj, schema, type);
  }

  /**
   * Read a decoded value expected to be of {@code type}. Described values are read by the
   * serializer their descriptor names, anything else is an AMQP primitive.
   */
  public Object readObject(Object obj, Schema schema, Type type) {
    Object result;
    if (obj instanceof DescribedType) {
      DescribedType described = (DescribedType) obj;
      Serializer<Object> serializer = factory.get(described.getDescriptor(), schema);
      result = serializer.readObject(described.getDescribed(), schema, this);
    } else {
      result = PrimitiveSerializer.coerce(obj, TypeUtils.asClass(type));
    }
    Class<?> expected = Primitives.wrap(TypeUtils.asClass(type));
    if (result != null && !expected.isInstance(result)) {
      throw new DeserializationException(
          "Found object of type "
              + result.getClass().getName()
              + " in stream, expected "
              + type.getTypeName());
    }
    return result;
  }

  public SerializerFactory getFactory() {
    return factory;
  }
}
