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

package org.apache.shapeshift;

import javax.annotation.concurrent.ThreadSafe;
import org.apache.shapeshift.carpenter.JaninoTypeSynthesizer;
import org.apache.shapeshift.carpenter.SchemaBuildingRemoteTypeCarpenter;
import org.apache.shapeshift.config.Config;
import org.apache.shapeshift.config.ShapeshiftBuilder;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.ObjectAndEnvelope;
import org.apache.shapeshift.serializer.SerializationOutput;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.serializer.custom.CustomSerializer;
import org.apache.shapeshift.serializer.custom.DefaultCustomSerializers;
import org.apache.shapeshift.serializer.custom.ExternalCustomSerializer;
import org.apache.shapeshift.serializer.custom.SerializationCustomSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: serializes object graphs to self-describing AMQP envelopes and reads them back,
 * carpenting classes the reader doesn't have and evolving classes whose shape changed.
 *
 * <pre>{@code
 * Shapeshift shapeshift = Shapeshift.builder().withWhitelist(AllWhitelist.INSTANCE).build();
 * byte[] bytes = shapeshift.serialize(obj);
 * Foo foo = shapeshift.deserialize(bytes, Foo.class);
 * }</pre>
 */
@ThreadSafe
public final class Shapeshift {
  private static final Logger LOG = LoggerFactory.getLogger(Shapeshift.class);

  private final Config config;
  private final SerializerFactory factory;

  public Shapeshift(Config config) {
    this.config = config;
    this.factory =
        new SerializerFactory(
            config.getWhitelist(),
            new SchemaBuildingRemoteTypeCarpenter(
                new JaninoTypeSynthesizer(config.getClassLoader())),
            config.getEvolutionSerializerProvider(),
            config.getFingerPrinterFactory(),
            config.isOnlyCustomSerializers());
    if (config.registerDefaultCustomSerializers()) {
      DefaultCustomSerializers.registerDefaultSerializers(factory);
    }
    LOG.debug("Created shapeshift instance with {}", config);
  }

  public static ShapeshiftBuilder builder() {
    return new ShapeshiftBuilder();
  }

  public byte[] serialize(Object obj) {
    return new SerializationOutput(factory).serialize(obj);
  }

  public <T> T deserialize(byte[] bytes, Class<T> clazz) {
    return new DeserializationInput(factory).deserialize(bytes, clazz);
  }

  public Object deserialize(byte[] bytes) {
    return deserialize(bytes, Object.class);
  }

  public <T> ObjectAndEnvelope<T> deserializeWithEnvelope(byte[] bytes, Class<T> clazz) {
    return new DeserializationInput(factory).deserializeAndReturnEnvelope(bytes, clazz);
  }

  public void registerSerializer(CustomSerializer<?> serializer) {
    factory.register(serializer);
  }

  public void registerExternalSerializer(SerializationCustomSerializer<?, ?> serializer) {
    factory.registerExternal(new ExternalCustomSerializer<>(serializer, factory));
  }

  public SerializerFactory getSerializerFactory() {
    return factory;
  }

  public Config getConfig() {
    return config;
  }
}
