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

package org.apache.shapeshift.config;

import java.util.function.Function;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.shapeshift.resolver.ClassWhitelist;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.serializer.evolution.EvolutionSerializerProvider;
import org.apache.shapeshift.serializer.struct.FingerPrinter;

/** Immutable options of a {@link org.apache.shapeshift.Shapeshift} instance. */
@ThreadSafe
public final class Config {
  private final ClassLoader classLoader;
  private final ClassWhitelist whitelist;
  private final boolean onlyCustomSerializers;
  private final EvolutionSerializerProvider evolutionSerializerProvider;
  private final boolean defaultCustomSerializers;
  private final Function<SerializerFactory, FingerPrinter> fingerPrinterFactory;

  Config(ShapeshiftBuilder builder) {
    classLoader = builder.classLoader;
    whitelist = builder.whitelist;
    onlyCustomSerializers = builder.onlyCustomSerializers;
    evolutionSerializerProvider = builder.evolutionSerializerProvider;
    defaultCustomSerializers = builder.defaultCustomSerializers;
    fingerPrinterFactory = builder.fingerPrinterFactory;
  }

  public ClassLoader getClassLoader() {
    return classLoader;
  }

  public ClassWhitelist getWhitelist() {
    return whitelist;
  }

  public boolean isOnlyCustomSerializers() {
    return onlyCustomSerializers;
  }

  public EvolutionSerializerProvider getEvolutionSerializerProvider() {
    return evolutionSerializerProvider;
  }

  public boolean registerDefaultCustomSerializers() {
    return defaultCustomSerializers;
  }

  public Function<SerializerFactory, FingerPrinter> getFingerPrinterFactory() {
    return fingerPrinterFactory;
  }

  @Override
  public String toString() {
    return "Config{"
        + "classLoader="
        + classLoader
        + ", whitelist="
        + whitelist
        + ", onlyCustomSerializers="
        + onlyCustomSerializers
        + ", evolutionSerializerProvider="
        + evolutionSerializerProvider
        + ", defaultCustomSerializers="
        + defaultCustomSerializers
        + '}';
  }
}
