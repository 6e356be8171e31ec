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

import com.google.common.base.Preconditions;
import java.util.function.Function;
import org.apache.shapeshift.Shapeshift;
import org.apache.shapeshift.resolver.ClassWhitelist;
import org.apache.shapeshift.resolver.EmptyWhitelist;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.serializer.evolution.DefaultEvolutionSerializerProvider;
import org.apache.shapeshift.serializer.evolution.EvolutionSerializerProvider;
import org.apache.shapeshift.serializer.struct.FingerPrinter;
import org.apache.shapeshift.serializer.struct.SerializerFingerPrinter;

/** Builder for {@link Shapeshift}. Every option has a default, see the {@code with} methods. */
public final class ShapeshiftBuilder {
  ClassLoader classLoader;
  ClassWhitelist whitelist = EmptyWhitelist.INSTANCE;
  boolean onlyCustomSerializers = false;
  EvolutionSerializerProvider evolutionSerializerProvider =
      DefaultEvolutionSerializerProvider.INSTANCE;
  boolean defaultCustomSerializers = true;
  Function<SerializerFactory, FingerPrinter> fingerPrinterFactory = SerializerFingerPrinter::new;

  public ShapeshiftBuilder() {}

  /**
   * Class loader local types are loaded from, and the parent of carpented types. Defaults to the
   * context class loader of the thread calling {@link #build()}.
   */
  public ShapeshiftBuilder withClassLoader(ClassLoader classLoader) {
    this.classLoader = classLoader;
    return this;
  }

  /**
   * Classes allowed to be serialized by their properties, in addition to classes annotated with
   * {@link org.apache.shapeshift.annotation.ShapeshiftSerializable}. Defaults to none.
   */
  public ShapeshiftBuilder withWhitelist(ClassWhitelist whitelist) {
    this.whitelist = Preconditions.checkNotNull(whitelist);
    return this;
  }

  /** Only serialize primitives and types handled by custom serializers. */
  public ShapeshiftBuilder withOnlyCustomSerializers(boolean onlyCustomSerializers) {
    this.onlyCustomSerializers = onlyCustomSerializers;
    return this;
  }

  public ShapeshiftBuilder withEvolutionSerializerProvider(EvolutionSerializerProvider provider) {
    this.evolutionSerializerProvider = Preconditions.checkNotNull(provider);
    return this;
  }

  /** Whether to register the built-in custom serializers, true by default. */
  public ShapeshiftBuilder withDefaultCustomSerializers(boolean defaultCustomSerializers) {
    this.defaultCustomSerializers = defaultCustomSerializers;
    return this;
  }

  public ShapeshiftBuilder withFingerPrinter(
      Function<SerializerFactory, FingerPrinter> fingerPrinterFactory) {
    this.fingerPrinterFactory = Preconditions.checkNotNull(fingerPrinterFactory);
    return this;
  }

  private void finish() {
    if (classLoader == null) {
      classLoader = Thread.currentThread().getContextClassLoader();
      if (classLoader == null) {
        classLoader = Shapeshift.class.getClassLoader();
      }
    }
  }

  public Config buildConfig() {
    finish();
    return new Config(this);
  }

  public Shapeshift build() {
    return new Shapeshift(buildConfig());
  }
}
