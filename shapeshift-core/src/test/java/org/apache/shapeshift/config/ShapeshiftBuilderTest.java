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

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import org.apache.shapeshift.resolver.AllWhitelist;
import org.apache.shapeshift.resolver.EmptyWhitelist;
import org.apache.shapeshift.serializer.evolution.DefaultEvolutionSerializerProvider;
import org.testng.annotations.Test;

public class ShapeshiftBuilderTest {

  @Test
  public void testDefaults() {
    Config config = new ShapeshiftBuilder().buildConfig();
    assertSame(config.getWhitelist(), EmptyWhitelist.INSTANCE);
    assertSame(
        config.getEvolutionSerializerProvider(), DefaultEvolutionSerializerProvider.INSTANCE);
    assertSame(config.getClassLoader(), Thread.currentThread().getContextClassLoader());
    assertFalse(config.isOnlyCustomSerializers());
    assertTrue(config.registerDefaultCustomSerializers());
  }

  @Test
  public void testOverrides() {
    ClassLoader loader = new ClassLoader(getClass().getClassLoader()) {};
    Config config =
        new ShapeshiftBuilder()
            .withClassLoader(loader)
            .withWhitelist(AllWhitelist.INSTANCE)
            .withOnlyCustomSerializers(true)
            .withDefaultCustomSerializers(false)
            .buildConfig();
    assertSame(config.getClassLoader(), loader);
    assertSame(config.getWhitelist(), AllWhitelist.INSTANCE);
    assertTrue(config.isOnlyCustomSerializers());
    assertFalse(config.registerDefaultCustomSerializers());
  }

  @Test
  public void testNullOptionsRejected() {
    assertThrows(NullPointerException.class, () -> new ShapeshiftBuilder().withWhitelist(null));
    assertThrows(
        NullPointerException.class,
        () -> new ShapeshiftBuilder().withEvolutionSerializerProvider(null));
  }
}
