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

import org.apache.shapeshift.config.ShapeshiftBuilder;
import org.apache.shapeshift.resolver.AllWhitelist;

/** Base class for tests that need a permissive {@link Shapeshift}. */
public abstract class ShapeshiftTestBase {

  public static ShapeshiftBuilder builder() {
    return Shapeshift.builder().withWhitelist(AllWhitelist.INSTANCE);
  }

  public static Shapeshift newShapeshift() {
    return builder().build();
  }

  /** A shapeshift instance that resolves classes through {@code classLoader}. */
  public static Shapeshift newShapeshift(ClassLoader classLoader) {
    return builder().withClassLoader(classLoader).build();
  }

  @SuppressWarnings("unchecked")
  public static <T> T serDe(Shapeshift shapeshift, T obj) {
    return (T) shapeshift.deserialize(shapeshift.serialize(obj), Object.class);
  }

  public static Object serDe(Shapeshift writer, Shapeshift reader, Object obj) {
    return reader.deserialize(writer.serialize(obj));
  }
}
