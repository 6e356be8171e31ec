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

package org.apache.shapeshift.reflect;

import java.util.List;

/**
 * Abstract base class for creating instances of a given type from deserialized property values.
 *
 * <p>Implementations handle records through their canonical constructor, classes with a no-arg
 * constructor by setting fields after construction, and classes whose constructor parameters are
 * named after their properties. All implementations are thread-safe.
 *
 * @param <T> the type of objects this creator can instantiate
 */
public abstract class ObjectCreator<T> {
  protected final Class<T> type;

  protected ObjectCreator(Class<T> type) {
    this.type = type;
  }

  /**
   * Creates a new instance whose property {@code propertyNames[i]} holds {@code values[i]}.
   * Properties of the type that aren't named get the java default of their type.
   *
   * @throws org.apache.shapeshift.exception.ShapeshiftException if instance creation fails
   */
  public abstract T newInstance(List<String> propertyNames, Object[] values);
}
