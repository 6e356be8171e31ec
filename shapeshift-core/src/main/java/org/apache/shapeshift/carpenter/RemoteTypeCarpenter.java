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

package org.apache.shapeshift.carpenter;

import java.lang.reflect.Type;
import org.apache.shapeshift.model.RemoteTypeInformation;

/** Builds local types for remote types that have no local counterpart. */
public interface RemoteTypeCarpenter {

  /**
   * Build a local type for {@code typeInformation}. The types it depends on must have been built
   * already.
   *
   * @throws CarpenterException if no type can be built
   */
  Type carpent(RemoteTypeInformation typeInformation);

  /** Loader through which carpented types, and local types, can be found by name. */
  ClassLoader getClassLoader();

  boolean isCarpented(Class<?> cls);
}
