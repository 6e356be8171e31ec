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

package org.apache.shapeshift.resolver;

import java.lang.reflect.Type;
import java.util.List;
import org.apache.shapeshift.meta.TypeNotation;

/** Resolves the notations of a received schema to local types, carpenting missing ones. */
public interface RemoteTypeResolver {

  /**
   * Resolve every notation, returning one result per notation in input order.
   *
   * @throws org.apache.shapeshift.exception.TypeNotSerializableException if some type can neither
   *     be located nor carpented
   */
  List<RemoteType> resolveTypes(List<TypeNotation> notations);

  /**
   * Local type for a canonical type name, including array names.
   *
   * @throws ClassNotFoundException if a named class doesn't exist locally
   */
  Type typeForName(String name) throws ClassNotFoundException;
}
