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

package org.apache.shapeshift.serializer.custom;

/**
 * User supplied conversion of a type the factory can't serialize by its properties to a proxy it
 * can. Register implementations with {@link
 * org.apache.shapeshift.Shapeshift#registerExternalSerializer(SerializationCustomSerializer)}.
 *
 * <p>The proxy class must be serializable by its properties: either have a no-arg constructor, or
 * a constructor taking every property by name.
 *
 * @param <OBJ> the type being serialized
 * @param <PROXY> the proxy written in its place
 */
public interface SerializationCustomSerializer<OBJ, PROXY> {

  PROXY toProxy(OBJ obj);

  OBJ fromProxy(PROXY proxy);
}
