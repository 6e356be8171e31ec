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

/** Creates new classes at runtime from {@link CarpenterSchema}s. */
public interface TypeSynthesizer {

  /**
   * Synthesize and load the type {@code schema} describes.
   *
   * @throws CarpenterException if the type can't be synthesized
   */
  Class<?> synthesize(CarpenterSchema schema);

  /** Loader that sees every type synthesized so far, and the classes of the parent loader. */
  ClassLoader getClassLoader();

  /** Whether {@code cls} was created by this synthesizer. */
  boolean isSynthesized(Class<?> cls);
}
