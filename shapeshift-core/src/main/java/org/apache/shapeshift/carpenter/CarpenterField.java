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

import com.google.common.base.Preconditions;

/** A property of a synthesized type. */
public final class CarpenterField {
  private final String name;
  private final Class<?> type;
  private final boolean selfReference;

  private CarpenterField(String name, Class<?> type, boolean selfReference) {
    this.name = Preconditions.checkNotNull(name);
    this.type = type;
    this.selfReference = selfReference;
  }

  public static CarpenterField of(String name, Class<?> type) {
    return new CarpenterField(name, Preconditions.checkNotNull(type), false);
  }

  /** A property typed as the synthesized type itself. */
  public static CarpenterField selfReference(String name) {
    return new CarpenterField(name, null, true);
  }

  public String getName() {
    return name;
  }

  /** The property type, null for a {@link #isSelfReference() self reference}. */
  public Class<?> getType() {
    return type;
  }

  public boolean isSelfReference() {
    return selfReference;
  }

  @Override
  public String toString() {
    return name + ": " + (selfReference ? "<self>" : type.getName());
  }
}
