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
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.shapeshift.meta.TypeNotation;

/**
 * A schema notation resolved to a local type. The {@link #getLocalDescriptor() local descriptor}
 * is the one a local serializer of the type writes; when it differs from the {@link
 * #getRemoteDescriptor() remote descriptor} the sender's type has a different shape.
 */
public final class RemoteType {
  private final Type type;
  private final TypeNotation notation;
  private final Symbol localDescriptor;

  public RemoteType(Type type, TypeNotation notation, Symbol localDescriptor) {
    this.type = type;
    this.notation = notation;
    this.localDescriptor = localDescriptor;
  }

  public Type getType() {
    return type;
  }

  public TypeNotation getNotation() {
    return notation;
  }

  public Symbol getLocalDescriptor() {
    return localDescriptor;
  }

  public Symbol getRemoteDescriptor() {
    return notation.getDescriptorElement().getName();
  }

  /** Whether the remote and local shapes of the type differ. */
  public boolean isDescriptorMismatch() {
    return !String.valueOf(localDescriptor).equals(String.valueOf(getRemoteDescriptor()));
  }

  @Override
  public String toString() {
    return "RemoteType("
        + type.getTypeName()
        + ", remote="
        + getRemoteDescriptor()
        + ", local="
        + localDescriptor
        + ")";
  }
}
