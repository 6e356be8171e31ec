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

package org.apache.shapeshift.exception;

import java.lang.reflect.Type;

/**
 * Raised when a type can't be serialized or reconstructed: synthetic or anonymous classes, types
 * that can't be rendered to a wire name, unsupported collection or map implementations, schemas
 * which don't describe the requested descriptor, and carpentry failures translated at the
 * resolution boundary.
 */
public class TypeNotSerializableException extends ShapeshiftException {
  private final transient Type type;

  public TypeNotSerializableException(String message) {
    this(null, message);
  }

  public TypeNotSerializableException(Type type, String message) {
    super(message);
    this.type = type;
  }

  public TypeNotSerializableException(Type type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  /** The offending type, null if the failure isn't attributable to a single type. */
  public Type getType() {
    return type;
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    if (type == null) {
      return message;
    }
    return message + " [type=" + type.getTypeName() + "]";
  }
}
