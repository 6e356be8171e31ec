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

package org.apache.shapeshift.meta;

import org.apache.qpid.proton.amqp.UnsignedLong;

/** Descriptor codes of the schema elements written with every envelope. */
public enum AmqpDescriptorRegistry {
  ENVELOPE(1),
  SCHEMA(2),
  OBJECT_DESCRIPTOR(3),
  FIELD(4),
  COMPOSITE_TYPE(5),
  RESTRICTED_TYPE(6),
  CHOICE(7),
  TRANSFORMS_SCHEMA(8),
  ENUM_DEFAULT_TRANSFORM(9),
  RENAME_TRANSFORM(10);

  /** Top 32 bits of every code, a private range of the AMQP descriptor space. */
  public static final long DESCRIPTOR_TOP_32BITS = 0xc562L << (32 + 16);

  private final UnsignedLong amqpDescriptor;

  AmqpDescriptorRegistry(long id) {
    this.amqpDescriptor = UnsignedLong.valueOf(id | DESCRIPTOR_TOP_32BITS);
  }

  public UnsignedLong getAmqpDescriptor() {
    return amqpDescriptor;
  }

  /** Whether {@code descriptor} read from the wire is this element's code. */
  public boolean matches(Object descriptor) {
    return amqpDescriptor.equals(descriptor);
  }
}
