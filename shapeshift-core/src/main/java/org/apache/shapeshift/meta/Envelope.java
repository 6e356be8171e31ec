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

import java.util.Arrays;
import java.util.List;
import org.apache.qpid.proton.amqp.DescribedType;

/**
 * Top level element of a serialized payload: the object, the schema describing every described
 * type the object graph uses and the transforms of those types. On the wire the envelope is
 * preceded by {@link #MAGIC}. Envelopes without transforms read as having none.
 */
public final class Envelope implements DescribedType {
  /** "shpsft" followed by the format version. */
  public static final byte[] MAGIC = {'s', 'h', 'p', 's', 'f', 't', 1};

  private final Object obj;
  private final Schema schema;
  private final TransformsSchema transforms;

  public Envelope(Object obj, Schema schema) {
    this(obj, schema, schema.getTransforms());
  }

  public Envelope(Object obj, Schema schema, TransformsSchema transforms) {
    this.obj = obj;
    this.schema = schema;
    this.transforms = transforms;
  }

  public static Envelope get(Object obj) {
    List<?> list = DescribedElements.describedList(obj, AmqpDescriptorRegistry.ENVELOPE, 2);
    TransformsSchema transforms =
        list.size() > 2 && list.get(2) != null
            ? TransformsSchema.get(list.get(2))
            : TransformsSchema.EMPTY;
    return new Envelope(list.get(0), Schema.get(list.get(1), transforms), transforms);
  }

  /** The encoded object, as decoded AMQP data. */
  public Object getObj() {
    return obj;
  }

  public Schema getSchema() {
    return schema;
  }

  public TransformsSchema getTransforms() {
    return transforms;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.ENVELOPE.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(obj, schema, transforms);
  }
}
