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
import java.util.Objects;
import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.UnsignedLong;

/** The descriptor a type's values are written with, a symbol and an optional numeric code. */
public final class Descriptor implements DescribedType {
  private final Symbol name;
  private final UnsignedLong code;

  public Descriptor(Symbol name) {
    this(name, null);
  }

  public Descriptor(Symbol name, UnsignedLong code) {
    this.name = name;
    this.code = code;
  }

  public static Descriptor get(Object obj) {
    List<?> list =
        DescribedElements.describedList(obj, AmqpDescriptorRegistry.OBJECT_DESCRIPTOR, 2);
    Object name = list.get(0);
    return new Descriptor(
        name instanceof Symbol ? (Symbol) name : Symbol.valueOf(DescribedElements.string(name)),
        (UnsignedLong) list.get(1));
  }

  public Symbol getName() {
    return name;
  }

  public UnsignedLong getCode() {
    return code;
  }

  @Override
  public Object getDescriptor() {
    return AmqpDescriptorRegistry.OBJECT_DESCRIPTOR.getAmqpDescriptor();
  }

  @Override
  public Object getDescribed() {
    return Arrays.asList(name, code);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Descriptor)) {
      return false;
    }
    Descriptor that = (Descriptor) o;
    return Objects.equals(String.valueOf(name), String.valueOf(that.name))
        && Objects.equals(code, that.code);
  }

  @Override
  public int hashCode() {
    return Objects.hash(String.valueOf(name), code);
  }

  @Override
  public String toString() {
    return code == null ? String.valueOf(name) : name + "(" + code + ")";
  }
}
