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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/** Description of a type to synthesize: its binary name, properties and interfaces. */
public abstract class CarpenterSchema {
  private final String name;
  private final Map<String, CarpenterField> fields;
  private final List<Class<?>> interfaces;

  protected CarpenterSchema(String name, List<CarpenterField> fields, List<Class<?>> interfaces) {
    this.name = name;
    ImmutableMap.Builder<String, CarpenterField> builder = ImmutableMap.builder();
    for (CarpenterField field : fields) {
      builder.put(field.getName(), field);
    }
    try {
      this.fields = builder.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new DuplicateNameException("Duplicate property name in " + name, e);
    }
    this.interfaces = ImmutableList.copyOf(interfaces);
  }

  public String getName() {
    return name;
  }

  public String getPackageName() {
    int index = name.lastIndexOf('.');
    return index < 0 ? "" : name.substring(0, index);
  }

  public String getSimpleName() {
    return name.substring(name.lastIndexOf('.') + 1);
  }

  /** Properties in declaration order. */
  public Map<String, CarpenterField> getFields() {
    return fields;
  }

  public List<Class<?>> getInterfaces() {
    return interfaces;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ", " + fields.values() + ")";
  }

  /** A concrete class with a no-arg and an all-args constructor and a getter per field. */
  public static final class ClassSchema extends CarpenterSchema {
    public ClassSchema(String name, List<CarpenterField> fields, List<Class<?>> interfaces) {
      super(name, fields, interfaces);
    }
  }

  /** An interface declaring a getter per field. */
  public static final class InterfaceSchema extends CarpenterSchema {
    public InterfaceSchema(String name, List<CarpenterField> fields, List<Class<?>> interfaces) {
      super(name, fields, interfaces);
    }
  }

  /** An enum with the given constants, in ordinal order. */
  public static final class EnumSchema extends CarpenterSchema {
    private final List<String> constants;

    public EnumSchema(String name, List<String> constants) {
      super(name, ImmutableList.of(), ImmutableList.of());
      this.constants = ImmutableList.copyOf(constants);
    }

    public List<String> getConstants() {
      return constants;
    }
  }
}
