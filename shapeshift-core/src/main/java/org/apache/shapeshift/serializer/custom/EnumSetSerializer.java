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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.exception.InsecureException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.serializer.SerializerFactory;

/**
 * Writes any {@link EnumSet} as the name of its element type and the names of its constants.
 * Enum sets keep their element type in a field the JDK doesn't expose, so they can't be written by
 * their properties.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public final class EnumSetSerializer
    extends CustomSerializer.Proxy<EnumSet, EnumSetSerializer.EnumSetProxy> {

  public EnumSetSerializer(SerializerFactory factory) {
    super(EnumSet.class, EnumSetProxy.class, factory, true);
  }

  @Override
  protected EnumSetProxy toProxy(EnumSet obj) {
    Class<? extends Enum> elementType = elementType(obj);
    requireWhitelisted(elementType);
    List<String> constants = new ArrayList<>(obj.size());
    for (Object constant : obj) {
      constants.add(((Enum<?>) constant).name());
    }
    return new EnumSetProxy(elementType.getName(), constants);
  }

  @Override
  protected EnumSet fromProxy(EnumSetProxy proxy) {
    Class<?> elementType;
    try {
      elementType = Class.forName(proxy.elementType, false, factory.getClassLoader());
    } catch (ClassNotFoundException e) {
      throw new DeserializationException("Unknown enum set element type " + proxy.elementType, e);
    }
    if (!elementType.isEnum()) {
      throw new DeserializationException(proxy.elementType + " is not an enum");
    }
    requireWhitelisted(elementType);
    EnumSet result = EnumSet.noneOf((Class) elementType);
    for (String constant : proxy.constants) {
      try {
        result.add(Enum.valueOf((Class) elementType, constant));
      } catch (IllegalArgumentException e) {
        throw new DeserializationException(
            "Enum set of " + proxy.elementType + " holds unknown constant " + constant, e);
      }
    }
    return result;
  }

  /** The element type is found through a member of the set, or else of its complement. */
  private static Class<? extends Enum> elementType(EnumSet set) {
    Iterator<?> it = set.isEmpty() ? EnumSet.complementOf(set).iterator() : set.iterator();
    if (!it.hasNext()) {
      throw new TypeNotSerializableException(
          set.getClass(),
          "Cannot find the element type of an enum set of an enum without constants");
    }
    return ((Enum<?>) it.next()).getDeclaringClass();
  }

  private void requireWhitelisted(Class<?> elementType) {
    if (!factory.isWhitelisted(elementType)) {
      throw new InsecureException(
          "Enum set element type " + elementType.getName() + " is not on the whitelist.");
    }
  }

  public static final class EnumSetProxy {
    private String elementType;
    private List<String> constants;

    private EnumSetProxy() {}

    public EnumSetProxy(String elementType, List<String> constants) {
      this.elementType = elementType;
      this.constants = constants;
    }
  }
}
