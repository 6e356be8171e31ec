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

package org.apache.shapeshift.type;

import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.Arrays;

/** The unbounded wildcard {@code ?}, equal to any JDK wildcard with the same bounds. */
public final class AnyType implements WildcardType {
  public static final AnyType INSTANCE = new AnyType();

  private static final Type[] UPPER_BOUNDS = {Object.class};
  private static final Type[] LOWER_BOUNDS = {};

  private AnyType() {}

  @Override
  public Type[] getUpperBounds() {
    return UPPER_BOUNDS.clone();
  }

  @Override
  public Type[] getLowerBounds() {
    return LOWER_BOUNDS.clone();
  }

  @Override
  public String getTypeName() {
    return "?";
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WildcardType)) {
      return false;
    }
    WildcardType that = (WildcardType) o;
    return Arrays.equals(UPPER_BOUNDS, that.getUpperBounds())
        && Arrays.equals(LOWER_BOUNDS, that.getLowerBounds());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(LOWER_BOUNDS) ^ Arrays.hashCode(UPPER_BOUNDS);
  }

  @Override
  public String toString() {
    return "?";
  }
}
