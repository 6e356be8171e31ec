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

package org.apache.shapeshift.model;

/** A property of a remote composite or interface type. */
public final class RemotePropertyInformation {
  private final RemoteTypeInformation type;
  private final boolean mandatory;

  public RemotePropertyInformation(RemoteTypeInformation type, boolean mandatory) {
    this.type = type;
    this.mandatory = mandatory;
  }

  public RemoteTypeInformation getType() {
    return type;
  }

  /** Whether the value can't be null, which makes a primitive property a java primitive. */
  public boolean isMandatory() {
    return mandatory;
  }

  @Override
  public String toString() {
    return type.prettyPrint(true) + (mandatory ? "" : "?");
  }
}
