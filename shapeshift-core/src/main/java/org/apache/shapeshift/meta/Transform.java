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

import org.apache.qpid.proton.amqp.DescribedType;
import org.apache.shapeshift.exception.DeserializationException;

/**
 * A change made to a type that peers holding another version of the type need to know about to
 * read it, see {@link TransformsSchema}.
 */
public abstract class Transform implements DescribedType {

  public static Transform get(Object obj) {
    if (obj instanceof DescribedType) {
      Object code = ((DescribedType) obj).getDescriptor();
      if (AmqpDescriptorRegistry.ENUM_DEFAULT_TRANSFORM.matches(code)) {
        return EnumDefaultTransform.get(obj);
      } else if (AmqpDescriptorRegistry.RENAME_TRANSFORM.matches(code)) {
        return RenameTransform.get(obj);
      }
    }
    throw new DeserializationException("Not a transform: " + obj);
  }
}
