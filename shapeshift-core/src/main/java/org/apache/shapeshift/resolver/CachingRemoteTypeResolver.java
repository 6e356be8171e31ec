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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.shapeshift.carpenter.CarpenterException;
import org.apache.shapeshift.carpenter.RemoteTypeCarpenter;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.model.CarpentryDependencyGraph;
import org.apache.shapeshift.model.RemoteTypeInformation;
import org.apache.shapeshift.model.RemoteTypeInterpreter;
import org.apache.shapeshift.serializer.struct.FingerPrinter;
import org.apache.shapeshift.type.TypeIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves notations in two passes. The first pass locates every type by name; notations naming
 * missing classes are interpreted together with the whole schema and carpented as one batch in
 * dependency order. The second pass then locates the remaining types, and a class still missing is
 * fatal. Resolutions are cached by wire descriptor.
 */
@ThreadSafe
public class CachingRemoteTypeResolver implements RemoteTypeResolver {
  private static final Logger LOG = LoggerFactory.getLogger(CachingRemoteTypeResolver.class);

  private final ConcurrentMap<String, RemoteType> resolvedTypes = new ConcurrentHashMap<>();
  private final ConcurrentMap<TypeIdentifier, Type> carpentedTypes = new ConcurrentHashMap<>();
  private final RemoteTypeCarpenter carpenter;
  private final FingerPrinter fingerPrinter;
  private final String descriptorDomain;

  public CachingRemoteTypeResolver(
      RemoteTypeCarpenter carpenter, FingerPrinter fingerPrinter, String descriptorDomain) {
    this.carpenter = carpenter;
    this.fingerPrinter = fingerPrinter;
    this.descriptorDomain = descriptorDomain;
  }

  @Override
  public List<RemoteType> resolveTypes(List<TypeNotation> notations) {
    RemoteType[] results = new RemoteType[notations.size()];
    Map<Integer, TypeNotation> pending = new LinkedHashMap<>();
    for (int i = 0; i < notations.size(); i++) {
      TypeNotation notation = notations.get(i);
      try {
        results[i] = getOrResolve(notation);
      } catch (ClassNotFoundException e) {
        LOG.trace("Class {} not found locally, it needs carpentry", notation.getName());
        pending.put(i, notation);
      }
    }
    if (!pending.isEmpty()) {
      carpentMissingTypes(notations, new ArrayList<>(pending.values()));
      for (Map.Entry<Integer, TypeNotation> entry : pending.entrySet()) {
        try {
          results[entry.getKey()] = getOrResolve(entry.getValue());
        } catch (ClassNotFoundException e) {
          LOG.error("Class {} can't be found after carpentry", entry.getValue().getName());
          throw new TypeNotSerializableException(
              null, "Unable to locate or carpent type " + entry.getValue().getName(), e);
        }
      }
    }
    return Arrays.asList(results);
  }

  private RemoteType getOrResolve(TypeNotation notation) throws ClassNotFoundException {
    String descriptor = String.valueOf(notation.getDescriptorElement().getName());
    RemoteType remoteType = resolvedTypes.get(descriptor);
    if (remoteType != null) {
      return remoteType;
    }
    // Can't use computeIfAbsent, resolution throws a checked exception to request carpentry.
    remoteType = resolve(notation);
    RemoteType previous = resolvedTypes.putIfAbsent(descriptor, remoteType);
    return previous != null ? previous : remoteType;
  }

  private RemoteType resolve(TypeNotation notation) throws ClassNotFoundException {
    Type type = typeForName(notation.getName());
    Symbol localDescriptor =
        Symbol.valueOf(descriptorDomain + ":" + fingerPrinter.fingerprint(type));
    return new RemoteType(type, notation, localDescriptor);
  }

  private void carpentMissingTypes(List<TypeNotation> notations, List<TypeNotation> missing) {
    Map<String, RemoteTypeInformation> interpreted = RemoteTypeInterpreter.interpret(notations);
    List<RemoteTypeInformation> toCarpent = new ArrayList<>();
    for (TypeNotation notation : missing) {
      RemoteTypeInformation information = interpreted.get(notation.getName());
      if (information instanceof RemoteTypeInformation.Composable
          || information instanceof RemoteTypeInformation.AnInterface
          || information instanceof RemoteTypeInformation.AnEnum) {
        toCarpent.add(information);
      }
    }
    try {
      CarpentryDependencyGraph.carpentInOrder(carpenter, carpentedTypes, toCarpent);
    } catch (CarpenterException e) {
      LOG.error("{} [hint: enable trace debugging for the stack trace]", e.getMessage());
      LOG.trace("Carpentry failed", e);
      throw new TypeNotSerializableException(e.getMessage());
    }
  }

  @Override
  public Type typeForName(String name) throws ClassNotFoundException {
    return TypeIdentifier.parse(name).getLocalType(carpenter.getClassLoader());
  }
}
