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

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.apache.shapeshift.carpenter.RemoteTypeCarpenter;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.type.TypeIdentifier;

/**
 * Orders a set of types needing carpentry so that every type is synthesized after the types in the
 * set it depends on through its properties, type parameters, interfaces or array components.
 *
 * <p>Only edges whose target is in the set are recorded, and a type referencing itself records no
 * edge. Each round emits every type whose dependencies have all been emitted, in input order; a
 * round that emits nothing while types remain means the remaining types depend on each other.
 */
public final class CarpentryDependencyGraph {
  private final Set<RemoteTypeInformation> typesRequiringCarpentry;
  private final Map<RemoteTypeInformation, Set<RemoteTypeInformation>> dependencies =
      new LinkedHashMap<>();

  private CarpentryDependencyGraph(Collection<RemoteTypeInformation> typesRequiringCarpentry) {
    this.typesRequiringCarpentry = new LinkedHashSet<>(typesRequiringCarpentry);
  }

  /**
   * Order {@code types} for carpentry.
   *
   * @throws TypeNotSerializableException if some types depend on each other in a cycle
   */
  public static List<RemoteTypeInformation> order(Collection<RemoteTypeInformation> types) {
    CarpentryDependencyGraph graph = new CarpentryDependencyGraph(types);
    for (RemoteTypeInformation type : graph.typesRequiringCarpentry) {
      graph.recordDependencies(type);
    }
    return graph.topologicalSort();
  }

  /**
   * Carpent {@code types} in dependency order, reusing types already present in {@code cache}. The
   * whole order is computed before the first type is synthesized.
   *
   * @return the local type of each input type, keyed by identifier, in carpentry order
   */
  public static Map<TypeIdentifier, Type> carpentInOrder(
      RemoteTypeCarpenter carpenter,
      ConcurrentMap<TypeIdentifier, Type> cache,
      Collection<RemoteTypeInformation> types) {
    Map<TypeIdentifier, Type> result = new LinkedHashMap<>();
    for (RemoteTypeInformation type : order(types)) {
      result.put(
          type.getTypeIdentifier(),
          cache.computeIfAbsent(type.getTypeIdentifier(), id -> carpenter.carpent(type)));
    }
    return result;
  }

  private void recordDependencies(RemoteTypeInformation type) {
    if (type instanceof RemoteTypeInformation.Composable) {
      RemoteTypeInformation.Composable composable = (RemoteTypeInformation.Composable) type;
      composable.getProperties().values().forEach(p -> addDependency(type, p.getType()));
      composable.getInterfaces().forEach(i -> addDependency(type, i));
      composable.getTypeParameters().forEach(p -> addDependency(type, p));
    } else if (type instanceof RemoteTypeInformation.AnInterface) {
      RemoteTypeInformation.AnInterface anInterface = (RemoteTypeInformation.AnInterface) type;
      anInterface.getProperties().values().forEach(p -> addDependency(type, p.getType()));
      anInterface.getInterfaces().forEach(i -> addDependency(type, i));
      anInterface.getTypeParameters().forEach(p -> addDependency(type, p));
    } else if (type instanceof RemoteTypeInformation.AnEnum) {
      ((RemoteTypeInformation.AnEnum) type).getInterfaces().forEach(i -> addDependency(type, i));
    } else if (type instanceof RemoteTypeInformation.AnArray) {
      addDependency(type, ((RemoteTypeInformation.AnArray) type).getComponentType());
    } else if (type instanceof RemoteTypeInformation.Parameterised) {
      ((RemoteTypeInformation.Parameterised) type)
          .getTypeParameters()
          .forEach(p -> addDependency(type, p));
    }
  }

  private void addDependency(RemoteTypeInformation dependent, RemoteTypeInformation dependee) {
    // Dependencies reached through arrays and type parameters count as well.
    if (dependee instanceof RemoteTypeInformation.AnArray
        && !typesRequiringCarpentry.contains(dependee)) {
      addDependency(dependent, ((RemoteTypeInformation.AnArray) dependee).getComponentType());
      return;
    }
    if (dependee instanceof RemoteTypeInformation.Parameterised
        && !typesRequiringCarpentry.contains(dependee)) {
      ((RemoteTypeInformation.Parameterised) dependee)
          .getTypeParameters()
          .forEach(p -> addDependency(dependent, p));
      return;
    }
    if (dependent.equals(dependee) || !typesRequiringCarpentry.contains(dependee)) {
      return;
    }
    dependencies.computeIfAbsent(dependent, k -> new LinkedHashSet<>()).add(dependee);
  }

  private List<RemoteTypeInformation> topologicalSort() {
    List<RemoteTypeInformation> sorted = new ArrayList<>();
    Set<RemoteTypeInformation> frontier = new LinkedHashSet<>();
    for (RemoteTypeInformation type : typesRequiringCarpentry) {
      if (!dependencies.containsKey(type)) {
        frontier.add(type);
      }
    }
    sorted.addAll(frontier);
    while (!dependencies.isEmpty()) {
      Set<RemoteTypeInformation> promoted = new LinkedHashSet<>();
      for (Iterator<Map.Entry<RemoteTypeInformation, Set<RemoteTypeInformation>>> it =
              dependencies.entrySet().iterator();
          it.hasNext(); ) {
        Map.Entry<RemoteTypeInformation, Set<RemoteTypeInformation>> entry = it.next();
        entry.getValue().removeAll(frontier);
        if (entry.getValue().isEmpty()) {
          promoted.add(entry.getKey());
          it.remove();
        }
      }
      if (promoted.isEmpty()) {
        throw new TypeNotSerializableException(
            "Cannot build dependencies for "
                + dependencies.keySet().stream()
                    .map(t -> t.prettyPrint(false))
                    .collect(Collectors.joining(", ", "[", "]")));
      }
      sorted.addAll(promoted);
      frontier = promoted;
    }
    return sorted;
  }
}
