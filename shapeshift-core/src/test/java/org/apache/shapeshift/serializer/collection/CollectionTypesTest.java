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

package org.apache.shapeshift.serializer.collection;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

import com.google.common.reflect.TypeToken;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Hashtable;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.WeakHashMap;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.type.TypeUtils;
import org.testng.annotations.Test;

public class CollectionTypesTest {

  @Test
  public void testFindMostSuitableCollectionType() {
    assertEquals(CollectionSerializer.findMostSuitableCollectionType(ArrayList.class), List.class);
    assertEquals(
        CollectionSerializer.findMostSuitableCollectionType(
            Collections.unmodifiableList(new ArrayList<>()).getClass()),
        List.class);
    assertEquals(
        CollectionSerializer.findMostSuitableCollectionType(LinkedHashSet.class), Set.class);
    assertEquals(
        CollectionSerializer.findMostSuitableCollectionType(TreeSet.class), NavigableSet.class);
    assertEquals(
        CollectionSerializer.findMostSuitableCollectionType(ArrayDeque.class), Collection.class);
    assertThrows(
        TypeNotSerializableException.class,
        () -> CollectionSerializer.findMostSuitableCollectionType(String.class));
  }

  @Test
  public void testDeriveCollectionType() {
    assertEquals(
        CollectionSerializer.deriveParameterizedType(
            new TypeToken<ArrayList<String>>() {}.getType(), ArrayList.class, ArrayList.class),
        new TypeToken<List<String>>() {}.getType());
    // A supported declared shape is kept even when the runtime class is more specific.
    assertEquals(
        CollectionSerializer.deriveParameterizedType(
            new TypeToken<Collection<Integer>>() {}.getType(), Collection.class, TreeSet.class),
        new TypeToken<Collection<Integer>>() {}.getType());
    assertEquals(
        TypeUtils.nameForType(
            CollectionSerializer.deriveParameterizedType(List.class, List.class, ArrayList.class)),
        "java.util.List<?>");
    assertEquals(
        TypeUtils.nameForType(
            CollectionSerializer.deriveParameterizedType(
                Object.class, Object.class, TreeSet.class)),
        "java.util.NavigableSet<?>");
    assertThrows(
        TypeNotSerializableException.class,
        () -> CollectionSerializer.deriveParameterizedType(Object.class, Object.class, null));
  }

  @Test
  public void testFindMostSuitableMapType() {
    assertEquals(MapSerializer.findMostSuitableMapType(LinkedHashMap.class), Map.class);
    assertEquals(MapSerializer.findMostSuitableMapType(TreeMap.class), NavigableMap.class);
    assertThrows(
        TypeNotSerializableException.class,
        () -> MapSerializer.findMostSuitableMapType(ArrayList.class));
  }

  @Test
  public void testDeriveMapType() {
    assertEquals(
        MapSerializer.deriveParameterizedType(
            new TypeToken<LinkedHashMap<String, Long>>() {}.getType(),
            LinkedHashMap.class,
            LinkedHashMap.class),
        new TypeToken<Map<String, Long>>() {}.getType());
    assertEquals(
        TypeUtils.nameForType(
            MapSerializer.deriveParameterizedType(Object.class, Object.class, TreeMap.class)),
        "java.util.NavigableMap<?, ?>");
  }

  @Test
  public void testUnsupportedMapTypes() {
    MapSerializer.checkSupportedMapType(LinkedHashMap.class);
    MapSerializer.checkSupportedMapType(TreeMap.class);
    assertThrows(
        TypeNotSerializableException.class,
        () -> MapSerializer.checkSupportedMapType(HashMap.class));
    assertThrows(
        TypeNotSerializableException.class,
        () -> MapSerializer.checkSupportedMapType(WeakHashMap.class));
    assertThrows(
        TypeNotSerializableException.class,
        () -> MapSerializer.checkSupportedMapType(IdentityHashMap.class));
    assertThrows(
        TypeNotSerializableException.class,
        () -> MapSerializer.checkSupportedMapType(Hashtable.class));
  }
}
