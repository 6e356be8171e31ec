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

package org.apache.shapeshift;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.serializer.ObjectAndEnvelope;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ShapeshiftTest extends ShapeshiftTestBase {

  public enum Color {
    RED,
    GREEN,
    BLUE
  }

  public enum Operation {
    PLUS {
      @Override
      int apply(int a, int b) {
        return a + b;
      }
    },
    MINUS {
      @Override
      int apply(int a, int b) {
        return a - b;
      }
    };

    abstract int apply(int a, int b);
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Address {
    private String street;
    private int number;
  }

  @Data
  public static class Person {
    private String name;
    private int age;
    private Integer height;
    private boolean active;
    private char initial;
    private long id;
    private double score;
    private Color favouriteColor;
    private List<String> tags;
    private Map<String, Integer> counters;
    private Address address;
    private int[] lucky;
    private String[] aliases;
    private byte[] avatar;
    private Date created;
    private UUID uuid;
  }

  @Value
  public static class Coordinates {
    double latitude;
    double longitude;
  }

  public record Range(int from, int to) {}

  public static final class Nothing {
    public static final Nothing INSTANCE = new Nothing();

    private Nothing() {}
  }

  @DataProvider
  public static Object[][] primitives() {
    return new Object[][] {
      {1},
      {-7L},
      {(short) 3},
      {(byte) 4},
      {1.5f},
      {2.25d},
      {true},
      {"hello"},
      {UUID.fromString("3e1d2c5a-4b6f-4a59-8a1b-0c2d3e4f5a6b")},
      {new Date(1_600_000_000_000L)},
    };
  }

  @Test(dataProvider = "primitives")
  public void testPrimitives(Object value) {
    assertEquals(serDe(newShapeshift(), value), value);
  }

  @Test
  public void testChar() {
    Shapeshift shapeshift = newShapeshift();
    Character result = shapeshift.deserialize(shapeshift.serialize('x'), Character.class);
    assertEquals(result, (Character) 'x');
  }

  @Test
  public void testNull() {
    assertNull(serDe(newShapeshift(), null));
  }

  @Test
  public void testBinary() {
    byte[] bytes = {1, 2, 3};
    assertEquals(serDe(newShapeshift(), bytes), bytes);
  }

  @Test
  public void testList() {
    List<String> list = new ArrayList<>(ImmutableList.of("a", "b"));
    Object result = serDe(newShapeshift(), list);
    assertTrue(result instanceof ArrayList, result.getClass().getName());
    assertEquals(result, list);
  }

  @Test
  public void testSortedSet() {
    TreeSet<Integer> set = new TreeSet<>(Arrays.asList(3, 1, 2));
    Object result = serDe(newShapeshift(), set);
    assertTrue(result instanceof TreeSet, result.getClass().getName());
    assertEquals(result, set);
  }

  @Test
  public void testMap() {
    Map<String, Integer> map = new LinkedHashMap<>();
    map.put("x", 1);
    map.put("y", 2);
    Object result = serDe(newShapeshift(), map);
    assertTrue(result instanceof LinkedHashMap, result.getClass().getName());
    assertEquals(result, map);
    assertEquals(ImmutableList.copyOf(((Map<?, ?>) result).keySet()), ImmutableList.of("x", "y"));
  }

  @Test
  public void testEnum() {
    Shapeshift shapeshift = newShapeshift();
    assertSame(serDe(shapeshift, Color.GREEN), Color.GREEN);
    assertSame(serDe(shapeshift, Operation.MINUS), Operation.MINUS);
  }

  @Test
  public void testArrays() {
    Shapeshift shapeshift = newShapeshift();
    assertEquals(serDe(shapeshift, new int[] {1, 2, 3}), new int[] {1, 2, 3});
    assertEquals(serDe(shapeshift, new long[] {4L, 5L}), new long[] {4L, 5L});
    assertEquals(serDe(shapeshift, new char[] {'a', 'b'}), new char[] {'a', 'b'});
    assertEquals(serDe(shapeshift, new String[] {"a", null, "c"}), new String[] {"a", null, "c"});
    assertEquals(
        serDe(shapeshift, new Color[] {Color.BLUE, Color.RED}),
        new Color[] {Color.BLUE, Color.RED});
  }

  @Test
  public void testBean() {
    Person person = new Person();
    person.setName("Ada");
    person.setAge(36);
    person.setActive(true);
    person.setInitial('A');
    person.setId(42L);
    person.setScore(99.5);
    person.setFavouriteColor(Color.BLUE);
    person.setTags(new ArrayList<>(ImmutableList.of("math", "engines")));
    Map<String, Integer> counters = new LinkedHashMap<>();
    counters.put("papers", 3);
    person.setCounters(counters);
    person.setAddress(new Address("St James's Square", 12));
    person.setLucky(new int[] {7, 13});
    person.setAliases(new String[] {"Countess"});
    person.setAvatar(new byte[] {9, 8});
    person.setCreated(new Date(1_000L));
    person.setUuid(UUID.randomUUID());
    Object result = serDe(newShapeshift(), person);
    assertEquals(result, person);
    assertNull(((Person) result).getHeight());
  }

  @Test
  public void testBeanAcrossInstances() {
    Person person = new Person();
    person.setName("Grace");
    person.setAddress(new Address("Arlington", 1));
    assertEquals(serDe(newShapeshift(), newShapeshift(), person), person);
  }

  @Test
  public void testConstructorAndRecord() {
    Shapeshift shapeshift = newShapeshift();
    Coordinates coordinates = new Coordinates(51.5, -0.12);
    assertEquals(serDe(shapeshift, coordinates), coordinates);
    assertEquals(serDe(shapeshift, new Range(1, 10)), new Range(1, 10));
    assertEquals(serDe(newShapeshift(), shapeshift, new Range(2, 3)), new Range(2, 3));
  }

  @Test
  public void testSingleton() {
    assertSame(serDe(newShapeshift(), newShapeshift(), Nothing.INSTANCE), Nothing.INSTANCE);
  }

  @Test
  public void testEnvelopeSchema() {
    Shapeshift shapeshift = newShapeshift();
    Address address = new Address("Baker Street", 221);
    ObjectAndEnvelope<Address> result =
        shapeshift.deserializeWithEnvelope(shapeshift.serialize(address), Address.class);
    assertEquals(result.getObj(), address);
    List<TypeNotation> types = result.getEnvelope().getSchema().getTypes();
    assertEquals(types.size(), 1);
    assertEquals(types.get(0).getName(), Address.class.getName());
    CompositeType composite = (CompositeType) types.get(0);
    assertEquals(composite.getFields().get(0).getName(), "number");
    assertEquals(composite.getFields().get(0).getType(), "int");
    assertTrue(composite.getFields().get(0).isMandatory());
    assertEquals(composite.getFields().get(1).getName(), "street");
    assertEquals(composite.getFields().get(1).getType(), "string");
  }

  @Test
  public void testHeaderMismatch() {
    byte[] bytes = newShapeshift().serialize("abc");
    bytes[0] = 'x';
    DeserializationException e =
        expectThrows(DeserializationException.class, () -> newShapeshift().deserialize(bytes));
    assertEquals(e.getMessage(), "Serialization header does not match.");
    assertThrows(DeserializationException.class, () -> newShapeshift().deserialize(new byte[2]));
  }

  @Test
  public void testUnexpectedType() {
    Shapeshift shapeshift = newShapeshift();
    byte[] bytes = shapeshift.serialize("abc");
    DeserializationException e =
        expectThrows(
            DeserializationException.class, () -> shapeshift.deserialize(bytes, Integer.class));
    assertTrue(e.getMessage().startsWith("Found object of type java.lang.String"), e.getMessage());
  }
}
