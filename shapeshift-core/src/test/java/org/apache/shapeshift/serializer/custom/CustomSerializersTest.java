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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Currency;
import java.util.EnumSet;
import java.util.List;
import lombok.Data;
import org.apache.shapeshift.Shapeshift;
import org.apache.shapeshift.ShapeshiftTestBase;
import org.apache.shapeshift.exception.InsecureException;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class CustomSerializersTest extends ShapeshiftTestBase {

  @DataProvider
  public static Object[][] defaults() {
    return new Object[][] {
      {new BigDecimal("12345.678901234567890")},
      {new BigInteger("123456789012345678901234567890")},
      {Currency.getInstance("GBP")},
      {Instant.ofEpochSecond(1_700_000_000L, 123_456_789)},
      {LocalDate.of(2024, 2, 29)},
    };
  }

  @Test(dataProvider = "defaults")
  public void testDefaultSerializers(Object value) {
    assertEquals(serDe(newShapeshift(), value), value);
    assertEquals(serDe(newShapeshift(), newShapeshift(), value), value);
  }

  @Test
  public void testDefaultSerializersCanBeDisabled() {
    Shapeshift shapeshift = builder().withDefaultCustomSerializers(false).build();
    assertNull(
        shapeshift.getSerializerFactory().findCustomSerializer(BigDecimal.class, BigDecimal.class));
  }

  @Data
  public static class Invoice {
    private BigDecimal amount;
    private Currency currency;
    private Instant issued;
    private LocalDate due;
  }

  @Test
  public void testCustomSerializedProperties() {
    Invoice invoice = new Invoice();
    invoice.setAmount(new BigDecimal("99.95"));
    invoice.setCurrency(Currency.getInstance("EUR"));
    invoice.setIssued(Instant.ofEpochMilli(1234567L));
    invoice.setDue(LocalDate.of(2030, 1, 1));
    assertEquals(serDe(newShapeshift(), newShapeshift(), invoice), invoice);
  }

  @Test
  public void testProxySchema() {
    Shapeshift shapeshift = newShapeshift();
    List<TypeNotation> types =
        shapeshift
            .deserializeWithEnvelope(shapeshift.serialize(Instant.EPOCH), Instant.class)
            .getEnvelope()
            .getSchema()
            .getTypes();
    assertEquals(types.size(), 1);
    CompositeType notation = (CompositeType) types.get(0);
    assertEquals(notation.getName(), "java.time.Instant");
    assertEquals(notation.getFields().size(), 2);
    assertEquals(notation.getFields().get(0).getName(), "epochSeconds");
    assertEquals(notation.getFields().get(1).getName(), "nanos");
  }

  public enum Flag {
    READ,
    WRITE,
    EXECUTE {
      @Override
      public String toString() {
        return "x";
      }
    }
  }

  @Data
  public static class Permissions {
    private String owner;
    private EnumSet<Flag> flags;
  }

  @Test
  public void testEnumSets() {
    EnumSet<Flag> flags = EnumSet.of(Flag.READ, Flag.EXECUTE);
    Object result = serDe(newShapeshift(), newShapeshift(), flags);
    assertTrue(result instanceof EnumSet, result.getClass().getName());
    assertEquals(result, flags);
    assertEquals(serDe(newShapeshift(), EnumSet.noneOf(Flag.class)), EnumSet.noneOf(Flag.class));
    assertEquals(serDe(newShapeshift(), EnumSet.allOf(Flag.class)), EnumSet.allOf(Flag.class));
    Permissions permissions = new Permissions();
    permissions.setOwner("ops");
    permissions.setFlags(EnumSet.of(Flag.WRITE));
    assertEquals(serDe(newShapeshift(), newShapeshift(), permissions), permissions);
  }

  @Test
  public void testEnumSetElementTypeMustBeWhitelisted() {
    Shapeshift shapeshift = Shapeshift.builder().build();
    assertThrows(InsecureException.class, () -> shapeshift.serialize(EnumSet.of(Flag.READ)));
  }

  /** A value type with no no-arg constructor and no property named constructor. */
  public static final class Money {
    private final long minorUnits;
    private final String currencyCode;

    public Money(String currencyCode, long minorUnits, boolean unused) {
      this.minorUnits = minorUnits;
      this.currencyCode = currencyCode;
    }

    public long getMinorUnits() {
      return minorUnits;
    }

    public String getCurrencyCode() {
      return currencyCode;
    }
  }

  @Data
  public static class MoneyProxy {
    private String code;
    private long units;
  }

  public static class MoneySerializer implements SerializationCustomSerializer<Money, MoneyProxy> {
    @Override
    public MoneyProxy toProxy(Money obj) {
      MoneyProxy proxy = new MoneyProxy();
      proxy.setCode(obj.getCurrencyCode());
      proxy.setUnits(obj.getMinorUnits());
      return proxy;
    }

    @Override
    public Money fromProxy(MoneyProxy proxy) {
      return new Money(proxy.getCode(), proxy.getUnits(), false);
    }
  }

  @Test
  public void testExternalSerializer() {
    Shapeshift writer = newShapeshift();
    writer.registerExternalSerializer(new MoneySerializer());
    Shapeshift reader = newShapeshift();
    reader.registerExternalSerializer(new MoneySerializer());
    Money money = (Money) serDe(writer, reader, new Money("JPY", 500, true));
    assertEquals(money.getCurrencyCode(), "JPY");
    assertEquals(money.getMinorUnits(), 500L);
  }

  @Test
  public void testWithoutExternalSerializer() {
    assertThrows(
        TypeNotSerializableException.class,
        () -> newShapeshift().serialize(new Money("JPY", 500, true)));
  }

  public static class UnboundSerializer<T> implements SerializationCustomSerializer<T, MoneyProxy> {
    @Override
    public MoneyProxy toProxy(T obj) {
      return new MoneyProxy();
    }

    @Override
    public T fromProxy(MoneyProxy proxy) {
      return null;
    }
  }

  @Test
  public void testUnboundExternalSerializer() {
    assertThrows(
        TypeNotSerializableException.class,
        () -> newShapeshift().registerExternalSerializer(new UnboundSerializer<Money>()));
  }

  public static class Animal {
    private final String name;

    public Animal(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }
  }

  public static class Dog extends Animal {
    public Dog(String name) {
      super(name);
    }
  }

  @Data
  public static class AnimalProxy {
    private String name;
  }

  /** Writes every animal as its name, keeping the subclass name in the schema. */
  public static class AnimalSerializer extends CustomSerializer.Proxy<Animal, AnimalProxy> {
    public AnimalSerializer(SerializerFactory factory) {
      super(Animal.class, AnimalProxy.class, factory, true);
    }

    @Override
    public boolean revealSubclassesInSchema() {
      return true;
    }

    @Override
    protected AnimalProxy toProxy(Animal obj) {
      AnimalProxy proxy = new AnimalProxy();
      proxy.setName(obj.getName());
      return proxy;
    }

    @Override
    protected Animal fromProxy(AnimalProxy proxy) {
      return new Animal(proxy.getName());
    }
  }

  @Test
  public void testSubclassRevealedInSchema() {
    Shapeshift shapeshift = newShapeshift();
    SerializerFactory factory = shapeshift.getSerializerFactory();
    AnimalSerializer animalSerializer = new AnimalSerializer(factory);
    shapeshift.registerSerializer(animalSerializer);
    assertSame(factory.get(Animal.class, Animal.class), animalSerializer);
    Serializer<Object> dogSerializer = factory.get(Dog.class, Dog.class);
    assertTrue(dogSerializer instanceof CustomSerializer.SubClass, dogSerializer.toString());
    assertSame(factory.get(Dog.class, Dog.class), dogSerializer);

    byte[] bytes = shapeshift.serialize(new Dog("Rex"));
    List<TypeNotation> types =
        shapeshift
            .deserializeWithEnvelope(bytes, Animal.class)
            .getEnvelope()
            .getSchema()
            .getTypes();
    RestrictedType dogNotation =
        (RestrictedType)
            types.stream().filter(t -> t.getName().equals(Dog.class.getName())).findFirst().get();
    assertEquals(dogNotation.getSource(), Animal.class.getName());
    assertTrue(types.stream().anyMatch(t -> t.getName().equals(Animal.class.getName())));

    Shapeshift reader = newShapeshift();
    reader.registerSerializer(new AnimalSerializer(reader.getSerializerFactory()));
    Animal animal = reader.deserialize(bytes, Animal.class);
    assertEquals(animal.getName(), "Rex");
  }
}
