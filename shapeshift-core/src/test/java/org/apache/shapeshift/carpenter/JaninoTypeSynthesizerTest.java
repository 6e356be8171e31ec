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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.util.Collections;
import org.apache.shapeshift.TestUtils;
import org.testng.annotations.Test;

public class JaninoTypeSynthesizerTest {

  private JaninoTypeSynthesizer newSynthesizer() {
    return new JaninoTypeSynthesizer(getClass().getClassLoader());
  }

  @Test
  public void testSynthesizeClass() throws Exception {
    JaninoTypeSynthesizer synthesizer = newSynthesizer();
    Class<?> cls =
        synthesizer.synthesize(
            new CarpenterSchema.ClassSchema(
                "synth.Account",
                ImmutableList.of(
                    CarpenterField.of("id", long.class),
                    CarpenterField.of("owner", String.class),
                    CarpenterField.selfReference("linked")),
                Collections.emptyList()));
    assertEquals(cls.getName(), "synth.Account");
    assertTrue(synthesizer.isSynthesized(cls));
    assertFalse(synthesizer.isSynthesized(String.class));
    assertSame(Class.forName("synth.Account", false, synthesizer.getClassLoader()), cls);
    assertSame(cls.getMethod("getLinked").getReturnType(), cls);
    Constructor<?> constructor = cls.getConstructor(long.class, String.class, cls);
    Object account = constructor.newInstance(3L, "ann", null);
    assertEquals(cls.getMethod("getId").invoke(account), 3L);
    assertEquals(cls.getMethod("getOwner").invoke(account), "ann");
    assertEquals(account.toString(), "Account{id=3, owner=ann, linked=null}");
    assertNotNull(cls.getConstructor().newInstance());
  }

  @Test
  public void testSynthesizeEnumAndInterface() throws Exception {
    JaninoTypeSynthesizer synthesizer = newSynthesizer();
    Class<?> level =
        synthesizer.synthesize(
            new CarpenterSchema.EnumSchema("synth.Level", ImmutableList.of("LOW", "HIGH")));
    assertTrue(level.isEnum());
    assertEquals(((Enum<?>) level.getEnumConstants()[1]).name(), "HIGH");
    Class<?> leveled =
        synthesizer.synthesize(
            new CarpenterSchema.InterfaceSchema(
                "synth.Leveled",
                ImmutableList.of(CarpenterField.of("level", level)),
                Collections.emptyList()));
    assertTrue(leveled.isInterface());
    Method getter = leveled.getMethod("getLevel");
    assertSame(getter.getReturnType(), level);
    Class<?> alarm =
        synthesizer.synthesize(
            new CarpenterSchema.ClassSchema(
                "synth.Alarm",
                ImmutableList.of(CarpenterField.of("level", level)),
                ImmutableList.of(leveled)));
    assertTrue(leveled.isAssignableFrom(alarm));
  }

  @Test
  public void testDuplicateName() {
    JaninoTypeSynthesizer synthesizer = newSynthesizer();
    CarpenterSchema schema =
        new CarpenterSchema.ClassSchema(
            "synth.Twice", ImmutableList.of(CarpenterField.of("a", int.class)), ImmutableList.of());
    synthesizer.synthesize(schema);
    assertThrows(DuplicateNameException.class, () -> synthesizer.synthesize(schema));
    assertThrows(
        DuplicateNameException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    TestUtils.class.getName(), ImmutableList.of(), ImmutableList.of())));
  }

  @Test
  public void testInterfaceMismatch() {
    JaninoTypeSynthesizer synthesizer = newSynthesizer();
    Class<?> named =
        synthesizer.synthesize(
            new CarpenterSchema.InterfaceSchema(
                "synth.Named",
                ImmutableList.of(CarpenterField.of("name", String.class)),
                ImmutableList.of()));
    assertThrows(
        InterfaceMismatchException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    "synth.Nameless",
                    ImmutableList.of(CarpenterField.of("id", int.class)),
                    ImmutableList.of(named))));
    assertThrows(
        InterfaceMismatchException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    "synth.Numbered",
                    ImmutableList.of(CarpenterField.of("name", int.class)),
                    ImmutableList.of(named))));
    assertThrows(
        InterfaceMismatchException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    "synth.NotAnInterface",
                    ImmutableList.of(CarpenterField.of("name", String.class)),
                    ImmutableList.of(String.class))));
  }

  @Test
  public void testInvalidNames() {
    JaninoTypeSynthesizer synthesizer = newSynthesizer();
    assertThrows(
        UncarpentableException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    "synth.Bad-Name", ImmutableList.of(), ImmutableList.of())));
    assertThrows(
        UncarpentableException.class,
        () ->
            synthesizer.synthesize(
                new CarpenterSchema.ClassSchema(
                    "synth.BadField",
                    ImmutableList.of(CarpenterField.of("class", int.class)),
                    ImmutableList.of())));
  }
}
