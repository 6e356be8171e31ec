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

package org.apache.shapeshift.serializer.struct;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;

import com.google.common.reflect.TypeToken;
import java.math.BigDecimal;
import java.util.List;
import org.apache.shapeshift.ShapeshiftTestBase;
import org.apache.shapeshift.TestUtils;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.testng.annotations.Test;

public class SerializerFingerPrinterTest extends ShapeshiftTestBase {

  private static FingerPrinter fingerPrinter() {
    return newShapeshift().getSerializerFactory().getFingerPrinter();
  }

  private static Class<?> compile(String code) {
    return TestUtils.compileClass("demo.fp", "Bean", code);
  }

  @Test
  public void testStableAcrossLoaders() {
    String code = "public class Bean { public int a; public String b; }";
    Class<?> v1 = compile(code);
    Class<?> v2 = compile(code);
    assertNotEquals(v1, v2);
    assertEquals(fingerPrinter().fingerprint(v1), fingerPrinter().fingerprint(v2));
  }

  @Test
  public void testDeclarationOrderDoesNotMatter() {
    Class<?> v1 = compile("public class Bean { public int a; public String b; }");
    Class<?> v2 = compile("public class Bean { public String b; public int a; }");
    assertEquals(fingerPrinter().fingerprint(v1), fingerPrinter().fingerprint(v2));
  }

  @Test
  public void testShapeChangesFingerprint() {
    FingerPrinter fingerPrinter = fingerPrinter();
    String base = fingerPrinter.fingerprint(compile("public class Bean { public int a; }"));
    assertNotEquals(
        fingerPrinter.fingerprint(compile("public class Bean { public int a; public int c; }")),
        base);
    assertNotEquals(
        fingerPrinter.fingerprint(compile("public class Bean { public long a; }")), base);
    assertNotEquals(
        fingerPrinter.fingerprint(compile("public class Bean { public Integer a; }")), base);
    assertNotEquals(
        fingerPrinter.fingerprint(compile("public class Bean { public int b; }")), base);
  }

  @Test
  public void testEnumConstantsChangeFingerprint() {
    FingerPrinter fingerPrinter = fingerPrinter();
    Class<?> v1 = TestUtils.compileClass("demo.fp", "Color", "public enum Color { RED, GREEN }");
    Class<?> v2 = TestUtils.compileClass("demo.fp", "Color", "public enum Color { RED, GREEN }");
    Class<?> v3 =
        TestUtils.compileClass("demo.fp", "Color", "public enum Color { RED, GREEN, BLUE }");
    assertEquals(fingerPrinter.fingerprint(v1), fingerPrinter.fingerprint(v2));
    assertNotEquals(fingerPrinter.fingerprint(v1), fingerPrinter.fingerprint(v3));
  }

  @Test
  public void testSelfReferenceTerminates() {
    Class<?> node = compile("public class Bean { public int value; public Bean next; }");
    String fingerprint = fingerPrinter().fingerprint(node);
    assertEquals(fingerPrinter().fingerprint(node), fingerprint);
  }

  @Test
  public void testTypeArgumentsChangeFingerprint() {
    FingerPrinter fingerPrinter = fingerPrinter();
    assertNotEquals(
        fingerPrinter.fingerprint(new TypeToken<List<String>>() {}.getType()),
        fingerPrinter.fingerprint(new TypeToken<List<Integer>>() {}.getType()));
  }

  @Test
  public void testCustomSerializedTypeUsesSerializerDescriptor() {
    SerializerFactory factory = newShapeshift().getSerializerFactory();
    Serializer<?> serializer = factory.findCustomSerializer(BigDecimal.class, BigDecimal.class);
    String descriptor = serializer.getTypeDescriptor().toString();
    assertEquals(
        SerializerFactory.DESCRIPTOR_DOMAIN
            + ":"
            + factory.getFingerPrinter().fingerprint(BigDecimal.class),
        descriptor);
  }
}
