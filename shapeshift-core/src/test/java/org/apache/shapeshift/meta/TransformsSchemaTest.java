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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.google.common.collect.ImmutableList;
import java.nio.ByteBuffer;
import java.util.List;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.Shapeshift;
import org.apache.shapeshift.ShapeshiftTestBase;
import org.apache.shapeshift.annotation.ShapeshiftEnumDefault;
import org.apache.shapeshift.annotation.ShapeshiftRename;
import org.apache.shapeshift.exception.TypeNotSerializableException;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.evolution.Shade;
import org.testng.annotations.Test;

public class TransformsSchemaTest extends ShapeshiftTestBase {

  @ShapeshiftRename(to = "C", from = "B")
  @ShapeshiftRename(to = "B", from = "A")
  enum Renamed {
    C,
    D
  }

  @ShapeshiftEnumDefault(newName = "B", oldName = "C")
  enum UnknownDefault {
    A,
    B
  }

  @ShapeshiftRename(to = "B", from = "A")
  enum StillDeclared {
    A,
    B
  }

  @ShapeshiftRename(to = "Y", from = "X")
  @ShapeshiftRename(to = "X", from = "Y")
  enum RenameCycle {
    A
  }

  @Test
  public void testEnumTransforms() {
    assertEquals(
        TransformsSchema.enumTransforms(Shade.class),
        ImmutableList.of(
            new EnumDefaultTransform("BRIGHT", "LIGHT"), new RenameTransform("DARK", "SHADOW")));
    assertEquals(
        TransformsSchema.enumTransforms(Renamed.class),
        ImmutableList.of(new RenameTransform("B", "C"), new RenameTransform("A", "B")));
    assertTrue(TransformsSchema.enumTransforms(Thread.State.class).isEmpty());
  }

  @Test
  public void testInvalidEnumTransforms() {
    expectThrows(
        TypeNotSerializableException.class,
        () -> TransformsSchema.enumTransforms(UnknownDefault.class));
    expectThrows(
        TypeNotSerializableException.class,
        () -> TransformsSchema.enumTransforms(StillDeclared.class));
    expectThrows(
        TypeNotSerializableException.class,
        () -> TransformsSchema.enumTransforms(RenameCycle.class));
  }

  @Test
  public void testEnvelopeCarriesTransforms() {
    Shapeshift shapeshift = newShapeshift();
    Envelope envelope = DeserializationInput.readEnvelope(shapeshift.serialize(Shade.BRIGHT));
    List<Transform> transforms = envelope.getTransforms().forType(Shade.class.getName());
    assertEquals(transforms, TransformsSchema.enumTransforms(Shade.class));
    assertEquals(envelope.getSchema().getTransforms().getTypes().keySet().size(), 1);
    assertTrue(
        DeserializationInput.readEnvelope(shapeshift.serialize("plain")).getTransforms().isEmpty());
  }

  @Test
  public void testEnvelopeWithoutTransforms() {
    Data data = Data.Factory.create();
    data.putDescribed();
    data.enter();
    data.putUnsignedLong(AmqpDescriptorRegistry.ENVELOPE.getAmqpDescriptor());
    data.putList();
    data.enter();
    data.putString("plain");
    data.putObject(new Schema(ImmutableList.of()));
    data.exit();
    data.exit();
    ByteBuffer buffer = ByteBuffer.allocate(Envelope.MAGIC.length + (int) data.encodedSize());
    buffer.put(Envelope.MAGIC);
    data.encode(buffer);
    byte[] bytes = buffer.array();
    assertTrue(DeserializationInput.readEnvelope(bytes).getTransforms().isEmpty());
    assertEquals(newShapeshift().deserialize(bytes, String.class), "plain");
  }
}
