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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.codec.Data;
import org.apache.shapeshift.exception.DeserializationException;
import org.apache.shapeshift.meta.CompositeType;
import org.apache.shapeshift.meta.Descriptor;
import org.apache.shapeshift.meta.RestrictedType;
import org.apache.shapeshift.meta.Schema;
import org.apache.shapeshift.meta.TypeNotation;
import org.apache.shapeshift.serializer.DeserializationInput;
import org.apache.shapeshift.serializer.ObjectSerializer;
import org.apache.shapeshift.serializer.PropertySerializer;
import org.apache.shapeshift.serializer.SerializationOutput;
import org.apache.shapeshift.serializer.Serializer;
import org.apache.shapeshift.serializer.SerializerFactory;
import org.apache.shapeshift.serializer.SerializerFor;
import org.apache.shapeshift.serializer.struct.SerializerFingerPrinter;
import org.apache.shapeshift.type.TypeUtils;

/**
 * Base class for serializers registered with {@link SerializerFactory#register(CustomSerializer)}.
 * The descriptor of a custom serializer is derived from the name of the class it handles, not from
 * the class's shape, so the class can change as long as the serializer writes the same form.
 */
@SuppressWarnings("unchecked")
public abstract class CustomSerializer<T> extends Serializer<T> implements SerializerFor {

  protected CustomSerializer(SerializerFactory factory, Type type) {
    super(Preconditions.checkNotNull(factory), type);
  }

  /** Serializers this one relies on, registered along with it. */
  public List<CustomSerializer<?>> getAdditionalSerializers() {
    return Collections.emptyList();
  }

  /** The notation describing the form this serializer writes. */
  public abstract TypeNotation getSchemaForDocumentation();

  @Override
  public boolean revealSubclassesInSchema() {
    return false;
  }

  @Override
  public void writeClassInfo(SerializationOutput output) {
    output.writeTypeNotations(getSchemaForDocumentation());
  }

  @Override
  public final void writeObject(
      Object obj, Data data, Type declaredType, SerializationOutput output) {
    data.putDescribed();
    data.enter();
    data.putSymbol(getTypeDescriptor());
    writeDescribedObject((T) obj, data, declaredType, output);
    data.exit();
  }

  /** Write the described part of {@code obj}. */
  protected abstract void writeDescribedObject(
      T obj, Data data, Type declaredType, SerializationOutput output);

  static Symbol descriptorForClass(Class<?> clazz) {
    return SerializerFactory.descriptorFor(
        SerializerFingerPrinter.fingerprintForDescriptors(TypeUtils.nameForType(clazz)));
  }

  /** Handles exactly one class. */
  public abstract static class Is<T> extends CustomSerializer<T> {
    protected final Class<T> clazz;
    private final Symbol typeDescriptor;

    protected Is(Class<T> clazz, SerializerFactory factory) {
      super(factory, clazz);
      this.clazz = clazz;
      this.typeDescriptor = descriptorForClass(clazz);
    }

    @Override
    public boolean isSerializerFor(Class<?> c) {
      return c == clazz;
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }
  }

  /** Handles a class and all its subclasses or implementations. */
  public abstract static class Implements<T> extends CustomSerializer<T> {
    protected final Class<T> clazz;
    private final Symbol typeDescriptor;

    protected Implements(Class<T> clazz, SerializerFactory factory) {
      super(factory, clazz);
      this.clazz = clazz;
      this.typeDescriptor = descriptorForClass(clazz);
    }

    @Override
    public boolean isSerializerFor(Class<?> c) {
      return clazz.isAssignableFrom(c);
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }
  }

  /**
   * Writes a value as a proxy object serialized by its properties. The proxy class needs no
   * whitelisting, it is only ever serialized through this serializer.
   */
  public abstract static class Proxy<T, P> extends CustomSerializer<T> {
    protected final Class<T> clazz;
    protected final Class<P> proxyClass;
    private final boolean withInheritance;
    private final Symbol typeDescriptor;
    // Built lazily, the proxy's fingerprint consults the registered serializers.
    private final Supplier<ObjectSerializer<P>> proxySerializer;

    protected Proxy(
        Class<T> clazz, Class<P> proxyClass, SerializerFactory factory, boolean withInheritance) {
      super(factory, clazz);
      this.clazz = clazz;
      this.proxyClass = proxyClass;
      this.withInheritance = withInheritance;
      this.typeDescriptor = descriptorForClass(clazz);
      this.proxySerializer =
          Suppliers.memoize(() -> new ObjectSerializer<>(proxyClass, this.factory));
    }

    protected Proxy(Class<T> clazz, Class<P> proxyClass, SerializerFactory factory) {
      this(clazz, proxyClass, factory, false);
    }

    protected abstract P toProxy(T obj);

    protected abstract T fromProxy(P proxy);

    @Override
    public boolean isSerializerFor(Class<?> c) {
      return withInheritance ? clazz.isAssignableFrom(c) : c == clazz;
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }

    @Override
    public TypeNotation getSchemaForDocumentation() {
      return new CompositeType(
          TypeUtils.nameForType(clazz),
          null,
          Collections.emptyList(),
          new Descriptor(typeDescriptor),
          proxySerializer.get().getFields());
    }

    @Override
    public void writeClassInfo(SerializationOutput output) {
      if (output.writeTypeNotations(getSchemaForDocumentation())) {
        for (PropertySerializer property : proxySerializer.get().getPropertySerializers()) {
          output.requireSerializer(property.getResolvedType());
        }
      }
    }

    @Override
    protected void writeDescribedObject(
        T obj, Data data, Type declaredType, SerializationOutput output) {
      proxySerializer.get().writeProperties(toProxy(obj), data, output);
    }

    @Override
    public T readObject(Object obj, Schema schema, DeserializationInput input) {
      ObjectSerializer<P> serializer = proxySerializer.get();
      return fromProxy(serializer.construct(serializer.readProperties(obj, schema, input)));
    }
  }

  /** Writes a value as a string, e.g. a number in its canonical decimal form. */
  public static class ToString<T> extends CustomSerializer<T> {
    private final Class<T> clazz;
    private final boolean withInheritance;
    private final Function<String, T> maker;
    private final Function<T, String> unmaker;
    private final Symbol typeDescriptor;
    private final RestrictedType typeNotation;

    public ToString(
        Class<T> clazz,
        boolean withInheritance,
        Function<String, T> maker,
        Function<T, String> unmaker,
        SerializerFactory factory) {
      super(factory, clazz);
      this.clazz = clazz;
      this.withInheritance = withInheritance;
      this.maker = maker;
      this.unmaker = unmaker;
      this.typeDescriptor = descriptorForClass(clazz);
      this.typeNotation =
          new RestrictedType(
              TypeUtils.nameForType(clazz),
              null,
              Collections.emptyList(),
              "string",
              new Descriptor(typeDescriptor),
              Collections.emptyList());
    }

    public ToString(Class<T> clazz, Function<String, T> maker, SerializerFactory factory) {
      this(clazz, false, maker, Object::toString, factory);
    }

    @Override
    public boolean isSerializerFor(Class<?> c) {
      return withInheritance ? clazz.isAssignableFrom(c) : c == clazz;
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }

    @Override
    public TypeNotation getSchemaForDocumentation() {
      return typeNotation;
    }

    @Override
    protected void writeDescribedObject(
        T obj, Data data, Type declaredType, SerializationOutput output) {
      data.putString(unmaker.apply(obj));
    }

    @Override
    public T readObject(Object obj, Schema schema, DeserializationInput input) {
      if (!(obj instanceof String)) {
        throw new DeserializationException("Expected a string for " + clazz + " but got " + obj);
      }
      return maker.apply((String) obj);
    }
  }

  /**
   * Writes a subclass of a type handled by a custom serializer in that serializer's form, but under
   * the subclass's own name. Created by the factory, never registered.
   */
  public static final class SubClass<T> extends CustomSerializer<T> {
    private final Class<?> clazz;
    private final CustomSerializer<T> superClassSerializer;
    private final Symbol typeDescriptor;
    private final RestrictedType typeNotation;

    public SubClass(Class<?> clazz, CustomSerializer<T> superClassSerializer) {
      super(superClassSerializer.getFactory(), clazz);
      this.clazz = clazz;
      this.superClassSerializer = superClassSerializer;
      this.typeDescriptor =
          SerializerFactory.descriptorFor(
              SerializerFingerPrinter.fingerprintForDescriptors(
                  superClassSerializer.getTypeDescriptor().toString(),
                  TypeUtils.nameForType(clazz)));
      this.typeNotation =
          new RestrictedType(
              TypeUtils.nameForType(clazz),
              null,
              Collections.emptyList(),
              TypeUtils.nameForType(superClassSerializer.getType()),
              new Descriptor(typeDescriptor),
              Collections.emptyList());
    }

    @Override
    public boolean isSerializerFor(Class<?> c) {
      return c == clazz;
    }

    @Override
    public Symbol getTypeDescriptor() {
      return typeDescriptor;
    }

    @Override
    public TypeNotation getSchemaForDocumentation() {
      return typeNotation;
    }

    @Override
    public void writeClassInfo(SerializationOutput output) {
      if (output.writeTypeNotations(typeNotation)) {
        superClassSerializer.writeClassInfo(output);
      }
    }

    @Override
    protected void writeDescribedObject(
        T obj, Data data, Type declaredType, SerializationOutput output) {
      superClassSerializer.writeDescribedObject(obj, data, declaredType, output);
    }

    @Override
    public T readObject(Object obj, Schema schema, DeserializationInput input) {
      return superClassSerializer.readObject(obj, schema, input);
    }
  }
}
