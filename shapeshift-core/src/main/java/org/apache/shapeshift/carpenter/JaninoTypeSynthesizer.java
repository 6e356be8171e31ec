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

import com.google.common.base.Preconditions;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.ThreadSafe;
import javax.lang.model.SourceVersion;
import org.apache.shapeshift.reflect.ReflectionUtils;
import org.codehaus.commons.compiler.CompileException;
import org.codehaus.janino.SimpleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes types by generating java source and compiling it with Janino. Every compilation uses
 * the loader of the previous one as parent, so a synthesized type can refer to any type synthesized
 * before it. Synthesis is serialized on this instance.
 *
 * <p>Synthesized classes have a private field, a getter and an all-args constructor parameter per
 * property, plus a no-arg constructor. Java generics are not reproduced.
 */
@ThreadSafe
public class JaninoTypeSynthesizer implements TypeSynthesizer {
  private static final Logger LOG = LoggerFactory.getLogger(JaninoTypeSynthesizer.class);

  private volatile ClassLoader classLoader;
  private final Map<String, Class<?>> synthesizedTypes = new ConcurrentHashMap<>();
  private final Set<Class<?>> synthesizedClasses = ConcurrentHashMap.newKeySet();

  public JaninoTypeSynthesizer(ClassLoader parentClassLoader) {
    this.classLoader = Preconditions.checkNotNull(parentClassLoader);
  }

  @Override
  public ClassLoader getClassLoader() {
    return classLoader;
  }

  @Override
  public boolean isSynthesized(Class<?> cls) {
    return synthesizedClasses.contains(cls);
  }

  @Override
  public synchronized Class<?> synthesize(CarpenterSchema schema) {
    validate(schema);
    String source = generateSource(schema);
    LOG.trace("Compiling {}:\n{}", schema.getName(), source);
    SimpleCompiler compiler = new SimpleCompiler();
    compiler.setParentClassLoader(classLoader);
    try {
      compiler.cook(source);
    } catch (CompileException e) {
      throw new UncarpentableException("Failed to compile " + schema.getName(), e);
    }
    ClassLoader loader = compiler.getClassLoader();
    Class<?> cls;
    try {
      cls = loader.loadClass(schema.getName());
    } catch (ClassNotFoundException e) {
      throw new UncarpentableException(
          "Compiled class " + schema.getName() + " can't be loaded", e);
    }
    classLoader = loader;
    synthesizedTypes.put(schema.getName(), cls);
    synthesizedClasses.add(cls);
    LOG.debug("Synthesized {}", schema);
    return cls;
  }

  private void validate(CarpenterSchema schema) {
    String name = schema.getName();
    for (String part : name.split("\\.", -1)) {
      if (!isJavaName(part)) {
        throw new UncarpentableException("Invalid class name " + name);
      }
    }
    if (synthesizedTypes.containsKey(name)) {
      throw new DuplicateNameException("Type " + name + " was already synthesized");
    }
    try {
      Class.forName(name, false, classLoader);
      throw new DuplicateNameException("Class " + name + " already exists");
    } catch (ClassNotFoundException e) {
      // Expected, the name is free.
      LOG.trace("Name {} is free", name);
    }
    for (CarpenterField field : schema.getFields().values()) {
      if (!isJavaName(field.getName())) {
        throw new UncarpentableException(
            "Invalid property name " + field.getName() + " in " + name);
      }
    }
    if (schema instanceof CarpenterSchema.ClassSchema) {
      validateInterfaces(schema);
    }
    for (Class<?> anInterface : schema.getInterfaces()) {
      if (!anInterface.isInterface()) {
        throw new InterfaceMismatchException(anInterface.getName() + " is not an interface");
      }
    }
  }

  /** Every abstract method of the declared interfaces must be a getter a field implements. */
  private void validateInterfaces(CarpenterSchema schema) {
    Map<String, Class<?>> requiredProperties = new HashMap<>();
    for (Class<?> anInterface : schema.getInterfaces()) {
      for (Method method : anInterface.getMethods()) {
        if (method.isDefault() || Modifier.isStatic(method.getModifiers())) {
          continue;
        }
        String property = ReflectionUtils.getterPropertyName(method);
        if (property == null) {
          throw new InterfaceMismatchException(
              "Can't implement "
                  + method
                  + " of "
                  + anInterface.getName()
                  + " in "
                  + schema.getName()
                  + ", only getters are supported");
        }
        Class<?> previous = requiredProperties.putIfAbsent(property, method.getReturnType());
        if (previous != null && previous != method.getReturnType()) {
          throw new InterfaceMismatchException(
              "Interfaces of "
                  + schema.getName()
                  + " declare property "
                  + property
                  + " as both "
                  + previous.getName()
                  + " and "
                  + method.getReturnType().getName());
        }
      }
    }
    for (Map.Entry<String, Class<?>> entry : requiredProperties.entrySet()) {
      CarpenterField field = schema.getFields().get(entry.getKey());
      if (field == null) {
        throw new InterfaceMismatchException(
            "Interface requires property " + entry.getKey() + " missing from " + schema.getName());
      }
      if (!field.isSelfReference() && field.getType() != entry.getValue()) {
        throw new InterfaceMismatchException(
            "Property "
                + entry.getKey()
                + " of "
                + schema.getName()
                + " is "
                + field.getType().getName()
                + " but an interface requires "
                + entry.getValue().getName());
      }
    }
  }

  private static boolean isJavaName(String name) {
    return SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
  }

  private String generateSource(CarpenterSchema schema) {
    StringBuilder source = new StringBuilder();
    if (!schema.getPackageName().isEmpty()) {
      source.append("package ").append(schema.getPackageName()).append(";\n\n");
    }
    if (schema instanceof CarpenterSchema.EnumSchema) {
      source.append("public enum ").append(schema.getSimpleName()).append(" {\n  ");
      source.append(String.join(",\n  ", ((CarpenterSchema.EnumSchema) schema).getConstants()));
      return source.append("\n}\n").toString();
    }
    boolean isInterface = schema instanceof CarpenterSchema.InterfaceSchema;
    source.append(isInterface ? "public interface " : "public class ");
    source.append(schema.getSimpleName());
    if (!schema.getInterfaces().isEmpty()) {
      StringJoiner interfaces =
          new StringJoiner(", ", isInterface ? " extends " : " implements ", "");
      schema.getInterfaces().forEach(i -> interfaces.add(sourceName(i)));
      source.append(interfaces);
    }
    source.append(" {\n");
    if (isInterface) {
      for (CarpenterField field : schema.getFields().values()) {
        source.append("  ").append(typeName(schema, field)).append(' ');
        source.append(getterName(field)).append("();\n");
      }
      return source.append("}\n").toString();
    }
    for (CarpenterField field : schema.getFields().values()) {
      source.append("  private ").append(typeName(schema, field)).append(' ');
      source.append(field.getName()).append(";\n");
    }
    source.append("\n  public ").append(schema.getSimpleName()).append("() {}\n");
    if (!schema.getFields().isEmpty()) {
      List<String> parameters = new ArrayList<>();
      for (CarpenterField field : schema.getFields().values()) {
        parameters.add(typeName(schema, field) + " " + field.getName());
      }
      source.append("\n  public ").append(schema.getSimpleName()).append('(');
      source.append(String.join(", ", parameters)).append(") {\n");
      for (CarpenterField field : schema.getFields().values()) {
        source.append("    this.").append(field.getName()).append(" = ");
        source.append(field.getName()).append(";\n");
      }
      source.append("  }\n");
    }
    for (CarpenterField field : schema.getFields().values()) {
      source.append("\n  public ").append(typeName(schema, field)).append(' ');
      source.append(getterName(field)).append("() {\n");
      source.append("    return this.").append(field.getName()).append(";\n  }\n");
    }
    source.append("\n  public String toString() {\n    return \"").append(schema.getSimpleName());
    source.append("{\"");
    String separator = "";
    for (CarpenterField field : schema.getFields().values()) {
      source.append(" + \"").append(separator).append(field.getName()).append("=\" + this.");
      source.append(field.getName());
      separator = ", ";
    }
    source.append(" + \"}\";\n  }\n");
    return source.append("}\n").toString();
  }

  private static String typeName(CarpenterSchema schema, CarpenterField field) {
    return field.isSelfReference() ? schema.getSimpleName() : sourceName(field.getType());
  }

  private static String sourceName(Class<?> type) {
    if (type.isArray()) {
      return sourceName(type.getComponentType()) + "[]";
    }
    String canonicalName = type.getCanonicalName();
    return canonicalName != null ? canonicalName : type.getName();
  }

  private static String getterName(CarpenterField field) {
    String name = field.getName();
    return "get" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
