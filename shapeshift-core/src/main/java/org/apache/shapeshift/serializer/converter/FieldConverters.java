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

package org.apache.shapeshift.serializer.converter;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Primitives;
import java.util.Set;

/**
 * Factory of {@link FieldConverter}s between primitive types, their boxed counterparts and
 * strings.
 */
public class FieldConverters {

  /**
   * Creates a converter from values of type {@code from} to {@code to}.
   *
   * @return the converter, or null if no compatible converter exists
   */
  public static FieldConverter<?> getConverter(Class<?> from, Class<?> to) {
    from = Primitives.wrap(from);
    boolean primitive = to.isPrimitive();
    Class<?> boxed = Primitives.wrap(to);
    if (boxed == Integer.class) {
      if (IntConverter.compatibleTypes.contains(from)) {
        return new IntConverter(to, primitive);
      }
    } else if (boxed == Boolean.class) {
      if (BooleanConverter.compatibleTypes.contains(from)) {
        return new BooleanConverter(to, primitive);
      }
    } else if (boxed == Byte.class) {
      if (ByteConverter.compatibleTypes.contains(from)) {
        return new ByteConverter(to, primitive);
      }
    } else if (boxed == Short.class) {
      if (ShortConverter.compatibleTypes.contains(from)) {
        return new ShortConverter(to, primitive);
      }
    } else if (boxed == Long.class) {
      if (LongConverter.compatibleTypes.contains(from)) {
        return new LongConverter(to, primitive);
      }
    } else if (boxed == Float.class) {
      if (FloatConverter.compatibleTypes.contains(from)) {
        return new FloatConverter(to, primitive);
      }
    } else if (boxed == Double.class) {
      if (DoubleConverter.compatibleTypes.contains(from)) {
        return new DoubleConverter(to, primitive);
      }
    } else if (to == String.class) {
      if (StringConverter.compatibleTypes.contains(from)) {
        return new StringConverter();
      }
    }
    return null;
  }

  private static UnsupportedOperationException incompatible(Object from) {
    return new UnsupportedOperationException("Incompatible type: " + from.getClass());
  }

  /** Converts to boolean, or {@code false} for null into a primitive. */
  public static class BooleanConverter extends FieldConverter<Boolean> {
    static final Set<Class<?>> compatibleTypes = ImmutableSet.of(String.class, Boolean.class);
    private final boolean primitive;

    BooleanConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Boolean convert(Object from) {
      if (from == null) {
        return primitive ? Boolean.FALSE : null;
      }
      if (from instanceof Boolean) {
        return (Boolean) from;
      } else if (from instanceof String) {
        return Boolean.parseBoolean((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class ByteConverter extends FieldConverter<Byte> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Integer.class, Long.class, Short.class, Byte.class);
    private final boolean primitive;

    ByteConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Byte convert(Object from) {
      if (from == null) {
        return primitive ? (byte) 0 : null;
      }
      if (from instanceof Byte) {
        return (Byte) from;
      } else if (from instanceof Short || from instanceof Integer || from instanceof Long) {
        long value = ((Number) from).longValue();
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
          throw new ArithmeticException("byte overflow: " + value);
        }
        return (byte) value;
      } else if (from instanceof String) {
        return Byte.parseByte((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class ShortConverter extends FieldConverter<Short> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Byte.class, Integer.class, Long.class, Short.class);
    private final boolean primitive;

    ShortConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Short convert(Object from) {
      if (from == null) {
        return primitive ? (short) 0 : null;
      }
      if (from instanceof Short) {
        return (Short) from;
      } else if (from instanceof Byte || from instanceof Integer || from instanceof Long) {
        long value = ((Number) from).longValue();
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
          throw new ArithmeticException("short overflow: " + value);
        }
        return (short) value;
      } else if (from instanceof String) {
        return Short.parseShort((String) from);
      }
      throw incompatible(from);
    }
  }

  /** Converts to int, narrowing longs only when they fit. */
  public static class IntConverter extends FieldConverter<Integer> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Byte.class, Short.class, Long.class, Integer.class);
    private final boolean primitive;

    IntConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Integer convert(Object from) {
      if (from == null) {
        return primitive ? 0 : null;
      }
      if (from instanceof Long) {
        return Math.toIntExact((Long) from);
      } else if (from instanceof Integer || from instanceof Short || from instanceof Byte) {
        return ((Number) from).intValue();
      } else if (from instanceof String) {
        return Integer.parseInt((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class LongConverter extends FieldConverter<Long> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Byte.class, Short.class, Integer.class, Long.class);
    private final boolean primitive;

    LongConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Long convert(Object from) {
      if (from == null) {
        return primitive ? 0L : null;
      }
      if (from instanceof Long || from instanceof Integer || from instanceof Short
          || from instanceof Byte) {
        return ((Number) from).longValue();
      } else if (from instanceof String) {
        return Long.parseLong((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class FloatConverter extends FieldConverter<Float> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Integer.class, Long.class, Float.class, Double.class);
    private final boolean primitive;

    FloatConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Float convert(Object from) {
      if (from == null) {
        return primitive ? 0f : null;
      }
      if (from instanceof Number) {
        return ((Number) from).floatValue();
      } else if (from instanceof String) {
        return Float.parseFloat((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class DoubleConverter extends FieldConverter<Double> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(String.class, Integer.class, Long.class, Float.class, Double.class);
    private final boolean primitive;

    DoubleConverter(Class<?> targetType, boolean primitive) {
      super(targetType);
      this.primitive = primitive;
    }

    @Override
    public Double convert(Object from) {
      if (from == null) {
        return primitive ? 0d : null;
      }
      if (from instanceof Number) {
        return ((Number) from).doubleValue();
      } else if (from instanceof String) {
        return Double.parseDouble((String) from);
      }
      throw incompatible(from);
    }
  }

  public static class StringConverter extends FieldConverter<String> {
    static final Set<Class<?>> compatibleTypes =
        ImmutableSet.of(
            String.class,
            Boolean.class,
            Byte.class,
            Short.class,
            Integer.class,
            Long.class,
            Float.class,
            Double.class,
            Character.class);

    StringConverter() {
      super(String.class);
    }

    @Override
    public String convert(Object from) {
      return from == null ? null : from.toString();
    }
  }
}
