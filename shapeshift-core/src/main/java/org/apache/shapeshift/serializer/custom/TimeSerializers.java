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

import java.time.Instant;
import java.time.LocalDate;
import org.apache.shapeshift.serializer.SerializerFactory;

/** Custom serializers for {@code java.time} types, written through proxies of their fields. */
public class TimeSerializers {

  public static final class InstantSerializer
      extends CustomSerializer.Proxy<Instant, InstantSerializer.InstantProxy> {
    public InstantSerializer(SerializerFactory factory) {
      super(Instant.class, InstantProxy.class, factory);
    }

    @Override
    protected InstantProxy toProxy(Instant obj) {
      return new InstantProxy(obj.getEpochSecond(), obj.getNano());
    }

    @Override
    protected Instant fromProxy(InstantProxy proxy) {
      return Instant.ofEpochSecond(proxy.epochSeconds, proxy.nanos);
    }

    public static final class InstantProxy {
      private long epochSeconds;
      private int nanos;

      private InstantProxy() {}

      public InstantProxy(long epochSeconds, int nanos) {
        this.epochSeconds = epochSeconds;
        this.nanos = nanos;
      }
    }
  }

  public static final class LocalDateSerializer
      extends CustomSerializer.Proxy<LocalDate, LocalDateSerializer.LocalDateProxy> {
    public LocalDateSerializer(SerializerFactory factory) {
      super(LocalDate.class, LocalDateProxy.class, factory);
    }

    @Override
    protected LocalDateProxy toProxy(LocalDate obj) {
      return new LocalDateProxy(
          obj.getYear(), (byte) obj.getMonthValue(), (byte) obj.getDayOfMonth());
    }

    @Override
    protected LocalDate fromProxy(LocalDateProxy proxy) {
      return LocalDate.of(proxy.year, proxy.month, proxy.day);
    }

    public static final class LocalDateProxy {
      private int year;
      private byte month;
      private byte day;

      private LocalDateProxy() {}

      public LocalDateProxy(int year, byte month, byte day) {
        this.year = year;
        this.month = month;
        this.day = day;
      }
    }
  }
}
