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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Currency;
import org.apache.shapeshift.serializer.SerializerFactory;

/** Custom serializers for JDK value types written in their string form. */
public class JavaSerializers {

  public static final class BigDecimalSerializer extends CustomSerializer.ToString<BigDecimal> {
    public BigDecimalSerializer(SerializerFactory factory) {
      super(BigDecimal.class, false, BigDecimal::new, BigDecimal::toString, factory);
    }
  }

  public static final class BigIntegerSerializer extends CustomSerializer.ToString<BigInteger> {
    public BigIntegerSerializer(SerializerFactory factory) {
      super(BigInteger.class, false, BigInteger::new, BigInteger::toString, factory);
    }
  }

  public static final class CurrencySerializer extends CustomSerializer.ToString<Currency> {
    public CurrencySerializer(SerializerFactory factory) {
      super(Currency.class, false, Currency::getInstance, Currency::getCurrencyCode, factory);
    }
  }
}
