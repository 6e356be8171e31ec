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

package org.apache.shapeshift.collection;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import org.apache.shapeshift.exception.ShapeshiftException;

/** A class keyed cache that doesn't keep classes, and so their loaders, reachable. */
public class ClassValueCache<T> {

  private final Cache<Class<?>, T> cache;

  private ClassValueCache(Cache<Class<?>, T> cache) {
    this.cache = cache;
  }

  public T getIfPresent(Class<?> k) {
    return cache.getIfPresent(k);
  }

  /** Get the value for {@code k}, computing it with {@code loader} if absent. */
  public T get(Class<?> k, Callable<? extends T> loader) {
    try {
      return cache.get(k, loader);
    } catch (UncheckedExecutionException e) {
      // Keep the loader's own exception type, e.g. a not serializable error.
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    } catch (ExecutionException e) {
      throw new ShapeshiftException(e.getCause());
    }
  }

  /**
   * Create a cache with weak keys.
   *
   * @param concurrencyLevel the concurrency level
   * @return the cache
   */
  public static <T> ClassValueCache<T> newClassKeyCache(int concurrencyLevel) {
    return new ClassValueCache<>(
        CacheBuilder.newBuilder().weakKeys().concurrencyLevel(concurrencyLevel).build());
  }

  /**
   * Create a cache with weak keys and soft values.
   *
   * @param concurrencyLevel the concurrency level
   * @return the cache
   */
  public static <T> ClassValueCache<T> newClassKeySoftCache(int concurrencyLevel) {
    return new ClassValueCache<>(
        CacheBuilder.newBuilder()
            .weakKeys()
            .softValues()
            .concurrencyLevel(concurrencyLevel)
            .build());
  }
}
