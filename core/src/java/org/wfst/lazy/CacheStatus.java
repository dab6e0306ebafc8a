/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.wfst.lazy;

import java.util.Objects;

/**
 * Either "not computed yet" or "computed" with a value.  The value of a
 * computed status may be null where the cached quantity is optional
 * (for example the final weight of a non-accepting state).
 *
 * @lucene.experimental
 */
public final class CacheStatus<T> {

  @SuppressWarnings("rawtypes")
  private static final CacheStatus NOT_COMPUTED = new CacheStatus<>(false, null);

  private final boolean computed;
  private final T value;

  private CacheStatus(boolean computed, T value) {
    this.computed = computed;
    this.value = value;
  }

  @SuppressWarnings("unchecked")
  public static <T> CacheStatus<T> notComputed() {
    return NOT_COMPUTED;
  }

  public static <T> CacheStatus<T> computed(T value) {
    return new CacheStatus<>(true, value);
  }

  public boolean isComputed() {
    return computed;
  }

  /**
   * Returns the computed value.
   *
   * @throws IllegalStateException if nothing was computed
   */
  public T value() {
    if (computed == false) {
      throw new IllegalStateException("value was not computed yet");
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof CacheStatus == false) {
      return false;
    }
    CacheStatus<?> that = (CacheStatus<?>) other;
    return computed == that.computed && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return computed ? 31 + Objects.hashCode(value) : 0;
  }

  @Override
  public String toString() {
    return computed ? "Computed(" + value + ")" : "NotComputed";
  }
}
