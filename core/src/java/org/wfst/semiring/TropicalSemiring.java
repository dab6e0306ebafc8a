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
package org.wfst.semiring;

/**
 * Min-plus semiring over floats: path weights add up and alternatives
 * keep the cheapest.  Typically holds negative log probabilities.
 *
 * @lucene.experimental
 */
public final class TropicalSemiring extends Semiring<Float> {

  private final static Float ZERO = Float.POSITIVE_INFINITY;
  private final static Float ONE = 0f;

  private final static TropicalSemiring singleton = new TropicalSemiring();

  private TropicalSemiring() {
  }

  public static TropicalSemiring getSingleton() {
    return singleton;
  }

  @Override
  public Float zero() {
    return ZERO;
  }

  @Override
  public Float one() {
    return ONE;
  }

  @Override
  public Float times(Float a, Float b) {
    if (a.isInfinite() || b.isInfinite()) {
      return ZERO;
    }
    return a + b;
  }

  @Override
  public Float plus(Float a, Float b) {
    return a <= b ? a : b;
  }

  @Override
  public String toString() {
    return "TropicalSemiring";
  }
}
