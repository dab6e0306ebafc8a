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
 * Real-valued sum-product semiring over floats.  Not idempotent, so
 * {@link #naturalLess} is not a total order here.
 *
 * @lucene.experimental
 */
public final class ProbabilitySemiring extends Semiring<Float> {

  private final static Float ZERO = 0f;
  private final static Float ONE = 1f;

  private final static ProbabilitySemiring singleton = new ProbabilitySemiring();

  private ProbabilitySemiring() {
  }

  public static ProbabilitySemiring getSingleton() {
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
    return a * b;
  }

  @Override
  public Float plus(Float a, Float b) {
    return a + b;
  }

  @Override
  public String toString() {
    return "ProbabilitySemiring";
  }
}
