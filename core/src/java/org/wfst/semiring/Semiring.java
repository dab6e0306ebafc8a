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
 * Represents the weight algebra of an FST.  Weights are immutable
 * values of type {@code W}; two weights are the same weight iff they
 * are {@link Object#equals equal}.
 *
 * <p>{@link #times} extends a path by one transition and {@link #plus}
 * combines alternative paths.  Implementations must satisfy the usual
 * semiring laws: both operators are associative, {@link #plus} is
 * commutative, {@link #one} is the identity of {@link #times}, {@link
 * #zero} is the identity of {@link #plus} and annihilates {@link #times}.
 *
 * @lucene.experimental
 */
public abstract class Semiring<W> {

  /** The additive identity; a path carrying this weight does not exist. */
  public abstract W zero();

  /** The multiplicative identity. */
  public abstract W one();

  /** Extends a path of weight {@code a} by a transition of weight {@code b}. */
  public abstract W times(W a, W b);

  /** Combines two alternative paths. */
  public abstract W plus(W a, W b);

  public boolean isZero(W weight) {
    return zero().equals(weight);
  }

  public boolean isOne(W weight) {
    return one().equals(weight);
  }

  /**
   * Natural order of an idempotent semiring: {@code a} is less than
   * {@code b} iff {@code a + b == a} and {@code a != b}.  Shortest-first
   * queue disciplines order states by this relation.
   */
  public boolean naturalLess(W a, W b) {
    return plus(a, b).equals(a) && a.equals(b) == false;
  }

  public String weightToString(W weight) {
    return String.valueOf(weight);
  }
}
