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
package org.wfst.compose;

/**
 * Capability bits a {@link Matcher} advertises.  Lookahead compose
 * filters and optimizers test the composite groups ({@link
 * #LOOKAHEAD_FLAGS}, {@link #ILABEL_LOOKAHEAD_FLAGS}, {@link
 * #OLABEL_LOOKAHEAD_FLAGS}), so a matcher must report every bit of the
 * group it supports.
 *
 * @lucene.experimental
 */
public final class MatcherFlags {

  /** The matcher must be the side that drives matching. */
  public static final MatcherFlags REQUIRE_MATCH = new MatcherFlags(1);
  public static final MatcherFlags INPUT_LOOKAHEAD_MATCHER = new MatcherFlags(1 << 4);
  public static final MatcherFlags OUTPUT_LOOKAHEAD_MATCHER = new MatcherFlags(1 << 5);
  public static final MatcherFlags LOOKAHEAD_WEIGHT = new MatcherFlags(1 << 6);
  public static final MatcherFlags LOOKAHEAD_PREFIX = new MatcherFlags(1 << 7);
  public static final MatcherFlags LOOKAHEAD_NON_EPSILONS = new MatcherFlags(1 << 8);
  public static final MatcherFlags LOOKAHEAD_EPSILONS = new MatcherFlags(1 << 9);
  public static final MatcherFlags LOOKAHEAD_NON_EPSILON_PREFIX = new MatcherFlags(1 << 10);

  public static final MatcherFlags EMPTY = new MatcherFlags(0);

  /** Every lookahead capability. */
  public static final MatcherFlags LOOKAHEAD_FLAGS = INPUT_LOOKAHEAD_MATCHER
      .union(OUTPUT_LOOKAHEAD_MATCHER)
      .union(LOOKAHEAD_WEIGHT)
      .union(LOOKAHEAD_PREFIX)
      .union(LOOKAHEAD_NON_EPSILONS)
      .union(LOOKAHEAD_EPSILONS)
      .union(LOOKAHEAD_NON_EPSILON_PREFIX);

  /** Lookahead on input labels. */
  public static final MatcherFlags ILABEL_LOOKAHEAD_FLAGS = INPUT_LOOKAHEAD_MATCHER
      .union(LOOKAHEAD_WEIGHT)
      .union(LOOKAHEAD_PREFIX)
      .union(LOOKAHEAD_EPSILONS)
      .union(LOOKAHEAD_NON_EPSILON_PREFIX);

  /** Lookahead on output labels. */
  public static final MatcherFlags OLABEL_LOOKAHEAD_FLAGS = OUTPUT_LOOKAHEAD_MATCHER
      .union(LOOKAHEAD_WEIGHT)
      .union(LOOKAHEAD_PREFIX)
      .union(LOOKAHEAD_EPSILONS)
      .union(LOOKAHEAD_NON_EPSILON_PREFIX);

  private final int bits;

  private MatcherFlags(int bits) {
    this.bits = bits;
  }

  public static MatcherFlags fromBits(int bits) {
    return bits == 0 ? EMPTY : new MatcherFlags(bits);
  }

  public int bits() {
    return bits;
  }

  public MatcherFlags union(MatcherFlags other) {
    return new MatcherFlags(bits | other.bits);
  }

  /** Returns true if every flag of {@code other} is set here. */
  public boolean contains(MatcherFlags other) {
    return (bits & other.bits) == other.bits;
  }

  /** Returns true if at least one flag of {@code other} is set here. */
  public boolean intersects(MatcherFlags other) {
    return (bits & other.bits) != 0;
  }

  public boolean isEmpty() {
    return bits == 0;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MatcherFlags && ((MatcherFlags) other).bits == bits;
  }

  @Override
  public int hashCode() {
    return bits;
  }

  @Override
  public String toString() {
    return "MatcherFlags(0x" + Integer.toHexString(bits) + ")";
  }
}
