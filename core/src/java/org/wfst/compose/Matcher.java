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

import org.wfst.fst.Fst;
import org.wfst.fst.Labels;
import org.wfst.fst.Tr;
import org.wfst.semiring.Semiring;

/**
 * Matchers find and iterate through the transitions leaving a state
 * that carry a requested label.  In the simplest form they are a search
 * over the transitions of the state, keyed on the input or output label
 * ({@link #matchType}).  A matcher is bound to one FST when it is
 * created and only keeps iteration cursors as mutable state.
 *
 * <p>Querying {@link Labels#EPS_LABEL} first yields {@link
 * MatcherItem#epsLoop()}, a virtual self-loop that stands for "this side
 * stays put", then the stored epsilon transitions.  Querying {@link
 * Labels#NO_LABEL} yields the stored epsilon transitions only.
 *
 * @lucene.experimental
 */
public interface Matcher<W> {

  /** Returned by {@link #priority} when this matcher must drive matching. */
  int REQUIRE_PRIORITY = Integer.MAX_VALUE;

  /** The FST this matcher searches. */
  Fst<W> fst();

  /** Starts a new, single-use iteration over the matches of {@code label} at {@code state}. */
  MatcherIterator<W> iter(int state, int label);

  /** Returns the final weight of {@code state}, or null if it is not accepting. */
  W finalWeight(int state);

  /**
   * Returns the side this matcher compares.  When {@code test} is true
   * the FST is inspected if needed to establish that the matcher can
   * work on it, otherwise only already known properties are used; in
   * both cases {@link MatchType#MATCH_NONE} means it cannot, and {@link
   * MatchType#MATCH_UNKNOWN} means it is not known.
   */
  MatchType matchType(boolean test);

  MatcherFlags flags();

  /**
   * Indicates preference for being the side used for matching in
   * composition; lower is preferred.  {@link #REQUIRE_PRIORITY} means it
   * is mandatory.  Calling this method loads {@code state} into the
   * matcher, replacing whatever state it was positioned on, so only call
   * it when the answer is going to be used.
   */
  int priority(int state);

  /**
   * Materializes the epsilon self-loop at {@code state} for a matcher of
   * the given type: the matched side reads epsilon and the other side
   * carries {@link Labels#NO_LABEL}.
   *
   * @throws IllegalArgumentException unless {@code matchType} is {@link
   *         MatchType#MATCH_INPUT} or {@link MatchType#MATCH_OUTPUT}
   */
  static <W> Tr<W> epsLoop(int state, MatchType matchType, Semiring<W> semiring) {
    switch (matchType) {
      case MATCH_INPUT:
        return new Tr<>(Labels.NO_LABEL, Labels.EPS_LABEL, semiring.one(), state);
      case MATCH_OUTPUT:
        return new Tr<>(Labels.EPS_LABEL, Labels.NO_LABEL, semiring.one(), state);
      default:
        throw new IllegalArgumentException("unsupported match type for epsilon loop: " + matchType);
    }
  }
}
