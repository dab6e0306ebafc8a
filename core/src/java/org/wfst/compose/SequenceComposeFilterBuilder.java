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

import java.util.Objects;

import org.wfst.fst.Fst;

/**
 * Builds {@link SequenceComposeFilter}s.  Unless given, the matchers are
 * {@link SortedMatcher}s: on the output labels of the first operand and
 * on the input labels of the second, since composition connects the
 * first operand's output alphabet to the second's input alphabet.
 *
 * @lucene.experimental
 */
public class SequenceComposeFilterBuilder<W> implements ComposeFilterBuilder<W, IntegerFilterState, SequenceComposeFilter<W>> {

  private final SharedDataComposeFilter<W> sharedData;

  public SequenceComposeFilterBuilder(Fst<W> fst1, Fst<W> fst2) {
    this(fst1, fst2, null, null);
  }

  /**
   * @param matcher1 matcher over {@code fst1}, or null for the default
   * @param matcher2 matcher over {@code fst2}, or null for the default
   * @throws IllegalArgumentException if a given matcher is not bound to
   *         its operand
   */
  public SequenceComposeFilterBuilder(Fst<W> fst1, Fst<W> fst2, Matcher<W> matcher1, Matcher<W> matcher2) {
    Objects.requireNonNull(fst1, "fst1");
    Objects.requireNonNull(fst2, "fst2");
    if (matcher1 == null) {
      matcher1 = new SortedMatcher<>(fst1, MatchType.MATCH_OUTPUT);
    } else if (matcher1.fst() != fst1) {
      throw new IllegalArgumentException("matcher1 must match on fst1");
    }
    if (matcher2 == null) {
      matcher2 = new SortedMatcher<>(fst2, MatchType.MATCH_INPUT);
    } else if (matcher2.fst() != fst2) {
      throw new IllegalArgumentException("matcher2 must match on fst2");
    }
    this.sharedData = new SharedDataComposeFilter<>(matcher1, matcher2);
  }

  @Override
  public SharedDataComposeFilter<W> getSharedData() {
    return sharedData;
  }

  @Override
  public SequenceComposeFilter<W> build() {
    return new SequenceComposeFilter<>(sharedData);
  }
}
