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

import java.util.List;

import org.wfst.fst.Fst;
import org.wfst.fst.Labels;
import org.wfst.fst.Tr;

/**
 * {@link Matcher} without any ordering requirement: every query scans all
 * transitions of the state.  Use it on small or unsorted FSTs.
 *
 * @lucene.experimental
 */
public class LinearMatcher<W> implements Matcher<W> {

  private final Fst<W> fst;
  private final MatchType matchType;

  /**
   * @throws IllegalArgumentException unless {@code matchType} is {@link
   *         MatchType#MATCH_INPUT} or {@link MatchType#MATCH_OUTPUT}
   */
  public LinearMatcher(Fst<W> fst, MatchType matchType) {
    if (matchType != MatchType.MATCH_INPUT && matchType != MatchType.MATCH_OUTPUT) {
      throw new IllegalArgumentException("LinearMatcher cannot match with " + matchType);
    }
    this.fst = fst;
    this.matchType = matchType;
  }

  @Override
  public Fst<W> fst() {
    return fst;
  }

  @Override
  public MatcherIterator<W> iter(int state, int label) {
    final List<Tr<W>> trs = fst.getTrs(state);
    final int matchLabel = label == Labels.NO_LABEL ? Labels.EPS_LABEL : label;
    final boolean input = matchType == MatchType.MATCH_INPUT;
    return new MatcherIterator<W>() {
      boolean loop = label == Labels.EPS_LABEL;
      int pos;

      @Override
      public MatcherItem<W> next() {
        if (loop) {
          loop = false;
          return MatcherItem.epsLoop();
        }
        while (pos < trs.size()) {
          Tr<W> tr = trs.get(pos++);
          if ((input ? tr.ilabel : tr.olabel) == matchLabel) {
            return MatcherItem.of(tr);
          }
        }
        return null;
      }
    };
  }

  @Override
  public W finalWeight(int state) {
    return fst.finalWeight(state);
  }

  @Override
  public MatchType matchType(boolean test) {
    return matchType;
  }

  @Override
  public MatcherFlags flags() {
    return MatcherFlags.EMPTY;
  }

  @Override
  public int priority(int state) {
    return fst.numTrs(state);
  }

  @Override
  public String toString() {
    return "LinearMatcher(" + matchType + ")";
  }
}
